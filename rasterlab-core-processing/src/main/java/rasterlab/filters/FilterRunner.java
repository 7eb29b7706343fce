/*-
 * #%L
 * This file is part of RasterLab.
 * %%
 * Copyright (C) 2024 - 2026 RasterLab developers
 * %%
 * RasterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * RasterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with RasterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package rasterlab.filters;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasterlab.lib.common.ThreadTools;
import rasterlab.lib.images.RgbImage;
import rasterlab.lib.tasks.ProgressMonitor;

/**
 * Run {@link ImageFilter ImageFilters} on a background thread, one at a time.
 * <p>
 * Only one filter may be running at any time. Requests made while a filter is running are
 * rejected rather than queued.
 *
 * @author RasterLab developers
 */
public class FilterRunner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(FilterRunner.class);

	private final ExecutorService pool;
	private final AtomicBoolean busy = new AtomicBoolean(false);

	/**
	 * Create a runner with its own daemon thread.
	 */
	public FilterRunner() {
		this.pool = Executors.newSingleThreadExecutor(ThreadTools.createThreadFactory("filter-runner-", true));
	}

	/**
	 * Query whether a filter is currently running.
	 * @return
	 */
	public boolean isBusy() {
		return busy.get();
	}

	/**
	 * Apply a filter asynchronously.
	 * <p>
	 * If the filter throws an exception, the returned future completes exceptionally.
	 *
	 * @param filter the filter to apply
	 * @param source the input image; this should not be modified until the filter completes
	 * @param monitor progress monitor, or null if progress should not be reported
	 * @return a future that completes with the result of the filter
	 * @throws RejectedExecutionException if a filter is already running, or the runner has been closed
	 */
	public CompletableFuture<FilterResult> submit(ImageFilter filter, RgbImage source, ProgressMonitor monitor) throws RejectedExecutionException {
		Objects.requireNonNull(filter, "Filter must not be null!");
		Objects.requireNonNull(source, "Source image must not be null!");
		var progress = monitor == null ? ProgressMonitor.NONE : monitor;
		acquire(filter);
		try {
			return CompletableFuture.supplyAsync(() -> apply(filter, source, progress), pool);
		} catch (RejectedExecutionException e) {
			busy.set(false);
			throw e;
		}
	}

	/**
	 * Apply a filter on the calling thread.
	 *
	 * @param filter the filter to apply
	 * @param source the input image
	 * @param monitor progress monitor, or null if progress should not be reported
	 * @return the result of the filter
	 * @throws RejectedExecutionException if a filter is already running
	 */
	public FilterResult run(ImageFilter filter, RgbImage source, ProgressMonitor monitor) throws RejectedExecutionException {
		Objects.requireNonNull(filter, "Filter must not be null!");
		Objects.requireNonNull(source, "Source image must not be null!");
		acquire(filter);
		return apply(filter, source, monitor == null ? ProgressMonitor.NONE : monitor);
	}

	private void acquire(ImageFilter filter) {
		if (pool.isShutdown())
			throw new RejectedExecutionException("FilterRunner has been closed");
		if (!busy.compareAndSet(false, true)) {
			logger.warn("Cannot apply {} - another filter is already running", filter);
			throw new RejectedExecutionException("Another filter is already running");
		}
	}

	private FilterResult apply(ImageFilter filter, RgbImage source, ProgressMonitor monitor) {
		long startTime = System.currentTimeMillis();
		try {
			var result = filter.processImage(source, monitor);
			long endTime = System.currentTimeMillis();
			if (result.isCancelled())
				logger.debug("{} cancelled after {} ms", filter, endTime - startTime);
			else
				logger.debug("{} completed in {} ms", filter, endTime - startTime);
			return result;
		} catch (RuntimeException e) {
			logger.error("Error applying " + filter + ": " + e.getLocalizedMessage(), e);
			throw e;
		} finally {
			busy.set(false);
		}
	}

	/**
	 * Stop accepting new filters, and wait briefly for any running filter to finish.
	 */
	@Override
	public void close() {
		pool.shutdown();
		try {
			if (!pool.awaitTermination(5, TimeUnit.SECONDS))
				logger.warn("FilterRunner did not terminate within 5 seconds");
		} catch (InterruptedException e) {
			logger.warn("Interrupted while waiting for FilterRunner to terminate");
			Thread.currentThread().interrupt();
		}
	}

}
