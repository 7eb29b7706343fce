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

package rasterlab.lib.tasks;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ProgressMonitor} that sends progress to a log.
 * <p>
 * Each distinct percentage is logged once. Cancellation can be requested from any thread
 * with {@link #requestCancel()}.
 *
 * @author RasterLab developers
 *
 */
public class LoggingProgressMonitor implements ProgressMonitor {

	private static final Logger logger = LoggerFactory.getLogger(LoggingProgressMonitor.class);

	private final String message;
	private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

	private long startTime = -1L;
	private int lastPercent = -1;

	/**
	 * Constructor.
	 * @param message message to include with each progress update; may be null
	 */
	public LoggingProgressMonitor(String message) {
		this.message = message == null ? "Processing" : message;
	}

	@Override
	public synchronized void reportProgress(int percent) {
		if (startTime < 0)
			startTime = System.currentTimeMillis();
		if (percent == lastPercent)
			return;
		if (percent < lastPercent)
			logger.warn("Progress decreased from {}% to {}%", lastPercent, percent);
		lastPercent = percent;
		logger.info("{} ({}%)", message, percent);
	}

	/**
	 * Log that processing has finished, with the elapsed time since the first progress update.
	 * @param completionMessage
	 */
	public synchronized void completed(String completionMessage) {
		if (startTime < 0)
			logger.info(completionMessage);
		else
			logger.info("{} in {} seconds", completionMessage,
					String.format("%.2f", (System.currentTimeMillis() - startTime)/1000.));
	}

	/**
	 * Request that the monitored operation stop at its next checkpoint.
	 */
	public void requestCancel() {
		if (!cancelRequested.getAndSet(true))
			logger.info("{} - cancel requested", message);
	}

	@Override
	public boolean isCancelRequested() {
		return cancelRequested.get();
	}

	/**
	 * The most recent progress value, or -1 if no progress has been reported.
	 * @return
	 */
	public synchronized int getLastProgress() {
		return lastPercent;
	}

}
