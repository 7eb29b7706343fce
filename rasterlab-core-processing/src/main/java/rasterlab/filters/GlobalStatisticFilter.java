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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasterlab.lib.common.ColorTools;
import rasterlab.lib.images.RgbImage;
import rasterlab.lib.tasks.ProgressMonitor;

/**
 * Abstract {@link ImageFilter} that first computes a statistic from the whole image, and then
 * computes each output pixel using that statistic.
 * <p>
 * The first half of the progress range is used to compute the statistic, the second half to apply it.
 * The statistic is computed afresh for every call to {@link #processImage(RgbImage, ProgressMonitor, int, int)}.
 * <p>
 * Cancellation while computing the statistic does <i>not</i> abort the filter: the statistic becomes 0
 * and the second phase begins, where the cancellation request is seen again and the filter returns
 * a cancelled result.
 *
 * @author RasterLab developers
 */
public abstract class GlobalStatisticFilter implements ImageFilter {

	private static final Logger logger = LoggerFactory.getLogger(GlobalStatisticFilter.class);

	@Override
	public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
		FilterTraversal.checkProgressRange(maxPercent, offset);
		int statisticPercent = maxPercent / 2;
		int statistic = computeStatistic(source, monitor, statisticPercent, offset);
		logger.debug("Global statistic for {}: {}", this, statistic);
		return FilterTraversal.traverse(source, monitor, maxPercent - statisticPercent, offset + statisticPercent,
				(img, x, y) -> computePixel(img, x, y, statistic));
	}

	/**
	 * Compute the statistic used by {@link #computePixel(RgbImage, int, int, int)}.
	 * <p>
	 * The default implementation returns the mean brightness of the image, as computed by
	 * {@link #meanBrightness(RgbImage, ProgressMonitor, int, int)}.
	 *
	 * @param source
	 * @param monitor
	 * @param maxPercent
	 * @param offset
	 * @return
	 */
	protected int computeStatistic(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
		return meanBrightness(source, monitor, maxPercent, offset);
	}

	/**
	 * Compute a single output pixel, given the global statistic.
	 *
	 * @param source
	 * @param x
	 * @param y
	 * @param statistic
	 * @return packed RGB value
	 */
	protected abstract int computePixel(RgbImage source, int x, int y, int statistic);

	/**
	 * Compute the mean brightness of an image.
	 * <p>
	 * The brightness of each pixel is the mean of its red, green and blue values, using integer division.
	 * The pixel brightness values are summed and divided by the number of pixels, again using integer division.
	 * <p>
	 * If cancellation is requested, 0 is returned.
	 *
	 * @param source
	 * @param monitor
	 * @param maxPercent
	 * @param offset
	 * @return the mean brightness, or 0 if cancelled
	 */
	public static int meanBrightness(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
		int width = source.getWidth();
		int height = source.getHeight();
		long sum = 0;
		for (int x = 0; x < width; x++) {
			monitor.reportProgress(FilterTraversal.progress(x, width, maxPercent, offset));
			if (monitor.isCancelRequested()) {
				logger.debug("Mean brightness cancelled at column {}/{}, using 0", x, width);
				return 0;
			}
			for (int y = 0; y < height; y++) {
				sum += ColorTools.meanRGB(source.getRGB(x, y));
			}
		}
		return (int)(sum / ((long)width * height));
	}

}
