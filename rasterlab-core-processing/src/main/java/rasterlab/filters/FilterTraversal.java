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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasterlab.lib.images.RgbImage;
import rasterlab.lib.images.RgbImages;
import rasterlab.lib.tasks.ProgressMonitor;

/**
 * Dense traversal of an image, column by column, applying a {@link PixelFunction} to every pixel.
 * <p>
 * Progress is reported and cancellation polled once before each column.
 *
 * @author RasterLab developers
 */
public class FilterTraversal {

	private static final Logger logger = LoggerFactory.getLogger(FilterTraversal.class);

	// Suppressed default constructor for non-instantiability
	private FilterTraversal() {
		throw new AssertionError();
	}

	/**
	 * Apply a pixel function to every pixel of a source image, writing to a new image of the same size.
	 *
	 * @param source the source image; this is not modified
	 * @param monitor progress monitor
	 * @param maxPercent width of the progress range
	 * @param offset value added to all progress values
	 * @param function the function used to compute each output pixel
	 * @return the completed result, or cancelled if the monitor requested it before the final column
	 */
	public static FilterResult traverse(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset, PixelFunction function) {
		Objects.requireNonNull(source, "Source image must not be null!");
		Objects.requireNonNull(monitor, "Progress monitor must not be null!");
		Objects.requireNonNull(function, "Pixel function must not be null!");
		checkProgressRange(maxPercent, offset);

		int width = source.getWidth();
		int height = source.getHeight();
		var output = RgbImages.createImage(width, height);
		for (int x = 0; x < width; x++) {
			monitor.reportProgress(progress(x, width, maxPercent, offset));
			if (monitor.isCancelRequested()) {
				logger.debug("Traversal cancelled at column {}/{}", x, width);
				return FilterResult.cancelled();
			}
			for (int y = 0; y < height; y++) {
				output.setRGB(x, y, function.computePixel(source, x, y));
			}
		}
		return FilterResult.completed(output);
	}

	/**
	 * Compute the progress value for a loop index, as {@code floor(index / count * maxPercent) + offset}.
	 *
	 * @param index current index
	 * @param count total number of iterations
	 * @param maxPercent
	 * @param offset
	 * @return
	 */
	public static int progress(int index, int count, int maxPercent, int offset) {
		return (int)((double)index / count * maxPercent) + offset;
	}

	static void checkProgressRange(int maxPercent, int offset) {
		if (maxPercent < 0 || offset < 0)
			throw new IllegalArgumentException("Progress range must not be negative (maxPercent=" + maxPercent + ", offset=" + offset + ")");
	}

}
