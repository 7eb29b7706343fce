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

import rasterlab.lib.images.RgbImage;
import rasterlab.lib.tasks.ProgressMonitor;

/**
 * A filter that creates a new image from a source image, reporting progress and supporting cancellation.
 * <p>
 * The source image is never modified. Filters should be created with {@link ImageFilters}.
 *
 * @author RasterLab developers
 * @see ImageFilters
 */
public interface ImageFilter {

	/**
	 * Apply the filter, using the full progress range 0-100.
	 *
	 * @param source the image to filter
	 * @param monitor progress monitor, polled for cancellation
	 * @return the result, which may be cancelled
	 */
	default FilterResult processImage(RgbImage source, ProgressMonitor monitor) {
		return processImage(source, monitor, 100, 0);
	}

	/**
	 * Apply the filter, reporting progress within a sub-range.
	 * <p>
	 * Progress values are in the range {@code offset} to {@code offset + maxPercent}.
	 * This makes it possible for a caller to reserve part of the progress range for other work.
	 *
	 * @param source the image to filter
	 * @param monitor progress monitor, polled for cancellation
	 * @param maxPercent width of the progress range used by this filter
	 * @param offset value added to all progress values
	 * @return the result, which may be cancelled
	 */
	FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset);

}
