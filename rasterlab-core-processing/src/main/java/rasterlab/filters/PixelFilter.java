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
 * Abstract {@link ImageFilter} that computes each output pixel independently, using the
 * default dense traversal of {@link FilterTraversal}.
 *
 * @author RasterLab developers
 */
public abstract class PixelFilter implements ImageFilter, PixelFunction {

	@Override
	public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
		return FilterTraversal.traverse(source, monitor, maxPercent, offset, this);
	}

}
