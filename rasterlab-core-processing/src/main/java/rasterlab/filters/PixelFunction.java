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

/**
 * Compute a single output pixel from a source image.
 *
 * @author RasterLab developers
 */
@FunctionalInterface
public interface PixelFunction {

	/**
	 * Compute the packed RGB value of the output pixel at (x, y).
	 * Implementations must only read from the source, never write to it.
	 *
	 * @param source the source image
	 * @param x
	 * @param y
	 * @return packed RGB value, with every channel in the range 0-255
	 */
	int computePixel(RgbImage source, int x, int y);

}
