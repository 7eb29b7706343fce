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

package rasterlab.lib.images;

/**
 * A minimal interface to define a means to provide access to packed RGB pixels from a 2D image.
 * <p>
 * Pixels are packed ints as created by {@link rasterlab.lib.common.ColorTools#packRGB(int, int, int)}.
 *
 * @author RasterLab developers
 *
 */
public interface RgbImage {

	/**
	 * Get the packed RGB value of a single pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @return
	 */
	int getRGB(int x, int y);

	/**
	 * Set the packed RGB value of a single pixel.
	 * @param x x-coordinate of the pixel to set
	 * @param y y-coordinate of the pixel to set
	 * @param rgb new packed RGB value
	 */
	void setRGB(int x, int y, int rgb);

	/**
	 * Image width, in pixels.
	 * @return
	 */
	int getWidth();

	/**
	 * Image height, in pixels.
	 * @return
	 */
	int getHeight();

}
