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

package rasterlab.lib.common;

/**
 * Static functions to help work with RGB colors using packed ints.
 * <p>
 * All packed values created here are opaque, i.e. the alpha bits are always 255.
 *
 * @author RasterLab developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Packed int representing white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed int representing black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Packed int representing blue.
	 */
	public static final int BLUE = packRGB(0, 0, 255);

	/**
	 * Make a packed RGB value from specified input values.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value with alpha 255
	 * @see #packClippedRGB(int, int, int)
	 */
	public static int packRGB(int r, int g, int b) {
		return (255 << 24) +
			   ((r & 0xff) << 16) +
			   ((g & 0xff) << 8) +
			    (b & 0xff);
	}

	/**
	 * Make a packed RGB value from specified input values, clipping to the range 0-255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255, but if they are not they are clipped to the closest valid value.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value with alpha 255
	 */
	public static int packClippedRGB(int r, int g, int b) {
		return packRGB(
				   do8BitRangeCheck(r),
				   do8BitRangeCheck(g),
				   do8BitRangeCheck(b)
				   );
	}

	/**
	 * Clip an input value to be an integer in the range 0-255.
	 *
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return GeneralTools.clipValue(v, 0, 255);
	}

	/**
	 * Truncate an input value toward zero, then clip it to the range 0-255.
	 * <p>
	 * Note that this truncates rather than rounds, so that -0.5 becomes 0 and 254.9 becomes 254.
	 *
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return do8BitRangeCheck((int)v);
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return (rgb & 0xff);
	}

	/**
	 * Compute the weighted luminance of a packed RGB value, truncated and clipped to 0-255.
	 * <p>
	 * The weights are 0.299, 0.5876 and 0.114 for red, green and blue respectively.
	 * The green weight is intentionally 0.5876 rather than the more common 0.587.
	 *
	 * @param rgb
	 * @return
	 */
	public static int luminance(int rgb) {
		return do8BitRangeCheck(0.299 * red(rgb) + 0.5876 * green(rgb) + 0.114 * blue(rgb));
	}

	/**
	 * Compute the unweighted mean of the red, green and blue values, using integer division.
	 *
	 * @param rgb
	 * @return
	 */
	public static int meanRGB(int rgb) {
		return (red(rgb) + green(rgb) + blue(rgb)) / 3;
	}

	/**
	 * Get the opaque RGB value, removing any alpha information.
	 * <p>
	 * This is useful when comparing packed values that may come from sources with different alpha conventions.
	 *
	 * @param argb
	 * @return
	 */
	public static int opaque(int argb) {
		return argb | 0xff000000;
	}

}
