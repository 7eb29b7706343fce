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

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

import rasterlab.lib.common.ColorTools;

/**
 * Create {@link RgbImage RgbImage} instances for basic pixel processing.
 *
 * @author RasterLab developers
 *
 */
public class RgbImages {

	// Suppressed default constructor for non-instantiability
	private RgbImages() {
		throw new AssertionError();
	}

	/**
	 * Create an {@link RgbImage} with all pixels set to black.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static RgbImage createImage(int width, int height) {
		checkDimensions(width, height);
		int[] data = new int[width * height];
		Arrays.fill(data, ColorTools.BLACK);
		return new IntArrayRgbImage(data, width, height);
	}

	/**
	 * Create an {@link RgbImage} with all pixels set to the same packed RGB value.
	 *
	 * @param width
	 * @param height
	 * @param rgb
	 * @return
	 */
	public static RgbImage createFilledImage(int width, int height, int rgb) {
		checkDimensions(width, height);
		int[] data = new int[width * height];
		Arrays.fill(data, ColorTools.opaque(rgb));
		return new IntArrayRgbImage(data, width, height);
	}

	/**
	 * Create an {@link RgbImage} backed by an existing int array of packed RGB pixels.
	 * <p>
	 * Pixels are stored in row-major order. The array is used directly, not copied.
	 *
	 * @param rgb
	 * @param width
	 * @param height
	 * @return
	 */
	public static RgbImage createImage(int[] rgb, int width, int height) {
		Objects.requireNonNull(rgb, "Pixel array must not be null!");
		checkDimensions(width, height);
		if (rgb.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + rgb.length + " does not match " + width + "x" + height);
		return new IntArrayRgbImage(rgb, width, height);
	}

	/**
	 * Create a full, independent copy of an image.
	 * @param image
	 * @return
	 */
	public static RgbImage copyOf(RgbImage image) {
		return new IntArrayRgbImage(getPixels(image), image.getWidth(), image.getHeight());
	}

	/**
	 * Get the packed RGB values for the image, in row-major order.
	 * <p>
	 * The returned array is always a copy, which the caller is free to modify.
	 *
	 * @param image
	 * @return
	 */
	public static int[] getPixels(RgbImage image) {
		if (image instanceof IntArrayRgbImage)
			return ((IntArrayRgbImage)image).data.clone();
		int w = image.getWidth();
		int h = image.getHeight();
		int[] pixels = new int[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				pixels[y * w + x] = image.getRGB(x, y);
		}
		return pixels;
	}

	/**
	 * Check whether two images have the same dimensions and identical RGB values.
	 * <p>
	 * Alpha values are ignored.
	 *
	 * @param image1
	 * @param image2
	 * @return
	 */
	public static boolean sameRGB(RgbImage image1, RgbImage image2) {
		if (image1.getWidth() != image2.getWidth() || image1.getHeight() != image2.getHeight())
			return false;
		for (int y = 0; y < image1.getHeight(); y++) {
			for (int x = 0; x < image1.getWidth(); x++) {
				if (ColorTools.opaque(image1.getRGB(x, y)) != ColorTools.opaque(image2.getRGB(x, y)))
					return false;
			}
		}
		return true;
	}

	/**
	 * Create an {@link RgbImage} from a {@link BufferedImage}.
	 * Any alpha channel is discarded.
	 *
	 * @param img
	 * @return
	 */
	public static RgbImage fromBufferedImage(BufferedImage img) {
		int w = img.getWidth();
		int h = img.getHeight();
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		for (int i = 0; i < rgb.length; i++)
			rgb[i] = ColorTools.opaque(rgb[i]);
		return createImage(rgb, w, h);
	}

	/**
	 * Create a {@link BufferedImage} of type {@code TYPE_INT_RGB} from an {@link RgbImage}.
	 * @param image
	 * @return
	 */
	public static BufferedImage toBufferedImage(RgbImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		var img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, w, h, getPixels(image), 0, w);
		return img;
	}

	private static void checkDimensions(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be positive, but were " + width + "x" + height);
	}


	/**
	 * Implementation of an RgbImage backed by an array of packed ints.
	 */
	static class IntArrayRgbImage implements RgbImage {

		private final int[] data;
		private final int width;
		private final int height;

		IntArrayRgbImage(int[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public int getRGB(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public void setRGB(int x, int y, int rgb) {
			data[y * width + x] = ColorTools.opaque(rgb);
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public String toString() {
			return "RgbImage (" + width + "x" + height + ")";
		}

	}

}
