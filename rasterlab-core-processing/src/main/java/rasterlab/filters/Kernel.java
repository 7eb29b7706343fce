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

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable 2D array of weights for convolution.
 * <p>
 * The width and height are always odd, so that the kernel has a center.
 * Weights are indexed by their offset from the center.
 *
 * @author RasterLab developers
 * @see Kernels
 */
public final class Kernel {

	private final int width;
	private final int height;
	private final double[] weights;

	private Kernel(int width, int height, double[] weights) {
		this.width = width;
		this.height = height;
		this.weights = weights;
	}

	/**
	 * Create a kernel from a 2D array of weights, indexed as {@code weights[row][column]}.
	 * The array is copied.
	 *
	 * @param weights rectangular array with an odd number of rows and columns
	 * @return
	 * @throws IllegalArgumentException if the array is empty, ragged or has an even dimension
	 */
	public static Kernel create(double[][] weights) throws IllegalArgumentException {
		Objects.requireNonNull(weights, "Kernel weights must not be null!");
		int height = weights.length;
		if (height == 0 || weights[0] == null || weights[0].length == 0)
			throw new IllegalArgumentException("Kernel must not be empty");
		int width = weights[0].length;
		checkDimensions(width, height);
		double[] data = new double[width * height];
		for (int row = 0; row < height; row++) {
			if (weights[row] == null || weights[row].length != width)
				throw new IllegalArgumentException("Kernel rows must all have length " + width);
			System.arraycopy(weights[row], 0, data, row * width, width);
		}
		return new Kernel(width, height, data);
	}

	/**
	 * Check that the kernel is usable, e.g. after it has been read from JSON.
	 * @throws IllegalArgumentException if the dimensions are not odd, or do not match the number of weights
	 */
	void validate() throws IllegalArgumentException {
		checkDimensions(width, height);
		if (weights == null || weights.length != width * height)
			throw new IllegalArgumentException("Kernel of size " + width + "x" + height + " must have " + (width * height) + " weights");
	}

	private static void checkDimensions(int width, int height) throws IllegalArgumentException {
		if (width <= 0 || height <= 0 || width % 2 == 0 || height % 2 == 0)
			throw new IllegalArgumentException("Kernel dimensions must be odd, but were " + width + "x" + height);
	}

	/**
	 * Number of columns.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Number of rows.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Horizontal radius, i.e. {@code (width - 1) / 2}.
	 * @return
	 */
	public int getRadiusX() {
		return width / 2;
	}

	/**
	 * Vertical radius, i.e. {@code (height - 1) / 2}.
	 * @return
	 */
	public int getRadiusY() {
		return height / 2;
	}

	/**
	 * Get a weight by its offset from the kernel center.
	 * @param dx horizontal offset, from -radiusX to radiusX
	 * @param dy vertical offset, from -radiusY to radiusY
	 * @return
	 */
	public double getWeight(int dx, int dy) {
		return weights[(dy + getRadiusY()) * width + dx + getRadiusX()];
	}

	/**
	 * Sum of all weights.
	 * @return
	 */
	public double sum() {
		double sum = 0;
		for (double w : weights)
			sum += w;
		return sum;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, Arrays.hashCode(weights));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Kernel))
			return false;
		Kernel other = (Kernel)obj;
		return width == other.width && height == other.height && Arrays.equals(weights, other.weights);
	}

	@Override
	public String toString() {
		return "Kernel (" + width + "x" + height + ")";
	}

}
