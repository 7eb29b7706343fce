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

/**
 * Create commonly-used {@link Kernel Kernels}.
 *
 * @author RasterLab developers
 */
public class Kernels {

	/**
	 * Default radius for {@link #gaussian()}.
	 */
	public static final int DEFAULT_GAUSSIAN_RADIUS = 3;

	/**
	 * Default sigma for {@link #gaussian()}.
	 */
	public static final double DEFAULT_GAUSSIAN_SIGMA = 2.0;

	private static final Kernel SHARPEN = Kernel.create(new double[][] {
		{ 0, -1,  0},
		{-1,  5, -1},
		{ 0, -1,  0}
	});

	// Suppressed default constructor for non-instantiability
	private Kernels() {
		throw new AssertionError();
	}

	/**
	 * Create a normalized Gaussian kernel with radius 3 and sigma 2.
	 * @return
	 */
	public static Kernel gaussian() {
		return gaussian(DEFAULT_GAUSSIAN_RADIUS, DEFAULT_GAUSSIAN_SIGMA);
	}

	/**
	 * Create a normalized, square Gaussian kernel.
	 * <p>
	 * Each weight is {@code exp(-(i*i + j*j) / (sigma*sigma))}, before all weights are divided by their sum.
	 * Note that the denominator is {@code sigma*sigma} rather than {@code 2*sigma*sigma}.
	 *
	 * @param radius kernel radius; the kernel size will be {@code 2*radius+1}
	 * @param sigma must be &gt; 0
	 * @return
	 * @throws IllegalArgumentException if radius &lt; 0 or sigma &lt;= 0
	 */
	public static Kernel gaussian(int radius, double sigma) throws IllegalArgumentException {
		if (radius < 0)
			throw new IllegalArgumentException("Gaussian radius must be >= 0, but was " + radius);
		if (!(sigma > 0) || Double.isInfinite(sigma))
			throw new IllegalArgumentException("Gaussian sigma must be > 0 and finite, but was " + sigma);
		int size = radius * 2 + 1;
		double[][] weights = new double[size][size];
		double sigma2 = sigma * sigma;
		double norm = 0;
		for (int i = -radius; i <= radius; i++) {
			for (int j = -radius; j <= radius; j++) {
				double w = Math.exp(-(i * i + j * j) / sigma2);
				weights[j + radius][i + radius] = w;
				norm += w;
			}
		}
		for (int row = 0; row < size; row++) {
			for (int col = 0; col < size; col++)
				weights[row][col] /= norm;
		}
		return Kernel.create(weights);
	}

	/**
	 * Get the 3x3 sharpening kernel {@code [[0,-1,0],[-1,5,-1],[0,-1,0]]}.
	 * The weights sum to 1.
	 * @return
	 */
	public static Kernel sharpen() {
		return SHARPEN;
	}

}
