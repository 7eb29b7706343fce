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

package rasterlab.lib.analysis.stats;

import rasterlab.lib.common.ColorTools;
import rasterlab.lib.images.RgbImage;

/**
 * 256-bin histogram of weighted pixel luminance.
 * <p>
 * Bins are computed with {@link ColorTools#luminance(int)}, using the same weights as the grayscale filter.
 *
 * @author RasterLab developers
 *
 */
public class LuminanceHistogram {

	/**
	 * Number of bins, one per 8-bit value.
	 */
	public static final int N_BINS = 256;

	private final long[] counts;
	private final long total;

	private LuminanceHistogram(long[] counts) {
		this.counts = counts;
		long sum = 0;
		for (long c : counts)
			sum += c;
		this.total = sum;
	}

	/**
	 * Build a histogram from all pixels of an image.
	 * @param image
	 * @return
	 */
	public static LuminanceHistogram compute(RgbImage image) {
		long[] counts = new long[N_BINS];
		for (int x = 0; x < image.getWidth(); x++) {
			for (int y = 0; y < image.getHeight(); y++) {
				counts[ColorTools.luminance(image.getRGB(x, y))]++;
			}
		}
		return new LuminanceHistogram(counts);
	}

	/**
	 * Number of pixels falling into the specified bin.
	 * @param bin
	 * @return
	 */
	public long getCount(int bin) {
		return counts[bin];
	}

	/**
	 * Total number of pixels counted.
	 * @return
	 */
	public long getTotal() {
		return total;
	}

	/**
	 * Proportion of all pixels in the specified bin, as a percentage 0-100.
	 * @param bin
	 * @return
	 */
	public double getPercentage(int bin) {
		if (total == 0)
			return 0;
		return (double)counts[bin] / total * 100.0;
	}

	/**
	 * Get a copy of all bin counts.
	 * @return
	 */
	public long[] getCounts() {
		return counts.clone();
	}

	/**
	 * Index of the bin with the highest count (the lowest index if tied).
	 * @return
	 */
	public int getModeBin() {
		int mode = 0;
		for (int i = 1; i < N_BINS; i++) {
			if (counts[i] > counts[mode])
				mode = i;
		}
		return mode;
	}

	@Override
	public String toString() {
		return "LuminanceHistogram (total=" + total + ", mode=" + getModeBin() + ")";
	}

}
