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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasterlab.lib.common.ColorTools;
import rasterlab.lib.common.GeneralTools;
import rasterlab.lib.images.RgbImage;
import rasterlab.lib.images.RgbImages;
import rasterlab.lib.io.GsonTools;
import rasterlab.lib.io.GsonTools.SubTypeAdapterFactory;
import rasterlab.lib.tasks.ProgressMonitor;

/**
 * Create and use {@link ImageFilter} objects.
 * <p>
 * Filters are grouped into pointwise, neighborhood, global and noise filters.
 * All filters created here can be serialized to JSON with {@link #toJson(ImageFilter)} and
 * recreated with {@link #fromJson(String)}.
 *
 * @author RasterLab developers
 */
public class ImageFilters {

	private static final Logger logger = LoggerFactory.getLogger(ImageFilters.class);

	/**
	 * Name of the JSON field used to identify the filter type.
	 */
	public static final String TYPE_FIELD = "type";

	@Target(ElementType.TYPE)
	@Retention(RetentionPolicy.RUNTIME)
	private @interface FilterType {
		String value();
	}

	private static final SubTypeAdapterFactory<ImageFilter> FILTER_FACTORY = GsonTools.createSubTypeAdapterFactory(ImageFilter.class, TYPE_FIELD);

	@SuppressWarnings("unchecked")
	private static void registerTypes(Class<?> cls, String base) {
		var annotation = cls.getAnnotation(FilterType.class);
		if (annotation != null) {
			base = base + "." + annotation.value();
			if (ImageFilter.class.isAssignableFrom(cls)) {
				FILTER_FACTORY.registerSubtype((Class<? extends ImageFilter>)cls, base);
			}
		}
		for (var c : cls.getDeclaredClasses()) {
			registerTypes(c, base);
		}
	}

	/**
	 * Filters with parameters that must be checked.
	 * Checks are made on construction and again after reading from JSON, since Gson does not call constructors.
	 */
	interface ValidatedFilter extends ImageFilter {

		/**
		 * Check the filter parameters.
		 * @throws IllegalArgumentException if a parameter is invalid
		 */
		void validate() throws IllegalArgumentException;

	}

	private static void validateFilter(ImageFilter filter) {
		if (filter instanceof ValidatedFilter)
			((ValidatedFilter)filter).validate();
	}

	static {
		registerTypes(ImageFilters.class, "filter");
		FILTER_FACTORY.setValidator(ImageFilters::validateFilter);
		GsonTools.getDefaultBuilder().registerTypeAdapterFactory(FILTER_FACTORY);
	}

	// Suppressed default constructor for non-instantiability
	private ImageFilters() {
		throw new AssertionError();
	}

	/**
	 * Serialize a filter to JSON, including its type label.
	 * @param filter
	 * @return
	 */
	public static String toJson(ImageFilter filter) {
		return GsonTools.getInstance(true).toJson(filter, ImageFilter.class);
	}

	/**
	 * Create a filter from its JSON representation.
	 * @param json
	 * @return
	 * @throws com.google.gson.JsonParseException if the JSON does not describe a known filter type,
	 *                                            or the filter parameters are invalid
	 */
	public static ImageFilter fromJson(String json) {
		return GsonTools.getInstance().fromJson(json, ImageFilter.class);
	}

	/**
	 * Get the label used to identify a filter type in JSON, e.g. {@code "filter.pointwise.negative"}.
	 * @param filter
	 * @return the label, or null if the filter type is not registered
	 */
	public static String getTypeLabel(ImageFilter filter) {
		return FILTER_FACTORY.getLabel(filter.getClass());
	}

	static long newSeed() {
		return ThreadLocalRandom.current().nextLong();
	}


	/**
	 * Filters where each output pixel depends only on the corresponding input pixel.
	 */
	@FilterType("pointwise")
	public static class Pointwise {

		/**
		 * Invert each channel, so that {@code v -> 255 - v}.
		 * @return
		 */
		public static ImageFilter negative() {
			return new NegativeFilter();
		}

		/**
		 * Replace each channel by the weighted luminance {@code 0.299*R + 0.5876*G + 0.114*B}, truncated.
		 * @return
		 */
		public static ImageFilter grayscale() {
			return new GrayscaleFilter();
		}

		/**
		 * Add a fixed amount to every channel, clipping to 0-255.
		 * @param amount amount to add; may be negative
		 * @return
		 */
		public static ImageFilter brightness(int amount) {
			return new BrightnessFilter(amount);
		}

		/**
		 * Increase brightness by the specified amount.
		 * @param amount
		 * @return
		 */
		public static ImageFilter brighten(int amount) {
			return brightness(amount);
		}

		/**
		 * Decrease brightness by the specified amount.
		 * @param amount
		 * @return
		 */
		public static ImageFilter darken(int amount) {
			return brightness(-amount);
		}

		@FilterType("negative")
		static class NegativeFilter extends PixelFilter {

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int rgb = source.getRGB(x, y);
				return ColorTools.packRGB(
						255 - ColorTools.red(rgb),
						255 - ColorTools.green(rgb),
						255 - ColorTools.blue(rgb));
			}

			@Override
			public String toString() {
				return "Negative";
			}

		}

		@FilterType("grayscale")
		static class GrayscaleFilter extends PixelFilter {

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int intensity = ColorTools.luminance(source.getRGB(x, y));
				return ColorTools.packRGB(intensity, intensity, intensity);
			}

			@Override
			public String toString() {
				return "Grayscale";
			}

		}

		@FilterType("brightness")
		static class BrightnessFilter extends PixelFilter {

			private int amount;

			BrightnessFilter(int amount) {
				this.amount = amount;
			}

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int rgb = source.getRGB(x, y);
				return ColorTools.packClippedRGB(
						ColorTools.red(rgb) + amount,
						ColorTools.green(rgb) + amount,
						ColorTools.blue(rgb) + amount);
			}

			@Override
			public String toString() {
				return "Brightness (amount=" + amount + ")";
			}

		}

	}


	/**
	 * Filters where each output pixel depends on a neighborhood of input pixels.
	 * <p>
	 * Pixels beyond the image boundary are replaced by the closest pixel inside the image.
	 */
	@FilterType("filters")
	public static class Filters {

		/**
		 * Default median filter radius.
		 */
		public static final int DEFAULT_MEDIAN_RADIUS = 1;

		/**
		 * Channel difference above which a pixel is considered to be on a contour.
		 */
		public static final int CONTOUR_THRESHOLD = 10;

		/**
		 * Color used to mark contour pixels.
		 */
		public static final int CONTOUR_COLOR = ColorTools.BLUE;

		/**
		 * Apply a 2D convolution with the specified kernel.
		 * @param kernel
		 * @return
		 */
		public static ImageFilter convolve(Kernel kernel) {
			return new ConvolutionFilter(kernel);
		}

		/**
		 * Apply a Gaussian blur with radius 3 and sigma 2.
		 * @return
		 * @see Kernels#gaussian()
		 */
		public static ImageFilter gaussianBlur() {
			return convolve(Kernels.gaussian());
		}

		/**
		 * Apply a Gaussian blur.
		 * @param radius
		 * @param sigma must be &gt; 0
		 * @return
		 * @see Kernels#gaussian(int, double)
		 */
		public static ImageFilter gaussianBlur(int radius, double sigma) {
			return convolve(Kernels.gaussian(radius, sigma));
		}

		/**
		 * Apply a 3x3 sharpening filter.
		 * @return
		 * @see Kernels#sharpen()
		 */
		public static ImageFilter sharpen() {
			return convolve(Kernels.sharpen());
		}

		/**
		 * Apply a 3x3 median filter.
		 * @return
		 */
		public static ImageFilter median() {
			return median(DEFAULT_MEDIAN_RADIUS);
		}

		/**
		 * Apply a square median filter to each channel independently.
		 * @param radius filter radius. 1 means a 3x3 filter, 2 means a 5x5 filter.
		 * @return
		 */
		public static ImageFilter median(int radius) {
			return new MedianFilter(radius);
		}

		/**
		 * Mark pixels that differ from any of their 4 neighbors by more than {@link #CONTOUR_THRESHOLD} in any channel.
		 * Marked pixels are set to {@link #CONTOUR_COLOR}, others are unchanged.
		 * @return
		 */
		public static ImageFilter contour() {
			return new ContourFilter();
		}

		/**
		 * Displace pixels horizontally along a sine wave with amplitude 20 and period 30.
		 * @return
		 */
		public static ImageFilter waves() {
			return waves(WavesFilter.DEFAULT_AMPLITUDE, WavesFilter.DEFAULT_PERIOD);
		}

		/**
		 * Displace pixels horizontally along a sine wave.
		 * @param amplitude maximum horizontal displacement, in pixels
		 * @param period wavelength in pixels, measured vertically; must be &gt; 0
		 * @return
		 */
		public static ImageFilter waves(double amplitude, double period) {
			return new WavesFilter(amplitude, period);
		}

		@FilterType("convolution")
		static class ConvolutionFilter extends PixelFilter implements ValidatedFilter {

			private static final double INTEGER_TOLERANCE = 1e-9;

			private Kernel kernel;

			ConvolutionFilter(Kernel kernel) {
				this.kernel = kernel;
				validate();
			}

			@Override
			public void validate() {
				Objects.requireNonNull(kernel, "Kernel must not be null!");
				kernel.validate();
			}

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int radiusX = kernel.getRadiusX();
				int radiusY = kernel.getRadiusY();
				int maxX = source.getWidth() - 1;
				int maxY = source.getHeight() - 1;

				double resultR = 0;
				double resultG = 0;
				double resultB = 0;
				for (int l = -radiusY; l <= radiusY; l++) {
					int idY = GeneralTools.clipValue(y + l, 0, maxY);
					for (int k = -radiusX; k <= radiusX; k++) {
						int idX = GeneralTools.clipValue(x + k, 0, maxX);
						int rgb = source.getRGB(idX, idY);
						double w = kernel.getWeight(k, l);
						resultR += ColorTools.red(rgb) * w;
						resultG += ColorTools.green(rgb) * w;
						resultB += ColorTools.blue(rgb) * w;
					}
				}
				return ColorTools.packClippedRGB(
						truncate(resultR),
						truncate(resultG),
						truncate(resultB));
			}

			/**
			 * Truncate toward zero, except where the value is within floating point error of an integer.
			 * This stops a sum such as 127.99999999999997 from a normalized kernel becoming 127.
			 */
			static int truncate(double value) {
				double nearest = Math.rint(value);
				if (Precision.equals(value, nearest, INTEGER_TOLERANCE))
					return (int)nearest;
				return (int)value;
			}

			@Override
			public String toString() {
				return "Convolution (" + kernel + ")";
			}

		}

		@FilterType("median")
		static class MedianFilter extends PixelFilter implements ValidatedFilter {

			private int radius;

			MedianFilter(int radius) {
				this.radius = radius;
				validate();
			}

			@Override
			public void validate() {
				if (radius < 0)
					throw new IllegalArgumentException("Median radius must be >= 0, but was " + radius);
			}

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int size = (radius * 2 + 1) * (radius * 2 + 1);
				int maxX = source.getWidth() - 1;
				int maxY = source.getHeight() - 1;
				int[] reds = new int[size];
				int[] greens = new int[size];
				int[] blues = new int[size];
				int i = 0;
				for (int l = -radius; l <= radius; l++) {
					int idY = GeneralTools.clipValue(y + l, 0, maxY);
					for (int k = -radius; k <= radius; k++) {
						int idX = GeneralTools.clipValue(x + k, 0, maxX);
						int rgb = source.getRGB(idX, idY);
						reds[i] = ColorTools.red(rgb);
						greens[i] = ColorTools.green(rgb);
						blues[i] = ColorTools.blue(rgb);
						i++;
					}
				}
				Arrays.sort(reds);
				Arrays.sort(greens);
				Arrays.sort(blues);
				int mid = size / 2;
				return ColorTools.packClippedRGB(reds[mid], greens[mid], blues[mid]);
			}

			@Override
			public String toString() {
				return "Median (radius=" + radius + ")";
			}

		}

		@FilterType("contour")
		static class ContourFilter extends PixelFilter {

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int maxX = source.getWidth() - 1;
				int maxY = source.getHeight() - 1;
				int current = source.getRGB(x, y);
				int left = source.getRGB(GeneralTools.clipValue(x - 1, 0, maxX), y);
				int right = source.getRGB(GeneralTools.clipValue(x + 1, 0, maxX), y);
				int top = source.getRGB(x, GeneralTools.clipValue(y - 1, 0, maxY));
				int bottom = source.getRGB(x, GeneralTools.clipValue(y + 1, 0, maxY));

				boolean isDifferent = isDifferentColor(current, left) ||
						isDifferentColor(current, right) ||
						isDifferentColor(current, top) ||
						isDifferentColor(current, bottom);
				return isDifferent ? CONTOUR_COLOR : current;
			}

			private static boolean isDifferentColor(int rgb1, int rgb2) {
				return Math.abs(ColorTools.red(rgb1) - ColorTools.red(rgb2)) > CONTOUR_THRESHOLD ||
						Math.abs(ColorTools.green(rgb1) - ColorTools.green(rgb2)) > CONTOUR_THRESHOLD ||
						Math.abs(ColorTools.blue(rgb1) - ColorTools.blue(rgb2)) > CONTOUR_THRESHOLD;
			}

			@Override
			public String toString() {
				return "Contour";
			}

		}

		@FilterType("waves")
		static class WavesFilter extends PixelFilter implements ValidatedFilter {

			static final double DEFAULT_AMPLITUDE = 20;
			static final double DEFAULT_PERIOD = 30;

			private double amplitude;
			private double period;

			WavesFilter(double amplitude, double period) {
				this.amplitude = amplitude;
				this.period = period;
				validate();
			}

			@Override
			public void validate() {
				if (!Double.isFinite(amplitude))
					throw new IllegalArgumentException("Wave amplitude must be finite, but was " + amplitude);
				if (!(period > 0 && Double.isFinite(period)))
					throw new IllegalArgumentException("Wave period must be finite and > 0, but was " + period);
			}

			@Override
			public int computePixel(RgbImage source, int x, int y) {
				int newX = x + (int)(amplitude * Math.sin(2 * Math.PI * y / period));
				newX = GeneralTools.clipValue(newX, 0, source.getWidth() - 1);
				return source.getRGB(newX, y);
			}

			@Override
			public String toString() {
				return "Waves (amplitude=" + amplitude + ", period=" + period + ")";
			}

		}

	}


	/**
	 * Filters that depend upon a statistic computed from the whole image.
	 */
	@FilterType("global")
	public static class Global {

		/**
		 * Scale the difference between each channel and the mean image brightness.
		 * <p>
		 * An amount of 1 leaves the image unchanged, &gt; 1 increases contrast and between 0 and 1 decreases it.
		 *
		 * @param amount
		 * @return
		 */
		public static ImageFilter contrast(double amount) {
			return new ContrastFilter(amount);
		}

		/**
		 * Increase contrast by the specified factor.
		 * @param amount factor &gt; 0
		 * @return
		 */
		public static ImageFilter increaseContrast(double amount) {
			return contrast(amount);
		}

		/**
		 * Decrease contrast, applying the reciprocal of the specified factor.
		 * @param amount factor &gt; 0
		 * @return
		 */
		public static ImageFilter decreaseContrast(double amount) {
			if (!(amount > 0))
				throw new IllegalArgumentException("Contrast amount must be > 0, but was " + amount);
			return contrast(1.0 / amount);
		}

		@FilterType("contrast")
		static class ContrastFilter extends GlobalStatisticFilter implements ValidatedFilter {

			private double amount;

			ContrastFilter(double amount) {
				this.amount = amount;
				validate();
			}

			@Override
			public void validate() {
				if (!Double.isFinite(amount))
					throw new IllegalArgumentException("Contrast amount must be finite, but was " + amount);
			}

			@Override
			protected int computePixel(RgbImage source, int x, int y, int brightness) {
				int rgb = source.getRGB(x, y);
				return ColorTools.packRGB(
						adjust(ColorTools.red(rgb), brightness),
						adjust(ColorTools.green(rgb), brightness),
						adjust(ColorTools.blue(rgb), brightness));
			}

			private int adjust(int value, int brightness) {
				return ColorTools.do8BitRangeCheck(brightness + (value - brightness) * amount);
			}

			@Override
			public String toString() {
				return "Contrast (amount=" + amount + ")";
			}

		}

	}


	/**
	 * Filters that add random noise.
	 * <p>
	 * Each invocation creates its own random number generator from the filter's seed,
	 * so a filter always produces the same output for the same input.
	 */
	@FilterType("noise")
	public static class Noise {

		/**
		 * Replace 2% of pixels with white and 2% with black, using a random seed.
		 * @return
		 */
		public static ImageFilter dots() {
			return dots(newSeed());
		}

		/**
		 * Replace 2% of pixels with white and 2% with black.
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter dots(long seed) {
			return dots(NoiseDotsFilter.DEFAULT_PROBABILITY, NoiseDotsFilter.DEFAULT_PROBABILITY, seed);
		}

		/**
		 * Replace random pixels with white or black.
		 * @param pWhite probability that a pixel becomes white
		 * @param pBlack probability that a pixel becomes black
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter dots(double pWhite, double pBlack, long seed) {
			return new NoiseDotsFilter(pWhite, pBlack, seed);
		}

		/**
		 * Draw random black and white lines, with the default line count 50 and maximum length 40, using a random seed.
		 * @return
		 */
		public static ImageFilter lines() {
			return lines(newSeed());
		}

		/**
		 * Draw random black and white lines, with the default line count 50 and maximum length 40.
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter lines(long seed) {
			return lines(NoiseLinesFilter.DEFAULT_NUMBER_OF_LINES, NoiseLinesFilter.DEFAULT_MAX_LENGTH, seed);
		}

		/**
		 * Draw random black and white lines.
		 * <p>
		 * Note that {@code numberOfLines * maxLength} lines are drawn.
		 *
		 * @param numberOfLines
		 * @param maxLength maximum line length (exclusive); must be &gt; 10
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter lines(int numberOfLines, int maxLength, long seed) {
			return new NoiseLinesFilter(numberOfLines, maxLength, seed);
		}

		/**
		 * Draw 1000 random circle outlines with maximum radius 30, using a random seed.
		 * @return
		 */
		public static ImageFilter circles() {
			return circles(newSeed());
		}

		/**
		 * Draw 1000 random circle outlines with maximum radius 30.
		 * Circles are white or black with equal probability 0.5, so that a quarter are skipped.
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter circles(long seed) {
			return circles(NoiseCirclesFilter.DEFAULT_NUMBER_OF_CIRCLES, NoiseCirclesFilter.DEFAULT_MAX_RADIUS,
					NoiseCirclesFilter.DEFAULT_PROBABILITY, NoiseCirclesFilter.DEFAULT_PROBABILITY, seed);
		}

		/**
		 * Draw random circle outlines.
		 *
		 * @param numberOfCircles
		 * @param maxRadius maximum radius (exclusive); must be &gt; 5
		 * @param pWhite probability that a circle is white
		 * @param pBlack probability that a circle that is not white is black; otherwise the circle is skipped
		 * @param seed random seed
		 * @return
		 */
		public static ImageFilter circles(int numberOfCircles, int maxRadius, double pWhite, double pBlack, long seed) {
			return new NoiseCirclesFilter(numberOfCircles, maxRadius, pWhite, pBlack, seed);
		}

		static void checkProbability(String name, double p) {
			if (!(p >= 0 && p <= 1))
				throw new IllegalArgumentException(name + " must be between 0 and 1, but was " + p);
		}

		/**
		 * Base class for noise filters, storing the seed used to create a generator for each invocation.
		 */
		abstract static class RandomFilter implements ValidatedFilter {

			private long seed;

			RandomFilter(long seed) {
				this.seed = seed;
			}

			Random createRandom() {
				return new Random(seed);
			}

			/**
			 * Random integer between min (inclusive) and max (exclusive).
			 */
			static int nextInt(Random random, int min, int max) {
				return min + random.nextInt(max - min);
			}

		}

		@FilterType("dots")
		static class NoiseDotsFilter extends RandomFilter {

			static final double DEFAULT_PROBABILITY = 0.02;

			private double pWhite;
			private double pBlack;

			NoiseDotsFilter(double pWhite, double pBlack, long seed) {
				super(seed);
				this.pWhite = pWhite;
				this.pBlack = pBlack;
				validate();
			}

			@Override
			public void validate() {
				checkProbability("pWhite", pWhite);
				checkProbability("pBlack", pBlack);
			}

			@Override
			public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
				var random = createRandom();
				return FilterTraversal.traverse(source, monitor, maxPercent, offset,
						(img, x, y) -> computePixel(img, x, y, random.nextDouble()));
			}

			private int computePixel(RgbImage source, int x, int y, double p) {
				if (p < pWhite)
					return ColorTools.WHITE;
				else if (p + pBlack > 1)
					return ColorTools.BLACK;
				else
					return source.getRGB(x, y);
			}

			@Override
			public String toString() {
				return "Noise dots (pWhite=" + pWhite + ", pBlack=" + pBlack + ")";
			}

		}

		@FilterType("lines")
		static class NoiseLinesFilter extends RandomFilter {

			static final int DEFAULT_NUMBER_OF_LINES = 50;
			static final int DEFAULT_MAX_LENGTH = 40;
			static final int MIN_LENGTH = 10;

			private int numberOfLines;
			private int maxLength;

			NoiseLinesFilter(int numberOfLines, int maxLength, long seed) {
				super(seed);
				this.numberOfLines = numberOfLines;
				this.maxLength = maxLength;
				validate();
			}

			@Override
			public void validate() {
				if (numberOfLines < 0)
					throw new IllegalArgumentException("Number of lines must be >= 0, but was " + numberOfLines);
				if (maxLength <= MIN_LENGTH)
					throw new IllegalArgumentException("Maximum line length must be > " + MIN_LENGTH + ", but was " + maxLength);
			}

			@Override
			public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
				FilterTraversal.checkProgressRange(maxPercent, offset);
				var random = createRandom();
				var output = RgbImages.copyOf(source);
				int width = source.getWidth();
				int height = source.getHeight();
				// TODO: Decide whether numberOfLines segments were intended, rather than numberOfLines * maxLength
				for (int i = 0; i < numberOfLines; i++) {
					monitor.reportProgress(FilterTraversal.progress(i, numberOfLines, maxPercent, offset));
					if (monitor.isCancelRequested()) {
						logger.debug("Noise lines cancelled after {}/{} batches", i, numberOfLines);
						return FilterResult.cancelled();
					}
					for (int j = 0; j < maxLength; j++) {
						int startX = nextInt(random, 0, width);
						int startY = nextInt(random, 0, height);
						double angle = random.nextDouble() * 2 * Math.PI;
						int length = nextInt(random, MIN_LENGTH, maxLength);
						boolean isBlack = random.nextInt(2) == 0;
						drawLine(output, startX, startY, angle, length, isBlack ? ColorTools.BLACK : ColorTools.WHITE);
					}
				}
				return FilterResult.completed(output);
			}

			private static void drawLine(RgbImage image, int startX, int startY, double angle, int length, int rgb) {
				double cos = Math.cos(angle);
				double sin = Math.sin(angle);
				for (int i = 0; i < length; i++) {
					int x = startX + (int)(i * cos);
					int y = startY + (int)(i * sin);
					if (x < 0 || x >= image.getWidth() || y < 0 || y >= image.getHeight())
						break;
					image.setRGB(x, y, rgb);
				}
			}

			@Override
			public String toString() {
				return "Noise lines (numberOfLines=" + numberOfLines + ", maxLength=" + maxLength + ")";
			}

		}

		@FilterType("circles")
		static class NoiseCirclesFilter extends RandomFilter {

			static final int DEFAULT_NUMBER_OF_CIRCLES = 1000;
			static final int DEFAULT_MAX_RADIUS = 30;
			static final double DEFAULT_PROBABILITY = 0.5;
			static final int MIN_RADIUS = 5;

			private int numberOfCircles;
			private int maxRadius;
			private double pWhite;
			private double pBlack;

			NoiseCirclesFilter(int numberOfCircles, int maxRadius, double pWhite, double pBlack, long seed) {
				super(seed);
				this.numberOfCircles = numberOfCircles;
				this.maxRadius = maxRadius;
				this.pWhite = pWhite;
				this.pBlack = pBlack;
				validate();
			}

			@Override
			public void validate() {
				if (numberOfCircles < 0)
					throw new IllegalArgumentException("Number of circles must be >= 0, but was " + numberOfCircles);
				if (maxRadius <= MIN_RADIUS)
					throw new IllegalArgumentException("Maximum radius must be > " + MIN_RADIUS + ", but was " + maxRadius);
				checkProbability("pWhite", pWhite);
				checkProbability("pBlack", pBlack);
			}

			@Override
			public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
				FilterTraversal.checkProgressRange(maxPercent, offset);
				var random = createRandom();
				var output = RgbImages.copyOf(source);
				int width = source.getWidth();
				int height = source.getHeight();
				for (int i = 0; i < numberOfCircles; i++) {
					monitor.reportProgress(FilterTraversal.progress(i, numberOfCircles, maxPercent, offset));
					if (monitor.isCancelRequested()) {
						logger.debug("Noise circles cancelled after {}/{} circles", i, numberOfCircles);
						return FilterResult.cancelled();
					}
					int centerX = nextInt(random, 0, width);
					int centerY = nextInt(random, 0, height);
					int radius = nextInt(random, MIN_RADIUS, maxRadius);

					// The second number is only drawn if the circle is not white
					Integer color = null;
					if (random.nextDouble() < pWhite)
						color = ColorTools.WHITE;
					else if (random.nextDouble() < pBlack)
						color = ColorTools.BLACK;

					if (color != null)
						drawCircle(output, centerX, centerY, radius, color);
				}
				return FilterResult.completed(output);
			}

			private static void drawCircle(RgbImage image, int centerX, int centerY, int radius, int rgb) {
				for (int angle = 0; angle < 360; angle++) {
					double theta = Math.toRadians(angle);
					int x = centerX + (int)Math.round(radius * Math.cos(theta));
					int y = centerY + (int)Math.round(radius * Math.sin(theta));
					if (x >= 0 && x < image.getWidth() && y >= 0 && y < image.getHeight())
						image.setRGB(x, y, rgb);
				}
			}

			@Override
			public String toString() {
				return "Noise circles (numberOfCircles=" + numberOfCircles + ", maxRadius=" + maxRadius +
						", pWhite=" + pWhite + ", pBlack=" + pBlack + ")";
			}

		}

	}


	/**
	 * Filters that combine other filters.
	 */
	@FilterType("core")
	public static class Core {

		/**
		 * Apply filters in order, passing the output of each to the next.
		 * @param filters
		 * @return
		 */
		public static ImageFilter sequential(ImageFilter... filters) {
			return sequential(Arrays.asList(filters));
		}

		/**
		 * Apply filters in order, passing the output of each to the next.
		 * <p>
		 * The progress range is split evenly between the filters, and the first cancelled result ends the sequence.
		 * @param filters
		 * @return
		 */
		public static ImageFilter sequential(Collection<? extends ImageFilter> filters) {
			return new SequentialFilter(filters);
		}

		@FilterType("sequential")
		static class SequentialFilter implements ValidatedFilter {

			private List<ImageFilter> filters;

			SequentialFilter(Collection<? extends ImageFilter> filters) {
				this.filters = new ArrayList<>(filters);
				validate();
			}

			/**
			 * Filters within the sequence are checked as they are read, so only nulls need to be checked here.
			 */
			@Override
			public void validate() {
				Objects.requireNonNull(filters, "Filters must not be null!");
				for (var f : filters)
					Objects.requireNonNull(f, "Filters must not be null!");
			}

			@Override
			public FilterResult processImage(RgbImage source, ProgressMonitor monitor, int maxPercent, int offset) {
				FilterTraversal.checkProgressRange(maxPercent, offset);
				int n = filters.size();
				if (n == 0)
					return FilterResult.completed(RgbImages.copyOf(source));
				var image = source;
				for (int i = 0; i < n; i++) {
					int start = FilterTraversal.progress(i, n, maxPercent, offset);
					int end = FilterTraversal.progress(i + 1, n, maxPercent, offset);
					var filter = filters.get(i);
					logger.debug("Applying {} ({}/{})", filter, i + 1, n);
					var result = filter.processImage(image, monitor, end - start, start);
					if (result.isCancelled())
						return result;
					image = result.getImage();
				}
				return FilterResult.completed(image);
			}

			@Override
			public String toString() {
				return "Sequential " + filters;
			}

		}

	}

}
