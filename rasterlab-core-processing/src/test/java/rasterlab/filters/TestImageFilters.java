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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import rasterlab.lib.common.ColorTools;
import rasterlab.lib.images.RgbImage;
import rasterlab.lib.images.RgbImages;
import rasterlab.lib.tasks.ProgressMonitor;

@SuppressWarnings("javadoc")
public class TestImageFilters {

	private static RgbImage gray(int width, int height, int value) {
		return RgbImages.createFilledImage(width, height, ColorTools.packRGB(value, value, value));
	}

	private static RgbImage apply(ImageFilter filter, RgbImage img) {
		var result = filter.processImage(img, ProgressMonitor.NONE);
		assertFalse(result.isCancelled());
		return result.getImage();
	}

	static Stream<Arguments> provideFilters() {
		return Stream.of(
				Arguments.of(ImageFilters.Pointwise.negative()),
				Arguments.of(ImageFilters.Pointwise.grayscale()),
				Arguments.of(ImageFilters.Pointwise.brighten(50)),
				Arguments.of(ImageFilters.Pointwise.darken(50)),
				Arguments.of(ImageFilters.Global.increaseContrast(2.0)),
				Arguments.of(ImageFilters.Global.decreaseContrast(2.0)),
				Arguments.of(ImageFilters.Filters.gaussianBlur()),
				Arguments.of(ImageFilters.Filters.sharpen()),
				Arguments.of(ImageFilters.Filters.median()),
				Arguments.of(ImageFilters.Filters.median(2)),
				Arguments.of(ImageFilters.Filters.contour()),
				Arguments.of(ImageFilters.Filters.waves()),
				Arguments.of(ImageFilters.Noise.dots(42L)),
				Arguments.of(ImageFilters.Noise.lines(5, 20, 42L)),
				Arguments.of(ImageFilters.Noise.circles(100, 10, 0.5, 0.5, 42L))
				);
	}

	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_sizeAndSourceUnchanged(ImageFilter filter) {
		var img = TestFilterTraversal.createRandomImage(13, 9, 100L);
		var copy = RgbImages.copyOf(img);
		var output = apply(filter, img);
		assertNotSame(img, output);
		assertEquals(img.getWidth(), output.getWidth());
		assertEquals(img.getHeight(), output.getHeight());
		assertTrue(RgbImages.sameRGB(copy, img), "Source image was modified by " + filter);
	}

	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_cancelBeforeStart(ImageFilter filter) {
		var img = TestFilterTraversal.createRandomImage(8, 8, 101L);
		var copy = RgbImages.copyOf(img);
		var result = filter.processImage(img, RecordingProgressMonitor.alwaysCancel());
		assertTrue(result.isCancelled(), filter + " should be cancelled");
		assertTrue(RgbImages.sameRGB(copy, img));
	}

	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_progressIsMonotonic(ImageFilter filter) {
		var img = TestFilterTraversal.createRandomImage(11, 6, 102L);
		var monitor = RecordingProgressMonitor.neverCancel();
		filter.processImage(img, monitor);
		assertFalse(monitor.getProgress().isEmpty());
		assertTrue(monitor.isMonotonic());
		for (int p : monitor.getProgress())
			assertTrue(p >= 0 && p <= 100);
	}

	@Test
	public void test_negative() {
		int[] rgb = {
				ColorTools.packRGB(10, 10, 10), ColorTools.packRGB(250, 250, 250),
				ColorTools.packRGB(0, 0, 0), ColorTools.packRGB(128, 128, 128)
		};
		var output = apply(ImageFilters.Pointwise.negative(), RgbImages.createImage(rgb, 2, 2));
		assertEquals(ColorTools.packRGB(245, 245, 245), output.getRGB(0, 0));
		assertEquals(ColorTools.packRGB(5, 5, 5), output.getRGB(1, 0));
		assertEquals(ColorTools.packRGB(255, 255, 255), output.getRGB(0, 1));
		assertEquals(ColorTools.packRGB(127, 127, 127), output.getRGB(1, 1));
	}

	@Test
	public void test_negativeIsSelfInverse() {
		var img = TestFilterTraversal.createRandomImage(20, 15, 1L);
		var filter = ImageFilters.Pointwise.negative();
		var once = apply(filter, img);
		assertEquals(255 - ColorTools.green(img.getRGB(3, 4)), ColorTools.green(once.getRGB(3, 4)));
		assertTrue(RgbImages.sameRGB(img, apply(filter, once)));
	}

	@Test
	public void test_grayscale() {
		var img = TestFilterTraversal.createRandomImage(20, 15, 2L);
		var filter = ImageFilters.Pointwise.grayscale();
		var output = apply(filter, img);
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				int rgb = output.getRGB(x, y);
				assertEquals(ColorTools.red(rgb), ColorTools.green(rgb));
				assertEquals(ColorTools.red(rgb), ColorTools.blue(rgb));
				assertEquals(ColorTools.luminance(img.getRGB(x, y)), ColorTools.red(rgb));
			}
		}
		assertTrue(RgbImages.sameRGB(output, apply(filter, output)));

		var single = apply(filter, RgbImages.createFilledImage(1, 1, ColorTools.packRGB(10, 20, 30)));
		assertEquals(ColorTools.packRGB(18, 18, 18), single.getRGB(0, 0));
	}

	@Test
	public void test_brightness() {
		var img = TestFilterTraversal.createRandomImage(10, 10, 3L);
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Pointwise.brightness(0), img)));

		var src = RgbImages.createFilledImage(1, 1, ColorTools.packRGB(10, 100, 250));
		assertEquals(ColorTools.packRGB(30, 120, 255), apply(ImageFilters.Pointwise.brighten(20), src).getRGB(0, 0));
		assertEquals(ColorTools.packRGB(0, 80, 230), apply(ImageFilters.Pointwise.darken(20), src).getRGB(0, 0));
	}

	@Test
	public void test_contrastIdentity() {
		var img = TestFilterTraversal.createRandomImage(17, 11, 4L);
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Global.contrast(1.0), img)));
	}

	@Test
	public void test_contrast() {
		int[] rgb = {ColorTools.packRGB(100, 100, 100), ColorTools.packRGB(200, 200, 200)};
		var img = RgbImages.createImage(rgb, 2, 1);
		assertEquals(150, GlobalStatisticFilter.meanBrightness(img, ProgressMonitor.NONE, 100, 0));

		var increased = apply(ImageFilters.Global.increaseContrast(2.0), img);
		assertEquals(ColorTools.packRGB(50, 50, 50), increased.getRGB(0, 0));
		assertEquals(ColorTools.packRGB(250, 250, 250), increased.getRGB(1, 0));

		var decreased = apply(ImageFilters.Global.decreaseContrast(2.0), img);
		assertEquals(ColorTools.packRGB(125, 125, 125), decreased.getRGB(0, 0));
		assertEquals(ColorTools.packRGB(175, 175, 175), decreased.getRGB(1, 0));

		var clipped = apply(ImageFilters.Global.contrast(10.0), img);
		assertEquals(ColorTools.BLACK, clipped.getRGB(0, 0));
		assertEquals(ColorTools.WHITE, clipped.getRGB(1, 0));

		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Global.decreaseContrast(0));
		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Global.contrast(Double.NaN));
	}

	@Test
	public void test_meanBrightnessTruncates() {
		// Pixel means are 0 (1/3) and 1 (5/3), and the image mean 1/2 also truncates to 0
		int[] rgb = {ColorTools.packRGB(1, 0, 0), ColorTools.packRGB(2, 2, 1)};
		assertEquals(0, GlobalStatisticFilter.meanBrightness(RgbImages.createImage(rgb, 2, 1), ProgressMonitor.NONE, 100, 0));
	}

	@Test
	public void test_contrastProgress() {
		var img = gray(4, 2, 100);
		var monitor = RecordingProgressMonitor.neverCancel();
		ImageFilters.Global.contrast(2.0).processImage(img, monitor);
		assertEquals(List.of(0, 12, 25, 37, 50, 62, 75, 87), monitor.getProgress());
	}

	@Test
	public void test_contrastCancelledWhileComputingStatistic() {
		var img = gray(4, 4, 100);
		var filter = ImageFilters.Global.contrast(2.0);
		assertTrue(RgbImages.sameRGB(img, apply(filter, img)));

		// Cancellation seen only while computing the mean means the mean becomes 0, and processing continues
		var monitor = RecordingProgressMonitor.cancelOnlyAt(0);
		var result = filter.processImage(img, monitor);
		assertFalse(result.isCancelled());
		assertTrue(RgbImages.sameRGB(gray(4, 4, 200), result.getImage()));
		assertEquals(List.of(0, 50, 62, 75, 87), monitor.getProgress());

		// Persistent cancellation is seen again when applying the contrast
		var persistent = RecordingProgressMonitor.cancelFrom(1);
		assertTrue(filter.processImage(img, persistent).isCancelled());
		assertEquals(List.of(0, 12, 50), persistent.getProgress());
	}

	@Test
	public void test_uniformUnchangedBySharpenAndGaussian() {
		var img = gray(3, 3, 128);
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Filters.sharpen(), img)));
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Filters.gaussianBlur(), img)));
		for (int value : new int[] {0, 1, 77, 128, 254, 255}) {
			var uniform = gray(9, 5, value);
			assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.gaussianBlur(2, 0.7), uniform)));
			assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.gaussianBlur(5, 3.3), uniform)));
		}
	}

	@Test
	public void test_convolutionTruncatesAndClips() {
		var img = RgbImages.createFilledImage(2, 2, ColorTools.packRGB(3, 100, 200));
		var half = apply(ImageFilters.Filters.convolve(Kernel.create(new double[][] {{0.5}})), img);
		assertEquals(ColorTools.packRGB(1, 50, 100), half.getRGB(0, 0));

		var negative = apply(ImageFilters.Filters.convolve(Kernel.create(new double[][] {{-0.5}})), img);
		assertEquals(ColorTools.BLACK, negative.getRGB(1, 1));

		var doubled = apply(ImageFilters.Filters.convolve(Kernel.create(new double[][] {{2}})), img);
		assertEquals(ColorTools.packRGB(6, 200, 255), doubled.getRGB(1, 0));

		assertEquals(127, ImageFilters.Filters.ConvolutionFilter.truncate(127.9));
		assertEquals(128, ImageFilters.Filters.ConvolutionFilter.truncate(127.99999999999997));
		assertEquals(-1, ImageFilters.Filters.ConvolutionFilter.truncate(-1.5));
	}

	@Test
	public void test_convolutionEdgeClamp() {
		// Horizontal kernel taking the pixel to the left
		var kernel = Kernel.create(new double[][] {{1, 0, 0}});
		int[] rgb = {ColorTools.packRGB(10, 0, 0), ColorTools.packRGB(20, 0, 0), ColorTools.packRGB(30, 0, 0)};
		var output = apply(ImageFilters.Filters.convolve(kernel), RgbImages.createImage(rgb, 3, 1));
		assertEquals(10, ColorTools.red(output.getRGB(0, 0)));
		assertEquals(10, ColorTools.red(output.getRGB(1, 0)));
		assertEquals(20, ColorTools.red(output.getRGB(2, 0)));

		// Vertical kernel taking the pixel below
		var vertical = Kernel.create(new double[][] {{0}, {0}, {1}});
		var column = RgbImages.createImage(rgb, 1, 3);
		var outputVertical = apply(ImageFilters.Filters.convolve(vertical), column);
		assertEquals(20, ColorTools.red(outputVertical.getRGB(0, 0)));
		assertEquals(30, ColorTools.red(outputVertical.getRGB(0, 1)));
		assertEquals(30, ColorTools.red(outputVertical.getRGB(0, 2)));
	}

	@Test
	public void test_median() {
		var uniform = RgbImages.createFilledImage(6, 4, ColorTools.packRGB(12, 34, 56));
		assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.median(), uniform)));
		assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.median(3), uniform)));

		var img = gray(5, 5, 0);
		img.setRGB(2, 2, ColorTools.WHITE);
		var output = apply(ImageFilters.Filters.median(), img);
		assertTrue(RgbImages.sameRGB(gray(5, 5, 0), output));

		// Radius 0 is the identity
		var random = TestFilterTraversal.createRandomImage(7, 7, 5L);
		assertTrue(RgbImages.sameRGB(random, apply(ImageFilters.Filters.median(0), random)));

		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Filters.median(-1));
	}

	@Test
	public void test_medianChannelsIndependent() {
		// Each channel has a different median pixel
		int[] rgb = {
				ColorTools.packRGB(0, 9, 5),
				ColorTools.packRGB(5, 0, 9),
				ColorTools.packRGB(9, 5, 0)
		};
		var output = apply(ImageFilters.Filters.median(1), RgbImages.createImage(rgb, 3, 1));
		// Window at the center pixel is 3 copies of the row, so the median of each channel is its middle value
		assertEquals(ColorTools.packRGB(5, 5, 5), output.getRGB(1, 0));
	}

	@Test
	public void test_contour() {
		int[] rgb = {
				ColorTools.BLACK, ColorTools.BLACK,
				ColorTools.WHITE, ColorTools.WHITE
		};
		var output = apply(ImageFilters.Filters.contour(), RgbImages.createImage(rgb, 4, 1));
		assertEquals(ColorTools.BLACK, output.getRGB(0, 0));
		assertEquals(ImageFilters.Filters.CONTOUR_COLOR, output.getRGB(1, 0));
		assertEquals(ImageFilters.Filters.CONTOUR_COLOR, output.getRGB(2, 0));
		assertEquals(ColorTools.WHITE, output.getRGB(3, 0));

		// Differences must be strictly greater than the threshold
		int[] close = {ColorTools.packRGB(100, 100, 100), ColorTools.packRGB(110, 90, 100)};
		var outputClose = apply(ImageFilters.Filters.contour(), RgbImages.createImage(close, 1, 2));
		assertTrue(RgbImages.sameRGB(RgbImages.createImage(close.clone(), 1, 2), outputClose));

		int[] far = {ColorTools.packRGB(100, 100, 100), ColorTools.packRGB(100, 100, 111)};
		var outputFar = apply(ImageFilters.Filters.contour(), RgbImages.createImage(far, 1, 2));
		assertEquals(ImageFilters.Filters.CONTOUR_COLOR, outputFar.getRGB(0, 0));
		assertEquals(ImageFilters.Filters.CONTOUR_COLOR, outputFar.getRGB(0, 1));

		var uniform = gray(5, 5, 50);
		assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.contour(), uniform)));
	}

	@Test
	public void test_waves() {
		int width = 40;
		int[] rgb = new int[width * 10];
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < width; x++)
				rgb[y * width + x] = ColorTools.packRGB(x, y, 0);
		}
		var img = RgbImages.createImage(rgb, width, 10);
		var output = apply(ImageFilters.Filters.waves(), img);
		// sin(0) = 0, so the first row is unchanged
		for (int x = 0; x < width; x++)
			assertEquals(img.getRGB(x, 0), output.getRGB(x, 0));
		// 20 * sin(2 * pi * 7 / 30) = 19.89
		assertEquals(ColorTools.packRGB(19, 7, 0), output.getRGB(0, 7));
		assertEquals(ColorTools.packRGB(39, 7, 0), output.getRGB(30, 7));

		var uniform = gray(10, 50, 90);
		assertTrue(RgbImages.sameRGB(uniform, apply(ImageFilters.Filters.waves(), uniform)));
		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Filters.waves(20, 0));
	}

	@Test
	public void test_noiseDots() {
		var img = TestFilterTraversal.createRandomImage(30, 20, 6L);
		assertTrue(RgbImages.sameRGB(RgbImages.createFilledImage(30, 20, ColorTools.WHITE),
				apply(ImageFilters.Noise.dots(1.0, 0.0, 1L), img)));
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Noise.dots(0.0, 0.0, 1L), img)));

		var output = apply(ImageFilters.Noise.dots(0.1, 0.1, 7L), img);
		int changed = 0;
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				int rgb = output.getRGB(x, y);
				if (rgb != img.getRGB(x, y)) {
					changed++;
					assertTrue(rgb == ColorTools.WHITE || rgb == ColorTools.BLACK);
				}
			}
		}
		assertTrue(changed > 0);

		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.dots(1.5, 0, 1L));
		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.dots(0, -0.1, 1L));
	}

	@Test
	public void test_noiseIsReproducible() {
		var img = gray(40, 30, 128);
		assertTrue(RgbImages.sameRGB(
				apply(ImageFilters.Noise.dots(99L), img),
				apply(ImageFilters.Noise.dots(99L), img)));
		assertTrue(RgbImages.sameRGB(
				apply(ImageFilters.Noise.lines(99L), img),
				apply(ImageFilters.Noise.lines(99L), img)));
		assertTrue(RgbImages.sameRGB(
				apply(ImageFilters.Noise.circles(99L), img),
				apply(ImageFilters.Noise.circles(99L), img)));

		// Each invocation starts a new generator from the seed
		var filter = ImageFilters.Noise.dots(0.3, 0.3, 99L);
		assertTrue(RgbImages.sameRGB(apply(filter, img), apply(filter, img)));
		assertFalse(RgbImages.sameRGB(apply(filter, img), apply(ImageFilters.Noise.dots(0.3, 0.3, 100L), img)));
	}

	@Test
	public void test_noiseLines() {
		var img = gray(50, 50, 128);
		var output = apply(ImageFilters.Noise.lines(2, 15, 8L), img);
		int changed = 0;
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				int rgb = output.getRGB(x, y);
				if (rgb != img.getRGB(x, y)) {
					changed++;
					assertTrue(rgb == ColorTools.WHITE || rgb == ColorTools.BLACK);
				}
			}
		}
		assertTrue(changed > 0);

		// No lines means an unchanged copy
		var none = apply(ImageFilters.Noise.lines(0, 40, 8L), img);
		assertNotSame(img, none);
		assertTrue(RgbImages.sameRGB(img, none));

		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.lines(10, 10, 1L));
		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.lines(-1, 40, 1L));
	}

	@Test
	public void test_noiseLinesCancelled() {
		var img = gray(20, 20, 128);
		var monitor = RecordingProgressMonitor.cancelFrom(3);
		var result = ImageFilters.Noise.lines(10, 20, 1L).processImage(img, monitor);
		assertTrue(result.isCancelled());
		assertEquals(List.of(0, 10, 20, 30), monitor.getProgress());
	}

	@Test
	public void test_noiseCircles() {
		var img = gray(60, 60, 128);
		var white = apply(ImageFilters.Noise.circles(20, 15, 1.0, 0.0, 9L), img);
		var black = apply(ImageFilters.Noise.circles(20, 15, 0.0, 1.0, 9L), img);
		int changedWhite = 0;
		int changedBlack = 0;
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				int w = white.getRGB(x, y);
				int b = black.getRGB(x, y);
				if (w != img.getRGB(x, y)) {
					assertEquals(ColorTools.WHITE, w);
					changedWhite++;
				}
				if (b != img.getRGB(x, y)) {
					assertEquals(ColorTools.BLACK, b);
					changedBlack++;
				}
			}
		}
		assertTrue(changedWhite > 0);
		assertTrue(changedBlack > 0);

		// All circles skipped
		assertTrue(RgbImages.sameRGB(img, apply(ImageFilters.Noise.circles(20, 15, 0.0, 0.0, 9L), img)));

		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.circles(10, 5, 0.5, 0.5, 1L));
		assertThrows(IllegalArgumentException.class, () -> ImageFilters.Noise.circles(10, 10, 2.0, 0.5, 1L));
	}

	@Test
	public void test_singleCircle() {
		// Radius must be 5, so the outline fits within an 11x11 box
		var img = gray(100, 100, 0);
		var output = apply(ImageFilters.Noise.circles(1, 6, 1.0, 0.0, 10L), img);
		int count = 0;
		int minX = Integer.MAX_VALUE, maxX = -1;
		int minY = Integer.MAX_VALUE, maxY = -1;
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				if (output.getRGB(x, y) == ColorTools.WHITE) {
					count++;
					minX = Math.min(minX, x);
					maxX = Math.max(maxX, x);
					minY = Math.min(minY, y);
					maxY = Math.max(maxY, y);
				}
			}
		}
		assertTrue(count > 1);
		assertTrue(count < 360);
		assertTrue(maxX - minX <= 10);
		assertTrue(maxY - minY <= 10);

		// Points are rounded, so (4, 3) from the center is on the outline at 37 degrees.
		// Truncation would give (3, 3) instead, and never reach (4, 3).
		var random = new Random(10L);
		int cx = random.nextInt(100);
		int cy = random.nextInt(100);
		int dx = cx + 4 < 100 ? 4 : -4;
		int dy = cy + 3 < 100 ? 3 : -3;
		assertEquals(ColorTools.WHITE, output.getRGB(cx + dx, cy + dy));
		assertEquals(ColorTools.WHITE, output.getRGB(cx + (cx + 5 < 100 ? 5 : -5), cy));
	}

	@Test
	public void test_noiseDotsExact() {
		var img = TestFilterTraversal.createRandomImage(17, 11, 20L);
		var expected = RgbImages.copyOf(img);
		// One draw per pixel in column order, used for both the white and black tests
		var random = new Random(21L);
		for (int x = 0; x < img.getWidth(); x++) {
			for (int y = 0; y < img.getHeight(); y++) {
				double p = random.nextDouble();
				if (p < 0.3)
					expected.setRGB(x, y, ColorTools.WHITE);
				else if (p + 0.4 > 1)
					expected.setRGB(x, y, ColorTools.BLACK);
			}
		}
		assertTrue(RgbImages.sameRGB(expected, apply(ImageFilters.Noise.dots(0.3, 0.4, 21L), img)));
	}

	private static RgbImage drawExpectedLines(RgbImage img, int nSegments, int maxLength, long seed) {
		var expected = RgbImages.copyOf(img);
		int width = img.getWidth();
		int height = img.getHeight();
		var random = new Random(seed);
		for (int s = 0; s < nSegments; s++) {
			int startX = random.nextInt(width);
			int startY = random.nextInt(height);
			double angle = random.nextDouble() * 2 * Math.PI;
			int length = 10 + random.nextInt(maxLength - 10);
			int rgb = random.nextInt(2) == 0 ? ColorTools.BLACK : ColorTools.WHITE;
			for (int i = 0; i < length; i++) {
				int x = startX + (int)(i * Math.cos(angle));
				int y = startY + (int)(i * Math.sin(angle));
				if (x < 0 || x >= width || y < 0 || y >= height)
					break;
				expected.setRGB(x, y, rgb);
			}
		}
		return expected;
	}

	@Test
	public void test_noiseLinesExact() {
		var img = gray(40, 30, 128);
		var output = apply(ImageFilters.Noise.lines(3, 15, 22L), img);
		// numberOfLines * maxLength segments are drawn
		assertTrue(RgbImages.sameRGB(drawExpectedLines(img, 3 * 15, 15, 22L), output));
		assertFalse(RgbImages.sameRGB(drawExpectedLines(img, 3, 15, 22L), output));

		var single = apply(ImageFilters.Noise.lines(1, 11, 23L), img);
		assertTrue(RgbImages.sameRGB(drawExpectedLines(img, 11, 11, 23L), single));
	}

	private static RgbImage drawExpectedCircles(RgbImage img, int nCircles, int maxRadius, double pWhite, double pBlack, long seed) {
		var expected = RgbImages.copyOf(img);
		int width = img.getWidth();
		int height = img.getHeight();
		var random = new Random(seed);
		for (int c = 0; c < nCircles; c++) {
			int cx = random.nextInt(width);
			int cy = random.nextInt(height);
			int r = 5 + random.nextInt(maxRadius - 5);
			int rgb;
			// The black test draws only when the circle is not white
			if (random.nextDouble() < pWhite)
				rgb = ColorTools.WHITE;
			else if (random.nextDouble() < pBlack)
				rgb = ColorTools.BLACK;
			else
				continue;
			for (int angle = 0; angle < 360; angle++) {
				int x = cx + (int)Math.round(r * Math.cos(Math.toRadians(angle)));
				int y = cy + (int)Math.round(r * Math.sin(Math.toRadians(angle)));
				if (x >= 0 && x < width && y >= 0 && y < height)
					expected.setRGB(x, y, rgb);
			}
		}
		return expected;
	}

	@Test
	public void test_noiseCirclesExact() {
		var img = gray(50, 40, 128);
		var output = apply(ImageFilters.Noise.circles(30, 12, 0.3, 0.5, 24L), img);
		assertTrue(RgbImages.sameRGB(drawExpectedCircles(img, 30, 12, 0.3, 0.5, 24L), output));

		var defaults = apply(ImageFilters.Noise.circles(25L), img);
		assertTrue(RgbImages.sameRGB(drawExpectedCircles(img, 1000, 30, 0.5, 0.5, 25L), defaults));
	}

}
