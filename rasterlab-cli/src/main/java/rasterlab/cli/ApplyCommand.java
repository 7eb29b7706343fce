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

package rasterlab.cli;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import rasterlab.filters.ImageFilter;
import rasterlab.filters.ImageFilters;
import rasterlab.filters.Kernels;
import rasterlab.lib.common.GeneralTools;
import rasterlab.lib.images.RgbImage;
import rasterlab.lib.images.RgbImages;
import rasterlab.lib.tasks.LoggingProgressMonitor;

/**
 * Command to apply one or more filters to an image file, and write the result.
 *
 * @author RasterLab developers
 */
@Command(name = "apply", description = {
		"Apply filters to an image and write the result.",
		"Filters may be named with --filter (applied in order) or read from a JSON file with --json."})
public class ApplyCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ApplyCommand.class);

	/**
	 * Named filters available from the command line.
	 */
	public static enum FilterName {
		/**
		 * Invert each channel
		 */
		NEGATIVE,
		/**
		 * Weighted luminance
		 */
		GRAYSCALE,
		/**
		 * Add --amount to each channel
		 */
		BRIGHTNESS,
		/**
		 * Scale about the mean brightness by --amount
		 */
		CONTRAST,
		/**
		 * Gaussian blur using --radius and --sigma
		 */
		GAUSSIAN,
		/**
		 * 3x3 sharpen
		 */
		SHARPEN,
		/**
		 * Median filter using --radius
		 */
		MEDIAN,
		/**
		 * Mark edges
		 */
		CONTOUR,
		/**
		 * Horizontal sine displacement
		 */
		WAVES,
		/**
		 * Random black and white pixels
		 */
		NOISE_DOTS,
		/**
		 * Random black and white lines
		 */
		NOISE_LINES,
		/**
		 * Random black and white circles
		 */
		NOISE_CIRCLES
	}

	@Parameters(index = "0", description = "Path to the input image.", paramLabel = "input")
	private File inputFile;

	@Parameters(index = "1", description = "Path to the output image. The format is determined from the file extension.", paramLabel = "output")
	private File outputFile;

	@Option(names = {"-f", "--filter"}, description = {"Filter to apply; may be used multiple times.", "Options: ${COMPLETION-CANDIDATES}"}, paramLabel = "filter")
	private List<FilterName> filterNames = new ArrayList<>();

	@Option(names = {"-j", "--json"}, description = "JSON file containing a filter definition, applied after any named filters.", paramLabel = "json")
	private File jsonFile;

	@Option(names = {"-a", "--amount"}, description = "Amount for brightness (default = 20) or contrast (default = 1.5) filters.", paramLabel = "amount")
	private Double amount;

	@Option(names = {"-r", "--radius"}, description = "Radius for Gaussian (default = 3) or median (default = 1) filters.", paramLabel = "radius")
	private Integer radius;

	@Option(names = {"-s", "--sigma"}, description = "Sigma for Gaussian filters (default = 2).", paramLabel = "sigma")
	private Double sigma;

	@Option(names = {"--seed"}, description = "Random seed for noise filters.", paramLabel = "seed")
	private Long seed;

	@Option(names = {"--save-json"}, description = "Write the filter definition to the specified JSON file.", paramLabel = "json")
	private File saveJsonFile;

	@Option(names = {"-o", "--overwrite"}, description = "Overwrite the output file if it exists.")
	private boolean overwrite;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	static final int DEFAULT_BRIGHTNESS = 20;
	static final double DEFAULT_CONTRAST = 1.5;

	@Override
	public Integer call() {
		try {
			checkFiles();
			var filter = buildFilter();
			if (saveJsonFile != null) {
				Files.writeString(saveJsonFile.toPath(), ImageFilters.toJson(filter), StandardCharsets.UTF_8);
				logger.info("Filter definition written to {}", saveJsonFile);
			}

			var img = ImageIO.read(inputFile);
			if (img == null)
				throw new IOException("Unable to read image from " + inputFile);
			RgbImage source = RgbImages.fromBufferedImage(img);
			logger.info("Read {} ({} x {})", inputFile.getName(), source.getWidth(), source.getHeight());

			var monitor = new LoggingProgressMonitor("Applying " + filter);
			var result = filter.processImage(source, monitor);
			if (result.isCancelled()) {
				logger.warn("Filter cancelled - no output written");
				return 1;
			}
			monitor.completed("Filter applied");

			String format = getFormat(outputFile);
			if (!ImageIO.write(RgbImages.toBufferedImage(result.getImage()), format, outputFile))
				throw new IOException("No writer available for format " + format);
			logger.info("Written {}", outputFile.getAbsolutePath());
			return 0;
		} catch (IOException | IllegalArgumentException | JsonParseException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	private void checkFiles() throws IOException {
		if (!inputFile.isFile())
			throw new IOException("Input file " + inputFile + " does not exist");
		if (outputFile.exists() && !overwrite)
			throw new IOException("Output file " + outputFile + " exists! Use --overwrite to replace it.");
		if (jsonFile != null && !jsonFile.isFile())
			throw new IOException("JSON file " + jsonFile + " does not exist");
	}

	ImageFilter buildFilter() throws IOException {
		var filters = new ArrayList<ImageFilter>();
		for (var name : filterNames)
			filters.add(createFilter(name));
		if (jsonFile != null) {
			try (var stream = new FileInputStream(jsonFile)) {
				filters.add(ImageFilters.fromJson(GeneralTools.readInputStreamAsString(stream)));
			}
		}
		if (filters.isEmpty())
			throw new IllegalArgumentException("No filter specified! Use --filter or --json.");
		if (filters.size() == 1)
			return filters.get(0);
		return ImageFilters.Core.sequential(filters);
	}

	ImageFilter createFilter(FilterName name) {
		long filterSeed = seed == null ? System.nanoTime() : seed;
		switch (name) {
		case NEGATIVE:
			return ImageFilters.Pointwise.negative();
		case GRAYSCALE:
			return ImageFilters.Pointwise.grayscale();
		case BRIGHTNESS:
			return ImageFilters.Pointwise.brightness(amount == null ? DEFAULT_BRIGHTNESS : (int)Math.round(amount));
		case CONTRAST:
			return ImageFilters.Global.contrast(amount == null ? DEFAULT_CONTRAST : amount);
		case GAUSSIAN:
			return ImageFilters.Filters.gaussianBlur(
					radius == null ? Kernels.DEFAULT_GAUSSIAN_RADIUS : radius,
					sigma == null ? Kernels.DEFAULT_GAUSSIAN_SIGMA : sigma);
		case SHARPEN:
			return ImageFilters.Filters.sharpen();
		case MEDIAN:
			return ImageFilters.Filters.median(radius == null ? ImageFilters.Filters.DEFAULT_MEDIAN_RADIUS : radius);
		case CONTOUR:
			return ImageFilters.Filters.contour();
		case WAVES:
			return ImageFilters.Filters.waves();
		case NOISE_DOTS:
			return ImageFilters.Noise.dots(filterSeed);
		case NOISE_LINES:
			return ImageFilters.Noise.lines(filterSeed);
		case NOISE_CIRCLES:
			return ImageFilters.Noise.circles(filterSeed);
		default:
			throw new IllegalArgumentException("Unsupported filter " + name);
		}
	}

	static String getFormat(File file) {
		String name = file.getName();
		int ind = name.lastIndexOf('.');
		if (ind < 0 || ind == name.length() - 1)
			return "png";
		String ext = name.substring(ind + 1).toLowerCase(Locale.ROOT);
		if (ext.equals("jpeg"))
			return "jpg";
		return ext;
	}

}
