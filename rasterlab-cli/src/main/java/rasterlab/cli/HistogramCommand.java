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
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import rasterlab.lib.analysis.stats.LuminanceHistogram;
import rasterlab.lib.images.RgbImages;

/**
 * Command to print the luminance histogram of an image.
 *
 * @author RasterLab developers
 */
@Command(name = "histogram", description = "Print the luminance histogram of an image as tab-separated values.")
public class HistogramCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(HistogramCommand.class);

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", description = "Path to the input image.", paramLabel = "input")
	private File inputFile;

	@Option(names = {"-z", "--include-zeros"}, description = "Include bins with a count of zero.")
	private boolean includeZeros;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() {
		try {
			var img = ImageIO.read(inputFile);
			if (img == null)
				throw new IOException("Unable to read image from " + inputFile);
			var histogram = LuminanceHistogram.compute(RgbImages.fromBufferedImage(img));
			logger.debug("Computed {}", histogram);
			write(histogram, spec.commandLine().getOut());
			return 0;
		} catch (IOException e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}

	void write(LuminanceHistogram histogram, PrintWriter writer) {
		writer.println("Bin\tCount\tPercentage");
		for (int i = 0; i < LuminanceHistogram.N_BINS; i++) {
			long count = histogram.getCount(i);
			if (count == 0 && !includeZeros)
				continue;
			writer.println(String.format(Locale.ROOT, "%d\t%d\t%.3f", i, count, histogram.getPercentage(i)));
		}
		writer.flush();
	}

}
