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

package rasterlab;

import java.io.File;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.RunLast;
import rasterlab.cli.ApplyCommand;
import rasterlab.cli.HistogramCommand;
import rasterlab.cli.LogManager;
import rasterlab.cli.LogManager.LogLevel;
import rasterlab.lib.common.GeneralTools;

/**
 * Main RasterLab launcher.
 *
 * @author RasterLab developers
 *
 */
@Command(name = "rasterlab", subcommands = {HelpCommand.class, ApplyCommand.class, HistogramCommand.class},
	footer = {"",
			"Copyright(c) RasterLab developers (2024-2026)"
			}, mixinStandardHelpOptions = true, versionProvider = RasterLab.VersionProvider.class)
public class RasterLab {

	private static final Logger logger = LoggerFactory.getLogger(RasterLab.class);

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;

	@Option(names = {"--log-file"}, description = "Also write log messages to the specified file.", paramLabel = "file")
	private File logFile;

	/**
	 * Main class to launch RasterLab.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = execute(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run the requested subcommand, without calling {@code System.exit}.
	 *
	 * @param args
	 * @return the exit code
	 */
	public static int execute(String... args) {
		var cmd = createCommandLine();
		return cmd.execute(args);
	}

	static CommandLine createCommandLine() {
		var rasterlab = new RasterLab();
		var cmd = new CommandLine(rasterlab);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		cmd.setExecutionStrategy(parseResult -> {
			rasterlab.configureLogging();
			return executeSubcommand(cmd, parseResult);
		});
		return cmd;
	}

	private static int executeSubcommand(CommandLine cmd, ParseResult parseResult) {
		if (!parseResult.hasSubcommand() && !cmd.isUsageHelpRequested() && !cmd.isVersionHelpRequested()) {
			logger.error("No command specified, please type -h to display help message.");
			cmd.usage(cmd.getErr());
			return cmd.getCommandSpec().exitCodeOnInvalidInput();
		}
		return new RunLast().execute(parseResult);
	}

	private void configureLogging() {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		if (logFile != null)
			LogManager.logToFile(logFile);
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = GeneralTools.getPackageVersion(RasterLab.class);
			var strings = new ArrayList<String>();
			if (version != null) {
				if (!version.startsWith("v"))
					version = "v" + version;
				strings.add("RasterLab " + version);
			}
			strings.add("Java " + System.getProperty("java.version"));
			if (version == null)
				strings.add(0, "Unknown RasterLab version!");
			return strings.toArray(String[]::new);
		}

	}

}
