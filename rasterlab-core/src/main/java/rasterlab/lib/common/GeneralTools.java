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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of generally useful static methods.
 *
 * @author RasterLab developers
 *
 */
public final class GeneralTools {

	private static final Logger logger = LoggerFactory.getLogger(GeneralTools.class);

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Try to determine the version of a jar containing a specified class.
	 * This first checks the implementation version in the package, then looks for a VERSION
	 * file stored as a resource.
	 *
	 * @param cls
	 * @return the version, if available, or null if no version is known.
	 */
	public static String getPackageVersion(Class<?> cls) {
		String version = cls.getPackage() == null ? null : cls.getPackage().getImplementationVersion();
		if (version == null) {
			try (var stream = cls.getResourceAsStream("/VERSION")) {
				if (stream != null)
					version = readInputStreamAsString(stream);
			} catch (IOException e) {
				logger.error("Error reading version: " + e.getLocalizedMessage(), e);
			}
		}
		if (version == null || version.isBlank())
			return null;
		return version.strip();
	}

	/**
	 * Read the contents of an input stream as a UTF-8 String.
	 * @param stream
	 * @return
	 * @throws IOException
	 */
	public static String readInputStreamAsString(final InputStream stream) throws IOException {
		return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

}
