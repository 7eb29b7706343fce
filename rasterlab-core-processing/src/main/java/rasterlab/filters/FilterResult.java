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

import java.util.Objects;
import java.util.Optional;

import rasterlab.lib.images.RgbImage;

/**
 * The outcome of applying an {@link ImageFilter}: either a newly created image, or cancellation.
 * <p>
 * A cancelled result never carries a partially-filled image.
 *
 * @author RasterLab developers
 */
public final class FilterResult {

	private static final FilterResult CANCELLED = new FilterResult(null);

	private final RgbImage image;

	private FilterResult(RgbImage image) {
		this.image = image;
	}

	/**
	 * Create a result for a filter that ran to completion.
	 * @param image the output image
	 * @return
	 */
	public static FilterResult completed(RgbImage image) {
		Objects.requireNonNull(image, "Completed result requires an image!");
		return new FilterResult(image);
	}

	/**
	 * Get the result for a filter that was cancelled before completion.
	 * @return
	 */
	public static FilterResult cancelled() {
		return CANCELLED;
	}

	/**
	 * Returns true if the filter was cancelled, and so no image is available.
	 * @return
	 */
	public boolean isCancelled() {
		return image == null;
	}

	/**
	 * Get the output image.
	 * @return
	 * @throws IllegalStateException if the filter was cancelled
	 * @see #getImageOptional()
	 */
	public RgbImage getImage() throws IllegalStateException {
		if (image == null)
			throw new IllegalStateException("No image available - filter was cancelled");
		return image;
	}

	/**
	 * Get the output image, or an empty optional if the filter was cancelled.
	 * @return
	 */
	public Optional<RgbImage> getImageOptional() {
		return Optional.ofNullable(image);
	}

	@Override
	public String toString() {
		return isCancelled() ? "FilterResult[cancelled]" : "FilterResult[" + image + "]";
	}

}
