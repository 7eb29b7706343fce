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

package rasterlab.lib.tasks;

/**
 * Interface for monitoring the progress of a long-running pixel operation.
 * <p>
 * Implementing classes receive progress notifications as the operation executes, and should display these in an appropriate way -
 * such as with a progress bar, or logging the progress.
 * Classes may also request cancellation, e.g. if the user presses a 'cancel' button.
 * Cancellation is cooperative: the operation polls {@link #isCancelRequested()} at its own checkpoints.
 *
 * @author RasterLab developers
 *
 */
public interface ProgressMonitor {

	/**
	 * A monitor that discards all progress and never requests cancellation.
	 */
	ProgressMonitor NONE = new ProgressMonitor() {

		@Override
		public void reportProgress(int percent) {}

		@Override
		public boolean isCancelRequested() {
			return false;
		}

		@Override
		public String toString() {
			return "ProgressMonitor.NONE";
		}

	};

	/**
	 * Update the current progress.
	 *
	 * @param percent progress in the range 0-100
	 */
	void reportProgress(int percent);

	/**
	 * Returns true if cancel has been requested, for example by the user pressing a 'cancel' button.
	 * @return
	 */
	boolean isCancelRequested();

}
