/*-
 * #%L
 * SANS-Core: numeric reduction of small-angle scattering data.
 * %%
 * Copyright (C) 2024 - 2026 SANS-Core developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package net.sanscore.state;

/**
 * A time-of-flight interval [start, stop], in microseconds.
 *
 * @author SANS-Core developers
 */
public record TofWindow(double start, double stop) {

	public TofWindow {
		if (Double.isNaN(start) || Double.isNaN(stop) || !(start < stop))
			throw new ConfigurationException("Inverted or empty TOF window: [" + start + ", " + stop + "]");
	}

	/**
	 * Builds a window from optional bounds, as read from a configuration source.
	 *
	 * @return the window, or null if neither bound is supplied
	 * @throws ConfigurationException if only one bound is supplied or the bounds
	 *                                are inverted
	 */
	public static TofWindow of(final Double start, final Double stop) {
		if (start == null && stop == null) return null;
		if (start == null || stop == null)
			throw new ConfigurationException("TOF window requires both bounds (start=" + start + ", stop=" + stop + ")");
		return new TofWindow(start, stop);
	}

	public boolean contains(final double tof) {
		return tof >= start && tof <= stop;
	}
}
