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
 * A pulse-time interval [start, stop), in seconds relative to the run start,
 * used to slice event data.
 */
public record TimeSlice(double start, double stop) {

	/** The whole run. */
	public static final TimeSlice ALL = new TimeSlice(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

	public TimeSlice {
		if (Double.isNaN(start) || Double.isNaN(stop) || !(start < stop))
			throw new ConfigurationException("Invalid time slice: [" + start + ", " + stop + ")");
	}

	public boolean isWholeRun() {
		return Double.isInfinite(start) && Double.isInfinite(stop);
	}

	/** Identifier fragment used in output names, e.g. {@code _t0.0_T100.0}. */
	public String label() {
		return (isWholeRun()) ? "" : "_t" + start + "_T" + stop;
	}
}
