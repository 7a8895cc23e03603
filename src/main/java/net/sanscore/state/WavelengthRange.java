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
 * A wavelength interval [min, max], in Angstrom.
 */
public record WavelengthRange(double min, double max) {

	public WavelengthRange {
		if (!(min > 0) || !(min < max))
			throw new ConfigurationException("Invalid wavelength range: [" + min + ", " + max + "]");
	}

	public boolean encloses(final WavelengthRange other) {
		return other.min >= min && other.max <= max;
	}

	public String label() {
		return min + "_" + max;
	}
}
