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
 * Inclusive range of spectrum numbers.
 */
public record SpectrumRange(int first, int last) {

	public SpectrumRange {
		if (first > last)
			throw new ConfigurationException("Inverted spectrum range: " + first + "-" + last);
	}

	public boolean contains(final int spectrumNumber) {
		return spectrumNumber >= first && spectrumNumber <= last;
	}

	public int size() {
		return last - first + 1;
	}

	public boolean overlaps(final SpectrumRange other) {
		return first <= other.last && other.first <= last;
	}
}
