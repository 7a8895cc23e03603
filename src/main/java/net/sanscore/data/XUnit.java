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

package net.sanscore.data;

/**
 * Units of the x-axis of a {@link Workspace}.
 *
 * @author SANS-Core developers
 */
public enum XUnit {

	TOF("TOF", "microsecond"),
	WAVELENGTH("Wavelength", "Angstrom"),
	MOMENTUM_TRANSFER("MomentumTransfer", "Angstrom^-1");

	private final String label;
	private final String unit;

	XUnit(final String label, final String unit) {
		this.label = label;
		this.unit = unit;
	}

	public String label() {
		return label;
	}

	public String unit() {
		return unit;
	}

	@Override
	public String toString() {
		return label + " (" + unit + ")";
	}
}
