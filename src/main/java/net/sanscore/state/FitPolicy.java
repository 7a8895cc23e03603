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
 * How the relative scale and shift of the two detector banks are determined
 * when they are merged.
 *
 * @author SANS-Core developers
 */
public enum FitPolicy {

	/** Scale and shift are taken verbatim from the configuration. */
	NO_FIT,
	/** Scale and shift are both fitted. */
	BOTH,
	/** Scale is fixed, shift is fitted. */
	SHIFT_ONLY,
	/** Shift is fixed, scale is fitted. */
	SCALE_ONLY;

	public boolean requiresFit() {
		return this != NO_FIT;
	}

	public boolean fitsScale() {
		return this == BOTH || this == SCALE_ONLY;
	}

	public boolean fitsShift() {
		return this == BOTH || this == SHIFT_ONLY;
	}

	/** Maps the legacy pair of fit flags onto a policy. */
	public static FitPolicy of(final boolean fitScale, final boolean fitShift) {
		if (fitScale && fitShift) return BOTH;
		if (fitScale) return SCALE_ONLY;
		if (fitShift) return SHIFT_ONLY;
		return NO_FIT;
	}
}
