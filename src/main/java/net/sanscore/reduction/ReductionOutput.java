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

package net.sanscore.reduction;

import net.sanscore.analysis.merge.MergeResult;
import net.sanscore.data.Workspace;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;

/**
 * A reduced profile produced by a run.
 *
 * @param name            the output name
 * @param component       the detector bank, or null for a merged profile
 * @param timeSlice       the time slice
 * @param wavelengthRange the wavelength range
 * @param intensity       the (can-subtracted, if a can was given) intensity
 * @param merge           the merge details of a merged profile, or null
 * @author SANS-Core developers
 */
public record ReductionOutput(String name, DetectorComponent component, TimeSlice timeSlice,
		WavelengthRange wavelengthRange, Workspace intensity, MergeResult merge) {

	public boolean isMerged() {
		return merge != null;
	}
}
