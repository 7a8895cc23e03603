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

package net.sanscore.analysis.reduction;

import net.sanscore.data.Spectrum;
import net.sanscore.data.XUnit;
import net.sanscore.io.RunData;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.DataType;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.MaskSpec;
import net.sanscore.state.ReductionState;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;

/**
 * What a single reduction produces: one detector component of one data type
 * in one time slice.
 *
 * @param component       the detector bank
 * @param dataType        sample or can
 * @param timeSlice       the event time slice
 * @param wavelengthRange the wavelength range, or null for every configured
 *                        range
 * @param extraMask       masks added to those of the state (e.g. the
 *                        quadrant masks of the beam-centre search)
 * @param outputName      base name of the output workspaces
 * @author SANS-Core developers
 */
public record ReductionRequest(DetectorComponent component, DataType dataType, TimeSlice timeSlice,
		WavelengthRange wavelengthRange, MaskSpec extraMask, String outputName) {

	public ReductionRequest {
		if (component == null) throw new ConfigurationException("Reduction request requires a detector component");
		dataType = (dataType == null) ? DataType.SAMPLE : dataType;
		timeSlice = (timeSlice == null) ? TimeSlice.ALL : timeSlice;
		extraMask = (extraMask == null) ? MaskSpec.EMPTY : extraMask;
		if (outputName == null || outputName.isBlank())
			outputName = component.name().toLowerCase() + "_" + dataType.name().toLowerCase() + timeSlice.label();
	}

	public static ReductionRequest of(final DetectorComponent component, final DataType dataType) {
		return new ReductionRequest(component, dataType, TimeSlice.ALL, null, null, null);
	}

	public static ReductionRequest of(final DetectorComponent component, final DataType dataType,
			final TimeSlice slice) {
		return new ReductionRequest(component, dataType, slice, null, null, null);
	}

	public ReductionRequest withWavelengthRange(final WavelengthRange range) {
		return new ReductionRequest(component, dataType, timeSlice, range, extraMask, outputName);
	}

	public ReductionRequest withExtraMask(final MaskSpec mask) {
		return new ReductionRequest(component, dataType, timeSlice, wavelengthRange, mask, outputName);
	}

	public ReductionRequest withOutputName(final String name) {
		return new ReductionRequest(component, dataType, timeSlice, wavelengthRange, extraMask, name);
	}

	/**
	 * Checks that this request can be reduced with the given state and run.
	 *
	 * @throws ConfigurationException if the request is inconsistent
	 */
	public void validate(final ReductionState state, final RunData run) {
		if (!state.geometry().hasComponent(component))
			throw new ConfigurationException(state.geometry().instrument() + " has no " + component + " bank");
		if (dataType == DataType.CAN && !run.hasCan())
			throw new ConfigurationException("Can reduction requested but the run holds no can data");
		if (wavelengthRange != null && !state.fullWavelengthRange().encloses(wavelengthRange))
			throw new ConfigurationException("Wavelength range " + wavelengthRange + " lies outside "
					+ state.fullWavelengthRange());
		if (run.counts(dataType).unit() != XUnit.TOF || run.monitors(dataType).unit() != XUnit.TOF)
			throw new ConfigurationException("Run workspaces must be in time-of-flight");
		final int monitor = state.normalization().incidentMonitor();
		if (run.monitors(dataType).findSpectrum(monitor) == null)
			throw new ConfigurationException("Incident monitor " + monitor + " is missing from the run");
		boolean found = false;
		for (final Spectrum s : run.counts(dataType).spectra()) {
			if (state.geometry().rangeOf(component).contains(s.spectrumNumber())) {
				found = true;
				break;
			}
		}
		if (!found) throw new ConfigurationException("Run holds no spectra of the " + component + " bank");
		if (state.transmission().wideAngleCorrection()
				&& (run.transmission(dataType).isEmpty() || run.directBeam().isEmpty()))
			throw new ConfigurationException("Wide-angle correction requires transmission and direct-beam runs");
	}
}
