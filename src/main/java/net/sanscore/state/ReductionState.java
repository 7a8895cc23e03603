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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.sanscore.data.BinningParams;

/**
 * Immutable configuration of one run's reduction. A state is validated when it
 * is constructed and is read-only afterwards; the {@code with*} methods return
 * new, revalidated states.
 *
 * @param geometry            instrument layout
 * @param beamCentres         beam centre of each detector bank (missing banks
 *                            default to the origin)
 * @param tofBinning          time-of-flight binning used to histogram event
 *                            data for the compatibility branch
 * @param wavelengthBinning   wavelength binning; its bounds are the full
 *                            wavelength range
 * @param wavelengthRanges    additional wavelength sub-ranges to reduce
 * @param qBinning            momentum-transfer binning of the output
 * @param masking             masking rules
 * @param normalization       monitor normalization settings
 * @param transmission        transmission settings
 * @param scale               absolute-units scaling
 * @param adjustments         detector efficiency corrections
 * @param merge               two-bank merge settings
 * @param mode                which banks are reduced
 * @param timeSlices          event time slices
 * @param compatibilityMode   whether event data are reduced the way the
 *                            legacy histogram engine reduced them
 * @param scaleSlicesByCharge whether time slices are scaled by their share of
 *                            the proton charge
 * @author SANS-Core developers
 */
public record ReductionState(InstrumentGeometry geometry, Map<DetectorComponent, BeamCentre> beamCentres,
		BinningParams tofBinning, BinningParams wavelengthBinning, List<WavelengthRange> wavelengthRanges,
		BinningParams qBinning, MaskingRules masking, NormalizationSettings normalization,
		TransmissionSettings transmission, ScaleSettings scale, AdjustmentSettings adjustments, MergeSettings merge,
		ReductionMode mode, List<TimeSlice> timeSlices, boolean compatibilityMode, boolean scaleSlicesByCharge) {

	public ReductionState {
		if (geometry == null)
			throw new ConfigurationException("Reduction state requires an instrument geometry");
		final Map<DetectorComponent, BeamCentre> centres = new EnumMap<>(DetectorComponent.class);
		if (beamCentres != null) centres.putAll(beamCentres);
		for (final DetectorComponent c : geometry.components().keySet())
			centres.putIfAbsent(c, BeamCentre.ORIGIN);
		beamCentres = Map.copyOf(centres);

		if (wavelengthBinning == null || qBinning == null)
			throw new ConfigurationException("Wavelength and momentum-transfer binning are required");
		if (!(wavelengthBinning.min() > 0))
			throw new ConfigurationException("Wavelength binning must start above zero");
		if (!(qBinning.min() > 0))
			throw new ConfigurationException("Momentum-transfer binning must start above zero");
		wavelengthRanges = (wavelengthRanges == null) ? List.of() : List.copyOf(wavelengthRanges);
		final WavelengthRange full = new WavelengthRange(wavelengthBinning.min(), wavelengthBinning.max());
		for (final WavelengthRange r : wavelengthRanges) {
			if (!full.encloses(r))
				throw new ConfigurationException("Wavelength range " + r + " lies outside " + full);
		}

		masking = (masking == null) ? MaskingRules.NONE : masking;
		normalization = (normalization == null) ? NormalizationSettings.defaults(geometry.instrument()) : normalization;
		transmission = (transmission == null) ? TransmissionSettings.defaults(geometry.instrument()) : transmission;
		scale = (scale == null) ? ScaleSettings.UNIT : scale;
		adjustments = (adjustments == null) ? AdjustmentSettings.NONE : adjustments;
		merge = (merge == null) ? MergeSettings.DEFAULT : merge;
		mode = (mode == null) ? ReductionMode.LAB : mode;
		for (final DetectorComponent c : mode.components()) {
			if (!geometry.hasComponent(c))
				throw new ConfigurationException("Reduction mode " + mode + " requires the " + c + " bank");
		}
		for (final SpectrumRange range : geometry.components().values()) {
			if (range.contains(normalization.incidentMonitor()))
				throw new ConfigurationException(
						"Incident monitor " + normalization.incidentMonitor() + " lies inside a detector bank");
		}

		timeSlices = (timeSlices == null || timeSlices.isEmpty()) ? List.of(TimeSlice.ALL) : List.copyOf(timeSlices);
		if (compatibilityMode && tofBinning == null)
			throw new ConfigurationException("Compatibility mode requires a time-of-flight binning");
	}

	/**
	 * Returns a state with the instrument's defaults: its wavelength range in
	 * 0.125 &Aring; steps, logarithmic Q binning from 0.001 to 0.5 &Aring;^-1 and
	 * its monitor and transmission defaults.
	 */
	public static ReductionState defaults(final InstrumentGeometry geometry) {
		final WavelengthRange range = geometry.instrument().defaultWavelengthRange();
		return new ReductionState(geometry, null, BinningParams.linear(5000, 100, 100000),
				BinningParams.linear(range.min(), 0.125, range.max()), null,
				BinningParams.logarithmic(0.001, 0.08, 0.5), null, null, null, null, null, null, null, null, false,
				false);
	}

	public BeamCentre beamCentre(final DetectorComponent component) {
		return beamCentres.getOrDefault(component, BeamCentre.ORIGIN);
	}

	/** The wavelength range spanned by the wavelength binning. */
	public WavelengthRange fullWavelengthRange() {
		return new WavelengthRange(wavelengthBinning.min(), wavelengthBinning.max());
	}

	/** The full wavelength range followed by the distinct sub-ranges. */
	public List<WavelengthRange> allWavelengthRanges() {
		final Set<WavelengthRange> all = new LinkedHashSet<>();
		all.add(fullWavelengthRange());
		all.addAll(wavelengthRanges);
		return new ArrayList<>(all);
	}

	public ReductionState withBeamCentre(final DetectorComponent component, final BeamCentre centre) {
		final Map<DetectorComponent, BeamCentre> centres = new EnumMap<>(DetectorComponent.class);
		centres.putAll(beamCentres);
		centres.put(component, centre);
		return new ReductionState(geometry, centres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning, masking,
				normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withBinning(final BinningParams wavelength, final BinningParams q) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelength, wavelengthRanges, q, masking,
				normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withTofBinning(final BinningParams tof) {
		return new ReductionState(geometry, beamCentres, tof, wavelengthBinning, wavelengthRanges, qBinning, masking,
				normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withWavelengthRanges(final List<WavelengthRange> ranges) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, ranges, qBinning, masking,
				normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withMasking(final MaskingRules rules) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				rules, normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withNormalization(final NormalizationSettings settings) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, settings, transmission, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withTransmission(final TransmissionSettings settings) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, settings, scale, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withScale(final ScaleSettings settings) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, settings, adjustments, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withAdjustments(final AdjustmentSettings settings) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, scale, settings, merge, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withMerge(final MergeSettings settings) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, scale, adjustments, settings, mode, timeSlices, compatibilityMode,
				scaleSlicesByCharge);
	}

	public ReductionState withMode(final ReductionMode reductionMode) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, scale, adjustments, merge, reductionMode, timeSlices,
				compatibilityMode, scaleSlicesByCharge);
	}

	public ReductionState withTimeSlices(final List<TimeSlice> slices, final boolean scaleByCharge) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, scale, adjustments, merge, mode, slices, compatibilityMode,
				scaleByCharge);
	}

	public ReductionState withCompatibilityMode(final boolean compatible) {
		return new ReductionState(geometry, beamCentres, tofBinning, wavelengthBinning, wavelengthRanges, qBinning,
				masking, normalization, transmission, scale, adjustments, merge, mode, timeSlices, compatible,
				scaleSlicesByCharge);
	}
}
