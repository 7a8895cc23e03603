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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import net.sanscore.data.DetectorPixel;
import net.sanscore.data.EventList;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.WorkspaceArena;
import net.sanscore.data.XUnit;
import net.sanscore.io.MaskingService;
import net.sanscore.io.RunData;
import net.sanscore.io.UnitConverter;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.MaskSpec;
import net.sanscore.state.ReductionState;
import net.sanscore.state.SpectrumRange;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;
import net.sanscore.util.Logger;

/**
 * Reduces one detector bank of one run to a 1D profile in momentum transfer.
 * The steps run in a fixed order:
 * <ol>
 * <li>crop to the spectra of the bank;</li>
 * <li>slice events by pulse time;</li>
 * <li>histogram a side copy of event data on the TOF binning, when legacy
 * compatibility is requested, to keep per-bin time masks;</li>
 * <li>move the bank so that the beam centre sits at the origin;</li>
 * <li>apply pixel and time masks;</li>
 * <li>convert to wavelength and crop to the wavelength range;</li>
 * <li>scale to absolute units;</li>
 * <li>build the wavelength, pixel and wide-angle adjustments;</li>
 * <li>histogram on the wavelength binning, copying the side copy's bin
 * masks;</li>
 * <li>convert counts and normalization to momentum transfer and sum them into
 * the Q bins.</li>
 * </ol>
 * Every intermediate workspace belongs to a {@link WorkspaceArena} and is
 * released when the reduction returns or fails. Instances hold no state
 * between calls.
 *
 * @author SANS-Core developers
 */
public class DetectorReductionCore {

	private final Logger logger = new Logger(DetectorReductionCore.class);
	private final UnitConverter converter;
	private final MaskingService maskingService;
	private final AdjustmentCalculator adjustments;

	public DetectorReductionCore(final UnitConverter converter, final MaskingService maskingService) {
		this.converter = converter;
		this.maskingService = maskingService;
		this.adjustments = new AdjustmentCalculator(converter);
	}

	/**
	 * Reduces the request over its wavelength range, or over the full range if
	 * the request does not name one.
	 *
	 * @throws net.sanscore.state.ConfigurationException if the request is
	 *                                                   inconsistent with the
	 *                                                   state or run
	 */
	public ReducedSlice reduceSlice(final ReductionState state, final RunData run, final ReductionRequest request) {
		final WavelengthRange range = (request.wavelengthRange() == null) ? state.fullWavelengthRange()
				: request.wavelengthRange();
		return reduce(state, run, request, List.of(range)).get(0);
	}

	/**
	 * Reduces the request once per wavelength range: the request's range if it
	 * names one, otherwise the full range followed by the state's sub-ranges.
	 */
	public List<ReducedSlice> reduce(final ReductionState state, final RunData run, final ReductionRequest request) {
		final List<WavelengthRange> ranges = (request.wavelengthRange() == null) ? state.allWavelengthRanges()
				: List.of(request.wavelengthRange());
		return reduce(state, run, request, ranges);
	}

	/**
	 * Runs the reduction up to the wavelength histogram and returns, per
	 * pixel, the wavelength-integrated counts divided by the integrated
	 * normalization. Each spectrum of the result holds one bin spanning the
	 * wavelength range, at the pixel position relative to the beam centre.
	 * Masked pixels and pixels without normalization are masked and zero.
	 */
	public Workspace reducePixels(final ReductionState state, final RunData run, final ReductionRequest request) {
		final WavelengthRange range = (request.wavelengthRange() == null) ? state.fullWavelengthRange()
				: request.wavelengthRange();
		request.validate(state, run);
		final String name = request.outputName() + "_" + range.label();
		try (WorkspaceArena arena = new WorkspaceArena(name)) {
			final Prepared prepared = prepare(state, run, request, arena);
			final Adjusted adjusted = adjust(state, run, request, prepared, range, arena);
			final double[] x = { range.min(), range.max() };
			final List<Spectrum> out = new ArrayList<>(adjusted.counts().size());
			for (int k = 0; k < adjusted.counts().size(); k++) {
				final Spectrum c = adjusted.counts().spectrum(k);
				final Spectrum n = adjusted.norm().spectrum(k);
				double counts = 0d;
				double variance = 0d;
				double norm = 0d;
				for (int i = 0; i < c.nBins(); i++) {
					counts += c.y()[i];
					variance += c.e()[i] * c.e()[i];
					norm += n.y()[i];
				}
				final boolean defined = !c.isMasked() && norm > 0;
				final Spectrum pixel = Spectrum.histogram(c.spectrumNumber(), c.pixel(), x.clone(),
						new double[] { (defined) ? counts / norm : 0d },
						new double[] { (defined) ? Math.sqrt(variance) / norm : 0d });
				pixel.setMasked(!defined);
				out.add(pixel);
			}
			return new Workspace(name + "_pixels", XUnit.WAVELENGTH, out);
		}
	}

	private List<ReducedSlice> reduce(final ReductionState state, final RunData run, final ReductionRequest request,
			final List<WavelengthRange> ranges) {
		request.validate(state, run);
		final String name = request.outputName();
		try (WorkspaceArena arena = new WorkspaceArena(name)) {
			final Prepared prepared = prepare(state, run, request, arena);
			final List<ReducedSlice> slices = new ArrayList<>(ranges.size());
			for (final WavelengthRange range : ranges)
				slices.add(reduceRange(state, run, request, prepared, range, arena));
			logger.debug("Reduced " + name + ": " + slices.size() + " wavelength range(s)");
			return slices;
		}
	}

	/** Wavelength data of a bank after steps 1 to 5 and the unit conversion. */
	private record Prepared(Workspace lambda, Optional<Workspace> shadowLambda, Workspace monitors) {
	}

	/** Counts and normalization per pixel and wavelength bin. */
	private record Adjusted(Workspace counts, Workspace norm) {
	}

	private Prepared prepare(final ReductionState state, final RunData run, final ReductionRequest request,
			final WorkspaceArena arena) {
		final String name = request.outputName();
		// 1. Crop
		final SpectrumRange spectra = state.geometry().rangeOf(request.component());
		Workspace counts = arena.track(run.counts(request.dataType()).crop(name + "_cropped",
				s -> spectra.contains(s.spectrumNumber())));
		Workspace monitors = arena.track(run.monitors(request.dataType()).duplicate(name + "_monitors"));

		// 2. Time slice
		counts = arena.track(sliceEvents(counts, request.timeSlice(), state.scaleSlicesByCharge()));

		// 3. Compatibility side copy
		Optional<Workspace> shadow = Optional.empty();
		if (state.compatibilityMode() && counts.isEventMode())
			shadow = Optional.of(arena.track(histogram(counts, state.tofBinning().edges(), name + "_shadow")));

		// 4. Move
		final BeamCentre centre = state.beamCentre(request.component());
		counts = arena.track(move(counts, centre));
		monitors = arena.track(move(monitors, centre));
		shadow = shadow.map(ws -> arena.track(move(ws, centre)));

		// 5. Mask
		final MaskSpec mask = state.masking().forComponent(request.component()).or(request.extraMask());
		counts = arena.track(maskingService.mask(counts, mask));
		shadow = shadow.map(ws -> arena.track(maskingService.mask(ws, mask)));

		final Workspace lambda = arena.track(converter.convert(counts, XUnit.WAVELENGTH));
		final Optional<Workspace> shadowLambda = shadow
				.map(ws -> arena.track(converter.convert(ws, XUnit.WAVELENGTH)));
		return new Prepared(lambda, shadowLambda, monitors);
	}

	private Adjusted adjust(final ReductionState state, final RunData run, final ReductionRequest request,
			final Prepared prepared, final WavelengthRange range, final WorkspaceArena arena) {
		final String name = request.outputName() + "_" + range.label();
		final double[] edges = state.wavelengthBinning().withRange(range.min(), range.max()).edges();

		// 6. Crop to the wavelength range
		final Workspace cropped = arena.track(cropToEdges(prepared.lambda(), edges, name + "_lambda"));

		// 7. Scale
		final Workspace scaled = arena.track(scale(cropped, state.scale().factor()));

		// 8. Adjustments
		final Optional<double[][]> transmission = adjustments.transmission(state, run, request.dataType(), edges);
		final double[][] wavelengthAdjustment = adjustments.wavelengthAdjustment(state, prepared.monitors(),
				transmission, edges);
		final boolean wideAngle = state.transmission().wideAngleCorrection() && transmission.isPresent();

		// 9. Histogram, recovering the side copy's bin masks
		final Workspace histogram = arena.track(scaled.toHistogram(name + "_histogram"));
		prepared.shadowLambda().ifPresent(sh -> transferMasks(sh, histogram));

		final Workspace norm = arena.track(normalization(state, histogram, wavelengthAdjustment,
				(wideAngle) ? transmission.get()[0] : null, name + "_norm_lambda"));
		zeroMasked(histogram);
		return new Adjusted(histogram, norm);
	}

	private ReducedSlice reduceRange(final ReductionState state, final RunData run, final ReductionRequest request,
			final Prepared prepared, final WavelengthRange range, final WorkspaceArena arena) {
		final String name = request.outputName() + "_" + range.label();
		final Adjusted adjusted = adjust(state, run, request, prepared, range, arena);

		// 10. Momentum transfer
		final Workspace qCounts = arena.track(converter.convert(adjusted.counts(), XUnit.MOMENTUM_TRANSFER));
		final Workspace qNorm = arena.track(converter.convert(adjusted.norm(), XUnit.MOMENTUM_TRANSFER));
		final double[] qEdges = state.qBinning().edges();
		final double[][] c = accumulate(qCounts, qEdges);
		final double[][] n = accumulate(qNorm, qEdges);
		return new ReducedSlice(request.component(), request.dataType(), request.timeSlice(), range,
				Workspace.of(name + "_counts", XUnit.MOMENTUM_TRANSFER, qEdges.clone(), c[0], c[1]),
				Workspace.of(name + "_norm", XUnit.MOMENTUM_TRANSFER, qEdges.clone(), n[0], n[1]));
	}

	/**
	 * Keeps the events whose pulse time lies in the slice. The proton charge of
	 * the slice is taken proportional to its share of the run duration; with
	 * {@code scaleByCharge} the counts are divided by that share so that they
	 * can be normalized by whole-run monitors.
	 */
	static Workspace sliceEvents(final Workspace counts, final TimeSlice slice, final boolean scaleByCharge) {
		if (slice.isWholeRun() || !counts.isEventMode()) return counts.duplicate(counts.name() + "_sliced");
		double tMin = Double.POSITIVE_INFINITY;
		double tMax = Double.NEGATIVE_INFINITY;
		for (final Spectrum s : counts.spectra()) {
			if (!s.isEventMode()) continue;
			for (int i = 0; i < s.events().size(); i++) {
				tMin = Math.min(tMin, s.events().pulseTime(i));
				tMax = Math.max(tMax, s.events().pulseTime(i));
			}
		}
		final double duration = tMax - tMin;
		final double share = (duration > 0)
				? Math.max(0d, Math.min(slice.stop(), tMax) - Math.max(slice.start(), tMin)) / duration
				: 1d;
		final List<Spectrum> sliced = new ArrayList<>(counts.size());
		for (final Spectrum source : counts.spectra()) {
			final Spectrum s = source.duplicate();
			if (s.isEventMode()) {
				EventList events = s.events().filterByPulseTime(slice.start(), slice.stop());
				if (scaleByCharge && share > 0) events = events.scaled(1 / share);
				s.setEvents(events);
			}
			sliced.add(s);
		}
		final Workspace ws = counts.withSpectra(counts.name() + "_sliced", counts.unit(), sliced);
		ws.setProtonCharge(counts.protonCharge() * share);
		return ws;
	}

	private static Workspace histogram(final Workspace ws, final double[] edges, final String name) {
		final List<Spectrum> out = new ArrayList<>(ws.size());
		for (final Spectrum source : ws.spectra()) {
			out.add(onEdges(source, edges));
		}
		return ws.withSpectra(name, ws.unit(), out);
	}

	/** Returns a histogram copy of the spectrum on the given edges. */
	private static Spectrum onEdges(final Spectrum source, final double[] edges) {
		final Spectrum s = source.duplicate();
		if (s.isEventMode()) {
			s.setEventBinning(edges.clone());
			return s.toHistogram();
		}
		final double[][] rebinned = Histograms.rebin(s.x(), s.y(), s.e(), edges);
		s.setHistogram(edges.clone(), rebinned[0], rebinned[1], Histograms.transferFlags(s.x(), s.binMasks(), edges));
		return s;
	}

	private static Workspace cropToEdges(final Workspace ws, final double[] edges, final String name) {
		final List<Spectrum> out = new ArrayList<>(ws.size());
		for (final Spectrum source : ws.spectra()) {
			if (source.isEventMode()) {
				final Spectrum s = source.duplicate();
				s.setEventBinning(edges.clone());
				out.add(s);
			} else {
				out.add(onEdges(source, edges));
			}
		}
		return ws.withSpectra(name, ws.unit(), out);
	}

	static Workspace move(final Workspace ws, final BeamCentre centre) {
		final Workspace moved = ws.duplicate(ws.name() + "_moved");
		for (final Spectrum s : moved.spectra()) {
			final DetectorPixel p = s.pixel();
			if (p != null) s.setPixel(p.shifted(-centre.position1(), -centre.position2()));
		}
		return moved;
	}

	private static Workspace scale(final Workspace ws, final double factor) {
		final Workspace scaled = ws.duplicate(ws.name() + "_scaled");
		if (factor == 1d) return scaled;
		for (final Spectrum s : scaled.spectra()) {
			if (s.isEventMode()) {
				s.setEvents(s.events().scaled(factor));
				continue;
			}
			final double[] y = s.y();
			final double[] e = s.e();
			for (int i = 0; i < y.length; i++) {
				y[i] *= factor;
				e[i] *= Math.abs(factor);
			}
		}
		return scaled;
	}

	private static void transferMasks(final Workspace shadow, final Workspace histogram) {
		for (final Spectrum s : histogram.spectra()) {
			final Spectrum sh = shadow.findSpectrum(s.spectrumNumber());
			if (sh == null) continue;
			if (sh.isMasked()) s.setMasked(true);
			final boolean[] flags = Histograms.transferFlags(sh.x(), sh.binMasks(), s.x());
			for (int i = 0; i < flags.length; i++) {
				if (flags[i]) s.maskBin(i);
			}
		}
	}

	private Workspace normalization(final ReductionState state, final Workspace histogram,
			final double[][] wavelengthAdjustment, final double[] wideAngleTransmission, final String name) {
		final List<Spectrum> out = new ArrayList<>(histogram.size());
		for (final Spectrum s : histogram.spectra()) {
			final double pixel = (s.isMasked()) ? 0d : adjustments.pixelAdjustment(state, s);
			final double[] correction = (wideAngleTransmission == null || s.pixel() == null) ? null
					: AdjustmentCalculator.wideAngleCorrection(s.pixel(), wideAngleTransmission);
			final double[] y = new double[s.nBins()];
			final double[] e = new double[y.length];
			for (int i = 0; i < y.length; i++) {
				if (s.isBinMasked(i)) continue;
				final double c = (correction == null) ? 1d : correction[i];
				y[i] = wavelengthAdjustment[0][i] * pixel * c;
				e[i] = wavelengthAdjustment[1][i] * pixel * c;
			}
			final Spectrum n = Spectrum.histogram(s.spectrumNumber(), s.pixel(), s.x().clone(), y, e);
			n.setMasked(s.isMasked());
			out.add(n);
		}
		return histogram.withSpectra(name, histogram.unit(), out);
	}

	private static void zeroMasked(final Workspace histogram) {
		for (final Spectrum s : histogram.spectra()) {
			final double[] y = s.y();
			final double[] e = s.e();
			for (int i = 0; i < y.length; i++) {
				if (s.isMasked() || s.isBinMasked(i)) {
					y[i] = 0d;
					e[i] = 0d;
				}
			}
		}
	}

	/**
	 * Sums every bin of every spectrum into the Q bin holding its centre.
	 * Variances are summed.
	 */
	private static double[][] accumulate(final Workspace q, final double[] qEdges) {
		final double[] y = new double[qEdges.length - 1];
		final double[] variance = new double[y.length];
		for (final Spectrum s : q.spectra()) {
			if (s.isMasked()) continue;
			final double[] centres = Histograms.centres(s.x());
			for (int i = 0; i < centres.length; i++) {
				final int bin = Histograms.binIndex(qEdges, centres[i]);
				if (bin < 0) continue;
				y[bin] += s.y()[i];
				variance[bin] += s.e()[i] * s.e()[i];
			}
		}
		final double[] e = new double[y.length];
		for (int i = 0; i < e.length; i++)
			e[i] = Math.sqrt(variance[i]);
		return new double[][] { y, e };
	}
}
