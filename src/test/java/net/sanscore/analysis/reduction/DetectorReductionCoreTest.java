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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.io.ElasticUnitConverter;
import net.sanscore.io.GeometricMaskingService;
import net.sanscore.io.RunData;
import net.sanscore.state.AdjustmentSettings;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.DataType;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.MaskShape;
import net.sanscore.state.MaskSpec;
import net.sanscore.state.MaskingRules;
import net.sanscore.state.ReductionState;
import net.sanscore.state.ScaleSettings;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.TofWindow;
import net.sanscore.state.WavelengthRange;

/**
 * Tests for {@link DetectorReductionCore}
 */
public class DetectorReductionCoreTest {

	private final double precision = 1e-9;
	private DetectorReductionCore core;
	private ReductionState state;
	private RunData run;

	@Before
	public void setUp() {
		core = new DetectorReductionCore(new ElasticUnitConverter(SyntheticRuns.L1), new GeometricMaskingService());
		state = SyntheticRuns.state();
		run = SyntheticRuns.flatRun(10, 1000);
	}

	private ReducedSlice lab(final ReductionState s, final RunData r) {
		return core.reduceSlice(s, r, ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE));
	}

	private static double total(final Workspace ws) {
		return StatUtils.sum(ws.spectrum(0).y());
	}

	@Test
	public void testMomentumTransferAxis() {
		final ReducedSlice slice = lab(state, run);
		final double[] q = slice.qEdges();
		assertEquals(state.qBinning().nBins() + 1, q.length);
		assertTrue(Histograms.isAscending(q));
		assertArrayEquals(q, slice.normalization().spectrum(0).x(), 0);
		assertEquals(DetectorComponent.LAB, slice.component());
		assertEquals(state.fullWavelengthRange(), slice.wavelengthRange());
		assertTrue(total(slice.counts()) > 0);
		assertTrue(total(slice.normalization()) > 0);
		final Spectrum counts = slice.counts().spectrum(0);
		final Spectrum norm = slice.normalization().spectrum(0);
		final Spectrum intensity = slice.intensity().spectrum(0);
		for (int i = 0; i < counts.nBins(); i++) {
			if (norm.y()[i] > 0) assertTrue(Double.isFinite(intensity.y()[i]));
			else assertTrue(Double.isNaN(intensity.y()[i]));
		}
	}

	@Test
	public void testReductionIsRepeatable() {
		final ReducedSlice a = lab(state, run);
		final ReducedSlice b = lab(state, run);
		assertArrayEquals(a.counts().spectrum(0).y(), b.counts().spectrum(0).y(), 0);
		assertArrayEquals(a.normalization().spectrum(0).y(), b.normalization().spectrum(0).y(), 0);
	}

	@Test
	public void testInputsSurviveReduction() {
		final double before = run.sampleCounts().findSpectrum(SyntheticRuns.LAB_FIRST).y()[0];
		final ReducedSlice slice = lab(state, run);
		assertFalse(run.sampleCounts().isReleased());
		assertFalse(run.sampleMonitors().isReleased());
		assertFalse(slice.counts().isReleased());
		assertEquals(before, run.sampleCounts().findSpectrum(SyntheticRuns.LAB_FIRST).y()[0], 0);
	}

	@Test
	public void testWavelengthRangesPartitionCounts() {
		final ReductionState s = state
				.withWavelengthRanges(List.of(new WavelengthRange(2, 6), new WavelengthRange(6, 10)));
		final List<ReducedSlice> slices = core.reduce(s, run,
				ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE));
		assertEquals(3, slices.size());
		assertEquals(new WavelengthRange(2, 10), slices.get(0).wavelengthRange());
		final double full = total(slices.get(0).counts());
		assertEquals(full, total(slices.get(1).counts()) + total(slices.get(2).counts()), full * precision);
		assertTrue(slices.get(1).counts().name().endsWith("_2.0_6.0_counts"));
	}

	@Test
	public void testAbsoluteScaleScalesIntensity() {
		final ReducedSlice unit = lab(state, run);
		final ReducedSlice doubled = lab(state.withScale(new ScaleSettings(2d, null)), run);
		assertEquals(2 * total(unit.counts()), total(doubled.counts()), precision);
		assertArrayEquals(unit.normalization().spectrum(0).y(), doubled.normalization().spectrum(0).y(), precision);
	}

	@Test
	public void testFullyMaskedBankHasNoIntensity() {
		final ReductionState masked = state.withMasking(
				new MaskingRules(MaskSpec.ofShapes(new MaskShape.Cylinder(1d, 0, 0, true)), null, 0, 0));
		final ReducedSlice slice = lab(masked, run);
		assertEquals(0d, total(slice.counts()), 0);
		assertEquals(0d, total(slice.normalization()), 0);
		for (final double v : slice.intensity().spectrum(0).y())
			assertTrue(Double.isNaN(v));
	}

	@Test
	public void testTransmissionScalesNormalization() {
		final RunData withTransmission = run.withTransmission(SyntheticRuns.monitors("trans", 1000, 500),
				SyntheticRuns.monitors("direct", 1000, 1000));
		final double plain = total(lab(state, run).normalization());
		final double transmitted = total(lab(state, withTransmission).normalization());
		assertEquals(0.5 * plain, transmitted, plain * 1e-6);

		final ReductionState wide = state.withTransmission(state.transmission().withWideAngleCorrection(true));
		final double corrected = total(lab(wide, withTransmission).normalization());
		assertTrue(corrected < transmitted);
		assertTrue(corrected > 0.99 * transmitted);
	}

	@Test
	public void testSliceEvents() {
		final Workspace events = SyntheticRuns.eventRun().sampleCounts();
		final TimeSlice slice = new TimeSlice(0, 50);
		final Workspace sliced = DetectorReductionCore.sliceEvents(events, slice, false);
		assertEquals(20, sliced.findSpectrum(SyntheticRuns.LAB_FIRST).events().size());
		assertEquals(50 / 97.5, sliced.protonCharge(), precision);
		final Workspace scaled = DetectorReductionCore.sliceEvents(events, slice, true);
		assertEquals(20 * 97.5 / 50, scaled.findSpectrum(SyntheticRuns.LAB_FIRST).integrate(), precision);
	}

	@Test
	public void testTimeSlicesPartitionEventCounts() {
		final RunData events = SyntheticRuns.eventRun();
		final double whole = total(lab(state, events).counts());
		double sum = 0;
		for (final TimeSlice slice : List.of(new TimeSlice(0, 50), new TimeSlice(50, 100))) {
			sum += total(core
					.reduceSlice(state, events, ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE, slice))
					.counts());
		}
		assertTrue(whole > 0);
		assertEquals(whole, sum, whole * precision);
	}

	@Test
	public void testCompatibilityModeMasksTimeWindowBins() {
		final RunData events = SyntheticRuns.eventRun();
		assertArrayEquals("Without masks both branches agree", lab(state, events).counts().spectrum(0).y(),
				lab(state.withCompatibilityMode(true), events).counts().spectrum(0).y(), precision);

		final ReductionState masked = state
				.withMasking(new MaskingRules(MaskSpec.ofTimeWindows(new TofWindow(12000, 16000)), null, 0, 0));
		final double eventNorm = total(lab(masked, events).normalization());
		final double compatibleNorm = total(lab(masked.withCompatibilityMode(true), events).normalization());
		assertTrue(compatibleNorm < eventNorm);
	}

	@Test
	public void testMove() {
		final Workspace moved = DetectorReductionCore.move(run.sampleCounts(), new BeamCentre(0.01, -0.02));
		final Spectrum before = run.sampleCounts().findSpectrum(SyntheticRuns.LAB_FIRST);
		final Spectrum after = moved.findSpectrum(SyntheticRuns.LAB_FIRST);
		assertEquals(before.pixel().x() - 0.01, after.pixel().x(), precision);
		assertEquals(before.pixel().y() + 0.02, after.pixel().y(), precision);
	}

	@Test(expected = ConfigurationException.class)
	public void testCanRequiresCanData() {
		core.reduceSlice(state, run, ReductionRequest.of(DetectorComponent.LAB, DataType.CAN));
	}

	@Test(expected = ConfigurationException.class)
	public void testRangeOutsideBinning() {
		core.reduceSlice(state, run, ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE)
				.withWavelengthRange(new WavelengthRange(1, 4)));
	}

	@Test(expected = ConfigurationException.class)
	public void testBankWithoutSpectra() {
		core.reduceSlice(state, SyntheticRuns.eventRun(), ReductionRequest.of(DetectorComponent.HAB, DataType.SAMPLE));
	}

	@Test
	public void testReducePixels() {
		final ReductionRequest request = ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE);
		final Workspace pixels = core.reducePixels(state, run, request);
		assertEquals(SyntheticRuns.GRID * SyntheticRuns.GRID, pixels.size());
		final Spectrum corner = pixels.findSpectrum(SyntheticRuns.LAB_FIRST);
		final Spectrum mirrored = pixels.findSpectrum(SyntheticRuns.LAB_FIRST + SyntheticRuns.GRID - 1);
		assertFalse(corner.isMasked());
		assertTrue(corner.y()[0] > 0);
		assertEquals(corner.y()[0], mirrored.y()[0], precision * corner.y()[0]);
		assertEquals(state.fullWavelengthRange().min(), corner.x()[0], 0);
		assertEquals(state.fullWavelengthRange().max(), corner.x()[1], 0);

		// a twice as efficient pixel with the same counts has half the intensity
		final ReductionState flatField = state.withAdjustments(
				new AdjustmentSettings(Map.of(SyntheticRuns.LAB_FIRST + SyntheticRuns.GRID - 1, 2d), null, null));
		final Spectrum efficient = core.reducePixels(flatField, run, request)
				.findSpectrum(SyntheticRuns.LAB_FIRST + SyntheticRuns.GRID - 1);
		assertEquals(mirrored.y()[0] / 2, efficient.y()[0], precision * mirrored.y()[0]);
	}

	@Test
	public void testReducePixelsMasksPixels() {
		final ReductionState masked = state
				.withMasking(new MaskingRules(MaskSpec.ofSpectra(SyntheticRuns.LAB_FIRST), null, 0, 0));
		final Workspace pixels = core.reducePixels(masked, run,
				ReductionRequest.of(DetectorComponent.LAB, DataType.SAMPLE));
		final Spectrum s = pixels.findSpectrum(SyntheticRuns.LAB_FIRST);
		assertTrue(s.isMasked());
		assertEquals(0d, s.y()[0], 0);
		assertFalse(pixels.findSpectrum(SyntheticRuns.LAB_FIRST + 1).isMasked());
	}
}
