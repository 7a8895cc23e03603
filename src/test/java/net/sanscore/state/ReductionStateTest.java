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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.data.BinningParams;

/**
 * Tests for {@link ReductionState} and its settings types
 */
public class ReductionStateTest {

	private ReductionState state;

	@Before
	public void setUp() {
		state = SyntheticRuns.state();
	}

	@Test
	public void testDefaults() {
		assertEquals(List.of(TimeSlice.ALL), state.timeSlices());
		assertEquals(BeamCentre.ORIGIN, state.beamCentre(DetectorComponent.HAB));
		assertEquals(ReductionMode.LAB, state.mode());
		assertEquals(Instrument.GENERIC.incidentMonitor(), state.normalization().incidentMonitor());
		assertEquals(new WavelengthRange(2, 10), state.fullWavelengthRange());
	}

	@Test
	public void testAllWavelengthRangesStartWithFullRange() {
		final ReductionState s = state.withWavelengthRanges(
				List.of(new WavelengthRange(2, 4), new WavelengthRange(4, 10), new WavelengthRange(2, 4)));
		assertEquals(List.of(new WavelengthRange(2, 10), new WavelengthRange(2, 4), new WavelengthRange(4, 10)),
				s.allWavelengthRanges());
	}

	@Test
	public void testWithBeamCentreLeavesOriginalUntouched() {
		final ReductionState moved = state.withBeamCentre(DetectorComponent.LAB, new BeamCentre(0.01, -0.02));
		assertNotSame(state, moved);
		assertEquals(BeamCentre.ORIGIN, state.beamCentre(DetectorComponent.LAB));
		assertEquals(new BeamCentre(0.01, -0.02), moved.beamCentre(DetectorComponent.LAB));
	}

	@Test(expected = ConfigurationException.class)
	public void testSubRangeOutsideFullRange() {
		state.withWavelengthRanges(List.of(new WavelengthRange(1, 4)));
	}

	@Test(expected = ConfigurationException.class)
	public void testNonPositiveQBinning() {
		state.withBinning(state.wavelengthBinning(), BinningParams.linear(0, 0.01, 0.1));
	}

	@Test(expected = ConfigurationException.class)
	public void testMergedModeRequiresHab() {
		final InstrumentGeometry labOnly = new InstrumentGeometry(Instrument.GENERIC,
				Map.of(DetectorComponent.LAB, new SpectrumRange(100, 199)), 0.01, 0.01, 10);
		ReductionState.defaults(labOnly).withMode(ReductionMode.MERGED);
	}

	@Test(expected = ConfigurationException.class)
	public void testIncidentMonitorInsideBank() {
		state.withNormalization(new NormalizationSettings(150, null, null, 1d));
	}

	@Test(expected = ConfigurationException.class)
	public void testCompatibilityModeRequiresTofBinning() {
		state.withTofBinning(null).withCompatibilityMode(true);
	}

	@Test(expected = ConfigurationException.class)
	public void testOverlappingBanks() {
		new InstrumentGeometry(Instrument.GENERIC, Map.of(DetectorComponent.LAB, new SpectrumRange(100, 199),
				DetectorComponent.HAB, new SpectrumRange(150, 250)), 0.01, 0.01, 10);
	}

	@Test(expected = ConfigurationException.class)
	public void testInvertedTofWindow() {
		new TofWindow(2000, 1000);
	}

	@Test(expected = ConfigurationException.class)
	public void testGlobalAndPerMonitorBackgroundsAreExclusive() {
		BackgroundWindow.of(new TofWindow(1000, 2000), Map.of(1, new TofWindow(3000, 4000)));
	}

	@Test
	public void testPerMonitorBackground() {
		final BackgroundWindow bg = BackgroundWindow.of(null, Map.of(1, new TofWindow(3000, 4000)));
		assertEquals(new TofWindow(3000, 4000), bg.windowFor(1).get());
		assertTrue(bg.windowFor(2).isEmpty());
	}

	@Test
	public void testMaskingRulesAddRadiusLimits() {
		final MaskingRules rules = new MaskingRules(MaskSpec.ofSpectra(101), null, 0.01, 0.05);
		final MaskSpec spec = rules.forComponent(DetectorComponent.LAB);
		assertTrue(spec.spectra().contains(101));
		assertEquals(2, spec.shapes().size());
	}

	@Test
	public void testSampleVolume() {
		final ScaleSettings scale = new ScaleSettings(2d, new SampleGeometry.FlatPlate(10, 10, 1));
		assertEquals(2d / 0.1, scale.factor(), 1e-12);
	}

	@Test(expected = ConfigurationException.class)
	public void testInvertedMergeRange() {
		MergeSettings.DEFAULT.withMergeRange(0.05, 0.01);
	}
}
