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

package net.sanscore.analysis.normalization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.data.DetectorPixel;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.state.BackgroundWindow;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.NormalizationSettings;
import net.sanscore.state.TofWindow;

/**
 * Tests for {@link CountsNormalizer}
 */
public class CountsNormalizerTest {

	private final double precision = 1e-9;
	private CountsNormalizer normalizer;

	@Before
	public void setUp() {
		normalizer = new CountsNormalizer();
	}

	/** Monitor 1 on 1-&micro;s bins starting at 0. */
	private static Workspace monitors(final double... y) {
		final double[] x = new double[y.length + 1];
		for (int i = 0; i < x.length; i++)
			x[i] = i;
		final double[] e = new double[y.length];
		for (int i = 0; i < e.length; i++)
			e[i] = Math.sqrt(Math.abs(y[i]));
		return new Workspace("monitors", XUnit.TOF, List.of(Spectrum.monitor(1, new DetectorPixel(0, 0, -1), x, y, e)));
	}

	@Test
	public void testFlatBackground() {
		final Workspace ws = monitors(10, 10, 10, 10, 10, 10, 4, 4, 4, 4);
		final Spectrum m = normalizer
				.prepareIncidentMonitor(ws, new BackgroundWindow.Global(new TofWindow(6, 10)), null, 1, 1d)
				.spectrum(0);
		for (int i = 0; i < 6; i++)
			assertEquals(10d, m.y()[i], precision);
		for (int i = 6; i < 10; i++)
			assertEquals(0d, m.y()[i], precision);
		assertEquals("Input is left untouched", 4d, ws.spectrum(0).y()[6], 0);
	}

	@Test
	public void testSignalOutsideSingleBinWindowIsConserved() {
		final Workspace ws = monitors(5, 10, 10, 10, 10);
		final Spectrum m = normalizer
				.prepareIncidentMonitor(ws, new BackgroundWindow.Global(new TofWindow(0, 1)), null, 1, 1d)
				.spectrum(0);
		assertEquals(0d, m.y()[0], precision);
		double outside = 0d;
		for (int i = 1; i < m.nBins(); i++)
			outside += m.y()[i];
		assertEquals(40d, outside, precision);
		assertEquals(Math.sqrt(10), m.e()[1], precision);
	}

	@Test
	public void testPromptPeakIsRemovedBeforeBackground() {
		final Workspace ws = monitors(50, 60, 70, 80, 90, 100, 4, 1000, 4, 4);
		final Spectrum m = normalizer
				.prepareIncidentMonitor(ws, new BackgroundWindow.Global(new TofWindow(6, 10)), new TofWindow(7, 8), 1, 1d)
				.spectrum(0);
		for (int i = 6; i < m.nBins(); i++)
			assertEquals("Bin " + i, 0d, m.y()[i], precision);
		for (int i = 0; i < 6; i++)
			assertEquals("Bin " + i, 50d + 10 * i, m.y()[i], precision);
	}

	@Test
	public void testScaleIsAppliedFirst() {
		final Workspace ws = monitors(10, 10, 10, 10, 4, 6);
		final Spectrum m = normalizer
				.prepareIncidentMonitor(ws, new BackgroundWindow.Global(new TofWindow(4, 6)), null, 1, 2d).spectrum(0);
		assertEquals(20d, m.y()[0], precision);
		assertEquals(-2d, m.y()[4], precision);
		assertEquals(2d, m.y()[5], precision);
	}

	@Test
	public void testPerMonitorBackgroundIgnoresOtherMonitors() {
		final Workspace ws = monitors(10, 10, 4, 4);
		final BackgroundWindow bg = new BackgroundWindow.PerMonitor(Map.of(2, new TofWindow(2, 4)));
		final Spectrum m = normalizer.prepareIncidentMonitor(ws, bg, null, 1, 1d).spectrum(0);
		assertEquals(10d, m.y()[0], 0);
	}

	@Test
	public void testNormalizeDividesByMonitor() {
		final Workspace normalized = normalizer.normalize(SyntheticRuns.flatRun(10, 1000).sampleCounts(),
				SyntheticRuns.monitors("monitors", 1000),
				new NormalizationSettings(SyntheticRuns.INCIDENT_MONITOR, null, null, 1d));
		final Spectrum s = normalized.findSpectrum(SyntheticRuns.LAB_FIRST);
		assertEquals(0.01, s.y()[0], precision);
		assertEquals(0.01 * Math.hypot(1 / Math.sqrt(10), 1 / Math.sqrt(1000)), s.e()[0], precision);
	}

	@Test
	public void testZeroMonitorBinsAreMasked() {
		final Workspace counts = Workspace.of("counts", XUnit.TOF, new double[] { 0, 1, 2 }, new double[] { 5, 5 },
				new double[] { 1, 1 });
		final Workspace monitor = Workspace.of("monitor", XUnit.TOF, new double[] { 0, 1, 2 },
				new double[] { 0, 10 }, new double[] { 0, 1 });
		final Spectrum s = CountsNormalizer.divide(counts, monitor).spectrum(0);
		assertTrue(s.isBinMasked(0));
		assertEquals(0d, s.y()[0], 0);
		assertFalse(s.isBinMasked(1));
		assertEquals(0.5, s.y()[1], precision);
	}

	@Test(expected = ConfigurationException.class)
	public void testMissingMonitor() {
		normalizer.prepareIncidentMonitor(monitors(1, 2, 3), null, null, 7, 1d);
	}

	@Test(expected = ConfigurationException.class)
	public void testBackgroundWindowWithoutBins() {
		normalizer.prepareIncidentMonitor(monitors(1, 2, 3), new BackgroundWindow.Global(new TofWindow(1.2, 1.8)),
				null, 1, 1d);
	}
}
