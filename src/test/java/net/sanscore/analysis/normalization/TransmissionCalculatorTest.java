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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.function.DoubleUnaryOperator;

import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.data.BinningParams;
import net.sanscore.data.Histograms;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.io.ElasticUnitConverter;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.NormalizationSettings;
import net.sanscore.state.TransmissionSettings;
import net.sanscore.state.TransmissionSettings.FitMethod;
import net.sanscore.state.WavelengthRange;

/**
 * Tests for {@link TransmissionCalculator}
 */
public class TransmissionCalculatorTest {

	private final double precision = 1e-9;
	private final double[] edges = BinningParams.linear(2, 0.5, 10).edges();
	private final double[] centres = Histograms.centres(edges);
	private TransmissionCalculator calculator;

	@Before
	public void setUp() {
		calculator = new TransmissionCalculator(new ElasticUnitConverter(SyntheticRuns.L1));
	}

	private double[] curve(final DoubleUnaryOperator f) {
		final double[] v = new double[centres.length];
		for (int i = 0; i < v.length; i++)
			v[i] = f.applyAsDouble(centres[i]);
		return v;
	}

	@Test
	public void testLinearFit() {
		final double[] t = curve(l -> 0.9 - 0.01 * l);
		assertArrayEquals(t, calculator.fit(edges, t, FitMethod.LINEAR, null, 2), precision);
	}

	@Test
	public void testLogFit() {
		final double[] t = curve(l -> Math.exp(-0.1 * l));
		assertArrayEquals(t, calculator.fit(edges, t, FitMethod.LOG, null, 2), precision);
	}

	@Test
	public void testPolynomialFit() {
		final double[] t = curve(l -> 1 - 0.01 * l + 0.001 * l * l);
		assertArrayEquals(t, calculator.fit(edges, t, FitMethod.POLYNOMIAL, null, 2), 1e-6);
	}

	@Test
	public void testFitRangeExcludesOutliers() {
		final double[] t = curve(l -> 0.9 - 0.01 * l);
		t[t.length - 1] = 5;
		final double[] fitted = calculator.fit(edges, t, FitMethod.LINEAR, new WavelengthRange(2, 9), 2);
		assertEquals(0.9 - 0.01 * centres[0], fitted[0], precision);
		assertEquals("Extrapolated over the outlier", 0.9 - 0.01 * centres[t.length - 1], fitted[t.length - 1],
				precision);
	}

	@Test
	public void testOffReturnsMeasuredCurve() {
		final double[] t = curve(l -> 0.5);
		t[3] = 0.7;
		assertArrayEquals(t, calculator.fit(edges, t, FitMethod.OFF, null, 2), 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testTooFewPoints() {
		final double[] t = curve(l -> 0.9);
		calculator.fit(edges, t, FitMethod.LINEAR, new WavelengthRange(2.1, 2.4), 2);
	}

	@Test
	public void testCalculateFromMonitors() {
		final Workspace trans = SyntheticRuns.monitors("trans", 1000, 500);
		final Workspace direct = SyntheticRuns.monitors("direct", 1000, 1000);
		final TransmissionSettings settings = new TransmissionSettings(SyntheticRuns.INCIDENT_MONITOR,
				SyntheticRuns.TRANSMISSION_MONITOR, FitMethod.LOG, null, 2, false);
		final Workspace t = calculator.calculate(trans, direct, settings,
				new NormalizationSettings(SyntheticRuns.INCIDENT_MONITOR, null, null, 1d), edges);
		assertEquals(XUnit.WAVELENGTH, t.unit());
		for (final double v : t.spectrum(0).y())
			assertEquals(0.5, v, 1e-6);
	}
}
