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

package net.sanscore.analysis.centre;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.io.ElasticUnitConverter;
import net.sanscore.io.GeometricMaskingService;
import net.sanscore.io.InMemoryPersistenceService;
import net.sanscore.io.RunData;
import net.sanscore.state.AdjustmentSettings;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.ReductionState;

/**
 * Tests for {@link BeamCentreFinder}
 */
public class BeamCentreFinderTest {

	private final double precision = 1e-9;
	private ExecutorService executor;
	private InMemoryPersistenceService persistence;
	private BeamCentreFinder finder;
	private ReductionState state;

	@Before
	public void setUp() {
		executor = Executors.newFixedThreadPool(4);
		persistence = new InMemoryPersistenceService();
		finder = new BeamCentreFinder(
				new DetectorReductionCore(new ElasticUnitConverter(SyntheticRuns.L1), new GeometricMaskingService()),
				persistence, executor);
		state = SyntheticRuns.state();
	}

	@After
	public void tearDown() {
		executor.shutdownNow();
	}

	private static CentreSearchSettings quadrant() {
		return CentreSearchSettings.defaults().withRadiusLimits(0, 0.1);
	}

	/** Counts falling off with the distance from (cx, cy). */
	private static RunData peakedRun(final double cx, final double cy) {
		return RunData.of(SyntheticRuns.detectors("peaked",
				(p, bin) -> 100 * Math.exp(-(Math.pow(p.x() - cx, 2) + Math.pow(p.y() - cy, 2)) / (2 * 0.02 * 0.02))),
				SyntheticRuns.monitors("monitors", 1000));
	}

	@Test
	public void testSymmetricPatternConvergesImmediately() {
		final CentreResult result = finder.findCentre(state, SyntheticRuns.flatRun(10, 1000), quadrant());
		assertEquals(ConvergenceStatus.CONVERGED, result.status());
		assertEquals(1, result.iterations());
		assertEquals(0d, result.position1(), 0);
		assertEquals(0d, result.position2(), 0);
		assertTrue(result.residualLR() < CentreSearchSettings.DEF_TOLERANCE);
		assertTrue(result.residualUD() < CentreSearchSettings.DEF_TOLERANCE);
	}

	@Test
	public void testResultIsPersisted() {
		final CentreResult result = finder.findCentre(state, SyntheticRuns.flatRun(10, 1000),
				quadrant().withStart(new BeamCentre(0d, 0d)));
		assertNotNull(result.tableId());
		final InMemoryPersistenceService.Table table = persistence.table(result.tableId());
		assertEquals(result.position1(), table.value(0, BeamCentreFinder.COLUMN_X), 0);
		assertEquals(result.position2(), table.value(0, BeamCentreFinder.COLUMN_Y), 0);
	}

	@Test
	public void testBudgetExhaustion() {
		final CentreSearchSettings settings = quadrant().withIterations(2, 1e-30).withDirection(FindDirection.LEFT_RIGHT)
				.withStep(0.002);
		final CentreResult result = finder.findCentre(state, peakedRun(0.015, 0), settings);
		assertEquals(ConvergenceStatus.MAX_ITERATIONS_REACHED, result.status());
		assertEquals(2, result.iterations());
		assertTrue(Double.isNaN(result.residualUD()));
		assertEquals("Up/down is not searched", 0d, result.position2(), 0);
		assertEquals(1, persistence.tableCount());
	}

	@Test
	public void testCentreOfMass() {
		// a 3x3 block of counts around the pixel at (0.005, -0.005)
		final RunData run = RunData.of(SyntheticRuns.detectors("block",
				(p, bin) -> (Math.abs(p.x() - 0.005) < 0.011 && Math.abs(p.y() + 0.005) < 0.011 && p.z() > 3)
						? ((p.x() == 0.005 && p.y() == -0.005) ? 50 : 10) : 0),
				SyntheticRuns.monitors("monitors", 1000));
		final CentreSearchSettings settings = CentreSearchSettings.defaults()
				.withMethod(CentreFinderMethod.CENTRE_OF_MASS).withRadiusLimits(0, 0.2);
		final CentreResult result = finder.findCentre(state, run, settings);
		assertTrue(result.converged());
		assertEquals(2, result.iterations());
		assertEquals(0.005, result.position1(), 1e-6);
		assertEquals(-0.005, result.position2(), 1e-6);
		assertNotNull(persistence.table(result.tableId()));
	}

	@Test
	public void testCentreOfMassUsesFlatFieldCorrectedIntensity() {
		// the column at x=0.015 counts twice as much because its pixels are
		// twice as efficient; corrected, the 3x3 block is uniform
		final RunData run = RunData.of(SyntheticRuns.detectors("block",
				(p, bin) -> (Math.abs(p.x() - 0.005) < 0.011 && Math.abs(p.y() + 0.005) < 0.011 && p.z() > 3)
						? ((p.x() > 0.01) ? 20 : 10) : 0),
				SyntheticRuns.monitors("monitors", 1000));
		final int first = SyntheticRuns.LAB_FIRST + 6;
		final ReductionState flatField = state.withAdjustments(new AdjustmentSettings(
				Map.of(first + 30, 2d, first + 40, 2d, first + 50, 2d), null, null));
		final CentreSearchSettings settings = CentreSearchSettings.defaults()
				.withMethod(CentreFinderMethod.CENTRE_OF_MASS).withRadiusLimits(0, 0.2);
		final CentreResult result = finder.findCentre(flatField, run, settings);
		assertTrue(result.converged());
		assertEquals(0.005, result.position1(), 1e-6);
		assertEquals(-0.005, result.position2(), 1e-6);
		final CentreResult uncorrected = finder.findCentre(state, run, settings);
		assertEquals(0.0075, uncorrected.position1(), 1e-6);
	}

	@Test
	public void testQuadrantSearchFromOffCentreStart() {
		final CentreSearchSettings settings = quadrant().withIterations(30, CentreSearchSettings.DEF_TOLERANCE)
				.withDirection(FindDirection.LEFT_RIGHT).withStep(0.004);
		final CentreResult result = finder.findCentre(state, peakedRun(0.015, 0), settings);
		assertEquals(ConvergenceStatus.CONVERGED, result.status());
		assertTrue(result.iterations() > 2);
		assertTrue(result.iterations() <= 30);
		assertEquals(0.015, result.position1(), 0.004);
		assertEquals(0d, result.position2(), 0);
	}

	@Test
	public void testResidualToleranceIsSeparateFromPositionTolerance() {
		final CentreSearchSettings settings = quadrant().withIterations(30, CentreSearchSettings.DEF_TOLERANCE)
				.withDirection(FindDirection.LEFT_RIGHT).withStep(0.004);
		assertEquals(CentreSearchSettings.DEF_TOLERANCE, settings.effectiveResidualTolerance(), 0);
		final CentreResult loose = finder.findCentre(state, peakedRun(0.015, 0),
				settings.withResidualTolerance(1e30));
		assertEquals(ConvergenceStatus.CONVERGED, loose.status());
		assertEquals(1, loose.iterations());
		assertEquals(0d, loose.position1(), 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testNegativeResidualTolerance() {
		CentreSearchSettings.defaults().withResidualTolerance(-1d);
	}

	@Test
	public void testResidual() {
		final Workspace a = Workspace.of("a", XUnit.MOMENTUM_TRANSFER, new double[] { 1, 2, 3, 4 },
				new double[] { 1, 2, Double.NaN }, new double[3]);
		final Workspace b = Workspace.of("b", XUnit.MOMENTUM_TRANSFER, new double[] { 1, 2, 3, 4 },
				new double[] { 2, 4, 7 }, new double[3]);
		assertEquals(1 + 4, QuadrantResidualSearch.residual(a, b), precision);
	}

	@Test(expected = IllegalStateException.class)
	public void testResidualWithoutCommonBins() {
		final Workspace a = Workspace.of("a", XUnit.MOMENTUM_TRANSFER, new double[] { 1, 2, 3 },
				new double[] { 1, Double.NaN }, new double[2]);
		final Workspace b = Workspace.of("b", XUnit.MOMENTUM_TRANSFER, new double[] { 1, 2, 3 },
				new double[] { Double.NaN, 4 }, new double[2]);
		QuadrantResidualSearch.residual(a, b);
	}
}
