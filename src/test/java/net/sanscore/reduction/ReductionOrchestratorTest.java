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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.sanscore.SyntheticRuns;
import net.sanscore.analysis.merge.BankMerger;
import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.analysis.reduction.ReducedSlice;
import net.sanscore.analysis.reduction.ReductionRequest;
import net.sanscore.data.Spectrum;
import net.sanscore.io.DataLoader;
import net.sanscore.io.ElasticUnitConverter;
import net.sanscore.io.GeometricMaskingService;
import net.sanscore.io.RunData;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.ReductionMode;
import net.sanscore.state.ReductionState;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;

/**
 * Tests for {@link ReductionOrchestrator}
 */
public class ReductionOrchestratorTest {

	private final double precision = 1e-9;
	private DetectorReductionCore core;
	private ReductionState state;
	private RunData run;
	private ExecutorService executor;

	@Before
	public void setUp() {
		core = new DetectorReductionCore(new ElasticUnitConverter(SyntheticRuns.L1), new GeometricMaskingService());
		state = SyntheticRuns.state();
		run = SyntheticRuns.flatRun(10, 1000);
	}

	@After
	public void tearDown() {
		if (executor != null) executor.shutdownNow();
	}

	private ReductionOrchestrator orchestrator(final DetectorReductionCore c) {
		return new ReductionOrchestrator(id -> run, c, new BankMerger());
	}

	@Test
	public void testMergedModeOutputsBothBanksAndMerge() throws IOException {
		final ReductionReport report = orchestrator(core).run(state.withMode(ReductionMode.MERGED), "run1");
		assertTrue(report.isComplete());
		assertEquals("run1", report.runIdentifier());
		assertEquals(3, report.succeeded().size());
		final ReductionOutput lab = report.output("run1_lab_sample_2.0_10.0").orElseThrow();
		final ReductionOutput hab = report.output("run1_hab_sample_2.0_10.0").orElseThrow();
		final ReductionOutput merged = report.output("run1_merged_2.0_10.0").orElseThrow();
		assertEquals(DetectorComponent.LAB, lab.component());
		assertEquals(DetectorComponent.HAB, hab.component());
		assertFalse(lab.isMerged());
		assertTrue(merged.isMerged());
		assertNull(merged.component());
		assertEquals(1d, merged.merge().scale(), 0);
		assertEquals(0d, merged.merge().shift(), 0);
	}

	@Test
	public void testSingleBankModes() throws IOException {
		final ReductionReport labOnly = orchestrator(core).run(state.withMode(ReductionMode.LAB), "run1");
		assertEquals(1, labOnly.succeeded().size());
		assertEquals(DetectorComponent.LAB, labOnly.succeeded().get(0).component());
		final ReductionReport all = orchestrator(core).run(state.withMode(ReductionMode.ALL), "run1");
		assertEquals(2, all.succeeded().size());
		for (final ReductionOutput output : all.succeeded())
			assertFalse(output.isMerged());
	}

	@Test
	public void testCanSubtraction() {
		final ReductionState labState = state.withMode(ReductionMode.LAB);
		final ReductionOrchestrator orchestrator = orchestrator(core);
		final ReductionReport plain = orchestrator.run(labState, run, "run1");
		final RunData withCan = run.withCan(SyntheticRuns.detectors("can", (p, i) -> 5d),
				SyntheticRuns.monitors("can_monitors", 1000d), null);
		final ReductionReport subtracted = orchestrator.run(labState, withCan, "run1");
		assertTrue(subtracted.isComplete());
		assertEquals(1, subtracted.succeeded().size());
		final Spectrum full = plain.succeeded().get(0).intensity().spectrum(0);
		final Spectrum half = subtracted.succeeded().get(0).intensity().spectrum(0);
		int compared = 0;
		for (int i = 0; i < full.nBins(); i++) {
			if (!Double.isFinite(full.y()[i])) {
				assertTrue(Double.isNaN(half.y()[i]));
				continue;
			}
			assertEquals(full.y()[i] / 2, half.y()[i], precision * Math.abs(full.y()[i]));
			assertFalse(Double.isNaN(half.e()[i]));
			compared++;
		}
		assertTrue(compared > 0);
	}

	@Test
	public void testFailingBankDoesNotAbortRun() {
		final DetectorReductionCore failing = new DetectorReductionCore(new ElasticUnitConverter(SyntheticRuns.L1),
				new GeometricMaskingService()) {
			@Override
			public List<ReducedSlice> reduce(final ReductionState s, final RunData r, final ReductionRequest request) {
				if (request.component() == DetectorComponent.HAB) throw new IllegalStateException("HAB offline");
				return super.reduce(s, r, request);
			}
		};
		final ReductionReport report = orchestrator(failing).run(state.withMode(ReductionMode.MERGED), run, "run1");
		assertFalse(report.isComplete());
		assertEquals(1, report.succeeded().size());
		assertEquals(DetectorComponent.LAB, report.succeeded().get(0).component());
		assertEquals(2, report.failures().size());
		final SliceFailure hab = report.failures().get(0);
		assertEquals("run1_hab_sample", hab.outputName());
		assertEquals("HAB offline", hab.reason());
		assertTrue(hab.cause() instanceof IllegalStateException);
		assertEquals("run1_merged_2.0_10.0", report.failures().get(1).outputName());
	}

	@Test(expected = IOException.class)
	public void testLoaderFailurePropagates() throws IOException {
		final DataLoader loader = id -> {
			throw new IOException("No such run: " + id);
		};
		new ReductionOrchestrator(loader, core, new BankMerger()).run(state, "missing");
	}

	@Test
	public void testConcurrentRunMatchesSequential() {
		executor = Executors.newFixedThreadPool(3);
		final ReductionState merged = state.withMode(ReductionMode.MERGED)
				.withWavelengthRanges(List.of(new WavelengthRange(2, 6), new WavelengthRange(6, 10)));
		final ReductionReport sequential = orchestrator(core).run(merged, run, "run1");
		final ReductionReport concurrent = new ReductionOrchestrator(id -> run, core, new BankMerger(), executor)
				.run(merged, run, "run1");
		assertTrue(concurrent.isComplete());
		assertEquals(9, concurrent.succeeded().size());
		assertEquals(names(sequential), names(concurrent));
		for (int k = 0; k < sequential.succeeded().size(); k++) {
			final double[] a = sequential.succeeded().get(k).intensity().spectrum(0).y();
			final double[] b = concurrent.succeeded().get(k).intensity().spectrum(0).y();
			for (int i = 0; i < a.length; i++)
				assertEquals(a[i], b[i], (Double.isNaN(a[i])) ? 0 : precision * Math.abs(a[i]));
		}
	}

	@Test
	public void testTimeSlicedEventRun() {
		final RunData events = SyntheticRuns.eventRun();
		final ReductionState sliced = state.withMode(ReductionMode.LAB)
				.withTimeSlices(List.of(new TimeSlice(0, 50), new TimeSlice(50, 100)), false)
				.withWavelengthRanges(List.of(new WavelengthRange(2, 6)));
		final ReductionReport report = orchestrator(core).run(sliced, events, "ev");
		assertTrue(report.isComplete());
		assertEquals(4, report.succeeded().size());
		assertEquals(4, new HashSet<>(names(report)).size());
		assertTrue(report.output("ev_lab_sample_t0.0_T50.0_2.0_10.0").isPresent());
		assertTrue(report.output("ev_lab_sample_t50.0_T100.0_2.0_6.0").isPresent());
		for (final ReductionOutput output : report.succeeded())
			assertFalse(output.timeSlice().isWholeRun());
	}

	@Test
	public void testAllocatedNamesAreUnique() {
		final RunData withCan = run.withCan(SyntheticRuns.detectors("can", (p, i) -> 1d),
				SyntheticRuns.monitors("can_monitors", 1000d), null);
		final List<SliceKey> keys = orchestrator(core).allocate(state.withMode(ReductionMode.MERGED), withCan, "r");
		assertEquals(4, keys.size());
		final List<String> names = new ArrayList<>();
		for (final SliceKey key : keys)
			names.add(key.outputName());
		assertEquals(List.of("r_lab_sample", "r_hab_sample", "r_lab_can", "r_hab_can"), names);
	}

	private static List<String> names(final ReductionReport report) {
		final List<String> names = new ArrayList<>();
		for (final ReductionOutput output : report.succeeded())
			names.add(output.name());
		return names;
	}
}
