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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.sanscore.analysis.merge.BankMerger;
import net.sanscore.analysis.merge.MergeResult;
import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.analysis.reduction.ReducedSlice;
import net.sanscore.analysis.reduction.ReductionRequest;
import net.sanscore.io.DataLoader;
import net.sanscore.io.RunData;
import net.sanscore.state.DataType;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.ReductionState;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;
import net.sanscore.util.Logger;

/**
 * Drives the reduction of a whole run: every time slice, data type and
 * detector bank the state asks for is reduced, the can is subtracted from the
 * sample and, in merged mode, the two banks are merged. A failing slice is
 * recorded in the {@link ReductionReport} and never aborts the other slices.
 * Output names are allocated before any slice is reduced, so they do not
 * depend on the order in which concurrent slices complete.
 *
 * @author SANS-Core developers
 */
public class ReductionOrchestrator {

	private final Logger logger = new Logger(ReductionOrchestrator.class);
	private final DataLoader loader;
	private final DetectorReductionCore core;
	private final BankMerger merger;
	private final CanSubtractor canSubtractor;
	private final ExecutorService executor;

	/**
	 * @param executor runs the slice reductions concurrently; if null, slices
	 *                 are reduced one after the other
	 */
	public ReductionOrchestrator(final DataLoader loader, final DetectorReductionCore core, final BankMerger merger,
			final ExecutorService executor) {
		this.loader = loader;
		this.core = core;
		this.merger = merger;
		this.canSubtractor = new CanSubtractor();
		this.executor = executor;
	}

	public ReductionOrchestrator(final DataLoader loader, final DetectorReductionCore core, final BankMerger merger) {
		this(loader, core, merger, null);
	}

	/**
	 * Loads and reduces a run.
	 *
	 * @throws IOException if the run cannot be loaded
	 */
	public ReductionReport run(final ReductionState state, final String runIdentifier) throws IOException {
		logger.info("Loading run " + runIdentifier);
		final RunData run = loader.load(runIdentifier);
		return run(state, run, runIdentifier);
	}

	/** Reduces an already loaded run. */
	public ReductionReport run(final ReductionState state, final RunData run, final String runIdentifier) {
		final List<SliceKey> keys = allocate(state, run, runIdentifier);
		final Map<SliceKey, List<ReducedSlice>> reduced = new LinkedHashMap<>();
		final List<SliceFailure> failures = new ArrayList<>();
		if (executor == null) {
			for (final SliceKey key : keys) {
				try {
					reduced.put(key, reduce(state, run, key));
				} catch (final RuntimeException e) {
					failures.add(fail(key.outputName(), key.timeSlice(), e));
				}
			}
		} else {
			final Map<SliceKey, Future<List<ReducedSlice>>> futures = new LinkedHashMap<>();
			for (final SliceKey key : keys) {
				final Callable<List<ReducedSlice>> task = () -> reduce(state, run, key);
				futures.put(key, executor.submit(task));
			}
			for (final Map.Entry<SliceKey, Future<List<ReducedSlice>>> entry : futures.entrySet()) {
				final SliceKey key = entry.getKey();
				try {
					reduced.put(key, entry.getValue().get());
				} catch (final ExecutionException e) {
					failures.add(fail(key.outputName(), key.timeSlice(), e.getCause()));
				} catch (final InterruptedException e) {
					Thread.currentThread().interrupt();
					failures.add(fail(key.outputName(), key.timeSlice(), e));
				}
			}
		}
		final List<ReductionOutput> outputs = assemble(state, run, runIdentifier, keys, reduced, failures);
		logger.info(String.format("Run %s: %d output(s), %d failure(s)", runIdentifier, outputs.size(),
				failures.size()));
		return new ReductionReport(runIdentifier, outputs, failures);
	}

	/** Lists the reductions of a run, each with a unique output name. */
	List<SliceKey> allocate(final ReductionState state, final RunData run, final String runIdentifier) {
		final List<DataType> types = (run.hasCan()) ? List.of(DataType.SAMPLE, DataType.CAN)
				: List.of(DataType.SAMPLE);
		final Set<String> names = new HashSet<>();
		final List<SliceKey> keys = new ArrayList<>();
		for (final TimeSlice slice : state.timeSlices()) {
			for (final DataType type : types) {
				for (final DetectorComponent component : state.mode().components()) {
					final String base = runIdentifier + "_" + component.name().toLowerCase() + "_"
							+ type.name().toLowerCase() + slice.label();
					String name = base;
					for (int i = 1; !names.add(name); i++)
						name = base + "_" + i;
					keys.add(new SliceKey(component, type, slice, name));
				}
			}
		}
		return keys;
	}

	private List<ReducedSlice> reduce(final ReductionState state, final RunData run, final SliceKey key) {
		logger.debug("Reducing " + key.outputName());
		final ReductionRequest request = ReductionRequest.of(key.component(), key.dataType(), key.timeSlice())
				.withOutputName(key.outputName());
		return core.reduce(state, run, request);
	}

	private List<ReductionOutput> assemble(final ReductionState state, final RunData run, final String runIdentifier,
			final List<SliceKey> keys, final Map<SliceKey, List<ReducedSlice>> reduced,
			final List<SliceFailure> failures) {
		final List<ReductionOutput> outputs = new ArrayList<>();
		final List<WavelengthRange> ranges = state.allWavelengthRanges();
		for (final TimeSlice slice : state.timeSlices()) {
			for (int r = 0; r < ranges.size(); r++) {
				final WavelengthRange range = ranges.get(r);
				final Map<DetectorComponent, ReducedSlice> banks = new LinkedHashMap<>();
				for (final DetectorComponent component : state.mode().components()) {
					final SliceKey sample = find(keys, component, DataType.SAMPLE, slice);
					final String name = sample.outputName() + "_" + range.label();
					if (!reduced.containsKey(sample)) continue;
					ReducedSlice profile = reduced.get(sample).get(r);
					if (run.hasCan()) {
						final SliceKey can = find(keys, component, DataType.CAN, slice);
						if (!reduced.containsKey(can)) {
							failures.add(new SliceFailure(name, slice,
									"can reduction " + can.outputName() + " failed", null));
							continue;
						}
						try {
							profile = canSubtractor.subtract(profile, reduced.get(can).get(r));
						} catch (final RuntimeException e) {
							failures.add(fail(name, slice, e));
							continue;
						}
					}
					banks.put(component, profile);
					outputs.add(new ReductionOutput(name, component, slice, range, profile.intensity(), null));
				}
				if (state.mode().merges()) {
					final String name = runIdentifier + "_merged" + slice.label() + "_" + range.label();
					final ReducedSlice lab = banks.get(DetectorComponent.LAB);
					final ReducedSlice hab = banks.get(DetectorComponent.HAB);
					if (lab == null || hab == null) {
						failures.add(new SliceFailure(name, slice, "a detector bank could not be reduced", null));
						continue;
					}
					try {
						final MergeResult result = merger.merge(lab, hab, state.merge());
						outputs.add(new ReductionOutput(name, null, slice, range, result.merged(), result));
					} catch (final RuntimeException e) {
						failures.add(fail(name, slice, e));
					}
				}
			}
		}
		return outputs;
	}

	private static SliceKey find(final List<SliceKey> keys, final DetectorComponent component, final DataType type,
			final TimeSlice slice) {
		for (final SliceKey key : keys) {
			if (key.component() == component && key.dataType() == type && key.timeSlice().equals(slice)) return key;
		}
		throw new IllegalStateException("No reduction allocated for " + component + " " + type + " " + slice);
	}

	private SliceFailure fail(final String name, final TimeSlice slice, final Throwable cause) {
		final String reason = (cause == null || cause.getMessage() == null) ? String.valueOf(cause)
				: cause.getMessage();
		logger.warn("Reduction of " + name + " failed: " + reason);
		return new SliceFailure(name, slice, reason, cause);
	}
}
