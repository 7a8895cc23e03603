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

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.sanscore.SANSUtils;
import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.io.PersistenceService;
import net.sanscore.io.RunData;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.ReductionState;
import net.sanscore.util.Logger;

/**
 * Finds the beam centre of a detector bank, either with the quadrant method
 * or the centre-of-mass method. The found position is stored as a one-row
 * table with the columns {@value #COLUMN_X} and {@value #COLUMN_Y}.
 *
 * @author SANS-Core developers
 */
public class BeamCentreFinder {

	public static final String COLUMN_X = "X Position";
	public static final String COLUMN_Y = "Y Position";

	private final Logger logger = new Logger(BeamCentreFinder.class);
	private final DetectorReductionCore core;
	private final PersistenceService persistence;
	private final ExecutorService executor;

	/**
	 * @param executor runs the quadrant reductions; if null, a pool is created
	 *                 (and shut down) for every search
	 */
	public BeamCentreFinder(final DetectorReductionCore core, final PersistenceService persistence,
			final ExecutorService executor) {
		this.core = core;
		this.persistence = persistence;
		this.executor = executor;
	}

	public BeamCentreFinder(final DetectorReductionCore core, final PersistenceService persistence) {
		this(core, persistence, null);
	}

	/**
	 * Searches the beam centre.
	 *
	 * @param state    the reduction state; its beam centre is the default start
	 * @param run      the run, typically a direct or strongly scattering sample
	 * @param settings the search settings
	 * @return the found centre; an exhausted budget is reported in the status
	 */
	public CentreResult findCentre(final ReductionState state, final RunData run,
			final CentreSearchSettings settings) {
		final BeamCentre start = (settings.start() == null) ? state.beamCentre(settings.component()) : settings.start();
		final CentreResult result = switch (settings.method()) {
			case QUADRANT -> quadrant(state, run, settings, start);
			case CENTRE_OF_MASS -> new CentreOfMassSearch(core).search(state, run, settings, start);
		};
		final String id = persistence.saveTable(List.<double[]>of(new double[] { result.position1(), result.position2() }),
				List.of(COLUMN_X, COLUMN_Y));
		logger.info(String.format("%s centre of %s: (%s, %s) m, %s after %d iteration(s)", settings.method(),
				settings.component(), SANSUtils.formatDouble(result.position1(), 5),
				SANSUtils.formatDouble(result.position2(), 5), result.status(), result.iterations()));
		return result.withTableId(id);
	}

	private CentreResult quadrant(final ReductionState state, final RunData run, final CentreSearchSettings settings,
			final BeamCentre start) {
		final double step = (settings.step() == null) ? state.geometry().instrument().centreFinderStep()
				: settings.step();
		final ExecutorService es = (executor == null) ? Executors.newFixedThreadPool(4) : executor;
		try {
			return new QuadrantResidualSearch(core, es).search(state, run, settings, start, step);
		} finally {
			if (executor == null) es.shutdown();
		}
	}
}
