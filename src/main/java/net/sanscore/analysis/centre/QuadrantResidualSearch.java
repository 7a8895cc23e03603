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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.sanscore.SANSUtils;
import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.analysis.reduction.ReductionRequest;
import net.sanscore.data.Workspace;
import net.sanscore.io.RunData;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.DataType;
import net.sanscore.state.MaskShape;
import net.sanscore.state.MaskSpec;
import net.sanscore.state.Quadrant;
import net.sanscore.state.ReductionState;
import net.sanscore.util.Logger;

/**
 * Quadrant method of the beam-centre search. Around a candidate centre the
 * detector is split into four quadrants, each reduced on its own; the centre
 * is where opposite quadrants give the same profile.
 * <p>
 * The first iteration evaluates the start position. Each later iteration
 * moves every searched coordinate by its step; a coordinate whose residual
 * grew reverses and halves its step. The search converges once, for every
 * searched coordinate, the residual change falls below the residual
 * tolerance or the step falls below the position tolerance. The iteration
 * budget is the only other stop.
 * </p>
 *
 * @author SANS-Core developers
 */
class QuadrantResidualSearch {

	private final Logger logger = new Logger(QuadrantResidualSearch.class);
	private final DetectorReductionCore core;
	private final ExecutorService executor;

	QuadrantResidualSearch(final DetectorReductionCore core, final ExecutorService executor) {
		this.core = core;
		this.executor = executor;
	}

	CentreResult search(final ReductionState state, final RunData run, final CentreSearchSettings settings,
			final BeamCentre start, final double initialStep) {
		final FindDirection direction = settings.direction();
		final double tol = settings.tolerance();
		final double residualTol = settings.effectiveResidualTolerance();
		double x = start.position1();
		double y = start.position2();
		double stepX = initialStep;
		double stepY = initialStep;

		double[] residuals = residuals(state, run, settings, x, y);
		double bestX = x;
		double bestY = y;
		double[] best = residuals;
		logger.debug(String.format("Iteration 1: (%.6f, %.6f) LR=%g UD=%g", x, y, residuals[0], residuals[1]));
		if (below(residuals, direction, residualTol))
			return result(x, y, ConvergenceStatus.CONVERGED, 1, residuals, direction);

		for (int iteration = 2; iteration <= settings.maxIterations(); iteration++) {
			if (direction.movesPosition1()) x += stepX;
			if (direction.movesPosition2()) y += stepY;
			final double[] current = residuals(state, run, settings, x, y);
			logger.debug(String.format("Iteration %d: (%.6f, %.6f) LR=%g UD=%g", iteration, x, y, current[0],
					current[1]));
			if (direction.movesPosition1() && current[0] > residuals[0]) stepX = -stepX / 2;
			if (direction.movesPosition2() && current[1] > residuals[1]) stepY = -stepY / 2;
			if (total(current, direction) < total(best, direction)) {
				best = current;
				bestX = x;
				bestY = y;
			}
			final boolean doneX = !direction.movesPosition1() || Math.abs(current[0] - residuals[0]) < residualTol
					|| Math.abs(stepX) < tol;
			final boolean doneY = !direction.movesPosition2() || Math.abs(current[1] - residuals[1]) < residualTol
					|| Math.abs(stepY) < tol;
			residuals = current;
			if (doneX && doneY) return result(x, y, ConvergenceStatus.CONVERGED, iteration, current, direction);
		}
		SANSUtils.log("Beam-centre search reached " + settings.maxIterations() + " iterations; returning best position");
		return result(bestX, bestY, ConvergenceStatus.MAX_ITERATIONS_REACHED, settings.maxIterations(), best,
				direction);
	}

	/**
	 * Returns the left/right and up/down residuals at the given centre.
	 * Residuals of coordinates that are not searched are NaN.
	 */
	double[] residuals(final ReductionState state, final RunData run, final CentreSearchSettings settings,
			final double x, final double y) {
		final ReductionState moved = state.withBeamCentre(settings.component(), new BeamCentre(x, y));
		final Set<Quadrant> quadrants = EnumSet.noneOf(Quadrant.class);
		if (settings.direction().movesPosition1()) quadrants.addAll(EnumSet.of(Quadrant.LEFT, Quadrant.RIGHT));
		if (settings.direction().movesPosition2()) quadrants.addAll(EnumSet.of(Quadrant.UP, Quadrant.DOWN));

		final Map<Quadrant, Future<Workspace>> futures = new EnumMap<>(Quadrant.class);
		for (final Quadrant q : quadrants) {
			final ReductionRequest request = new ReductionRequest(settings.component(), DataType.SAMPLE, null,
					moved.fullWavelengthRange(),
					MaskSpec.ofShapes(new MaskShape.QuadrantWedge(q, 0, 0, settings.radiusMin(), settings.radiusMax())),
					"centre_" + q.name().toLowerCase());
			futures.put(q, executor.submit(() -> core.reduceSlice(moved, run, request).intensity()));
		}
		final Map<Quadrant, Workspace> profiles = new EnumMap<>(Quadrant.class);
		try {
			for (final Map.Entry<Quadrant, Future<Workspace>> entry : futures.entrySet())
				profiles.put(entry.getKey(), entry.getValue().get());
		} catch (final ExecutionException e) {
			futures.values().forEach(f -> f.cancel(true));
			final Throwable cause = e.getCause();
			if (cause instanceof RuntimeException rex) throw rex;
			throw new IllegalStateException("Quadrant reduction failed", cause);
		} catch (final InterruptedException e) {
			futures.values().forEach(f -> f.cancel(true));
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Beam-centre search interrupted", e);
		}
		final double lr = (quadrants.contains(Quadrant.LEFT))
				? residual(profiles.get(Quadrant.LEFT), profiles.get(Quadrant.RIGHT))
				: Double.NaN;
		final double ud = (quadrants.contains(Quadrant.UP))
				? residual(profiles.get(Quadrant.UP), profiles.get(Quadrant.DOWN))
				: Double.NaN;
		return new double[] { lr, ud };
	}

	/**
	 * Sum of squared differences of two profiles over the bins where both are
	 * defined.
	 *
	 * @throws IllegalStateException if the profiles share no bin
	 */
	static double residual(final Workspace a, final Workspace b) {
		final double[] ya = a.spectrum(0).y();
		final double[] yb = b.spectrum(0).y();
		double sum = 0d;
		int n = 0;
		for (int i = 0; i < Math.min(ya.length, yb.length); i++) {
			if (!Double.isFinite(ya[i]) || !Double.isFinite(yb[i])) continue;
			final double d = ya[i] - yb[i];
			sum += d * d;
			n++;
		}
		if (n == 0)
			throw new IllegalStateException("Quadrant profiles " + a.name() + " and " + b.name() + " share no Q bin");
		return sum;
	}

	private static boolean below(final double[] r, final FindDirection d, final double tol) {
		return (!d.movesPosition1() || r[0] < tol) && (!d.movesPosition2() || r[1] < tol);
	}

	private static double total(final double[] r, final FindDirection d) {
		return ((d.movesPosition1()) ? r[0] : 0d) + ((d.movesPosition2()) ? r[1] : 0d);
	}

	private static CentreResult result(final double x, final double y, final ConvergenceStatus status,
			final int iterations, final double[] r, final FindDirection d) {
		return new CentreResult(x, y, status, iterations, (d.movesPosition1()) ? r[0] : Double.NaN,
				(d.movesPosition2()) ? r[1] : Double.NaN, null);
	}
}
