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

import net.sanscore.state.BeamCentre;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.DetectorComponent;

/**
 * Settings of a beam-centre search.
 *
 * @param method        the search algorithm
 * @param maxIterations the iteration budget (number of passes of the
 *                      centre-of-mass method)
 * @param tolerance     convergence tolerance of steps and moves, in metres
 * @param direction     which coordinates are searched
 * @param start         start position, or null for the state's beam centre
 * @param radiusMin     inner radius limit, in metres
 * @param radiusMax     outer radius limit, in metres
 * @param component     the detector bank
 * @param step          initial step of the quadrant method, or null for the
 *                      instrument default
 * @param radiusShrink  factor applied to the inner radius after each
 *                      centre-of-mass pass
 * @param residualTolerance convergence tolerance of quadrant residuals and
 *                      of their changes, in squared intensity units, or
 *                      null to use {@code tolerance}
 * @author SANS-Core developers
 */
public record CentreSearchSettings(CentreFinderMethod method, int maxIterations, double tolerance,
		FindDirection direction, BeamCentre start, double radiusMin, double radiusMax, DetectorComponent component,
		Double step, double radiusShrink, Double residualTolerance) {

	public static final int DEF_MAX_ITERATIONS = 10;
	public static final double DEF_TOLERANCE = 1.251e-4;
	public static final double DEF_RADIUS_MIN = 0.06;
	public static final double DEF_RADIUS_MAX = 0.28;

	public CentreSearchSettings {
		method = (method == null) ? CentreFinderMethod.QUADRANT : method;
		direction = (direction == null) ? FindDirection.ALL : direction;
		component = (component == null) ? DetectorComponent.LAB : component;
		if (maxIterations < 1)
			throw new ConfigurationException("At least one iteration is required: " + maxIterations);
		if (!(tolerance > 0)) throw new ConfigurationException("Tolerance must be positive: " + tolerance);
		if (radiusMin < 0 || !(radiusMin < radiusMax))
			throw new ConfigurationException("Invalid radius limits: [" + radiusMin + ", " + radiusMax + "]");
		if (step != null && !(step > 0)) throw new ConfigurationException("Step must be positive: " + step);
		if (!(radiusShrink > 0) || radiusShrink > 1)
			throw new ConfigurationException("Radius shrink factor must be in (0, 1]: " + radiusShrink);
		if (residualTolerance != null && !(residualTolerance > 0))
			throw new ConfigurationException("Residual tolerance must be positive: " + residualTolerance);
	}

	public static CentreSearchSettings defaults() {
		return new CentreSearchSettings(CentreFinderMethod.QUADRANT, DEF_MAX_ITERATIONS, DEF_TOLERANCE,
				FindDirection.ALL, null, DEF_RADIUS_MIN, DEF_RADIUS_MAX, DetectorComponent.LAB, null, 1d, null);
	}

	public CentreSearchSettings withMethod(final CentreFinderMethod m) {
		return new CentreSearchSettings(m, maxIterations, tolerance, direction, start, radiusMin, radiusMax, component,
				step, radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withIterations(final int iterations, final double tol) {
		return new CentreSearchSettings(method, iterations, tol, direction, start, radiusMin, radiusMax, component,
				step, radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withDirection(final FindDirection d) {
		return new CentreSearchSettings(method, maxIterations, tolerance, d, start, radiusMin, radiusMax, component,
				step, radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withStart(final BeamCentre position) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, position, radiusMin, radiusMax,
				component, step, radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withRadiusLimits(final double min, final double max) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, start, min, max, component, step,
				radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withComponent(final DetectorComponent c) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, start, radiusMin, radiusMax, c,
				step, radiusShrink, residualTolerance);
	}

	public CentreSearchSettings withStep(final Double initialStep) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, start, radiusMin, radiusMax,
				component, initialStep, radiusShrink, residualTolerance);
	}

	/** The tolerance applied to quadrant residuals. */
	public double effectiveResidualTolerance() {
		return (residualTolerance == null) ? tolerance : residualTolerance;
	}

	public CentreSearchSettings withResidualTolerance(final Double tol) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, start, radiusMin, radiusMax,
				component, step, radiusShrink, tol);
	}

	public CentreSearchSettings withRadiusShrink(final double shrink) {
		return new CentreSearchSettings(method, maxIterations, tolerance, direction, start, radiusMin, radiusMax,
				component, step, shrink, residualTolerance);
	}
}
