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

import net.sanscore.analysis.reduction.DetectorReductionCore;
import net.sanscore.analysis.reduction.ReductionRequest;
import net.sanscore.data.DetectorPixel;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.io.RunData;
import net.sanscore.state.BeamCentre;
import net.sanscore.state.DataType;
import net.sanscore.state.ReductionState;
import net.sanscore.util.Logger;

/**
 * Centre-of-mass method of the beam-centre search: the intensity-weighted
 * centroid of the pixels lying between the inner and outer radius around the
 * current estimate. Each pass re-centres on the previous estimate and shrinks
 * the inner radius.
 * <p>
 * Pixel weights are the wavelength-integrated intensities of the reduction
 * core, so monitor normalization, absolute scale and pixel adjustments apply
 * as in a full reduction. The state's radius limits are lifted; the search
 * applies its own around each estimate.
 * </p>
 *
 * @author SANS-Core developers
 */
class CentreOfMassSearch {

	private final Logger logger = new Logger(CentreOfMassSearch.class);
	private final DetectorReductionCore core;

	CentreOfMassSearch(final DetectorReductionCore core) {
		this.core = core;
	}

	CentreResult search(final ReductionState state, final RunData run, final CentreSearchSettings settings,
			final BeamCentre start) {
		final ReductionState labFrame = state.withBeamCentre(settings.component(), BeamCentre.ORIGIN)
				.withMasking(state.masking().withRadiusLimits(0, 0));
		final ReductionRequest request = new ReductionRequest(settings.component(), DataType.SAMPLE, null,
				labFrame.fullWavelengthRange(), null, "centre_of_mass");
		final Workspace pixels = core.reducePixels(labFrame, run, request);

		final int n = pixels.size();
		final double[] px = new double[n];
		final double[] py = new double[n];
		final double[] w = new double[n];
		for (int i = 0; i < n; i++) {
			final Spectrum s = pixels.spectrum(i);
			final DetectorPixel p = s.pixel();
			if (p == null || s.isMasked()) continue;
			px[i] = p.x();
			py[i] = p.y();
			w[i] = s.y()[0];
		}
		pixels.release();

		final FindDirection direction = settings.direction();
		double x = start.position1();
		double y = start.position2();
		double radius = settings.radiusMin();
		for (int pass = 1; pass <= settings.maxIterations(); pass++) {
			double sum = 0d;
			double sx = 0d;
			double sy = 0d;
			for (int i = 0; i < n; i++) {
				if (!(w[i] > 0)) continue;
				final double r = Math.hypot(px[i] - x, py[i] - y);
				if (r < radius || r > settings.radiusMax()) continue;
				sum += w[i];
				sx += w[i] * px[i];
				sy += w[i] * py[i];
			}
			if (!(sum > 0))
				throw new IllegalStateException("No intensity between radii " + radius + " and "
						+ settings.radiusMax() + " around (" + x + ", " + y + ")");
			final double newX = (direction.movesPosition1()) ? sx / sum : x;
			final double newY = (direction.movesPosition2()) ? sy / sum : y;
			final double shift = Math.hypot(newX - x, newY - y);
			x = newX;
			y = newY;
			radius *= settings.radiusShrink();
			logger.debug(String.format("Pass %d: (%.6f, %.6f), moved %.3g m", pass, x, y, shift));
			if (shift < settings.tolerance())
				return new CentreResult(x, y, ConvergenceStatus.CONVERGED, pass, Double.NaN, Double.NaN, null);
		}
		return new CentreResult(x, y, ConvergenceStatus.MAX_ITERATIONS_REACHED, settings.maxIterations(), Double.NaN,
				Double.NaN, null);
	}
}
