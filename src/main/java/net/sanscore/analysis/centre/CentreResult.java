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

/**
 * Result of a beam-centre search.
 *
 * @param position1       horizontal beam-centre position, in metres
 * @param position2       vertical beam-centre position, in metres
 * @param status          whether the search converged
 * @param iterations      iterations (or passes) used
 * @param residualLR      final left/right residual (NaN if not searched)
 * @param residualUD      final up/down residual (NaN if not searched)
 * @param tableId         identifier of the persisted position table
 * @author SANS-Core developers
 */
public record CentreResult(double position1, double position2, ConvergenceStatus status, int iterations,
		double residualLR, double residualUD, String tableId) {

	public boolean converged() {
		return status == ConvergenceStatus.CONVERGED;
	}

	public BeamCentre toBeamCentre() {
		return new BeamCentre(position1, position2);
	}

	CentreResult withTableId(final String id) {
		return new CentreResult(position1, position2, status, iterations, residualLR, residualUD, id);
	}
}
