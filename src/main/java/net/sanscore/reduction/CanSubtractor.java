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

import net.sanscore.analysis.reduction.ReducedSlice;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.state.ConfigurationException;

/**
 * Subtracts the reduced empty-can profile from the reduced sample profile.
 * The difference is returned as a slice whose counts hold the subtracted
 * intensity and whose normalization is 1 wherever both profiles are defined
 * and 0 elsewhere, so that it can be merged like any other slice.
 *
 * @author SANS-Core developers
 */
public class CanSubtractor {

	public ReducedSlice subtract(final ReducedSlice sample, final ReducedSlice can) {
		if (sample.component() != can.component())
			throw new ConfigurationException("Cannot subtract a " + can.component() + " can from a "
					+ sample.component() + " sample");
		final Spectrum s = sample.intensity().spectrum(0);
		final Spectrum c = can.intensity().spectrum(0);
		if (s.nBins() != c.nBins())
			throw new ConfigurationException("Sample and can profiles have different Q binning");
		final int n = s.nBins();
		final double[] y = new double[n];
		final double[] e = new double[n];
		final double[] norm = new double[n];
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(s.y()[i]) || !Double.isFinite(c.y()[i])) continue;
			y[i] = s.y()[i] - c.y()[i];
			e[i] = Math.hypot(s.e()[i], c.e()[i]);
			norm[i] = 1d;
		}
		final String name = sample.counts().name().replace("_counts", "") + "_can_subtracted";
		return new ReducedSlice(sample.component(), sample.dataType(), sample.timeSlice(), sample.wavelengthRange(),
				Workspace.of(name + "_counts", XUnit.MOMENTUM_TRANSFER, s.x().clone(), y, e),
				Workspace.of(name + "_norm", XUnit.MOMENTUM_TRANSFER, s.x().clone(), norm, new double[n]));
	}
}
