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

package net.sanscore.analysis.reduction;

import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.state.DataType;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.TimeSlice;
import net.sanscore.state.WavelengthRange;

/**
 * Output of one reduction: summed counts and summed normalization per Q bin.
 * Keeping both lets consumers recompute ratios, e.g. when merging or
 * subtracting, without reducing again.
 *
 * @param counts        single-spectrum counts workspace in momentum transfer
 * @param normalization single-spectrum normalization workspace, same bins
 * @author SANS-Core developers
 */
public record ReducedSlice(DetectorComponent component, DataType dataType, TimeSlice timeSlice,
		WavelengthRange wavelengthRange, Workspace counts, Workspace normalization) {

	public ReducedSlice {
		if (counts.unit() != XUnit.MOMENTUM_TRANSFER || normalization.unit() != XUnit.MOMENTUM_TRANSFER)
			throw new IllegalArgumentException("Reduced slices are in momentum transfer");
		if (counts.size() != 1 || normalization.size() != 1)
			throw new IllegalArgumentException("Reduced slices hold a single spectrum");
	}

	public double[] qEdges() {
		return counts.spectrum(0).x();
	}

	/**
	 * Returns counts divided by normalization. Bins without normalization are
	 * NaN.
	 */
	public Workspace intensity() {
		final Spectrum c = counts.spectrum(0);
		final Spectrum n = normalization.spectrum(0);
		final double[] y = new double[c.nBins()];
		final double[] e = new double[y.length];
		for (int i = 0; i < y.length; i++) {
			final double norm = n.y()[i];
			if (!(norm > 0)) {
				y[i] = Double.NaN;
				e[i] = Double.NaN;
				continue;
			}
			y[i] = c.y()[i] / norm;
			e[i] = Math.hypot(c.e()[i] / norm, y[i] * n.e()[i] / norm);
		}
		return Workspace.of(counts.name().replace("_counts", "") + "_intensity", XUnit.MOMENTUM_TRANSFER,
				c.x().clone(), y, e);
	}
}
