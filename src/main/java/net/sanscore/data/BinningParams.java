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

package net.sanscore.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebin parameters: lower bound, step and upper bound. A linear step is a bin
 * width; a logarithmic step is the relative growth of consecutive bin widths
 * ({@code x[i+1] = x[i] * (1 + step)}). The last bin is truncated at
 * {@code max}.
 *
 * @author SANS-Core developers
 */
public record BinningParams(double min, double step, double max, boolean logarithmic) {

	/* Remainders smaller than this fraction of a step are merged into the previous bin */
	private static final double MERGE_FRACTION = 1e-9;

	public BinningParams {
		if (!(min < max))
			throw new IllegalArgumentException("Binning lower bound must be smaller than upper bound: " + min + " >= " + max);
		if (!(step > 0))
			throw new IllegalArgumentException("Binning step must be positive: " + step);
		if (logarithmic && !(min > 0))
			throw new IllegalArgumentException("Logarithmic binning requires a positive lower bound");
	}

	public static BinningParams linear(final double min, final double step, final double max) {
		return new BinningParams(min, step, max, false);
	}

	public static BinningParams logarithmic(final double min, final double step, final double max) {
		return new BinningParams(min, step, max, true);
	}

	/** Returns the number of bins these parameters produce. */
	public int nBins() {
		return edges().length - 1;
	}

	/** Returns the ascending bin edges. */
	public double[] edges() {
		final List<Double> edges = new ArrayList<>();
		double x = min;
		edges.add(x);
		while (true) {
			final double width = (logarithmic) ? x * step : step;
			final double next = x + width;
			if (next >= max || (max - next) < MERGE_FRACTION * width) {
				edges.add(max);
				break;
			}
			edges.add(next);
			x = next;
		}
		return edges.stream().mapToDouble(d -> d).toArray();
	}

	/** Returns a copy with different bounds and the same step. */
	public BinningParams withRange(final double newMin, final double newMax) {
		return new BinningParams(newMin, step, newMax, logarithmic);
	}

	@Override
	public String toString() {
		return min + "," + ((logarithmic) ? -step : step) + "," + max;
	}
}
