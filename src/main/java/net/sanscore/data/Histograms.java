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

import java.util.Arrays;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Static utilities for histogram arithmetic on bin edges.
 *
 * @author SANS-Core developers
 */
public final class Histograms {

	private Histograms() {
	} // no instantiation

	/**
	 * Returns the index of the bin containing {@code value}, or -1 if it lies
	 * outside the edges. Bins are closed on the left and open on the right.
	 */
	public static int binIndex(final double[] edges, final double value) {
		if (edges.length < 2 || !(value >= edges[0]) || !(value < edges[edges.length - 1]))
			return -1;
		final int pos = Arrays.binarySearch(edges, value);
		if (pos >= 0) return Math.min(pos, edges.length - 2);
		return -pos - 2;
	}

	public static double[] centres(final double[] edges) {
		final double[] c = new double[edges.length - 1];
		for (int i = 0; i < c.length; i++)
			c[i] = 0.5 * (edges[i] + edges[i + 1]);
		return c;
	}

	public static boolean isAscending(final double[] values) {
		for (int i = 1; i < values.length; i++) {
			if (values[i] < values[i - 1]) return false;
		}
		return true;
	}

	/**
	 * Redistributes histogram counts onto new bin edges, assuming counts are
	 * uniformly distributed within each old bin. Errors are added in quadrature.
	 *
	 * @return a two-row array: rebinned counts and errors
	 */
	public static double[][] rebin(final double[] xOld, final double[] y, final double[] e, final double[] xNew) {
		final int nNew = xNew.length - 1;
		final double[] yNew = new double[nNew];
		final double[] varNew = new double[nNew];
		int j = 0;
		for (int i = 0; i < nNew; i++) {
			final double lo = xNew[i];
			final double hi = xNew[i + 1];
			while (j < y.length && xOld[j + 1] <= lo)
				j++;
			for (int k = j; k < y.length && xOld[k] < hi; k++) {
				final double width = xOld[k + 1] - xOld[k];
				if (width <= 0) continue;
				final double overlap = Math.min(hi, xOld[k + 1]) - Math.max(lo, xOld[k]);
				if (overlap <= 0) continue;
				final double f = overlap / width;
				yNew[i] += f * y[k];
				varNew[i] += f * f * e[k] * e[k];
			}
		}
		final double[] eNew = new double[nNew];
		for (int i = 0; i < nNew; i++)
			eNew[i] = Math.sqrt(varNew[i]);
		return new double[][] { yNew, eNew };
	}

	/**
	 * Flags every new bin that overlaps a flagged old bin.
	 */
	public static boolean[] transferFlags(final double[] xOld, final boolean[] flags, final double[] xNew) {
		final boolean[] out = new boolean[xNew.length - 1];
		for (int k = 0; k < flags.length; k++) {
			if (!flags[k]) continue;
			final double lo = Math.min(xOld[k], xOld[k + 1]);
			final double hi = Math.max(xOld[k], xOld[k + 1]);
			for (int i = 0; i < out.length; i++) {
				if (xNew[i] < hi && xNew[i + 1] > lo) out[i] = true;
			}
		}
		return out;
	}

	/**
	 * Replaces the values of the bins lying entirely inside [start, stop] by a
	 * linear interpolation between the nearest bins outside the window.
	 *
	 * @return the number of bins replaced
	 */
	public static int interpolateAcross(final double[] x, final double[] y, final double[] e, final double start,
			final double stop) {
		int first = -1;
		int last = -1;
		for (int i = 0; i < y.length; i++) {
			if (x[i] >= start && x[i + 1] <= stop) {
				if (first < 0) first = i;
				last = i;
			}
		}
		if (first < 0) return 0;
		final double[] c = centres(x);
		final int left = first - 1;
		final int right = last + 1;
		final PolynomialSplineFunction line = (left >= 0 && right < y.length)
				? new LinearInterpolator().interpolate(new double[] { c[left], c[right] },
						new double[] { y[left], y[right] })
				: null;
		for (int i = first; i <= last; i++) {
			if (line != null) {
				final double f = (c[i] - c[left]) / (c[right] - c[left]);
				y[i] = line.value(c[i]);
				e[i] = Math.sqrt((1 - f) * (1 - f) * e[left] * e[left] + f * f * e[right] * e[right]);
			} else if (left >= 0) {
				y[i] = y[left];
				e[i] = e[left];
			} else if (right < y.length) {
				y[i] = y[right];
				e[i] = e[right];
			} else {
				y[i] = 0d;
				e[i] = 0d;
			}
		}
		return last - first + 1;
	}

	/**
	 * Returns the reversed copy of an array.
	 */
	public static double[] reversed(final double[] values) {
		final double[] r = new double[values.length];
		for (int i = 0; i < values.length; i++)
			r[i] = values[values.length - 1 - i];
		return r;
	}

	public static boolean[] reversed(final boolean[] values) {
		final boolean[] r = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
			r[i] = values[values.length - 1 - i];
		return r;
	}
}
