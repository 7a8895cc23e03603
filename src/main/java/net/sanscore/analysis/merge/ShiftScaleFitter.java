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

package net.sanscore.analysis.merge;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import net.sanscore.state.FitPolicy;

/**
 * Fits the relation {@code I_LAB = scale * I_HAB + A0} over the overlap of
 * the two banks. The reported shift is {@code A0 / scale}, so that the
 * rescaled high-angle bank reads {@code scale * (I_HAB + shift)}.
 *
 * @author SANS-Core developers
 */
public class ShiftScaleFitter {

	/**
	 * Fitted parameters.
	 *
	 * @param rSquared coefficient of determination of the fit (NaN if nothing
	 *                 was fitted)
	 */
	public record Fit(double scale, double shift, double rSquared) {
	}

	/**
	 * Determines scale and shift.
	 *
	 * @param lab    low-angle intensities of the overlap bins
	 * @param hab    high-angle intensities of the same bins
	 * @param policy which parameters are fitted
	 * @param scale  configured scale (kept unless fitted)
	 * @param shift  configured shift (kept unless fitted)
	 * @throws InsufficientOverlapException if the policy requires a fit and
	 *                                      there are fewer than two bins, or
	 *                                      the fit is degenerate
	 */
	public Fit fit(final double[] lab, final double[] hab, final FitPolicy policy, final double scale,
			final double shift) {
		if (lab.length != hab.length) throw new IllegalArgumentException("Overlap arrays differ in length");
		if (!policy.requiresFit()) return new Fit(scale, shift, Double.NaN);
		if (lab.length < 2)
			throw new InsufficientOverlapException(policy + " fit needs at least 2 overlapping bins, got " + lab.length);
		return switch (policy) {
			case BOTH -> fitBoth(lab, hab);
			case SHIFT_ONLY -> fitShift(lab, hab, scale);
			case SCALE_ONLY -> fitScale(lab, hab, shift);
			case NO_FIT -> new Fit(scale, shift, Double.NaN);
		};
	}

	private Fit fitBoth(final double[] lab, final double[] hab) {
		if (StatUtils.variance(hab) == 0)
			throw new InsufficientOverlapException("High-angle intensity is constant over the overlap");
		final double s;
		final double a0;
		final double r2;
		if (lab.length == 2) {
			s = (lab[1] - lab[0]) / (hab[1] - hab[0]);
			a0 = lab[0] - s * hab[0];
			r2 = 1d;
		} else {
			final SimpleRegression regression = new SimpleRegression();
			for (int i = 0; i < lab.length; i++)
				regression.addData(hab[i], lab[i]);
			s = regression.getSlope();
			a0 = regression.getIntercept();
			r2 = regression.getRSquare();
		}
		checkScale(s);
		return new Fit(s, a0 / s, r2);
	}

	private Fit fitShift(final double[] lab, final double[] hab, final double scale) {
		final double[] a = new double[lab.length];
		for (int i = 0; i < lab.length; i++)
			a[i] = lab[i] - scale * hab[i];
		final double a0 = StatUtils.mean(a);
		return new Fit(scale, a0 / scale, rSquared(lab, hab, scale, a0));
	}

	private Fit fitScale(final double[] lab, final double[] hab, final double shift) {
		double num = 0d;
		double den = 0d;
		for (int i = 0; i < lab.length; i++) {
			final double h = hab[i] + shift;
			num += lab[i] * h;
			den += h * h;
		}
		if (den == 0)
			throw new InsufficientOverlapException("Shifted high-angle intensity vanishes over the overlap");
		final double s = num / den;
		checkScale(s);
		return new Fit(s, shift, rSquared(lab, hab, s, s * shift));
	}

	private static void checkScale(final double s) {
		if (s == 0 || !Double.isFinite(s))
			throw new InsufficientOverlapException("Degenerate merge fit: scale = " + s);
	}

	/** 1 - SSres/SStot of the model lab = scale * hab + a0. */
	static double rSquared(final double[] lab, final double[] hab, final double scale, final double a0) {
		final double mean = StatUtils.mean(lab);
		double ssRes = 0d;
		double ssTot = 0d;
		for (int i = 0; i < lab.length; i++) {
			final double f = scale * hab[i] + a0;
			ssRes += (lab[i] - f) * (lab[i] - f);
			ssTot += (lab[i] - mean) * (lab[i] - mean);
		}
		return (ssTot == 0) ? Double.NaN : 1.0 - (ssRes / ssTot);
	}
}
