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

import java.util.ArrayList;
import java.util.List;

import net.sanscore.analysis.reduction.ReducedSlice;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.FitPolicy;
import net.sanscore.state.MergeSettings;
import net.sanscore.util.Logger;

/**
 * Merges the reduced profiles of the low-angle (LAB) and high-angle (HAB)
 * banks into one profile. The HAB profile is rescaled to
 * {@code scale * (I_HAB + shift)}, with scale and shift taken from the
 * settings or fitted over the overlap of the two banks; bins covered by both
 * banks are then combined by a {@link Stitcher}.
 *
 * @author SANS-Core developers
 */
public class BankMerger {

	/* Relative tolerance when comparing Q bin edges */
	private static final double EDGE_TOLERANCE = 1e-9;

	private final Logger logger = new Logger(BankMerger.class);
	private final ShiftScaleFitter fitter;
	private final Stitcher stitcher;

	public BankMerger() {
		this(new InverseVarianceStitcher());
	}

	public BankMerger(final Stitcher stitcher) {
		this.fitter = new ShiftScaleFitter();
		this.stitcher = stitcher;
	}

	/**
	 * Merges with the given policy and default ranges.
	 *
	 * @see #merge(ReducedSlice, ReducedSlice, MergeSettings)
	 */
	public MergeResult merge(final ReducedSlice lab, final ReducedSlice hab, final FitPolicy policy,
			final double scale, final double shift) {
		return merge(lab, hab, MergeSettings.of(policy, scale, shift));
	}

	/**
	 * Merges two reduced profiles.
	 *
	 * @param lab      the low-angle profile
	 * @param hab      the high-angle profile, on the same Q bins
	 * @param settings fit policy, configured scale and shift, fit and merge
	 *                 ranges
	 * @return the merged profile with the scale and shift used
	 * @throws ConfigurationException       if the profiles have different Q bins
	 * @throws InsufficientOverlapException if a fit is required but impossible
	 */
	public MergeResult merge(final ReducedSlice lab, final ReducedSlice hab, final MergeSettings settings) {
		final double[] q = lab.qEdges();
		checkEdges(q, hab.qEdges());
		final double[] centres = Histograms.centres(q);
		final Spectrum iLab = lab.intensity().spectrum(0);
		final Spectrum iHab = hab.intensity().spectrum(0);
		final boolean[] inLab = covered(iLab, lab.normalization().spectrum(0));
		final boolean[] inHab = covered(iHab, hab.normalization().spectrum(0));

		final List<Integer> overlap = new ArrayList<>();
		for (int i = 0; i < centres.length; i++) {
			if (!inLab[i] || !inHab[i]) continue;
			if (settings.fitMin() != null && centres[i] < settings.fitMin()) continue;
			if (settings.fitMax() != null && centres[i] > settings.fitMax()) continue;
			overlap.add(i);
		}
		final double[] yl = new double[overlap.size()];
		final double[] yh = new double[overlap.size()];
		for (int k = 0; k < yl.length; k++) {
			yl[k] = iLab.y()[overlap.get(k)];
			yh[k] = iHab.y()[overlap.get(k)];
		}
		final ShiftScaleFitter.Fit fit = fitter.fit(yl, yh, settings.policy(), settings.scale(), settings.shift());
		if (settings.policy().requiresFit())
			logger.debug(String.format("%s fit over %d bins: scale=%g shift=%g R^2=%g", settings.policy(),
					overlap.size(), fit.scale(), fit.shift(), fit.rSquared()));

		final int n = centres.length;
		final double[] hy = new double[n];
		final double[] he = new double[n];
		for (int i = 0; i < n; i++) {
			hy[i] = fit.scale() * (iHab.y()[i] + fit.shift());
			he[i] = Math.abs(fit.scale()) * iHab.e()[i];
		}
		final double[] y = new double[n];
		final double[] e = new double[n];
		for (int i = 0; i < n; i++) {
			boolean useLab = inLab[i];
			boolean useHab = inHab[i];
			if (settings.mergeMin() != null && centres[i] < settings.mergeMin()) useHab = false;
			if (settings.mergeMax() != null && centres[i] > settings.mergeMax()) useLab = false;
			if (useLab && useHab) {
				final double[] s = stitcher.stitch(iLab.y()[i], iLab.e()[i], hy[i], he[i]);
				y[i] = s[0];
				e[i] = s[1];
			} else if (useLab) {
				y[i] = iLab.y()[i];
				e[i] = iLab.e()[i];
			} else if (useHab) {
				y[i] = hy[i];
				e[i] = he[i];
			} else {
				y[i] = Double.NaN;
				e[i] = Double.NaN;
			}
		}
		final String base = lab.counts().name().replace("_counts", "");
		return new MergeResult(Workspace.of(base + "_merged", XUnit.MOMENTUM_TRANSFER, q.clone(), y, e),
				fit.scale(), fit.shift(), settings.policy(), overlap.size(),
				Workspace.of(base + "_hab_scaled", XUnit.MOMENTUM_TRANSFER, q.clone(), hy, he));
	}

	private static boolean[] covered(final Spectrum intensity, final Spectrum norm) {
		final boolean[] covered = new boolean[intensity.nBins()];
		for (int i = 0; i < covered.length; i++)
			covered[i] = norm.y()[i] > 0 && Double.isFinite(intensity.y()[i]);
		return covered;
	}

	private static void checkEdges(final double[] a, final double[] b) {
		if (a.length != b.length)
			throw new ConfigurationException("Banks have different Q binning: " + (a.length - 1) + " vs "
					+ (b.length - 1) + " bins");
		for (int i = 0; i < a.length; i++) {
			if (Math.abs(a[i] - b[i]) > EDGE_TOLERANCE * Math.max(Math.abs(a[i]), Math.abs(b[i])))
				throw new ConfigurationException("Banks have different Q bin edges at index " + i);
		}
	}
}
