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

package net.sanscore.state;

/**
 * Settings of the two-bank merge.
 *
 * @param policy   fit policy
 * @param scale    configured scale (the starting value of fits that solve for
 *                 it)
 * @param shift    configured shift, in LAB units
 * @param fitMin   lower Q bound of the fit region, or null for the overlap
 * @param fitMax   upper Q bound of the fit region, or null for the overlap
 * @param mergeMin below this Q only LAB data is used, or null
 * @param mergeMax above this Q only HAB data is used, or null
 * @author SANS-Core developers
 */
public record MergeSettings(FitPolicy policy, double scale, double shift, Double fitMin, Double fitMax,
		Double mergeMin, Double mergeMax) {

	public static final MergeSettings DEFAULT = new MergeSettings(FitPolicy.NO_FIT, 1d, 0d, null, null, null, null);

	public MergeSettings {
		policy = (policy == null) ? FitPolicy.NO_FIT : policy;
		if (!Double.isFinite(scale) || !Double.isFinite(shift))
			throw new ConfigurationException("Merge scale and shift must be finite");
		if (!policy.fitsScale() && scale == 0)
			throw new ConfigurationException("A fixed merge scale cannot be zero");
		checkRange("fit", fitMin, fitMax);
		checkRange("merge", mergeMin, mergeMax);
	}

	public static MergeSettings of(final FitPolicy policy, final double scale, final double shift) {
		return new MergeSettings(policy, scale, shift, null, null, null, null);
	}

	public MergeSettings withFitRange(final Double min, final Double max) {
		return new MergeSettings(policy, scale, shift, min, max, mergeMin, mergeMax);
	}

	public MergeSettings withMergeRange(final Double min, final Double max) {
		return new MergeSettings(policy, scale, shift, fitMin, fitMax, min, max);
	}

	private static void checkRange(final String label, final Double min, final Double max) {
		if (min != null && max != null && !(min < max))
			throw new ConfigurationException("Inverted " + label + " range: [" + min + ", " + max + "]");
	}
}
