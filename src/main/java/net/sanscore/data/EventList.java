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

/**
 * Neutron events recorded by one spectrum: time-of-flight, pulse time and
 * weight of every event. Once the owning workspace is converted to another
 * unit, the time-of-flight array holds the converted coordinate.
 *
 * @author SANS-Core developers
 */
public final class EventList {

	private final double[] tof;
	private final double[] pulseTime;
	private final double[] weight;

	public EventList(final double[] tof, final double[] pulseTime) {
		this(tof, pulseTime, null);
	}

	public EventList(final double[] tof, final double[] pulseTime, final double[] weight) {
		if (tof == null || pulseTime == null || tof.length != pulseTime.length)
			throw new IllegalArgumentException("Event arrays cannot be null and must have the same length");
		if (weight != null && weight.length != tof.length)
			throw new IllegalArgumentException("Weights must match the number of events");
		this.tof = tof;
		this.pulseTime = pulseTime;
		if (weight == null) {
			this.weight = new double[tof.length];
			Arrays.fill(this.weight, 1d);
		} else {
			this.weight = weight;
		}
	}

	public int size() {
		return tof.length;
	}

	public double tof(final int i) {
		return tof[i];
	}

	public double pulseTime(final int i) {
		return pulseTime[i];
	}

	public double weight(final int i) {
		return weight[i];
	}

	public EventList duplicate() {
		return new EventList(tof.clone(), pulseTime.clone(), weight.clone());
	}

	/** Keeps the events whose pulse time lies in [start, stop). */
	public EventList filterByPulseTime(final double start, final double stop) {
		return filter(start, stop, true, true);
	}

	/** Drops the events whose time-of-flight lies in [start, stop). */
	public EventList removeTofWindow(final double start, final double stop) {
		return filter(start, stop, false, false);
	}

	private EventList filter(final double start, final double stop, final boolean byPulse, final boolean keepInside) {
		int n = 0;
		final boolean[] keep = new boolean[tof.length];
		for (int i = 0; i < tof.length; i++) {
			final double v = (byPulse) ? pulseTime[i] : tof[i];
			final boolean inside = v >= start && v < stop;
			keep[i] = (inside == keepInside);
			if (keep[i]) n++;
		}
		final double[] t = new double[n];
		final double[] p = new double[n];
		final double[] w = new double[n];
		int k = 0;
		for (int i = 0; i < tof.length; i++) {
			if (!keep[i]) continue;
			t[k] = tof[i];
			p[k] = pulseTime[i];
			w[k++] = weight[i];
		}
		return new EventList(t, p, w);
	}

	/** Returns a copy with every weight multiplied by {@code factor}. */
	public EventList scaled(final double factor) {
		final double[] w = new double[weight.length];
		for (int i = 0; i < w.length; i++)
			w[i] = weight[i] * factor;
		return new EventList(tof.clone(), pulseTime.clone(), w);
	}

	/**
	 * Histograms the events on the given bin edges, using {@code x} as the event
	 * coordinate.
	 *
	 * @param coordinates the per-event coordinate (e.g. time-of-flight or
	 *                    wavelength), same length as this list
	 * @param edges       ascending bin edges
	 * @return a two-row array: summed weights and their errors
	 */
	public double[][] histogram(final double[] coordinates, final double[] edges) {
		final int nBins = edges.length - 1;
		final double[] counts = new double[nBins];
		final double[] variance = new double[nBins];
		for (int i = 0; i < coordinates.length; i++) {
			final int bin = Histograms.binIndex(edges, coordinates[i]);
			if (bin < 0) continue;
			counts[bin] += weight[i];
			variance[bin] += weight[i] * weight[i];
		}
		final double[] errors = new double[nBins];
		for (int b = 0; b < nBins; b++)
			errors[b] = Math.sqrt(variance[b]);
		return new double[][] { counts, errors };
	}

	/**
	 * Returns a copy whose events sit at the given coordinates, keeping pulse
	 * times and weights.
	 */
	public EventList withCoordinates(final double[] coordinates) {
		if (coordinates.length != tof.length)
			throw new IllegalArgumentException("Coordinates must match the number of events");
		return new EventList(coordinates, pulseTime.clone(), weight.clone());
	}

	public double totalWeight() {
		double sum = 0d;
		for (final double w : weight)
			sum += w;
		return sum;
	}

	/** Histograms on time-of-flight. */
	public double[][] histogram(final double[] edges) {
		return histogram(tof, edges);
	}

	public double[] tofs() {
		return tof.clone();
	}
}
