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

/**
 * A single spectrum of a {@link Workspace}: either a histogram (bin edges,
 * counts, errors and per-bin mask flags) or an {@link EventList} together with
 * the bin edges used when the events are histogrammed.
 * <p>
 * Spectra are owned by exactly one workspace; the array accessors return the
 * live arrays so that the owner can update them in place.
 * </p>
 *
 * @author SANS-Core developers
 */
public class Spectrum {

	private final int spectrumNumber;
	private final boolean monitor;
	private DetectorPixel pixel;
	private double[] x;
	private double[] y;
	private double[] e;
	private boolean[] binMasks;
	private EventList events;
	private boolean masked;

	private Spectrum(final int spectrumNumber, final DetectorPixel pixel, final boolean monitor) {
		this.spectrumNumber = spectrumNumber;
		this.pixel = pixel;
		this.monitor = monitor;
	}

	/**
	 * Creates a histogram spectrum.
	 *
	 * @param spectrumNumber the spectrum number
	 * @param pixel          the detector position (may be null)
	 * @param x              ascending bin edges
	 * @param y              counts, one per bin
	 * @param e              errors, one per bin
	 */
	public static Spectrum histogram(final int spectrumNumber, final DetectorPixel pixel, final double[] x,
			final double[] y, final double[] e) {
		final Spectrum s = new Spectrum(spectrumNumber, pixel, false);
		s.setHistogram(x, y, e, new boolean[y.length]);
		return s;
	}

	public static Spectrum monitor(final int spectrumNumber, final DetectorPixel pixel, final double[] x,
			final double[] y, final double[] e) {
		final Spectrum s = new Spectrum(spectrumNumber, pixel, true);
		s.setHistogram(x, y, e, new boolean[y.length]);
		return s;
	}

	/**
	 * Creates an event spectrum.
	 *
	 * @param edges the time-of-flight bin edges used to histogram the events
	 */
	public static Spectrum events(final int spectrumNumber, final DetectorPixel pixel, final double[] edges,
			final EventList events) {
		if (events == null)
			throw new IllegalArgumentException("Event list cannot be null");
		final Spectrum s = new Spectrum(spectrumNumber, pixel, false);
		s.x = edges;
		s.events = events;
		return s;
	}

	public int spectrumNumber() {
		return spectrumNumber;
	}

	public boolean isMonitor() {
		return monitor;
	}

	public DetectorPixel pixel() {
		return pixel;
	}

	public void setPixel(final DetectorPixel pixel) {
		this.pixel = pixel;
	}

	public boolean isEventMode() {
		return events != null;
	}

	public EventList events() {
		return events;
	}

	public void setEvents(final EventList events) {
		if (!isEventMode())
			throw new IllegalStateException("Spectrum " + spectrumNumber + " is not in event mode");
		this.events = events;
	}

	public double[] x() {
		return x;
	}

	public double[] y() {
		return y;
	}

	public double[] e() {
		return e;
	}

	public boolean[] binMasks() {
		return binMasks;
	}

	public int nBins() {
		return x.length - 1;
	}

	/**
	 * Replaces the histogram content of this spectrum and leaves event mode.
	 */
	public void setHistogram(final double[] x, final double[] y, final double[] e, final boolean[] binMasks) {
		if (x == null || y == null || e == null)
			throw new IllegalArgumentException("Histogram arrays cannot be null");
		if (x.length != y.length + 1 || y.length != e.length)
			throw new IllegalArgumentException("Histogram requires len(x) = len(y) + 1 = len(e) + 1 (spectrum "
					+ spectrumNumber + ")");
		this.x = x;
		this.y = y;
		this.e = e;
		this.binMasks = (binMasks == null) ? new boolean[y.length] : binMasks;
		this.events = null;
	}

	/** Replaces the bin edges of an event spectrum. */
	public void setEventBinning(final double[] edges) {
		if (!isEventMode())
			throw new IllegalStateException("Spectrum " + spectrumNumber + " is not in event mode");
		this.x = edges;
	}

	public boolean isMasked() {
		return masked;
	}

	public void setMasked(final boolean masked) {
		this.masked = masked;
	}

	public boolean isBinMasked(final int bin) {
		return binMasks != null && binMasks[bin];
	}

	public void maskBin(final int bin) {
		if (binMasks == null)
			throw new IllegalStateException("Bin masks are only available for histogram spectra");
		binMasks[bin] = true;
	}

	/**
	 * Returns the total counts of this spectrum. Masked bins are excluded and a
	 * masked spectrum integrates to zero.
	 */
	public double integrate() {
		if (masked) return 0d;
		if (isEventMode()) return events.totalWeight();
		double sum = 0d;
		for (int i = 0; i < y.length; i++) {
			if (!binMasks[i]) sum += y[i];
		}
		return sum;
	}

	/**
	 * Returns a histogram copy of this spectrum; event spectra are histogrammed
	 * on their bin edges.
	 */
	public Spectrum toHistogram() {
		if (!isEventMode()) return duplicate();
		final double[][] h = events.histogram(x);
		final Spectrum s = new Spectrum(spectrumNumber, pixel, monitor);
		s.setHistogram(x.clone(), h[0], h[1], new boolean[h[0].length]);
		s.masked = masked;
		return s;
	}

	public Spectrum duplicate() {
		final Spectrum s = new Spectrum(spectrumNumber, pixel, monitor);
		s.x = x.clone();
		s.masked = masked;
		if (isEventMode()) {
			s.events = events.duplicate();
		} else {
			s.y = y.clone();
			s.e = e.clone();
			s.binMasks = binMasks.clone();
		}
		return s;
	}

	@Override
	public String toString() {
		return "Spectrum " + spectrumNumber + ((isEventMode()) ? " [" + events.size() + " events]" : " [" + y.length + " bins]");
	}
}
