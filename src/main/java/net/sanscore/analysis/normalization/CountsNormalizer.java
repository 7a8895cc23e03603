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

package net.sanscore.analysis.normalization;

import java.util.ArrayList;
import java.util.List;

import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.state.BackgroundWindow;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.NormalizationSettings;
import net.sanscore.state.TofWindow;
import net.sanscore.util.Logger;

/**
 * Normalizes scattered counts by the incident-beam monitor. The monitor is
 * corrected in a fixed order: selection, event-to-histogram scaling,
 * prompt-peak removal and flat background subtraction. The prompt peak is
 * always removed first, so that it never contributes to the background level.
 * <p>
 * All windows are in time-of-flight; monitors are corrected before any unit
 * conversion or rebinning.
 * </p>
 *
 * @author SANS-Core developers
 */
public class CountsNormalizer {

	private final Logger logger = new Logger(CountsNormalizer.class);

	/**
	 * Divides every counts spectrum by the corrected incident monitor, rebinned
	 * onto the spectrum's bin edges.
	 *
	 * @param counts          the counts workspace (TOF)
	 * @param monitors        the monitor workspace (TOF)
	 * @param background      the monitor background window
	 * @param promptPeak      the prompt-peak window, or null
	 * @param incidentMonitor spectrum number of the incident monitor
	 * @return the normalized workspace
	 * @throws ConfigurationException if the incident monitor is missing
	 */
	public Workspace normalize(final Workspace counts, final Workspace monitors, final BackgroundWindow background,
			final TofWindow promptPeak, final int incidentMonitor) {
		return divide(counts, prepareIncidentMonitor(monitors, background, promptPeak, incidentMonitor, 1d));
	}

	public Workspace normalize(final Workspace counts, final Workspace monitors,
			final NormalizationSettings settings) {
		return divide(counts, prepareIncidentMonitor(monitors, settings));
	}

	public Workspace prepareIncidentMonitor(final Workspace monitors, final NormalizationSettings settings) {
		return prepareIncidentMonitor(monitors, settings.background(), settings.promptPeak(),
				settings.incidentMonitor(), settings.eventToHistogramScale());
	}

	/**
	 * Extracts and corrects the incident monitor.
	 *
	 * @param monitors        the monitor workspace (TOF)
	 * @param background      the monitor background window
	 * @param promptPeak      the prompt-peak window, or null
	 * @param incidentMonitor spectrum number of the incident monitor
	 * @param scale           factor applied to the monitor counts, e.g. to
	 *                        match histogram and event acquisitions
	 * @return a single-spectrum histogram workspace holding the corrected
	 *         monitor
	 */
	public Workspace prepareIncidentMonitor(final Workspace monitors, final BackgroundWindow background,
			final TofWindow promptPeak, final int incidentMonitor, final double scale) {
		final Spectrum monitor = selectMonitor(monitors, incidentMonitor);
		correctMonitor(monitor, (background == null) ? BackgroundWindow.NONE : background, promptPeak, scale);
		return monitors.withSpectra("incident_monitor_" + incidentMonitor, monitors.unit(), List.of(monitor));
	}

	/**
	 * Returns a histogram copy of a monitor spectrum.
	 *
	 * @throws ConfigurationException if the workspace holds no such spectrum
	 */
	public static Spectrum selectMonitor(final Workspace monitors, final int spectrumNumber) {
		final Spectrum source = monitors.findSpectrum(spectrumNumber);
		if (source == null)
			throw new ConfigurationException("Monitor spectrum " + spectrumNumber + " not found in " + monitors.name());
		return source.toHistogram();
	}

	/**
	 * Applies scaling, prompt-peak removal and background subtraction, in this
	 * order, to a histogram monitor spectrum in place.
	 */
	public void correctMonitor(final Spectrum monitor, final BackgroundWindow background, final TofWindow promptPeak,
			final double scale) {
		if (scale != 1d) {
			final double[] y = monitor.y();
			final double[] e = monitor.e();
			for (int i = 0; i < y.length; i++) {
				y[i] *= scale;
				e[i] *= Math.abs(scale);
			}
		}
		if (promptPeak != null) {
			final int n = removePromptPeak(monitor, promptPeak);
			logger.debug("Prompt peak " + promptPeak + ": " + n + " bins interpolated in monitor "
					+ monitor.spectrumNumber());
		}
		background.windowFor(monitor.spectrumNumber()).ifPresent(w -> {
			final double level = subtractFlatBackground(monitor, w);
			logger.debug("Monitor " + monitor.spectrumNumber() + " background " + level + " in " + w);
		});
	}

	/**
	 * Replaces the bins lying inside the window by a linear interpolation
	 * between the neighbouring bins.
	 *
	 * @return the number of bins replaced
	 */
	public static int removePromptPeak(final Spectrum monitor, final TofWindow window) {
		return Histograms.interpolateAcross(monitor.x(), monitor.y(), monitor.e(), window.start(), window.stop());
	}

	/**
	 * Subtracts the mean of the bins lying inside the window from those bins.
	 * Bins outside the window keep their counts, so the monitor signal outside
	 * the background region is conserved.
	 *
	 * @return the subtracted level
	 * @throws ConfigurationException if no bin lies inside the window
	 */
	public static double subtractFlatBackground(final Spectrum monitor, final TofWindow window) {
		final double[] x = monitor.x();
		final double[] y = monitor.y();
		final double[] e = monitor.e();
		final boolean[] inside = new boolean[y.length];
		double sum = 0d;
		double variance = 0d;
		int n = 0;
		for (int i = 0; i < y.length; i++) {
			if (x[i] >= window.start() && x[i + 1] <= window.stop()) {
				inside[i] = true;
				sum += y[i];
				variance += e[i] * e[i];
				n++;
			}
		}
		if (n == 0)
			throw new ConfigurationException("Background window " + window + " holds no bins of monitor "
					+ monitor.spectrumNumber());
		final double level = sum / n;
		final double levelVariance = variance / ((double) n * n);
		for (int i = 0; i < y.length; i++) {
			if (!inside[i]) continue;
			y[i] -= level;
			e[i] = Math.sqrt(e[i] * e[i] + levelVariance);
		}
		return level;
	}

	/**
	 * Divides every spectrum of {@code counts} by the single spectrum of
	 * {@code monitor}, rebinned onto each spectrum's edges. Bins where the
	 * monitor is not positive are zeroed and masked.
	 */
	public static Workspace divide(final Workspace counts, final Workspace monitor) {
		if (counts.unit() != monitor.unit())
			throw new IllegalArgumentException("Counts (" + counts.unit() + ") and monitor (" + monitor.unit()
					+ ") units differ");
		final Spectrum m = monitor.spectrum(0);
		final List<Spectrum> out = new ArrayList<>(counts.size());
		for (final Spectrum source : counts.spectra()) {
			final Spectrum s = source.toHistogram();
			final double[][] rebinned = Histograms.rebin(m.x(), m.y(), m.e(), s.x());
			final double[] y = s.y();
			final double[] e = s.e();
			for (int i = 0; i < y.length; i++) {
				final double mon = rebinned[0][i];
				if (!(mon > 0)) {
					y[i] = 0d;
					e[i] = 0d;
					s.maskBin(i);
					continue;
				}
				final double ratio = y[i] / mon;
				e[i] = Math.hypot(e[i] / mon, ratio * rebinned[1][i] / mon);
				y[i] = ratio;
			}
			out.add(s);
		}
		return counts.withSpectra(counts.name() + "_normalized", counts.unit(), out);
	}
}
