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
 * Monitor normalization settings.
 *
 * @param incidentMonitor     spectrum number of the incident-beam monitor
 * @param background          flat-background region of the monitors
 * @param promptPeak          prompt-peak window to excise, or null
 * @param eventToHistogramScale factor applied to the monitor counts
 * @author SANS-Core developers
 */
public record NormalizationSettings(int incidentMonitor, BackgroundWindow background, TofWindow promptPeak,
		double eventToHistogramScale) {

	public NormalizationSettings {
		if (incidentMonitor < 0)
			throw new ConfigurationException("Incident monitor spectrum must be set: " + incidentMonitor);
		background = (background == null) ? BackgroundWindow.NONE : background;
		if (!(eventToHistogramScale > 0))
			throw new ConfigurationException("Monitor scale must be positive: " + eventToHistogramScale);
	}

	/**
	 * Returns the instrument defaults: its incident monitor, its background
	 * window and, for LOQ, its prompt-peak window.
	 */
	public static NormalizationSettings defaults(final Instrument instrument) {
		return new NormalizationSettings(instrument.incidentMonitor(), instrument.defaultBackground(),
				instrument.defaultPromptPeak(), 1d);
	}

	public NormalizationSettings withBackground(final BackgroundWindow window) {
		return new NormalizationSettings(incidentMonitor, window, promptPeak, eventToHistogramScale);
	}

	public NormalizationSettings withPromptPeak(final TofWindow window) {
		return new NormalizationSettings(incidentMonitor, background, window, eventToHistogramScale);
	}
}
