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
 * Instruments known to the reduction, with their default settings. Defaults
 * apply wherever a configuration leaves a value unset.
 *
 * @author SANS-Core developers
 */
public enum Instrument {

	LOQ(2, 3, new TofWindow(31000, 39000), new TofWindow(19000, 20500), 0.001, 2.2, 10.0),
	SANS2D(1, 3, new TofWindow(85000, 98000), null, 0.001, 1.75, 16.5),
	LARMOR(1, 3, new TofWindow(70000, 95000), null, 0.001, 0.9, 13.5),
	ZOOM(3, 4, new TofWindow(85000, 98000), null, 0.001, 1.75, 16.5),
	/** Instrument without defaults beyond monitor 1 and a 1 mm centre-finder step */
	GENERIC(1, 2, null, null, 0.001, 1.0, 20.0);

	private final int incidentMonitor;
	private final int transmissionMonitor;
	private final TofWindow defaultBackground;
	private final TofWindow defaultPromptPeak;
	private final double centreFinderStep;
	private final double wavelengthMin;
	private final double wavelengthMax;

	Instrument(final int incidentMonitor, final int transmissionMonitor, final TofWindow defaultBackground,
			final TofWindow defaultPromptPeak, final double centreFinderStep, final double wavelengthMin,
			final double wavelengthMax) {
		this.incidentMonitor = incidentMonitor;
		this.transmissionMonitor = transmissionMonitor;
		this.defaultBackground = defaultBackground;
		this.defaultPromptPeak = defaultPromptPeak;
		this.centreFinderStep = centreFinderStep;
		this.wavelengthMin = wavelengthMin;
		this.wavelengthMax = wavelengthMax;
	}

	/** Spectrum number of the default incident-beam monitor. */
	public int incidentMonitor() {
		return incidentMonitor;
	}

	public int transmissionMonitor() {
		return transmissionMonitor;
	}

	public BackgroundWindow defaultBackground() {
		return (defaultBackground == null) ? BackgroundWindow.NONE : new BackgroundWindow.Global(defaultBackground);
	}

	/**
	 * Prompt-peak window used when none is configured. Only LOQ has one.
	 *
	 * @return the window in microseconds, or null
	 */
	public TofWindow defaultPromptPeak() {
		return defaultPromptPeak;
	}

	/** Initial step of the quadrant beam-centre search, in metres. */
	public double centreFinderStep() {
		return centreFinderStep;
	}

	public WavelengthRange defaultWavelengthRange() {
		return new WavelengthRange(wavelengthMin, wavelengthMax);
	}

	public static Instrument fromString(final String name) {
		if (name == null || name.isBlank()) return GENERIC;
		for (final Instrument i : values()) {
			if (i.name().equalsIgnoreCase(name.trim())) return i;
		}
		throw new ConfigurationException("Unknown instrument: " + name);
	}
}
