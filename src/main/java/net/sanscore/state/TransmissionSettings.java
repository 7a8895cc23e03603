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
 * Transmission calculation settings.
 *
 * @param incidentMonitor     monitor used to normalize the transmission runs
 * @param transmissionMonitor monitor (or detector spectrum) behind the sample
 * @param fitMethod           how the transmission curve is smoothed
 * @param fitRange            wavelength range of the fit, or null for all
 * @param polynomialOrder     order of the POLYNOMIAL fit
 * @param wideAngleCorrection whether to apply the wide-angle transmission
 *                            correction
 * @author SANS-Core developers
 */
public record TransmissionSettings(int incidentMonitor, int transmissionMonitor, FitMethod fitMethod,
		WavelengthRange fitRange, int polynomialOrder, boolean wideAngleCorrection) {

	/** Smoothing applied to the measured transmission curve. */
	public enum FitMethod {
		OFF, LINEAR, LOG, POLYNOMIAL
	}

	public TransmissionSettings {
		if (incidentMonitor < 0 || transmissionMonitor < 0)
			throw new ConfigurationException("Transmission monitors must be set");
		if (incidentMonitor == transmissionMonitor)
			throw new ConfigurationException("Incident and transmission monitors must differ: " + incidentMonitor);
		fitMethod = (fitMethod == null) ? FitMethod.LOG : fitMethod;
		if (fitMethod == FitMethod.POLYNOMIAL && (polynomialOrder < 2 || polynomialOrder > 6))
			throw new ConfigurationException("Polynomial transmission fit order must be in [2, 6]: " + polynomialOrder);
	}

	public static TransmissionSettings defaults(final Instrument instrument) {
		return new TransmissionSettings(instrument.incidentMonitor(), instrument.transmissionMonitor(), FitMethod.LOG,
				null, 2, false);
	}

	public TransmissionSettings withFit(final FitMethod method, final WavelengthRange range, final int order) {
		return new TransmissionSettings(incidentMonitor, transmissionMonitor, method, range, order, wideAngleCorrection);
	}

	public TransmissionSettings withWideAngleCorrection(final boolean enabled) {
		return new TransmissionSettings(incidentMonitor, transmissionMonitor, fitMethod, fitRange, polynomialOrder,
				enabled);
	}
}
