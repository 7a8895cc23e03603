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

package net.sanscore.io;

import java.util.ArrayList;
import java.util.List;

import net.sanscore.data.DetectorPixel;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;

/**
 * Elastic unit conversions between time-of-flight (&micro;s), wavelength
 * (&Aring;) and momentum transfer (&Aring;<sup>-1</sup>), based on each
 * spectrum's flight path.
 * <p>
 * The flight path of a detector pixel is {@code L1} plus its distance from the
 * sample; that of a monitor is {@code L1} plus its (usually negative) beam-axis
 * coordinate. Momentum transfer decreases with wavelength, so Q spectra are
 * stored reversed to keep their bin edges ascending.
 * </p>
 *
 * @author SANS-Core developers
 */
public class ElasticUnitConverter implements UnitConverter {

	/** h / m<sub>n</sub> in &Aring;&middot;m/&micro;s */
	public static final double H_OVER_MN = 3.956034e-3;

	private final double l1;

	/**
	 * @param l1 the moderator-to-sample distance in metres
	 */
	public ElasticUnitConverter(final double l1) {
		if (!(l1 > 0)) throw new IllegalArgumentException("Primary flight path must be positive: " + l1);
		this.l1 = l1;
	}

	@Override
	public Workspace convert(final Workspace ws, final XUnit target, final ConversionMode mode,
			final Double fixedEnergy) {
		if (mode != ConversionMode.ELASTIC) throw new UnsupportedUnitException(ws.unit(), target, mode);
		final XUnit source = ws.unit();
		if (source == target) return ws.duplicate();
		if (source == XUnit.TOF && target == XUnit.MOMENTUM_TRANSFER)
			return convert(convert(ws, XUnit.WAVELENGTH, mode, fixedEnergy), target, mode, fixedEnergy);

		final List<Spectrum> converted = new ArrayList<>(ws.size());
		for (final Spectrum s : ws.spectra()) {
			if (source == XUnit.TOF && target == XUnit.WAVELENGTH)
				converted.add(scaleAxis(s, H_OVER_MN / flightPath(s)));
			else if (source == XUnit.WAVELENGTH && target == XUnit.TOF)
				converted.add(scaleAxis(s, flightPath(s) / H_OVER_MN));
			else if (source == XUnit.WAVELENGTH && target == XUnit.MOMENTUM_TRANSFER)
				converted.add(toMomentumTransfer(s));
			else
				throw new UnsupportedUnitException(source, target, mode);
		}
		return ws.withSpectra(ws.name(), target, converted);
	}

	/** Total flight path of a spectrum, in metres. */
	public double flightPath(final Spectrum s) {
		final DetectorPixel p = s.pixel();
		if (s.isMonitor()) return (p == null) ? l1 : l1 + p.z();
		if (p == null)
			throw new IllegalArgumentException("Spectrum " + s.spectrumNumber() + " has no detector position");
		return l1 + p.distance();
	}

	/** Momentum transfer of a pixel at the given wavelength. */
	public static double momentumTransfer(final DetectorPixel pixel, final double wavelength) {
		return 4 * Math.PI * Math.sin(pixel.twoTheta() / 2) / wavelength;
	}

	private static Spectrum scaleAxis(final Spectrum s, final double factor) {
		final Spectrum out = s.duplicate();
		final double[] edges = scaled(s.x(), factor);
		if (s.isEventMode()) {
			out.setEvents(s.events().withCoordinates(scaled(s.events().tofs(), factor)));
			out.setEventBinning(edges);
		} else {
			out.setHistogram(edges, out.y(), out.e(), out.binMasks());
		}
		return out;
	}

	private static Spectrum toMomentumTransfer(final Spectrum s) {
		if (s.isEventMode())
			throw new UnsupportedUnitException("Event data cannot be converted to momentum transfer; histogram first");
		if (s.pixel() == null || s.isMonitor())
			throw new UnsupportedUnitException("Spectrum " + s.spectrumNumber() + " has no scattering angle");
		final double[] lambda = s.x();
		final double[] q = new double[lambda.length];
		for (int i = 0; i < lambda.length; i++)
			q[q.length - 1 - i] = momentumTransfer(s.pixel(), lambda[i]);
		final Spectrum out = s.duplicate();
		out.setHistogram(q, Histograms.reversed(s.y()), Histograms.reversed(s.e()),
				Histograms.reversed(s.binMasks()));
		return out;
	}

	private static double[] scaled(final double[] values, final double factor) {
		final double[] out = new double[values.length];
		for (int i = 0; i < values.length; i++)
			out[i] = values[i] * factor;
		return out;
	}

	@Override
	public String toString() {
		return "ElasticUnitConverter [L1=" + l1 + " m]";
	}
}
