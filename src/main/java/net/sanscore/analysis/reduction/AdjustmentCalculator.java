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

package net.sanscore.analysis.reduction;

import java.util.Optional;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import net.sanscore.analysis.normalization.CountsNormalizer;
import net.sanscore.analysis.normalization.TransmissionCalculator;
import net.sanscore.data.DetectorPixel;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.io.RunData;
import net.sanscore.io.UnitConverter;
import net.sanscore.state.AdjustmentSettings;
import net.sanscore.state.DataType;
import net.sanscore.state.ReductionState;
import net.sanscore.util.Logger;

/**
 * Builds the normalization factors of a reduction. The normalization of pixel
 * {@code p} at wavelength bin {@code i} is
 * {@code W[i] * P[p] * C[p][i]}, with
 * <ul>
 * <li>{@code W}: the wavelength adjustment, i.e. the corrected incident
 * monitor times the transmission times the detector efficiency;</li>
 * <li>{@code P}: the pixel adjustment, i.e. the solid angle times the flood
 * efficiency;</li>
 * <li>{@code C}: the optional wide-angle transmission correction.</li>
 * </ul>
 *
 * @author SANS-Core developers
 */
public class AdjustmentCalculator {

	private final Logger logger = new Logger(AdjustmentCalculator.class);
	private final UnitConverter converter;
	private final CountsNormalizer normalizer;
	private final TransmissionCalculator transmissionCalculator;

	public AdjustmentCalculator(final UnitConverter converter) {
		this.converter = converter;
		normalizer = new CountsNormalizer();
		transmissionCalculator = new TransmissionCalculator(converter, normalizer);
	}

	/**
	 * Computes the transmission of the requested data type on the given edges,
	 * if the run provides both a transmission and a direct-beam run.
	 */
	public Optional<double[][]> transmission(final ReductionState state, final RunData run, final DataType type,
			final double[] edges) {
		final Optional<Workspace> trans = run.transmission(type);
		if (trans.isEmpty() || run.directBeam().isEmpty()) return Optional.empty();
		final Workspace t = transmissionCalculator.calculate(trans.get(), run.directBeam().get(), state.transmission(),
				state.normalization(), edges);
		return Optional.of(new double[][] { t.spectrum(0).y(), t.spectrum(0).e() });
	}

	/**
	 * Computes the wavelength adjustment on the given edges.
	 *
	 * @param monitors     the monitor workspace (TOF), already moved
	 * @param transmission the transmission and its errors, if any
	 * @return a two-row array: adjustment and error per bin
	 */
	public double[][] wavelengthAdjustment(final ReductionState state, final Workspace monitors,
			final Optional<double[][]> transmission, final double[] edges) {
		final Workspace monitor = normalizer.prepareIncidentMonitor(monitors, state.normalization());
		final Spectrum m = converter.convert(monitor, XUnit.WAVELENGTH).spectrum(0);
		final double[][] rebinned = Histograms.rebin(m.x(), m.y(), m.e(), edges);
		final double[] y = rebinned[0];
		final double[] e = rebinned[1];
		if (transmission.isPresent()) {
			final double[] t = transmission.get()[0];
			final double[] te = transmission.get()[1];
			for (int i = 0; i < y.length; i++) {
				e[i] = Math.hypot(e[i] * t[i], y[i] * te[i]);
				y[i] *= t[i];
			}
		}
		final AdjustmentSettings adjustments = state.adjustments();
		if (adjustments.hasEfficiencyTable()) {
			final double[] efficiency = detectorEfficiency(adjustments, Histograms.centres(edges));
			for (int i = 0; i < y.length; i++) {
				y[i] *= efficiency[i];
				e[i] *= efficiency[i];
			}
		}
		return new double[][] { y, e };
	}

	/**
	 * Interpolates the detector efficiency table at the given wavelengths.
	 * Wavelengths outside the table take the value of its nearest end.
	 */
	public static double[] detectorEfficiency(final AdjustmentSettings adjustments, final double[] wavelengths) {
		final double[] table = adjustments.efficiencyWavelength();
		final PolynomialSplineFunction f = new LinearInterpolator().interpolate(table, adjustments.efficiency());
		final double lo = table[0];
		final double hi = table[table.length - 1];
		final double[] out = new double[wavelengths.length];
		for (int i = 0; i < out.length; i++)
			out[i] = f.value(Math.min(hi, Math.max(lo, wavelengths[i])));
		return out;
	}

	/** Solid angle of the pixel times its flood efficiency. */
	public double pixelAdjustment(final ReductionState state, final Spectrum s) {
		final DetectorPixel p = s.pixel();
		if (p == null) {
			logger.warn("Spectrum " + s.spectrumNumber() + " has no position: pixel adjustment set to 0");
			return 0d;
		}
		return p.solidAngle(state.geometry().pixelArea()) * state.adjustments().pixelEfficiency(s.spectrumNumber());
	}

	/**
	 * Wide-angle transmission correction of a pixel: the ratio between the
	 * transmission along the scattered path and the transmission measured on
	 * the beam axis, averaged over the sample thickness.
	 *
	 * @param pixel        the pixel, relative to the beam centre
	 * @param transmission the on-axis transmission per wavelength bin
	 * @return the correction per wavelength bin
	 */
	public static double[] wideAngleCorrection(final DetectorPixel pixel, final double[] transmission) {
		final double a = 1 / Math.cos(pixel.twoTheta()) - 1;
		final double[] out = new double[transmission.length];
		for (int i = 0; i < out.length; i++) {
			final double t = transmission[i];
			if (!(t > 0) || a == 0 || t == 1) {
				out[i] = 1d;
				continue;
			}
			final double x = a * Math.log(t);
			out[i] = (Math.abs(x) < 1e-12) ? 1d : (1 - Math.exp(x)) / -x;
		}
		return out;
	}
}
