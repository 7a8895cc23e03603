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

import java.util.List;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import net.sanscore.data.BinningParams;
import net.sanscore.data.Histograms;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.io.UnitConverter;
import net.sanscore.state.ConfigurationException;
import net.sanscore.state.NormalizationSettings;
import net.sanscore.state.TransmissionSettings;
import net.sanscore.state.TransmissionSettings.FitMethod;
import net.sanscore.state.WavelengthRange;
import net.sanscore.util.Logger;

/**
 * Calculates the wavelength-dependent sample transmission from a transmission
 * run and a direct-beam run: in each run the transmission monitor is divided
 * by the incident monitor (both corrected as for normalization) and the
 * sample ratio is divided by the direct-beam ratio. The measured curve can be
 * smoothed by a linear, exponential or polynomial fit.
 *
 * @author SANS-Core developers
 */
public class TransmissionCalculator {

	private final Logger logger = new Logger(TransmissionCalculator.class);
	private final UnitConverter converter;
	private final CountsNormalizer normalizer;

	public TransmissionCalculator(final UnitConverter converter) {
		this(converter, new CountsNormalizer());
	}

	public TransmissionCalculator(final UnitConverter converter, final CountsNormalizer normalizer) {
		this.converter = converter;
		this.normalizer = normalizer;
	}

	/**
	 * Computes the transmission on the given wavelength binning.
	 *
	 * @param transmissionRun monitors of the transmission run (TOF)
	 * @param directRun       monitors of the direct-beam run (TOF)
	 * @return a single-spectrum wavelength workspace
	 */
	public Workspace calculate(final Workspace transmissionRun, final Workspace directRun,
			final TransmissionSettings settings, final NormalizationSettings normalization,
			final BinningParams wavelengthBinning) {
		return calculate(transmissionRun, directRun, settings, normalization, wavelengthBinning.edges());
	}

	/**
	 * Computes the transmission on the given wavelength bin edges.
	 */
	public Workspace calculate(final Workspace transmissionRun, final Workspace directRun,
			final TransmissionSettings settings, final NormalizationSettings normalization, final double[] edges) {
		final double[][] sample = monitorRatio(transmissionRun, settings, normalization, edges);
		final double[][] direct = monitorRatio(directRun, settings, normalization, edges);
		final double[] t = new double[edges.length - 1];
		final double[] e = new double[t.length];
		for (int i = 0; i < t.length; i++) {
			t[i] = sample[0][i] / direct[0][i];
			e[i] = Math.abs(t[i]) * Math.hypot(sample[1][i] / sample[0][i], direct[1][i] / direct[0][i]);
		}
		final double[] fitted = fit(edges, t, settings.fitMethod(), settings.fitRange(), settings.polynomialOrder());
		return Workspace.of("transmission", XUnit.WAVELENGTH, edges, fitted, e);
	}

	private double[][] monitorRatio(final Workspace run, final TransmissionSettings settings,
			final NormalizationSettings normalization, final double[] edges) {
		final Spectrum incident = CountsNormalizer.selectMonitor(run, settings.incidentMonitor());
		final Spectrum transmitted = CountsNormalizer.selectMonitor(run, settings.transmissionMonitor());
		for (final Spectrum m : List.of(incident, transmitted))
			normalizer.correctMonitor(m, normalization.background(), normalization.promptPeak(),
					normalization.eventToHistogramScale());
		final Workspace lambda = converter.convert(run.withSpectra(run.name() + "_trans", run.unit(),
				List.of(incident, transmitted)), XUnit.WAVELENGTH);
		final Spectrum in = lambda.spectrum(0);
		final Spectrum out = lambda.spectrum(1);
		final double[][] inR = Histograms.rebin(in.x(), in.y(), in.e(), edges);
		final double[][] outR = Histograms.rebin(out.x(), out.y(), out.e(), edges);
		final double[] ratio = new double[edges.length - 1];
		final double[] error = new double[ratio.length];
		for (int i = 0; i < ratio.length; i++) {
			ratio[i] = outR[0][i] / inR[0][i];
			error[i] = Math.abs(ratio[i]) * Math.hypot(outR[1][i] / outR[0][i], inR[1][i] / inR[0][i]);
		}
		return new double[][] { ratio, error };
	}

	/**
	 * Smooths a transmission curve.
	 *
	 * @param edges  the wavelength bin edges
	 * @param values the measured transmission per bin
	 * @param method the fit method (OFF returns a copy)
	 * @param range  the wavelength range whose bins enter the fit, or null for
	 *               all
	 * @param order  the polynomial order, for POLYNOMIAL fits
	 * @return the fit evaluated at every bin centre
	 * @throws ConfigurationException if the range holds too few valid points
	 */
	public double[] fit(final double[] edges, final double[] values, final FitMethod method,
			final WavelengthRange range, final int order) {
		if (method == FitMethod.OFF) return values.clone();
		final double[] centres = Histograms.centres(edges);
		final double[] fitted = new double[values.length];
		final int minPoints = (method == FitMethod.POLYNOMIAL) ? order + 1 : 2;
		switch (method) {
			case LINEAR, LOG -> {
				final SimpleRegression regression = new SimpleRegression();
				for (int i = 0; i < values.length; i++) {
					if (!usable(centres[i], values[i], method, range)) continue;
					regression.addData(centres[i], (method == FitMethod.LOG) ? Math.log(values[i]) : values[i]);
				}
				checkPoints(regression.getN(), minPoints, method);
				for (int i = 0; i < fitted.length; i++) {
					final double v = regression.predict(centres[i]);
					fitted[i] = (method == FitMethod.LOG) ? Math.exp(v) : v;
				}
				logger.debug(method + " transmission fit: R^2=" + regression.getRSquare());
			}
			case POLYNOMIAL -> {
				final WeightedObservedPoints points = new WeightedObservedPoints();
				for (int i = 0; i < values.length; i++) {
					if (usable(centres[i], values[i], method, range)) points.add(centres[i], values[i]);
				}
				checkPoints(points.toList().size(), minPoints, method);
				final double[] coefficients = PolynomialCurveFitter.create(order).fit(points.toList());
				final PolynomialFunction polynomial = new PolynomialFunction(coefficients);
				for (int i = 0; i < fitted.length; i++)
					fitted[i] = polynomial.value(centres[i]);
			}
			default -> throw new IllegalArgumentException("Unrecognized fit method: " + method);
		}
		return fitted;
	}

	private static boolean usable(final double lambda, final double value, final FitMethod method,
			final WavelengthRange range) {
		if (!Double.isFinite(value)) return false;
		if (method == FitMethod.LOG && !(value > 0)) return false;
		return range == null || (lambda >= range.min() && lambda <= range.max());
	}

	private static void checkPoints(final long n, final int min, final FitMethod method) {
		if (n < min)
			throw new ConfigurationException(method + " transmission fit needs at least " + min + " points, got " + n);
	}
}
