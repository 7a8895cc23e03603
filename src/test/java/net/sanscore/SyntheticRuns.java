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

package net.sanscore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleBiFunction;

import net.sanscore.data.BinningParams;
import net.sanscore.data.DetectorPixel;
import net.sanscore.data.EventList;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.io.RunData;
import net.sanscore.state.DetectorComponent;
import net.sanscore.state.Instrument;
import net.sanscore.state.InstrumentGeometry;
import net.sanscore.state.ReductionState;
import net.sanscore.state.SpectrumRange;

/**
 * Builds small synthetic runs: a 10x10 low-angle bank 4 m from the sample,
 * a 10x10 high-angle bank at 2 m, and two monitors upstream of the sample.
 */
public final class SyntheticRuns {

	public static final int GRID = 10;
	public static final double PITCH = 0.01;
	public static final double L1 = 10d;
	public static final double LAB_Z = 4d;
	public static final double HAB_Z = 2d;
	public static final int LAB_FIRST = 100;
	public static final int HAB_FIRST = 200;
	public static final int INCIDENT_MONITOR = 1;
	public static final int TRANSMISSION_MONITOR = 2;

	/** Time-of-flight edges, 1000-60000 &micro;s in 500 &micro;s bins. */
	public static final double[] TOF_EDGES = BinningParams.linear(1000, 500, 60000).edges();

	private SyntheticRuns() {
	}

	public static InstrumentGeometry geometry() {
		return new InstrumentGeometry(Instrument.GENERIC,
				Map.of(DetectorComponent.LAB, new SpectrumRange(LAB_FIRST, LAB_FIRST + GRID * GRID - 1),
						DetectorComponent.HAB, new SpectrumRange(HAB_FIRST, HAB_FIRST + GRID * GRID - 1)),
				PITCH, PITCH, L1);
	}

	/** Defaults with 2-10 &Aring; in 0.5 &Aring; steps and log Q bins 0.001-0.1. */
	public static ReductionState state() {
		return ReductionState.defaults(geometry()).withBinning(BinningParams.linear(2, 0.5, 10),
				BinningParams.logarithmic(0.001, 0.1, 0.1));
	}

	/** Pixel position of grid cell (i, j), centred on the beam axis. */
	public static DetectorPixel pixel(final int i, final int j, final double z) {
		return new DetectorPixel((i - (GRID - 1) / 2d) * PITCH, (j - (GRID - 1) / 2d) * PITCH, z);
	}

	/** A run of flat spectra: {@code counts} per TOF bin in every pixel. */
	public static RunData flatRun(final double counts, final double monitorCounts) {
		return RunData.of(detectors("sample", (p, i) -> counts), monitors("sample_monitors", monitorCounts));
	}

	/**
	 * Histogram detectors whose counts per TOF bin are given by
	 * {@code counts(pixel, bin)}.
	 */
	public static Workspace detectors(final String name, final ToDoubleBiFunction<DetectorPixel, Integer> counts) {
		final List<Spectrum> spectra = new ArrayList<>();
		addBank(spectra, LAB_FIRST, LAB_Z, counts);
		addBank(spectra, HAB_FIRST, HAB_Z, counts);
		return new Workspace(name, XUnit.TOF, spectra);
	}

	private static void addBank(final List<Spectrum> spectra, final int first, final double z,
			final ToDoubleBiFunction<DetectorPixel, Integer> counts) {
		final int nBins = TOF_EDGES.length - 1;
		for (int j = 0; j < GRID; j++) {
			for (int i = 0; i < GRID; i++) {
				final DetectorPixel p = pixel(i, j, z);
				final double[] y = new double[nBins];
				final double[] e = new double[nBins];
				for (int b = 0; b < nBins; b++) {
					y[b] = counts.applyAsDouble(p, b);
					e[b] = Math.sqrt(y[b]);
				}
				spectra.add(Spectrum.histogram(first + j * GRID + i, p, TOF_EDGES.clone(), y, e));
			}
		}
	}

	/** Incident (z=-1 m) and transmission (z=-0.5 m) monitors. */
	public static Workspace monitors(final String name, final double countsPerBin) {
		return monitors(name, countsPerBin, countsPerBin);
	}

	public static Workspace monitors(final String name, final double incident, final double transmitted) {
		final int nBins = TOF_EDGES.length - 1;
		final List<Spectrum> spectra = new ArrayList<>();
		spectra.add(monitor(INCIDENT_MONITOR, -1d, nBins, incident));
		spectra.add(monitor(TRANSMISSION_MONITOR, -0.5, nBins, transmitted));
		return new Workspace(name, XUnit.TOF, spectra);
	}

	private static Spectrum monitor(final int number, final double z, final int nBins, final double value) {
		final double[] y = new double[nBins];
		final double[] e = new double[nBins];
		for (int b = 0; b < nBins; b++) {
			y[b] = value;
			e[b] = Math.sqrt(value);
		}
		return Spectrum.monitor(number, new DetectorPixel(0, 0, z), TOF_EDGES.clone(), y, e);
	}

	/**
	 * An event run of the low-angle bank: 40 unit-weight events per pixel,
	 * evenly spread over 8000-27500 &micro;s and over pulse times 0-97.5 s.
	 */
	public static RunData eventRun() {
		final List<Spectrum> spectra = new ArrayList<>();
		for (int j = 0; j < GRID; j++) {
			for (int i = 0; i < GRID; i++) {
				final double[] tof = new double[40];
				final double[] pulse = new double[40];
				for (int k = 0; k < tof.length; k++) {
					tof[k] = 8000 + k * 500;
					pulse[k] = k * 2.5;
				}
				spectra.add(Spectrum.events(LAB_FIRST + j * GRID + i, pixel(i, j, LAB_Z), TOF_EDGES.clone(),
						new EventList(tof, pulse)));
			}
		}
		return RunData.of(new Workspace("events", XUnit.TOF, spectra), monitors("event_monitors", 1000d));
	}
}
