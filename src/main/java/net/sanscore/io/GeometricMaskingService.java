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

import net.sanscore.data.EventList;
import net.sanscore.data.Spectrum;
import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;
import net.sanscore.state.MaskShape;
import net.sanscore.state.MaskSpec;
import net.sanscore.state.TofWindow;

/**
 * Masks spectra by number, by detector position against {@link MaskShape}s
 * and by time-of-flight window. Time masks drop the events inside the window
 * of event spectra and flag the overlapping bins of histogram spectra; they
 * require a workspace in time-of-flight. Monitor spectra are never masked.
 *
 * @author SANS-Core developers
 */
public class GeometricMaskingService implements MaskingService {

	@Override
	public Workspace mask(final Workspace ws, final MaskSpec spec) {
		if (spec == null || spec.isEmpty()) return ws.duplicate();
		if (!spec.timeWindows().isEmpty() && ws.unit() != XUnit.TOF)
			throw new UnsupportedUnitException("Time masks require time-of-flight data, not " + ws.unit());
		final List<Spectrum> out = new ArrayList<>(ws.size());
		for (final Spectrum source : ws.spectra()) {
			final Spectrum s = source.duplicate();
			out.add(s);
			if (s.isMonitor()) continue;
			if (isPixelMasked(s, spec)) s.setMasked(true);
			for (final TofWindow w : spec.timeWindows())
				maskWindow(s, w);
		}
		return ws.withSpectra(ws.name(), ws.unit(), out);
	}

	/**
	 * Assesses whether the spectrum is covered by a spectrum-number or shape
	 * mask of the spec.
	 */
	public static boolean isPixelMasked(final Spectrum s, final MaskSpec spec) {
		if (spec.spectra().contains(s.spectrumNumber())) return true;
		if (s.pixel() == null) return false;
		for (final MaskShape shape : spec.shapes()) {
			if (shape.covers(s.pixel())) return true;
		}
		return false;
	}

	private static void maskWindow(final Spectrum s, final TofWindow w) {
		if (s.isEventMode()) {
			final EventList kept = s.events().removeTofWindow(w.start(), w.stop());
			s.setEvents(kept);
			return;
		}
		final double[] x = s.x();
		for (int i = 0; i < s.nBins(); i++) {
			if (x[i] < w.stop() && x[i + 1] > w.start()) s.maskBin(i);
		}
	}
}
