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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A set of masking instructions: whole spectra, geometric shapes and
 * time-of-flight windows. Combining specs is a logical OR.
 *
 * @author SANS-Core developers
 */
public record MaskSpec(Set<Integer> spectra, List<MaskShape> shapes, List<TofWindow> timeWindows) {

	public static final MaskSpec EMPTY = new MaskSpec(Set.of(), List.of(), List.of());

	public MaskSpec {
		spectra = (spectra == null) ? Set.of() : Set.copyOf(new TreeSet<>(spectra));
		shapes = (shapes == null) ? List.of() : List.copyOf(shapes);
		timeWindows = (timeWindows == null) ? List.of() : List.copyOf(timeWindows);
	}

	public static MaskSpec ofSpectra(final Integer... spectrumNumbers) {
		return new MaskSpec(Set.of(spectrumNumbers), null, null);
	}

	public static MaskSpec ofShapes(final MaskShape... shapes) {
		return new MaskSpec(null, List.of(shapes), null);
	}

	public static MaskSpec ofTimeWindows(final TofWindow... windows) {
		return new MaskSpec(null, null, List.of(windows));
	}

	public boolean isEmpty() {
		return spectra.isEmpty() && shapes.isEmpty() && timeWindows.isEmpty();
	}

	public boolean hasPixelMasks() {
		return !spectra.isEmpty() || !shapes.isEmpty();
	}

	/** Returns the union of this spec and {@code other}. */
	public MaskSpec or(final MaskSpec other) {
		if (other == null || other.isEmpty()) return this;
		if (isEmpty()) return other;
		final Set<Integer> s = new TreeSet<>(spectra);
		s.addAll(other.spectra);
		final List<MaskShape> sh = new ArrayList<>(shapes);
		sh.addAll(other.shapes);
		final List<TofWindow> tw = new ArrayList<>(timeWindows);
		tw.addAll(other.timeWindows);
		return new MaskSpec(s, sh, tw);
	}
}
