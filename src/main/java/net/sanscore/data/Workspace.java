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

package net.sanscore.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * An ordered collection of {@link Spectrum} sharing one x-unit. Workspaces are
 * passed between reduction stages as values: stages that change a workspace
 * work on a {@link #duplicate()} and return it.
 *
 * @author SANS-Core developers
 */
public class Workspace {

	private final String name;
	private final XUnit unit;
	private List<Spectrum> spectra;
	private double protonCharge = 1d;
	private boolean released;

	public Workspace(final String name, final XUnit unit, final List<Spectrum> spectra) {
		if (unit == null)
			throw new IllegalArgumentException("Workspace unit cannot be null");
		if (spectra == null)
			throw new IllegalArgumentException("Spectra cannot be null");
		this.name = (name == null) ? "" : name;
		this.unit = unit;
		this.spectra = new ArrayList<>(spectra);
	}

	/** Creates a workspace holding a single histogram spectrum. */
	public static Workspace of(final String name, final XUnit unit, final double[] x, final double[] y,
			final double[] e) {
		return new Workspace(name, unit, List.of(Spectrum.histogram(0, null, x, y, e)));
	}

	public String name() {
		return name;
	}

	public XUnit unit() {
		return unit;
	}

	public int size() {
		checkNotReleased();
		return spectra.size();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public Spectrum spectrum(final int index) {
		checkNotReleased();
		return spectra.get(index);
	}

	public List<Spectrum> spectra() {
		checkNotReleased();
		return Collections.unmodifiableList(spectra);
	}

	/**
	 * Returns the spectrum with the given spectrum number, or null if this
	 * workspace does not hold it.
	 */
	public Spectrum findSpectrum(final int spectrumNumber) {
		checkNotReleased();
		for (final Spectrum s : spectra) {
			if (s.spectrumNumber() == spectrumNumber) return s;
		}
		return null;
	}

	public boolean isEventMode() {
		checkNotReleased();
		return spectra.stream().anyMatch(Spectrum::isEventMode);
	}

	public double protonCharge() {
		return protonCharge;
	}

	public void setProtonCharge(final double protonCharge) {
		this.protonCharge = protonCharge;
	}

	public Workspace duplicate() {
		return duplicate(name);
	}

	public Workspace duplicate(final String newName) {
		return withSpectra(newName, unit, select(s -> true));
	}

	/**
	 * Returns a new workspace holding copies of the spectra accepted by the
	 * filter.
	 */
	public Workspace crop(final String newName, final Predicate<Spectrum> filter) {
		return withSpectra(newName, unit, select(filter));
	}

	/** Returns a new workspace with the same metadata and the given spectra. */
	public Workspace withSpectra(final String newName, final XUnit newUnit, final List<Spectrum> newSpectra) {
		checkNotReleased();
		final Workspace ws = new Workspace(newName, newUnit, newSpectra);
		ws.protonCharge = protonCharge;
		return ws;
	}

	/** Returns a histogram copy of this workspace. */
	public Workspace toHistogram(final String newName) {
		checkNotReleased();
		final List<Spectrum> copies = new ArrayList<>(spectra.size());
		for (final Spectrum s : spectra)
			copies.add(s.toHistogram());
		return withSpectra(newName, unit, copies);
	}

	private List<Spectrum> select(final Predicate<Spectrum> filter) {
		checkNotReleased();
		final List<Spectrum> copies = new ArrayList<>();
		for (final Spectrum s : spectra) {
			if (filter.test(s)) copies.add(s.duplicate());
		}
		return copies;
	}

	/**
	 * Drops the data held by this workspace. Any later access fails.
	 */
	public void release() {
		spectra = null;
		released = true;
	}

	public boolean isReleased() {
		return released;
	}

	private void checkNotReleased() {
		if (released)
			throw new IllegalStateException("Workspace '" + name + "' has been released");
	}

	@Override
	public String toString() {
		return name + " [" + unit.label() + ((released) ? ", released]" : ", " + spectra.size() + " spectra]");
	}
}
