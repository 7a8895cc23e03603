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

import java.util.Optional;

import net.sanscore.data.Workspace;
import net.sanscore.state.DataType;

/**
 * The workspaces of one run, all in time-of-flight. Detector counts and
 * monitor spectra are held separately. Transmission and direct-beam runs hold
 * monitor spectra only.
 *
 * @param sampleCounts       scattered counts of the sample
 * @param sampleMonitors     monitors of the sample run
 * @param sampleTransmission sample transmission run, or null
 * @param direct             direct-beam run, or null
 * @param canCounts          scattered counts of the empty can, or null
 * @param canMonitors        monitors of the can run, or null
 * @param canTransmission    can transmission run, or null
 * @author SANS-Core developers
 */
public record RunData(Workspace sampleCounts, Workspace sampleMonitors, Workspace sampleTransmission,
		Workspace direct, Workspace canCounts, Workspace canMonitors, Workspace canTransmission) {

	public RunData {
		if (sampleCounts == null || sampleMonitors == null)
			throw new IllegalArgumentException("A run requires sample counts and monitors");
		if ((canCounts == null) != (canMonitors == null))
			throw new IllegalArgumentException("Can counts and can monitors must be given together");
	}

	/** A sample-only run without transmission data. */
	public static RunData of(final Workspace counts, final Workspace monitors) {
		return new RunData(counts, monitors, null, null, null, null, null);
	}

	public RunData withTransmission(final Workspace transmission, final Workspace directBeam) {
		return new RunData(sampleCounts, sampleMonitors, transmission, directBeam, canCounts, canMonitors,
				canTransmission);
	}

	public RunData withCan(final Workspace counts, final Workspace monitors, final Workspace transmission) {
		return new RunData(sampleCounts, sampleMonitors, sampleTransmission, direct, counts, monitors, transmission);
	}

	public boolean hasCan() {
		return canCounts != null;
	}

	public Workspace counts(final DataType type) {
		return (type == DataType.CAN) ? require(canCounts, type) : sampleCounts;
	}

	public Workspace monitors(final DataType type) {
		return (type == DataType.CAN) ? require(canMonitors, type) : sampleMonitors;
	}

	public Optional<Workspace> transmission(final DataType type) {
		return Optional.ofNullable((type == DataType.CAN) ? canTransmission : sampleTransmission);
	}

	public Optional<Workspace> directBeam() {
		return Optional.ofNullable(direct);
	}

	private static Workspace require(final Workspace ws, final DataType type) {
		if (ws == null) throw new IllegalStateException("Run holds no " + type + " data");
		return ws;
	}
}
