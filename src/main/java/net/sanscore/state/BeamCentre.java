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
 * Beam-centre position of a detector bank, in metres. Position 1 is the
 * horizontal coordinate, position 2 the vertical one.
 */
public record BeamCentre(double position1, double position2) {

	public static final BeamCentre ORIGIN = new BeamCentre(0d, 0d);

	public BeamCentre {
		if (!Double.isFinite(position1) || !Double.isFinite(position2))
			throw new ConfigurationException("Beam centre must be finite: " + position1 + ", " + position2);
	}
}
