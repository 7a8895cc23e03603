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

import net.sanscore.data.Workspace;
import net.sanscore.data.XUnit;

/**
 * Converts the x-axis of a workspace between units.
 *
 * @author SANS-Core developers
 */
public interface UnitConverter {

	/**
	 * Converts a workspace. The input is left untouched.
	 *
	 * @param ws          the workspace to convert
	 * @param target      the target unit
	 * @param mode        the energy-transfer mode
	 * @param fixedEnergy the fixed energy (meV) of inelastic modes, or null
	 * @return a new workspace in the target unit, with ascending bin edges
	 * @throws UnsupportedUnitException if the combination is not implemented
	 */
	public Workspace convert(Workspace ws, XUnit target, ConversionMode mode, Double fixedEnergy);

	/** Elastic conversion. */
	default Workspace convert(final Workspace ws, final XUnit target) {
		return convert(ws, target, ConversionMode.ELASTIC, null);
	}

}
