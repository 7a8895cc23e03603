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

package net.sanscore.analysis.centre;

/**
 * Coordinates moved by the beam-centre search.
 *
 * @author SANS-Core developers
 */
public enum FindDirection {

	ALL, LEFT_RIGHT, UP_DOWN;

	/** Whether the horizontal position (position 1) is searched. */
	public boolean movesPosition1() {
		return this != UP_DOWN;
	}

	/** Whether the vertical position (position 2) is searched. */
	public boolean movesPosition2() {
		return this != LEFT_RIGHT;
	}
}
