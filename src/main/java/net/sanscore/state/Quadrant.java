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
 * The four detector-plane quadrants around a candidate beam centre, bounded
 * by the two diagonals through the centre. Pixels on a diagonal belong to no
 * quadrant.
 *
 * @author SANS-Core developers
 */
public enum Quadrant {

	LEFT, RIGHT, UP, DOWN;

	/**
	 * @param dx horizontal offset from the centre
	 * @param dy vertical offset from the centre
	 * @return true if the offset lies strictly inside this quadrant
	 */
	public boolean contains(final double dx, final double dy) {
		return switch (this) {
			case LEFT -> dx < 0 && Math.abs(dy) < -dx;
			case RIGHT -> dx > 0 && Math.abs(dy) < dx;
			case UP -> dy > 0 && Math.abs(dx) < dy;
			case DOWN -> dy < 0 && Math.abs(dx) < -dy;
		};
	}

	/** The quadrant a residual is computed against. */
	public Quadrant opposite() {
		return switch (this) {
			case LEFT -> RIGHT;
			case RIGHT -> LEFT;
			case UP -> DOWN;
			case DOWN -> UP;
		};
	}
}
