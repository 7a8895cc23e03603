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

/**
 * Position of a detector pixel (or monitor) relative to the sample, in metres.
 * The beam travels along +z.
 *
 * @author SANS-Core developers
 */
public record DetectorPixel(double x, double y, double z) {

	/** Returns this position translated in the detector plane. */
	public DetectorPixel shifted(final double dx, final double dy) {
		return new DetectorPixel(x + dx, y + dy, z);
	}

	/** Distance from the beam axis, in the detector plane. */
	public double radius() {
		return Math.hypot(x, y);
	}

	/** Sample-to-pixel distance (L2). */
	public double distance() {
		return Math.sqrt(x * x + y * y + z * z);
	}

	/** Scattering angle 2&theta;, in radians. */
	public double twoTheta() {
		return Math.atan2(radius(), z);
	}

	/**
	 * Solid angle subtended by a flat pixel facing the sample.
	 *
	 * @param area the pixel area in square metres
	 * @return the solid angle in steradians
	 */
	public double solidAngle(final double area) {
		final double l2 = distance();
		return area * Math.abs(z) / (l2 * l2 * l2);
	}

	/** Azimuthal angle in degrees, in [0, 360). */
	public double phi() {
		final double deg = Math.toDegrees(Math.atan2(y, x));
		return (deg < 0) ? deg + 360.0 : deg;
	}
}
