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

import net.sanscore.data.DetectorPixel;

/**
 * Geometric pixel masks. Each variant decides whether it covers (masks) a
 * detector position; positions are in metres in the detector plane.
 *
 * @author SANS-Core developers
 */
public sealed interface MaskShape
		permits MaskShape.Cylinder, MaskShape.QuadrantWedge, MaskShape.PhiWedge, MaskShape.Line {

	boolean covers(DetectorPixel pixel);

	/**
	 * Infinite cylinder along the beam. Masks the inside of the cylinder when
	 * {@code maskInside} is set, the outside otherwise.
	 */
	record Cylinder(double radius, double centreX, double centreY, boolean maskInside) implements MaskShape {
		public Cylinder {
			if (!(radius > 0)) throw new ConfigurationException("Cylinder mask radius must be positive: " + radius);
		}

		@Override
		public boolean covers(final DetectorPixel p) {
			final double r = Math.hypot(p.x() - centreX, p.y() - centreY);
			return (maskInside) ? r < radius : r > radius;
		}
	}

	/**
	 * Masks everything except one quadrant of the annulus
	 * {@code rMin <= r <= rMax} around the given centre.
	 */
	record QuadrantWedge(Quadrant quadrant, double centreX, double centreY, double rMin, double rMax)
			implements MaskShape {
		public QuadrantWedge {
			if (quadrant == null) throw new ConfigurationException("Quadrant cannot be null");
			if (rMin < 0 || !(rMin < rMax))
				throw new ConfigurationException("Invalid quadrant radius limits: [" + rMin + ", " + rMax + "]");
		}

		@Override
		public boolean covers(final DetectorPixel p) {
			final double dx = p.x() - centreX;
			final double dy = p.y() - centreY;
			final double r = Math.hypot(dx, dy);
			return !(quadrant.contains(dx, dy) && r >= rMin && r <= rMax);
		}
	}

	/**
	 * Masks every pixel whose azimuth (degrees, around the centre) lies outside
	 * [phiMin, phiMax]. With {@code mirror}, the opposite sector is kept too.
	 */
	record PhiWedge(double phiMin, double phiMax, boolean mirror, double centreX, double centreY)
			implements MaskShape {
		public PhiWedge {
			if (!(phiMin < phiMax)) throw new ConfigurationException("Inverted phi limits: " + phiMin + ", " + phiMax);
		}

		@Override
		public boolean covers(final DetectorPixel p) {
			final double phi = new DetectorPixel(p.x() - centreX, p.y() - centreY, p.z()).phi();
			if (inSector(phi)) return false;
			return !(mirror && inSector((phi + 180.0) % 360.0));
		}

		private boolean inSector(final double phi) {
			final double lo = norm360(phiMin);
			final double hi = lo + (phiMax - phiMin);
			return (phi >= lo && phi <= hi) || (phi + 360.0 >= lo && phi + 360.0 <= hi);
		}

		private static double norm360(final double deg) {
			final double x = deg % 360.0;
			return (x < 0) ? x + 360.0 : x;
		}
	}

	/**
	 * Masks a strip of the given width through the centre at the given angle
	 * (degrees from the +x axis), e.g. a beam-stop arm.
	 */
	record Line(double width, double angle, double centreX, double centreY) implements MaskShape {
		public Line {
			if (!(width > 0)) throw new ConfigurationException("Line mask width must be positive: " + width);
		}

		@Override
		public boolean covers(final DetectorPixel p) {
			final double a = Math.toRadians(angle);
			final double dx = p.x() - centreX;
			final double dy = p.y() - centreY;
			final double distance = Math.abs(-Math.sin(a) * dx + Math.cos(a) * dy);
			final double along = Math.cos(a) * dx + Math.sin(a) * dy;
			return distance <= width / 2 && along >= 0;
		}
	}
}
