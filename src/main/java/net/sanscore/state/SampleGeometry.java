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
 * Shape of the illuminated sample, used to scale counts to absolute units.
 * Dimensions are in millimetres; volumes in cubic centimetres.
 *
 * @author SANS-Core developers
 */
public sealed interface SampleGeometry
		permits SampleGeometry.Cylinder, SampleGeometry.FlatPlate, SampleGeometry.Disc {

	double volume();

	/** Cylinder with its axis vertical; the beam crosses its diameter. */
	record Cylinder(double width, double height) implements SampleGeometry {
		public Cylinder {
			checkPositive(width, height);
		}

		@Override
		public double volume() {
			final double r = width / 2;
			return Math.PI * r * r * height / 1000.0;
		}
	}

	record FlatPlate(double width, double height, double thickness) implements SampleGeometry {
		public FlatPlate {
			checkPositive(width, height, thickness);
		}

		@Override
		public double volume() {
			return width * height * thickness / 1000.0;
		}
	}

	/** Disc facing the beam. */
	record Disc(double width, double thickness) implements SampleGeometry {
		public Disc {
			checkPositive(width, thickness);
		}

		@Override
		public double volume() {
			final double r = width / 2;
			return Math.PI * r * r * thickness / 1000.0;
		}
	}

	private static void checkPositive(final double... dimensions) {
		for (final double d : dimensions) {
			if (!(d > 0)) throw new ConfigurationException("Sample dimensions must be positive: " + d);
		}
	}
}
