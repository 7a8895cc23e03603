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
 * Absolute-units scaling: counts are multiplied by {@code absoluteScale} and
 * divided by the sample volume.
 */
public record ScaleSettings(double absoluteScale, SampleGeometry sample) {

	public static final ScaleSettings UNIT = new ScaleSettings(1d, null);

	public ScaleSettings {
		if (!Double.isFinite(absoluteScale) || absoluteScale == 0)
			throw new ConfigurationException("Absolute scale must be finite and non-zero: " + absoluteScale);
	}

	/** The factor counts are multiplied by. */
	public double factor() {
		return (sample == null) ? absoluteScale : absoluteScale / sample.volume();
	}
}
