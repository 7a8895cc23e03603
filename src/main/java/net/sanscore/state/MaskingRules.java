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

import java.util.EnumMap;
import java.util.Map;

/**
 * Masking configuration of a run: masks for every bank, masks per bank and the
 * radius limits around the beam centre.
 *
 * @param general      masks applied to every component
 * @param perComponent masks applied to one component only
 * @param radiusMin    pixels closer than this to the beam centre are masked
 *                     (0 disables)
 * @param radiusMax    pixels further than this from the beam centre are masked
 *                     (0 disables)
 * @author SANS-Core developers
 */
public record MaskingRules(MaskSpec general, Map<DetectorComponent, MaskSpec> perComponent, double radiusMin,
		double radiusMax) {

	public static final MaskingRules NONE = new MaskingRules(MaskSpec.EMPTY, Map.of(), 0d, 0d);

	public MaskingRules {
		general = (general == null) ? MaskSpec.EMPTY : general;
		final Map<DetectorComponent, MaskSpec> copy = new EnumMap<>(DetectorComponent.class);
		if (perComponent != null) copy.putAll(perComponent);
		perComponent = Map.copyOf(copy);
		if (radiusMin < 0 || radiusMax < 0)
			throw new ConfigurationException("Radius limits cannot be negative");
		if (radiusMin > 0 && radiusMax > 0 && !(radiusMin < radiusMax))
			throw new ConfigurationException("Inverted radius limits: " + radiusMin + " >= " + radiusMax);
	}

	/**
	 * Returns every mask that applies to the given component. Radius limits are
	 * expressed around the origin, i.e. they assume the detector has already been
	 * moved so that the beam centre sits at (0, 0).
	 */
	public MaskSpec forComponent(final DetectorComponent component) {
		MaskSpec spec = general.or(perComponent.get(component));
		if (radiusMin > 0)
			spec = spec.or(MaskSpec.ofShapes(new MaskShape.Cylinder(radiusMin, 0, 0, true)));
		if (radiusMax > 0)
			spec = spec.or(MaskSpec.ofShapes(new MaskShape.Cylinder(radiusMax, 0, 0, false)));
		return spec;
	}

	public MaskingRules withRadiusLimits(final double min, final double max) {
		return new MaskingRules(general, perComponent, min, max);
	}
}
