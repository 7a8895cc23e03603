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
import java.util.List;
import java.util.Map;

/**
 * Detector layout of an instrument: spectrum-number ranges of its banks, pixel
 * size and primary flight path.
 *
 * @param instrument  instrument identity, used for default lookups
 * @param components  spectrum-number range of each detector bank
 * @param pixelWidth  pixel width in metres
 * @param pixelHeight pixel height in metres
 * @param l1          moderator-to-sample distance in metres
 * @author SANS-Core developers
 */
public record InstrumentGeometry(Instrument instrument, Map<DetectorComponent, SpectrumRange> components,
		double pixelWidth, double pixelHeight, double l1) {

	public InstrumentGeometry {
		instrument = (instrument == null) ? Instrument.GENERIC : instrument;
		if (components == null || !components.containsKey(DetectorComponent.LAB))
			throw new ConfigurationException("Instrument geometry must define the low-angle bank");
		final Map<DetectorComponent, SpectrumRange> copy = new EnumMap<>(components);
		final List<SpectrumRange> ranges = List.copyOf(copy.values());
		for (int i = 0; i < ranges.size(); i++) {
			for (int j = i + 1; j < ranges.size(); j++) {
				if (ranges.get(i).overlaps(ranges.get(j)))
					throw new ConfigurationException("Detector banks share spectra: " + ranges.get(i) + ", " + ranges.get(j));
			}
		}
		components = Map.copyOf(copy);
		if (!(pixelWidth > 0) || !(pixelHeight > 0))
			throw new ConfigurationException("Pixel dimensions must be positive");
		if (!(l1 > 0))
			throw new ConfigurationException("Primary flight path must be positive: " + l1);
	}

	public boolean hasComponent(final DetectorComponent component) {
		return components.containsKey(component);
	}

	public SpectrumRange rangeOf(final DetectorComponent component) {
		final SpectrumRange range = components.get(component);
		if (range == null)
			throw new ConfigurationException(instrument + " has no " + component + " detector bank");
		return range;
	}

	public double pixelArea() {
		return pixelWidth * pixelHeight;
	}
}
