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

import java.util.Map;
import java.util.TreeMap;

/**
 * Optional detector corrections.
 *
 * @param pixelEfficiency      flood-field efficiency per spectrum number
 *                             (missing spectra count as 1)
 * @param efficiencyWavelength wavelengths of the detector efficiency table,
 *                             ascending (may be null)
 * @param efficiency           detector efficiency at those wavelengths
 * @author SANS-Core developers
 */
public record AdjustmentSettings(Map<Integer, Double> pixelEfficiency, double[] efficiencyWavelength,
		double[] efficiency) {

	public static final AdjustmentSettings NONE = new AdjustmentSettings(null, null, null);

	public AdjustmentSettings {
		pixelEfficiency = (pixelEfficiency == null) ? Map.of() : Map.copyOf(new TreeMap<>(pixelEfficiency));
		for (final Map.Entry<Integer, Double> entry : pixelEfficiency.entrySet()) {
			if (!(entry.getValue() > 0))
				throw new ConfigurationException("Pixel efficiency must be positive (spectrum " + entry.getKey() + ")");
		}
		if ((efficiencyWavelength == null) != (efficiency == null))
			throw new ConfigurationException("Efficiency table requires both wavelengths and efficiencies");
		if (efficiencyWavelength != null) {
			if (efficiencyWavelength.length != efficiency.length || efficiencyWavelength.length < 2)
				throw new ConfigurationException("Efficiency table needs at least two matching entries");
			for (int i = 1; i < efficiencyWavelength.length; i++) {
				if (!(efficiencyWavelength[i] > efficiencyWavelength[i - 1]))
					throw new ConfigurationException("Efficiency wavelengths must be strictly ascending");
			}
			efficiencyWavelength = efficiencyWavelength.clone();
			efficiency = efficiency.clone();
		}
	}

	public boolean hasEfficiencyTable() {
		return efficiencyWavelength != null;
	}

	public double pixelEfficiency(final int spectrumNumber) {
		return pixelEfficiency.getOrDefault(spectrumNumber, 1d);
	}
}
