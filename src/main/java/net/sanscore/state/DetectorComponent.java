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
 * The detector banks of a SANS instrument.
 *
 * @author SANS-Core developers
 */
public enum DetectorComponent {

	/** Low-angle (main, rear) bank */
	LAB("main-detector-bank", "rear"),
	/** High-angle (front) bank */
	HAB("HAB", "front");

	private final String componentName;
	private final String alias;

	DetectorComponent(final String componentName, final String alias) {
		this.componentName = componentName;
		this.alias = alias;
	}

	public String componentName() {
		return componentName;
	}

	/**
	 * Parses a component from its enum name, instrument component name or
	 * legacy alias ("rear"/"front"), ignoring case.
	 */
	public static DetectorComponent fromString(final String value) {
		if (value != null) {
			final String v = value.trim();
			for (final DetectorComponent c : values()) {
				if (c.name().equalsIgnoreCase(v) || c.componentName.equalsIgnoreCase(v) || c.alias.equalsIgnoreCase(v))
					return c;
			}
		}
		throw new ConfigurationException("Unknown detector component: " + value);
	}
}
