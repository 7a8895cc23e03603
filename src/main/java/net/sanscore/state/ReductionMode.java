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

import java.util.EnumSet;
import java.util.Set;

/**
 * Which detector banks a run reduces and whether their profiles are merged.
 *
 * @author SANS-Core developers
 */
public enum ReductionMode {

	LAB, HAB, ALL, MERGED;

	/** Returns the components that need a core reduction in this mode. */
	public Set<DetectorComponent> components() {
		return switch (this) {
			case LAB -> EnumSet.of(DetectorComponent.LAB);
			case HAB -> EnumSet.of(DetectorComponent.HAB);
			case ALL, MERGED -> EnumSet.allOf(DetectorComponent.class);
		};
	}

	public boolean merges() {
		return this == MERGED;
	}
}
