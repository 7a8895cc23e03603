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

package net.sanscore.reduction;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of the reduction of a run: the outputs that were produced and the
 * reasons of those that were not.
 *
 * @author SANS-Core developers
 */
public record ReductionReport(String runIdentifier, List<ReductionOutput> succeeded, List<SliceFailure> failures) {

	public ReductionReport {
		succeeded = List.copyOf(succeeded);
		failures = List.copyOf(failures);
	}

	public boolean isComplete() {
		return failures.isEmpty();
	}

	public Optional<ReductionOutput> output(final String name) {
		return succeeded.stream().filter(o -> o.name().equals(name)).findFirst();
	}
}
