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

import net.sanscore.state.TimeSlice;

/**
 * A reduction output that could not be produced.
 *
 * @param outputName the output that is missing
 * @param timeSlice  its time slice
 * @param reason     a description of the failure
 * @param cause      the exception raised, if any
 * @author SANS-Core developers
 */
public record SliceFailure(String outputName, TimeSlice timeSlice, String reason, Throwable cause) {
}
