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

package net.sanscore.analysis.merge;

import net.sanscore.data.Workspace;
import net.sanscore.state.FitPolicy;

/**
 * Result of a two-bank merge.
 *
 * @param merged      the merged intensity, one spectrum over the common Q bins
 * @param scale       the scale applied to the high-angle bank
 * @param shift       the shift applied to the high-angle bank, in low-angle
 *                    units
 * @param policy      the fit policy used
 * @param overlapBins the number of bins entering the fit
 * @param scaledHab   the rescaled high-angle intensity
 * @author SANS-Core developers
 */
public record MergeResult(Workspace merged, double scale, double shift, FitPolicy policy, int overlapBins,
		Workspace scaledHab) {
}
