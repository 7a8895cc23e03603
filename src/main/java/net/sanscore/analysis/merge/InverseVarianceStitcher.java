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

/**
 * Weights each bank by the inverse of its variance. A value without error
 * takes precedence; two values without error are averaged.
 *
 * @author SANS-Core developers
 */
public class InverseVarianceStitcher implements Stitcher {

	@Override
	public double[] stitch(final double yLab, final double eLab, final double yHab, final double eHab) {
		if (eLab == 0 && eHab == 0) return new double[] { (yLab + yHab) / 2, 0d };
		if (eLab == 0) return new double[] { yLab, 0d };
		if (eHab == 0) return new double[] { yHab, 0d };
		final double wLab = 1 / (eLab * eLab);
		final double wHab = 1 / (eHab * eHab);
		final double sum = wLab + wHab;
		return new double[] { (wLab * yLab + wHab * yHab) / sum, Math.sqrt(1 / sum) };
	}
}
