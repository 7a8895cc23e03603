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

package net.sanscore.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.Test;

/**
 * Tests for {@link Histograms}
 */
public class HistogramsTest {

	private final double precision = 1e-9;

	@Test
	public void testBinIndex() {
		final double[] edges = { 0, 1, 2, 3 };
		assertEquals(0, Histograms.binIndex(edges, 0));
		assertEquals(1, Histograms.binIndex(edges, 1.5));
		assertEquals(2, Histograms.binIndex(edges, 2));
		assertEquals(-1, Histograms.binIndex(edges, 3));
		assertEquals(-1, Histograms.binIndex(edges, -0.1));
		assertEquals(-1, Histograms.binIndex(edges, Double.NaN));
	}

	@Test
	public void testRebinConservesCounts() {
		final double[] x = { 0, 1, 2, 3, 4 };
		final double[] y = { 4, 8, 2, 6 };
		final double[] e = { 2, Math.sqrt(8), Math.sqrt(2), Math.sqrt(6) };
		final double[][] r = Histograms.rebin(x, y, e, new double[] { 0, 0.5, 2.5, 4 });
		assertEquals(StatUtils.sum(y), StatUtils.sum(r[0]), precision);
		assertArrayEquals(new double[] { 2, 2 + 8 + 1, 1 + 6 }, r[0], precision);
	}

	@Test
	public void testRebinOutsideRangeIsZero() {
		final double[][] r = Histograms.rebin(new double[] { 0, 1 }, new double[] { 5 }, new double[] { 1 },
				new double[] { 2, 3 });
		assertEquals(0d, r[0][0], 0);
		assertEquals(0d, r[1][0], 0);
	}

	@Test
	public void testTransferFlags() {
		final boolean[] flags = Histograms.transferFlags(new double[] { 0, 1, 2 }, new boolean[] { false, true },
				new double[] { 0, 0.5, 1.5, 3 });
		assertFalse(flags[0]);
		assertTrue(flags[1]);
		assertTrue(flags[2]);
	}

	@Test
	public void testInterpolateAcross() {
		final double[] x = { 0, 1, 2, 3, 4, 5 };
		final double[] y = { 1, 2, 100, 100, 5 };
		final double[] e = { 1, 1, 10, 10, 1 };
		final int n = Histograms.interpolateAcross(x, y, e, 2, 4);
		assertEquals(2, n);
		assertEquals(3d, y[2], precision);
		assertEquals(4d, y[3], precision);
	}
}
