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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for {@link BinningParams}
 */
public class BinningParamsTest {

	private final double precision = 1e-12;

	@Test
	public void testLinearEdges() {
		final BinningParams p = BinningParams.linear(2, 0.5, 4);
		assertArrayEquals(new double[] { 2, 2.5, 3, 3.5, 4 }, p.edges(), precision);
		assertEquals(4, p.nBins());
	}

	@Test
	public void testLastBinIsTruncated() {
		final double[] edges = BinningParams.linear(0, 0.3, 1).edges();
		assertEquals(1d, edges[edges.length - 1], precision);
		assertEquals(0.1, edges[edges.length - 1] - edges[edges.length - 2], 1e-9);
	}

	@Test
	public void testLogarithmicEdges() {
		final double[] edges = BinningParams.logarithmic(0.001, 0.1, 0.1).edges();
		assertEquals(0.001, edges[0], precision);
		assertEquals(0.1, edges[edges.length - 1], precision);
		assertTrue(Histograms.isAscending(edges));
		for (int i = 1; i < edges.length - 1; i++)
			assertEquals("Constant relative width", 1.1, edges[i] / edges[i - 1], 1e-9);
	}

	@Test
	public void testWithRangeKeepsStep() {
		final BinningParams p = BinningParams.linear(2, 0.5, 10).withRange(4, 6);
		assertEquals(4, p.nBins());
		assertEquals(0.5, p.step(), precision);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvertedBounds() {
		BinningParams.linear(10, 0.5, 2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLogarithmicRequiresPositiveMinimum() {
		BinningParams.logarithmic(0, 0.1, 1);
	}
}
