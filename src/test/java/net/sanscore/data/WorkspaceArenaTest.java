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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for {@link WorkspaceArena}
 */
public class WorkspaceArenaTest {

	private static Workspace workspace(final String name) {
		return Workspace.of(name, XUnit.TOF, new double[] { 0, 1 }, new double[] { 1 }, new double[] { 1 });
	}

	@Test
	public void testCloseReleasesTrackedWorkspaces() {
		final Workspace a = workspace("a");
		final Workspace b = workspace("b");
		final Workspace kept = workspace("kept");
		final WorkspaceArena arena;
		try (WorkspaceArena ar = new WorkspaceArena("test")) {
			arena = ar;
			ar.track(a);
			ar.track(b);
			ar.track(kept);
			ar.detach(kept);
			assertEquals(2, ar.size());
		}
		assertTrue(arena.isClosed());
		assertTrue(a.isReleased());
		assertTrue(b.isReleased());
		assertFalse(kept.isReleased());
		assertEquals(2, arena.releasedNames().size());
	}

	@Test
	public void testReleaseOnFailure() {
		final Workspace a = workspace("a");
		try (WorkspaceArena arena = new WorkspaceArena("failing")) {
			arena.track(a);
			throw new IllegalStateException("boom");
		} catch (final IllegalStateException expected) {
			assertEquals("boom", expected.getMessage());
		}
		assertTrue(a.isReleased());
	}

	@Test(expected = IllegalStateException.class)
	public void testReleasedWorkspaceCannotBeRead() {
		final Workspace a = workspace("a");
		a.release();
		a.duplicate("copy");
	}
}
