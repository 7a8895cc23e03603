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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Owns the intermediate workspaces of one reduction. Closing the arena
 * releases every tracked workspace that was not detached, whether the
 * reduction completed or failed.
 *
 * <pre>
 * try (WorkspaceArena arena = new WorkspaceArena("slice")) {
 * 	Workspace cropped = arena.track(input.crop(...));
 * 	...
 * 	return arena.detach(result);
 * }
 * </pre>
 *
 * @author SANS-Core developers
 */
public class WorkspaceArena implements AutoCloseable {

	private final String owner;
	private final Set<Workspace> tracked = Collections.newSetFromMap(new IdentityHashMap<>());
	private final List<String> releasedNames = new ArrayList<>();
	private boolean closed;

	public WorkspaceArena(final String owner) {
		this.owner = owner;
	}

	/** Registers an intermediate workspace and returns it. */
	public synchronized <T extends Workspace> T track(final T workspace) {
		if (closed)
			throw new IllegalStateException("Arena '" + owner + "' is closed");
		if (workspace != null) tracked.add(workspace);
		return workspace;
	}

	/**
	 * Removes a workspace from the arena so that it survives {@link #close()}.
	 */
	public synchronized <T extends Workspace> T detach(final T workspace) {
		tracked.remove(workspace);
		return workspace;
	}

	/** Number of workspaces currently owned by the arena. */
	public synchronized int size() {
		return tracked.size();
	}

	/** Names of the workspaces released when the arena was closed. */
	public synchronized List<String> releasedNames() {
		return Collections.unmodifiableList(releasedNames);
	}

	public synchronized boolean isClosed() {
		return closed;
	}

	@Override
	public synchronized void close() {
		if (closed) return;
		for (final Workspace ws : tracked) {
			releasedNames.add(ws.name());
			ws.release();
		}
		tracked.clear();
		closed = true;
	}
}
