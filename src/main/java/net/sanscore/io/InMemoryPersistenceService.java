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

package net.sanscore.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import net.sanscore.data.Workspace;
import net.sanscore.util.Logger;

/**
 * Keeps saved tables and workspaces in memory, e.g. for embedding the
 * reduction in another application or for testing.
 *
 * @author SANS-Core developers
 */
public class InMemoryPersistenceService implements PersistenceService {

	/** A stored table. */
	public record Table(List<String> columns, List<double[]> rows) {

		public double value(final int row, final String column) {
			final int col = columns.indexOf(column);
			if (col < 0) throw new IllegalArgumentException("No such column: " + column);
			return rows.get(row)[col];
		}
	}

	private final Logger logger = new Logger(InMemoryPersistenceService.class);
	private final Map<String, Table> tables = Collections.synchronizedMap(new LinkedHashMap<>());
	private final Map<Path, Workspace> workspaces = Collections.synchronizedMap(new LinkedHashMap<>());
	private final AtomicInteger counter = new AtomicInteger();

	@Override
	public String saveTable(final List<double[]> rows, final List<String> columns) {
		final List<double[]> copies = new ArrayList<>(rows.size());
		for (final double[] row : rows) {
			if (row.length != columns.size())
				throw new IllegalArgumentException("Row has " + row.length + " values for " + columns.size() + " columns");
			copies.add(row.clone());
		}
		final String id = "table_" + counter.incrementAndGet();
		tables.put(id, new Table(List.copyOf(columns), Collections.unmodifiableList(copies)));
		logger.debug("Saved " + id + " " + columns);
		return id;
	}

	@Override
	public void saveWorkspace(final Workspace ws, final Path path) {
		workspaces.put(path, ws.duplicate());
		logger.debug("Saved " + ws + " to " + path);
	}

	public Table table(final String id) {
		return tables.get(id);
	}

	public Workspace workspace(final Path path) {
		return workspaces.get(path);
	}

	public int tableCount() {
		return tables.size();
	}
}
