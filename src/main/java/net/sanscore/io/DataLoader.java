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

import java.io.IOException;

/**
 * Loaders providing the workspaces of a run should implement this interface.
 * Reading raw instrument files is left to implementations.
 *
 * @author SANS-Core developers
 */
public interface DataLoader {

	/**
	 * Loads a run.
	 *
	 * @param runIdentifier the run number or file name
	 * @return the workspaces of the run, all sharing one instrument geometry
	 * @throws IOException if the run cannot be read
	 */
	public RunData load(String runIdentifier) throws IOException;

}
