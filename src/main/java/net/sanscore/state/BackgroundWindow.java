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

package net.sanscore.state;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Time-of-flight region assumed to hold only background counts in a monitor
 * spectrum. Either one window shared by every monitor or one window per
 * monitor spectrum; the two forms are mutually exclusive.
 *
 * @author SANS-Core developers
 */
public sealed interface BackgroundWindow
		permits BackgroundWindow.None, BackgroundWindow.Global, BackgroundWindow.PerMonitor {

	BackgroundWindow NONE = new None();

	/** Returns the window to use for the given monitor spectrum, if any. */
	Optional<TofWindow> windowFor(int monitorSpectrum);

	/** No background subtraction. */
	record None() implements BackgroundWindow {
		@Override
		public Optional<TofWindow> windowFor(final int monitorSpectrum) {
			return Optional.empty();
		}
	}

	/** One window for every monitor. */
	record Global(TofWindow window) implements BackgroundWindow {
		public Global {
			if (window == null) throw new ConfigurationException("Global background window cannot be null");
		}

		@Override
		public Optional<TofWindow> windowFor(final int monitorSpectrum) {
			return Optional.of(window);
		}
	}

	/** A window per monitor spectrum number. */
	record PerMonitor(Map<Integer, TofWindow> windows) implements BackgroundWindow {
		public PerMonitor {
			if (windows == null || windows.isEmpty())
				throw new ConfigurationException("Per-monitor background requires at least one window");
			windows = Map.copyOf(new TreeMap<>(windows));
		}

		@Override
		public Optional<TofWindow> windowFor(final int monitorSpectrum) {
			return Optional.ofNullable(windows.get(monitorSpectrum));
		}
	}

	/**
	 * Builds the background window from the two configuration forms.
	 *
	 * @param global     the shared window (may be null)
	 * @param perMonitor the per-monitor windows (may be null or empty)
	 * @throws ConfigurationException if both forms are supplied
	 */
	static BackgroundWindow of(final TofWindow global, final Map<Integer, TofWindow> perMonitor) {
		final boolean hasPerMonitor = perMonitor != null && !perMonitor.isEmpty();
		if (global != null && hasPerMonitor)
			throw new ConfigurationException(
					"A global background window and per-monitor background windows are mutually exclusive");
		if (global != null) return new Global(global);
		if (hasPerMonitor) return new PerMonitor(perMonitor);
		return NONE;
	}
}
