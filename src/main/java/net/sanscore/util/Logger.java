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

package net.sanscore.util;

import org.scijava.log.LogService;

import net.sanscore.SANSUtils;

/**
 * Logs messages tagged with the name of the calling component. Debug messages
 * are only emitted when debug mode is enabled, either for this logger or
 * library-wide through {@link SANSUtils#setDebugMode(boolean)}.
 *
 * @author SANS-Core developers
 */
public class Logger {

	private final LogService logService;
	private final String callerIdentifier;
	private boolean debug;

	public Logger(final Class<?> clazz) {
		this(SANSUtils.getLogService(), clazz.getSimpleName());
	}

	/**
	 * Constructs a new Logger with the specified service and caller identifier.
	 *
	 * @param logService       the service receiving the messages
	 * @param callerIdentifier the identifier for the calling class/component
	 */
	public Logger(final LogService logService, final String callerIdentifier) {
		this.logService = logService;
		this.callerIdentifier = callerIdentifier;
		setDebug(logService.isDebug());
	}

	/**
	 * Logs an informational message.
	 *
	 * @param msg the message to log
	 */
	public void info(final Object msg) {
		logService.info(callerIdentifier + ": " + msg);
	}

	/**
	 * Logs a debug message (only if debug mode is enabled).
	 *
	 * @param msg the debug message to log
	 */
	public void debug(final Object msg) {
		if (isDebug()) logService.info(callerIdentifier + ": " + msg);
	}

	public void warn(final String string) {
		logService.warn(callerIdentifier + ": " + string);
	}

	public void error(final String string, final Throwable t) {
		logService.error(callerIdentifier + ": " + string, t);
	}

	public boolean isDebug() {
		return debug || SANSUtils.isDebugMode();
	}

	public void setDebug(final boolean debug) {
		this.debug = debug;
	}
}
