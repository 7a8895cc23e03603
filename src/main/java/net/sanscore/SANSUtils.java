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

package net.sanscore;

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

/**
 * Static utilities: library-wide logging and number formatting.
 *
 * @author SANS-Core developers
 */
public class SANSUtils {

	private static LogService logService;
	private static boolean debugMode;

	private SANSUtils() {
	} // no instantiation

	/**
	 * Returns the log service used by the library. Unless another service was
	 * installed, messages go to the standard error stream.
	 */
	public static synchronized LogService getLogService() {
		if (logService == null) logService = new StderrLogService();
		return logService;
	}

	/**
	 * Installs the log service used by the library, e.g. the one of an existing
	 * SciJava context.
	 *
	 * @param service the service, or null to restore the default
	 */
	public static synchronized void setLogService(final LogService service) {
		logService = service;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		getLogService().info("[SANS] " + string);
	}

	public static synchronized void warn(final String string) {
		getLogService().warn("[SANS] " + string);
	}

	public static synchronized void error(final String string) {
		getLogService().error("[SANS] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (t == null)
			getLogService().error("[SANS] " + string);
		else
			getLogService().error("[SANS] " + string, t);
	}

	/**
	 * Assesses if the library is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debugMode;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debugMode = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	public static String formatDouble(final double value, final int digits) {
		return (Double.isNaN(value)) ? "NaN" : getDecimalFormat(value, digits).format(value);
	}

	public static DecimalFormat getDecimalFormat(final double value, final int digits) {
		final StringBuilder pattern = new StringBuilder("0.");
		while (pattern.length() < digits + 2)
			pattern.append("0");
		final double absValue = Math.abs(value);
		if ((absValue > 0 && absValue < 0.01) || absValue >= 1000) pattern.append("E0");
		final NumberFormat nf = NumberFormat.getNumberInstance(Locale.US);
		final DecimalFormat df = (DecimalFormat) nf;
		df.applyLocalizedPattern(pattern.toString());
		return df;
	}
}
