package org.metricshub.jtmpl.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtmpl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the parser classes.
 * <p>
 * SLF4J reports its own provider lookup on the console, which is noise for an
 * application that embeds the parser. Unless the application already chose a
 * verbosity with the <code>slf4j.internal.verbosity</code> system property,
 * those reports are limited to warnings.
 */
public final class TemplateLogger {

	static final String VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(VERBOSITY_PROPERTY) == null) {
			System.setProperty(VERBOSITY_PROPERTY, "WARN");
		}
	}

	private TemplateLogger() {}

	/**
	 * @param clazz parser class that logs
	 * @return the logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
