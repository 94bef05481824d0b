package org.metricshub.jtmpl;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import org.metricshub.jtmpl.frontend.TemplateParser;
import org.metricshub.jtmpl.frontend.Tree;
import org.metricshub.jtmpl.frontend.ast.ParserException;
import org.metricshub.jtmpl.util.ParserSettings;
import org.metricshub.jtmpl.util.TemplateLogger;
import org.metricshub.jtmpl.util.TemplateSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing of templates.
 * This entry point is used both when Jtmpl is used as a library and when
 * invoked from the command line.
 * <p>
 * Parsing a template produces one {@link Tree} per named template: the
 * top-level one, registered under the name given to the parse, and one for
 * each <code>{{define}}</code> and <code>{{block}}</code> it contains.
 * <p>
 * Templates may only call the functions declared in the
 * {@link ParserSettings}; none are declared by default.
 */
public class Jtmpl {

	private static final Logger LOG = TemplateLogger.getLogger(Jtmpl.class);

	private static final int READ_BUFFER_SIZE = 4096;

	private final ParserSettings settings;

	/**
	 * The trees produced by the last successful parse.
	 */
	private Map<String, Tree> lastTrees = Collections.emptyMap();

	/**
	 * Create a new instance of Jtmpl that knows no function
	 */
	public Jtmpl() {
		this(new ParserSettings());
	}

	/**
	 * Create a new instance of Jtmpl with the specified known functions.
	 *
	 * @param functions names of the functions templates may call
	 */
	public Jtmpl(Collection<String> functions) {
		this(settingsWith(functions));
	}

	/**
	 * Create a new instance of Jtmpl with the specified known functions.
	 *
	 * @param functions names of the functions templates may call
	 */
	public Jtmpl(String... functions) {
		this(settingsWith(Arrays.asList(functions)));
	}

	/**
	 * Create a new instance of Jtmpl with the specified settings. Later
	 * changes to {@code settings} apply to later parses.
	 *
	 * @param settings known functions, delimiters and options
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "settings are meant to be tuned between parses")
	public Jtmpl(ParserSettings settings) {
		this.settings = settings;
	}

	private static ParserSettings settingsWith(Collection<String> functions) {
		ParserSettings settings = new ParserSettings();
		settings.setFunctions(functions);
		return settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ParserSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the trees produced by the last successful parse.
	 *
	 * @return the trees by name, empty if nothing was parsed yet
	 */
	public Map<String, Tree> getLastTrees() {
		return lastTrees;
	}

	/**
	 * Parses a template.
	 *
	 * @param name name of the top-level template
	 * @param text the template
	 * @return the templates found, by name, in order of registration
	 * @throws ParserException on the first syntax error
	 */
	public Map<String, Tree> parse(String name, String text) {
		if (LOG.isTraceEnabled()) {
			LOG.trace("Parser settings:\n{}", settings.toDescriptionString());
		}
		Map<String, Tree> trees = new TemplateParser(name, settings).parse(text);
		lastTrees = trees;
		return trees;
	}

	/**
	 * Reads and parses a template source. The top-level template is named
	 * after {@link TemplateSource#getTemplateName()}.
	 *
	 * @param source where to read the template from
	 * @return the templates found, by name, in order of registration
	 * @throws IOException if the source cannot be read
	 * @throws ParserException on the first syntax error
	 */
	public Map<String, Tree> parse(TemplateSource source) throws IOException {
		LOG.debug("Reading template from {}", source.getDescription());
		return parse(source.getTemplateName(), readFully(source.getReader()));
	}

	/**
	 * Parses a template with the given known functions and default settings.
	 *
	 * @param name name of the top-level template
	 * @param text the template
	 * @param functions names of the functions templates may call
	 * @return the templates found, by name, in order of registration
	 * @throws ParserException on the first syntax error
	 */
	public static Map<String, Tree> parse(String name, String text, Collection<String> functions) {
		return new Jtmpl(functions).parse(name, text);
	}

	private static String readFully(Reader reader) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[READ_BUFFER_SIZE];
		try (Reader r = reader) {
			int read;
			while ((read = r.read(buffer)) != -1) {
				text.append(buffer, 0, read);
			}
		}
		return text.toString();
	}
}
