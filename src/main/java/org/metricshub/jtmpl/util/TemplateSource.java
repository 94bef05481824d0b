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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one template content source.
 * This is usually either a string given on the command line,
 * or a template file given as a path with a "-f" command line switch.
 */
public class TemplateSource {

	/** Constant <code>DESCRIPTION_COMMAND_LINE_TEMPLATE="&lt;command-line&gt;"</code> */
	public static final String DESCRIPTION_COMMAND_LINE_TEMPLATE = "<command-line>";

	private final String description;
	private final String templateName;
	private final Reader reader;

	/**
	 * @param templateName name the parsed template is registered under
	 * @param reader the template contents
	 */
	public TemplateSource(String templateName, Reader reader) {
		this(templateName, templateName, reader);
	}

	/**
	 * @param templateName name the parsed template is registered under
	 * @param text the template contents
	 */
	public TemplateSource(String templateName, String text) {
		this(templateName, templateName, new StringReader(text));
	}

	/**
	 * <p>
	 * Constructor for TemplateSource.
	 * </p>
	 *
	 * @param description where the template comes from, for messages
	 * @param templateName name the parsed template is registered under
	 * @param reader the template contents, may be {@code null} for
	 *        subclasses that open it lazily
	 */
	protected TemplateSource(String description, String templateName, Reader reader) {
		this.description = description;
		this.templateName = templateName;
		this.reader = reader;
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * @return name of the top-level template parsed from this source
	 */
	public String getTemplateName() {
		return templateName;
	}

	/**
	 * Obtain the {@link Reader} serving the template contents.
	 *
	 * @return The reader which contains the template contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
