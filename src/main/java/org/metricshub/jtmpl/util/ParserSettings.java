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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.metricshub.jtmpl.frontend.Lexer;

/**
 * A simple container for the parameters of a template parse.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jtmpl programmatically, from within Java code.
 */
public class ParserSettings {

	/**
	 * Names of the functions templates may call.
	 * Any other identifier is rejected while parsing.
	 * Empty by default.
	 */
	private Set<String> functions = new LinkedHashSet<String>();

	/**
	 * Whether <code>{{template (pipeline)}}</code> is accepted;
	 * <code>false</code> by default.
	 */
	private boolean dynamicTemplateNames = false;

	/**
	 * Delimiter opening an action;
	 * <code>{{</code> by default.
	 */
	private String leftDelimiter = Lexer.DEFAULT_LEFT_DELIM;

	/**
	 * Delimiter closing an action;
	 * <code>}}</code> by default.
	 */
	private String rightDelimiter = Lexer.DEFAULT_RIGHT_DELIM;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("functions = ").append(new ArrayList<String>(functions)).append(newLine);
		desc.append("dynamicTemplateNames = ").append(isDynamicTemplateNames()).append(newLine);
		desc.append("leftDelimiter = ").append(getLeftDelimiter()).append(newLine);
		desc.append("rightDelimiter = ").append(getRightDelimiter()).append(newLine);

		return desc.toString();
	}

	/**
	 * Names of the functions templates may call.
	 *
	 * @return a copy of the function names
	 */
	public Set<String> getFunctions() {
		return new LinkedHashSet<String>(functions);
	}

	/**
	 * Replaces the names of the functions templates may call.
	 *
	 * @param functions the function names
	 */
	public void setFunctions(Collection<String> functions) {
		this.functions = new LinkedHashSet<String>(functions);
	}

	/**
	 * Declares one more function templates may call.
	 *
	 * @param name Function name
	 */
	public void addFunction(String name) {
		functions.add(name);
	}

	/**
	 * Whether <code>{{template (pipeline)}}</code> is accepted;
	 * <code>false</code> by default.
	 *
	 * @return the dynamicTemplateNames
	 */
	public boolean isDynamicTemplateNames() {
		return dynamicTemplateNames;
	}

	/**
	 * @param dynamicTemplateNames the dynamicTemplateNames to set
	 */
	public void setDynamicTemplateNames(boolean dynamicTemplateNames) {
		this.dynamicTemplateNames = dynamicTemplateNames;
	}

	public String getLeftDelimiter() {
		return leftDelimiter;
	}

	public String getRightDelimiter() {
		return rightDelimiter;
	}

	/**
	 * Sets the action delimiters. An empty or <code>null</code> value
	 * restores the corresponding default.
	 *
	 * @param left delimiter opening an action
	 * @param right delimiter closing an action
	 */
	public void setDelimiters(String left, String right) {
		this.leftDelimiter = left == null || left.isEmpty() ? Lexer.DEFAULT_LEFT_DELIM : left;
		this.rightDelimiter = right == null || right.isEmpty() ? Lexer.DEFAULT_RIGHT_DELIM : right;
	}
}
