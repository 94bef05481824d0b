package org.metricshub.jtmpl.frontend.ast;

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

/**
 * Thrown when a template cannot be parsed.
 * <p>
 * The message has the form
 * <code>template: &lt;tree-name&gt;:&lt;line&gt;:&lt;detail&gt;</code> where
 * the tree name is the innermost template being parsed when the error was
 * detected.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * What went wrong.
	 */
	public enum ErrorKind {
		/** Input ended inside a construct */
		UNEXPECTED_EOF,
		/** A token that the grammar does not allow here */
		UNEXPECTED_TOKEN,
		/** The lexer reported an error token */
		LEXICAL,
		/** An identifier that is not a known function */
		UNDEFINED_FUNCTION,
		/** A variable used before its declaration */
		UNDEFINED_VARIABLE,
		/** Two non-empty definitions of the same template */
		MULTIPLE_DEFINITION,
		/** A string, character or number literal that cannot be decoded */
		MALFORMED_LITERAL,
		/** Too many variables declared in a pipeline */
		TOO_MANY_DECLARATIONS,
		/** A pipeline stage that starts with a constant */
		NON_EXECUTABLE_COMMAND,
		/** A pipeline without any command */
		MISSING_VALUE,
		/** A command without any operand */
		EMPTY_COMMAND,
		/** A parenthesized pipeline that is not closed */
		UNCLOSED_PAREN,
		/** A computed template name while those are disabled */
		DYNAMIC_TEMPLATE_NAME,
		/** The parser was used while no template was being parsed */
		NO_TREE
	}

	private final ErrorKind kind;
	private final String templateName;
	private final int lineNumber;
	private final String detail;

	/**
	 * @param kind category of the error
	 * @param templateName name of the template being parsed
	 * @param lineNumber 1-based line of the offending token
	 * @param detail the bare error message
	 */
	public ParserException(ErrorKind kind, String templateName, int lineNumber, String detail) {
		super("template: " + templateName + ":" + lineNumber + ":" + detail);
		this.kind = kind;
		this.templateName = templateName;
		this.lineNumber = lineNumber;
		this.detail = detail;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public String getTemplateName() {
		return templateName;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the message without the template name and line prefix
	 */
	public String getDetail() {
		return detail;
	}
}
