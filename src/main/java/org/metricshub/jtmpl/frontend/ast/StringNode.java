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
 * A quoted or raw string constant.
 */
public final class StringNode extends Node {

	private final String quoted;
	private final String text;

	/**
	 * @param treeId owning tree
	 * @param position offset of the literal
	 * @param quoted the literal as written, quotes included
	 * @param text the decoded string
	 */
	public StringNode(int treeId, int position, String quoted, String text) {
		super(treeId, position);
		this.quoted = quoted;
		this.text = text;
	}

	@Override
	public NodeType getType() {
		return NodeType.STRING;
	}

	public String getQuoted() {
		return quoted;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return quoted;
	}
}
