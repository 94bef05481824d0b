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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A variable, possibly followed by field accesses: <code>$x</code>,
 * <code>$x.a.b</code> or <code>$</code>.
 */
public final class VariableNode extends Node {

	private final List<String> ident;

	/**
	 * @param treeId owning tree
	 * @param position offset of the variable
	 * @param name variable name and dotted path, e.g. <code>$x.a</code>
	 */
	public VariableNode(int treeId, int position, String name) {
		super(treeId, position);
		this.ident = Collections.unmodifiableList(Arrays.asList(name.split("\\.")));
	}

	@Override
	public NodeType getType() {
		return NodeType.VARIABLE;
	}

	/**
	 * @return the variable name (with its <code>$</code>) followed by the field
	 *         names
	 */
	public List<String> getIdent() {
		return ident;
	}

	/**
	 * @return the variable name, <code>$</code> included
	 */
	public String getName() {
		return ident.get(0);
	}

	@Override
	public String toString() {
		return String.join(".", ident);
	}
}
