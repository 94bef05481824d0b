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
 * A field path such as <code>.Name</code> or <code>.Address.City</code>,
 * stored without the leading dot.
 */
public final class FieldNode extends Node {

	private final List<String> ident;

	/**
	 * @param treeId owning tree
	 * @param position offset of the field
	 * @param field field path with its leading dot, e.g. <code>.a.b</code>
	 */
	public FieldNode(int treeId, int position, String field) {
		super(treeId, position);
		this.ident = Collections.unmodifiableList(Arrays.asList(field.substring(1).split("\\.")));
	}

	@Override
	public NodeType getType() {
		return NodeType.FIELD;
	}

	public List<String> getIdent() {
		return ident;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (String id : ident) {
			sb.append('.').append(id);
		}
		return sb.toString();
	}
}
