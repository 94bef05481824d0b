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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field accesses applied to a term that is neither a field nor a variable,
 * e.g. <code>(pipeline).Field1.Field2</code>.
 */
public final class ChainNode extends Node {

	private final Node node;
	private final List<String> fields = new ArrayList<String>();

	public ChainNode(int treeId, int position, Node node) {
		super(treeId, position);
		this.node = node;
	}

	@Override
	public NodeType getType() {
		return NodeType.CHAIN;
	}

	/**
	 * Adds a field access to the chain.
	 *
	 * @param field field with its leading dot, e.g. <code>.Name</code>
	 */
	public void add(String field) {
		if (field.length() < 2 || field.charAt(0) != '.') {
			throw new IllegalArgumentException("not a field: " + field);
		}
		fields.add(field.substring(1));
	}

	public Node getNode() {
		return node;
	}

	/**
	 * @return field names, without their dots
	 */
	public List<String> getFields() {
		return Collections.unmodifiableList(fields);
	}

	@Override
	public List<Node> getChildren() {
		return Collections.singletonList(node);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (node.getType() == NodeType.PIPE) {
			sb.append('(').append(node).append(')');
		} else {
			sb.append(node);
		}
		for (String field : fields) {
			sb.append('.').append(field);
		}
		return sb.toString();
	}
}
