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
 * Ordered sequence of nodes, the body of a template or of a control
 * structure.
 */
public final class ListNode extends Node {

	private final List<Node> nodes = new ArrayList<Node>();

	public ListNode(int treeId, int position) {
		super(treeId, position);
	}

	@Override
	public NodeType getType() {
		return NodeType.LIST;
	}

	/**
	 * @param node node to add at the end of the list
	 */
	public void append(Node node) {
		nodes.add(node);
	}

	public List<Node> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	@Override
	public List<Node> getChildren() {
		return getNodes();
	}

	@Override
	protected String describe() {
		return "(empty)";
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Node node : nodes) {
			sb.append(node);
		}
		return sb.toString();
	}
}
