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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the template syntax tree.
 * <p>
 * The set of node classes is closed: there is exactly one final class per
 * {@link NodeType}, all in this package. Consumers are expected to switch on
 * {@link #getType()}.
 * <p>
 * {@link #toString()} renders the node back to template source.
 */
public abstract class Node {

	private final int treeId;
	private final int position;

	Node(int treeId, int position) {
		this.treeId = treeId;
		this.position = position;
	}

	/**
	 * @return the kind of this node
	 */
	public abstract NodeType getType();

	/**
	 * @return id of the tree this node belongs to
	 */
	public final int getTreeId() {
		return treeId;
	}

	/**
	 * @return offset in the template text of the token this node was built from
	 */
	public final int getPosition() {
		return position;
	}

	/**
	 * @return the direct sub-nodes, in source order
	 */
	public List<Node> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * Short form of the node used in {@link #dump(PrintStream)}.
	 *
	 * @return a one-line description
	 */
	protected String describe() {
		return toString();
	}

	/**
	 * Dump a meaningful text representation of this syntax tree node, and of
	 * all of its children, to the print stream.
	 *
	 * @param ps The print stream to dump the text representation to
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			line.append("  ");
		}
		line.append(getType());
		List<Node> children = getChildren();
		if (children.isEmpty()) {
			line.append(' ').append(describe());
		}
		ps.println(line);
		for (Node child : children) {
			child.dump(ps, lvl + 1);
		}
	}
}
