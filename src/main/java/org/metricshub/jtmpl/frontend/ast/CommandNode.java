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
 * One stage of a pipeline: an operand list, the first operand being the
 * thing executed, the others its arguments.
 */
public final class CommandNode extends Node {

	private final List<Node> args = new ArrayList<Node>();

	public CommandNode(int treeId, int position) {
		super(treeId, position);
	}

	@Override
	public NodeType getType() {
		return NodeType.COMMAND;
	}

	/**
	 * @param arg operand to add
	 */
	public void append(Node arg) {
		args.add(arg);
	}

	public List<Node> getArgs() {
		return Collections.unmodifiableList(args);
	}

	@Override
	public List<Node> getChildren() {
		return getArgs();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < args.size(); i++) {
			if (i > 0) {
				sb.append(' ');
			}
			Node arg = args.get(i);
			if (arg.getType() == NodeType.PIPE) {
				sb.append('(').append(arg).append(')');
			} else {
				sb.append(arg);
			}
		}
		return sb.toString();
	}
}
