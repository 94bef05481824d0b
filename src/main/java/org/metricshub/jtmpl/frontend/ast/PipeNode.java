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
 * A pipeline: optional variable declarations followed by commands separated
 * by <code>|</code>.
 */
public final class PipeNode extends Node {

	private final List<VariableNode> declarations;
	private final List<CommandNode> commands = new ArrayList<CommandNode>();

	public PipeNode(int treeId, int position, List<VariableNode> declarations) {
		super(treeId, position);
		this.declarations = new ArrayList<VariableNode>(declarations);
	}

	@Override
	public NodeType getType() {
		return NodeType.PIPE;
	}

	/**
	 * @param command command to add as the last stage of the pipeline
	 */
	public void append(CommandNode command) {
		commands.add(command);
	}

	/**
	 * @return the variables declared by this pipeline, in declaration order
	 */
	public List<VariableNode> getDeclarations() {
		return Collections.unmodifiableList(declarations);
	}

	public List<CommandNode> getCommands() {
		return Collections.unmodifiableList(commands);
	}

	@Override
	public List<Node> getChildren() {
		List<Node> children = new ArrayList<Node>(declarations.size() + commands.size());
		children.addAll(declarations);
		children.addAll(commands);
		return children;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (!declarations.isEmpty()) {
			for (int i = 0; i < declarations.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(declarations.get(i));
			}
			sb.append(" := ");
		}
		for (int i = 0; i < commands.size(); i++) {
			if (i > 0) {
				sb.append(" | ");
			}
			sb.append(commands.get(i));
		}
		return sb.toString();
	}
}
