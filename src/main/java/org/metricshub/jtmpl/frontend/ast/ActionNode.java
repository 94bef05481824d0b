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

import java.util.Collections;
import java.util.List;

/**
 * A non-control action such as a field evaluation, whose result is printed.
 */
public final class ActionNode extends Node {

	private final PipeNode pipe;

	public ActionNode(int treeId, int position, PipeNode pipe) {
		super(treeId, position);
		this.pipe = pipe;
	}

	@Override
	public NodeType getType() {
		return NodeType.ACTION;
	}

	public PipeNode getPipe() {
		return pipe;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.<Node>singletonList(pipe);
	}

	@Override
	public String toString() {
		return "{{" + pipe + "}}";
	}
}
