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
import java.util.List;

/**
 * Common shape of <code>if</code>, <code>range</code> and <code>with</code>:
 * a pipeline, a body, and an optional <code>else</code> body.
 */
public abstract class BranchNode extends Node {

	private final PipeNode pipe;
	private final ListNode list;
	private final ListNode elseList;

	BranchNode(int treeId, int position, PipeNode pipe, ListNode list, ListNode elseList) {
		super(treeId, position);
		this.pipe = pipe;
		this.list = list;
		this.elseList = elseList;
	}

	/**
	 * @return the keyword opening this construct
	 */
	protected abstract String keyword();

	public PipeNode getPipe() {
		return pipe;
	}

	public ListNode getList() {
		return list;
	}

	/**
	 * @return the <code>else</code> body, or {@code null} when there is none
	 */
	public ListNode getElseList() {
		return elseList;
	}

	@Override
	public List<Node> getChildren() {
		List<Node> children = new ArrayList<Node>(3);
		children.add(pipe);
		children.add(list);
		if (elseList != null) {
			children.add(elseList);
		}
		return children;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("{{").append(keyword()).append(' ').append(pipe).append("}}");
		sb.append(list);
		if (elseList != null) {
			sb.append("{{else}}").append(elseList);
		}
		sb.append("{{end}}");
		return sb.toString();
	}
}
