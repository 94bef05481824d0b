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
import org.metricshub.jtmpl.util.Literals;

/**
 * Invocation of a named template: <code>{{template "name" pipeline}}</code>.
 * <p>
 * The name is either a literal, or, with dynamic template names enabled, a
 * pipeline evaluated at execution time:
 * <code>{{template (pipeline) pipeline}}</code>.
 */
public final class TemplateNode extends Node {

	private final String name;
	private final PipeNode namePipe;
	private final PipeNode pipe;

	/**
	 * Invocation of a template known by name.
	 *
	 * @param treeId owning tree
	 * @param position offset of the name
	 * @param name template name
	 * @param pipe argument pipeline, or {@code null}
	 */
	public TemplateNode(int treeId, int position, String name, PipeNode pipe) {
		super(treeId, position);
		this.name = name;
		this.namePipe = null;
		this.pipe = pipe;
	}

	/**
	 * Invocation of a template whose name is computed.
	 *
	 * @param treeId owning tree
	 * @param position offset of the name pipeline
	 * @param namePipe pipeline producing the template name
	 * @param pipe argument pipeline, or {@code null}
	 */
	public TemplateNode(int treeId, int position, PipeNode namePipe, PipeNode pipe) {
		super(treeId, position);
		this.name = null;
		this.namePipe = namePipe;
		this.pipe = pipe;
	}

	@Override
	public NodeType getType() {
		return NodeType.TEMPLATE;
	}

	/**
	 * @return the literal template name, or {@code null} if it is computed
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the pipeline computing the template name, or {@code null}
	 */
	public PipeNode getNamePipe() {
		return namePipe;
	}

	public boolean isDynamic() {
		return namePipe != null;
	}

	/**
	 * @return the argument pipeline, or {@code null}
	 */
	public PipeNode getPipe() {
		return pipe;
	}

	@Override
	public List<Node> getChildren() {
		List<Node> children = new ArrayList<Node>(2);
		if (namePipe != null) {
			children.add(namePipe);
		}
		if (pipe != null) {
			children.add(pipe);
		}
		return children;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{{template ");
		if (namePipe != null) {
			sb.append('(').append(namePipe).append(')');
		} else {
			sb.append(Literals.quote(name));
		}
		if (pipe != null) {
			sb.append(' ').append(pipe);
		}
		return sb.append("}}").toString();
	}
}
