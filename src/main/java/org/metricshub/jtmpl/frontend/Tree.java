package org.metricshub.jtmpl.frontend;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jtmpl.frontend.ast.ListNode;
import org.metricshub.jtmpl.frontend.ast.Node;
import org.metricshub.jtmpl.frontend.ast.TextNode;

/**
 * A named template: the unit produced by a parse for the top-level text and
 * for each <code>define</code> and <code>block</code>.
 * <p>
 * While the tree is being parsed it also holds the variables in scope. Once
 * parsing is done, only its name, id, root list and the set of referenced
 * field paths are of interest.
 */
public final class Tree {

	private final String name;
	private final int id;
	private ListNode root;
	private final List<String> variables = new ArrayList<String>();
	private final Set<String> fields = new LinkedHashSet<String>();

	Tree(String name, int id) {
		this.name = name;
		this.id = id;
	}

	public String getName() {
		return name;
	}

	public int getId() {
		return id;
	}

	/**
	 * @return the top-level list of the template, {@code null} while the
	 *         template is not parsed
	 */
	public ListNode getRoot() {
		return root;
	}

	/**
	 * @return the field paths (like <code>.a.b</code>) referenced in this
	 *         template, in order of first appearance
	 */
	public Set<String> getFields() {
		return Collections.unmodifiableSet(fields);
	}

	/**
	 * @return the variables currently in scope, innermost last
	 */
	public List<String> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	void setRoot(ListNode root) {
		assert this.root == null : "root of " + name + " already set";
		this.root = root;
	}

	void pushVariable(String variable) {
		variables.add(variable);
	}

	int variableCount() {
		return variables.size();
	}

	/**
	 * Drops the variables declared after the scope depth {@code count} was
	 * recorded.
	 */
	void popVariables(int count) {
		if (count < variables.size()) {
			variables.subList(count, variables.size()).clear();
		}
	}

	boolean hasVariable(String variable) {
		return variables.contains(variable);
	}

	void addField(String field) {
		fields.add(field);
	}

	/**
	 * A tree is empty when it holds nothing but white space text. Empty
	 * templates may be redefined.
	 *
	 * @param node root of the tree to check, may be {@code null}
	 * @return whether {@code node} is empty
	 */
	public static boolean isEmptyTree(Node node) {
		if (node == null) {
			return true;
		}
		switch (node.getType()) {
		case LIST:
			for (Node child : ((ListNode) node).getNodes()) {
				if (!isEmptyTree(child)) {
					return false;
				}
			}
			return true;
		case TEXT:
			return ((TextNode) node).getText().trim().isEmpty();
		default:
			return false;
		}
	}

	@Override
	public String toString() {
		return name + " (id " + id + ")";
	}
}
