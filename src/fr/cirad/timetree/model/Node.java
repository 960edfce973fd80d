/*******************************************************************************
 * TimeTree - rooted phylogenetic time trees
 * Copyright (C) 2016 - 2025, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.timetree.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node in a rooted phylogenetic time tree: either a sampled taxon (leaf) or a divergence point.
 *
 * Time and height are derived values, set by {@link TimeCalculator} once the whole tree is built.
 * They are NaN until then. From that point on the node is sealed: its label, branch length, annotations and
 * children can no longer be changed, only the order of its children (see {@link Tree#sort(boolean)}).
 *
 * @author sempere
 */
public class Node {

	public static final double DEFAULT_BRANCH_LENGTH = 1.0;

	private String label = null;
	private double branchLength = DEFAULT_BRANCH_LENGTH;
	private double time = Double.NaN;
	private double height = Double.NaN;
	private final Map<String, String> annotations = new LinkedHashMap<>();
	private final List<Node> children = new ArrayList<>();
	private Node parent = null;
	private boolean sealed = false;
	private boolean ownedByTree = false;

	public Node() {
	}

	public Node(String label) {
		this.label = label;
	}

	public Node(String label, double branchLength) {
		this.label = label;
		this.branchLength = branchLength;
	}

	/**
	 * @return true if this node is the root of a tree
	 */
	public boolean isRoot() {
		return parent == null;
	}

	/**
	 * @return true if this node is a leaf of a tree
	 */
	public boolean isLeaf() {
		return children.isEmpty();
	}

	/**
	 * Appends a child to this node and sets its parent back-reference.
	 *
	 * @param child a parentless node which must not be an ancestor of this node
	 * @throws IllegalArgumentException if child already has a parent, or if attaching it would create a cycle
	 * @throws IllegalStateException if this node or child is sealed
	 */
	public void addChild(Node child) {
		if (child == null)
			throw new IllegalArgumentException("Child node may not be null");
		checkNotSealed();
		child.checkNotSealed();
		if (child.ownedByTree)
			throw new IllegalArgumentException("Node " + child.describe() + " is the root of a tree");
		if (child.parent != null)
			throw new IllegalArgumentException("Node " + child.describe() + " is already attached to a parent");
		// a childless node can only be its own ancestor
		if (child == this || !child.isLeaf())
			for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent)
				if (ancestor == child)
					throw new IllegalArgumentException("Attaching node " + child.describe() + " below " + describe() + " would create a cycle");

		children.add(child);
		child.parent = this;
	}

	/**
	 * Retrieves a list including this node and all of its descendants, in preorder.
	 */
	public List<Node> getClade() {
		List<Node> clade = new ArrayList<>();
		Deque<Node> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty()) {
			Node node = pending.pop();
			clade.add(node);
			for (int i = node.children.size() - 1; i >= 0; i--)
				pending.push(node.children.get(i));
		}
		return clade;
	}

	/**
	 * Retrieves the leaves descending from this node (the node itself if it is a leaf), left to right.
	 */
	public List<Node> getLeaves() {
		List<Node> leaves = new ArrayList<>();
		for (Node node : getClade())
			if (node.isLeaf())
				leaves.add(node);
		return leaves;
	}

	/**
	 * Sets up the time of this node and of each node below it.
	 *
	 * @param offset the time of this node's parent (0 for the root)
	 */
	public void computeTimes(double offset) {
		time = offset + branchLength;
		for (Node node : getClade())
			if (node != this)
				node.time = node.parent.time + node.branchLength;
	}

	/**
	 * Reorders the immediate children of this node. List.sort is stable, so equal children keep their order.
	 */
	void sortChildren(Comparator<Node> comparator) {
		children.sort(comparator);
	}

	void setHeight(double height) {
		this.height = height;
	}

	void seal() {
		sealed = true;
	}

	public boolean isSealed() {
		return sealed;
	}

	/**
	 * Marks this root as owned by a tree.
	 *
	 * @throws IllegalArgumentException if another tree already owns it
	 */
	void claimAsRoot() {
		if (ownedByTree)
			throw new IllegalArgumentException("Node " + describe() + " is already the root of another tree");
		ownedByTree = true;
	}

	private void checkNotSealed() {
		if (sealed)
			throw new IllegalStateException("Node " + describe() + " belongs to a time-calibrated tree and cannot be modified");
	}

	private String describe() {
		return label == null ? "<unlabelled>" : "'" + label + "'";
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		checkNotSealed();
		this.label = label;
	}

	public double getBranchLength() {
		return branchLength;
	}

	public void setBranchLength(double branchLength) {
		checkNotSealed();
		this.branchLength = branchLength;
	}

	public double getTime() {
		return time;
	}

	public double getHeight() {
		return height;
	}

	/**
	 * @return a read-only view of the annotations, in insertion order
	 */
	public Map<String, String> getAnnotations() {
		return Collections.unmodifiableMap(annotations);
	}

	public void putAnnotation(String key, String value) {
		checkNotSealed();
		annotations.put(key, value);
	}

	/**
	 * @return a read-only view of the children, in display order
	 */
	public List<Node> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public Node getParent() {
		return parent;
	}

	@Override
	public String toString() {
		return "Node " + describe() + " [branchLength=" + branchLength + ", height=" + height + ", children=" + children.size() + "]";
	}
}
