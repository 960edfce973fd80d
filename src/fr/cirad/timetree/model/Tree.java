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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import fr.cirad.timetree.newick.NewickException;
import fr.cirad.timetree.newick.NewickParser;
import fr.cirad.timetree.newick.NewickWriter;
import fr.cirad.timetree.newick.NexusTreeExtractor;

/**
 * A rooted phylogenetic time tree.
 *
 * A Tree either wraps a caller-built root as is, or is parsed from Newick text (possibly embedded in a Nexus file),
 * in which case node times, heights and the tree origin are computed right after parsing. Parsing either
 * succeeds entirely or throws: no partially built tree is ever exposed.
 *
 * A tree owns its root exclusively: a node can be the root of one tree only. Nodes of a parsed tree are sealed
 * (see {@link Node}), so only {@link #sort(boolean)} mutates such a tree; it must not run concurrently with any
 * other call on the same instance.
 *
 * @author sempere
 */
public class Tree implements TreeView {

	private final Node root;
	private final Double origin;

	/**
	 * Wraps an existing root node. No times or heights are computed and the origin is left undefined.
	 *
	 * @throws IllegalArgumentException if root is null, has a parent, or is already the root of another tree
	 */
	public Tree(Node root) {
		if (root == null)
			throw new IllegalArgumentException("Root node may not be null");
		if (!root.isRoot())
			throw new IllegalArgumentException("Node " + root + " has a parent and cannot be used as a tree root");
		root.claimAsRoot();
		this.root = root;
		this.origin = null;
	}

	/**
	 * Parses a Newick string. Leading and trailing whitespace is ignored.
	 *
	 * @throws NewickException if the string is not a valid Newick tree
	 */
	public Tree(String newick) throws NewickException {
		this(newick, new NewickParser());
	}

	public Tree(String newick, NewickParser parser) throws NewickException {
		this.root = parser.parse(newick.trim());
		root.claimAsRoot();
		this.origin = TimeCalculator.annotate(root);
	}

	/**
	 * Reads a tree from a Newick or Nexus source. If the first line is a #NEXUS header, the first "tree" statement
	 * provides the Newick string, otherwise the first line itself is the Newick string.
	 *
	 * @throws IOException if the source cannot be read
	 * @throws NewickException if no tree statement can be found, or if the tree cannot be parsed
	 */
	public Tree(Reader source) throws IOException, NewickException {
		this(source, new NewickParser());
	}

	public Tree(Reader source, NewickParser parser) throws IOException, NewickException {
		this(NexusTreeExtractor.extractNewick(source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source)), parser);
	}

	@Override
	public Node getRoot() {
		return root;
	}

	@Override
	public Double getOrigin() {
		return origin;
	}

	@Override
	public List<Node> getNodes() {
		return root.getClade();
	}

	@Override
	public List<Node> getLeaves() {
		return root.getLeaves();
	}

	/**
	 * Sorts the tree in place by increasing clade size.
	 */
	public Tree sort() {
		return sort(true);
	}

	/**
	 * Sorts the tree in place, ordering the children of every node by the size of their clades.
	 * Children with equal clade sizes keep their relative order. Only child order changes.
	 *
	 * @param increasing true to put smaller clades first, false to put larger clades first
	 * @return this tree
	 */
	public Tree sort(boolean increasing) {
		sortSubTree(root, increasing);
		return this;
	}

	/**
	 * Visits nodes in reverse preorder so that every clade size is known before its parent's children get sorted.
	 */
	private static void sortSubTree(Node subTreeRoot, boolean increasing) {
		List<Node> clade = subTreeRoot.getClade();
		Map<Node, Integer> cladeSizes = new IdentityHashMap<>(clade.size() * 2);
		Comparator<Node> bySize = Comparator.comparingInt(cladeSizes::get);
		if (!increasing)
			bySize = bySize.reversed();

		for (int i = clade.size() - 1; i >= 0; i--) {
			Node node = clade.get(i);
			int cladeSize = 1;
			for (Node child : node.getChildren())
				cladeSize += cladeSizes.get(child);
			cladeSizes.put(node, cladeSize);
			node.sortChildren(bySize);
		}
	}

	/**
	 * @return the Newick representation of this tree, terminated by a semicolon
	 */
	public String toNewick() {
		return toNewick(new NewickWriter());
	}

	public String toNewick(NewickWriter writer) {
		return writer.write(root, origin) + ";";
	}

	@Override
	public String toString() {
		return "Phylogenetic tree with " + getNodes().size() + " nodes (including " + getLeaves().size() + " leaves).";
	}
}
