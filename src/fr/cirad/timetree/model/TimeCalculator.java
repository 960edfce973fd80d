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

import java.util.List;

/**
 * Computes node times and heights over a fully built tree.
 *
 * Times increase from the root (whose time is its own branch length) towards the leaves.
 * Heights are measured backwards from the most recent node, which therefore has height 0.
 */
public class TimeCalculator {

	private TimeCalculator() {
	}

	/**
	 * Sets time and height on every node below (and including) root, then seals those nodes.
	 *
	 * @param root the root of the tree
	 * @return the tree origin, i.e. root height + root branch length
	 */
	public static double annotate(Node root) {
		root.computeTimes(0.0);

		List<Node> nodes = root.getClade();
		double maxTime = Double.NEGATIVE_INFINITY;
		for (Node node : nodes)
			maxTime = Math.max(maxTime, node.getTime());

		for (Node node : nodes) {
			node.setHeight(maxTime - node.getTime());
			node.seal();
		}

		return root.getHeight() + root.getBranchLength();
	}
}
