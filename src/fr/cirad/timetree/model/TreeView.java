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
 * Read-only access to a tree, as needed by layout and rendering code.
 * Implementations recompute the node lists on each call.
 */
public interface TreeView {

	Node getRoot();

	/**
	 * @return every node of the tree in preorder (a node, then the nodes below each of its children in order)
	 */
	List<Node> getNodes();

	/**
	 * @return the leaves of the tree, left to right
	 */
	List<Node> getLeaves();

	/**
	 * @return the time depth above the root's first split, or null when unknown
	 */
	Double getOrigin();
}
