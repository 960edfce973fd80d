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
package fr.cirad.timetree.rendering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

import fr.cirad.timetree.model.Node;
import fr.cirad.timetree.model.TreeView;

/**
 * Crude text rendering of a time tree, one row per leaf, present time on the right.
 * Leaves are drawn as '*', internal nodes as '+'.
 *
 * @author sempere
 */
public class AsciiTreeRenderer {

	public static final int DEFAULT_WIDTH = 70;

	private final int width;
	private final boolean labelLeaves;

	public AsciiTreeRenderer() {
		this(DEFAULT_WIDTH, true);
	}

	public AsciiTreeRenderer(int width, boolean labelLeaves) {
		if (width < 2)
			throw new IllegalArgumentException("Rendering width must be at least 2, got " + width);
		this.width = width;
		this.labelLeaves = labelLeaves;
	}

	/**
	 * @return the rendered rows, top to bottom, without line terminators
	 * @throws IllegalStateException if node heights have not been computed
	 */
	public List<String> render(TreeView tree) {
		List<Node> leaves = tree.getLeaves();
		List<Node> nodes = tree.getNodes();
		Node root = tree.getRoot();
		if (Double.isNaN(root.getHeight()))
			throw new IllegalStateException("Tree heights have not been computed");

		double scale = tree.getOrigin() != null ? tree.getOrigin() : root.getHeight() + root.getBranchLength();
		if (scale <= 0)
			scale = 1;

		Map<Node, Double> pos = new IdentityHashMap<>();
		computePos(nodes, leaves, pos);

		char[][] grid = new char[leaves.size()][width];
		for (char[] row : grid)
			Arrays.fill(row, ' ');

		// edges
		for (Node node : nodes) {
			if (node.isRoot()) {
				int x1 = column(node.getHeight(), scale, width - 1);
				fill(grid[pos.get(node).intValue()], x1, width - 1, '-');
			}
			else {
				int x1 = column(node.getHeight(), scale, width);
				int x2 = column(node.getParent().getHeight(), scale, width - 1);
				int y1 = pos.get(node).intValue();
				int y2 = pos.get(node.getParent()).intValue();
				fill(grid[y1], x1, x2, '-');
				for (int y = Math.min(y1, y2) + 1; y < Math.max(y1, y2); y++)
					grid[y][x2] = '|';
			}
		}

		// corners
		for (Node node : nodes) {
			if (node.isRoot())
				continue;
			int x1 = column(node.getHeight(), scale, width - 1);
			int x2 = column(node.getParent().getHeight(), scale, width - 1);
			int y1 = pos.get(node).intValue();
			int y2 = pos.get(node.getParent()).intValue();
			fill(grid[y1], x1, x2, '-');
			grid[Math.min(y1, y2)][x2] = '\\';
			grid[Math.max(y1, y2)][x2] = '/';
		}

		for (Node node : nodes)
			grid[pos.get(node).intValue()][column(node.getHeight(), scale, width - 1)] = node.isLeaf() ? '*' : '+';

		List<String> rows = new ArrayList<>(grid.length);
		List<Node> reversedLeaves = new ArrayList<>(leaves);
		Collections.reverse(reversedLeaves);
		for (int i = 0; i < grid.length; i++) {
			String row = StringUtils.stripEnd(StringUtils.reverse(new String(grid[grid.length - 1 - i])), null);
			Node leaf = reversedLeaves.get(i);
			if (labelLeaves && leaf.getLabel() != null)
				row += " " + leaf.getLabel();
			rows.add(row);
		}
		return rows;
	}

	/**
	 * Leaves sit on their own row, internal nodes halfway between their children.
	 * Nodes are visited in reverse preorder so that children are placed before their parent.
	 */
	private static void computePos(List<Node> nodes, List<Node> leaves, Map<Node, Double> pos) {
		for (int i = 0; i < leaves.size(); i++)
			pos.put(leaves.get(i), (double) i);

		for (int i = nodes.size() - 1; i >= 0; i--) {
			Node node = nodes.get(i);
			if (node.isLeaf())
				continue;
			double p = 0;
			for (Node child : node.getChildren())
				p += pos.get(child);
			pos.put(node, p / node.getChildren().size());
		}
	}

	private static int column(double height, double scale, int span) {
		return Math.max(0, Math.min(span, (int) (height / scale * span)));
	}

	private static void fill(char[] row, int from, int to, char c) {
		for (int x = from; x < Math.min(to, row.length); x++)
			row[x] = c;
	}
}
