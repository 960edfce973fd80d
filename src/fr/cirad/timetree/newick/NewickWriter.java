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
package fr.cirad.timetree.newick;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

import fr.cirad.timetree.model.Node;

/**
 * Writes nodes back to Newick text. Branch lengths are derived from node heights, so the output reflects
 * the time-calibrated tree rather than the branch lengths found in the input.
 *
 * The written text has no terminating semicolon; {@link fr.cirad.timetree.model.Tree#toNewick()} adds it.
 * Instances are not thread-safe when a decimal format is used.
 */
public class NewickWriter {

	private final DecimalFormat decimalFormat;

	/**
	 * Writes branch lengths with the shortest representation that parses back to the same double.
	 */
	public NewickWriter() {
		this.decimalFormat = null;
	}

	/**
	 * @param branchLengthPattern DecimalFormat pattern for branch lengths, e.g. "##0.########"; null or empty for the default representation
	 */
	public NewickWriter(String branchLengthPattern) {
		if (branchLengthPattern == null || branchLengthPattern.isEmpty())
			this.decimalFormat = null;
		else {
			// force dot as decimal separator, whatever the JVM locale
			DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.US);
			symbols.setDecimalSeparator('.');
			this.decimalFormat = new DecimalFormat(branchLengthPattern, symbols);
			this.decimalFormat.setGroupingUsed(false);
		}
	}

	/**
	 * Renders the subtree below node.
	 *
	 * @param node the node to render
	 * @param origin tree origin, only used when node is a root: its branch length is then origin - height, or 0.0 if origin is null
	 * @throws IllegalStateException if node heights have not been computed
	 */
	public String write(Node node, Double origin) {
		StringBuilder sb = new StringBuilder();
		Deque<PendingNode> stack = new ArrayDeque<>();
		stack.push(new PendingNode(node));
		while (!stack.isEmpty()) {
			PendingNode pending = stack.peek();
			List<Node> children = pending.node.getChildren();
			if (pending.nextChild < children.size()) {
				sb.append(pending.nextChild == 0 ? "(" : ",");
				stack.push(new PendingNode(children.get(pending.nextChild++)));
				continue;
			}

			if (!children.isEmpty())
				sb.append(")");
			appendNodeSuffix(pending.node, origin, sb);
			stack.pop();
		}
		return sb.toString();
	}

	/**
	 * Appends what follows the subtree of node: label, annotations and branch length.
	 */
	private void appendNodeSuffix(Node node, Double origin, StringBuilder sb) {
		if (node.getLabel() != null)
			sb.append(quoteIfNeeded(node.getLabel()));

		if (!node.getAnnotations().isEmpty()) {
			List<String> pairs = new ArrayList<>(node.getAnnotations().size());
			for (Map.Entry<String, String> annotation : node.getAnnotations().entrySet())
				pairs.add(quoteIfNeeded(annotation.getKey()) + "=" + quoteValue(annotation.getValue()));
			sb.append("[&").append(StringUtils.join(pairs, ",")).append("]");
		}

		double branchLength;
		if (node.isRoot())
			branchLength = origin == null ? 0.0 : origin - checkHeight(node);
		else
			branchLength = checkHeight(node.getParent()) - checkHeight(node);
		sb.append(":").append(formatBranchLength(branchLength));
	}

	private static double checkHeight(Node node) {
		if (Double.isNaN(node.getHeight()))
			throw new IllegalStateException("Height of " + node + " has not been computed");
		return node.getHeight();
	}

	String formatBranchLength(double branchLength) {
		return decimalFormat == null ? Double.toString(branchLength) : decimalFormat.format(branchLength);
	}

	/**
	 * Quotes text which would not be read back as a single bare STRING token.
	 */
	static String quoteIfNeeded(String text) {
		if (NewickTokenizer.BARE_STRING.matcher(text).matches())
			return text;
		return quote(text, '\'', '"');
	}

	static String quoteValue(String text) {
		return quote(text, '"', '\'');
	}

	private static String quote(String text, char preferred, char fallback) {
		if (text.indexOf(preferred) == -1)
			return preferred + text + preferred;
		if (text.indexOf(fallback) == -1)
			return fallback + text + fallback;
		throw new IllegalArgumentException("Text contains both quote characters and cannot be written to Newick: " + text);
	}

	/**
	 * A node whose subtree is being written, with the index of the next child to write.
	 */
	private static class PendingNode {
		private final Node node;
		private int nextChild = 0;

		PendingNode(Node node) {
			this.node = node;
		}
	}
}
