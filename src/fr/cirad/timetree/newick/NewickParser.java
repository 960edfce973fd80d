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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

import fr.cirad.timetree.model.Node;

/**
 * Descent parser building a node tree from Newick text.
 *
 * <pre>
 * tree        := node ';'
 * node        := subtree label annotations branchLength
 * subtree     := '(' node siblings ')' | empty
 * siblings    := ',' node siblings | empty
 * label       := STRING | empty
 * annotations := '[&amp;' pair pairs ']' | empty
 * pair        := STRING '=' STRING
 * pairs       := ',' pair pairs | empty
 * branchLength:= ':' STRING | empty      (empty means 1.0)
 * </pre>
 *
 * Subtree nesting is tracked on an explicit stack rather than the call stack, so nesting depth is only
 * bounded by memory. The first error aborts the parse. Nodes built so far are discarded with it.
 * Times and heights are not computed here, see {@link fr.cirad.timetree.model.TimeCalculator}.
 */
public class NewickParser {

	private static final Pattern DECIMAL_NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

	private final boolean rejectNegativeBranchLengths;

	public NewickParser() {
		this(false);
	}

	/**
	 * @param rejectNegativeBranchLengths whether a negative branch length is a parse error (it is accepted by default)
	 */
	public NewickParser(boolean rejectNegativeBranchLengths) {
		this.rejectNegativeBranchLengths = rejectNegativeBranchLengths;
	}

	/**
	 * Parses a complete Newick statement, terminating semicolon included.
	 *
	 * @param newick trimmed Newick text
	 * @return the root of the parsed tree
	 * @throws NewickLexException if the text contains a character that cannot start any token
	 * @throws NewickParseException if the tokens do not form a tree
	 */
	public Node parse(String newick) throws NewickException {
		ParseContext ctx = new ParseContext(NewickTokenizer.tokenize(newick));
		Node root = new Node();
		Deque<Node> openSubTrees = new ArrayDeque<>();
		Node node = root;
		while (true) {
			// subtree: every '(' opens the subtree of the current node and starts its first child
			while (ctx.acceptToken(TokenKind.LPAREN, false)) {
				openSubTrees.push(node);
				node = newChild(node);
			}
			ruleNodeSuffix(node, ctx);

			// siblings: ',' starts the next child, ')' completes the enclosing node
			while (!openSubTrees.isEmpty() && !ctx.acceptToken(TokenKind.COMMA, false)) {
				ctx.acceptToken(TokenKind.RPAREN, true);
				node = openSubTrees.pop();
				ruleNodeSuffix(node, ctx);
			}
			if (openSubTrees.isEmpty())
				break;
			node = newChild(openSubTrees.peek());
		}
		ctx.acceptToken(TokenKind.SEMI, true);
		ctx.acceptToken(TokenKind.END, true);
		return root;
	}

	private static Node newChild(Node parent) {
		Node child = new Node();
		parent.addChild(child);
		return child;
	}

	private void ruleNodeSuffix(Node node, ParseContext ctx) throws NewickParseException {
		ruleL(node, ctx);
		ruleA(node, ctx);
		ruleB(node, ctx);
	}

	private void ruleL(Node node, ParseContext ctx) throws NewickParseException {
		if (ctx.acceptToken(TokenKind.STRING, false))
			node.setLabel(ctx.getLastValue());
	}

	private void ruleA(Node node, ParseContext ctx) throws NewickParseException {
		if (ctx.acceptToken(TokenKind.OPENA, false)) {
			ruleC(node, ctx);
			while (ctx.acceptToken(TokenKind.COMMA, false))
				ruleC(node, ctx);
			ctx.acceptToken(TokenKind.CLOSEA, true);
		}
	}

	private void ruleC(Node node, ParseContext ctx) throws NewickParseException {
		ctx.acceptToken(TokenKind.STRING, true);
		String key = ctx.getLastValue();
		ctx.acceptToken(TokenKind.EQUALS, true);
		ctx.acceptToken(TokenKind.STRING, true);
		node.putAnnotation(key, ctx.getLastValue());
	}

	private void ruleB(Node node, ParseContext ctx) throws NewickParseException {
		if (!ctx.acceptToken(TokenKind.COLON, false)) {
			node.setBranchLength(Node.DEFAULT_BRANCH_LENGTH);
			return;
		}

		ctx.acceptToken(TokenKind.STRING, true);
		String value = ctx.getLastValue();
		double branchLength;
		try {
			if (!DECIMAL_NUMBER.matcher(value).matches())
				throw new NumberFormatException("For input string: \"" + value + "\"");
			branchLength = Double.parseDouble(value);
		}
		catch (NumberFormatException nfe) {
			throw new NewickParseException("Invalid branch length", ctx.getLastToken(), ctx.getLastIndex(), nfe);
		}
		if (Double.isInfinite(branchLength))
			throw new NewickParseException("Branch length out of range", ctx.getLastToken(), ctx.getLastIndex());
		if (rejectNegativeBranchLengths && branchLength < 0)
			throw new NewickParseException("Negative branch length", ctx.getLastToken(), ctx.getLastIndex());
		node.setBranchLength(branchLength);
	}

	/**
	 * Cursor over the token list.
	 */
	private static class ParseContext {
		private final List<Token> tokens;
		private int idx = 0;

		ParseContext(List<Token> tokens) {
			this.tokens = tokens;
		}

		/**
		 * Consumes the next token if it is of the given kind.
		 *
		 * @param mandatory whether a token of another kind is an error
		 * @return true if the token was consumed
		 * @throws NewickParseException if mandatory and the next token is of another kind
		 */
		boolean acceptToken(TokenKind kind, boolean mandatory) throws NewickParseException {
			Token next = tokens.get(idx);
			if (next.getKind() == kind) {
				if (kind != TokenKind.END)
					idx++;
				return true;
			}
			if (mandatory)
				throw new NewickParseException("Expected " + kind + " but found unexpected token", next, idx);
			return false;
		}

		Token getLastToken() {
			return tokens.get(idx - 1);
		}

		int getLastIndex() {
			return idx - 1;
		}

		String getLastValue() {
			return getLastToken().getValue();
		}
	}
}
