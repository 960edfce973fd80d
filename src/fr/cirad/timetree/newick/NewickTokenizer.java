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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Newick text into tokens. At each position the rules below are tried in order and the first one
 * matching there wins. Whitespace matches no rule: callers must trim their input beforehand.
 * Quoted strings cannot contain their own quote character (no escaping).
 */
public final class NewickTokenizer {

	private static final class Rule {
		final TokenKind kind;
		final Pattern pattern;

		Rule(TokenKind kind, String regex) {
			this.kind = kind;
			this.pattern = Pattern.compile(regex);
		}
	}

	private static final Rule[] RULES = {
		new Rule(TokenKind.LPAREN, "\\("),
		new Rule(TokenKind.RPAREN, "\\)"),
		new Rule(TokenKind.COLON, ":"),
		new Rule(TokenKind.STRING, "\"[^\"]*\""),
		new Rule(TokenKind.STRING, "'[^']*'"),
		new Rule(TokenKind.STRING, "[a-zA-Z0-9_.-]+"),
		new Rule(TokenKind.OPENA, "\\[&"),
		new Rule(TokenKind.EQUALS, "="),
		new Rule(TokenKind.CLOSEA, "\\]"),
		new Rule(TokenKind.COMMA, ","),
		new Rule(TokenKind.SEMI, ";")
	};

	/** Characters allowed in an unquoted STRING token. */
	public static final Pattern BARE_STRING = Pattern.compile("[a-zA-Z0-9_.-]+");

	private NewickTokenizer() {
	}

	/**
	 * @return the tokens found in input, always terminated by an END token
	 * @throws NewickLexException at the first position where no rule matches
	 */
	public static List<Token> tokenize(String input) throws NewickLexException {
		List<Token> tokens = new ArrayList<>();
		int idx = 0;
		while (idx < input.length()) {
			Token token = null;
			for (Rule rule : RULES) {
				Matcher matcher = rule.pattern.matcher(input).region(idx, input.length());
				if (matcher.lookingAt()) {
					String text = matcher.group();
					token = new Token(rule.kind, rule.kind == TokenKind.STRING ? unquote(text) : null, idx);
					idx = matcher.end();
					break;
				}
			}
			if (token == null)
				throw new NewickLexException(input.charAt(idx), idx);
			tokens.add(token);
		}
		tokens.add(new Token(TokenKind.END, null, input.length()));
		return tokens;
	}

	private static String unquote(String text) {
		if (text.length() >= 2) {
			char first = text.charAt(0);
			if ((first == '"' || first == '\'') && text.charAt(text.length() - 1) == first)
				return text.substring(1, text.length() - 1);
		}
		return text;
	}
}
