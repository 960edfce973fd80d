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

/**
 * One lexical token: its kind, its value (only STRING tokens carry one, without surrounding quotes)
 * and the character offset where it starts in the tokenized text.
 */
public class Token {

	private final TokenKind kind;
	private final String value;
	private final int offset;

	public Token(TokenKind kind, String value, int offset) {
		this.kind = kind;
		this.value = value;
		this.offset = offset;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public int getOffset() {
		return offset;
	}

	@Override
	public String toString() {
		return value == null ? kind.name() : kind + "(" + value + ")";
	}
}
