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
 * Thrown when a mandatory token is missing, or when a token cannot be interpreted (e.g. a non-numeric branch length).
 */
public class NewickParseException extends NewickException {

	private static final long serialVersionUID = 1L;

	private final TokenKind tokenKind;
	private final String tokenValue;
	private final int tokenIndex;

	public NewickParseException(String message, Token token, int tokenIndex) {
		this(message, token, tokenIndex, null);
	}

	public NewickParseException(String message, Token token, int tokenIndex, Throwable cause) {
		super(message + " at token " + tokenIndex + ": " + token.getKind() + (token.getValue() == null ? "" : " (" + token.getValue() + ")"), cause);
		this.tokenKind = token.getKind();
		this.tokenValue = token.getValue();
		this.tokenIndex = tokenIndex;
	}

	public TokenKind getTokenKind() {
		return tokenKind;
	}

	/**
	 * @return the value of the offending token, null if it is not a STRING token
	 */
	public String getTokenValue() {
		return tokenValue;
	}

	/**
	 * @return the position of the offending token in the token stream
	 */
	public int getTokenIndex() {
		return tokenIndex;
	}
}
