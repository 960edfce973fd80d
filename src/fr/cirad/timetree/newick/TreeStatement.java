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
 * The Newick string found in a tree source, with the line it was read from.
 */
public class TreeStatement {

	private final String newick;
	private final int lineNumber;
	private final boolean nexus;

	public TreeStatement(String newick, int lineNumber, boolean nexus) {
		this.newick = newick;
		this.lineNumber = lineNumber;
		this.nexus = nexus;
	}

	/**
	 * @return the trimmed Newick string
	 */
	public String getNewick() {
		return newick;
	}

	/**
	 * @return the 1-based line number of the statement in its source
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return true if the source was a Nexus file
	 */
	public boolean isNexus() {
		return nexus;
	}
}
