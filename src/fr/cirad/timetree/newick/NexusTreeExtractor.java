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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Locale;

/**
 * Locates the Newick string in a tree source which is either a plain Newick file (tree on the first line)
 * or a Nexus file. Only the first "tree" statement of a Nexus file is considered; other blocks are skipped.
 */
public class NexusTreeExtractor {

	public static final String NEXUS_HEADER = "#NEXUS";

	private static final String TREE_STATEMENT_PREFIX = "tree ";

	private static final String BYTE_ORDER_MARK = "\uFEFF";

	private NexusTreeExtractor() {
	}

	public static boolean isNexusHeader(String line) {
		return line != null && line.trim().equalsIgnoreCase(NEXUS_HEADER);
	}

	/**
	 * @return the trimmed Newick string held by the source
	 * @throws IOException if the source cannot be read
	 * @throws TreeSourceFormatException if the source is empty, or is a Nexus file without a tree statement
	 */
	public static String extractNewick(BufferedReader reader) throws IOException, TreeSourceFormatException {
		return extractTreeStatement(reader).getNewick();
	}

	/**
	 * Same as {@link #extractNewick(BufferedReader)}, also telling which line provided the tree.
	 * A leading byte order mark is ignored.
	 */
	public static TreeStatement extractTreeStatement(BufferedReader reader) throws IOException, TreeSourceFormatException {
		String firstLine = reader.readLine();
		if (firstLine == null)
			throw new TreeSourceFormatException("Tree source is empty");
		if (firstLine.startsWith(BYTE_ORDER_MARK))
			firstLine = firstLine.substring(BYTE_ORDER_MARK.length());

		if (!isNexusHeader(firstLine))
			return new TreeStatement(firstLine.trim(), 1, false);

		String line;
		int lineNumber = 1;
		while ((line = reader.readLine()) != null) {
			lineNumber++;
			if (!line.trim().toLowerCase(Locale.ROOT).startsWith(TREE_STATEMENT_PREFIX))
				continue;

			int equalsPos = line.indexOf('=');
			if (equalsPos == -1)
				throw new TreeSourceFormatException("Tree statement at line " + lineNumber + " has no '=' sign");
			return new TreeStatement(line.substring(equalsPos + 1).trim(), lineNumber, true);
		}
		throw new TreeSourceFormatException("No tree statement found in Nexus source");
	}
}
