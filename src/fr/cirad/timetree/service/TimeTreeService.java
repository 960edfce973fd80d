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
package fr.cirad.timetree.service;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import fr.cirad.timetree.model.Tree;
import fr.cirad.timetree.newick.NewickException;
import fr.cirad.timetree.newick.NewickParser;
import fr.cirad.timetree.newick.NewickWriter;
import fr.cirad.timetree.newick.NexusTreeExtractor;
import fr.cirad.timetree.newick.TreeStatement;
import fr.cirad.timetree.rendering.AsciiTreeRenderer;
import fr.cirad.timetree.tools.AppConfig;

/**
 * Reads, writes and renders time trees according to application settings.
 *
 * @author sempere
 */
@Component
public class TimeTreeService {

	private static final Logger LOG = Logger.getLogger(TimeTreeService.class);

	public static final String PROP_BRANCH_LENGTH_FORMAT = "newick.branchLengthFormat";
	public static final String PROP_REJECT_NEGATIVE_BRANCH_LENGTHS = "newick.rejectNegativeBranchLengths";
	public static final String PROP_SORT_ON_LOAD = "tree.sortOnLoad";
	public static final String PROP_ASCII_WIDTH = "ascii.width";
	public static final String PROP_ASCII_LABEL_LEAVES = "ascii.labelLeaves";

	@Autowired private AppConfig appConfig;

	/**
	 * Parses a Newick string, then applies the configured sort if any.
	 */
	public Tree parseTree(String newick) throws NewickException {
		long before = System.currentTimeMillis();
		Tree tree = new Tree(newick, createParser());
		LOG.debug(tree + " parsed in " + (System.currentTimeMillis() - before) / 1000d + "s");
		return sortIfConfigured(tree);
	}

	/**
	 * Reads a Newick or Nexus tree source, then applies the configured sort if any.
	 */
	public Tree readTree(Reader source) throws IOException, NewickException {
		long before = System.currentTimeMillis();
		TreeStatement statement = NexusTreeExtractor.extractTreeStatement(source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source));
		if (statement.isNexus())
			LOG.debug("Using tree statement found at line " + statement.getLineNumber() + " of Nexus source");
		Tree tree = new Tree(statement.getNewick(), createParser());
		LOG.debug(tree + " read in " + (System.currentTimeMillis() - before) / 1000d + "s");
		return sortIfConfigured(tree);
	}

	public Tree readTree(File file) throws IOException, NewickException {
		LOG.debug("Reading tree from " + file.getPath());
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return readTree(reader);
		}
	}

	/**
	 * @return the Newick statement for tree, semicolon included, using the configured branch length format
	 */
	public String toNewick(Tree tree) {
		return tree.toNewick(new NewickWriter(appConfig.get(PROP_BRANCH_LENGTH_FORMAT)));
	}

	public void writeTree(Tree tree, File file) throws IOException {
		try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
			writer.write(toNewick(tree));
			writer.newLine();
		}
		LOG.debug(tree + " written to " + file.getPath());
	}

	public String renderAscii(Tree tree) {
		AsciiTreeRenderer renderer = new AsciiTreeRenderer(appConfig.getInt(PROP_ASCII_WIDTH, AsciiTreeRenderer.DEFAULT_WIDTH), appConfig.getBoolean(PROP_ASCII_LABEL_LEAVES, true));
		return StringUtils.join(renderer.render(tree), "\n");
	}

	private NewickParser createParser() {
		return new NewickParser(appConfig.getBoolean(PROP_REJECT_NEGATIVE_BRANCH_LENGTHS, false));
	}

	private Tree sortIfConfigured(Tree tree) {
		String sortOrder = appConfig.get(PROP_SORT_ON_LOAD);
		if (sortOrder == null || sortOrder.isEmpty())
			return tree;

		if ("increasing".equalsIgnoreCase(sortOrder) || "decreasing".equalsIgnoreCase(sortOrder)) {
			LOG.info("Sorting tree by " + sortOrder.toLowerCase() + " clade size");
			return tree.sort("increasing".equalsIgnoreCase(sortOrder));
		}

		LOG.warn("Invalid value '" + sortOrder + "' for " + PROP_SORT_ON_LOAD + ", leaving tree unsorted");
		return tree;
	}
}
