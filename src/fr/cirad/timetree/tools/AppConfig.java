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
package fr.cirad.timetree.tools;

import java.io.IOException;
import java.util.Properties;

import org.apache.log4j.Logger;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.stereotype.Component;

/**
 * Application settings, read from timetree.properties at the root of the classpath.
 *
 * @author sempere
 */
@Component
public class AppConfig {

	private static final Logger LOG = Logger.getLogger(AppConfig.class);

	public static final String CONFIG_FILE = "timetree.properties";

	private final Properties props;

	public AppConfig() throws IOException {
		Resource resource = new ClassPathResource(CONFIG_FILE);
		if (resource.exists())
			props = PropertiesLoaderUtils.loadProperties(resource);
		else {
			LOG.info(CONFIG_FILE + " not found in classpath, using default settings");
			props = new Properties();
		}
	}

	public AppConfig(Properties props) {
		this.props = props;
	}

	/**
	 * @return the trimmed value for key, or null if it is not set
	 */
	public String get(String key) {
		String value = props.getProperty(key);
		return value == null ? null : value.trim();
	}

	public int getInt(String key, int defaultValue) {
		String value = get(key);
		if (value == null || value.isEmpty())
			return defaultValue;
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException nfe) {
			LOG.warn("Invalid integer value '" + value + "' for " + key + ", using " + defaultValue);
			return defaultValue;
		}
	}

	public boolean getBoolean(String key, boolean defaultValue) {
		String value = get(key);
		if (value == null || value.isEmpty())
			return defaultValue;
		if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value))
			return Boolean.parseBoolean(value);
		LOG.warn("Invalid boolean value '" + value + "' for " + key + ", using " + defaultValue);
		return defaultValue;
	}
}
