/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.commoncrawl.langgraph.crawl.TruncationPolicy;

/**
 * Configuration of a sampling run. Read from a Java properties file:
 *
 * <pre>
 * languages = en,fr,es
 * start.en = Mathematics
 * start.fr = Mathématiques
 * start.es = Matemáticas
 * max.vertices.per.language = 100
 * edge.inversion.probability = 0.1
 * edge.removal.probability = 0.8
 * seed = 42
 * content.capture = false
 * content.max.chars = 500
 * max.links.per.expansion = 0
 * truncation = prefix
 * crawl.threads = 4
 * crawl.timeout.seconds = 0
 * </pre>
 *
 * Only the languages and the start identifiers are required.
 */
public class SamplerConfig {

	public static final String LANGUAGES = "languages";
	public static final String START_PREFIX = "start.";
	public static final String MAX_VERTICES = "max.vertices.per.language";
	public static final String INVERSION_PROBABILITY = "edge.inversion.probability";
	public static final String REMOVAL_PROBABILITY = "edge.removal.probability";
	public static final String SEED = "seed";
	public static final String CONTENT_CAPTURE = "content.capture";
	public static final String CONTENT_MAX_CHARS = "content.max.chars";
	public static final String MAX_LINKS_PER_EXPANSION = "max.links.per.expansion";
	public static final String TRUNCATION = "truncation";
	public static final String CRAWL_THREADS = "crawl.threads";
	public static final String CRAWL_TIMEOUT = "crawl.timeout.seconds";

	private final Map<String, String> startIds = new LinkedHashMap<>();
	private int maxVerticesPerLanguage = 100;
	private double inversionProbability = 0.1;
	private double removalProbability = 0.8;
	private Long seed = null;
	private boolean contentCapture = false;
	private int contentMaxChars = 500;
	private int maxLinksPerExpansion = 0;
	private TruncationPolicy truncationPolicy = TruncationPolicy.PREFIX;
	private int crawlThreads = 4;
	private long crawlTimeoutSeconds = 0;

	public SamplerConfig() {
	}

	/**
	 * Add a language and its start identifier. Languages are processed in the
	 * order they are added.
	 */
	public SamplerConfig addLanguage(String language, String startId) {
		if (language == null || language.isBlank()) {
			throw new IllegalArgumentException("Empty language code");
		}
		if (startId == null || startId.isBlank()) {
			throw new IllegalArgumentException("No start identifier for language " + language);
		}
		if (startIds.containsKey(language)) {
			throw new IllegalArgumentException("Duplicate language: " + language);
		}
		startIds.put(language, startId);
		return this;
	}

	public static SamplerConfig load(Path file) throws IOException {
		Properties props = new Properties();
		try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			props.load(in);
		}
		return fromProperties(props);
	}

	/**
	 * @throws IllegalArgumentException if a value is missing or invalid
	 */
	public static SamplerConfig fromProperties(Properties props) {
		SamplerConfig conf = new SamplerConfig();
		String languages = props.getProperty(LANGUAGES, "");
		for (String language : languages.split(",")) {
			language = language.trim();
			if (language.isEmpty()) {
				continue;
			}
			String startId = props.getProperty(START_PREFIX + language);
			conf.addLanguage(language, startId == null ? null : startId.trim());
		}
		conf.setMaxVerticesPerLanguage(getInt(props, MAX_VERTICES, conf.maxVerticesPerLanguage));
		conf.setInversionProbability(getDouble(props, INVERSION_PROBABILITY, conf.inversionProbability));
		conf.setRemovalProbability(getDouble(props, REMOVAL_PROBABILITY, conf.removalProbability));
		String seed = props.getProperty(SEED);
		if (seed != null && !seed.isBlank()) {
			try {
				conf.setSeed(Long.parseLong(seed.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid number for " + SEED + ": " + seed, e);
			}
		}
		conf.setContentCapture(Boolean.parseBoolean(props.getProperty(CONTENT_CAPTURE, "false").trim()));
		conf.setContentMaxChars(getInt(props, CONTENT_MAX_CHARS, conf.contentMaxChars));
		conf.setMaxLinksPerExpansion(getInt(props, MAX_LINKS_PER_EXPANSION, conf.maxLinksPerExpansion));
		String truncation = props.getProperty(TRUNCATION);
		if (truncation != null) {
			conf.setTruncationPolicy(TruncationPolicy.fromName(truncation));
		}
		conf.setCrawlThreads(getInt(props, CRAWL_THREADS, conf.crawlThreads));
		conf.setCrawlTimeoutSeconds(getInt(props, CRAWL_TIMEOUT, (int) conf.crawlTimeoutSeconds));
		conf.validate();
		return conf;
	}

	private static int getInt(Properties props, String key, int defaultValue) {
		String value = props.getProperty(key);
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
		}
	}

	private static double getDouble(Properties props, String key, double defaultValue) {
		String value = props.getProperty(key);
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
		}
	}

	/**
	 * Check the configuration for consistency.
	 *
	 * @throws IllegalArgumentException if the configuration is not usable
	 */
	public void validate() {
		if (startIds.isEmpty()) {
			throw new IllegalArgumentException("No languages configured");
		}
		if (maxVerticesPerLanguage <= 0) {
			throw new IllegalArgumentException("Max. vertices per language must be positive: " + maxVerticesPerLanguage);
		}
		checkProbability(INVERSION_PROBABILITY, inversionProbability);
		checkProbability(REMOVAL_PROBABILITY, removalProbability);
		if (contentMaxChars < 0) {
			throw new IllegalArgumentException(CONTENT_MAX_CHARS + " must not be negative: " + contentMaxChars);
		}
		if (maxLinksPerExpansion < 0) {
			throw new IllegalArgumentException(
					MAX_LINKS_PER_EXPANSION + " must not be negative: " + maxLinksPerExpansion);
		}
		if (crawlThreads <= 0) {
			throw new IllegalArgumentException(CRAWL_THREADS + " must be positive: " + crawlThreads);
		}
		if (crawlTimeoutSeconds < 0) {
			throw new IllegalArgumentException(CRAWL_TIMEOUT + " must not be negative: " + crawlTimeoutSeconds);
		}
	}

	private static void checkProbability(String key, double p) {
		if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
			throw new IllegalArgumentException(key + " not in [0, 1]: " + p);
		}
	}

	public List<String> getLanguages() {
		return Collections.unmodifiableList(new ArrayList<>(startIds.keySet()));
	}

	public String getStartId(String language) {
		return startIds.get(language);
	}

	public int getMaxVerticesPerLanguage() {
		return maxVerticesPerLanguage;
	}

	public SamplerConfig setMaxVerticesPerLanguage(int maxVerticesPerLanguage) {
		this.maxVerticesPerLanguage = maxVerticesPerLanguage;
		return this;
	}

	public double getInversionProbability() {
		return inversionProbability;
	}

	public SamplerConfig setInversionProbability(double inversionProbability) {
		this.inversionProbability = inversionProbability;
		return this;
	}

	public double getRemovalProbability() {
		return removalProbability;
	}

	public SamplerConfig setRemovalProbability(double removalProbability) {
		this.removalProbability = removalProbability;
		return this;
	}

	/**
	 * @return the seed of the random source or null if none is configured
	 */
	public Long getSeed() {
		return seed;
	}

	public SamplerConfig setSeed(Long seed) {
		this.seed = seed;
		return this;
	}

	public boolean isContentCapture() {
		return contentCapture;
	}

	public SamplerConfig setContentCapture(boolean contentCapture) {
		this.contentCapture = contentCapture;
		return this;
	}

	public int getContentMaxChars() {
		return contentMaxChars;
	}

	public SamplerConfig setContentMaxChars(int contentMaxChars) {
		this.contentMaxChars = contentMaxChars;
		return this;
	}

	public int getMaxLinksPerExpansion() {
		return maxLinksPerExpansion;
	}

	public SamplerConfig setMaxLinksPerExpansion(int maxLinksPerExpansion) {
		this.maxLinksPerExpansion = maxLinksPerExpansion;
		return this;
	}

	public TruncationPolicy getTruncationPolicy() {
		return truncationPolicy;
	}

	public SamplerConfig setTruncationPolicy(TruncationPolicy truncationPolicy) {
		this.truncationPolicy = truncationPolicy;
		return this;
	}

	public int getCrawlThreads() {
		return crawlThreads;
	}

	public SamplerConfig setCrawlThreads(int crawlThreads) {
		this.crawlThreads = crawlThreads;
		return this;
	}

	public long getCrawlTimeoutSeconds() {
		return crawlTimeoutSeconds;
	}

	public SamplerConfig setCrawlTimeoutSeconds(long crawlTimeoutSeconds) {
		this.crawlTimeoutSeconds = crawlTimeoutSeconds;
		return this;
	}

	@Override
	public String toString() {
		return "SamplerConfig[languages=" + startIds + ", maxVerticesPerLanguage=" + maxVerticesPerLanguage
				+ ", inversionProbability=" + inversionProbability + ", removalProbability=" + removalProbability
				+ ", seed=" + seed + ", contentCapture=" + contentCapture + ", truncation=" + truncationPolicy + "]";
	}
}
