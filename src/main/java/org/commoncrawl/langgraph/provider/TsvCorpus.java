/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.commoncrawl.langgraph.crawl.LinkProvider;
import org.commoncrawl.langgraph.translate.TranslationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document corpus held in memory, optionally loaded from a directory of
 * tab-separated files (all UTF-8, one record per line):
 * <dl>
 * <dt><code>links.tsv</code></dt>
 * <dd>&langle;lang, fromId, toId&rangle; links in document order</dd>
 * <dt><code>langlinks.tsv</code></dt>
 * <dd>&langle;lang, id, otherLang, otherId&rangle; interlanguage links</dd>
 * <dt><code>pages.tsv</code> (optional)</dt>
 * <dd>&langle;lang, id, text&rangle; plain text of the lead section</dd>
 * <dt><code>disambiguation.tsv</code> (optional)</dt>
 * <dd>&langle;lang, id, candidate, ...&rangle; disambiguation pages</dd>
 * </dl>
 * A document exists if it appears as the first identifier column in any of
 * the files. Links are filtered by {@link LinkFilter}.
 */
public class TsvCorpus implements LinkProvider, TranslationProvider, ContentProvider {

	private static Logger LOG = LoggerFactory.getLogger(TsvCorpus.class);

	public static final String LINKS_FILE = "links.tsv";
	public static final String LANGLINKS_FILE = "langlinks.tsv";
	public static final String PAGES_FILE = "pages.tsv";
	public static final String DISAMBIGUATION_FILE = "disambiguation.tsv";

	private final Map<String, Map<String, List<String>>> links = new HashMap<>();
	private final Map<String, Map<String, Map<String, String>>> translations = new HashMap<>();
	private final Map<String, Map<String, String>> pages = new HashMap<>();
	private final Map<String, Map<String, List<String>>> disambiguations = new HashMap<>();

	public TsvCorpus() {
	}

	/**
	 * Load a corpus from a directory.
	 *
	 * @param dir directory holding the corpus files
	 * @throws IOException if a required file is missing or cannot be read
	 */
	public static TsvCorpus load(Path dir) throws IOException {
		TsvCorpus corpus = new TsvCorpus();
		corpus.read(dir.resolve(LINKS_FILE), 3, -1, false, f -> corpus.addLink(f[0], f[1], f[2]));
		corpus.read(dir.resolve(LANGLINKS_FILE), 4, -1, false, f -> corpus.addTranslation(f[0], f[1], f[2], f[3]));
		corpus.read(dir.resolve(PAGES_FILE), 3, 3, true, f -> corpus.addPage(f[0], f[1], f[2]));
		corpus.read(dir.resolve(DISAMBIGUATION_FILE), 3, -1, true,
				f -> corpus.addDisambiguation(f[0], f[1], Arrays.asList(f).subList(2, f.length)));
		LOG.info("Loaded corpus from {}: {} documents with links, languages: {}", dir,
				corpus.links.values().stream().mapToInt(Map::size).sum(), corpus.links.keySet());
		return corpus;
	}

	private void read(Path file, int minFields, int limit, boolean optional, Consumer<String[]> consumer)
			throws IOException {
		if (optional && !Files.exists(file)) {
			LOG.info("Optional corpus file {} not found", file);
			return;
		}
		long lines = 0;
		long skipped = 0;
		try (Stream<String> in = Files.lines(file, StandardCharsets.UTF_8)) {
			for (String line : (Iterable<String>) in::iterator) {
				lines++;
				if (line.isEmpty() || line.charAt(0) == '#') {
					continue;
				}
				String[] fields = line.split("\t", limit);
				if (fields.length < minFields) {
					LOG.warn("Skipping invalid line {} in {}: <{}>", lines, file, line);
					skipped++;
					continue;
				}
				consumer.accept(fields);
			}
		}
		LOG.info("Read {} lines from {} ({} skipped)", lines, file, skipped);
	}

	public void addLink(String language, String from, String to) {
		links.computeIfAbsent(language, k -> new HashMap<>()).computeIfAbsent(from, k -> new ArrayList<>()).add(to);
	}

	/**
	 * Register a document without outgoing links.
	 */
	public void addDocument(String language, String id) {
		links.computeIfAbsent(language, k -> new HashMap<>()).computeIfAbsent(id, k -> new ArrayList<>());
	}

	public void addTranslation(String language, String id, String otherLanguage, String otherId) {
		translations.computeIfAbsent(language, k -> new HashMap<>())
				.computeIfAbsent(id, k -> new LinkedHashMap<>()).put(otherLanguage, otherId);
	}

	public void addPage(String language, String id, String text) {
		pages.computeIfAbsent(language, k -> new HashMap<>()).put(id, text);
	}

	public void addDisambiguation(String language, String id, List<String> candidates) {
		disambiguations.computeIfAbsent(language, k -> new HashMap<>()).put(id, new ArrayList<>(candidates));
	}

	private static <V> V lookup(Map<String, Map<String, V>> map, String language, String id) {
		Map<String, V> m = map.get(language);
		if (m == null) {
			return null;
		}
		return m.get(id);
	}

	public boolean exists(String id, String language) {
		return lookup(links, language, id) != null || lookup(translations, language, id) != null
				|| lookup(pages, language, id) != null || lookup(disambiguations, language, id) != null;
	}

	@Override
	public List<String> getLinks(String id, String language) throws ProviderException {
		if (!exists(id, language)) {
			throw new DocumentNotFoundException(language, id);
		}
		List<String> res = lookup(links, language, id);
		if (res == null) {
			return Collections.emptyList();
		}
		return LinkFilter.filter(id, res);
	}

	@Override
	public Map<String, String> getTranslations(String id, String language) throws ProviderException {
		if (!exists(id, language)) {
			throw new DocumentNotFoundException(language, id);
		}
		Map<String, String> res = lookup(translations, language, id);
		if (res == null) {
			return Collections.emptyMap();
		}
		return Collections.unmodifiableMap(res);
	}

	@Override
	public String getSummary(String id, String language) throws ProviderException {
		List<String> candidates = lookup(disambiguations, language, id);
		if (candidates != null) {
			throw new AmbiguousTitleException(language, id, candidates);
		}
		if (!exists(id, language)) {
			throw new DocumentNotFoundException(language, id);
		}
		String text = lookup(pages, language, id);
		return text == null ? "" : text;
	}
}
