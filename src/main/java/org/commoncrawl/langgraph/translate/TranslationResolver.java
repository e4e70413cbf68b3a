/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.translate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.commoncrawl.langgraph.Vertex;
import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Look up the translations of all crawled vertices of one language. This is
 * a pure lookup: one provider call per vertex, the crawl result is not
 * modified.
 */
public class TranslationResolver {

	private static Logger LOG = LoggerFactory.getLogger(TranslationResolver.class);

	private final TranslationProvider translationProvider;

	public TranslationResolver(TranslationProvider translationProvider) {
		this.translationProvider = translationProvider;
	}

	/**
	 * @param vertices        vertices of one language
	 * @param language        the language of the vertices
	 * @param targetLanguages languages to keep translations for, translations
	 *                        into other languages (or into {@code language}
	 *                        itself) are ignored
	 * @return translation table: for every vertex the map &lt;language,
	 *         equivalent identifier&gt;, in the order of the input vertices.
	 *         Vertices whose document does not exist are not contained in
	 *         the table.
	 * @throws ProviderException    on transient provider failures
	 * @throws InterruptedException if the thread is interrupted
	 */
	public Map<Vertex, Map<String, String>> resolve(Collection<Vertex> vertices, String language,
			Set<String> targetLanguages) throws ProviderException, InterruptedException {
		Map<Vertex, Map<String, String>> table = new LinkedHashMap<>();
		int notFound = 0;
		int translations = 0;
		for (Vertex v : vertices) {
			if (Thread.interrupted()) {
				throw new InterruptedException("Translation lookup for " + language + " interrupted");
			}
			if (!v.getLanguage().equals(language)) {
				throw new IllegalArgumentException("Vertex " + v + " is not in language " + language);
			}
			Map<String, String> record = new LinkedHashMap<>();
			try {
				for (Entry<String, String> e : translationProvider.getTranslations(v.getId(), language).entrySet()) {
					if (!e.getKey().equals(language) && targetLanguages.contains(e.getKey())) {
						record.put(e.getKey(), e.getValue());
					}
				}
			} catch (DocumentNotFoundException e) {
				LOG.debug("Missing document {}", v);
				notFound++;
				continue;
			}
			translations += record.size();
			table.put(v, record);
		}
		LOG.info("Resolved {} translations for {} vertices of language {} ({} documents not found)", translations,
				vertices.size(), language, notFound);
		return table;
	}
}
