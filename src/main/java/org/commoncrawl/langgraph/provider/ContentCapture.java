/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import java.util.List;

import org.commoncrawl.langgraph.KnowledgeGraph;
import org.commoncrawl.langgraph.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attach a content snippet to every vertex of a graph. Failures never drop a
 * vertex: if the content cannot be fetched the snippet is empty.
 */
public class ContentCapture {

	private static Logger LOG = LoggerFactory.getLogger(ContentCapture.class);

	private final ContentProvider contentProvider;
	private final int maxChars;

	/**
	 * @param contentProvider the content provider
	 * @param maxChars        character budget of a snippet, 0 means unlimited
	 */
	public ContentCapture(ContentProvider contentProvider, int maxChars) {
		this.contentProvider = contentProvider;
		this.maxChars = maxChars;
	}

	/**
	 * Get the summary of a document. A disambiguation page is resolved to its
	 * first candidate.
	 *
	 * @return the summary, cut to the character budget, or the empty string if
	 *         not available
	 */
	public String summary(Vertex v) {
		try {
			return Summaries.truncate(contentProvider.getSummary(v.getId(), v.getLanguage()), maxChars);
		} catch (AmbiguousTitleException e) {
			List<String> candidates = e.getCandidates();
			if (candidates.isEmpty()) {
				LOG.warn("Ambiguous title {} without candidates", v);
				return "";
			}
			String candidate = candidates.get(0);
			LOG.debug("Resolving ambiguous title {} to {}", v, candidate);
			try {
				return Summaries.truncate(contentProvider.getSummary(candidate, v.getLanguage()), maxChars);
			} catch (ProviderException e2) {
				LOG.warn("Failed to get content of {} (resolved to {}): {}", v, candidate, e2.getMessage());
				return "";
			}
		} catch (DocumentNotFoundException e) {
			LOG.debug("No content for missing document {}", v);
			return "";
		} catch (ProviderException e) {
			LOG.warn("Failed to get content of {}: {}", v, e.getMessage());
			return "";
		}
	}

	/**
	 * Set the content attribute of all vertices of the graph.
	 */
	public void capture(KnowledgeGraph graph) {
		long empty = 0;
		for (Vertex v : graph.vertices()) {
			String content = summary(v);
			if (content.isEmpty()) {
				empty++;
			}
			graph.setAttribute(v, KnowledgeGraph.ATTR_CONTENT, content);
		}
		LOG.info("Captured content of {} vertices ({} without content)", graph.numVertices(), empty);
	}
}
