/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.crawl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.Set;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.Vertex;
import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded breadth-first crawl of the link structure of one language.
 *
 * <p>
 * Starting from a single document the crawler expands vertices in FIFO order:
 * the links of the current vertex are requested from the {@link LinkProvider},
 * links to vertices already known only add an edge, unknown links are admitted
 * as new vertices (and queued) as long as the vertex budget is not exhausted.
 * If more unknown links are found than the remaining budget allows, they are
 * truncated by the configured {@link TruncationPolicy}. Crawling stops when the
 * frontier is empty or the budget is used up. No vertex is expanded twice.
 * </p>
 *
 * <p>
 * All state of a crawl is local to the call of
 * {@link #crawl(String, String, int)}, so one crawler may serve several
 * languages sequentially. The random source is not thread-safe, use one
 * crawler per thread.
 * </p>
 */
public class Crawler {

	private static Logger LOG = LoggerFactory.getLogger(Crawler.class);

	private final LinkProvider linkProvider;
	private final TruncationPolicy truncationPolicy;
	private final Random random;
	private int maxLinksPerExpansion = 0;

	public Crawler(LinkProvider linkProvider, TruncationPolicy truncationPolicy, Random random) {
		if (truncationPolicy == TruncationPolicy.RANDOM_SUBSET && random == null) {
			throw new IllegalArgumentException("Random subset truncation requires a random source");
		}
		this.linkProvider = linkProvider;
		this.truncationPolicy = truncationPolicy;
		this.random = random;
	}

	public Crawler(LinkProvider linkProvider) {
		this(linkProvider, TruncationPolicy.PREFIX, null);
	}

	/**
	 * @param maxLinks consider only the first {@code maxLinks} links of every
	 *                 expanded document, 0 means no limit
	 */
	public void setMaxLinksPerExpansion(int maxLinks) {
		if (maxLinks < 0) {
			throw new IllegalArgumentException("Max. links per expansion must not be negative: " + maxLinks);
		}
		this.maxLinksPerExpansion = maxLinks;
	}

	/**
	 * Crawl one language.
	 *
	 * @param startId     identifier of the start document
	 * @param language    language code
	 * @param maxVertices vertex budget (including the start vertex)
	 * @return the vertices and link edges found
	 * @throws ProviderException    if the link provider fails with a transient
	 *                              error, the partial crawl is discarded
	 * @throws InterruptedException if the crawling thread is interrupted
	 */
	public LanguageCrawl crawl(String startId, String language, int maxVertices)
			throws ProviderException, InterruptedException {
		if (maxVertices <= 0) {
			throw new IllegalArgumentException("Vertex budget must be positive: " + maxVertices);
		}
		Set<String> vertices = new LinkedHashSet<>();
		Set<Edge> edges = new LinkedHashSet<>();
		Set<String> visited = new HashSet<>();
		Set<String> missing = new HashSet<>();
		Queue<String> frontier = new ArrayDeque<>();

		vertices.add(startId);
		frontier.add(startId);
		int expansions = 0;

		while (!frontier.isEmpty() && vertices.size() < maxVertices) {
			if (Thread.interrupted()) {
				throw new InterruptedException("Crawl of " + language + " interrupted after " + expansions
						+ " expansions");
			}
			String current = frontier.remove();
			if (!visited.add(current)) {
				continue;
			}
			expansions++;

			List<String> links;
			try {
				links = linkProvider.getLinks(current, language);
			} catch (DocumentNotFoundException e) {
				LOG.debug("Skipping missing document {}:{}", language, current);
				Vertex v = new Vertex(language, current);
				vertices.remove(current);
				edges.removeIf(edge -> edge.isIncidentTo(v));
				missing.add(current);
				continue;
			}
			if (maxLinksPerExpansion > 0 && links.size() > maxLinksPerExpansion) {
				links = links.subList(0, maxLinksPerExpansion);
			}

			// unknown links, deduplicated in document order
			Set<String> unknown = new LinkedHashSet<>();
			for (String link : links) {
				if (!link.equals(current) && !vertices.contains(link) && !missing.contains(link)) {
					unknown.add(link);
				}
			}
			int budget = maxVertices - vertices.size();
			Set<String> admitted = new HashSet<>(truncationPolicy.select(new ArrayList<>(unknown), budget, random));
			if (admitted.size() < unknown.size()) {
				LOG.debug("{}:{} - admitting {} of {} new links, budget exhausted", language, current,
						admitted.size(), unknown.size());
			}

			Vertex from = new Vertex(language, current);
			for (String link : links) {
				if (link.equals(current) || missing.contains(link)) {
					continue;
				}
				if (admitted.remove(link)) {
					vertices.add(link);
					frontier.add(link);
				} else if (!vertices.contains(link)) {
					// not admitted
					continue;
				}
				edges.add(new Edge(from, new Vertex(language, link)));
			}
		}

		LOG.info("Crawled {} vertices and {} edges for language {} ({} expansions, {} missing documents)",
				vertices.size(), edges.size(), language, expansions, missing.size());
		Set<Vertex> res = new LinkedHashSet<>();
		for (String id : vertices) {
			res.add(new Vertex(language, id));
		}
		return new LanguageCrawl(language, res, edges, expansions, missing.size());
	}
}
