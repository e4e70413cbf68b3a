/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.crawl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.Vertex;

/**
 * Result of a completed crawl of one language: the discovered vertices and
 * the link edges between them.
 */
public class LanguageCrawl {

	private final String language;
	private final Set<Vertex> vertices;
	private final Set<Edge> edges;
	private final int expansions;
	private final int missing;

	public LanguageCrawl(String language, Set<Vertex> vertices, Set<Edge> edges, int expansions, int missing) {
		this.language = language;
		this.vertices = Collections.unmodifiableSet(vertices);
		this.edges = Collections.unmodifiableSet(edges);
		this.expansions = expansions;
		this.missing = missing;
	}

	public String getLanguage() {
		return language;
	}

	/**
	 * @return vertices in discovery order
	 */
	public Set<Vertex> getVertices() {
		return vertices;
	}

	/**
	 * @return link edges in discovery order, both endpoints are in
	 *         {@link #getVertices()}
	 */
	public Set<Edge> getEdges() {
		return edges;
	}

	/**
	 * @return number of vertices expanded (links requested)
	 */
	public int getExpansions() {
		return expansions;
	}

	/**
	 * @return number of documents found to be missing during the crawl
	 */
	public int getMissing() {
		return missing;
	}

	/**
	 * Drop vertices found to be missing after the crawl, e.g., documents
	 * admitted when the budget was exhausted and never expanded.
	 *
	 * @param retained vertices to keep
	 * @return a crawl holding only the retained vertices and the edges between
	 *         them, dropped vertices are counted as missing
	 */
	public LanguageCrawl retainVertices(Set<Vertex> retained) {
		Set<Vertex> v = new LinkedHashSet<>();
		for (Vertex vertex : vertices) {
			if (retained.contains(vertex)) {
				v.add(vertex);
			}
		}
		Set<Edge> e = new LinkedHashSet<>();
		for (Edge edge : edges) {
			if (v.contains(edge.getFirst()) && v.contains(edge.getSecond())) {
				e.add(edge);
			}
		}
		return new LanguageCrawl(language, v, e, expansions, missing + vertices.size() - v.size());
	}

	@Override
	public String toString() {
		return language + ": " + vertices.size() + " vertices, " + edges.size() + " edges";
	}
}
