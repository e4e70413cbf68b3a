/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merge the per-language vertex sets, the link edges and the translation
 * edges into one graph.
 *
 * <p>
 * Edges are inserted with set semantics, red (link) edges first, blue
 * (translation) edges second. If the same pair of vertices is both a link and
 * a translation, the edge ends up <b>blue</b>: translation equivalence takes
 * precedence over the hyperlink relation. Such overrides are counted and
 * logged.
 * </p>
 */
public class GraphAssembler {

	private static Logger LOG = LoggerFactory.getLogger(GraphAssembler.class);

	private Map<String, String> languageColors = Collections.emptyMap();
	private long colorOverrides = 0;

	/**
	 * @param languageColors display color per language, stored as vertex
	 *                       attribute {@value KnowledgeGraph#ATTR_COLOR}
	 */
	public void setLanguageColors(Map<String, String> languageColors) {
		this.languageColors = languageColors;
	}

	/**
	 * @return number of red edges overridden by blue ones in the last assembly
	 */
	public long getColorOverrides() {
		return colorOverrides;
	}

	public KnowledgeGraph assemble(Map<String, ? extends Collection<Vertex>> perLanguageVertices,
			Collection<Edge> redEdges, Collection<Edge> blueEdges) {
		KnowledgeGraph g = new KnowledgeGraph();
		for (Entry<String, ? extends Collection<Vertex>> e : perLanguageVertices.entrySet()) {
			String language = e.getKey();
			String color = languageColors.get(language);
			for (Vertex v : e.getValue()) {
				if (!v.getLanguage().equals(language)) {
					throw new IllegalArgumentException("Vertex " + v + " listed under language " + language);
				}
				if (g.addVertex(v) && color != null) {
					g.setAttribute(v, KnowledgeGraph.ATTR_COLOR, color);
				}
			}
		}
		for (Edge edge : redEdges) {
			g.addEdge(edge, EdgeColor.RED);
		}
		colorOverrides = 0;
		for (Edge edge : blueEdges) {
			if (g.addEdge(edge, EdgeColor.BLUE) == EdgeColor.RED) {
				LOG.debug("Link edge {} is also a translation, kept as translation edge", edge);
				colorOverrides++;
			}
		}
		if (colorOverrides > 0) {
			LOG.warn("{} link edges connect translations of each other and were colored blue", colorOverrides);
		}
		LOG.info("Assembled {}", g);
		return g;
	}

	/**
	 * Draw a random display color (<code>#RRGGBB</code>) per language.
	 */
	public static Map<String, String> randomLanguageColors(Collection<String> languages, Random random) {
		Map<String, String> colors = new LinkedHashMap<>();
		for (String language : languages) {
			colors.put(language, String.format("#%06X", random.nextInt(1 << 24)));
		}
		return colors;
	}

	/**
	 * Collect the vertices of all languages.
	 */
	public static Set<Vertex> union(Map<String, ? extends Collection<Vertex>> perLanguageVertices) {
		Set<Vertex> all = new LinkedHashSet<>();
		for (Collection<Vertex> vertices : perLanguageVertices.values()) {
			all.addAll(vertices);
		}
		return all;
	}
}
