/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.translate;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turn pairwise translations into translation edges closed under
 * transitivity: if A translates to B and B translates to C, then A, B and C
 * form one equivalence class and all three pairs are connected.
 *
 * <p>
 * The equivalence classes are the connected components of the translation
 * pairs, computed in a single pass by union-find. Only pairs whose both
 * endpoints are known (crawled) vertices are considered. Every class with two
 * or more members is emitted as a clique.
 * </p>
 */
public class CliqueBuilder {

	private static Logger LOG = LoggerFactory.getLogger(CliqueBuilder.class);

	/**
	 * @param translationTables translation tables of all languages, see
	 *                          {@link TranslationResolver}
	 * @param knownVertices     vertices present in the crawled graph
	 * @return translation edges, deduplicated, without self-pairs
	 */
	public Set<Edge> buildCliqueEdges(Collection<Map<Vertex, Map<String, String>>> translationTables,
			Set<Vertex> knownVertices) {
		DisjointSets<Vertex> classes = new DisjointSets<>();
		long pairs = 0;
		long unknown = 0;
		for (Map<Vertex, Map<String, String>> table : translationTables) {
			for (Entry<Vertex, Map<String, String>> e : table.entrySet()) {
				Vertex source = e.getKey();
				if (!knownVertices.contains(source)) {
					continue;
				}
				for (Entry<String, String> t : e.getValue().entrySet()) {
					Vertex target = new Vertex(t.getKey(), t.getValue());
					if (target.equals(source)) {
						continue;
					}
					if (!knownVertices.contains(target)) {
						unknown++;
						continue;
					}
					classes.union(source, target);
					pairs++;
				}
			}
		}

		Set<Edge> edges = new LinkedHashSet<>();
		int cliques = 0;
		for (List<Vertex> members : classes.sets()) {
			if (members.size() < 2) {
				continue;
			}
			cliques++;
			for (int i = 0; i < members.size(); i++) {
				for (int j = i + 1; j < members.size(); j++) {
					edges.add(new Edge(members.get(i), members.get(j)));
				}
			}
		}
		LOG.info("Built {} translation edges in {} cliques from {} translation pairs ({} targets not crawled)",
				edges.size(), cliques, pairs, unknown);
		return edges;
	}
}
