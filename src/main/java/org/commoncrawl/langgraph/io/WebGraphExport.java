/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.io;

import java.io.IOException;
import java.util.Map.Entry;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.EdgeColor;
import org.commoncrawl.langgraph.KnowledgeGraph;
import org.commoncrawl.langgraph.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.webgraph.ArrayListMutableGraph;
import it.unimi.dsi.webgraph.BVGraph;
import it.unimi.dsi.webgraph.ImmutableGraph;

/**
 * Export the red and the blue layer of a graph as compressed
 * <a href="https://webgraph.di.unimi.it/">WebGraph</a> {@link BVGraph}s
 * <code>&lt;basename&gt;-red</code> and <code>&lt;basename&gt;-blue</code>.
 * Both graphs share the vertex IDs written by {@link GraphWriter}, every
 * undirected edge is stored as a pair of arcs (the graphs are symmetric).
 */
public class WebGraphExport {

	private static Logger LOG = LoggerFactory.getLogger(WebGraphExport.class);

	public static final String RED_SUFFIX = "-red";
	public static final String BLUE_SUFFIX = "-blue";

	private WebGraphExport() {
	}

	/**
	 * Build the symmetric graph of all edges of one color.
	 */
	public static ImmutableGraph layer(KnowledgeGraph graph, Object2IntMap<Vertex> ids, EdgeColor color) {
		int n = graph.numVertices();
		IntRBTreeSet[] successors = new IntRBTreeSet[n];
		for (Entry<Edge, EdgeColor> e : graph.edges().entrySet()) {
			if (e.getValue() != color) {
				continue;
			}
			int u = ids.getInt(e.getKey().getFirst());
			int v = ids.getInt(e.getKey().getSecond());
			successor(successors, u).add(v);
			successor(successors, v).add(u);
		}
		// successor lists must be added in increasing order
		ArrayListMutableGraph layer = new ArrayListMutableGraph(n);
		for (int u = 0; u < n; u++) {
			if (successors[u] == null) {
				continue;
			}
			IntIterator it = successors[u].iterator();
			while (it.hasNext()) {
				layer.addArc(u, it.nextInt());
			}
		}
		return layer.immutableView();
	}

	private static IntRBTreeSet successor(IntRBTreeSet[] successors, int u) {
		if (successors[u] == null) {
			successors[u] = new IntRBTreeSet();
		}
		return successors[u];
	}

	public static void store(KnowledgeGraph graph, String basename) throws IOException {
		Object2IntMap<Vertex> ids = GraphWriter.vertexIds(graph);
		for (EdgeColor color : EdgeColor.values()) {
			String name = basename + (color == EdgeColor.RED ? RED_SUFFIX : BLUE_SUFFIX);
			ImmutableGraph layer = layer(graph, ids, color);
			LOG.info("Storing {} layer ({} arcs) as BVGraph {}", color, layer.numArcs(), name);
			BVGraph.store(layer, name);
		}
	}
}
