/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.io;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Map.Entry;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.EdgeColor;
import org.commoncrawl.langgraph.KnowledgeGraph;
import org.commoncrawl.langgraph.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * Write a graph as two tab-separated text files:
 * <dl>
 * <dt><code>&lt;basename&gt;.vertices.tsv</code></dt>
 * <dd>&langle;id, lang, identifier, key=value, ...&rangle;</dd>
 * <dt><code>&lt;basename&gt;.edges.tsv</code></dt>
 * <dd>&langle;fromId, toId, color&rangle;</dd>
 * </dl>
 * Vertex IDs (0,1,...,n-1) are assigned in the insertion order of the graph.
 * Every vertex attribute except the language is written as key-value pair;
 * tabs, line breaks and backslashes in values are escaped.
 */
public class GraphWriter {

	private static Logger LOG = LoggerFactory.getLogger(GraphWriter.class);

	public static final String VERTICES_SUFFIX = ".vertices.tsv";
	public static final String EDGES_SUFFIX = ".edges.tsv";

	private GraphWriter() {
	}

	public static Path verticesPath(String basename) {
		return Paths.get(basename + VERTICES_SUFFIX);
	}

	public static Path edgesPath(String basename) {
		return Paths.get(basename + EDGES_SUFFIX);
	}

	/**
	 * @return the mapping vertex &rarr; ID used when writing the graph
	 */
	public static Object2IntMap<Vertex> vertexIds(KnowledgeGraph graph) {
		Object2IntLinkedOpenHashMap<Vertex> ids = new Object2IntLinkedOpenHashMap<>(graph.numVertices());
		ids.defaultReturnValue(-1);
		int id = 0;
		for (Vertex v : graph.vertices()) {
			ids.put(v, id++);
		}
		return ids;
	}

	public static void write(KnowledgeGraph graph, String basename) throws IOException {
		Object2IntMap<Vertex> ids = vertexIds(graph);
		try (PrintStream out = new PrintStream(Files.newOutputStream(verticesPath(basename)), false,
				StandardCharsets.UTF_8)) {
			writeVertices(graph, ids, out);
		}
		try (PrintStream out = new PrintStream(Files.newOutputStream(edgesPath(basename)), false,
				StandardCharsets.UTF_8)) {
			writeEdges(graph, ids, out);
		}
		LOG.info("Saved graph with {} vertices and {} edges to {} and {}", graph.numVertices(), graph.numEdges(),
				verticesPath(basename), edgesPath(basename));
	}

	public static void writeVertices(KnowledgeGraph graph, Object2IntMap<Vertex> ids, PrintStream out) {
		StringBuilder b = new StringBuilder();
		for (Vertex v : graph.vertices()) {
			b.setLength(0);
			b.append(ids.getInt(v));
			b.append('\t');
			b.append(TsvEscape.escape(v.getLanguage()));
			b.append('\t');
			b.append(TsvEscape.escape(v.getId()));
			for (Entry<String, String> attr : graph.getAttributes(v).entrySet()) {
				if (attr.getKey().equals(KnowledgeGraph.ATTR_LANGUAGE)) {
					continue;
				}
				b.append('\t');
				b.append(TsvEscape.escape(attr.getKey()));
				b.append('=');
				b.append(TsvEscape.escape(attr.getValue()));
			}
			out.print(b);
			out.print('\n');
		}
		out.flush();
	}

	public static void writeEdges(KnowledgeGraph graph, Object2IntMap<Vertex> ids, PrintStream out) {
		for (Map.Entry<Edge, EdgeColor> e : graph.edges().entrySet()) {
			out.print(ids.getInt(e.getKey().getFirst()));
			out.print('\t');
			out.print(ids.getInt(e.getKey().getSecond()));
			out.print('\t');
			out.print(e.getValue().label());
			out.print('\n');
		}
		out.flush();
	}
}
