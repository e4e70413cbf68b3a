/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Simple undirected graph with per-vertex attributes and two-colored edges.
 * Vertices and edges are kept in insertion order, which makes iteration (and
 * thus any randomized pass over the graph) reproducible.
 *
 * <p>
 * Adding an edge which is already present does not duplicate it but only
 * updates its color. Self-loops and edges to unknown vertices are rejected.
 * </p>
 */
public class KnowledgeGraph {

	/** Attribute key holding the language code of a vertex */
	public static final String ATTR_LANGUAGE = "lang";
	/** Attribute key holding the display color of a vertex */
	public static final String ATTR_COLOR = "color";
	/** Attribute key holding a content snippet of a vertex */
	public static final String ATTR_CONTENT = "content";

	private final Map<Vertex, Map<String, String>> vertices = new LinkedHashMap<>();
	private final Map<Edge, EdgeColor> edges = new LinkedHashMap<>();

	public KnowledgeGraph() {
	}

	/**
	 * Copy constructor, vertex attributes are copied (not shared).
	 */
	public KnowledgeGraph(KnowledgeGraph other) {
		for (Entry<Vertex, Map<String, String>> e : other.vertices.entrySet()) {
			vertices.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
		}
		edges.putAll(other.edges);
	}

	/**
	 * Add a vertex, the language attribute is set from the vertex. No-op if the
	 * vertex already exists.
	 *
	 * @return true if the vertex was added
	 */
	public boolean addVertex(Vertex v) {
		if (vertices.containsKey(v)) {
			return false;
		}
		Map<String, String> attributes = new LinkedHashMap<>();
		attributes.put(ATTR_LANGUAGE, v.getLanguage());
		vertices.put(v, attributes);
		return true;
	}

	public boolean containsVertex(Vertex v) {
		return vertices.containsKey(v);
	}

	public void setAttribute(Vertex v, String key, String value) {
		Map<String, String> attributes = vertices.get(v);
		if (attributes == null) {
			throw new IllegalArgumentException("Unknown vertex: " + v);
		}
		attributes.put(key, value);
	}

	public String getAttribute(Vertex v, String key) {
		Map<String, String> attributes = vertices.get(v);
		if (attributes == null) {
			return null;
		}
		return attributes.get(key);
	}

	/**
	 * @return unmodifiable view of the attributes of a vertex
	 */
	public Map<String, String> getAttributes(Vertex v) {
		Map<String, String> attributes = vertices.get(v);
		if (attributes == null) {
			throw new IllegalArgumentException("Unknown vertex: " + v);
		}
		return Collections.unmodifiableMap(attributes);
	}

	/**
	 * Insert an edge with set semantics: if the edge exists, only its color is
	 * overwritten.
	 *
	 * @return the previous color of the edge or null if it was not present
	 * @throws IllegalArgumentException if one of the endpoints is not a vertex of
	 *                                  the graph or both endpoints are equal
	 */
	public EdgeColor addEdge(Vertex u, Vertex v, EdgeColor color) {
		return addEdge(new Edge(u, v), color);
	}

	public EdgeColor addEdge(Edge edge, EdgeColor color) {
		if (!vertices.containsKey(edge.getFirst())) {
			throw new IllegalArgumentException("Unknown vertex: " + edge.getFirst());
		}
		if (!vertices.containsKey(edge.getSecond())) {
			throw new IllegalArgumentException("Unknown vertex: " + edge.getSecond());
		}
		return edges.put(edge, color);
	}

	public boolean containsEdge(Vertex u, Vertex v) {
		if (u.equals(v)) {
			return false;
		}
		return edges.containsKey(new Edge(u, v));
	}

	public EdgeColor getColor(Edge edge) {
		return edges.get(edge);
	}

	public EdgeColor getColor(Vertex u, Vertex v) {
		if (u.equals(v)) {
			return null;
		}
		return edges.get(new Edge(u, v));
	}

	/**
	 * Toggle the color of an existing edge.
	 *
	 * @return the new color
	 */
	public EdgeColor invertEdge(Edge edge) {
		EdgeColor color = edges.get(edge);
		if (color == null) {
			throw new IllegalArgumentException("Unknown edge: " + edge);
		}
		EdgeColor inverted = color.inverse();
		edges.put(edge, inverted);
		return inverted;
	}

	public boolean removeEdge(Edge edge) {
		return edges.remove(edge) != null;
	}

	/**
	 * @return unmodifiable view of the vertices in insertion order
	 */
	public Set<Vertex> vertices() {
		return Collections.unmodifiableSet(vertices.keySet());
	}

	public Stream<Vertex> vertices(String language) {
		return vertices.keySet().stream().filter(v -> v.getLanguage().equals(language));
	}

	/**
	 * @return unmodifiable view of the edges and their colors in insertion order
	 */
	public Map<Edge, EdgeColor> edges() {
		return Collections.unmodifiableMap(edges);
	}

	/**
	 * @return a copy of the current edge set, safe to iterate while the graph is
	 *         modified
	 */
	public List<Edge> edgeSnapshot() {
		return new ArrayList<>(edges.keySet());
	}

	public int numVertices() {
		return vertices.size();
	}

	public int numEdges() {
		return edges.size();
	}

	public long numEdges(EdgeColor color) {
		return edges.values().stream().filter(c -> c == color).count();
	}

	/**
	 * Two graphs are equal if they hold the same vertices with the same
	 * attributes and the same edges with the same colors, regardless of the
	 * insertion order.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof KnowledgeGraph)) {
			return false;
		}
		KnowledgeGraph g = (KnowledgeGraph) o;
		return vertices.equals(g.vertices) && edges.equals(g.edges);
	}

	@Override
	public int hashCode() {
		return 31 * vertices.hashCode() + edges.hashCode();
	}

	@Override
	public String toString() {
		return "KnowledgeGraph[" + numVertices() + " vertices, " + numEdges(EdgeColor.RED) + " red edges, "
				+ numEdges(EdgeColor.BLUE) + " blue edges]";
	}
}
