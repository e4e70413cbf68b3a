/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TestKnowledgeGraph {

	private static final Vertex A = Vertex.of("en", "A");
	private static final Vertex B = Vertex.of("fr", "B");
	private static final Vertex A_FR = Vertex.of("fr", "A");

	@Test
	void testEdgesAreUndirectedAndUnique() {
		KnowledgeGraph g = new KnowledgeGraph();
		g.addVertex(A);
		g.addVertex(B);
		assertNull(g.addEdge(A, B, EdgeColor.RED));
		assertEquals(EdgeColor.RED, g.addEdge(B, A, EdgeColor.RED));
		assertEquals(1, g.numEdges());
		assertTrue(g.containsEdge(B, A));
		assertEquals(Edge.of(A, B), Edge.of(B, A));
	}

	@Test
	void testSameIdentifierInTwoLanguages() {
		KnowledgeGraph g = new KnowledgeGraph();
		assertTrue(g.addVertex(A));
		assertTrue(g.addVertex(A_FR));
		assertFalse(g.addVertex(A));
		assertEquals(2, g.numVertices());
		assertEquals("en", g.getAttribute(A, KnowledgeGraph.ATTR_LANGUAGE));
		assertEquals("fr", g.getAttribute(A_FR, KnowledgeGraph.ATTR_LANGUAGE));
		assertFalse(g.containsEdge(A, A_FR));
	}

	@Test
	void testInvalidEdges() {
		KnowledgeGraph g = new KnowledgeGraph();
		g.addVertex(A);
		assertThrows(IllegalArgumentException.class, () -> g.addEdge(A, A, EdgeColor.RED));
		assertThrows(IllegalArgumentException.class, () -> g.addEdge(A, B, EdgeColor.BLUE));
		assertEquals(0, g.numEdges());
	}

	@Test
	void testInvertAndRemove() {
		KnowledgeGraph g = new KnowledgeGraph();
		g.addVertex(A);
		g.addVertex(B);
		g.addEdge(A, B, EdgeColor.BLUE);
		Edge edge = Edge.of(A, B);
		assertEquals(EdgeColor.RED, g.invertEdge(edge));
		assertEquals(EdgeColor.BLUE, g.invertEdge(edge));
		assertTrue(g.removeEdge(edge));
		assertFalse(g.removeEdge(edge));
		assertThrows(IllegalArgumentException.class, () -> g.invertEdge(edge));
	}

	@Test
	void testCopyIsIndependent() {
		KnowledgeGraph g = new KnowledgeGraph();
		g.addVertex(A);
		g.addVertex(B);
		g.addEdge(A, B, EdgeColor.RED);
		KnowledgeGraph copy = new KnowledgeGraph(g);
		assertEquals(g, copy);
		copy.setAttribute(A, KnowledgeGraph.ATTR_CONTENT, "text");
		copy.removeEdge(Edge.of(A, B));
		assertNull(g.getAttribute(A, KnowledgeGraph.ATTR_CONTENT));
		assertEquals(1, g.numEdges());
	}
}
