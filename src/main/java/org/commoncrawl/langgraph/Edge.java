/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.Objects;

/**
 * Unordered pair of distinct vertices. The endpoints are normalized so that
 * {@code (u, v)} and {@code (v, u)} are equal edges.
 */
public final class Edge {

	private final Vertex first;
	private final Vertex second;

	public Edge(Vertex u, Vertex v) {
		Objects.requireNonNull(u, "u");
		Objects.requireNonNull(v, "v");
		int c = u.compareTo(v);
		if (c == 0) {
			throw new IllegalArgumentException("Self-loop not allowed: " + u);
		}
		if (c < 0) {
			first = u;
			second = v;
		} else {
			first = v;
			second = u;
		}
	}

	public static Edge of(Vertex u, Vertex v) {
		return new Edge(u, v);
	}

	public Vertex getFirst() {
		return first;
	}

	public Vertex getSecond() {
		return second;
	}

	public boolean isIncidentTo(Vertex v) {
		return first.equals(v) || second.equals(v);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Edge)) {
			return false;
		}
		Edge e = (Edge) o;
		return first.equals(e.first) && second.equals(e.second);
	}

	@Override
	public int hashCode() {
		return 31 * first.hashCode() + second.hashCode();
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
