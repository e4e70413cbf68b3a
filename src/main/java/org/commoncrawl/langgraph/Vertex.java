/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.Objects;

/**
 * A document in the graph, identified by its language and its identifier
 * (title) in that language. Two documents sharing the same title in different
 * languages are different vertices.
 */
public final class Vertex implements Comparable<Vertex> {

	private final String language;
	private final String id;

	public Vertex(String language, String id) {
		this.language = Objects.requireNonNull(language, "language");
		this.id = Objects.requireNonNull(id, "id");
	}

	public static Vertex of(String language, String id) {
		return new Vertex(language, id);
	}

	public String getLanguage() {
		return language;
	}

	public String getId() {
		return id;
	}

	@Override
	public int compareTo(Vertex o) {
		int c = language.compareTo(o.language);
		if (c != 0) {
			return c;
		}
		return id.compareTo(o.id);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Vertex)) {
			return false;
		}
		Vertex v = (Vertex) o;
		return language.equals(v.language) && id.equals(v.id);
	}

	@Override
	public int hashCode() {
		return 31 * language.hashCode() + id.hashCode();
	}

	@Override
	public String toString() {
		return language + ":" + id;
	}
}
