/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

/**
 * Relation type of an edge. There are exactly two colors, inversion toggles
 * between them.
 */
public enum EdgeColor {

	/** same-language hyperlink */
	RED("red"),
	/** cross-language translation equivalence */
	BLUE("blue");

	private final String label;

	EdgeColor(String label) {
		this.label = label;
	}

	public EdgeColor inverse() {
		return this == RED ? BLUE : RED;
	}

	public String label() {
		return label;
	}

	public static EdgeColor fromLabel(String label) {
		switch (label) {
		case "red":
			return RED;
		case "blue":
			return BLUE;
		default:
			throw new IllegalArgumentException("Unknown edge color: " + label);
		}
	}

	@Override
	public String toString() {
		return label;
	}
}
