/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import java.util.Collections;
import java.util.List;

/**
 * The requested identifier is a disambiguation page. Holds the candidate
 * identifiers in the order listed by the page.
 */
public class AmbiguousTitleException extends ProviderException {

	private static final long serialVersionUID = 1L;

	private final List<String> candidates;

	public AmbiguousTitleException(String language, String id, List<String> candidates) {
		super("Ambiguous title: " + language + ":" + id + " (" + candidates.size() + " candidates)");
		this.candidates = Collections.unmodifiableList(candidates);
	}

	public List<String> getCandidates() {
		return candidates;
	}
}
