/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

/**
 * The requested document does not exist in the given language.
 */
public class DocumentNotFoundException extends ProviderException {

	private static final long serialVersionUID = 1L;

	private final String language;
	private final String id;

	public DocumentNotFoundException(String language, String id) {
		super("Document not found: " + language + ":" + id);
		this.language = language;
		this.id = id;
	}

	public String getLanguage() {
		return language;
	}

	public String getId() {
		return id;
	}
}
