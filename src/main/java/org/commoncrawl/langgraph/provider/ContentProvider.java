/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

/**
 * Access to the plain-text content of documents, used only if content capture
 * is enabled.
 */
public interface ContentProvider {

	/**
	 * @param id       document identifier
	 * @param language language code
	 * @return plain-text summary (lead section) of the document
	 * @throws DocumentNotFoundException if the document does not exist
	 * @throws AmbiguousTitleException   if the identifier names a disambiguation
	 *                                   page
	 * @throws ProviderException         on transient failures
	 */
	String getSummary(String id, String language) throws ProviderException;
}
