/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.crawl;

import java.util.List;

import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;

/**
 * Access to the outgoing links of a document.
 */
public interface LinkProvider {

	/**
	 * Get the links found in the lead section of a document. Invalid identifiers
	 * and links to the document itself are already filtered out.
	 *
	 * @param id       document identifier
	 * @param language language code
	 * @return link targets in document order
	 * @throws DocumentNotFoundException if the document does not exist
	 * @throws ProviderException         on transient failures
	 */
	List<String> getLinks(String id, String language) throws ProviderException;
}
