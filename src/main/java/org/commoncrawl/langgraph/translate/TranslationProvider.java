/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.translate;

import java.util.Map;

import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;

/**
 * Access to the cross-language equivalents (interlanguage links) of a
 * document.
 */
public interface TranslationProvider {

	/**
	 * @param id       document identifier
	 * @param language language code of the document
	 * @return map &lt;language code, identifier of the equivalent document in that
	 *         language&gt;, empty if no equivalent is known
	 * @throws DocumentNotFoundException if the document does not exist
	 * @throws ProviderException         on transient failures
	 */
	Map<String, String> getTranslations(String id, String language) throws ProviderException;
}
