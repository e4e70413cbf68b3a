/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.translate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import org.commoncrawl.langgraph.Vertex;
import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;
import org.junit.jupiter.api.Test;

public class TestTranslationResolver {

	private static final TranslationProvider PROVIDER = (id, language) -> {
		switch (id) {
		case "Mathematics":
			return Map.of("fr", "Mathématiques", "es", "Matemáticas", "de", "Mathematik", "en", "Mathematics");
		case "Missing":
			throw new DocumentNotFoundException(language, id);
		case "Broken":
			throw new ProviderException("HTTP 503");
		default:
			return Map.of();
		}
	};

	@Test
	void testTargetLanguagesOnly() throws Exception {
		Vertex math = Vertex.of("en", "Mathematics");
		Vertex algebra = Vertex.of("en", "Algebra");
		Vertex missing = Vertex.of("en", "Missing");
		Map<Vertex, Map<String, String>> table = new TranslationResolver(PROVIDER)
				.resolve(Arrays.asList(math, algebra, missing), "en", Set.of("en", "fr", "es"));
		assertEquals(2, table.size());
		assertEquals(Map.of("fr", "Mathématiques", "es", "Matemáticas"), table.get(math));
		assertEquals(Map.of(), table.get(algebra));
		assertFalse(table.containsKey(missing));
	}

	@Test
	void testProviderError() {
		TranslationResolver resolver = new TranslationResolver(PROVIDER);
		assertThrows(ProviderException.class,
				() -> resolver.resolve(Arrays.asList(Vertex.of("en", "Broken")), "en", Set.of("fr")));
	}

	@Test
	void testLanguageMismatch() {
		TranslationResolver resolver = new TranslationResolver(PROVIDER);
		assertThrows(IllegalArgumentException.class,
				() -> resolver.resolve(Arrays.asList(Vertex.of("fr", "Algèbre")), "en", Set.of("fr")));
	}
}
