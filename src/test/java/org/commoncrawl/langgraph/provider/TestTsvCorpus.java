/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestTsvCorpus {

	private static void write(Path file, String... lines) throws IOException {
		Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
	}

	private static TsvCorpus corpus(Path dir) throws IOException {
		write(dir.resolve(TsvCorpus.LINKS_FILE), //
				"# lang\tfrom\tto", //
				"en\tMathematics\tAlgebra", //
				"en\tMathematics\tGeometry", //
				"en\tMathematics\tFile:Euclid.png", //
				"en\tMathematics\tMathematics", //
				"en\tMathematics\tPi#Decimal", //
				"en\tMathematics\tAnalysis", //
				"", //
				"en\tbroken line", //
				"fr\tMathématiques\tAlgèbre");
		write(dir.resolve(TsvCorpus.LANGLINKS_FILE), //
				"en\tMathematics\tfr\tMathématiques", //
				"en\tMathematics\tes\tMatemáticas", //
				"fr\tMathématiques\ten\tMathematics");
		write(dir.resolve(TsvCorpus.PAGES_FILE), //
				"en\tMathematics\tMathematics is a field of study.\tIt has tabs.", //
				"en\tAlgebra\tAlgebra is a branch of mathematics.");
		write(dir.resolve(TsvCorpus.DISAMBIGUATION_FILE), //
				"en\tMercury\tMercury (planet)\tMercury (element)");
		return TsvCorpus.load(dir);
	}

	@Test
	void testLinks(@TempDir Path dir) throws Exception {
		TsvCorpus corpus = corpus(dir);
		assertEquals(Arrays.asList("Algebra", "Geometry", "Analysis"), corpus.getLinks("Mathematics", "en"));
		assertEquals(Collections.singletonList("Algèbre"), corpus.getLinks("Mathématiques", "fr"));
		// known from pages.tsv only
		assertTrue(corpus.getLinks("Algebra", "en").isEmpty());
		assertThrows(DocumentNotFoundException.class, () -> corpus.getLinks("Geometry", "en"));
		assertThrows(DocumentNotFoundException.class, () -> corpus.getLinks("Mathematics", "de"));
	}

	@Test
	void testTranslations(@TempDir Path dir) throws Exception {
		TsvCorpus corpus = corpus(dir);
		Map<String, String> translations = corpus.getTranslations("Mathematics", "en");
		assertEquals(Map.of("fr", "Mathématiques", "es", "Matemáticas"), translations);
		assertTrue(corpus.getTranslations("Algebra", "en").isEmpty());
		DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class,
				() -> corpus.getTranslations("Topology", "en"));
		assertEquals("Topology", e.getId());
		assertEquals("en", e.getLanguage());
	}

	@Test
	void testSummaries(@TempDir Path dir) throws Exception {
		TsvCorpus corpus = corpus(dir);
		assertEquals("Mathematics is a field of study.\tIt has tabs.", corpus.getSummary("Mathematics", "en"));
		assertEquals("", corpus.getSummary("Mathématiques", "fr"));
		AmbiguousTitleException e = assertThrows(AmbiguousTitleException.class,
				() -> corpus.getSummary("Mercury", "en"));
		assertEquals(List.of("Mercury (planet)", "Mercury (element)"), e.getCandidates());
		assertThrows(DocumentNotFoundException.class, () -> corpus.getSummary("Venus", "en"));
	}

	@Test
	void testOptionalFiles(@TempDir Path dir) throws Exception {
		write(dir.resolve(TsvCorpus.LINKS_FILE), "en\tA\tB");
		write(dir.resolve(TsvCorpus.LANGLINKS_FILE));
		TsvCorpus corpus = TsvCorpus.load(dir);
		assertTrue(corpus.exists("A", "en"));
		assertFalse(corpus.exists("B", "en"));
		assertEquals(Collections.singletonList("B"), corpus.getLinks("A", "en"));
	}

	@Test
	void testMissingRequiredFile(@TempDir Path dir) throws Exception {
		write(dir.resolve(TsvCorpus.LINKS_FILE), "en\tA\tB");
		assertThrows(IOException.class, () -> TsvCorpus.load(dir));
	}
}
