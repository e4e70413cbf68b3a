/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.crawl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.commoncrawl.langgraph.Edge;
import org.commoncrawl.langgraph.Vertex;
import org.commoncrawl.langgraph.provider.DocumentNotFoundException;
import org.commoncrawl.langgraph.provider.ProviderException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.util.XoRoShiRo128PlusPlusRandom;

public class TestCrawler {

	protected static Logger LOG = LoggerFactory.getLogger(TestCrawler.class);

	/**
	 * Link provider backed by a map, counts the requests per document.
	 */
	static class MapLinkProvider implements LinkProvider {
		Map<String, List<String>> links = new HashMap<>();
		Map<String, Integer> requests = new HashMap<>();

		MapLinkProvider link(String from, String... to) {
			links.put(from, Arrays.asList(to));
			return this;
		}

		@Override
		public List<String> getLinks(String id, String language) throws ProviderException {
			requests.merge(id, 1, Integer::sum);
			List<String> res = links.get(id);
			if (res == null) {
				throw new DocumentNotFoundException(language, id);
			}
			return res;
		}
	}

	private static Vertex v(String id) {
		return new Vertex("en", id);
	}

	private static Edge e(String u, String v) {
		return new Edge(v(u), v(v));
	}

	private static Set<String> ids(LanguageCrawl crawl) {
		return crawl.getVertices().stream().map(Vertex::getId).collect(Collectors.toSet());
	}

	private static void assertValid(LanguageCrawl crawl, int maxVertices) {
		assertTrue(crawl.getVertices().size() <= maxVertices, "vertex budget exceeded: " + crawl);
		for (Edge edge : crawl.getEdges()) {
			assertTrue(crawl.getVertices().contains(edge.getFirst()), "unknown endpoint " + edge);
			assertTrue(crawl.getVertices().contains(edge.getSecond()), "unknown endpoint " + edge);
			assertFalse(edge.getFirst().equals(edge.getSecond()));
		}
	}

	@Test
	void testBreadthFirst() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C") //
				.link("B", "D") //
				.link("C", "E") //
				.link("D") //
				.link("E");
		LanguageCrawl crawl = new Crawler(provider).crawl("A", "en", 10);
		assertValid(crawl, 10);
		assertEquals(Arrays.asList(v("A"), v("B"), v("C"), v("D"), v("E")),
				crawl.getVertices().stream().collect(Collectors.toList()));
		assertEquals(Set.of(e("A", "B"), e("A", "C"), e("B", "D"), e("C", "E")), crawl.getEdges());
		assertEquals(5, crawl.getExpansions());
	}

	@Test
	void testBudgetPrefixTruncation() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C", "D", "E");
		LanguageCrawl crawl = new Crawler(provider).crawl("A", "en", 3);
		assertValid(crawl, 3);
		assertEquals(Set.of("A", "B", "C"), ids(crawl));
		assertEquals(Set.of(e("A", "B"), e("A", "C")), crawl.getEdges());
		// budget exhausted after the first expansion
		assertEquals(1, crawl.getExpansions());
	}

	@Test
	void testKnownLinkAddsEdgeWhenBudgetExhausted() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C") //
				.link("B", "C", "D", "E");
		LanguageCrawl crawl = new Crawler(provider).crawl("A", "en", 4);
		assertValid(crawl, 4);
		assertEquals(Set.of("A", "B", "C", "D"), ids(crawl));
		assertEquals(Set.of(e("A", "B"), e("A", "C"), e("B", "C"), e("B", "D")), crawl.getEdges());
	}

	@Test
	void testRandomSubsetTruncation() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C", "D", "E", "F", "G", "H");
		Set<String> candidates = Set.of("B", "C", "D", "E", "F", "G", "H");
		LanguageCrawl first = null;
		for (int i = 0; i < 3; i++) {
			Crawler crawler = new Crawler(provider, TruncationPolicy.RANDOM_SUBSET,
					new XoRoShiRo128PlusPlusRandom(42));
			LanguageCrawl crawl = crawler.crawl("A", "en", 4);
			assertValid(crawl, 4);
			assertEquals(4, crawl.getVertices().size());
			assertEquals(3, crawl.getEdges().size());
			for (Vertex vertex : crawl.getVertices()) {
				assertTrue(vertex.getId().equals("A") || candidates.contains(vertex.getId()));
			}
			if (first == null) {
				first = crawl;
			} else {
				assertEquals(first.getVertices(), crawl.getVertices(), "same seed, same subset");
			}
		}
	}

	@Test
	void testRandomSubsetRequiresRandomSource() {
		assertThrows(IllegalArgumentException.class,
				() -> new Crawler(new MapLinkProvider(), TruncationPolicy.RANDOM_SUBSET, null));
	}

	@Test
	void testMissingDocumentIsSkipped() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C") //
				.link("C", "B", "D") //
				.link("D");
		// B does not exist
		LanguageCrawl crawl = new Crawler(provider).crawl("A", "en", 10);
		assertValid(crawl, 10);
		assertEquals(Set.of("A", "C", "D"), ids(crawl));
		assertEquals(Set.of(e("A", "C"), e("C", "D")), crawl.getEdges());
		assertEquals(1, crawl.getMissing());
		assertEquals(1, provider.requests.get("B"));
	}

	@Test
	void testMissingStart() throws Exception {
		LanguageCrawl crawl = new Crawler(new MapLinkProvider()).crawl("A", "en", 10);
		assertTrue(crawl.getVertices().isEmpty());
		assertTrue(crawl.getEdges().isEmpty());
	}

	@Test
	void testProviderErrorPropagates() {
		LinkProvider failing = (id, language) -> {
			if (id.equals("B")) {
				throw new ProviderException("connection reset");
			}
			return Collections.singletonList("B");
		};
		assertThrows(ProviderException.class, () -> new Crawler(failing).crawl("A", "en", 10));
	}

	@Test
	void testNoSelfLoopsAndNoRevisits() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "A", "B", "B", "C") //
				.link("B", "A", "B", "C") //
				.link("C", "C", "A", "B");
		LanguageCrawl crawl = new Crawler(provider).crawl("A", "en", 10);
		assertValid(crawl, 10);
		assertEquals(Set.of(e("A", "B"), e("A", "C"), e("B", "C")), crawl.getEdges());
		for (int requests : provider.requests.values()) {
			assertEquals(1, requests);
		}
	}

	@Test
	void testMaxLinksPerExpansion() throws Exception {
		MapLinkProvider provider = new MapLinkProvider() //
				.link("A", "B", "C", "D") //
				.link("B") //
				.link("C") //
				.link("D");
		Crawler crawler = new Crawler(provider);
		crawler.setMaxLinksPerExpansion(2);
		LanguageCrawl crawl = crawler.crawl("A", "en", 10);
		assertEquals(Set.of("A", "B", "C"), ids(crawl));
	}

	@Test
	void testInvalidBudget() {
		assertThrows(IllegalArgumentException.class, () -> new Crawler(new MapLinkProvider()).crawl("A", "en", 0));
	}

	@Test
	void testInterrupted() {
		MapLinkProvider provider = new MapLinkProvider().link("A", "B");
		Thread.currentThread().interrupt();
		try {
			assertThrows(InterruptedException.class, () -> new Crawler(provider).crawl("A", "en", 10));
		} finally {
			// clear the flag in case the crawler did not
			Thread.interrupted();
		}
	}
}
