/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class TestSummaries {

	private static final String TEXT = "Algebra is a branch of mathematics. It studies structures. "
			+ "Elementary algebra deals with variables.";

	@Test
	void testNoTruncation() {
		assertEquals(TEXT, Summaries.truncate(TEXT, 0));
		assertEquals(TEXT, Summaries.truncate(TEXT, TEXT.length()));
		assertEquals("short", Summaries.truncate("short \n", 100));
		assertEquals("", Summaries.truncate(null, 10));
	}

	@Test
	void testSentenceBoundary() {
		assertEquals("Algebra is a branch of mathematics.", Summaries.truncate(TEXT, 40));
		assertEquals("Algebra is a branch of mathematics. It studies structures.", Summaries.truncate(TEXT, 60));
	}

	@Test
	void testHardCut() {
		assertEquals("Algebra is", Summaries.truncate(TEXT, 10));
	}
}
