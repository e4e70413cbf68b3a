/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import java.text.BreakIterator;
import java.util.Locale;

/**
 * Utilities to cut document summaries to a character budget.
 */
public class Summaries {

	private Summaries() {
	}

	/**
	 * Truncate a text to at most {@code maxChars} characters. The text is cut
	 * after the last complete sentence which fits into the budget. If not even
	 * the first sentence fits, the text is cut hard at the budget.
	 *
	 * @param text     plain text
	 * @param maxChars character budget, values &lt;= 0 mean no limit
	 * @param locale   locale used to detect sentence boundaries
	 * @return truncated text, trailing whitespace removed
	 */
	public static String truncate(String text, int maxChars, Locale locale) {
		if (text == null) {
			return "";
		}
		if (maxChars <= 0 || text.length() <= maxChars) {
			return text.strip();
		}
		BreakIterator sentences = BreakIterator.getSentenceInstance(locale);
		sentences.setText(text);
		// last boundary at or before the budget
		int end = sentences.preceding(maxChars + 1);
		if (end == BreakIterator.DONE || end <= 0) {
			return text.substring(0, maxChars).strip();
		}
		return text.substring(0, end).strip();
	}

	public static String truncate(String text, int maxChars) {
		return truncate(text, maxChars, Locale.ROOT);
	}
}
