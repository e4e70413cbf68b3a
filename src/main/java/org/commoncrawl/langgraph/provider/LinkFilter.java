/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter link targets extracted from a document: drop identifiers which
 * contain characters not allowed in a plain title (section anchors, namespace
 * prefixes, file names, lists) and links pointing back to the document itself.
 */
public class LinkFilter {

	private static final char[] BAD_CHARS = { '.', '#', ',', ':' };

	private LinkFilter() {
	}

	public static boolean isValidTitle(String title) {
		if (title == null || title.isEmpty()) {
			return false;
		}
		for (char c : BAD_CHARS) {
			if (title.indexOf(c) != -1) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param self  identifier of the document the links were extracted from
	 * @param links link targets in document order
	 * @return valid link targets, order preserved
	 */
	public static List<String> filter(String self, List<String> links) {
		List<String> res = new ArrayList<>(links.size());
		for (String link : links) {
			if (isValidTitle(link) && !link.equals(self)) {
				res.add(link);
			}
		}
		return res;
	}
}
