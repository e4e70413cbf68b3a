/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.io;

/**
 * Escape and unescape field values of the tab-separated graph files: tab,
 * newline, carriage return and backslash are written as <code>\t</code>,
 * <code>\n</code>, <code>\r</code> and <code>\\</code>.
 */
class TsvEscape {

	private TsvEscape() {
	}

	static String escape(String s) {
		StringBuilder b = null;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			String rep;
			switch (c) {
			case '\\':
				rep = "\\\\";
				break;
			case '\t':
				rep = "\\t";
				break;
			case '\n':
				rep = "\\n";
				break;
			case '\r':
				rep = "\\r";
				break;
			default:
				rep = null;
			}
			if (rep != null && b == null) {
				b = new StringBuilder(s.length() + 16);
				b.append(s, 0, i);
			}
			if (b != null) {
				if (rep != null) {
					b.append(rep);
				} else {
					b.append(c);
				}
			}
		}
		return b == null ? s : b.toString();
	}

	static String unescape(String s) {
		if (s.indexOf('\\') == -1) {
			return s;
		}
		StringBuilder b = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c != '\\' || i + 1 == s.length()) {
				b.append(c);
				continue;
			}
			char n = s.charAt(++i);
			switch (n) {
			case 't':
				b.append('\t');
				break;
			case 'n':
				b.append('\n');
				break;
			case 'r':
				b.append('\r');
				break;
			default:
				b.append(n);
			}
		}
		return b.toString();
	}
}
