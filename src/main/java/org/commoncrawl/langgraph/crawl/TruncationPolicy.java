/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.crawl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * How to select newly discovered links if there are more of them than the
 * remaining vertex budget allows to admit.
 */
public enum TruncationPolicy {

	/** keep the first links in document order */
	PREFIX {
		@Override
		public List<String> select(List<String> candidates, int budget, Random random) {
			if (candidates.size() <= budget) {
				return candidates;
			}
			return new ArrayList<>(candidates.subList(0, Math.max(budget, 0)));
		}
	},

	/**
	 * keep a uniformly drawn subset of links, the selected links keep their
	 * document order
	 */
	RANDOM_SUBSET {
		@Override
		public List<String> select(List<String> candidates, int budget, Random random) {
			if (candidates.size() <= budget) {
				return candidates;
			}
			if (budget <= 0) {
				return new ArrayList<>();
			}
			int[] perm = new int[candidates.size()];
			for (int i = 0; i < perm.length; i++) {
				perm[i] = i;
			}
			IntArrays.shuffle(perm, random);
			int[] selected = Arrays.copyOf(perm, budget);
			Arrays.sort(selected);
			List<String> res = new ArrayList<>(budget);
			for (int i : selected) {
				res.add(candidates.get(i));
			}
			return res;
		}
	};

	/**
	 * @param candidates links not yet known, in document order
	 * @param budget     number of vertices which may still be admitted
	 * @param random     random source, used only by randomized policies
	 * @return at most {@code budget} links
	 */
	public abstract List<String> select(List<String> candidates, int budget, Random random);

	public static TruncationPolicy fromName(String name) {
		switch (name.trim().toLowerCase(Locale.ROOT)) {
		case "prefix":
			return PREFIX;
		case "random":
		case "random_subset":
			return RANDOM_SUBSET;
		default:
			throw new IllegalArgumentException("Unknown truncation policy: " + name);
		}
	}
}
