/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.translate;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Union-find (disjoint-set forest) over arbitrary elements with path
 * compression and union by rank. Elements are mapped to dense integer IDs in
 * the order they are added.
 */
public class DisjointSets<T> {

	private final Object2IntOpenHashMap<T> ids = new Object2IntOpenHashMap<>();
	private final ObjectArrayList<T> elements = new ObjectArrayList<>();
	private final IntArrayList parent = new IntArrayList();
	private final IntArrayList rank = new IntArrayList();

	public DisjointSets() {
		ids.defaultReturnValue(-1);
	}

	/**
	 * Add an element as singleton set, no-op if the element is already known.
	 *
	 * @return the ID of the element
	 */
	public int add(T element) {
		int id = ids.getInt(element);
		if (id != -1) {
			return id;
		}
		id = elements.size();
		ids.put(element, id);
		elements.add(element);
		parent.add(id);
		rank.add(0);
		return id;
	}

	public boolean contains(T element) {
		return ids.containsKey(element);
	}

	public int size() {
		return elements.size();
	}

	private int find(int id) {
		int root = id;
		while (parent.getInt(root) != root) {
			root = parent.getInt(root);
		}
		// path compression
		while (parent.getInt(id) != root) {
			int next = parent.getInt(id);
			parent.set(id, root);
			id = next;
		}
		return root;
	}

	/**
	 * @return the representative of the set containing {@code element}
	 */
	public T find(T element) {
		int id = ids.getInt(element);
		if (id == -1) {
			throw new IllegalArgumentException("Unknown element: " + element);
		}
		return elements.get(find(id));
	}

	/**
	 * Merge the sets of two elements, elements not yet known are added.
	 *
	 * @return true if the two elements were in different sets before
	 */
	public boolean union(T a, T b) {
		int ra = find(add(a));
		int rb = find(add(b));
		if (ra == rb) {
			return false;
		}
		int rankA = rank.getInt(ra);
		int rankB = rank.getInt(rb);
		if (rankA < rankB) {
			parent.set(ra, rb);
		} else if (rankA > rankB) {
			parent.set(rb, ra);
		} else {
			parent.set(rb, ra);
			rank.set(ra, rankA + 1);
		}
		return true;
	}

	public boolean connected(T a, T b) {
		int ia = ids.getInt(a);
		int ib = ids.getInt(b);
		if (ia == -1 || ib == -1) {
			return false;
		}
		return find(ia) == find(ib);
	}

	/**
	 * @return all sets; sets are ordered by their first added element and the
	 *         members of a set keep the order in which they were added
	 */
	public List<List<T>> sets() {
		Int2ObjectLinkedOpenHashMap<List<T>> sets = new Int2ObjectLinkedOpenHashMap<>();
		for (int id = 0; id < elements.size(); id++) {
			int root = find(id);
			List<T> members = sets.get(root);
			if (members == null) {
				members = new ArrayList<>();
				sets.put(root, members);
			}
			members.add(elements.get(id));
		}
		return new ArrayList<>(sets.values());
	}
}
