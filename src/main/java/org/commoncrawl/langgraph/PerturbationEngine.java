/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Add sampling noise to a graph: every edge is independently inverted (its
 * color is toggled) with probability <i>p<sub>invert</sub></i> and removed with
 * probability <i>p<sub>remove</sub></i>.
 *
 * <p>
 * Edges are processed in the insertion order of the input graph, using a
 * snapshot of the edge set. For every edge two random draws are made, the
 * first decides about inversion, the second about removal, so an edge may be
 * inverted and removed. Given the same input graph and an identically seeded
 * random source the result is always the same.
 * </p>
 */
public class PerturbationEngine {

	private static Logger LOG = LoggerFactory.getLogger(PerturbationEngine.class);

	private final double invertProbability;
	private final double removeProbability;

	public PerturbationEngine(double invertProbability, double removeProbability) {
		checkProbability("inversion", invertProbability);
		checkProbability("removal", removeProbability);
		this.invertProbability = invertProbability;
		this.removeProbability = removeProbability;
	}

	private static void checkProbability(String name, double p) {
		if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
			throw new IllegalArgumentException("Edge " + name + " probability not in [0, 1]: " + p);
		}
	}

	/**
	 * @param graph  input graph, not modified
	 * @param random random source
	 * @return the perturbed copy of the graph
	 */
	public KnowledgeGraph perturb(KnowledgeGraph graph, Random random) {
		if (random == null) {
			throw new IllegalArgumentException("No random source given");
		}
		KnowledgeGraph res = new KnowledgeGraph(graph);
		List<Edge> snapshot = res.edgeSnapshot();
		long inverted = 0;
		long removed = 0;
		for (Edge edge : snapshot) {
			boolean invert = random.nextDouble() < invertProbability;
			boolean remove = random.nextDouble() < removeProbability;
			if (invert) {
				res.invertEdge(edge);
				inverted++;
			}
			if (remove) {
				res.removeEdge(edge);
				removed++;
			}
		}
		LOG.info("Perturbed {} edges: {} inverted (p = {}), {} removed (p = {})", snapshot.size(), inverted,
				invertProbability, removed, removeProbability);
		return res;
	}

	public static KnowledgeGraph perturb(KnowledgeGraph graph, double invertProbability,
			double removeProbability, Random random) {
		return new PerturbationEngine(invertProbability, removeProbability).perturb(graph, random);
	}
}
