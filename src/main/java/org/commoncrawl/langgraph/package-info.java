/**
 * Sample multilingual graphs for testing graph algorithms. Vertices are
 * documents of a corpus organized by language, red edges are hyperlinks
 * between documents of the same language, blue edges connect documents which
 * are translations of each other. The sampled graph is perturbed by randomly
 * inverting the color of edges and removing edges.
 */
package org.commoncrawl.langgraph;
