/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.commoncrawl.langgraph.EdgeColor;
import org.commoncrawl.langgraph.KnowledgeGraph;
import org.commoncrawl.langgraph.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Read a graph written by {@link GraphWriter}.
 */
public class GraphReader {

	private static Logger LOG = LoggerFactory.getLogger(GraphReader.class);

	private GraphReader() {
	}

	public static KnowledgeGraph read(String basename) throws IOException {
		return read(GraphWriter.verticesPath(basename), GraphWriter.edgesPath(basename));
	}

	/**
	 * @throws IOException if a file cannot be read or contains an invalid line
	 */
	public static KnowledgeGraph read(Path verticesFile, Path edgesFile) throws IOException {
		KnowledgeGraph graph = new KnowledgeGraph();
		Int2ObjectOpenHashMap<Vertex> vertices = new Int2ObjectOpenHashMap<>();
		long lineNumber = 0;
		try (Stream<String> in = Files.lines(verticesFile, StandardCharsets.UTF_8)) {
			for (String line : (Iterable<String>) in::iterator) {
				lineNumber++;
				String[] fields = line.split("\t", -1);
				if (fields.length < 3) {
					throw new IOException("Invalid vertex line " + lineNumber + " in " + verticesFile + ": <" + line + ">");
				}
				int id = parseId(fields[0], verticesFile, lineNumber);
				Vertex v = new Vertex(TsvEscape.unescape(fields[1]), TsvEscape.unescape(fields[2]));
				if (vertices.put(id, v) != null || !graph.addVertex(v)) {
					throw new IOException("Duplicate vertex in line " + lineNumber + " of " + verticesFile);
				}
				for (int i = 3; i < fields.length; i++) {
					int sep = fields[i].indexOf('=');
					if (sep == -1) {
						throw new IOException("Invalid attribute in line " + lineNumber + " of " + verticesFile
								+ ": <" + fields[i] + ">");
					}
					graph.setAttribute(v, TsvEscape.unescape(fields[i].substring(0, sep)),
							TsvEscape.unescape(fields[i].substring(sep + 1)));
				}
			}
		}
		lineNumber = 0;
		try (Stream<String> in = Files.lines(edgesFile, StandardCharsets.UTF_8)) {
			for (String line : (Iterable<String>) in::iterator) {
				lineNumber++;
				String[] fields = line.split("\t", -1);
				if (fields.length != 3) {
					throw new IOException("Invalid edge line " + lineNumber + " in " + edgesFile + ": <" + line + ">");
				}
				Vertex from = vertices.get(parseId(fields[0], edgesFile, lineNumber));
				Vertex to = vertices.get(parseId(fields[1], edgesFile, lineNumber));
				if (from == null || to == null) {
					throw new IOException("Edge to unknown vertex in line " + lineNumber + " of " + edgesFile);
				}
				try {
					graph.addEdge(from, to, EdgeColor.fromLabel(fields[2]));
				} catch (IllegalArgumentException e) {
					throw new IOException("Invalid edge in line " + lineNumber + " of " + edgesFile, e);
				}
			}
		}
		LOG.info("Loaded {} from {} and {}", graph, verticesFile, edgesFile);
		return graph;
	}

	private static int parseId(String s, Path file, long lineNumber) throws IOException {
		try {
			return Integer.parseInt(s);
		} catch (NumberFormatException e) {
			throw new IOException("Invalid vertex ID in line " + lineNumber + " of " + file + ": " + s, e);
		}
	}
}
