/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map.Entry;

import org.commoncrawl.langgraph.io.GraphWriter;
import org.commoncrawl.langgraph.io.WebGraphExport;
import org.commoncrawl.langgraph.provider.TsvCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tool to sample a multilingual graph from a corpus directory
 * (see {@link TsvCorpus}) and save it (see {@link GraphWriter}).
 */
public class SampleGraph {

	private static Logger LOG = LoggerFactory.getLogger(SampleGraph.class);

	/**
	 * Default output base name:
	 * <code>&lt;start&gt;_&lt;n&gt;_samples_&lt;p_invert&gt;_inversions_&lt;p_remove&gt;_removals_graph</code>
	 * where <i>start</i> is the start identifier of the first language and
	 * <i>n</i> the total vertex budget over all languages.
	 */
	public static String defaultBaseName(SamplerConfig config) {
		String firstLanguage = config.getLanguages().get(0);
		String start = config.getStartId(firstLanguage).replace('/', '_').replace(' ', '_');
		long samples = (long) config.getMaxVerticesPerLanguage() * config.getLanguages().size();
		return start + "_" + samples + "_samples_" + config.getInversionProbability() + "_inversions_"
				+ config.getRemovalProbability() + "_removals_graph";
	}

	private static void showHelp() {
		System.err.println("SampleGraph [options]... <corpus_dir> <config> [<output_basename>]");
		System.err.println("");
		System.err.println("Sample a multilingual graph: crawl the links of every configured language,");
		System.err.println("connect translations across languages, invert and remove edges at random.");
		System.err.println("");
		System.err.println("Options:");
		System.err.println(" -h\t(also -? or --help) show usage message and exit");
		System.err.println(" --seed <n>\tseed of the random source (overrides the configuration)");
		System.err.println(" --webgraph\talso store the red and blue edges as BVGraphs");
		System.err.println("          \t<output_basename>-red and <output_basename>-blue");
		System.err.println("");
		System.err.println("Input / output parameters");
		System.err.println(" <corpus_dir>\tdirectory holding the corpus files links.tsv, langlinks.tsv");
		System.err.println("            \tand optionally pages.tsv and disambiguation.tsv");
		System.err.println(" <config>\tproperties file with the sampling configuration");
		System.err.println(" <output_basename>\tthe graph is written to <output_basename>.vertices.tsv");
		System.err.println("                  \tand <output_basename>.edges.tsv. If not given, the name");
		System.err.println("                  \tis derived from the configuration.");
	}

	public static void main(String[] args) {
		Long seed = null;
		boolean webgraph = false;
		int argpos = 0;
		while (argpos < args.length && args[argpos].startsWith("-")) {
			switch (args[argpos]) {
			case "-?":
			case "-h":
			case "--help":
				showHelp();
				System.exit(0);
			case "--seed":
				try {
					seed = Long.parseLong(args[++argpos]);
				} catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
					LOG.error("Invalid or missing seed");
					System.exit(1);
				}
				break;
			case "--webgraph":
				webgraph = true;
				break;
			default:
				System.err.println("Unknown option " + args[argpos]);
				showHelp();
				System.exit(1);
			}
			argpos++;
		}
		if ((args.length - argpos) < 2) {
			showHelp();
			System.exit(1);
		}
		String corpusDir = args[argpos];
		String configFile = args[argpos + 1];

		SamplerConfig config = null;
		try {
			config = SamplerConfig.load(Paths.get(configFile));
			if (seed != null) {
				config.setSeed(seed);
			}
		} catch (IOException e) {
			LOG.error("Failed to read configuration {}", configFile, e);
			System.exit(1);
		} catch (IllegalArgumentException e) {
			LOG.error("Invalid configuration {}: {}", configFile, e.getMessage());
			System.exit(1);
		}
		String basename = (args.length - argpos) > 2 ? args[argpos + 2] : defaultBaseName(config);
		LOG.info("{}", config);

		TsvCorpus corpus = null;
		try {
			corpus = TsvCorpus.load(Paths.get(corpusDir));
		} catch (IOException e) {
			LOG.error("Failed to load corpus from {}", corpusDir, e);
			System.exit(1);
		}

		LanguageGraphSampler sampler = new LanguageGraphSampler(config, corpus, corpus);
		sampler.setContentProvider(corpus);
		KnowledgeGraph graph = null;
		try {
			graph = sampler.sample();
		} catch (InterruptedException e) {
			LOG.error("Interrupted while sampling the graph");
			Thread.currentThread().interrupt();
			System.exit(1);
		}
		for (Entry<String, String> e : sampler.getAbandonedLanguages().entrySet()) {
			LOG.warn("Language {} is missing in the graph: {}", e.getKey(), e.getValue());
		}
		LOG.info("Sampled {} (seed = {})", graph, sampler.getSeed());

		try {
			GraphWriter.write(graph, basename);
			if (webgraph) {
				WebGraphExport.store(graph, basename);
			}
		} catch (IOException e) {
			LOG.error("Failed to save graph {}", basename, e);
			System.exit(1);
		}
	}
}
