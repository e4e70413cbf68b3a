/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.commoncrawl.langgraph.crawl.Crawler;
import org.commoncrawl.langgraph.crawl.LanguageCrawl;
import org.commoncrawl.langgraph.crawl.LinkProvider;
import org.commoncrawl.langgraph.provider.ContentCapture;
import org.commoncrawl.langgraph.provider.ContentProvider;
import org.commoncrawl.langgraph.provider.ProviderException;
import org.commoncrawl.langgraph.translate.CliqueBuilder;
import org.commoncrawl.langgraph.translate.TranslationProvider;
import org.commoncrawl.langgraph.translate.TranslationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.Util;
import it.unimi.dsi.util.XoRoShiRo128PlusPlusRandom;

/**
 * Sample a multilingual graph: crawl the link structure of every configured
 * language, connect translations across languages, merge everything into one
 * graph and perturb it.
 *
 * <p>
 * The languages are crawled in parallel on a bounded thread pool, every
 * language by its own {@link Crawler} with its own random source. All crawls
 * are joined before translations are looked up (again in parallel per
 * language), because the translation cliques need the vertices of all
 * languages. A language whose crawl fails with a provider error, times out or
 * is cancelled is abandoned: none of its vertices go into the graph, the other
 * languages are not affected.
 * </p>
 *
 * <p>
 * All random sources are derived from one seed in the order of the configured
 * languages: first one crawl seed per language, then the language colors,
 * then the perturbation seed. A run is therefore reproducible given the seed
 * and the same provider responses.
 * </p>
 */
public class LanguageGraphSampler {

	private static Logger LOG = LoggerFactory.getLogger(LanguageGraphSampler.class);

	private final SamplerConfig config;
	private final LinkProvider linkProvider;
	private final TranslationProvider translationProvider;
	private ContentProvider contentProvider = null;

	private long seed;
	private final Map<String, String> abandonedLanguages = new LinkedHashMap<>();
	private KnowledgeGraph assembled = null;

	public LanguageGraphSampler(SamplerConfig config, LinkProvider linkProvider,
			TranslationProvider translationProvider) {
		this.config = config;
		this.linkProvider = linkProvider;
		this.translationProvider = translationProvider;
	}

	/**
	 * @param contentProvider provider of vertex content, required if content
	 *                        capture is enabled
	 */
	public void setContentProvider(ContentProvider contentProvider) {
		this.contentProvider = contentProvider;
	}

	/**
	 * @return the seed used by the last run
	 */
	public long getSeed() {
		return seed;
	}

	/**
	 * @return languages abandoned in the last run and the reason why
	 */
	public Map<String, String> getAbandonedLanguages() {
		return Collections.unmodifiableMap(abandonedLanguages);
	}

	/**
	 * @return the graph of the last run before perturbation
	 */
	public KnowledgeGraph getAssembledGraph() {
		return assembled;
	}

	/**
	 * Run the sampling pipeline.
	 *
	 * @return the sampled (perturbed) graph
	 * @throws IllegalArgumentException if the configuration is invalid
	 * @throws InterruptedException     if the calling thread is interrupted while
	 *                                  waiting for the crawls
	 */
	public KnowledgeGraph sample() throws InterruptedException {
		config.validate();
		if (config.isContentCapture() && contentProvider == null) {
			throw new IllegalArgumentException("Content capture enabled but no content provider given");
		}
		abandonedLanguages.clear();
		assembled = null;
		List<String> languages = config.getLanguages();

		seed = config.getSeed() != null ? config.getSeed() : Util.randomSeed();
		LOG.info("Sampling graph for languages {} (seed = {})", languages, seed);
		Random master = new XoRoShiRo128PlusPlusRandom(seed);
		Map<String, Long> crawlSeeds = new LinkedHashMap<>();
		for (String language : languages) {
			crawlSeeds.put(language, master.nextLong());
		}
		Map<String, String> languageColors = GraphAssembler.randomLanguageColors(languages, master);
		long perturbationSeed = master.nextLong();

		Map<String, LanguageCrawl> crawls;
		Map<String, Map<Vertex, Map<String, String>>> translationTables;
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getCrawlThreads(), languages.size()));
		try {
			crawls = crawlLanguages(executor, crawlSeeds);
			translationTables = resolveTranslations(executor, crawls);
		} finally {
			executor.shutdownNow();
		}

		Map<String, Set<Vertex>> perLanguageVertices = new LinkedHashMap<>();
		Set<Edge> redEdges = new LinkedHashSet<>();
		for (LanguageCrawl crawl : crawls.values()) {
			Map<Vertex, Map<String, String>> table = translationTables.get(crawl.getLanguage());
			if (table != null && table.size() < crawl.getVertices().size()) {
				// documents never expanded by the crawler, found missing by the lookup
				int before = crawl.getVertices().size();
				crawl = crawl.retainVertices(table.keySet());
				LOG.info("Removed {} missing documents from language {}", before - crawl.getVertices().size(),
						crawl.getLanguage());
			}
			perLanguageVertices.put(crawl.getLanguage(), crawl.getVertices());
			redEdges.addAll(crawl.getEdges());
		}
		Set<Edge> blueEdges = new CliqueBuilder().buildCliqueEdges(translationTables.values(),
				GraphAssembler.union(perLanguageVertices));

		GraphAssembler assembler = new GraphAssembler();
		assembler.setLanguageColors(languageColors);
		KnowledgeGraph graph = assembler.assemble(perLanguageVertices, redEdges, blueEdges);
		if (config.isContentCapture()) {
			new ContentCapture(contentProvider, config.getContentMaxChars()).capture(graph);
		}
		assembled = graph;

		return PerturbationEngine.perturb(graph, config.getInversionProbability(), config.getRemovalProbability(),
				new XoRoShiRo128PlusPlusRandom(perturbationSeed));
	}

	private Map<String, LanguageCrawl> crawlLanguages(ExecutorService executor, Map<String, Long> crawlSeeds)
			throws InterruptedException {
		Map<String, Future<LanguageCrawl>> futures = new LinkedHashMap<>();
		for (Entry<String, Long> e : crawlSeeds.entrySet()) {
			String language = e.getKey();
			String startId = config.getStartId(language);
			Crawler crawler = new Crawler(linkProvider, config.getTruncationPolicy(),
					new XoRoShiRo128PlusPlusRandom(e.getValue()));
			crawler.setMaxLinksPerExpansion(config.getMaxLinksPerExpansion());
			LOG.info("Crawling up to {} vertices for language {} starting from {}",
					config.getMaxVerticesPerLanguage(), language, startId);
			futures.put(language,
					executor.submit(() -> crawler.crawl(startId, language, config.getMaxVerticesPerLanguage())));
		}
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getCrawlTimeoutSeconds());
		Map<String, LanguageCrawl> crawls = new LinkedHashMap<>();
		for (Entry<String, Future<LanguageCrawl>> e : futures.entrySet()) {
			LanguageCrawl crawl = join(e.getKey(), "crawl", e.getValue(), deadline);
			if (crawl != null) {
				crawls.put(e.getKey(), crawl);
			}
		}
		LOG.info("Completed crawls for {} of {} languages", crawls.size(), crawlSeeds.size());
		return crawls;
	}

	private Map<String, Map<Vertex, Map<String, String>>> resolveTranslations(ExecutorService executor,
			Map<String, LanguageCrawl> crawls) throws InterruptedException {
		Set<String> targetLanguages = crawls.keySet();
		TranslationResolver resolver = new TranslationResolver(translationProvider);
		Map<String, Future<Map<Vertex, Map<String, String>>>> futures = new LinkedHashMap<>();
		for (LanguageCrawl crawl : crawls.values()) {
			Callable<Map<Vertex, Map<String, String>>> task = () -> resolver.resolve(crawl.getVertices(),
					crawl.getLanguage(), targetLanguages);
			futures.put(crawl.getLanguage(), executor.submit(task));
		}
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getCrawlTimeoutSeconds());
		Map<String, Map<Vertex, Map<String, String>>> tables = new LinkedHashMap<>();
		for (Entry<String, Future<Map<Vertex, Map<String, String>>>> e : futures.entrySet()) {
			Map<Vertex, Map<String, String>> table = join(e.getKey(), "translation lookup", e.getValue(), deadline);
			if (table != null) {
				tables.put(e.getKey(), table);
			}
		}
		return tables;
	}

	/**
	 * Wait for the task of one language.
	 *
	 * @return the result or null if the task failed with a provider error,
	 *         timed out or was cancelled
	 * @throws RuntimeException any other failure of the task is rethrown
	 */
	private <T> T join(String language, String stage, Future<T> future, long deadline) throws InterruptedException {
		String reason;
		try {
			if (config.getCrawlTimeoutSeconds() > 0) {
				return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
			}
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (!(cause instanceof ProviderException || cause instanceof InterruptedException)) {
				if (cause instanceof RuntimeException) {
					throw (RuntimeException) cause;
				}
				if (cause instanceof Error) {
					throw (Error) cause;
				}
				throw new IllegalStateException("Unexpected failure in " + stage + " of language " + language, cause);
			}
			LOG.error("Failed {} of language {}:", stage, language, cause);
			reason = stage + " failed: " + cause;
		} catch (TimeoutException e) {
			future.cancel(true);
			LOG.error("Cancelled {} of language {} after timeout of {} seconds", stage, language,
					config.getCrawlTimeoutSeconds());
			reason = stage + " timed out";
		} catch (CancellationException e) {
			LOG.error("The {} of language {} was cancelled", stage, language);
			reason = stage + " cancelled";
		}
		if (stage.equals("crawl")) {
			abandonedLanguages.put(language, reason);
		} else {
			LOG.error("Translations of language {} are ignored", language);
		}
		return null;
	}

	/**
	 * @return all languages which completed their crawl in the last run
	 */
	public List<String> getCompletedLanguages() {
		List<String> res = new ArrayList<>(config.getLanguages());
		res.removeAll(abandonedLanguages.keySet());
		return res;
	}
}
