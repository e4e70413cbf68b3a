/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2026 Common Crawl and contributors
 */
package org.commoncrawl.langgraph.provider;

/**
 * Failure of an external document provider. Unless a subclass says otherwise
 * the failure is transient (network error, rate limiting, timeout) and
 * retrying is left to the provider.
 */
public class ProviderException extends Exception {

	private static final long serialVersionUID = 1L;

	public ProviderException(String message) {
		super(message);
	}

	public ProviderException(String message, Throwable cause) {
		super(message, cause);
	}
}
