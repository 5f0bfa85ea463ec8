/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.util;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null} and not blank
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Strips a single trailing slash so that {@code /messages/} and {@code /messages}
	 * resolve to the same route. The root path is returned unchanged.
	 * @param path the request path, may be {@code null}
	 * @return the normalized path, or an empty string for {@code null}
	 */
	public static String stripTrailingSlash(@Nullable String path) {
		if (path == null) {
			return "";
		}
		if (path.length() > 1 && path.endsWith("/")) {
			return path.substring(0, path.length() - 1);
		}
		return path;
	}

}
