package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

/**
 * One language of a repository with its size in bytes.
 *
 * @param name language name
 * @param color display color, when GitHub defines one
 * @param size bytes of code in this language
 */
public record LanguageShare(String name, @Nullable String color, long size) {

	/**
	 * Share of this language in the given total, in percent.
	 * @param totalSize total bytes across all languages
	 * @return percentage in [0, 100], 0 when the total is 0
	 */
	public double percentOf(long totalSize) {
		return totalSize > 0 ? (size * 100.0) / totalSize : 0.0;
	}

}
