package io.gitfort.insights;

import java.util.List;

/**
 * Top languages of a repository ordered by size, largest first.
 *
 * @param languages at most ten languages
 * @param totalSize total bytes across all languages of the repository
 */
public record RepositoryLanguages(List<LanguageShare> languages, long totalSize) {
}
