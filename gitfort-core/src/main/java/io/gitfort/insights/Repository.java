package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A repository as listed by {@code GET /users/{username}/repos}.
 *
 * @param id numeric repository id
 * @param name repository name
 * @param fullName "owner/name"
 * @param owner owner login
 * @param isPrivate whether the repository is private
 * @param fork whether the repository is a fork
 * @param language primary language
 * @param defaultBranch default branch name
 * @param updatedAt last update
 */
public record Repository(long id, String name, String fullName, String owner, boolean isPrivate, boolean fork,
		@Nullable String language, @Nullable String defaultBranch, @Nullable Instant updatedAt) {
}
