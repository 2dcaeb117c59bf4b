package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Repository metadata fetched through GraphQL.
 *
 * @param id GraphQL node id
 * @param databaseId numeric repository id
 * @param name repository name
 * @param nameWithOwner "owner/name"
 * @param description repository description
 * @param url repository URL
 * @param homepageUrl project homepage
 * @param isPrivate whether the repository is private
 * @param isFork whether the repository is a fork
 * @param isArchived whether the repository is archived
 * @param createdAt creation time
 * @param updatedAt last update
 * @param pushedAt last push
 * @param stargazerCount stars
 * @param forkCount forks
 * @param watchers watcher count
 * @param openIssues open issue count
 * @param openPullRequests open pull request count
 * @param releases release count
 * @param primaryLanguage primary language name
 * @param licenseSpdxId SPDX id of the license
 * @param defaultBranch default branch name
 */
public record RepositoryDetails(String id, long databaseId, String name, String nameWithOwner,
		@Nullable String description, String url, @Nullable String homepageUrl, boolean isPrivate, boolean isFork,
		boolean isArchived, @Nullable Instant createdAt, @Nullable Instant updatedAt, @Nullable Instant pushedAt,
		int stargazerCount, int forkCount, int watchers, int openIssues, int openPullRequests, int releases,
		@Nullable String primaryLanguage, @Nullable String licenseSpdxId, @Nullable String defaultBranch) {
}
