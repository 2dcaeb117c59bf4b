package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Public GitHub user profile with contribution totals of the current year.
 *
 * @param id GraphQL node id
 * @param databaseId numeric user id
 * @param login user login
 * @param name display name
 * @param email public email
 * @param avatarUrl avatar image URL
 * @param bio profile bio
 * @param company company field
 * @param location location field
 * @param websiteUrl personal website
 * @param twitterUsername twitter handle
 * @param createdAt account creation time
 * @param updatedAt last profile update
 * @param followers follower count
 * @param following following count
 * @param publicRepositories number of public repositories
 * @param totalCommitContributions commits in the current contribution window
 * @param totalIssueContributions issues opened in the window
 * @param totalPullRequestContributions pull requests opened in the window
 * @param totalPullRequestReviewContributions reviews submitted in the window
 */
public record UserProfile(String id, long databaseId, String login, @Nullable String name, @Nullable String email,
		@Nullable String avatarUrl, @Nullable String bio, @Nullable String company, @Nullable String location,
		@Nullable String websiteUrl, @Nullable String twitterUsername, @Nullable Instant createdAt,
		@Nullable Instant updatedAt, int followers, int following, int publicRepositories,
		int totalCommitContributions, int totalIssueContributions, int totalPullRequestContributions,
		int totalPullRequestReviewContributions) {
}
