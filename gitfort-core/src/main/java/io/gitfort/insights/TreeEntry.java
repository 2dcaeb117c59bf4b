package io.gitfort.insights;

/**
 * A file (blob) in a repository tree.
 *
 * @param path path relative to the repository root
 * @param size size in bytes
 */
public record TreeEntry(String path, long size) {
}
