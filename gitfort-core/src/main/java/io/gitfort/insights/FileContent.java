package io.gitfort.insights;

/**
 * A fetched file to scan.
 *
 * @param path repository path
 * @param content decoded text
 * @param size size in bytes as reported by the tree, or the text length when unknown
 */
public record FileContent(String path, String content, long size) {
}
