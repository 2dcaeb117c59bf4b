package io.gitfort.insights;

import java.util.List;

/**
 * File selection for a repository scan. A path is scanned when it matches no exclude glob
 * and at least one include glob.
 *
 * @param maxFileSize files larger than this many bytes are skipped
 * @param excludePatterns globs of paths never scanned
 * @param includePatterns globs of paths eligible for scanning
 * @param maxFiles at most this many eligible files are considered
 */
public record ScanOptions(long maxFileSize, List<String> excludePatterns, List<String> includePatterns,
		int maxFiles) {

	public static final long DEFAULT_MAX_FILE_SIZE = 1024 * 1024;

	public static final int DEFAULT_MAX_FILES = 500;

	public static final List<String> DEFAULT_EXCLUDES = List.of("node_modules/**", ".git/**", "*.min.js",
			"*.bundle.js", "dist/**", "build/**", "coverage/**", "*.log");

	public static final List<String> DEFAULT_INCLUDES = List.of("**/*.js", "**/*.ts", "**/*.jsx", "**/*.tsx",
			"**/*.py", "**/*.java", "**/*.php", "**/*.rb", "**/*.go", "**/*.rs", "**/*.cpp", "**/*.c", "**/*.h",
			"**/*.env*", "**/*.config.*", "**/*.json", "**/*.yaml", "**/*.yml", "**/*.xml", "**/*.properties",
			"**/*.ini", "**/*.conf");

	public ScanOptions {
		if (maxFileSize <= 0 || maxFiles <= 0) {
			throw new IllegalArgumentException("maxFileSize and maxFiles must be positive");
		}
		excludePatterns = List.copyOf(excludePatterns);
		includePatterns = List.copyOf(includePatterns);
	}

	public static ScanOptions defaults() {
		return new ScanOptions(DEFAULT_MAX_FILE_SIZE, DEFAULT_EXCLUDES, DEFAULT_INCLUDES, DEFAULT_MAX_FILES);
	}

	public static ScanOptions from(GitFortProperties properties) {
		return new ScanOptions(properties.getMaxFileSize(), DEFAULT_EXCLUDES, DEFAULT_INCLUDES,
				properties.getMaxFiles());
	}

	public ScanOptions withMaxFiles(int maxFiles) {
		return new ScanOptions(maxFileSize, excludePatterns, includePatterns, maxFiles);
	}

	public ScanOptions withMaxFileSize(long maxFileSize) {
		return new ScanOptions(maxFileSize, excludePatterns, includePatterns, maxFiles);
	}

}
