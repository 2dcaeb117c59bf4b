package io.gitfort.insights;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Case-insensitive path globs anchored at both ends. {@code **} spans directories,
 * {@code *} stays within one path segment and {@code ?} is any single character. A leading
 * or inner {@code **}{@code /} may also match no directory at all, so {@code **}{@code /*.js}
 * matches {@code app.js}.
 */
public final class GlobMatcher {

	private final String glob;

	private final Pattern pattern;

	public GlobMatcher(String glob) {
		this.glob = glob;
		this.pattern = Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE);
	}

	public boolean matches(String path) {
		return pattern.matcher(path).matches();
	}

	public String getGlob() {
		return glob;
	}

	public static List<GlobMatcher> compile(List<String> globs) {
		return globs.stream().map(GlobMatcher::new).toList();
	}

	public static boolean anyMatch(List<GlobMatcher> matchers, String path) {
		return matchers.stream().anyMatch(matcher -> matcher.matches(path));
	}

	static String toRegex(String glob) {
		StringBuilder regex = new StringBuilder();
		StringBuilder literal = new StringBuilder();
		int i = 0;
		while (i < glob.length()) {
			char c = glob.charAt(i);
			if (c != '*' && c != '?') {
				literal.append(c);
				i++;
				continue;
			}
			flush(regex, literal);
			if (c == '?') {
				regex.append('.');
				i++;
			}
			else if (glob.startsWith("**/", i)) {
				regex.append("(?:.*/)?");
				i += 3;
			}
			else if (glob.startsWith("**", i)) {
				regex.append(".*");
				i += 2;
			}
			else {
				regex.append("[^/]*");
				i++;
			}
		}
		flush(regex, literal);
		return regex.toString();
	}

	private static void flush(StringBuilder regex, StringBuilder literal) {
		if (literal.length() > 0) {
			regex.append(Pattern.quote(literal.toString()));
			literal.setLength(0);
		}
	}

	@Override
	public String toString() {
		return glob;
	}

}
