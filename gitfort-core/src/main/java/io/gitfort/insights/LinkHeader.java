package io.gitfort.insights;

import org.jspecify.annotations.Nullable;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads pagination hints from a REST {@code Link} header such as
 * {@code <https://api.github.com/user/repos?page=2>; rel="next", <...?page=7>; rel="last"}.
 */
final class LinkHeader {

	private static final Pattern LINK = Pattern.compile("<([^>]*)>\\s*;\\s*rel=\"([^\"]+)\"");

	private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

	private LinkHeader() {
	}

	/**
	 * Page number of the {@code rel="last"} link.
	 * @param header raw header value, may be null
	 * @return last page, or empty when the header carries no last-page hint
	 */
	static OptionalInt lastPage(@Nullable String header) {
		if (header == null || header.isBlank()) {
			return OptionalInt.empty();
		}
		Matcher link = LINK.matcher(header);
		while (link.find()) {
			if ("last".equals(link.group(2))) {
				Matcher page = PAGE_PARAM.matcher(link.group(1));
				if (page.find()) {
					return OptionalInt.of(Integer.parseInt(page.group(1)));
				}
			}
		}
		return OptionalInt.empty();
	}

}
