package org.javai.extparams.source.http;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed HTTP source key: {@code [METHOD:]url[:body][#path]}.
 * <p>
 * Examples: {@code https://api/config#db.host}, {@code POST:https://api/lookup:{"id":1}#value}.
 * A body is only recognised for POST, PUT and PATCH. It is separated from the URL by the first
 * {@code :} inside the URL path, so ports and schemes are never mistaken for the separator.
 */
record HttpKey(String method, String url, String body, String path) {

	private static final Pattern METHOD_PREFIX = Pattern.compile("^(GET|POST|PUT|PATCH|DELETE):");

	static HttpKey parse(String key) {
		String method = "GET";
		String rest = key;
		Matcher matcher = METHOD_PREFIX.matcher(key);
		if (matcher.find()) {
			method = matcher.group(1);
			rest = key.substring(matcher.end());
		}

		String path = null;
		int hash = rest.indexOf('#');
		if (hash >= 0) {
			path = rest.substring(hash + 1);
			rest = rest.substring(0, hash);
		}

		String url = rest;
		String body = null;
		if (acceptsBody(method)) {
			int separator = bodySeparator(rest);
			if (separator >= 0) {
				url = rest.substring(0, separator);
				body = rest.substring(separator + 1);
			}
		}
		return new HttpKey(method, url, body, path == null || path.isEmpty() ? null : path);
	}

	static boolean acceptsBody(String method) {
		return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
	}

	private static int bodySeparator(String rest) {
		int scheme = rest.indexOf("://");
		if (scheme < 0) {
			return rest.indexOf(':');
		}
		int authorityStart = scheme + 3;
		int pathStart = rest.indexOf('/', authorityStart);
		if (pathStart >= 0) {
			return rest.indexOf(':', pathStart);
		}
		int candidate = rest.indexOf(':', authorityStart);
		while (candidate >= 0 && isPort(rest, candidate)) {
			candidate = rest.indexOf(':', candidate + 1);
		}
		return candidate;
	}

	private static boolean isPort(String rest, int colon) {
		int end = rest.indexOf(':', colon + 1);
		String digits = end < 0 ? rest.substring(colon + 1) : rest.substring(colon + 1, end);
		return !digits.isEmpty() && digits.chars().allMatch(Character::isDigit);
	}
}
