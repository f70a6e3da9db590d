package works.wireparams.codec;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.List;
import works.wireparams.Param;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.joining;

/**
 * Conversion between {@link Param} lists and their
 * {@code application/x-www-form-urlencoded} text, and between
 * path segments and their percent-encoded path text.
 */
public final class QueryStrings {
	private QueryStrings() { }

	public static String encode(List<Param> params) {
		return params.stream()
			.map(p -> URLEncoder.encode(p.key(), UTF_8) + "=" + URLEncoder.encode(p.value(), UTF_8))
			.collect(joining("&"));
	}

	/**
	 * A pair with no {@code =} gets an empty value; empty pairs are skipped.
	 *
	 * @throws IllegalArgumentException if the text contains a malformed percent escape
	 */
	public static List<Param> decode(String query) {
		List<Param> result = new ArrayList<>();
		if (query.isEmpty()) {
			return result;
		}
		for (String pair : query.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int eq = pair.indexOf('=');
			if (eq < 0) {
				result.add(new Param(URLDecoder.decode(pair, UTF_8), ""));
			} else {
				result.add(new Param(
					URLDecoder.decode(pair.substring(0, eq), UTF_8),
					URLDecoder.decode(pair.substring(eq + 1), UTF_8)));
			}
		}
		return result;
	}

	public static String encodePath(List<String> segments) {
		return segments.stream()
			.map(s -> URLEncoder.encode(s, UTF_8).replace("+", "%20"))
			.collect(joining("/"));
	}

	/**
	 * Inverse of {@link #encodePath}. Empty segments are kept.
	 */
	public static List<String> decodePath(String path) {
		List<String> result = new ArrayList<>();
		if (path.isEmpty()) {
			return result;
		}
		for (String segment : path.split("/", -1)) {
			// In a path, '+' is just a plus
			result.add(URLDecoder.decode(segment.replace("+", "%2B"), UTF_8));
		}
		return result;
	}
}
