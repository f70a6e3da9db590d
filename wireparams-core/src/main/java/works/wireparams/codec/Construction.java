package works.wireparams.codec;

import java.util.List;
import java.util.Optional;
import works.wireparams.Param;

import static java.util.Objects.requireNonNull;

/**
 * The wire form of a parameter value.
 *
 * @param suffix the URL path segments, present if and only if the shape reads the URL suffix
 * @param params the query-string or form-body pairs, in a deterministic order
 */
public record Construction(Optional<List<String>> suffix, List<Param> params) {
	public Construction {
		suffix = requireNonNull(suffix).map(List::copyOf);
		params = List.copyOf(params);
	}

	/**
	 * @return {@link #params} in {@code application/x-www-form-urlencoded} form
	 */
	public String queryString() {
		return QueryStrings.encode(params);
	}

	/**
	 * @return the suffix segments, percent-encoded and joined with {@code /}
	 */
	public Optional<String> suffixPath() {
		return suffix.map(QueryStrings::encodePath);
	}

	/**
	 * @return the suffix path, if any, followed by the query string, if any,
	 * ready to be appended to a service's path
	 */
	public String relativeUri() {
		String path = suffixPath().orElse("");
		return params.isEmpty()? path : path + "?" + queryString();
	}
}
