package works.wireparams.service;

import java.util.List;
import java.util.Map;
import works.wireparams.FileInfo;
import works.wireparams.Param;
import works.wireparams.codec.QueryStrings;

/**
 * A request as it arrives from the HTTP layer, already split into its parts
 * but not yet interpreted.
 *
 * @param path the percent-decoded segments of the URL path
 * @param getParams the query-string pairs, in order
 * @param postParams the form-body pairs, in order
 * @param files uploaded files by field name
 */
public record RawRequest(
	List<String> path,
	List<Param> getParams,
	List<Param> postParams,
	Map<String, List<FileInfo>> files
) {
	public RawRequest {
		path = List.copyOf(path);
		getParams = List.copyOf(getParams);
		postParams = List.copyOf(postParams);
		files = Map.copyOf(files);
	}

	public static RawRequest get(List<String> path, List<Param> getParams) {
		return new RawRequest(path, getParams, List.of(), Map.of());
	}

	/**
	 * Parses a relative URI such as {@code /blog/2024/post?lang=en}.
	 *
	 * @throws IllegalArgumentException if the URI contains a malformed percent escape
	 */
	public static RawRequest fromUri(String uri) {
		String pathPart = uri;
		String query = "";
		int question = uri.indexOf('?');
		if (question >= 0) {
			pathPart = uri.substring(0, question);
			query = uri.substring(question + 1);
		}
		if (pathPart.startsWith("/")) {
			pathPart = pathPart.substring(1);
		}
		return get(QueryStrings.decodePath(pathPart), QueryStrings.decode(query));
	}

	public RawRequest withPost(List<Param> postParams, Map<String, List<FileInfo>> files) {
		return new RawRequest(path, getParams, postParams, files);
	}
}
