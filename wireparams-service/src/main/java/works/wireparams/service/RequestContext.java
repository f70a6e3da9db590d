package works.wireparams.service;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @param servicePath the registered path that matched
 * @param suffix the path segments that followed {@code servicePath}
 */
public record RequestContext(RawRequest request, List<String> servicePath, List<String> suffix) {
	public RequestContext {
		requireNonNull(request);
		servicePath = List.copyOf(servicePath);
		suffix = List.copyOf(suffix);
	}
}
