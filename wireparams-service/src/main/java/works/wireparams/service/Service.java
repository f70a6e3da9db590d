package works.wireparams.service;

import java.util.List;
import java.util.Optional;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.UnitNode;

import static java.util.Objects.requireNonNull;

/**
 * A typed entry point of a web application: a URL path plus the shapes of the
 * GET and POST parameters it takes.
 * Built with the factories in {@link Services}.
 *
 * @param path the URL path segments; for an {@link ServiceKind#EXTERNAL external} service,
 *             the segments following {@link #site}
 * @param state the state code of an {@link ServiceKind#AUXILIARY auxiliary} service, empty otherwise
 * @param site the scheme and authority of an external service, such as {@code https://example.com};
 *             empty otherwise
 */
public record Service<G, P>(
	List<String> path,
	ParamType<G> getParams,
	ParamType<P> postParams,
	ServiceKind kind,
	Optional<String> state,
	Optional<String> site
) {
	public Service {
		path = List.copyOf(path);
		requireNonNull(getParams);
		requireNonNull(postParams);
		requireNonNull(kind);
		requireNonNull(state);
		requireNonNull(site);
		for (String segment : path) {
			if (segment.contains("/")) {
				throw new IllegalArgumentException("Path segment can't contain a slash: \"" + segment + "\"");
			}
		}
		if (state.isPresent() != (kind == ServiceKind.AUXILIARY)) {
			throw new IllegalArgumentException("Only auxiliary services have a state code: " + kind + " " + state);
		}
		if (site.isPresent() != (kind == ServiceKind.EXTERNAL)) {
			throw new IllegalArgumentException("Only external services have a site: " + kind + " " + site);
		}
		if (postParams.containsSuffix()) {
			throw new IllegalArgumentException("POST parameters can't read the URL suffix");
		}
	}

	public boolean isPost() {
		return !(postParams instanceof UnitNode);
	}

	/**
	 * A service whose GET parameters read the URL suffix also answers
	 * requests for any path below its own.
	 */
	public boolean takesSuffix() {
		return getParams.containsSuffix();
	}

	@Override
	public String toString() {
		return kind + ":" + site.orElse("") + "/" + String.join("/", path)
			+ state.map(s -> "[" + s + "]").orElse("")
			+ "(" + getParams + ", " + postParams + ")";
	}
}
