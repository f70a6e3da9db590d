package works.wireparams.service;

import java.util.List;
import java.util.Optional;
import works.wireparams.Unit;
import works.wireparams.codec.NameGenerator;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.ParamTypes;

/**
 * Factories for {@link Service}s.
 */
public final class Services {
	private Services() { }

	/**
	 * Parameters whose keys start with this are reserved for dispatching,
	 * and are never seen by a service's parameter shapes.
	 */
	public static final String RESERVED_PREFIX = "__svc.";

	/**
	 * The GET parameter carrying the state code of an auxiliary service.
	 */
	public static final String STATE_PARAM = RESERVED_PREFIX + "state";

	public static <G> Service<G, Unit> service(List<String> path, ParamType<G> getParams) {
		return new Service<>(path, getParams, ParamTypes.unit(), ServiceKind.PUBLIC, Optional.empty(), Optional.empty());
	}

	/**
	 * A service answering form submissions to {@code fallback}'s URL.
	 * It takes the same GET parameters as {@code fallback}, and is of the same kind.
	 */
	public static <G, P> Service<G, P> postService(Service<G, ?> fallback, ParamType<P> postParams) {
		requireLocal(fallback);
		return new Service<>(fallback.path(), fallback.getParams(), postParams, fallback.kind(), fallback.state(), Optional.empty());
	}

	/**
	 * An auxiliary service at {@code fallback}'s path with the same parameters
	 * and a fresh state code.
	 * Typically registered for a short-lived purpose, like the target of one particular form.
	 */
	public static <G, P> Service<G, P> auxiliaryService(Service<G, P> fallback) {
		return auxiliaryService(fallback, fallback.getParams(), fallback.postParams());
	}

	public static <G> Service<G, Unit> auxiliaryService(Service<?, ?> fallback, ParamType<G> getParams) {
		return auxiliaryService(fallback, getParams, ParamTypes.unit());
	}

	public static <G, P> Service<G, P> auxiliaryService(Service<?, ?> fallback, ParamType<G> getParams, ParamType<P> postParams) {
		requireLocal(fallback);
		return new Service<>(fallback.path(), getParams, postParams, ServiceKind.AUXILIARY, Optional.of(nextStateCode()), Optional.empty());
	}

	/**
	 * @param site the scheme and authority, such as {@code https://example.com}
	 */
	public static <G, P> Service<G, P> externalService(String site, List<String> path, ParamType<G> getParams, ParamType<P> postParams) {
		if (site.isEmpty() || site.endsWith("/")) {
			throw new IllegalArgumentException("Site must be non-empty with no trailing slash: \"" + site + "\"");
		}
		return new Service<>(path, getParams, postParams, ServiceKind.EXTERNAL, Optional.empty(), Optional.of(site));
	}

	private static void requireLocal(Service<?, ?> fallback) {
		if (fallback.kind() == ServiceKind.EXTERNAL) {
			throw new IllegalArgumentException("Fallback can't be an external service: " + fallback);
		}
	}

	private static synchronized String nextStateCode() {
		return NameGenerator.code(++stateCounter);
	}

	private static int stateCounter = 0;
}
