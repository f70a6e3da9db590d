package works.wireparams.service;

/**
 * Called by {@link ServiceTable#dispatch} once both parameter groups have decoded successfully.
 *
 * @param <G> the decoded GET parameters
 * @param <P> the decoded POST parameters
 * @param <R> the response type of the application
 */
@FunctionalInterface
public interface ServiceHandler<G, P, R> {
	R handle(RequestContext context, G get, P post);
}
