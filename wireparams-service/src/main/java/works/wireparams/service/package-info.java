/**
 * Typed services on top of the parameter codec.
 * <p>
 * A {@link works.wireparams.service.Service} pairs a URL path with the shapes of its
 * GET and POST parameters. Applications register a handler for each service in a
 * {@link works.wireparams.service.ServiceTable}, which decodes incoming requests
 * and hands the typed values to the right handler.
 * {@link works.wireparams.service.Links} goes the other way, from typed values to URLs.
 * <p>
 * The HTTP layer itself is the application's business:
 * it turns each request into a {@link works.wireparams.service.RawRequest}
 * and maps the exceptions from {@link works.wireparams.service.exceptions} to responses.
 */
package works.wireparams.service;
