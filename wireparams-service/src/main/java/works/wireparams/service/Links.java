package works.wireparams.service;

import java.util.ArrayList;
import java.util.List;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.codec.Construction;
import works.wireparams.codec.ParamCodec;
import works.wireparams.codec.ParamCodecBuilder;
import works.wireparams.codec.QueryStrings;
import works.wireparams.names.ParamNames;

/**
 * Builds URLs and form field names that a {@link ServiceTable} will route back to a given service.
 */
public final class Links {
	private Links() { }

	public static <G> String uri(Service<G, ?> service, G getValue) {
		return uri(ParamCodecBuilder.defaultCodec(), service, getValue);
	}

	/**
	 * @return the service's path, followed by the URL suffix and query string encoding {@code getValue}.
	 * Relative to the site root, except for external services, whose URL includes their site.
	 */
	public static <G> String uri(ParamCodec codec, Service<G, ?> service, G getValue) {
		Construction construction = codec.construct(service.getParams(), getValue);
		List<String> segments = new ArrayList<>(service.path());
		construction.suffix().ifPresent(segments::addAll);
		List<Param> params = new ArrayList<>(hiddenParams(service));
		params.addAll(construction.params());

		StringBuilder sb = new StringBuilder(service.site().orElse(""));
		sb.append('/').append(QueryStrings.encodePath(segments));
		if (!params.isEmpty()) {
			sb.append('?').append(QueryStrings.encode(params));
		}
		return sb.toString();
	}

	/**
	 * @return the target of a form submitting to {@code service}; the fields supply the parameters
	 */
	public static String formAction(Service<?, ?> service) {
		return service.site().orElse("") + "/" + QueryStrings.encodePath(service.path());
	}

	/**
	 * @return the pairs a form must submit, besides its own fields, to reach {@code service}
	 */
	public static List<Param> hiddenParams(Service<?, ?> service) {
		return service.state()
			.map(s -> List.of(new Param(Services.STATE_PARAM, s)))
			.orElse(List.of());
	}

	/**
	 * @return the field names for the GET and POST parameters of {@code service}
	 */
	public static Pair<ParamNames, ParamNames> formNames(Service<?, ?> service) {
		return Pair.of(ParamNames.of(service.getParams()), ParamNames.of(service.postParams()));
	}
}
