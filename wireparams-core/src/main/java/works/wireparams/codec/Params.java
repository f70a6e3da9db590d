package works.wireparams.codec;

import java.util.List;
import works.wireparams.Param;

import static java.util.stream.Collectors.toUnmodifiableList;

public final class Params {
	private Params() { }

	/**
	 * @return {@code params} without the pairs whose key starts with {@code prefix}
	 */
	public static List<Param> removePrefixed(String prefix, List<Param> params) {
		return params.stream()
			.filter(p -> !p.key().startsWith(prefix))
			.collect(toUnmodifiableList());
	}

	/**
	 * @return the pairs whose key starts with {@code prefix}
	 */
	public static List<Param> withPrefix(String prefix, List<Param> params) {
		return params.stream()
			.filter(p -> p.key().startsWith(prefix))
			.collect(toUnmodifiableList());
	}
}
