package works.wireparams;

import static java.util.Objects.requireNonNull;

/**
 * One key/value pair of a query string or form body, already percent-decoded.
 */
public record Param(String key, String value) {
	public Param {
		requireNonNull(key);
		requireNonNull(value);
	}

	public static Param of(String key, String value) {
		return new Param(key, value);
	}

	@Override
	public String toString() {
		return key + "=" + value;
	}
}
