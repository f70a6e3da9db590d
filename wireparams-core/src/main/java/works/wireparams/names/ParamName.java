package works.wireparams.names;

import static java.util.Objects.requireNonNull;

/**
 * The wire key of one leaf parameter.
 *
 * @param <T> the type of value the field carries; not checked at runtime
 */
public record ParamName<T>(String key, Multiplicity multiplicity) implements ParamNames {
	public ParamName {
		requireNonNull(key);
		requireNonNull(multiplicity);
	}

	@Override
	public String toString() {
		return key;
	}
}
