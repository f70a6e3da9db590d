package works.wireparams.names;

import works.wireparams.codec.NameGenerator;

import static java.util.Objects.requireNonNull;

/**
 * A form offering either of two alternatives must also send {@link #discriminatorKey}
 * with {@link #firstValue()} or {@link #secondValue()}, typically from a hidden field or radio button.
 */
public record SumNames(String discriminatorKey, ParamNames left, ParamNames right) implements ParamNames {
	public SumNames {
		requireNonNull(discriminatorKey);
		requireNonNull(left);
		requireNonNull(right);
	}

	public String firstValue() {
		return NameGenerator.FIRST_ALTERNATIVE;
	}

	public String secondValue() {
		return NameGenerator.SECOND_ALTERNATIVE;
	}
}
