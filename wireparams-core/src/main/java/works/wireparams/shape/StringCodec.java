package works.wireparams.shape;

import java.util.function.Function;

/**
 * Converts values of a parameter type to and from their wire string.
 * {@link #parse} may throw any {@link RuntimeException} to reject a string;
 * the decoder reports it as an invalid parameter value.
 */
public interface StringCodec<T> {
	String print(T value);

	T parse(String raw);

	static <T> StringCodec<T> of(Function<String, T> ofString, Function<T, String> toString) {
		return new StringCodec<>() {
			@Override
			public String print(T value) {
				return toString.apply(value);
			}

			@Override
			public T parse(String raw) {
				return ofString.apply(raw);
			}

			@Override
			public String toString() {
				return "user";
			}
		};
	}
}
