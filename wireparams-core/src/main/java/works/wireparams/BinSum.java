package works.wireparams;

import static java.util.Objects.requireNonNull;

/**
 * The value of a {@link works.wireparams.shape.SumNode binary sum}:
 * exactly one of the two alternatives.
 */
public sealed interface BinSum<A, B> {
	static <A, B> BinSum<A, B> inj1(A value) {
		return new Inj1<>(value);
	}

	static <A, B> BinSum<A, B> inj2(B value) {
		return new Inj2<>(value);
	}

	record Inj1<A, B>(A value) implements BinSum<A, B> {
		public Inj1 {
			requireNonNull(value);
		}
	}

	record Inj2<A, B>(B value) implements BinSum<A, B> {
		public Inj2 {
			requireNonNull(value);
		}
	}
}
