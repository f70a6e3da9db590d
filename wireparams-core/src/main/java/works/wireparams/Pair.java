package works.wireparams;

/**
 * The value of a {@link works.wireparams.shape.ProductNode product} of two parameter shapes.
 */
public record Pair<A, B>(A left, B right) {
	public static <A, B> Pair<A, B> of(A left, B right) {
		return new Pair<>(left, right);
	}
}
