package works.wireparams.shape;

import java.util.HashSet;
import java.util.Set;
import works.wireparams.Pair;
import works.wireparams.exceptions.InvalidParamShapeException;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireDisjoint;

/**
 * Both {@code left} and {@code right}, whose names must not overlap.
 * At most one side may read the URL suffix.
 * Decoding goes left to right, so {@link AnyNode any()} may only be followed by shapes that read no parameters.
 */
public record ProductNode<A, B>(ParamType<A> left, ParamType<B> right) implements ParamType<Pair<A, B>> {
	public ProductNode {
		requireNonNull(left);
		requireNonNull(right);
		if (left.containsSuffix() && right.containsSuffix()) {
			throw new InvalidParamShapeException("Only one side of a product may read the URL suffix: " + left + " ** " + right);
		}
		requireDisjoint(left, right);
		if (ShapeChecks.claimsAllParams(left) && ShapeChecks.readsParams(right)) {
			throw new InvalidParamShapeException("Nothing is left for the right side of a product after any(): " + left + " ** " + right);
		}
	}

	@Override
	public Set<String> names() {
		Set<String> result = new HashSet<>(left.names());
		result.addAll(right.names());
		return Set.copyOf(result);
	}

	@Override
	public boolean containsSuffix() {
		return left.containsSuffix() || right.containsSuffix();
	}

	@Override
	public int sumCount() {
		return left.sumCount() + right.sumCount();
	}

	@Override
	public String toString() {
		return "(" + left + " ** " + right + ")";
	}
}
