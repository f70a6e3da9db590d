package works.wireparams.shape;

import java.util.HashSet;
import java.util.Set;
import works.wireparams.BinSum;

import static works.wireparams.shape.ShapeChecks.requireNoSuffix;

/**
 * Either {@code left} or {@code right}.
 * The choice travels in a reserved discriminator parameter
 * (see {@link works.wireparams.codec.NameGenerator#sumDiscriminator()}),
 * so the two sides may even use the same names.
 */
public record SumNode<T>(ParamType<T> left, ParamType<T> right) implements ParamType<BinSum<T, T>> {
	public SumNode {
		requireNoSuffix(left, "A sum");
		requireNoSuffix(right, "A sum");
	}

	@Override
	public Set<String> names() {
		Set<String> result = new HashSet<>(left.names());
		result.addAll(right.names());
		return Set.copyOf(result);
	}

	@Override
	public boolean containsSuffix() {
		return false;
	}

	/**
	 * This node takes the first discriminator, followed by those of {@code left}, then {@code right}.
	 */
	@Override
	public int sumCount() {
		return 1 + left.sumCount() + right.sumCount();
	}

	@Override
	public String toString() {
		return "sum(" + left + ", " + right + ")";
	}
}
