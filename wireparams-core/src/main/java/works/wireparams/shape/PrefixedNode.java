package works.wireparams.shape;

import java.util.Set;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toUnmodifiableSet;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * The same shape as {@code inner}, with every key it uses prefixed by {@code prefix}.
 */
public record PrefixedNode<T>(String prefix, ParamType<T> inner) implements ParamType<T> {
	public PrefixedNode {
		requireName(prefix, "Prefix");
		requireNonNull(inner);
	}

	@Override
	public Set<String> names() {
		return inner.names().stream()
			.map(n -> prefix + n)
			.collect(toUnmodifiableSet());
	}

	@Override
	public boolean containsSuffix() {
		return inner.containsSuffix();
	}

	@Override
	public int sumCount() {
		return inner.sumCount();
	}

	@Override
	public String toString() {
		return "prefixed(" + prefix + ", " + inner + ")";
	}
}
