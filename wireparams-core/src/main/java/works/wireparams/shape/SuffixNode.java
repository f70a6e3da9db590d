package works.wireparams.shape;

import java.util.Set;
import works.wireparams.exceptions.InvalidParamShapeException;

import static java.util.Objects.requireNonNull;

/**
 * Reads {@code inner} from the URL path segments that follow the service's path,
 * one segment per component, in order.
 */
public record SuffixNode<T>(ParamType<T> inner) implements ParamType<T> {
	public SuffixNode {
		requireNonNull(inner);
		if (inner instanceof SuffixNode<?>) {
			throw new InvalidParamShapeException("Nested suffix: " + inner);
		}
		ShapeChecks.requireSuffixable(inner);
	}

	@Override
	public Set<String> names() {
		return inner.names();
	}

	@Override
	public boolean containsSuffix() {
		return true;
	}

	@Override
	public int sumCount() {
		return 0;
	}

	@Override
	public String toString() {
		return "suffix(" + inner + ")";
	}
}
