package works.wireparams.shape;

import java.util.Optional;
import java.util.Set;
import works.wireparams.exceptions.InvalidParamShapeException;

import static java.util.Objects.requireNonNull;

/**
 * Zero or one occurrence of a leaf.
 * Absence of the leaf's keys decodes as {@link Optional#empty()};
 * a present but malformed value is still an error.
 */
public record OptionNode<T>(LeafNode<T> inner) implements ParamType<Optional<T>> {
	public OptionNode {
		requireNonNull(inner);
		if (inner instanceof BoolNode) {
			// An absent bool already means false, so there is nothing left to mark as empty
			throw new InvalidParamShapeException("Can't make a boolean parameter optional: " + inner);
		}
	}

	@Override
	public Set<String> names() {
		return inner.names();
	}

	@Override
	public boolean containsSuffix() {
		return false;
	}

	@Override
	public int sumCount() {
		return 0;
	}

	@Override
	public String toString() {
		return "opt(" + inner + ")";
	}
}
