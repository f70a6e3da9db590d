package works.wireparams.shape;

import java.util.List;
import java.util.Set;
import works.wireparams.exceptions.InvalidParamShapeException;

import static java.util.Objects.requireNonNull;

/**
 * Any number of occurrences of the same leaf, all under the same name.
 * Decoded in the order the occurrences appear in the request.
 */
public record SetNode<T>(LeafNode<T> element) implements ParamType<List<T>> {
	public SetNode {
		requireNonNull(element);
		if (element instanceof BoolNode) {
			// Presence is all a bool has to say, so repeats carry no information
			throw new InvalidParamShapeException("Can't repeat a boolean parameter: " + element);
		}
	}

	public String name() {
		return element.name();
	}

	@Override
	public Set<String> names() {
		return element.names();
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
		return "set(" + element + ")";
	}
}
