package works.wireparams.shape;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * One parameter of a built-in {@link ScalarKind}.
 */
public record ScalarNode<T>(String name, ScalarKind<T> kind) implements LeafNode<T> {
	public ScalarNode {
		requireName(name, "Parameter");
		requireNonNull(kind);
	}

	@Override
	public String toString() {
		return kind + "(" + name + ")";
	}
}
