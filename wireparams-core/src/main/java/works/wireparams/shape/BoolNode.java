package works.wireparams.shape;

import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * A checkbox-style boolean: {@code true} is sent as the parameter being present,
 * {@code false} as its absence. Decoding never fails.
 */
public record BoolNode(String name) implements LeafNode<Boolean> {
	public static final String CHECKED = "on";

	public BoolNode {
		requireName(name, "Parameter");
	}

	@Override
	public String toString() {
		return "bool(" + name + ")";
	}
}
