package works.wireparams.shape;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * One parameter of an application-defined type, converted with {@code codec}.
 */
public record UserTypeNode<T>(String name, StringCodec<T> codec) implements LeafNode<T> {
	public UserTypeNode {
		requireName(name, "Parameter");
		requireNonNull(codec);
	}

	@Override
	public String toString() {
		return "user(" + name + ")";
	}
}
