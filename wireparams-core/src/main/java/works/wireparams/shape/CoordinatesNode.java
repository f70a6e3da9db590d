package works.wireparams.shape;

import java.util.Set;
import works.wireparams.Coordinates;

import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * The click position sent by an image input, as {@code name.x} and {@code name.y}.
 */
public record CoordinatesNode(String name) implements LeafNode<Coordinates> {
	public CoordinatesNode {
		requireName(name, "Parameter");
	}

	@Override
	public Set<String> keys() {
		return Set.of(abscissaKey(name), ordinateKey(name));
	}

	public static String abscissaKey(String name) {
		return name + ".x";
	}

	public static String ordinateKey(String name) {
		return name + ".y";
	}

	@Override
	public String toString() {
		return "coordinates(" + name + ")";
	}
}
