package works.wireparams.shape;

import java.util.Set;
import works.wireparams.Coordinates;
import works.wireparams.Pair;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.CoordinatesNode.abscissaKey;
import static works.wireparams.shape.CoordinatesNode.ordinateKey;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * Like {@link CoordinatesNode}, plus the input's own value sent under {@code name}.
 */
public record ValuedCoordinatesNode<V>(String name, StringCodec<V> companion) implements LeafNode<Pair<V, Coordinates>> {
	public ValuedCoordinatesNode {
		requireName(name, "Parameter");
		requireNonNull(companion);
	}

	@Override
	public Set<String> keys() {
		return Set.of(name, abscissaKey(name), ordinateKey(name));
	}

	@Override
	public String toString() {
		return companion + "_coordinates(" + name + ")";
	}
}
