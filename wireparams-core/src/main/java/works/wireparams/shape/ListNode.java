package works.wireparams.shape;

import java.util.List;
import java.util.Set;

import static works.wireparams.shape.ShapeChecks.requireName;
import static works.wireparams.shape.ShapeChecks.requireNoSuffix;

/**
 * A sequence of groups of parameters.
 * The names of element {@code i} are prefixed by {@code name.i.},
 * which keeps the fields of each element together.
 */
public record ListNode<T>(String name, ParamType<T> element) implements ParamType<List<T>> {
	public ListNode {
		requireName(name, "List");
		requireNoSuffix(element, "A list");
	}

	@Override
	public Set<String> names() {
		return Set.of(name);
	}

	@Override
	public boolean containsSuffix() {
		return false;
	}

	/**
	 * Each element numbers its sums from zero under its own prefix.
	 */
	@Override
	public int sumCount() {
		return 0;
	}

	@Override
	public String toString() {
		return "list(" + name + ", " + element + ")";
	}
}
