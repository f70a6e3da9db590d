package works.wireparams.shape;

import java.util.List;

import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * All remaining suffix segments, as a list.
 */
public record AllSuffixNode(String name) implements AllSuffixSpec<List<String>> {
	public AllSuffixNode {
		requireName(name, "Suffix");
	}

	@Override
	public String toString() {
		return "all_suffix(" + name + ")";
	}
}
