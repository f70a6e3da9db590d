package works.wireparams.shape;

import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * All remaining suffix segments, joined with {@code /}.
 */
public record AllSuffixStringNode(String name) implements AllSuffixSpec<String> {
	public AllSuffixStringNode {
		requireName(name, "Suffix");
	}

	@Override
	public String toString() {
		return "all_suffix_string(" + name + ")";
	}
}
