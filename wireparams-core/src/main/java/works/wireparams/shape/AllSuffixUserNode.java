package works.wireparams.shape;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * All remaining suffix segments, joined with {@code /} and parsed by {@code codec}.
 */
public record AllSuffixUserNode<T>(String name, StringCodec<T> codec) implements AllSuffixSpec<T> {
	public AllSuffixUserNode {
		requireName(name, "Suffix");
		requireNonNull(codec);
	}

	@Override
	public String toString() {
		return "all_suffix_user(" + name + ")";
	}
}
