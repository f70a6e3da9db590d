package works.wireparams.shape;

import works.wireparams.regex.CompiledPattern;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * All remaining suffix segments, joined with {@code /},
 * matched against {@code pattern} and rewritten into {@code template}.
 */
public record AllSuffixRegexpNode(String name, CompiledPattern pattern, String template) implements AllSuffixSpec<String> {
	public AllSuffixRegexpNode {
		requireName(name, "Suffix");
		requireNonNull(pattern);
		requireNonNull(template);
	}

	@Override
	public String toString() {
		return "all_suffix_regexp(" + name + ", " + pattern + ")";
	}
}
