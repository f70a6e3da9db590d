package works.wireparams.shape;

import works.wireparams.regex.CompiledPattern;

import static java.util.Objects.requireNonNull;
import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * A string parameter that must match {@code pattern},
 * and is delivered as {@code template} with the pattern's groups substituted.
 */
public record RegexpNode(String name, CompiledPattern pattern, String template) implements LeafNode<String> {
	public RegexpNode {
		requireName(name, "Parameter");
		requireNonNull(pattern);
		requireNonNull(template);
	}

	@Override
	public String toString() {
		return "regexp(" + name + ", " + pattern + ")";
	}
}
