package works.wireparams.shape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import works.wireparams.codec.NameGenerator;
import works.wireparams.exceptions.InvalidParamShapeException;

import static java.util.Objects.requireNonNull;

final class ShapeChecks {
	private ShapeChecks() { }

	static String requireName(String name, String what) {
		if (name == null || name.isEmpty()) {
			throw new InvalidParamShapeException(what + " name must not be empty");
		}
		if (name.startsWith(NameGenerator.SUM_DISCRIMINATOR)) {
			throw new InvalidParamShapeException(what + " name \"" + name + "\" uses the reserved prefix " + NameGenerator.SUM_DISCRIMINATOR);
		}
		return name;
	}

	static <N extends ParamType<?>> N requireNoSuffix(N node, String context) {
		requireNonNull(node);
		if (node.containsSuffix()) {
			throw new InvalidParamShapeException(context + " can't contain a URL suffix: " + node);
		}
		return node;
	}

	static void requireDisjoint(ParamType<?> left, ParamType<?> right) {
		Set<String> overlap = new HashSet<>(left.names());
		overlap.retainAll(right.names());
		if (!overlap.isEmpty()) {
			throw new InvalidParamShapeException("Both sides of a product use the names " + overlap);
		}
	}

	/**
	 * Whether decoding {@code node} may take every remaining pair.
	 */
	static boolean claimsAllParams(ParamType<?> node) {
		if (node instanceof AnyNode) {
			return true;
		} else if (node instanceof PrefixedNode<?> p) {
			return claimsAllParams(p.inner());
		} else if (node instanceof ProductNode<?, ?> p) {
			return claimsAllParams(p.left()) || claimsAllParams(p.right());
		} else if (node instanceof SumNode<?> s) {
			return claimsAllParams(s.left()) || claimsAllParams(s.right());
		} else {
			return false;
		}
	}

	/**
	 * Whether decoding {@code node} needs any query or body pairs. Path segments don't count.
	 */
	static boolean readsParams(ParamType<?> node) {
		if (node instanceof SuffixNode<?> || node instanceof AllSuffixSpec<?>) {
			return false;
		} else if (node instanceof ProductNode<?, ?> p) {
			return readsParams(p.left()) || readsParams(p.right());
		} else if (node instanceof PrefixedNode<?> p) {
			return readsParams(p.inner());
		} else {
			return !node.names().isEmpty() || node.sumCount() > 0;
		}
	}

	/**
	 * Checks that {@code inner} can be read positionally from path segments.
	 */
	static void requireSuffixable(ParamType<?> inner) {
		List<ParamType<?>> components = new ArrayList<>();
		flatten(inner, components);
		for (int i = 0; i < components.size(); i++) {
			ParamType<?> component = components.get(i);
			if (component instanceof AllSuffixSpec) {
				if (i != components.size() - 1) {
					throw new InvalidParamShapeException("Only the last component of a suffix may take all remaining segments: " + component);
				}
			} else if (!(component instanceof ScalarNode
				|| component instanceof UserTypeNode
				|| component instanceof RegexpNode
				|| component instanceof UnitNode)) {
				throw new InvalidParamShapeException("Can't read from a URL path segment: " + component);
			}
		}
	}

	private static void flatten(ParamType<?> node, List<ParamType<?>> components) {
		if (node instanceof ProductNode<?, ?> p) {
			flatten(p.left(), components);
			flatten(p.right(), components);
		} else {
			components.add(node);
		}
	}
}
