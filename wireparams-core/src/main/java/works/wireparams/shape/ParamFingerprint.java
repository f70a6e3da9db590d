package works.wireparams.shape;

/**
 * A value-independent summary of a {@link ParamType}'s public shape.
 * <p>
 * Two trees that would accept exactly the same requests describe identically.
 * Conversion functions and compiled patterns can't be compared,
 * so user types and regexps contribute only their kind, their name, and,
 * for regexps, the pattern's source text.
 */
public final class ParamFingerprint {
	private ParamFingerprint() { }

	public static int of(ParamType<?> type) {
		return describe(type).hashCode();
	}

	public static String describe(ParamType<?> type) {
		StringBuilder sb = new StringBuilder();
		describe(type, sb);
		return sb.toString();
	}

	private static void describe(ParamType<?> node, StringBuilder sb) {
		if (node instanceof ScalarNode<?> n) {
			leaf(n.kind().name(), n.name(), sb);
		} else if (node instanceof UserTypeNode<?> n) {
			leaf("user", n.name(), sb);
		} else if (node instanceof BoolNode n) {
			leaf("bool", n.name(), sb);
		} else if (node instanceof FileNode n) {
			leaf("file", n.name(), sb);
		} else if (node instanceof RegexpNode n) {
			sb.append("regexp(").append(quote(n.name())).append(',').append(quote(n.pattern().source())).append(')');
		} else if (node instanceof CoordinatesNode n) {
			leaf("coordinates", n.name(), sb);
		} else if (node instanceof ValuedCoordinatesNode<?> n) {
			String companion = (n.companion() instanceof ScalarKind<?> k)? k.name() : "user";
			leaf(companion + "_coordinates", n.name(), sb);
		} else if (node instanceof ProductNode<?, ?> n) {
			composite("prod", sb, n.left(), n.right());
		} else if (node instanceof SumNode<?> n) {
			composite("sum", sb, n.left(), n.right());
		} else if (node instanceof OptionNode<?> n) {
			composite("opt", sb, n.inner());
		} else if (node instanceof SetNode<?> n) {
			composite("set", sb, n.element());
		} else if (node instanceof ListNode<?> n) {
			sb.append("list(").append(quote(n.name())).append(',');
			describe(n.element(), sb);
			sb.append(')');
		} else if (node instanceof SuffixNode<?> n) {
			composite("suffix", sb, n.inner());
		} else if (node instanceof AllSuffixNode n) {
			leaf("all_suffix", n.name(), sb);
		} else if (node instanceof AllSuffixStringNode n) {
			leaf("all_suffix_string", n.name(), sb);
		} else if (node instanceof AllSuffixUserNode<?> n) {
			leaf("all_suffix_user", n.name(), sb);
		} else if (node instanceof AllSuffixRegexpNode n) {
			sb.append("all_suffix_regexp(").append(quote(n.name())).append(',').append(quote(n.pattern().source())).append(')');
		} else if (node instanceof AnyNode) {
			sb.append("any");
		} else if (node instanceof UnitNode) {
			sb.append("unit");
		} else if (node instanceof PrefixedNode<?> n) {
			sb.append("prefixed(").append(quote(n.prefix())).append(',');
			describe(n.inner(), sb);
			sb.append(')');
		} else {
			throw new AssertionError("Unexpected parameter shape: " + node);
		}
	}

	private static void leaf(String kind, String name, StringBuilder sb) {
		sb.append(kind).append('(').append(quote(name)).append(')');
	}

	private static void composite(String kind, StringBuilder sb, ParamType<?>... children) {
		sb.append(kind).append('(');
		for (int i = 0; i < children.length; i++) {
			if (i > 0) {
				sb.append(',');
			}
			describe(children[i], sb);
		}
		sb.append(')');
	}

	/**
	 * Keeps names containing punctuation from colliding with the structure around them.
	 */
	private static String quote(String text) {
		return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
	}
}
