package works.wireparams.shape;

import java.util.Set;

/**
 * Takes every remaining segment of the URL suffix.
 * Must be the last positional component of its {@link SuffixNode}.
 */
public sealed interface AllSuffixSpec<T> extends ParamType<T> permits
	AllSuffixNode,
	AllSuffixRegexpNode,
	AllSuffixStringNode,
	AllSuffixUserNode
{
	String name();

	@Override
	default Set<String> names() {
		return Set.of(name());
	}

	@Override
	default boolean containsSuffix() {
		return true;
	}

	@Override
	default int sumCount() {
		return 0;
	}
}
