package works.wireparams.shape;

import java.util.Set;

/**
 * A shape that stands for exactly one value under one field name.
 * Only leaves may be made {@link OptionNode optional} or {@link SetNode repeated}.
 */
public sealed interface LeafNode<T> extends ParamType<T> permits
	BoolNode,
	CoordinatesNode,
	FileNode,
	RegexpNode,
	ScalarNode,
	UserTypeNode,
	ValuedCoordinatesNode
{
	String name();

	/**
	 * @return the keys this leaf occupies on the wire, relative to the current prefix
	 */
	default Set<String> keys() {
		return Set.of(name());
	}

	@Override
	default Set<String> names() {
		return keys();
	}

	@Override
	default boolean containsSuffix() {
		return false;
	}

	@Override
	default int sumCount() {
		return 0;
	}
}
