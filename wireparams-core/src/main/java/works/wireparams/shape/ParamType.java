package works.wireparams.shape;

import java.util.Set;

/**
 * A node in a parameter-shape tree, describing how a value of type {@code T}
 * corresponds to the flat key/value pairs of a query string or form body,
 * and to the path segments of a URL suffix.
 * <p>
 * The description is bidirectional: the same tree drives
 * {@link works.wireparams.codec.ParamEncoder encoding} and
 * {@link works.wireparams.codec.ParamDecoder decoding}.
 * Trees are immutable and are normally built once, with the combinators in
 * {@link ParamTypes}, when a service is declared.
 * Local well-formedness rules are checked by each node's constructor,
 * which throws {@link works.wireparams.exceptions.InvalidParamShapeException}.
 *
 * @param <T> the type of value this shape describes
 */
public sealed interface ParamType<T> permits
	LeafNode,
	AllSuffixSpec,
	AnyNode,
	ListNode,
	OptionNode,
	PrefixedNode,
	ProductNode,
	SetNode,
	SuffixNode,
	SumNode,
	UnitNode
{
	/**
	 * @return the field names this shape claims at its own level,
	 * before any list or prefix is applied.
	 * Two sides of a {@link ProductNode} must not share any.
	 */
	Set<String> names();

	/**
	 * @return true if decoding this shape reads URL path segments
	 */
	boolean containsSuffix();

	/**
	 * @return the number of {@link SumNode}s in this tree that share
	 * a discriminator namespace with this node.
	 * Sums inside a {@link ListNode} element have their own namespace and are not counted.
	 */
	int sumCount();
}
