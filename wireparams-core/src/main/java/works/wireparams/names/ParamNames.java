package works.wireparams.names;

import works.wireparams.codec.NameGenerator;
import works.wireparams.shape.AllSuffixSpec;
import works.wireparams.shape.AnyNode;
import works.wireparams.shape.LeafNode;
import works.wireparams.shape.ListNode;
import works.wireparams.shape.OptionNode;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.PrefixedNode;
import works.wireparams.shape.ProductNode;
import works.wireparams.shape.SetNode;
import works.wireparams.shape.SuffixNode;
import works.wireparams.shape.SumNode;
import works.wireparams.shape.UnitNode;

/**
 * The field names a form must use so that its submission decodes
 * into a given {@link ParamType}.
 * <p>
 * The structure follows the shape: a {@link ProductNode} yields {@link PairNames},
 * a {@link SumNode} yields {@link SumNames}, and so on down to one {@link ParamName} per leaf.
 * The keys are generated by the same {@link NameGenerator} rules the codec uses,
 * so a form built from these names always produces a request the codec accepts.
 */
public sealed interface ParamNames permits
	ParamName,
	PairNames,
	SumNames,
	ListNames,
	NoNames
{
	static ParamNames of(ParamType<?> type) {
		return of(type, NameGenerator.root());
	}

	static ParamNames of(ParamType<?> node, NameGenerator names) {
		if (node instanceof LeafNode<?> n) {
			return leaf(n, names, Multiplicity.ONE);
		} else if (node instanceof OptionNode<?> n) {
			return leaf(n.inner(), names, Multiplicity.OPT);
		} else if (node instanceof SetNode<?> n) {
			return leaf(n.element(), names, Multiplicity.SET);
		} else if (node instanceof ProductNode<?, ?> n) {
			return new PairNames(
				of(n.left(), names),
				of(n.right(), names.skip(n.left().sumCount())));
		} else if (node instanceof SumNode<?> n) {
			return new SumNames(
				names.sumDiscriminator(),
				of(n.left(), names.skip(1)),
				of(n.right(), names.skip(1 + n.left().sumCount())));
		} else if (node instanceof ListNode<?> n) {
			return new ListNames(n.name(), n.element(), names);
		} else if (node instanceof SuffixNode<?> n) {
			// Path segments are named after their fields, so a GET form can still fill them in
			return of(n.inner(), names);
		} else if (node instanceof AllSuffixSpec<?> n) {
			return new ParamName<>(names.key(n.name()), Multiplicity.ONE);
		} else if (node instanceof PrefixedNode<?> n) {
			return of(n.inner(), names.prefixed(n.prefix()));
		} else if (node instanceof AnyNode || node instanceof UnitNode) {
			return NoNames.INSTANCE;
		} else {
			throw new AssertionError("Unexpected parameter shape: " + node);
		}
	}

	/**
	 * Coordinates come from an image input, whose browser-generated
	 * {@code .x} and {@code .y} keys hang off the one name given to the widget.
	 */
	private static ParamName<?> leaf(LeafNode<?> leaf, NameGenerator names, Multiplicity multiplicity) {
		return new ParamName<>(names.key(leaf.name()), multiplicity);
	}
}
