package works.wireparams.codec;

/**
 * Produces the wire keys for a position in a parameter-shape tree.
 * <p>
 * A field the author named is sent under the current {@link #prefix} plus its name.
 * The things nobody named get synthesized keys:
 *
 * <ul>
 *     <li>
 *         each {@link works.wireparams.shape.ListNode list} element {@code i} of list {@code l}
 *         gets the prefix {@code l.i.}, and numbers its sums from zero again;
 *     </li>
 *     <li>
 *         each {@link works.wireparams.shape.SumNode sum} gets a discriminator key
 *         {@code __sum.} followed by a base-36 code of its pre-order position
 *         among the sums sharing its prefix.
 *     </li>
 * </ul>
 *
 * The position depends only on the shape, never on the value being encoded,
 * so the encoder, the decoder and {@link works.wireparams.names.ParamNames}
 * always agree on the keys.
 *
 * @param prefix prepended to every key generated here
 * @param sumBase the position of the next sum
 */
public record NameGenerator(String prefix, int sumBase) {
	public static final String SUM_DISCRIMINATOR = "__sum.";
	public static final String FIRST_ALTERNATIVE = "1";
	public static final String SECOND_ALTERNATIVE = "2";

	public static NameGenerator root() {
		return ROOT;
	}

	public String key(String name) {
		return prefix + name;
	}

	/**
	 * @return the discriminator key for a sum at this position
	 */
	public String sumDiscriminator() {
		return prefix + SUM_DISCRIMINATOR + code(sumBase);
	}

	/**
	 * @return the generator for the position after {@code sums} sums
	 */
	public NameGenerator skip(int sums) {
		if (sums == 0) {
			return this;
		}
		return new NameGenerator(prefix, sumBase + sums);
	}

	public String listPrefix(String listName) {
		return prefix + listName + ".";
	}

	public NameGenerator listElement(String listName, int index) {
		return new NameGenerator(listPrefix(listName) + index + ".", 0);
	}

	public NameGenerator prefixed(String extraPrefix) {
		return new NameGenerator(prefix + extraPrefix, sumBase);
	}

	/**
	 * A short alphanumeric rendering of a counter.
	 */
	public static String code(int counter) {
		return Integer.toString(counter, Character.MAX_RADIX);
	}

	private static final NameGenerator ROOT = new NameGenerator("", 0);
}
