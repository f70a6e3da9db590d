package works.wireparams.shape;

import java.util.function.Function;
import works.wireparams.Unit;
import works.wireparams.regex.CompiledPattern;

import static java.util.Objects.requireNonNull;

/**
 * Combinators for declaring the parameters a service takes.
 * <p>
 * Some examples, with the type of value the handler receives:
 *
 * <ul>
 *     <li>
 *         {@code unit()} takes no parameters ({@link Unit});
 *     </li>
 *     <li>
 *         {@code integer("myvalue")} takes one integer called {@code myvalue} ({@code Integer});
 *     </li>
 *     <li>
 *         {@code prod(integer("myvalue"), string("mystring"))} takes both ({@code Pair<Integer, String>});
 *     </li>
 *     <li>
 *         {@code opt(integer("myvalue"))} takes an optional integer ({@code Optional<Integer>});
 *     </li>
 *     <li>
 *         {@code set(ParamTypes::integer, "i")} takes any number of integers all called {@code i},
 *         so it matches {@code i=4&i=22&i=111} ({@code List<Integer>});
 *     </li>
 *     <li>
 *         {@code list("l", prod(integer("a"), string("b")))} takes a list of pairs,
 *         sent as {@code l.0.a=1&l.0.b=x&l.1.a=2&l.1.b=y} ({@code List<Pair<Integer, String>>}).
 *     </li>
 * </ul>
 */
public final class ParamTypes {
	private ParamTypes() { }

	public static ScalarNode<Integer> integer(String name) {
		return new ScalarNode<>(name, ScalarKind.INT);
	}

	public static ScalarNode<Integer> int32(String name) {
		return new ScalarNode<>(name, ScalarKind.INT32);
	}

	public static ScalarNode<Long> int64(String name) {
		return new ScalarNode<>(name, ScalarKind.INT64);
	}

	public static ScalarNode<Double> floating(String name) {
		return new ScalarNode<>(name, ScalarKind.FLOAT);
	}

	public static ScalarNode<String> string(String name) {
		return new ScalarNode<>(name, ScalarKind.STRING);
	}

	public static BoolNode bool(String name) {
		return new BoolNode(name);
	}

	public static FileNode file(String name) {
		return new FileNode(name);
	}

	public static UnitNode unit() {
		return UNIT;
	}

	/**
	 * Every pair not claimed by the shapes decoded before it.
	 * Put it last: in a product, nothing that reads parameters may follow it.
	 */
	public static AnyNode any() {
		return ANY;
	}

	/**
	 * A parameter of any type that can be converted to and from a string.
	 * {@code ofString} may throw to reject a value.
	 */
	public static <T> UserTypeNode<T> userType(Function<String, T> ofString, Function<T, String> toString, String name) {
		return new UserTypeNode<>(name, StringCodec.of(ofString, toString));
	}

	public static CoordinatesNode coordinates(String name) {
		return new CoordinatesNode(name);
	}

	public static ValuedCoordinatesNode<String> stringCoordinates(String name) {
		return new ValuedCoordinatesNode<>(name, ScalarKind.STRING);
	}

	public static ValuedCoordinatesNode<Integer> intCoordinates(String name) {
		return new ValuedCoordinatesNode<>(name, ScalarKind.INT);
	}

	public static ValuedCoordinatesNode<Integer> int32Coordinates(String name) {
		return new ValuedCoordinatesNode<>(name, ScalarKind.INT32);
	}

	public static ValuedCoordinatesNode<Long> int64Coordinates(String name) {
		return new ValuedCoordinatesNode<>(name, ScalarKind.INT64);
	}

	public static ValuedCoordinatesNode<Double> floatCoordinates(String name) {
		return new ValuedCoordinatesNode<>(name, ScalarKind.FLOAT);
	}

	public static <T> ValuedCoordinatesNode<T> userTypeCoordinates(Function<String, T> ofString, Function<T, String> toString, String name) {
		return new ValuedCoordinatesNode<>(name, StringCodec.of(ofString, toString));
	}

	/**
	 * Both parameter groups. Only {@code right} may read the URL suffix
	 * unless {@code left} is a {@link #suffix} and {@code right} is not.
	 */
	public static <A, B> ProductNode<A, B> prod(ParamType<A> left, ParamType<B> right) {
		return new ProductNode<>(left, right);
	}

	/**
	 * One of two alternatives with the same value type.
	 */
	public static <T> SumNode<T> sum(ParamType<T> left, ParamType<T> right) {
		return new SumNode<>(left, right);
	}

	public static <T> OptionNode<T> opt(LeafNode<T> inner) {
		return new OptionNode<>(inner);
	}

	/**
	 * @param element builds the repeated leaf from {@code name}, as in {@code set(ParamTypes::integer, "i")}
	 */
	public static <T> SetNode<T> set(Function<String, ? extends LeafNode<T>> element, String name) {
		ShapeChecks.requireName(name, "Parameter");
		return new SetNode<>(requireNonNull(element.apply(name)));
	}

	public static <T> ListNode<T> list(String name, ParamType<T> element) {
		return new ListNode<>(name, element);
	}

	/**
	 * A string matching {@code pattern}, delivered rewritten into {@code template}.
	 * For example, {@code regexp(engine.compile("\\[(.*)\\]"), "($1)", "myparam")}
	 * turns {@code myparam=[hello]} into {@code "(hello)"}.
	 */
	public static RegexpNode regexp(CompiledPattern pattern, String template, String name) {
		return new RegexpNode(name, pattern, template);
	}

	/**
	 * Reads {@code inner} from the URL suffix instead of the query string.
	 * For example, {@code suffix(prod(integer("i"), string("s")))} matches a URL
	 * ending in {@code 380/yo} and yields {@code (380, "yo")}.
	 */
	public static <T> SuffixNode<T> suffix(ParamType<T> inner) {
		return new SuffixNode<>(inner);
	}

	public static AllSuffixNode allSuffix(String name) {
		return new AllSuffixNode(name);
	}

	public static AllSuffixStringNode allSuffixString(String name) {
		return new AllSuffixStringNode(name);
	}

	public static <T> AllSuffixUserNode<T> allSuffixUser(Function<String, T> ofString, Function<T, String> toString, String name) {
		return new AllSuffixUserNode<>(name, StringCodec.of(ofString, toString));
	}

	public static AllSuffixRegexpNode allSuffixRegexp(CompiledPattern pattern, String template, String name) {
		return new AllSuffixRegexpNode(name, pattern, template);
	}

	/**
	 * A suffix followed by ordinary parameters.
	 * For example, {@code suffixProd(prod(integer("suff"), allSuffix("endsuff")), integer("i"))}
	 * matches a URL ending in {@code 777/go/go/go?i=320}
	 * and yields {@code ((777, [go, go, go]), 320)}.
	 */
	public static <S, A> ProductNode<S, A> suffixProd(ParamType<S> suffixPart, ParamType<A> regularPart) {
		return new ProductNode<>(suffix(suffixPart), ShapeChecks.requireNoSuffix(regularPart, "The regular part of a suffix product"));
	}

	/**
	 * The same parameters with {@code prefix} in front of every key.
	 */
	public static <T> PrefixedNode<T> addPrefix(String prefix, ParamType<T> inner) {
		return new PrefixedNode<>(prefix, inner);
	}

	public static boolean containsSuffix(ParamType<?> type) {
		return type.containsSuffix();
	}

	private static final UnitNode UNIT = new UnitNode();
	private static final AnyNode ANY = new AnyNode();
}
