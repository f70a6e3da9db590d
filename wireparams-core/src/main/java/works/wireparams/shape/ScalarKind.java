package works.wireparams.shape;

import java.math.BigDecimal;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * The built-in scalar parameter types.
 * The set is closed; use {@link ParamTypes#userType} for anything else.
 */
public final class ScalarKind<T> implements StringCodec<T> {
	public static final ScalarKind<Integer> INT = new ScalarKind<>("int", Integer::parseInt, Object::toString);
	public static final ScalarKind<Integer> INT32 = new ScalarKind<>("int32", Integer::parseInt, Object::toString);
	public static final ScalarKind<Long> INT64 = new ScalarKind<>("int64", Long::parseLong, Object::toString);
	public static final ScalarKind<Double> FLOAT = new ScalarKind<>("float", ScalarKind::parseFloat, ScalarKind::printFloat);
	public static final ScalarKind<String> STRING = new ScalarKind<>("string", Function.identity(), Function.identity());

	private final String name;
	private final Function<String, T> parser;
	private final Function<T, String> printer;

	private ScalarKind(String name, Function<String, T> parser, Function<T, String> printer) {
		this.name = name;
		this.parser = parser;
		this.printer = printer;
	}

	public String name() {
		return name;
	}

	@Override
	public String print(T value) {
		return printer.apply(value);
	}

	@Override
	public T parse(String raw) {
		return parser.apply(raw);
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * Plain decimal notation, never an exponent, so that the text is stable
	 * and parses back to the identical double.
	 */
	static String printFloat(Double value) {
		double d = value;
		if (Double.isNaN(d)) {
			return "nan";
		} else if (Double.isInfinite(d)) {
			return (d > 0)? "inf" : "-inf";
		} else if (d == 0.0) {
			// BigDecimal has no negative zero
			return (1.0 / d < 0)? "-0" : "0";
		}
		return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
	}

	static Double parseFloat(String raw) {
		switch (raw) {
			case "nan": return Double.NaN;
			case "inf": return Double.POSITIVE_INFINITY;
			case "-inf": return Double.NEGATIVE_INFINITY;
			default:
				// Double.parseDouble also takes hex, "Infinity" and type suffixes like "1d"
				if (!DECIMAL.matcher(raw).matches()) {
					throw new NumberFormatException("Not a decimal number: \"" + raw + "\"");
				}
				return Double.parseDouble(raw);
		}
	}

	private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
}
