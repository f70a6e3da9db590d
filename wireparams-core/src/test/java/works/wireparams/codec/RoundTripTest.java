package works.wireparams.codec;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.wireparams.BinSum;
import works.wireparams.Coordinates;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.Unit;
import works.wireparams.regex.PatternEngine;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.ParamTypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.wireparams.shape.ParamTypes.addPrefix;
import static works.wireparams.shape.ParamTypes.allSuffix;
import static works.wireparams.shape.ParamTypes.allSuffixString;
import static works.wireparams.shape.ParamTypes.any;
import static works.wireparams.shape.ParamTypes.bool;
import static works.wireparams.shape.ParamTypes.coordinates;
import static works.wireparams.shape.ParamTypes.floating;
import static works.wireparams.shape.ParamTypes.int64;
import static works.wireparams.shape.ParamTypes.intCoordinates;
import static works.wireparams.shape.ParamTypes.integer;
import static works.wireparams.shape.ParamTypes.list;
import static works.wireparams.shape.ParamTypes.opt;
import static works.wireparams.shape.ParamTypes.prod;
import static works.wireparams.shape.ParamTypes.regexp;
import static works.wireparams.shape.ParamTypes.set;
import static works.wireparams.shape.ParamTypes.string;
import static works.wireparams.shape.ParamTypes.stringCoordinates;
import static works.wireparams.shape.ParamTypes.suffix;
import static works.wireparams.shape.ParamTypes.suffixProd;
import static works.wireparams.shape.ParamTypes.sum;
import static works.wireparams.shape.ParamTypes.unit;
import static works.wireparams.shape.ParamTypes.userType;

/**
 * Every value survives construction, conversion to URL text and back, and reconstruction.
 * Strict settings also confirm that decoding claims every parameter that encoding produced.
 */
public class RoundTripTest {

	record Case<T>(String description, ParamType<T> type, T value) {
		@Override
		public String toString() {
			return description;
		}
	}

	static <T> Case<T> c(String description, ParamType<T> type, T value) {
		return new Case<>(description, type, value);
	}

	static Stream<Case<?>> cases() {
		return Stream.of(
			c("int", integer("i"), 42),
			c("negative int", integer("i"), -7),
			c("int64", int64("l"), Long.MAX_VALUE),
			c("float", floating("f"), 0.1),
			c("huge float", floating("f"), 1e300),
			c("tiny float", floating("f"), -4.9e-324),
			c("negative zero", floating("f"), -0.0),
			c("nan", floating("f"), Double.NaN),
			c("infinity", floating("f"), Double.NEGATIVE_INFINITY),
			c("string needing escapes", string("s"), "a b&c=d/é"),
			c("empty string", string("s"), ""),
			c("checked bool", bool("b"), true),
			c("unchecked bool", bool("b"), false),
			c("user type", userType(LocalDate::parse, LocalDate::toString, "d"), LocalDate.of(2024, 2, 29)),
			c("product", prod(integer("a"), string("b")), Pair.of(1, "x")),
			c("sum first", sum(integer("a"), integer("b")), BinSum.inj1(5)),
			c("sum second with shared name", sum(integer("a"), integer("a")), BinSum.inj2(5)),
			c("two sums",
				prod(sum(integer("x"), integer("y")), sum(string("s"), string("t"))),
				Pair.of(BinSum.inj2(3), BinSum.inj1("q"))),
			c("nested sum",
				sum(sum(integer("a"), integer("b")), sum(integer("c"), integer("d"))),
				BinSum.inj2(BinSum.inj1(9))),
			c("absent option", opt(integer("o")), Optional.empty()),
			c("present option", opt(integer("o")), Optional.of(7)),
			c("optional coordinates", opt(coordinates("c")), Optional.of(new Coordinates(1, 2))),
			c("set", set(ParamTypes::integer, "i"), List.of(4, 22, 111)),
			c("empty set", set(ParamTypes::integer, "i"), List.of()),
			c("list of pairs",
				list("l", prod(integer("a"), string("b"))),
				List.of(Pair.of(1, "x"), Pair.of(2, "y"))),
			c("list of sums",
				list("l", sum(integer("a"), integer("b"))),
				List.of(BinSum.inj1(1), BinSum.inj2(2), BinSum.inj1(3))),
			c("sum after list",
				prod(list("l", sum(integer("a"), integer("b"))), sum(integer("c"), integer("d"))),
				Pair.of(List.of(BinSum.inj2(1)), BinSum.inj2(2))),
			c("nested list",
				list("outer", list("inner", integer("v"))),
				List.of(List.of(1, 2), List.of(3))),
			c("coordinates", coordinates("c"), new Coordinates(3, 4)),
			c("string coordinates", stringCoordinates("c"), Pair.of("value", new Coordinates(3, 4))),
			c("int coordinates", intCoordinates("c"), Pair.of(9, new Coordinates(0, -1))),
			c("suffix", suffix(prod(integer("i"), string("s"))), Pair.of(380, "yo")),
			c("suffix product",
				suffixProd(prod(integer("suff"), allSuffix("endsuff")), integer("i")),
				Pair.of(Pair.of(777, List.of("go", "go", "go")), 320)),
			c("all suffix string", allSuffixString("path"), "docs/api/index.html"),
			c("regexp", regexp(PatternEngine.javaRegex().compile("[a-z]+"), "$0", "r"), "abc"),
			c("prefixed",
				addPrefix("p.", prod(integer("a"), sum(integer("b"), integer("b")))),
				Pair.of(1, BinSum.inj1(2))),
			c("any", any(), List.of(Param.of("x", "1"), Param.of("y", "2"), Param.of("x", "3"))),
			c("unit", unit(), Unit.UNIT),
			c("unit in product", prod(unit(), integer("i")), Pair.of(Unit.UNIT, 5)),
			c("nothing sent", prod(opt(integer("a")), bool("b")), Pair.of(Optional.empty(), false))
		);
	}

	static Stream<Arguments> settingsAndCases() {
		return Stream.of(CodecSettings.DEFAULT, CodecSettings.STRICT)
			.flatMap(settings -> cases().map(c -> Arguments.of(settings, c)));
	}

	@ParameterizedTest
	@MethodSource("settingsAndCases")
	void roundTrip(CodecSettings settings, Case<?> testCase) {
		assertRoundTrip(ParamCodecBuilder.using(settings).build(), testCase);
	}

	private static <T> void assertRoundTrip(ParamCodec codec, Case<T> testCase) {
		Construction construction = codec.construct(testCase.type(), testCase.value());
		List<Param> params = QueryStrings.decode(construction.queryString());
		List<String> segments = construction.suffixPath()
			.map(QueryStrings::decodePath)
			.orElse(List.of());
		T actual = codec.reconstruct(testCase.type(), params, Map.of(), segments);
		assertEquals(testCase.value(), actual, () -> "Round trip via " + construction.relativeUri());
	}

}
