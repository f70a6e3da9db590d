package works.wireparams.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.wireparams.FileInfo;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.Unit;
import works.wireparams.exceptions.InvalidParameterValueException;
import works.wireparams.exceptions.MissingParameterException;
import works.wireparams.service.exceptions.DuplicateServiceException;
import works.wireparams.service.exceptions.ServiceNotFoundException;
import works.wireparams.service.exceptions.ServiceTableFrozenException;
import works.wireparams.service.exceptions.UnregisteredServicesException;
import works.wireparams.service.exceptions.UnregistrableServiceException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wireparams.service.Services.auxiliaryService;
import static works.wireparams.service.Services.externalService;
import static works.wireparams.service.Services.postService;
import static works.wireparams.service.Services.service;
import static works.wireparams.shape.ParamTypes.allSuffix;
import static works.wireparams.shape.ParamTypes.file;
import static works.wireparams.shape.ParamTypes.integer;
import static works.wireparams.shape.ParamTypes.opt;
import static works.wireparams.shape.ParamTypes.prod;
import static works.wireparams.shape.ParamTypes.string;
import static works.wireparams.shape.ParamTypes.suffix;
import static works.wireparams.shape.ParamTypes.suffixProd;
import static works.wireparams.shape.ParamTypes.unit;

public class ServiceTableTest {
	ServiceTable<String> table;

	@BeforeEach
	void setUp() {
		table = new ServiceTable<>();
	}

	@Test
	void exactPath() {
		table.register(service(List.of("hello"), unit()), (ctx, g, p) -> "hello");
		table.register(service(List.of("hello", "world"), unit()), (ctx, g, p) -> "hello world");
		table.register(service(List.of(), unit()), (ctx, g, p) -> "root");
		table.endInitialisation();

		assertEquals("hello", table.dispatch(RawRequest.fromUri("/hello")));
		assertEquals("hello world", table.dispatch(RawRequest.fromUri("/hello/world")));
		assertEquals("root", table.dispatch(RawRequest.fromUri("/")));
		var e = assertThrows(ServiceNotFoundException.class, () -> table.dispatch(RawRequest.fromUri("/goodbye")));
		assertEquals(List.of("goodbye"), e.path());
	}

	@Test
	void typedParameters() {
		table.register(service(List.of("add"), prod(integer("a"), integer("b"))),
			(ctx, g, p) -> String.valueOf(g.left() + g.right()));
		assertEquals("5", table.dispatch(RawRequest.fromUri("/add?a=2&b=3")));
		assertThrows(MissingParameterException.class, () -> table.dispatch(RawRequest.fromUri("/add?a=2")));
		assertThrows(InvalidParameterValueException.class, () -> table.dispatch(RawRequest.fromUri("/add?a=2&b=three")));
	}

	@Test
	void suffix_matchesLongerPaths() {
		table.register(service(List.of("blog"), suffixProd(prod(integer("year"), allSuffix("slug")), opt(string("lang")))),
			(ctx, g, p) -> g.left().left() + ":" + String.join("/", g.left().right()) + ":" + g.right().orElse("en")
				+ " at /" + String.join("/", ctx.servicePath()) + " with " + ctx.suffix());
		assertEquals("2024:hello/world:fr at /blog with [2024, hello, world]",
			table.dispatch(RawRequest.fromUri("/blog/2024/hello/world?lang=fr")));
		assertThrows(ServiceNotFoundException.class, () -> table.dispatch(RawRequest.fromUri("/blogs/2024")));
	}

	@Test
	void suffix_longestPathWins() {
		table.register(service(List.of("docs"), suffix(allSuffix("page"))), (ctx, g, p) -> "page " + g);
		table.register(service(List.of("docs", "index"), unit()), (ctx, g, p) -> "index");
		assertEquals("index", table.dispatch(RawRequest.fromUri("/docs/index")));
		assertEquals("page [intro]", table.dispatch(RawRequest.fromUri("/docs/intro")));
		assertEquals("page [index, more]", table.dispatch(RawRequest.fromUri("/docs/index/more")),
			"The non-suffix service can't take the extra segment");
	}

	@Test
	void noSuffix_noLongerPaths() {
		table.register(service(List.of("exact"), unit()), (ctx, g, p) -> "exact");
		assertThrows(ServiceNotFoundException.class, () -> table.dispatch(RawRequest.fromUri("/exact/more")));
	}

	@Test
	void samePath_toldApartByParameters() {
		table.register(service(List.of("find"), integer("id")), (ctx, g, p) -> "by id " + g);
		table.register(service(List.of("find"), string("name")), (ctx, g, p) -> "by name " + g);
		assertEquals("by id 7", table.dispatch(RawRequest.fromUri("/find?id=7")));
		assertEquals("by name bob", table.dispatch(RawRequest.fromUri("/find?name=bob")));

		var e = assertThrows(MissingParameterException.class, () -> table.dispatch(RawRequest.fromUri("/find?nickname=bob")));
		assertEquals("id", e.paramName(), "The first candidate's failure is reported");
	}

	@Test
	void getAndPost() {
		var form = service(List.of("comment"), unit());
		var submit = postService(form, prod(string("author"), string("text")));
		table.register(form, (ctx, g, p) -> "form");
		table.register(submit, (ctx, g, p) -> p.left() + " says " + p.right());

		assertEquals("form", table.dispatch(RawRequest.fromUri("/comment")));
		var post = RawRequest.fromUri("/comment").withPost(List.of(Param.of("author", "ann"), Param.of("text", "hi")), Map.of());
		assertEquals("ann says hi", table.dispatch(post));
	}

	@Test
	void fileUpload() {
		var upload = postService(service(List.of("upload"), unit()), file("doc"));
		table.register(upload, (ctx, g, p) -> p.originalBasename() + " " + p.filesize());
		var info = new FileInfo("/tmp/u1", 42, "report.pdf", "report.pdf");
		var request = RawRequest.fromUri("/upload").withPost(List.of(), Map.of("doc", List.of(info)));
		assertEquals("report.pdf 42", table.dispatch(request));
	}

	@Test
	void auxiliary_stateSelectsTheService() {
		var main = service(List.of("cart"), unit());
		var checkout = auxiliaryService(main);
		var cancel = auxiliaryService(main);
		table.register(main, (ctx, g, p) -> "cart");
		table.register(checkout, (ctx, g, p) -> "checkout");
		table.register(cancel, (ctx, g, p) -> "cancel");

		assertEquals("cart", table.dispatch(RawRequest.fromUri("/cart")));
		assertEquals("checkout", table.dispatch(RawRequest.fromUri(Links.uri(checkout, Unit.UNIT))));
		assertEquals("cancel", table.dispatch(RawRequest.fromUri(Links.uri(cancel, Unit.UNIT))));
		assertEquals("cart", table.dispatch(RawRequest.fromUri("/cart?__svc.state=expired")),
			"An unknown state falls back to the public service");
	}

	@Test
	void auxiliary_withOwnParameters() {
		var main = service(List.of("search"), string("q"));
		var page = auxiliaryService(main, prod(string("q"), integer("page")));
		table.register(main, (ctx, g, p) -> "first page of " + g);
		table.register(page, (ctx, g, p) -> "page " + g.right() + " of " + g.left());
		assertEquals("page 3 of cats", table.dispatch(RawRequest.fromUri(Links.uri(page, Pair.of("cats", 3)))));
		assertEquals("first page of cats", table.dispatch(RawRequest.fromUri(Links.uri(main, "cats"))));
	}

	@Test
	void duplicates() {
		table.register(service(List.of("a"), integer("x")), (ctx, g, p) -> "one");
		assertThrows(DuplicateServiceException.class,
			() -> table.register(service(List.of("a"), integer("x")), (ctx, g, p) -> "two"));
		table.register(service(List.of("a"), integer("y")), (ctx, g, p) -> "different parameters");
		table.register(service(List.of("b"), integer("x")), (ctx, g, p) -> "different path");
	}

	@Test
	void duplicates_comparedByShapeNotByHash() {
		assertEquals("Aa".hashCode(), "BB".hashCode());
		table.register(service(List.of("p"), integer("Aa")), (ctx, g, p) -> "Aa " + g);
		table.register(service(List.of("p"), integer("BB")), (ctx, g, p) -> "BB " + g);
		assertEquals("BB 2", table.dispatch(RawRequest.fromUri("/p?BB=2")));
	}

	@Test
	void externalServicesCantBeRegistered() {
		var external = externalService("https://example.com", List.of("search"), string("q"), unit());
		assertThrows(UnregistrableServiceException.class, () -> table.register(external, (ctx, g, p) -> "nope"));
	}

	@Test
	void declaredServicesMustBeRegistered() {
		var later = service(List.of("later"), unit());
		table.declare(later);
		var e = assertThrows(UnregisteredServicesException.class, () -> table.endInitialisation());
		assertEquals(1, e.services().size());
		assertFalse(table.isFrozen());

		table.register(later, (ctx, g, p) -> "registered");
		table.endInitialisation();
		assertTrue(table.isFrozen());
	}

	@Test
	void declaringAnAlreadyRegisteredService() {
		var now = service(List.of("now"), unit());
		table.register(now, (ctx, g, p) -> "now");
		table.declare(now);
		table.endInitialisation();
	}

	@Test
	void frozen() {
		table.endInitialisation();
		var s = service(List.of("late"), unit());
		assertThrows(ServiceTableFrozenException.class, () -> table.register(s, (ctx, g, p) -> "late"));
		assertThrows(ServiceTableFrozenException.class, () -> table.declare(s));
		assertThrows(ServiceTableFrozenException.class, () -> table.endInitialisation());
	}

	@Test
	void reservedParametersAreHidden() {
		table.register(service(List.of("p"), opt(string("x"))), (ctx, g, p) -> g.orElse("none"));
		assertEquals("none", table.dispatch(RawRequest.fromUri("/p?__svc.tracking=1")));
	}

	@Test
	void handlerExceptionsAreNotRetried() {
		table.register(service(List.of("boom"), unit()), (ctx, g, p) -> {
			throw new MissingParameterException("from the handler");
		});
		table.register(service(List.of("boom"), opt(integer("x"))), (ctx, g, p) -> "second");
		var e = assertThrows(MissingParameterException.class, () -> table.dispatch(RawRequest.fromUri("/boom")));
		assertEquals("from the handler", e.paramName());
	}

	@Test
	void strayParametersDisqualify() {
		table.register(service(List.of("s"), unit()), (ctx, g, p) -> "plain");
		assertThrows(works.wireparams.exceptions.UnexpectedParameterException.class,
			() -> table.dispatch(RawRequest.fromUri("/s?stray=1")));
	}

	@Test
	void optionalGetValueIsEmpty() {
		table.register(service(List.of("o"), opt(integer("n"))), (ctx, g, p) -> String.valueOf(g));
		assertEquals(String.valueOf(Optional.empty()), table.dispatch(RawRequest.fromUri("/o")));
	}

}
