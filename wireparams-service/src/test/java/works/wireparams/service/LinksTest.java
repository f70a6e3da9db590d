package works.wireparams.service;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.Unit;
import works.wireparams.names.PairNames;
import works.wireparams.names.ParamName;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wireparams.names.Multiplicity.ONE;
import static works.wireparams.names.Multiplicity.OPT;
import static works.wireparams.service.Services.auxiliaryService;
import static works.wireparams.service.Services.externalService;
import static works.wireparams.service.Services.postService;
import static works.wireparams.service.Services.service;
import static works.wireparams.shape.ParamTypes.allSuffix;
import static works.wireparams.shape.ParamTypes.integer;
import static works.wireparams.shape.ParamTypes.opt;
import static works.wireparams.shape.ParamTypes.prod;
import static works.wireparams.shape.ParamTypes.string;
import static works.wireparams.shape.ParamTypes.suffixProd;
import static works.wireparams.shape.ParamTypes.unit;

public class LinksTest {

	@Test
	void plainPath() {
		assertEquals("/about/team", Links.uri(service(List.of("about", "team"), unit()), Unit.UNIT));
		assertEquals("/", Links.uri(service(List.of(), unit()), Unit.UNIT));
	}

	@Test
	void queryString() {
		var s = service(List.of("search"), prod(string("q"), opt(integer("page"))));
		assertEquals("/search?q=red+shoes&page=2", Links.uri(s, Pair.of("red shoes", Optional.of(2))));
		assertEquals("/search?q=a%26b", Links.uri(s, Pair.of("a&b", Optional.empty())));
	}

	@Test
	void suffixFollowsThePath() {
		var s = service(List.of("blog"), suffixProd(prod(integer("year"), allSuffix("slug")), opt(string("lang"))));
		assertEquals("/blog/2024/a%20b/c?lang=fr",
			Links.uri(s, Pair.of(Pair.of(2024, List.of("a b", "c")), Optional.of("fr"))));
	}

	@Test
	void auxiliaryState() {
		var main = service(List.of("cart"), integer("id"));
		var aux = auxiliaryService(main);
		String state = aux.state().orElseThrow();
		assertEquals("/cart?__svc.state=" + state + "&id=3", Links.uri(aux, 3));
		assertEquals(List.of(Param.of(Services.STATE_PARAM, state)), Links.hiddenParams(aux));
		assertEquals(List.of(), Links.hiddenParams(main));
	}

	@Test
	void external() {
		var s = externalService("https://example.com", List.of("search"), string("q"), unit());
		assertEquals("https://example.com/search?q=x", Links.uri(s, "x"));
		assertEquals("https://example.com/search", Links.formAction(s));
	}

	@Test
	void roundTripThroughTheTable() {
		var table = new ServiceTable<String>();
		var s = service(List.of("item"), prod(integer("id"), opt(string("tab"))));
		table.register(s, (ctx, g, p) -> g.left() + "/" + g.right().orElse("-"));
		assertEquals("12/reviews", table.dispatch(RawRequest.fromUri(Links.uri(s, Pair.of(12, Optional.of("reviews"))))));
	}

	@Test
	void formNames() {
		var form = service(List.of("comment"), opt(integer("reply_to")));
		var submit = postService(form, prod(string("author"), string("text")));
		var names = Links.formNames(submit);
		assertEquals(new ParamName<>("reply_to", OPT), names.left());
		assertEquals(new PairNames(new ParamName<>("author", ONE), new ParamName<>("text", ONE)), names.right());
		assertEquals("/comment", Links.formAction(submit));
		assertTrue(submit.isPost());
	}

}
