package works.wireparams.service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import works.wireparams.exceptions.InvalidParamShapeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.wireparams.service.Services.auxiliaryService;
import static works.wireparams.service.Services.externalService;
import static works.wireparams.service.Services.postService;
import static works.wireparams.service.Services.service;
import static works.wireparams.shape.ParamTypes.allSuffix;
import static works.wireparams.shape.ParamTypes.integer;
import static works.wireparams.shape.ParamTypes.string;
import static works.wireparams.shape.ParamTypes.suffix;
import static works.wireparams.shape.ParamTypes.unit;

public class ServicesTest {

	@Test
	void stateCodesAreUnique() {
		var main = service(List.of("x"), unit());
		Set<String> codes = new HashSet<>();
		for (int i = 0; i < 100; i++) {
			assertTrue(codes.add(auxiliaryService(main).state().orElseThrow()));
		}
	}

	@Test
	void postServiceInheritsFromFallback() {
		var main = service(List.of("x"), integer("id"));
		var aux = auxiliaryService(main);
		var post = postService(aux, string("text"));
		assertEquals(ServiceKind.AUXILIARY, post.kind());
		assertEquals(aux.state(), post.state());
		assertEquals(main.getParams(), post.getParams());
		assertTrue(post.isPost());
		assertFalse(main.isPost());
	}

	@Test
	void auxiliaryKeepsTheFallbackParameters() {
		var form = postService(service(List.of("x"), integer("id")), string("text"));
		var aux = auxiliaryService(form);
		assertEquals(form.getParams(), aux.getParams());
		assertEquals(form.postParams(), aux.postParams());
		assertTrue(aux.isPost());
		assertEquals(ServiceKind.AUXILIARY, aux.kind());
	}

	@Test
	void takesSuffix() {
		assertTrue(service(List.of("a"), suffix(allSuffix("rest"))).takesSuffix());
		assertFalse(service(List.of("a"), integer("i")).takesSuffix());
	}

	@Test
	void invalid() {
		assertThrows(IllegalArgumentException.class, () -> service(List.of("a/b"), unit()));
		assertThrows(IllegalArgumentException.class,
			() -> new Service<>(List.of("a"), unit(), suffix(integer("i")), ServiceKind.PUBLIC, Optional.empty(), Optional.empty()));
		assertThrows(IllegalArgumentException.class,
			() -> new Service<>(List.of("a"), unit(), unit(), ServiceKind.PUBLIC, Optional.of("s"), Optional.empty()));
		assertThrows(IllegalArgumentException.class,
			() -> new Service<>(List.of("a"), unit(), unit(), ServiceKind.AUXILIARY, Optional.empty(), Optional.empty()));
		assertThrows(IllegalArgumentException.class,
			() -> externalService("https://example.com/", List.of(), unit(), unit()));
		var external = externalService("https://example.com", List.of(), unit(), unit());
		assertThrows(IllegalArgumentException.class, () -> auxiliaryService(external));
		assertThrows(IllegalArgumentException.class, () -> postService(external, integer("i")));
	}

	@Test
	void invalidShapesFailEarly() {
		assertThrows(InvalidParamShapeException.class, () -> service(List.of("a"), suffix(suffix(integer("i")))));
	}

}
