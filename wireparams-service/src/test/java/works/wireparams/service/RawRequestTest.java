package works.wireparams.service;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.wireparams.Param;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RawRequestTest {

	@Test
	void fromUri() {
		var request = RawRequest.fromUri("/blog/a%20b/c+d?x=1&y=two+words&x=3");
		assertEquals(List.of("blog", "a b", "c+d"), request.path());
		assertEquals(List.of(Param.of("x", "1"), Param.of("y", "two words"), Param.of("x", "3")), request.getParams());
		assertEquals(List.of(), request.postParams());
	}

	@Test
	void root() {
		assertEquals(List.of(), RawRequest.fromUri("/").path());
		assertEquals(List.of(), RawRequest.fromUri("").path());
		assertEquals(List.of(Param.of("q", "")), RawRequest.fromUri("/?q=").getParams());
	}

	@Test
	void malformedEscape() {
		assertThrows(IllegalArgumentException.class, () -> RawRequest.fromUri("/%zz"));
	}

}
