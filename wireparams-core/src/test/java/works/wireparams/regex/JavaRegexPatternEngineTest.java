package works.wireparams.regex;

import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JavaRegexPatternEngineTest {
	private final PatternEngine engine = PatternEngine.javaRegex();

	@Test
	void rewrite() {
		var pattern = engine.compile("\\[(.*)\\]");
		assertEquals(Optional.of("(hello)"), pattern.rewrite("[hello]", "($1)"));
		assertEquals(Optional.of("[hello]"), pattern.rewrite("[hello]", "$0"));
		assertEquals(Optional.of("literal"), pattern.rewrite("[]", "literal"));
	}

	@Test
	void wholeInputMustMatch() {
		var pattern = engine.compile("[0-9]+");
		assertTrue(pattern.matches("123"));
		assertFalse(pattern.matches("123abc"));
		assertFalse(pattern.matches("abc123"));
		assertEquals(Optional.empty(), pattern.rewrite("x123", "$0"));
	}

	@Test
	void source() {
		assertEquals("a|b", engine.compile("a|b").source());
	}

	@Test
	void invalidPattern() {
		assertThrows(IllegalArgumentException.class, () -> engine.compile("(unclosed"));
	}

}
