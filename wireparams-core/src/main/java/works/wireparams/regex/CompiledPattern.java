package works.wireparams.regex;

import java.util.Optional;

public interface CompiledPattern {
	/**
	 * @return the source text of the pattern, for messages and fingerprints
	 */
	String source();

	/**
	 * @param template replacement text, possibly containing group references
	 * @return {@code template} with its group references filled in from {@code input},
	 * or empty if the whole of {@code input} does not match
	 */
	Optional<String> rewrite(String input, String template);

	default boolean matches(String input) {
		return rewrite(input, "").isPresent();
	}
}
