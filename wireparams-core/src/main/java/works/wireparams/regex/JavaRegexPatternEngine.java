package works.wireparams.regex;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link PatternEngine} backed by {@link java.util.regex}.
 * Templates use {@code $1}-style group references, as in {@link Matcher#appendReplacement}.
 */
public final class JavaRegexPatternEngine implements PatternEngine {
	static final JavaRegexPatternEngine INSTANCE = new JavaRegexPatternEngine();

	private JavaRegexPatternEngine() { }

	@Override
	public CompiledPattern compile(String pattern) {
		try {
			return new JavaPattern(Pattern.compile(pattern));
		} catch (PatternSyntaxException e) {
			throw new IllegalArgumentException("Invalid pattern: " + pattern, e);
		}
	}

	record JavaPattern(Pattern pattern) implements CompiledPattern {
		@Override
		public String source() {
			return pattern.pattern();
		}

		@Override
		public Optional<String> rewrite(String input, String template) {
			Matcher matcher = pattern.matcher(input);
			if (!matcher.matches()) {
				return Optional.empty();
			}
			// The match spans the whole input, so nothing precedes the replacement
			StringBuilder sb = new StringBuilder();
			matcher.appendReplacement(sb, template);
			return Optional.of(sb.toString());
		}

		@Override
		public String toString() {
			return "/" + pattern.pattern() + "/";
		}
	}
}
