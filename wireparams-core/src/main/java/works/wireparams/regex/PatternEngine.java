package works.wireparams.regex;

/**
 * Compiles the regular expressions used by
 * {@link works.wireparams.shape.ParamTypes#regexp regexp} and
 * {@link works.wireparams.shape.ParamTypes#allSuffixRegexp allSuffixRegexp} parameters.
 * <p>
 * Parameter shapes only ever see {@link CompiledPattern}s,
 * so the regex dialect is up to whoever supplies the engine.
 */
public interface PatternEngine {
	/**
	 * @throws IllegalArgumentException if {@code pattern} is not valid in this engine's dialect
	 */
	CompiledPattern compile(String pattern);

	static PatternEngine javaRegex() {
		return JavaRegexPatternEngine.INSTANCE;
	}
}
