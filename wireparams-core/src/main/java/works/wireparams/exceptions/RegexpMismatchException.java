package works.wireparams.exceptions;

public final class RegexpMismatchException extends InvalidParameterValueException {
	private final String pattern;

	public RegexpMismatchException(String paramName, String rawValue, String pattern) {
		super(paramName, rawValue, "Value \"" + rawValue + "\" of parameter \"" + paramName + "\" does not match /" + pattern + "/");
		this.pattern = pattern;
	}

	public String pattern() {
		return pattern;
	}
}
