package works.wireparams.exceptions;

/**
 * A parameter is present but its value can't be converted to the expected type.
 */
public sealed class InvalidParameterValueException extends ParamDecodeException permits RegexpMismatchException {
	private final String rawValue;

	public InvalidParameterValueException(String paramName, String rawValue) {
		super(paramName, "Invalid value for parameter \"" + paramName + "\": \"" + rawValue + "\"");
		this.rawValue = rawValue;
	}

	public InvalidParameterValueException(String paramName, String rawValue, Throwable cause) {
		super(paramName, "Invalid value for parameter \"" + paramName + "\": \"" + rawValue + "\"", cause);
		this.rawValue = rawValue;
	}

	protected InvalidParameterValueException(String paramName, String rawValue, String message) {
		super(paramName, message);
		this.rawValue = rawValue;
	}

	public String rawValue() {
		return rawValue;
	}
}
