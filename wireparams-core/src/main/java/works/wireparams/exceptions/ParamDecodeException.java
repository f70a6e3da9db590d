package works.wireparams.exceptions;

/**
 * The parameters of a request do not match the expected shape.
 * <p>
 * Decoding is all-or-nothing: the first failure aborts the whole decode.
 */
public sealed abstract class ParamDecodeException extends ParamException permits
	AmbiguousSumException,
	FileFieldException,
	InvalidParameterValueException,
	MissingParameterException,
	UnexpectedParameterException
{
	private final String paramName;

	protected ParamDecodeException(String paramName, String message) {
		super(message);
		this.paramName = paramName;
	}

	protected ParamDecodeException(String paramName, String message, Throwable cause) {
		super(message, cause);
		this.paramName = paramName;
	}

	/**
	 * @return the full key (including any list prefix) of the offending parameter
	 */
	public String paramName() {
		return paramName;
	}
}
