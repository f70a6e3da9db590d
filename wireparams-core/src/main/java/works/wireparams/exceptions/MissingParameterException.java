package works.wireparams.exceptions;

public final class MissingParameterException extends ParamDecodeException {
	public MissingParameterException(String paramName) {
		super(paramName, "Missing parameter \"" + paramName + "\"");
	}
}
