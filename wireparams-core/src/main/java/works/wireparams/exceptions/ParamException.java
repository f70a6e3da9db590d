package works.wireparams.exceptions;

public sealed abstract class ParamException extends RuntimeException permits InvalidParamShapeException, ParamDecodeException {
	protected ParamException(String message) {
		super(message);
	}

	protected ParamException(String message, Throwable cause) {
		super(message, cause);
	}
}
