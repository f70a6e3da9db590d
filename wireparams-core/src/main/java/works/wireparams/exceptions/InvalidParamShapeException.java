package works.wireparams.exceptions;

/**
 * A parameter shape was assembled from combinators that can't be combined that way.
 * <p>
 * This is thrown while services are being declared, never while serving a request.
 */
public final class InvalidParamShapeException extends ParamException {
	public InvalidParamShapeException(String message) {
		super(message);
	}
}
