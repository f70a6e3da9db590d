package works.wireparams.service.exceptions;

public abstract class ServiceException extends RuntimeException {
	protected ServiceException(String message) {
		super(message);
	}
}
