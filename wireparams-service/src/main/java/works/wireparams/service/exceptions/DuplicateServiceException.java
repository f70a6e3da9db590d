package works.wireparams.service.exceptions;

/**
 * A service with the same path, kind, state and parameter shapes is already registered.
 */
public class DuplicateServiceException extends ServiceException {
	public DuplicateServiceException(String message) {
		super(message);
	}
}
