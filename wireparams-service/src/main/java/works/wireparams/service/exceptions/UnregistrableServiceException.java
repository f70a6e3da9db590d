package works.wireparams.service.exceptions;

public class UnregistrableServiceException extends ServiceException {
	public UnregistrableServiceException(String message) {
		super(message);
	}
}
