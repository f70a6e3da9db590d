package works.wireparams.service.exceptions;

public class ServiceTableFrozenException extends ServiceException {
	public ServiceTableFrozenException(String message) {
		super(message);
	}
}
