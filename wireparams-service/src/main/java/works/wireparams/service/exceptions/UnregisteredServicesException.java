package works.wireparams.service.exceptions;

import java.util.List;

/**
 * Some services were declared but never registered by the end of initialisation.
 */
public class UnregisteredServicesException extends ServiceException {
	private final List<String> services;

	public UnregisteredServicesException(List<String> services) {
		super("Declared services were never registered: " + services);
		this.services = List.copyOf(services);
	}

	public List<String> services() {
		return services;
	}
}
