package works.wireparams.service.exceptions;

import java.util.List;

/**
 * No registered service answers the requested path.
 */
public class ServiceNotFoundException extends ServiceException {
	private final List<String> path;

	public ServiceNotFoundException(List<String> path) {
		super("No service at /" + String.join("/", path));
		this.path = List.copyOf(path);
	}

	public List<String> path() {
		return path;
	}
}
