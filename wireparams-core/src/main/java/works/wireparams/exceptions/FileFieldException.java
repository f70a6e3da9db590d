package works.wireparams.exceptions;

public final class FileFieldException extends ParamDecodeException {
	public FileFieldException(String paramName, String reason) {
		super(paramName, "File parameter \"" + paramName + "\": " + reason);
	}
}
