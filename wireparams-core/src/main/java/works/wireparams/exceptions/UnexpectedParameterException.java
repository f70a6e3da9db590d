package works.wireparams.exceptions;

import java.util.List;

/**
 * Some parameters were left over after decoding.
 * Only thrown when {@link works.wireparams.codec.CodecSettings#isRejectUnusedParameters() rejectUnusedParameters} is set.
 */
public final class UnexpectedParameterException extends ParamDecodeException {
	private final List<String> unexpectedNames;

	public UnexpectedParameterException(List<String> unexpectedNames) {
		super(unexpectedNames.get(0), "Unexpected parameters " + unexpectedNames);
		this.unexpectedNames = List.copyOf(unexpectedNames);
	}

	public List<String> unexpectedNames() {
		return unexpectedNames;
	}
}
