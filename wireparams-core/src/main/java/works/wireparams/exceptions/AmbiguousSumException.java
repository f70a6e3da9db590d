package works.wireparams.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The discriminator of a binary sum is absent or names neither alternative.
 */
public final class AmbiguousSumException extends ParamDecodeException {
	private final @Nullable String rawValue;

	public AmbiguousSumException(String discriminatorKey, @Nullable String rawValue) {
		super(discriminatorKey, (rawValue == null)
			? "Missing sum discriminator \"" + discriminatorKey + "\""
			: "Unrecognized sum discriminator \"" + discriminatorKey + "\": \"" + rawValue + "\"");
		this.rawValue = rawValue;
	}

	public @Nullable String rawValue() {
		return rawValue;
	}
}
