package works.wireparams.codec;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CodecSettings {
	/**
	 * If set, a decode that leaves any parameter or file unclaimed fails with
	 * {@link works.wireparams.exceptions.UnexpectedParameterException}.
	 * <p>
	 * This is what lets several services share a path and still be told apart
	 * by the names of their parameters.
	 * The default tolerates strays, which browsers and proxies add more often than you'd think.
	 */
	@Default boolean rejectUnusedParameters = false;

	/**
	 * If set, a shape that reads the URL suffix fails to decode when path segments
	 * remain after it has taken what it needs.
	 */
	@Default boolean rejectExtraSuffixSegments = true;

	public static final CodecSettings DEFAULT = CodecSettings.builder().build();

	public static final CodecSettings STRICT = DEFAULT.toBuilder()
		.rejectUnusedParameters(true)
		.build();
}
