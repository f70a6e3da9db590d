package works.wireparams.codec;

import works.wireparams.codec.interpreter.ShapeInterpretingDecoder;
import works.wireparams.codec.interpreter.ShapeInterpretingEncoder;
import works.wireparams.shape.ParamType;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link ParamCodec} according to the user's instructions.
 */
public class ParamCodecBuilder {
	private final CodecSettings settings;

	private ParamCodecBuilder(CodecSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public static ParamCodecBuilder using(CodecSettings settings) {
		return new ParamCodecBuilder(settings);
	}

	public static ParamCodec defaultCodec() {
		return DEFAULT_CODEC;
	}

	public ParamCodec build() {
		return new ParamCodec() {
			@Override
			public CodecSettings settings() {
				return settings;
			}

			@Override
			public <T> ParamEncoder<T> encoderFor(ParamType<T> type) {
				return new ShapeInterpretingEncoder<>(type);
			}

			@Override
			public <T> ParamDecoder<T> decoderFor(ParamType<T> type) {
				return new ShapeInterpretingDecoder<>(type, settings);
			}

			@Override
			public String toString() {
				return "ParamCodec(" + settings + ")";
			}
		};
	}

	private static final ParamCodec DEFAULT_CODEC = using(CodecSettings.DEFAULT).build();
}
