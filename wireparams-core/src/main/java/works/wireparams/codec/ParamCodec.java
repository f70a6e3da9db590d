package works.wireparams.codec;

import java.util.List;
import java.util.Map;
import works.wireparams.FileInfo;
import works.wireparams.Param;
import works.wireparams.shape.ParamType;

/**
 * A factory for parameter encoders and decoders.
 * Accessible via {@link ParamCodecBuilder}.
 * <p>
 * Encoders and decoders hold no mutable state and may be shared freely between threads.
 */
public interface ParamCodec {
	CodecSettings settings();

	<T> ParamEncoder<T> encoderFor(ParamType<T> type);

	<T> ParamDecoder<T> decoderFor(ParamType<T> type);

	default <T> Construction construct(ParamType<T> type, T value) {
		return encoderFor(type).construct(value);
	}

	default <T> String constructString(ParamType<T> type, T value) {
		return construct(type, value).relativeUri();
	}

	default <T> T reconstruct(ParamType<T> type, List<Param> params, Map<String, List<FileInfo>> files, List<String> suffix) {
		return decoderFor(type).reconstruct(params, files, suffix);
	}

	default <T> T reconstruct(ParamType<T> type, List<Param> params) {
		return decoderFor(type).reconstruct(params);
	}
}
