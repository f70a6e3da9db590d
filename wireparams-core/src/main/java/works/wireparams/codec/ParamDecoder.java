package works.wireparams.codec;

import java.util.List;
import java.util.Map;
import works.wireparams.FileInfo;
import works.wireparams.Param;
import works.wireparams.exceptions.ParamDecodeException;

/**
 * Rebuilds values of one parameter shape from the parameters of a request.
 * Obtained from {@link ParamCodec#decoderFor}.
 */
public interface ParamDecoder<T> {
	/**
	 * @param params query or body pairs; order matters only among pairs with the same key
	 * @param files uploads, by field name
	 * @param suffix the URL path segments after the service's path
	 * @throws ParamDecodeException on the first parameter that doesn't fit
	 */
	T reconstruct(List<Param> params, Map<String, List<FileInfo>> files, List<String> suffix) throws ParamDecodeException;

	default T reconstruct(List<Param> params) throws ParamDecodeException {
		return reconstruct(params, Map.of(), List.of());
	}
}
