package works.wireparams.codec;

/**
 * Turns values of one parameter shape into their wire form.
 * Obtained from {@link ParamCodec#encoderFor}.
 */
public interface ParamEncoder<T> {
	/**
	 * @param value must match the shape this encoder was made for
	 * @throws IllegalArgumentException if the value can't be put on the wire, as with an uploaded file
	 */
	Construction construct(T value);
}
