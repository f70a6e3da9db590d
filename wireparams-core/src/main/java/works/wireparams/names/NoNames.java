package works.wireparams.names;

/**
 * A shape with no fields a form could fill in: {@code unit}, or {@code any}.
 */
public enum NoNames implements ParamNames {
	INSTANCE
}
