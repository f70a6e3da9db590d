package works.wireparams;

/**
 * The value of a shape that carries no parameters.
 */
public enum Unit {
	UNIT
}
