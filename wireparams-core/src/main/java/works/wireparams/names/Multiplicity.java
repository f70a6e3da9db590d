package works.wireparams.names;

/**
 * How many values a form field may contribute under one {@link ParamName}.
 * A form helper should only offer widgets that agree with it:
 * a multi-select for {@link #SET}, something that can be left blank for {@link #OPT}.
 */
public enum Multiplicity {
	ONE,
	OPT,
	SET,
}
