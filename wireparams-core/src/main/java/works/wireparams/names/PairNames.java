package works.wireparams.names;

import static java.util.Objects.requireNonNull;

public record PairNames(ParamNames left, ParamNames right) implements ParamNames {
	public PairNames {
		requireNonNull(left);
		requireNonNull(right);
	}
}
