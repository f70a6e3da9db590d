package works.wireparams.shape;

import java.util.Set;
import works.wireparams.Unit;

/**
 * No parameters at all.
 */
public record UnitNode() implements ParamType<Unit> {
	@Override
	public Set<String> names() {
		return Set.of();
	}

	@Override
	public boolean containsSuffix() {
		return false;
	}

	@Override
	public int sumCount() {
		return 0;
	}

	@Override
	public String toString() {
		return "unit";
	}
}
