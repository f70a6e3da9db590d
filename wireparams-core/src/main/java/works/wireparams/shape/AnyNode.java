package works.wireparams.shape;

import java.util.List;
import java.util.Set;
import works.wireparams.Param;

/**
 * Whatever parameters remain, verbatim.
 */
public record AnyNode() implements ParamType<List<Param>> {
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
		return "any";
	}
}
