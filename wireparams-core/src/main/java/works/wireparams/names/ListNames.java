package works.wireparams.names;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import works.wireparams.codec.NameGenerator;
import works.wireparams.shape.ParamType;

import static java.util.Objects.requireNonNull;

/**
 * The names of a list, which depend on the index of each element.
 */
public final class ListNames implements ParamNames {
	private final String listName;
	private final ParamType<?> element;
	private final NameGenerator parent;

	ListNames(String listName, ParamType<?> element, NameGenerator parent) {
		this.listName = requireNonNull(listName);
		this.element = requireNonNull(element);
		this.parent = requireNonNull(parent);
	}

	public String listName() {
		return listName;
	}

	/**
	 * @return the key prefix shared by every element's fields
	 */
	public String prefix() {
		return parent.listPrefix(listName);
	}

	public ParamNames element(int index) {
		if (index < 0) {
			throw new IndexOutOfBoundsException("Negative list index " + index);
		}
		return ParamNames.of(element, parent.listElement(listName, index));
	}

	/**
	 * Builds something (typically form fields) for each element of {@code elements}.
	 *
	 * @param f given the names of element {@code i} and {@code elements.get(i)}
	 * @param tail appended after the results for all the elements
	 * @return the concatenation of the results of {@code f}, followed by {@code tail}
	 */
	public <E, R> List<R> it(BiFunction<ParamNames, E, List<R>> f, List<E> elements, List<R> tail) {
		List<R> result = new ArrayList<>();
		for (int i = 0; i < elements.size(); i++) {
			result.addAll(f.apply(element(i), elements.get(i)));
		}
		result.addAll(tail);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (!(obj instanceof ListNames)) {
			return false;
		}
		ListNames other = (ListNames) obj;
		return listName.equals(other.listName)
			&& element.equals(other.element)
			&& parent.equals(other.parent);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * listName.hashCode() + element.hashCode()) + parent.hashCode();
	}

	@Override
	public String toString() {
		return prefix() + "*";
	}
}
