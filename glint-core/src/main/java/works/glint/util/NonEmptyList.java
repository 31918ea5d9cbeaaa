package works.glint.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An immutable list with at least one element.
 */
public record NonEmptyList<E>(List<E> asList) {
	public NonEmptyList {
		asList = List.copyOf(asList);
		if (asList.isEmpty()) {
			throw new IllegalArgumentException("NonEmptyList can't be empty");
		}
	}

	@SafeVarargs
	public static <E> NonEmptyList<E> of(E first, E... rest) {
		List<E> elements = new ArrayList<>(1 + rest.length);
		elements.add(first);
		elements.addAll(List.of(rest));
		return new NonEmptyList<>(elements);
	}

	/**
	 * @return the given elements as a {@link NonEmptyList}, or empty if there are none.
	 */
	public static <E> Optional<NonEmptyList<E>> from(List<E> elements) {
		if (elements.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(new NonEmptyList<>(elements));
		}
	}

	public E head() {
		return asList.get(0);
	}

	public List<E> tail() {
		return asList.subList(1, asList.size());
	}

	public int size() {
		return asList.size();
	}
}
