package works.glint;

import static java.util.Objects.requireNonNull;

/**
 * The payload of a {@link StringValue}.
 * Kept distinct from {@link Name} so that string values and enum values
 * can't be confused.
 */
public record GqlString(String text) implements Comparable<GqlString> {
	public GqlString {
		requireNonNull(text);
	}

	@Override
	public int compareTo(GqlString other) {
		return text.compareTo(other.text);
	}
}
