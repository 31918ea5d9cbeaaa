package works.glint;

import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/**
 * A GraphQL identifier, used as an {@link GqlObject object} key
 * and as the payload of an {@link EnumValue enum value}.
 * <p>
 * Names match <code>[_A-Za-z][_0-9A-Za-z]*</code>
 * and are ordered by their text.
 */
public final class Name implements Comparable<Name> {
	@NotNull
	final String text;

	private Name(@NotNull String text) {
		this.text = text;
	}

	public static Name of(String text) {
		if (text.isEmpty()) {
			throw new IllegalArgumentException("Name can't be empty");
		} else if (!VALID_NAME.matcher(text).matches()) {
			throw new IllegalArgumentException("Invalid GraphQL name: \"" + text + "\"");
		}
		return new Name(text);
	}

	/**
	 * @return the {@link Name} for <code>text</code>, or empty if it isn't a valid name.
	 */
	public static Optional<Name> parse(String text) {
		if (VALID_NAME.matcher(text).matches()) {
			return Optional.of(new Name(text));
		} else {
			return Optional.empty();
		}
	}

	public String text() {
		return text;
	}

	@Override
	public int compareTo(Name other) {
		return text.compareTo(other.text);
	}

	@Override
	public String toString() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Name that = (Name) o;
		return text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	private static final Pattern VALID_NAME = Pattern.compile("[_A-Za-z][_0-9A-Za-z]*");
}
