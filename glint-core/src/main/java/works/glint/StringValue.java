package works.glint;

import static java.util.Objects.requireNonNull;

public record StringValue(GqlString string) implements Value {
	public StringValue {
		requireNonNull(string);
	}

	public String text() {
		return string.text();
	}
}
