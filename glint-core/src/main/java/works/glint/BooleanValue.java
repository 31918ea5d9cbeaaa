package works.glint;

public record BooleanValue(boolean value) implements Value {
}
