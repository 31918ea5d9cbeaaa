package works.glint;

public record IntValue(int value) implements Value {
}
