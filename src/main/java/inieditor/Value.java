package inieditor;

/**
 * Value of a property: either a {@link StringValue} or a {@link NumberValue}.
 * Consumers branch through {@link Visitor}, so a new variant breaks every
 * one of them at compile time.
 */
public sealed interface Value permits StringValue, NumberValue {

    <R> R accept(Visitor<R> visitor);

    static Value of(String text) {
        return new StringValue(text);
    }

    static Value of(double number) {
        return new NumberValue(number);
    }

    interface Visitor<R> {
        R visitString(StringValue value);

        R visitNumber(NumberValue value);
    }
}
