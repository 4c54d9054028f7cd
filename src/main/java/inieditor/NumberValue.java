package inieditor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Unsigned decimal magnitude. The grammar has no sign, exponent or
 * special values, so neither does this type.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NumberValue implements Value {

    private final double number;

    public NumberValue(double number) {
        Validate.isTrue(Double.isFinite(number), "number must be finite: %s", number);
        Validate.isTrue(number >= 0, "number must not be negative: %s", number);
        this.number = number;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
