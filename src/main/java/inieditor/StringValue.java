package inieditor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Logical (unescaped) text of a quoted string literal.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class StringValue implements Value {

    private final String text;

    public StringValue(String text) {
        this.text = Validate.notNull(text, "text must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitString(this);
    }
}
