package inieditor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Key/value pair, with the comment lines written above it and the blank
 * lines written below it.
 */
@Getter
@EqualsAndHashCode
@ToString
public class IniProperty {

    private final List<String> comments = new ArrayList<>();
    private final String key;
    private Value value;
    private final List<String> blankLines = new ArrayList<>();

    public IniProperty(String key, Value value) {
        this.key = Validate.notNull(key, "key must not be null");
        this.value = Validate.notNull(value, "value must not be null");
    }

    public void setValue(Value value) {
        this.value = Validate.notNull(value, "value must not be null");
    }

    /**
     * Replaces the comment lines. Each line is written verbatim, so it should
     * start with {@code #} or {@code ;}.
     */
    public void setComments(List<String> comments) {
        this.comments.clear();
        if (comments != null) {
            this.comments.addAll(comments);
        }
    }
}
