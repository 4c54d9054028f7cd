package inieditor;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;

/**
 * Input does not match the grammar. Carries the source label, the position
 * of the offending token and the constructs that would have been accepted.
 */
public class IniParseException extends Exception {

    private final String sourceLabel;
    private final transient Position position;
    private final List<String> expected;

    public IniParseException(String sourceLabel, Position position, String detail) {
        this(sourceLabel, position, detail, Collections.emptyList());
    }

    public IniParseException(String sourceLabel, Position position, String detail, List<String> expected) {
        super(format(sourceLabel, position, detail, expected));
        this.sourceLabel = StringUtils.defaultString(sourceLabel);
        this.position = position;
        this.expected = expected == null ? Collections.emptyList() : List.copyOf(expected);
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public Position getPosition() {
        return position;
    }

    public List<String> getExpected() {
        return expected;
    }

    private static String format(String sourceLabel, Position position, String detail, List<String> expected) {
        StringBuilder sb = new StringBuilder();
        if (StringUtils.isNotEmpty(sourceLabel)) {
            sb.append(sourceLabel).append(':');
        }
        sb.append(position).append(": ").append(detail);
        if (expected != null && !expected.isEmpty()) {
            sb.append(" (expected ").append(String.join(" or ", expected)).append(')');
        }
        return sb.toString();
    }
}
