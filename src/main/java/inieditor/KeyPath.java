package inieditor;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * A {@code "section/key"} or {@code "key"} address. The split happens on the
 * last {@code /}; an empty section part means the global scope.
 */
@Value
public class KeyPath {
    String section;
    String key;

    public static KeyPath parse(String path) {
        Validate.notNull(path, "path must not be null");
        int slash = path.lastIndexOf('/');
        if (slash < 0) {
            return new KeyPath("", path);
        }
        return new KeyPath(path.substring(0, slash), path.substring(slash + 1));
    }

    public boolean isGlobal() {
        return StringUtils.isEmpty(section);
    }

    @Override
    public String toString() {
        return isGlobal() ? key : section + "/" + key;
    }
}
