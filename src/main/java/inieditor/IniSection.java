package inieditor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.List;

@Getter
@EqualsAndHashCode
@ToString
public class IniSection {

    private final List<String> comments = new ArrayList<>();
    private final String name;
    private final List<String> blankLines = new ArrayList<>();
    private final List<IniProperty> properties = new ArrayList<>();

    public IniSection(String name) {
        this.name = Validate.notNull(name, "name must not be null");
    }

    public void setComments(List<String> comments) {
        this.comments.clear();
        if (comments != null) {
            this.comments.addAll(comments);
        }
    }
}
