package inieditor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Root of a parsed INI file: global properties first, then sections, each
 * node carrying its own comments and blank lines.
 * <p>
 * Editing methods address properties with a path, {@code "key"} for the
 * global scope and {@code "section/key"} for a named section. When names
 * repeat, the first match in file order wins. Properties and sections live
 * in separate namespaces: {@link #remove(String)} never touches a section
 * and {@link #removeSection(String)} never touches a property.
 * <p>
 * Not thread-safe.
 */
@Slf4j
@Getter
@EqualsAndHashCode
@ToString
public class IniDocument {

    private final List<String> blankLines = new ArrayList<>();
    private final List<IniProperty> properties = new ArrayList<>();
    private final List<IniSection> sections = new ArrayList<>();

    public Optional<IniProperty> lookup(String path) {
        KeyPath keyPath = KeyPath.parse(path);
        return scope(keyPath).flatMap(list -> first(list, keyPath.getKey(), IniProperty::getKey));
    }

    public Optional<IniSection> lookupSection(String name) {
        Validate.notNull(name, "name must not be null");
        return first(sections, name, IniSection::getName);
    }

    /**
     * Sets the value at {@code path}. An existing property keeps its comments
     * and blank lines; a missing one is appended to its scope, creating the
     * section at the end of the document when needed.
     *
     * @return the property now holding {@code value}
     * @throws IllegalArgumentException if the key or section is not a valid identifier
     */
    public IniProperty add(String path, Value value) {
        Validate.notNull(value, "value must not be null");
        KeyPath keyPath = KeyPath.parse(path);
        Validate.isTrue(IniGrammar.isIdentifier(keyPath.getKey()), "invalid key in path \"%s\"", path);
        Validate.isTrue(keyPath.isGlobal() || IniGrammar.isIdentifier(keyPath.getSection()),
                "invalid section in path \"%s\"", path);

        Optional<List<IniProperty>> scope = scope(keyPath);
        if (scope.isPresent()) {
            return addTo(scope.get(), keyPath, value);
        }

        IniSection section = new IniSection(keyPath.getSection());
        IniProperty property = new IniProperty(keyPath.getKey(), value);
        section.getProperties().add(property);
        sections.add(section);
        log.debug("Created section [{}] for {}", section.getName(), keyPath);
        return property;
    }

    public void remove(String path) {
        KeyPath keyPath = KeyPath.parse(path);
        scope(keyPath).ifPresent(list -> {
            int index = indexOf(list, keyPath.getKey(), IniProperty::getKey);
            if (index >= 0) {
                list.remove(index);
                log.debug("Removed {}", keyPath);
            }
        });
    }

    public void removeSection(String name) {
        Validate.notNull(name, "name must not be null");
        int index = indexOf(sections, name, IniSection::getName);
        if (index >= 0) {
            IniSection removed = sections.remove(index);
            log.debug("Removed section [{}] with {} properties", name, removed.getProperties().size());
        }
    }

    public String render() {
        return new IniEncoder().encode(this);
    }

    private static IniProperty addTo(List<IniProperty> list, KeyPath keyPath, Value value) {
        int index = indexOf(list, keyPath.getKey(), IniProperty::getKey);
        if (index >= 0) {
            IniProperty existing = list.get(index);
            existing.setValue(value);
            log.debug("Replaced value of {}", keyPath);
            return existing;
        }
        IniProperty property = new IniProperty(keyPath.getKey(), value);
        list.add(property);
        log.debug("Appended {}", keyPath);
        return property;
    }

    /**
     * Property list the path points into: the global list, or the list of the
     * first section with the given name. Empty if that section does not exist.
     */
    private Optional<List<IniProperty>> scope(KeyPath keyPath) {
        if (keyPath.isGlobal()) {
            return Optional.of(properties);
        }
        return first(sections, keyPath.getSection(), IniSection::getName).map(IniSection::getProperties);
    }

    private static <T> Optional<T> first(List<T> list, String name, Function<T, String> nameOf) {
        int index = indexOf(list, name, nameOf);
        return index < 0 ? Optional.empty() : Optional.of(list.get(index));
    }

    private static <T> int indexOf(List<T> list, String name, Function<T, String> nameOf) {
        for (int i = 0; i < list.size(); i++) {
            if (nameOf.apply(list.get(i)).equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
