package inieditor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RoundTripIniTest {

    private static final String INPUT_1 = "src/test/resources/roundtrip/ini/input_1";
    private static final String INPUT_2 = "src/test/resources/roundtrip/ini/input_2";
    private static final String EXPECTED_2 = "src/test/resources/roundtrip/ini/expected_2";
    private static final String EXPECTED_3 = "src/test/resources/roundtrip/ini/expected_3";
    private static final String RENDER_CASES = "src/test/resources/roundtrip/ini/render_cases.yaml";
    private static final String EDIT_CASES = "src/test/resources/roundtrip/ini/edit_cases.yaml";

    private final RoundTripIni ini = new RoundTripIni();

    @Test
    void rendersCanonicalFileUnchanged() throws Exception {
        var inputData = Files.readString(Paths.get(INPUT_1));

        var actual = ini.render(ini.parse(INPUT_1, inputData));

        assertEquals(inputData, actual);
    }

    @Test
    void normalizesFormatting() throws Exception {
        var inputData = Files.readString(Paths.get(INPUT_2));

        var actual = ini.normalize(INPUT_2, inputData);

        assertEquals(Files.readString(Paths.get(EXPECTED_2)), actual);
    }

    @Test
    void normalizedOutputIsFixedPoint() throws Exception {
        var once = ini.normalize(INPUT_2, Files.readString(Paths.get(INPUT_2)));

        assertEquals(once, ini.normalize("again", once));
    }

    @Test
    void editsKeepUntouchedCommentsAndBlankLines() throws Exception {
        var document = ini.parse(INPUT_1, Files.readString(Paths.get(INPUT_1)));

        document.add("database/port", Value.of(6543));
        document.add("database/user", Value.of("admin"));
        document.remove("version");
        document.removeSection("paths");
        document.add("cache/ttl", Value.of(30));
        document.lookup("name").orElseThrow().setComments(List.of("# project name", "# second line"));

        assertEquals(Files.readString(Paths.get(EXPECTED_3)), ini.render(document));
    }

    @Test
    void editedOutputParsesToEqualTree() throws Exception {
        var document = ini.parse(INPUT_1, Files.readString(Paths.get(INPUT_1)));
        document.add("extra/flag", Value.of("on"));

        var reparsed = ini.parse("rendered", ini.render(document));

        assertEquals(document, reparsed);
    }

    @Test
    void parseErrorsPropagate() {
        var e = assertThrows(IniParseException.class, () -> ini.parse("broken.ini", "[s1\n"));

        assertEquals("broken.ini", e.getSourceLabel());
    }

    @Test
    void numbersAtTheEdgeOfDoubleRange() throws Exception {
        var canonical = "big = 200000000000000000000000\nmax = 17976931348623157" + "0".repeat(292) + "\n";

        assertEquals(canonical, ini.normalize("big.ini", canonical));
        assertThrows(IniParseException.class, () -> ini.parse("huge.ini", "a = 2" + "0".repeat(308) + "\n"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("renderCases")
    void rendersWithoutEdits(String name, Map<String, Object> testCase) throws Exception {
        var input = (String) testCase.get("input");
        var want = (String) testCase.getOrDefault("want", input);

        var once = ini.normalize(name, input);

        assertEquals(want, once);
        assertEquals(once, ini.normalize(name, once));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("editCases")
    void appliesEdit(String name, Map<String, Object> testCase) throws Exception {
        var document = ini.parse(name, (String) testCase.get("input"));
        var path = (String) testCase.get("path");

        switch ((String) testCase.get("op")) {
            case "add":
                document.add(path, toValue(testCase.get("value")));
                break;
            case "remove":
                document.remove(path);
                break;
            case "removeSection":
                document.removeSection(path);
                break;
            default:
                throw new IllegalArgumentException("unknown op in " + name);
        }

        assertEquals(testCase.get("want"), ini.render(document));
    }

    static Stream<Arguments> renderCases() throws IOException {
        return loadCases(RENDER_CASES);
    }

    static Stream<Arguments> editCases() throws IOException {
        return loadCases(EDIT_CASES);
    }

    private static Stream<Arguments> loadCases(String file) throws IOException {
        try (var in = Files.newInputStream(Paths.get(file))) {
            List<Map<String, Object>> cases = new Yaml().load(in);
            return cases.stream().map(c -> Arguments.of(c.get("name"), c));
        }
    }

    private static Value toValue(Object raw) {
        if (raw instanceof Number) {
            return Value.of(((Number) raw).doubleValue());
        }
        return Value.of(String.valueOf(raw));
    }
}
