package prefilter.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DisassembleMainTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return DisassembleMain.run(
            args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String[] outputLines() {
        return out.toString(StandardCharsets.UTF_8).split("\\R");
    }

    @Test
    void printsOneJsonObjectPerPattern() throws Exception {
        assertEquals(0, run("ab(c|d)e", "x.y"));

        final String[] lines = outputLines();
        assertEquals(2, lines.length);

        final JsonNode first = mapper.readTree(lines[0]);
        assertEquals("ab(c|d)e", first.get("pattern").asText());
        assertEquals(mapper.readTree("[\"ab\",\"e\"]"), first.get("substrings"));
        assertEquals(mapper.readTree("[[\"abce\"],[\"abde\"]]"), first.get("alternatedSubstrings"));
        assertFalse(first.has("caseInsensitive"));

        final JsonNode second = mapper.readTree(lines[1]);
        assertEquals(mapper.readTree("[\"x\",\"y\"]"), second.get("substrings"));
    }

    @Test
    void appliesFlags() throws Exception {
        assertEquals(0, run("-i", "ab"));
        final JsonNode result = mapper.readTree(outputLines()[0]);
        assertEquals("AB", result.get("substrings").get(0).asText());
        assertTrue(result.get("caseInsensitive").asBoolean());
    }

    @Test
    void reportsPatternErrors() throws Exception {
        assertEquals(1, run("ok", "(broken"));
        final String[] lines = outputLines();
        assertEquals(2, lines.length);
        final JsonNode broken = mapper.readTree(lines[1]);
        assertTrue(broken.get("error").asText().startsWith("Unclosed group"));
        assertEquals(7, broken.get("index").asInt());
    }

    @Test
    void boundsAlternatives() throws Exception {
        assertEquals(0, run("--max-alternatives", "2", "(a|b)(c|d)"));
        final JsonNode result = mapper.readTree(outputLines()[0]);
        assertEquals(mapper.readTree("[[]]"), result.get("alternatedSubstrings"));
    }

    @Test
    void doubleDashEndsOptions() throws Exception {
        assertEquals(0, run("--", "-i"));
        assertEquals(mapper.readTree("[\"-i\"]"), mapper.readTree(outputLines()[0]).get("substrings"));
    }

    @Test
    void rejectsBadUsage() throws Exception {
        assertEquals(2, run());
        assertEquals(2, run("--bogus", "a"));
        assertEquals(2, run("--max-alternatives", "many", "a"));
        assertEquals(2, run("--max-alternatives", "0", "a"));
        assertEquals(2, run("--max-alternatives"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}
