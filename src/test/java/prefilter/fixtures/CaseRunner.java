package prefilter.fixtures;

import prefilter.RegexpDisassembler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Consumer;
import java.util.regex.PatternSyntaxException;

/**
 * Charged with running fixture cases.
 */
public class CaseRunner implements Consumer<DisassemblyCase> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * How are case outcomes reported?
     */
    final CaseReporter reporter;

    public CaseRunner(CaseReporter reporter) {
        this.reporter = reporter;
    }

    /**
     * Accept a new case.
     *
     * @param disassemblyCase case to run
     */
    @Override
    public void accept(DisassemblyCase disassemblyCase) {

        // Parse the pattern
        final RegexpDisassembler disassembler;
        try {
            disassembler = RegexpDisassembler.of(disassemblyCase.pattern);
        } catch (PatternSyntaxException error) {
            if (disassemblyCase.expectsError()) {
                reporter.onSuccess(disassemblyCase, true);
            } else {
                reporter.onPatternError(disassemblyCase, error);
            }
            return;
        }

        if (disassemblyCase.expectsError()) {
            reporter.onUnexpectedOutput(disassemblyCase, "parse", "no error");
            return;
        }

        // Compare the outputs
        try {
            final JsonNode foundSubstrings = MAPPER.valueToTree(disassembler.substrings());
            if (!MAPPER.readTree(disassemblyCase.substrings).equals(foundSubstrings)) {
                reporter.onUnexpectedOutput(disassemblyCase, "substrings", foundSubstrings.toString());
                return;
            }

            final JsonNode foundAlternated = MAPPER.valueToTree(disassembler.alternatedSubstrings());
            if (!MAPPER.readTree(disassemblyCase.alternatedSubstrings).equals(foundAlternated)) {
                reporter.onUnexpectedOutput(disassemblyCase, "alternatedSubstrings", foundAlternated.toString());
                return;
            }
        } catch (JsonProcessingException malformed) {
            reporter.onPatternError(disassemblyCase, malformed);
            return;
        }

        reporter.onSuccess(disassemblyCase, false);
    }
}
