package prefilter.fixtures;

/**
 * Case in a fixture file.
 *
 * <p>Expected outputs are JSON text, or {@code error} when the pattern should
 * be rejected.
 */
public class DisassemblyCase {

    /**
     * Regular expression pattern.
     */
    public final String pattern;

    /**
     * Expected substrings, as a JSON array.
     */
    public final String substrings;

    /**
     * Expected alternated substrings, as a JSON array of arrays.
     */
    public final String alternatedSubstrings;

    /**
     * Source from which the case originated.
     */
    public final String source;

    /**
     * Line in the source from which the case originated.
     */
    public final int lineNumber;

    public DisassemblyCase(
        String pattern,
        String substrings,
        String alternatedSubstrings,
        String source,
        int lineNumber
    ) {
        this.pattern = pattern;
        this.substrings = substrings;
        this.alternatedSubstrings = alternatedSubstrings;
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public boolean expectsError() {
        return "error".equals(substrings);
    }

    /**
     * Render the case and its source location in a human readable fashion.
     */
    public String getSummary() {
        return "/" + pattern + "/ (at " + source + ":" + lineNumber + ")";
    }
}
