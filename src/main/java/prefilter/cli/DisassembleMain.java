package prefilter.cli;

import prefilter.RegexpDisassembler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Prints the mandatory substrings of patterns given on the command line.
 *
 * <p>Each pattern produces one line of JSON on standard output. Exit status
 * is 0 on success, 1 if any pattern failed to parse, 2 on bad usage.
 */
public final class DisassembleMain {

  private static final String USAGE = String.join(System.lineSeparator(),
    "Usage: DisassembleMain [options] [--] PATTERN...",
    "  -i                      case-insensitive",
    "  -x                      allow whitespace and comments",
    "  -q                      treat each pattern as a literal string",
    "  --max-alternatives N    bound on alternated rows (default " +
      RegexpDisassembler.DEFAULT_MAX_ALTERNATIVES + ")",
    "  --debug                 trace the computation on standard error"
  );

  private DisassembleMain() { }

  public static void main(String[] args) throws IOException {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
    int flags = 0;
    int maxAlternatives = RegexpDisassembler.DEFAULT_MAX_ALTERNATIVES;
    boolean printDebugInfo = false;
    final var patterns = new ArrayList<String>();

    boolean optionsDone = false;
    for (int i = 0; i < args.length; i++) {
      final String arg = args[i];
      if (optionsDone || !arg.startsWith("-") || arg.equals("-")) {
        patterns.add(arg);
        continue;
      }
      switch (arg) {
        case "--":
          optionsDone = true;
          break;
        case "-i":
          flags |= Pattern.CASE_INSENSITIVE;
          break;
        case "-x":
          flags |= Pattern.COMMENTS;
          break;
        case "-q":
          flags |= Pattern.LITERAL;
          break;
        case "--debug":
          printDebugInfo = true;
          break;
        case "--max-alternatives":
          if (i + 1 >= args.length) {
            err.println("Missing value for --max-alternatives");
            err.println(USAGE);
            return 2;
          }
          try {
            maxAlternatives = Integer.parseInt(args[++i]);
          } catch (NumberFormatException notANumber) {
            err.println("Invalid value for --max-alternatives: " + args[i]);
            return 2;
          }
          if (maxAlternatives < 1) {
            err.println("--max-alternatives must be at least 1");
            return 2;
          }
          break;
        case "-h":
        case "--help":
          out.println(USAGE);
          return 0;
        default:
          err.println("Unknown option: " + arg);
          err.println(USAGE);
          return 2;
      }
    }

    if (patterns.isEmpty()) {
      err.println(USAGE);
      return 2;
    }

    final var mapper = new ObjectMapper();
    int status = 0;
    for (final String pattern : patterns) {
      final ObjectNode result = mapper.createObjectNode();
      result.put("pattern", pattern);
      try {
        final var disassembler = RegexpDisassembler.of(pattern, flags, maxAlternatives, printDebugInfo);
        result.set("substrings", mapper.valueToTree(disassembler.substrings()));
        result.set("alternatedSubstrings", mapper.valueToTree(disassembler.alternatedSubstrings()));
        if (disassembler.isCaseInsensitive()) {
          result.put("caseInsensitive", true);
        }
      } catch (PatternSyntaxException error) {
        result.put("error", error.getDescription());
        result.put("index", error.getIndex());
        status = 1;
      }
      out.println(mapper.writeValueAsString(result));
    }
    return status;
  }
}
