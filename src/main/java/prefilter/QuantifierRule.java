package prefilter;

import prefilter.ast.Quantifier;
import java.util.List;

/**
 * How repeating a fragment changes its mandatory substrings.
 *
 * <pre>
 *   rule             when                       substrings            left   right
 *   ---------------  -------------------------  --------------------  -----  ---------
 *   OPTIONAL         min == 0                   none                  false  false
 *   IDENTITY         exactly once               unchanged             same   same
 *   FIXED_LITERAL    pure, min == max           literal x min         true   true
 *   RANGED_LITERAL   pure, min &lt; max           literal x min         true   false
 *   REPRESENTATIVE   not pure, min &gt;= 1        one copy              same   false
 * </pre>
 *
 * <p>Rows are tried top to bottom by {@link #classify}. A repeated literal
 * longer than {@link #MAX_LITERAL_LENGTH} is cut to a prefix of whole copies,
 * and its right edge is then no longer exact.
 */
public enum QuantifierRule {

  OPTIONAL {
    @Override
    Fragment repeat(Fragment fragment, Quantifier quantifier) {
      return Fragment.OPAQUE;
    }
  },

  IDENTITY {
    @Override
    Fragment repeat(Fragment fragment, Quantifier quantifier) {
      return fragment;
    }
  },

  FIXED_LITERAL {
    @Override
    Fragment repeat(Fragment fragment, Quantifier quantifier) {
      return repeatLiteral(fragment, quantifier, true);
    }
  },

  RANGED_LITERAL {
    @Override
    Fragment repeat(Fragment fragment, Quantifier quantifier) {
      return repeatLiteral(fragment, quantifier, false);
    }
  },

  REPRESENTATIVE {
    @Override
    Fragment repeat(Fragment fragment, Quantifier quantifier) {
      return new Fragment(fragment.substrings(), fragment.leftExact(), false);
    }
  };

  /**
   * Longest literal produced by repeating a pure fragment.
   */
  public static final int MAX_LITERAL_LENGTH = 4096;

  abstract Fragment repeat(Fragment fragment, Quantifier quantifier);

  /**
   * Pick the row of the table that applies.
   *
   * @param fragment fragment being repeated
   * @param quantifier repetition bounds
   */
  public static QuantifierRule classify(Fragment fragment, Quantifier quantifier) {
    if (quantifier.isOptional()) {
      return OPTIONAL;
    } else if (quantifier.isOnce()) {
      return IDENTITY;
    } else if (fragment.isPure()) {
      return quantifier.isFixed() ? FIXED_LITERAL : RANGED_LITERAL;
    } else {
      return REPRESENTATIVE;
    }
  }

  /**
   * Repeat a fragment according to its row of the table.
   *
   * @param fragment fragment being repeated
   * @param quantifier repetition bounds
   * @return fragment for the repetition as a whole
   */
  public static Fragment apply(Fragment fragment, Quantifier quantifier) {
    return classify(fragment, quantifier).repeat(fragment, quantifier);
  }

  private static Fragment repeatLiteral(Fragment fragment, Quantifier quantifier, boolean exactEnd) {
    final String unit = fragment.substrings().get(0);
    final int copies = Math.min(quantifier.min(), Math.max(1, MAX_LITERAL_LENGTH / unit.length()));
    return new Fragment(List.of(unit.repeat(copies)), true, exactEnd && copies == quantifier.min());
  }
}
