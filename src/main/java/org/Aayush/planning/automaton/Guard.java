package org.Aayush.planning.automaton;

/**
 * Conjunction of literals over a {@link PropositionAlphabet}.
 *
 * @param positive propositions that must hold.
 * @param negative propositions that must not hold.
 */
public record Guard(long positive, long negative) {
    public static final Guard TRUE = new Guard(0L, 0L);

    public boolean matches(long labelMask) {
        return (labelMask & positive) == positive && (labelMask & negative) == 0L;
    }

    public boolean isSatisfiable() {
        return (positive & negative) == 0L;
    }

    public String describe(PropositionAlphabet alphabet) {
        if (positive == 0L && negative == 0L) {
            return "true";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < alphabet.size(); i++) {
            long bit = 1L << i;
            if ((positive & bit) != 0L || (negative & bit) != 0L) {
                if (sb.length() > 0) {
                    sb.append(" && ");
                }
                if ((negative & bit) != 0L) {
                    sb.append('!');
                }
                sb.append(alphabet.name(i));
            }
        }
        return sb.toString();
    }
}
