/*
 * @LICENSE@
 */
package org.fsmrx.regex;

import static org.fsmrx.regex.Misc.Esc.RX;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides acceptance by running every live state of an {@link Automaton} in
 * lock step over the input, one code point at a time. No backtracking, and no
 * DFA tables: the set of live states (the frontier) is recomputed per code
 * point, so the cost is bounded by input length times automaton size.
 * <p>
 * The engine holds no per-match state and never modifies the automaton; a
 * single instance serves every {@link Matcher}.
 */
final class FrontierEngine {

    private static final Logger logger = Logger.getLogger("org.fsmrx.regex");
    private static final Level level = Level.FINEST;

    static final FrontierEngine INSTANCE = new FrontierEngine();

    private FrontierEngine() {
    }

    boolean accepts(Automaton a, CharSequence text) {

        Set<State> curr = new LinkedHashSet<State>();
        curr.add(a.start());

        for (int i = 0; i < text.length(); ) {
            final int c = Character.codePointAt(text, i);

            enterRepeats(curr);

            Set<State> next = new LinkedHashSet<State>();
            for (State s : curr) {
                State ns = s.checkNext(c);
                if (ns != null) next.add(ns);
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "at " + i + " '" + RX.esc(c) + "': "
                    + labelsOf(curr) + " -> " + labelsOf(next));
            }
            if (next.isEmpty()) {
                logger.log(Level.FINER, "rejected at " + i + ": " + a.pattern());
                return false;
            }
            curr = next;
            i += Character.charCount(c);
        }

        enterFinals(curr);
        for (State s : curr) {
            if (s.isFinal()) return true;
        }
        return false;
    }

    /*
     * One step of epsilon closure, restricted to repeats that may match
     * nothing: lets a star be entered before any of its input is seen.
     */
    private static void enterRepeats(Set<State> curr) {
        List<State> entered = new ArrayList<State>();
        for (State s : curr) {
            for (State ns : s.nextStates()) {
                if (ns.kind() == State.Kind.REPEAT && ns.isFinal()) {
                    entered.add(ns);
                }
            }
        }
        curr.addAll(entered);
    }

    /*
     * One step of epsilon closure at end of input, to any final state.
     */
    private static void enterFinals(Set<State> curr) {
        List<State> entered = new ArrayList<State>();
        for (State s : curr) {
            for (State ns : s.nextStates()) {
                if (ns.isFinal()) entered.add(ns);
            }
        }
        curr.addAll(entered);
    }

    private static String labelsOf(Set<State> states) {
        StringBuilder sb = new StringBuilder();
        for (State s : states) {
            sb.append(sb.length() == 0 ? "{" : ", ").append(s.label());
        }
        return sb.length() == 0 ? "{}" : sb.append('}').toString();
    }
}
