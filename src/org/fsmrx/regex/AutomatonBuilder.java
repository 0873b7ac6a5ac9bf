/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import static org.fsmrx.regex.Misc.codePointsOf;
import static org.fsmrx.regex.Misc.isSet;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmrx.regex.State.Quantifier;

/**
 * Builds an {@link Automaton} from a pattern in a single left to right pass.
 * Each atom (literal, <code>.</code> or bracketed class) becomes one state,
 * linked from the state built before it; a quantifier wraps the state before
 * it in a {@link State.Kind#REPEAT} state. There is no recursion and no
 * lookahead, save the scan for the <code>]</code> of a class.
 * <p>
 * Instances hold parsing state and are not thread safe; use one per build.
 */
final class AutomatonBuilder {

    private static final Logger logger = Logger.getLogger("org.fsmrx.regex");
    private static final Level level = Level.FINER;

    /*
     * fields to hold parameters and derived parameters
     */
    private String regex;
    private boolean foldcase;
    private boolean literal;

    /*
     * aux fields for parsing
     */
    private int iNext;          // cursor: index of the next char to read
    private State start;
    private State prev;         // the state built last
    private State prevPrev;     // the state built before it, if any

    private void init() {
        iNext = 0;
        start = State.start();
        prev = start;
        prevPrev = null;
    }

    Automaton build(String regex, int flags) {

        if (regex == null) throw new NullPointerException("regex");
        this.regex = regex;
        this.foldcase = isSet(flags, Pattern.CASE_INSENSITIVE);
        this.literal = isSet(flags, Pattern.LITERAL);

        init();

        while (iNext < regex.length()) {
            final int iCurrent = iNext;
            final int c = regex.codePointAt(iCurrent);
            iNext += Character.charCount(c);

            if (literal) {
                append(State.literal(iCurrent, c, foldcase));
                continue;
            }
            switch (c) {
            case '*':
            case '+':
                repeat(iCurrent, Quantifier.forSymbol(c));
                break;
            case '[':
                charClass(iCurrent);
                break;
            case '.':
                append(State.wildcard(iCurrent));
                break;
            default:
                append(State.literal(iCurrent, c, foldcase));
                break;
            }
        }

        State terminal = State.terminal(regex.length());
        prev.link(terminal);
        Automaton ret = new Automaton(regex, start, terminal);
        logger.log(level, ret.toString());
        return ret;
    }

    private void append(State s) {
        prev.link(s);
        prevPrev = prev;
        prev = s;
    }

    /*
     * The repeat is entered from the atom it repeats; a star may also be
     * entered from whatever came before that atom, skipping it.
     */
    private void repeat(int iCurrent, Quantifier q) {
        State rep = State.repeat(iCurrent, prev, q);
        if (q == Quantifier.STAR) {
            if (starFollowedByClassPlus(iCurrent)) {
                rep.markNonFinal();
            }
            (prevPrev != null ? prevPrev : start).link(rep);
        }
        prev.link(rep);
        prevPrev = prev;
        prev = rep;
    }

    /*
     * true for "*[...]+": the star's repeat then must not count as an
     * accepting state by itself, since the class atom that follows is
     * mandatory.
     */
    private boolean starFollowedByClassPlus(int iStar) {
        if (iStar + 1 >= regex.length() || regex.charAt(iStar + 1) != '[') {
            return false;
        }
        int j = regex.indexOf(']', iStar + 2);
        return j != -1 && j + 1 < regex.length() && regex.charAt(j + 1) == '+';
    }

    private void charClass(int iCurrent) {
        int iClose = regex.indexOf(']', iCurrent + 1);
        if (iClose == -1) {
            syntaxError("Unclosed character class", iCurrent);
        }
        String content = regex.substring(iCurrent + 1, iClose);
        boolean negated = content.startsWith("^");
        if (negated) {
            content = content.substring(1);
        }

        CharClass.Builder ccb = new CharClass.Builder();
        int[] cps = codePointsOf(content);
        int k = 0;
        while (k < cps.length) {
            if (k + 2 < cps.length && cps[k + 1] == '-') {
                ccb.add(cps[k], cps[k + 2]);
                k += 3;
            } else {
                ccb.add(cps[k]);
                k += 1;
            }
        }
        append(State.charClass(iCurrent, ccb.build(content), negated, foldcase));
        iNext = iClose + 1;
    }

    private void syntaxError(String msg, int index) {
        throw new MalformedPatternException(msg, regex, index);
    }
}
