/*@LICENSE@
 */

package org.fsmrx.regex;

import static junit.framework.Assert.*;
import static org.fsmrx.regex.Misc.Esc.JAVA;

import java.util.ArrayList;
import java.util.List;

import org.fsmrx.regex.State.Kind;


public final class RegexAssert {

    private RegexAssert() {}   // not instantiable.

    public static void assertAccepts(String regex, CharSequence... inputs) {
        assertAccepts(regex, 0, inputs);
    }

    public static void assertAccepts(String regex, int flags, CharSequence... inputs) {
        Pattern p = Pattern.compile(regex, flags);
        for (CharSequence input : inputs) {
            assertTrue(
                "\"" + JAVA.esc(regex) + "\" should accept \"" + JAVA.esc(input) + '"',
                p.matcher(input).matches());
        }
    }

    public static void assertRejects(String regex, CharSequence... inputs) {
        assertRejects(regex, 0, inputs);
    }

    public static void assertRejects(String regex, int flags, CharSequence... inputs) {
        Pattern p = Pattern.compile(regex, flags);
        for (CharSequence input : inputs) {
            assertFalse(
                "\"" + JAVA.esc(regex) + "\" should reject \"" + JAVA.esc(input) + '"',
                p.matcher(input).matches());
        }
    }

    public static void assertMalformed(String regex, int index) {
        try {
            Pattern.compile(regex);
            fail("should throw: " + regex);
        } catch (MalformedPatternException e) {
            assertEquals(regex, e.getPattern());
            assertEquals(index, e.getIndex());
        }
    }

    /*
     * the structural invariants every built automaton keeps
     */
    public static void assertWellFormed(Automaton a) {
        int starts = 0;
        int terminals = 0;
        for (State s : a.states()) {
            switch (s.kind()) {
            case START:
                ++starts;
                assertSame(a.start(), s);
                break;
            case TERMINAL:
                ++terminals;
                assertSame(a.terminal(), s);
                assertTrue(s.isFinal());
                assertTrue(s.nextStates().isEmpty());
                break;
            default:
                assertFalse("dead end: " + s, s.nextStates().isEmpty());
            }
        }
        assertEquals(1, starts);
        assertEquals(1, terminals);
        assertSame(a.start(), a.states().get(0));
    }

    public static List<State> statesOfKind(Automaton a, Kind kind) {
        List<State> ret = new ArrayList<State>();
        for (State s : a.states()) {
            if (s.kind() == kind) ret.add(s);
        }
        return ret;
    }
}
