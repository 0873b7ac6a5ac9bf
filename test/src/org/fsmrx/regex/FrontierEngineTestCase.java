/* @LICENSE@
 */

package org.fsmrx.regex;

import java.util.ArrayList;
import java.util.List;

public class FrontierEngineTestCase extends AbstractRxTestCase {

    private final FrontierEngine engine = FrontierEngine.INSTANCE;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(FrontierEngineTestCase.class);
    }

    public FrontierEngineTestCase(String name) {
        super(name);
    }

    private static Automaton build(String regex) {
        return new AutomatonBuilder().build(regex, 0);
    }

    public void testZeroOrMoreEnteredBeforeInput() {
        Automaton a = build("a*b");
        assertTrue(engine.accepts(a, "b"));
        assertTrue(engine.accepts(a, "ab"));
        assertTrue(engine.accepts(a, "aaaab"));
        assertFalse(engine.accepts(a, "c"));
        assertFalse(engine.accepts(a, "ba"));
    }

    public void testOneOrMoreIsMandatory() {
        Automaton a = build("a+b");
        assertFalse(engine.accepts(a, "b"));
        assertTrue(engine.accepts(a, "ab"));
        assertTrue(engine.accepts(a, "aab"));
    }

    public void testEmptyInput() {
        assertTrue(engine.accepts(build(""), ""));
        assertTrue(engine.accepts(build("x*"), ""));
        assertFalse(engine.accepts(build("x"), ""));
        assertFalse(engine.accepts(build("x+"), ""));
        assertFalse(engine.accepts(build(""), "x"));
    }

    public void testRejectsAsSoonAsFrontierEmpties() {
        logRx();
        Automaton a = build("abc");
        assertFalse(engine.accepts(a, "abd" + "ccccccccc"));
    }

    public void testIdempotent() {
        Automaton a = build("[a-zsh]*[^a-z]+");
        String before = a.toString();
        for (int i = 0; i < 3; ++i) {
            assertTrue(engine.accepts(a, "shs123"));
            assertFalse(engine.accepts(a, "shshabc"));
            assertFalse(engine.accepts(a, ""));
        }
        assertEquals(before, a.toString());
    }

    public void testConcurrentUse() throws Exception {
        final Automaton a = build("[a-c]+d");
        final boolean[] ok = new boolean[8];
        List<Thread> threads = new ArrayList<Thread>();
        for (int t = 0; t < ok.length; ++t) {
            final int n = t;
            threads.add(new Thread() {
                @Override
                public void run() {
                    boolean ret = true;
                    for (int i = 0; i < 1000; ++i) {
                        ret &= engine.accepts(a, "acccd");
                        ret &= !engine.accepts(a, "ed");
                    }
                    ok[n] = ret;
                }
            });
        }
        for (Thread t : threads) t.start();
        for (Thread t : threads) t.join();
        for (boolean b : ok) assertTrue(b);
    }

    public void testSupplementaryInput() {
        Automaton a = build("😀+");
        assertTrue(engine.accepts(a, "😀"));
        assertTrue(engine.accepts(a, "😀😀"));
        assertFalse(engine.accepts(a, ""));
        // a lone surrogate is a code point in its own right
        assertFalse(engine.accepts(a, "\uD83D"));
        assertTrue(engine.accepts(build("."), "😀"));
        assertFalse(engine.accepts(build(".."), "😀"));
    }
}
