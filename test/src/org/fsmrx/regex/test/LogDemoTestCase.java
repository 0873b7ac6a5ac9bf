/*@LICENSE@
 */
package org.fsmrx.regex.test;

import java.io.File;

import org.fsmrx.regex.AbstractRxTestCase;
import org.fsmrx.regex.Pattern;

public class LogDemoTestCase extends AbstractRxTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logRx();
    }

    private void assertLogged() {
        rxHandler().flush();
        File log = rxHandler().file();
        assertTrue(log.getPath(), log.exists());
        assertTrue(log.getPath(), log.length() > 0);
    }

    public void testCompile() {
        Pattern.compile("[a-c]+[d-f]+[g-i]*", Pattern.CASE_INSENSITIVE);
        assertLogged();
    }

    public void testMatch() {
        assertTrue(Pattern.matches("[a-zsh]*[^a-z]+", "shs123"));
        assertLogged();
    }

    public void testReject() {
        assertFalse(Pattern.matches("a*4.+hi", "meow"));
        assertLogged();
    }
}
