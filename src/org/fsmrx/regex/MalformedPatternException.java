/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown by {@link Pattern#compile(String, int)} when a pattern cannot be
 * turned into an automaton. The only such pattern is one with a character
 * class which is never closed, e.g. <code>ab[cd</code>.
 */
public class MalformedPatternException extends PatternSyntaxException {

    private static final long serialVersionUID = 4406419162253590641L;

    public MalformedPatternException(String desc, String regex, int index) {
        super(desc, regex, index);
    }
}
