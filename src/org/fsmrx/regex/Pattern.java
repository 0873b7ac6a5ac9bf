/*
 * @LICENSE@
 */

package org.fsmrx.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmrx.regex.Misc.FlagMgr;

/**
 * A compiled representation of a regular expression; analog to the
 * {@link java.util.regex.Pattern} class. Like the Pattern class of the standard
 * library, instances of this Pattern class are immutable and thread safe. The
 * syntax accepted is a small subset of the standard one:
 * <p>
 * <strong>Atoms:</strong> any code point stands for itself, except the
 * metacharacters <code>. [ * +</code>. <code>.</code> matches any single code
 * point, line terminators included.
 * <p>
 * <strong>Character classes:</strong> <code>[abc]</code>, ranges
 * <code>[a-z0-9]</code> and negation <code>[^a-z]</code>. Ranges are raw code
 * point ranges; a range written backwards (<code>[z-a]</code>) is empty. A
 * <code>-</code> that cannot form a range is literal, and there are no escape
 * sequences: a class runs up to the first <code>]</code>.
 * <p>
 * <strong>Quantifiers:</strong> greedy <code>*</code> and <code>+</code>,
 * applied to the atom just before them.
 * <p>
 * <strong>Not supported:</strong> alternation, grouping, capturing groups,
 * backreferences, anchors, bounded and reluctant quantifiers, escapes.
 * <p>
 * Matching is always against the whole input ({@link Matcher#matches()}).
 * The compiled automaton is available to clients through
 * {@link #automaton()}, e.g. for rendering.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.fsmrx.regex");
    private static final Level level = Level.FINER;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Literals and class members also match their upper and lower case
     * variants. Negated classes exclude the variants of their members too.
     */
    public static final int CASE_INSENSITIVE = flagMgr.next("CASE_INSENSITIVE");

    /**
     * Every code point of the pattern is a literal; metacharacters lose their
     * meaning.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    static final int FLAG_COUNT =
            flagMgr.setImplemented(CASE_INSENSITIVE | LITERAL).freezeAndCount();

    final String regex;
    final int flags;
    final Automaton automaton;

    private Pattern(String regex, int flags) {

        flagMgr.check(flags);
        this.regex = regex;
        this.flags = flags;
        logger.log(level, "regex: " + regex);
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        this.automaton = new AutomatonBuilder().build(regex, flags);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @return the pattern.
     * @throws MalformedPatternException
     *             if a character class of <code>regex</code> is never
     *             closed.
     */
    public static Pattern compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @param flags
     *            a bit mask of {@link #CASE_INSENSITIVE} and {@link #LITERAL}.
     * @return the pattern.
     * @throws MalformedPatternException
     *             if a character class of <code>regex</code> is never
     *             closed.
     * @throws IllegalArgumentException
     *             if <code>flags</code> has bits set other than the defined
     *             flags.
     */
    public static Pattern compile(String regex, int flags) {
        return new Pattern(regex, flags);
    }

    public int flags() {
        return flags;
    }

    /**
     * The state graph compiled from this pattern. It is immutable, and may be
     * walked by any number of clients.
     *
     * @return the automaton.
     */
    public Automaton automaton() {
        return automaton;
    }

    public Matcher matcher(CharSequence csq) {
        return new Matcher(this, csq);
    }

    public static boolean matches(String regex, CharSequence input) {
        return Pattern.compile(regex).matcher(input).matches();
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
