/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Command line driver: reads one pattern (the first argument, or a line from
 * standard input after a prompt), prints the automaton's document and writes
 * it to <code>nfa.json</code>, or to the file named by the
 * <code>tnfa.output</code> system property. An invalid pattern gets one fixed
 * message and no file.
 */
public final class Main {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINE;

    static final String PROMPT = "Enter regular expression: ";
    static final String INVALID = "regular expression is not valid";
    static final String OUTPUT_PROPERTY = "tnfa.output";
    static final String DEFAULT_OUTPUT = "nfa.json";

    private Main() {
    } // never instantiated

    public static void main(String[] args) throws IOException {
        File output = new File(System.getProperty(OUTPUT_PROPERTY, DEFAULT_OUTPUT));
        run(args, System.in, System.out, output);
    }

    /**
     * @return true if a document was written.
     */
    static boolean run(String[] args, InputStream in, PrintStream out, File output)
            throws IOException {
        String regex;
        if (args.length > 0) {
            regex = args[0];
        } else {
            out.print(PROMPT);
            out.flush();
            regex = new BufferedReader(new InputStreamReader(in, "UTF-8")).readLine();
            if (regex == null) {
                out.println();
                out.println(INVALID);
                return false;
            }
        }
        NFA nfa;
        try {
            nfa = NfaCompiler.compile(regex);
        } catch (PatternSyntaxException e) {
            logger.log(level, e.getMessage(), e);
            out.println(INVALID);
            return false;
        }
        out.println(NfaDocument.toJsonString(nfa, true));
        NfaDocument.write(nfa, output);
        out.println("File saved to " + output.getPath());
        return true;
    }
}
