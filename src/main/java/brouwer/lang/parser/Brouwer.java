// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, command line front end.
 *
 * Copyright (c) 2007-2013 Madis Janson
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package brouwer.lang.parser;

import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line parser front end.
 *
 * <pre>
 * brouwer [-q] [-s] [-v] [-encoding NAME] FILE...
 * </pre>
 *
 * Exit status is 0 on success, 1 on unreadable or malformed input and
 * bad usage, 2 on internal parser errors and 3 on anything else.
 */
public class Brouwer {
    static final int OK = 0;
    static final int BAD_INPUT = 1;
    static final int DEFECT = 2;
    static final int FAILURE = 3;

    private final static Logger LOG = Logger.getLogger(Brouwer.class.getName());
    private static Handler verboseHandler;

    private boolean quiet;
    private boolean compact;
    private String encoding = SourceReader.DEFAULT_CHARSET;

    static String usage() {
        return "brouwer [-q] [-s] [-v] [-encoding NAME] FILE...\n\n"
             + "  -q              check only, print nothing on success\n"
             + "  -s              print the tree as s-expression\n"
             + "  -v              log parser progress\n"
             + "  -encoding NAME  source file encoding (default "
             + SourceReader.DEFAULT_CHARSET + ")\n";
    }

    static synchronized void verbose() {
        if (verboseHandler != null)
            return;
        Logger log = Logger.getLogger(Brouwer.class.getPackage().getName());
        verboseHandler = new ConsoleHandler();
        verboseHandler.setLevel(Level.FINE);
        log.addHandler(verboseHandler);
        log.setLevel(Level.FINE);
    }

    /**
     * Runs the command, writing results to out and diagnostics to err.
     *
     * @return the exit status
     */
    public static int run(String[] argv, PrintStream out, PrintStream err) {
        Brouwer cmd = new Brouwer();
        int i = 0;
        for (; i < argv.length && argv[i].startsWith("-"); ++i) {
            String arg = argv[i];
            if (arg.equals("-q")) {
                cmd.quiet = true;
            } else if (arg.equals("-s")) {
                cmd.compact = true;
            } else if (arg.equals("-v")) {
                verbose();
            } else if (arg.equals("-encoding")) {
                if (++i >= argv.length) {
                    err.println("brouwer: -encoding requires an argument");
                    return BAD_INPUT;
                }
                cmd.encoding = argv[i];
            } else if (arg.equals("-h") || arg.equals("-help")) {
                out.print(usage());
                return OK;
            } else {
                err.println("brouwer: unknown option " + arg);
                err.print(usage());
                return BAD_INPUT;
            }
        }
        if (i >= argv.length) {
            err.print(usage());
            return BAD_INPUT;
        }
        int status = OK;
        for (; i < argv.length; ++i)
            status = Math.max(status, cmd.parseFile(argv[i], out, err));
        return status;
    }

    int parseFile(String name, PrintStream out, PrintStream err) {
        try {
            Node root = new Parser(name, new SourceReader(null, encoding))
                            .parse();
            if (!quiet)
                out.print(compact ? root.str() + '\n' : root.dump());
            return OK;
        } catch (IOException ex) {
            err.println("brouwer: " + ex.getMessage());
            return BAD_INPUT;
        } catch (ParseException ex) {
            err.println(ex.getMessage());
            return BAD_INPUT;
        } catch (ParserDefectException ex) {
            LOG.log(Level.SEVERE, name, ex);
            err.println(name + ": " + ex.getMessage());
            return DEFECT;
        } catch (Throwable ex) {
            LOG.log(Level.SEVERE, name, ex);
            err.println(name + ": " + ex);
            return FAILURE;
        }
    }

    public static void main(String[] argv) {
        System.exit(run(argv, System.out, System.err));
    }
}
