// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, Ant task.
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

import java.io.File;
import java.io.IOException;
import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.Project;
import org.apache.tools.ant.taskdefs.MatchingTask;

/**
 * Checks the syntax of Brouwer sources as part of an Ant build.
 *
 * <pre>
 * &lt;taskdef name="brouwer" classname="brouwer.lang.parser.ParseTask"/&gt;
 * &lt;brouwer srcdir="src" includes="**&#47;*.brw" failonerror="true"/&gt;
 * </pre>
 */
public class ParseTask extends MatchingTask {
    private File dir;
    private String encoding = SourceReader.DEFAULT_CHARSET;
    private boolean failOnError = true;
    private boolean verbose;
    private int parsed;

    public void setSrcDir(String dir) {
        this.dir = new File(dir);
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /** Number of files parsed successfully by the last execution. */
    public int getParsedCount() {
        return parsed;
    }

    public void execute() {
        if (dir == null)
            dir = getProject().getBaseDir();
        if (!fileset.hasPatterns())
            setIncludes("*.brw");
        String[] files = getDirectoryScanner(dir).getIncludedFiles();
        SourceReader reader = new SourceReader(dir.getPath(), encoding);
        log("Parsing " + files.length + " files.");
        parsed = 0;
        int failed = 0;
        for (int i = 0; i < files.length; ++i) {
            String msg;
            try {
                new Parser(files[i], reader.getSource(files[i])).parse();
                ++parsed;
                if (verbose)
                    log(files[i] + ": OK");
                continue;
            } catch (IOException ex) {
                msg = ex.getMessage();
            } catch (ParseException ex) {
                msg = ex.getMessage();
            } catch (ParserDefectException ex) {
                throw new BuildException(files[i] + ": " + ex.getMessage(), ex);
            }
            if (failOnError)
                throw new BuildException(msg);
            log(msg, Project.MSG_WARN);
            ++failed;
        }
        if (failed != 0)
            log(failed + " of " + files.length + " files failed to parse.",
                Project.MSG_WARN);
    }
}
