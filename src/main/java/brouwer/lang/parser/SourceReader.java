// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, source file reader.
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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;

/**
 * Reads whole source files into memory.
 */
public class SourceReader {
    static final String DEFAULT_CHARSET = "UTF-8";

    private final String basedir;
    private final String charset;

    public SourceReader() {
        this(null, DEFAULT_CHARSET);
    }

    /**
     * @param basedir directory that relative names are resolved
     *                against, or null for the working directory
     * @param charset source encoding, null for UTF-8
     */
    public SourceReader(String basedir, String charset) {
        this.basedir = basedir;
        this.charset = charset == null ? DEFAULT_CHARSET : charset;
    }

    /**
     * Reads the named file.
     *
     * @throws IOException if the file cannot be opened or read
     */
    public char[] getSource(String name) throws IOException {
        InputStream stream = basedir == null ? new FileInputStream(name)
                                : new FileInputStream(new File(basedir, name));
        try {
            return read(new InputStreamReader(stream, charset));
        } catch (IOException ex) {
            throw new IOException(name + ": " + ex.getMessage(), ex);
        } finally {
            stream.close();
        }
    }

    static char[] read(Reader reader) throws IOException {
        char[] buf = new char[0x8000];
        int l = 0;
        for (int n; (n = reader.read(buf, l, buf.length - l)) >= 0; ) {
            if (buf.length - (l += n) < 0x1000) {
                char[] tmp = new char[buf.length << 1];
                System.arraycopy(buf, 0, tmp, 0, l);
                buf = tmp;
            }
        }
        char[] r = new char[l];
        System.arraycopy(buf, 0, r, 0, l);
        return r;
    }
}
