// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, character input with backtracking.
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

/**
 * Character cursor over buffered source text.
 *
 * Everything after the current position is the rewind region: text
 * already read from the source but not consumed yet. Any position
 * returned by {@link #save()} can be restored later, which rewinds
 * over arbitrarily long spans.
 */
final class Cursor {
    static final int EOF = -1;

    private char[] src;
    private int len;
    private int p;
    private int[] lineStarts;
    private int lineCount;

    Cursor(char[] src) {
        this.src = src;
        this.len = src.length;
    }

    /** Current character, or {@link #EOF} when the input is exhausted. */
    int peek() {
        return p < len ? src[p] : EOF;
    }

    boolean atEnd() {
        return p >= len;
    }

    /**
     * Consumes the current character.
     *
     * @return true when the input is exhausted after this
     */
    boolean advance() {
        if (p < len)
            ++p;
        return p >= len;
    }

    int save() {
        return p;
    }

    void restore(int mark) {
        if (mark < 0 || mark > len)
            throw new ParserDefectException("bad cursor mark " + mark);
        p = mark;
    }

    /**
     * Queues text to be read next, ahead of the current character.
     */
    void pushBack(CharSequence text) {
        int n = text.length();
        if (n == 0)
            return;
        if (len + n > src.length) {
            char[] tmp = new char[Math.max(src.length << 1, len + n)];
            System.arraycopy(src, 0, tmp, 0, len);
            src = tmp;
        }
        System.arraycopy(src, p, src, p + n, len - p);
        for (int i = 0; i < n; ++i)
            src[p + i] = text.charAt(i);
        len += n;
        lineStarts = null;
    }

    /** Text consumed since the given mark. */
    String text(int from) {
        return new String(src, from, p - from);
    }

    /** 1-based line number of the given position. */
    int line(int pos) {
        if (lineStarts == null)
            index();
        int lo = 0, hi = lineCount - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= pos)
                lo = mid;
            else
                hi = mid - 1;
        }
        return lo + 1;
    }

    /** 1-based column of the given position. */
    int column(int pos) {
        return pos - lineStarts[line(pos) - 1] + 1;
    }

    private void index() {
        int[] ls = new int[64];
        int n = 1;
        for (int i = 0; i < len; ++i) {
            char c = src[i];
            if (c == '\n' || c == '\r' && (i + 1 >= len || src[i + 1] != '\n')) {
                if (n == ls.length) {
                    int[] tmp = new int[n << 1];
                    System.arraycopy(ls, 0, tmp, 0, n);
                    ls = tmp;
                }
                ls[n++] = i + 1;
            }
        }
        lineStarts = ls;
        lineCount = n;
    }
}
