// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, terminal matchers and indentation.
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
 * Terminal matchers and line/indentation tracking on top of
 * a {@link Cursor}.
 *
 * Every matcher either consumes its lexeme or leaves the cursor
 * exactly where it was.
 */
abstract class CharParser {
    static final String OP_CHARS = "?<>=%\\~!@#$|&*/+^-:;.";
    static final String ESC_CHARS = "'\"tvnrb0\\";
    static final String[] RESERVED_OPS =
        { ":", "->", "=>", "<-", "--", "|", "\\", "=", ".", "::" };
    // exposing, hiding, as and in are keywords only in their headers
    static final String[] KEYWORDS = {
        "module", "import", "fn", "case", "if", "else", "try", "catch",
        "while", "for", "var", "return", "NaN", "Infinity"
    };

    final Cursor cur;
    final String sourceName;
    // blank prefix of the current logical line
    String indent = "";
    // where the content of the current logical line starts
    int lineStart = -1;
    // open brackets, newlines are blanks inside them
    int nesting;

    /** Parser state to return to when an alternative fails. */
    static final class Mark {
        final int pos;
        final String indent;
        final int lineStart;

        Mark(int pos, String indent, int lineStart) {
            this.pos = pos;
            this.indent = indent;
            this.lineStart = lineStart;
        }
    }

    CharParser(String sourceName, char[] src) {
        this.sourceName = sourceName;
        this.cur = new Cursor(src);
    }

    Mark mark() {
        return new Mark(cur.save(), indent, lineStart);
    }

    void reset(Mark mark) {
        cur.restore(mark.pos);
        indent = mark.indent;
        lineStart = mark.lineStart;
    }

    /** Restores the mark and reports no match. */
    Node fail(Mark mark) {
        reset(mark);
        return null;
    }

    static boolean isBlank(int c) {
        return c == ' ' || c == '\t';
    }

    static boolean isNewline(int c) {
        return c == '\n' || c == '\r';
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentChar(int c) {
        return c == '_' || c >= 0 && Character.isLetterOrDigit((char) c);
    }

    static boolean isOpChar(int c) {
        return c >= 0 && OP_CHARS.indexOf(c) >= 0;
    }

    static boolean isReservedOp(String op) {
        for (int i = 0; i < RESERVED_OPS.length; ++i)
            if (RESERVED_OPS[i].equals(op))
                return true;
        return false;
    }

    static boolean isKeyword(String s) {
        for (int i = 0; i < KEYWORDS.length; ++i)
            if (KEYWORDS[i].equals(s))
                return true;
        return false;
    }

    boolean matchChar(char c) {
        if (cur.peek() != c)
            return false;
        cur.advance();
        return true;
    }

    /** @return the consumed character, or -1 */
    int matchCharIn(String set) {
        int c = cur.peek();
        if (c < 0 || set.indexOf(c) < 0)
            return -1;
        cur.advance();
        return c;
    }

    /** @return the consumed character, or -1 */
    int matchCharNotIn(String set) {
        int c = cur.peek();
        if (c < 0 || set.indexOf(c) >= 0)
            return -1;
        cur.advance();
        return c;
    }

    /**
     * Matches the word only when it is not followed by an identifier
     * character, so "iffy" never matches "if".
     */
    boolean matchKeyword(String word) {
        int start = cur.save();
        for (int i = 0; i < word.length(); ++i)
            if (!matchChar(word.charAt(i))) {
                cur.restore(start);
                return false;
            }
        if (isIdentChar(cur.peek())) {
            cur.restore(start);
            return false;
        }
        return true;
    }

    /**
     * Matches the operator only when the operator character run
     * ends right after it (maximal munch).
     */
    boolean matchOperator(String op) {
        int start = cur.save();
        for (int i = 0; i < op.length(); ++i)
            if (!matchChar(op.charAt(i))) {
                cur.restore(start);
                return false;
            }
        if (isOpChar(cur.peek())) {
            cur.restore(start);
            return false;
        }
        return true;
    }

    Node leaf(TokenType tag, String text, int at) {
        return new Node(tag, text).pos(cur.line(at), cur.column(at));
    }

    Node keyword(TokenType tag) {
        skipBlanks();
        return keywordHere(tag);
    }

    Node keywordHere(TokenType tag) {
        int at = cur.save();
        return matchKeyword(tag.lexeme()) ? leaf(tag, tag.lexeme(), at) : null;
    }

    Node operator(TokenType tag) {
        skipBlanks();
        return operatorHere(tag);
    }

    Node operatorHere(TokenType tag) {
        int at = cur.save();
        return matchOperator(tag.lexeme()) ? leaf(tag, tag.lexeme(), at) : null;
    }

    Node punct(TokenType tag) {
        skipBlanks();
        return punctHere(tag);
    }

    Node punctHere(TokenType tag) {
        int at = cur.save();
        return matchChar(tag.lexeme().charAt(0))
                ? leaf(tag, tag.lexeme(), at) : null;
    }

    /** Identifier at the current position; keywords and lone _ are not. */
    Node ident() {
        int c = cur.peek();
        if (c != '_' && (c < 0 || !Character.isLetter((char) c)))
            return null;
        int from = cur.save();
        while (isIdentChar(cur.peek()))
            cur.advance();
        String s = cur.text(from);
        if (s.equals("_") || isKeyword(s)) {
            cur.restore(from);
            return null;
        }
        return leaf(TokenType.IDENT, s, from);
    }

    /**
     * Skips blanks. Inside brackets newlines and comments are
     * skipped too.
     */
    void skipBlanks() {
        for (int c; (c = cur.peek()) >= 0;) {
            if (isBlank(c)) {
                cur.advance();
            } else if (nesting == 0) {
                return;
            } else if (isNewline(c)) {
                cur.advance();
            } else if (!skipComment()) {
                return;
            }
        }
    }

    boolean skipComment() {
        if (cur.peek() != '-' || !matchOperator("--"))
            return false;
        while (!cur.atEnd() && !isNewline(cur.peek()))
            cur.advance();
        return true;
    }

    boolean atLineStart() {
        return cur.save() == lineStart;
    }

    /**
     * Consumes the end of the current line, including a trailing
     * comment, and the blank or comment-only lines after it.
     * End of input counts as a line end, as does already standing
     * on a fresh line left behind by a nested block.
     *
     * @return false if something other than a line end follows
     */
    boolean expectNewline() {
        skipBlanks();
        if (atLineStart())
            return true;
        skipComment();
        if (cur.atEnd()) {
            indent = "";
            lineStart = cur.save();
            return true;
        }
        if (!isNewline(cur.peek()))
            return false;
        cur.advance();
        readIndent();
        return true;
    }

    /**
     * Reads the indentation of the next line that has content.
     * The cursor must be at the beginning of a physical line.
     */
    void readIndent() {
        for (;;) {
            int from = cur.save();
            while (isBlank(cur.peek()))
                cur.advance();
            int c = cur.peek();
            if (isNewline(c)) {
                cur.advance();
            } else if (!skipComment()) {
                indent = c < 0 ? "" : cur.text(from);
                lineStart = cur.save();
                return;
            }
        }
    }

    ParseException error(String what) {
        return error(cur.save(), what);
    }

    ParseException error(int at, String what) {
        return new ParseException(sourceName, cur.line(at),
                                  cur.column(at), what);
    }

    /** Describes the current character for messages. */
    String found() {
        int c = cur.peek();
        if (c < 0)
            return "end of input";
        if (isNewline(c))
            return "newline";
        return "'" + (char) c + "'";
    }
}
