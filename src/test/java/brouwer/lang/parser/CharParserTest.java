// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, terminal matcher tests.
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

import org.junit.Test;

import static org.junit.Assert.*;
import static brouwer.lang.parser.TokenType.*;

public class CharParserTest {
    private static CharParser on(String src) {
        return new CharParser("test", src.toCharArray()) {};
    }

    @Test
    public void keywordNeedsWordBoundary() {
        CharParser p = on("iffy");
        assertNull(p.keyword(IF_KEYWORD));
        assertEquals(0, p.cur.save());

        p = on("if x");
        Node kw = p.keyword(IF_KEYWORD);
        assertEquals(IF_KEYWORD, kw.tag());
        assertEquals("if", kw.text());
        assertEquals(2, p.cur.save());
    }

    @Test
    public void operatorIsMaximalMunch() {
        CharParser p = on("->");
        assertNull(p.operator(MINUS));
        assertEquals(0, p.cur.save());
        assertNotNull(p.operator(R_ARROW));

        p = on("==");
        assertNull(p.operator(EQUALS));
        p = on("= 1");
        assertNotNull(p.operator(EQUALS));
    }

    @Test
    public void identifiersExcludeKeywords() {
        assertNull(on("while").ident());
        assertNull(on("_").ident());
        assertEquals("_tmp", on("_tmp").ident().text());
        assertEquals("while2", on("while2 x").ident().text());
        assertNull(on("2x").ident());
        assertEquals("as", on("as").ident().text());
        assertEquals("in", on("in x").ident().text());
        assertEquals("exposing", on("exposing").ident().text());
        assertNull(on("import").ident());
    }

    @Test
    public void charClassMatchers() {
        CharParser p = on("ab");
        assertEquals('a', p.matchCharIn("abc"));
        assertEquals(-1, p.matchCharNotIn("xb"));
        assertEquals(1, p.cur.save());
        assertEquals('b', p.matchCharNotIn("x"));
        assertEquals(-1, p.matchCharIn("abc"));
    }

    @Test
    public void newlinesAreBlankOnlyInsideBrackets() {
        CharParser p = on("  \n  x");
        p.skipBlanks();
        assertEquals('\n', p.cur.peek());

        p = on("  \n  -- note\n  x");
        p.nesting = 1;
        p.skipBlanks();
        assertEquals('x', p.cur.peek());
    }

    @Test
    public void expectNewlineReadsNextIndent() {
        CharParser p = on("a -- end\n\n  -- only comment\n   b");
        p.readIndent();
        assertEquals("", p.indent);
        p.matchChar('a');
        assertTrue(p.expectNewline());
        assertEquals("   ", p.indent);
        assertTrue(p.atLineStart());
        assertEquals('b', p.cur.peek());
        // already on a fresh line
        assertTrue(p.expectNewline());
        assertEquals('b', p.cur.peek());
    }

    @Test
    public void endOfInputIsNewline() {
        CharParser p = on("a  ");
        p.matchChar('a');
        assertTrue(p.expectNewline());
        assertTrue(p.cur.atEnd());
        assertEquals("", p.indent);
    }

    @Test
    public void expectNewlineRejectsContent() {
        CharParser p = on("a b");
        p.matchChar('a');
        assertFalse(p.expectNewline());
        assertEquals('b', p.cur.peek());
    }

    @Test
    public void failRestoresState() {
        CharParser p = on("x\n  y");
        p.readIndent();
        CharParser.Mark m = p.mark();
        p.matchChar('x');
        p.expectNewline();
        assertEquals("  ", p.indent);
        assertNull(p.fail(m));
        assertEquals(0, p.cur.save());
        assertEquals("", p.indent);
        assertTrue(p.atLineStart());
    }

    @Test
    public void errorsCarryPosition() {
        CharParser p = on("ab\ncd");
        p.cur.restore(4);
        ParseException ex = p.error("oops");
        assertEquals(2, ex.getLine());
        assertEquals(2, ex.getColumn());
        assertEquals("test:2:2: oops", ex.getMessage());
        assertEquals("'d'", p.found());
        assertEquals("3: bare", new ParseException(3, 0, "bare").getMessage());
        assertEquals("oops", ex.getWhat());
    }
}
