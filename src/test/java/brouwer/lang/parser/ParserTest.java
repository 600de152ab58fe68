// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser tests.
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;

import static org.junit.Assert.*;
import static brouwer.lang.parser.TokenType.*;

public class ParserTest {
    private static Node parse(String src) {
        return new Parser("test.brw", src).parse();
    }

    private static Node prog(String... lines) {
        StringBuffer buf = new StringBuffer("module M\n");
        for (int i = 0; i < lines.length; ++i)
            buf.append(lines[i]).append('\n');
        return parse(buf.toString()).getChild(0);
    }

    // the node under the first subexpression of the first line
    private static Node first(String... lines) {
        Node line = prog(lines).find(LINE);
        assertNotNull("no line parsed", line);
        return line.getChild(0).getChild(0).getChild(0);
    }

    private static String failure(String src) {
        try {
            parse(src);
        } catch (ParseException ex) {
            return ex.getMessage();
        }
        fail("expected parse error for: " + src);
        return null;
    }

    private static void assertFails(String src, String what) {
        String msg = failure(src);
        assertTrue(msg, msg.indexOf(what) >= 0);
    }

    @Test
    public void moduleOnly() {
        Node root = parse("module Main\n");
        assertEquals(ROOT, root.tag());
        assertEquals("(ROOT (PROG (MOD_DECL module Main)))", root.str());
        assertEquals("ROOT\n  PROG\n    MOD_DECL\n"
                   + "      MODULE_KEYWORD \"module\"\n      IDENT \"Main\"\n",
                     root.dump());
        Node name = root.getChild(0).getChild(0).getChild(1);
        assertTrue(name.isLeaf());
        assertTrue(name.tag().isTerminal());
        assertFalse(root.isLeaf());
        assertFalse(MOD_DECL.isTerminal());
        assertEquals("`Main'", name.toString());
        assertEquals("MOD_DECL", root.getChild(0).getChild(0).toString());
    }

    @Test
    public void moduleWithoutTrailingNewline() {
        assertEquals(1, parse("module Main").getChild(0).childCount());
    }

    @Test
    public void moduleExposingList() {
        Node mod = parse("module M exposing (f, g)\n").getChild(0).getChild(0);
        assertEquals(Arrays.asList("module", "M", "exposing", "(", "f", ",",
                                   "g", ")"), mod.terminals());
        mod = parse("module M hiding h\n").getChild(0).getChild(0);
        assertEquals(HIDING_KEYWORD, mod.getChild(2).tag());
        assertEquals(4, mod.childCount());
    }

    @Test
    public void imports() {
        Node prog = parse("module M\nimport A\nimport B as C\n"
                   + "import D (x, y)\nimport E hiding (z)\nx\n").getChild(0);
        assertEquals(4, prog.count(IMPORT));
        assertEquals(1, prog.count(LINE));
        assertEquals(2, prog.getChild(1).childCount());
        assertEquals(AS_KEYWORD, prog.getChild(2).getChild(2).tag());
        assertEquals(Arrays.asList("import", "D", "(", "x", ",", "y", ")"),
                     prog.getChild(3).terminals());
        assertEquals(HIDING_KEYWORD, prog.getChild(4).getChild(2).tag());
    }

    @Test
    public void headerWordsAreIdentifiersElsewhere() {
        Node assign = first("x = as");
        assertEquals(ASSIGN, assign.tag());
        assertEquals(Arrays.asList("x", "=", "as"), assign.terminals());
        assertEquals(ASSIGN, first("in = exposing hiding").tag());

        Node prog = parse("module M\nimport as as in\n").getChild(0);
        assertEquals(Arrays.asList("import", "as", "as", "in"),
                     prog.getChild(1).terminals());
        assertEquals(AS_KEYWORD, prog.getChild(1).getChild(2).tag());

        Node f = first("for in in in", "    print in");
        assertEquals(FOR, f.tag());
        assertEquals(IN_KEYWORD, f.getChild(2).tag());
        assertEquals(Arrays.asList("in"), f.getChild(1).terminals());
        assertFails("module M\nfor x xs\n    x\n", "missing in keyword of for loop");
        assertFails("module M\nwhile\n    x\n", "expected expression as while condition");
    }

    @Test
    public void headerErrors() {
        assertFails("x = 1\n", "expected module declaration");
        assertFails("", "expected module declaration");
        assertFails("module 1\n", "expected name of module to be plain identifier");
        assertFails("module M x\n", "expected newline after module declaration");
        assertFails("module M exposing\n", "expected at least one item");
        assertFails("module M\nimport\n", "expected module name after import");
        assertFails("module M\nimport A hiding z\n", "expected left paren");
        assertFails("module M\nimport A (x\n", "expected right paren");
        assertFails("module M\nimport A as\n", "expected namespace alias");
    }

    @Test
    public void leadingIndentationIsRejected() {
        assertFails("  module M\n", "source must not start with leading whitespace");
    }

    @Test
    public void blankAndCommentLinesAreSkipped() {
        Node prog = parse("-- about\n\nmodule M\n\n   \n-- note\nx = 1 -- one\n\n")
                        .getChild(0);
        assertEquals(2, prog.childCount());
        assertEquals(ASSIGN, prog.getChild(1).getChild(0).getChild(0)
                                 .getChild(0).tag());
    }

    @Test
    public void topLevelIndentation() {
        assertFails("module M\nx\n  y\n", "unexpected indentation");
        assertFails("module M\n)\n", "unexpected input");
    }

    @Test
    public void functionDeclaration() {
        Node fn = first("fn id x -> T", "    x");
        assertEquals(FN_DECL, fn.tag());
        assertEquals("id", fn.getChild(1).text());
        assertEquals(PARAM, fn.getChild(2).tag());
        assertEquals(R_ARROW, fn.getChild(3).tag());
        assertEquals(Arrays.asList("T"), fn.getChild(4).terminals());
        assertEquals(TYPE_IDENT, fn.getChild(4).tag());
        assertEquals(LINE, fn.getChild(5).tag());
        assertEquals(Arrays.asList("x"), fn.getChild(5).terminals());
        assertEquals(6, fn.childCount());
    }

    @Test
    public void functionWithTypedParams() {
        Node fn = first("fn add (a : Int) (b : Int) -> Int", "    a + b");
        assertEquals(2, fn.count(PARAM));
        Node param = fn.getChild(2);
        assertEquals(5, param.childCount());
        assertEquals(COLON, param.getChild(2).tag());
        assertEquals(Arrays.asList("a", "+", "b"),
                     fn.find(LINE).terminals());
    }

    @Test
    public void functionWithoutParams() {
        Node fn = first("fn main", "    print 1", "    print 2");
        assertEquals(0, fn.count(PARAM));
        assertEquals(2, fn.count(LINE));
    }

    @Test
    public void missingReturnType() {
        String msg = failure("module M\nfn f ->\n    x\n");
        assertTrue(msg, msg.indexOf("return type") >= 0);
        assertTrue(msg, msg.startsWith("test.brw:2:"));
    }

    @Test
    public void blockErrors() {
        assertFails("module M\nfn f x y\nx\n", "improper indentation after header");
        assertFails("module M\nfn f x", "improper indentation after header");
        assertFails("module M\nfn\n", "expected function name");
    }

    @Test
    public void nestedBlocks() {
        Node fn = first("fn f x",
                        "    if x",
                        "        a",
                        "    b",
                        "c");
        assertEquals(2, fn.count(LINE));
        Node inner = fn.getChild(3).getChild(0).getChild(0).getChild(0);
        assertEquals(IF_ELSE, inner.tag());
        assertEquals(1, inner.count(LINE));
        assertEquals(2, prog("fn f x", "    if x", "        a", "    b", "c")
                            .count(LINE));
    }

    @Test
    public void caseExpression() {
        Node c = first("case x",
                       "    0 => \"zero\"",
                       "    _ => \"other\"");
        assertEquals(CASE, c.tag());
        assertEquals(2, c.count(CASE_BRANCH));
        Node wild = c.getChild(3).getChild(0);
        assertEquals(PATTERN, wild.tag());
        assertEquals(UNDERSCORE, wild.getChild(0).tag());
        assertEquals(Arrays.asList("_", "=>", "\"", "o", "t", "h", "e", "r", "\""),
                     c.getChild(3).terminals());
    }

    @Test
    public void caseErrors() {
        assertFails("module M\ncase\n    1 => 2\n", "expected subject expression");
        assertFails("module M\ncase x\n    1 2\n", "expected => while parsing case branch");
        assertFails("module M\ncase x\n    1 =>\n", "expected expression(s) after =>");
    }

    @Test
    public void ifElse() {
        Node n = first("if a", "    b", "else", "    c");
        assertEquals(Arrays.asList("if", "a", "b", "else", "c"), n.terminals());
        assertEquals(2, n.count(LINE));
        assertNotNull(n.find(ELSE_KEYWORD));

        n = first("if a", "    b", "else if c", "    d", "else", "    e");
        Node elseIf = n.find(IF_ELSE);
        assertNotNull(elseIf);
        assertEquals(Arrays.asList("if", "c", "d", "else", "e"), elseIf.terminals());

        n = first("if a", "    b", "elsewhere");
        assertNull(n.find(ELSE_KEYWORD));
    }

    @Test
    public void tryCatch() {
        Node n = first("try", "    risky 1", "catch e", "    handle e");
        assertEquals(TRY, n.tag());
        assertEquals("e", n.find(IDENT).text());
        assertEquals(2, n.count(LINE));
        assertFails("module M\ntry\n    a\n", "try must have corresponding catch on same indent level");
        assertFails("module M\ntry\n    a\nb\n", "try must have corresponding catch");
        assertFails("module M\ntry\n    a\ncatch\n    b\n", "catch must name the caught exception");
    }

    @Test
    public void loops() {
        Node w = first("while x < 10", "    x = x + 1");
        assertEquals(WHILE, w.tag());
        assertEquals(Arrays.asList("x", "<", "10"), w.getChild(1).terminals());

        Node f = first("for (k, v) in pairs", "    print k");
        assertEquals(FOR, f.tag());
        assertEquals(PATTERN, f.getChild(1).tag());
        assertEquals(IN_KEYWORD, f.getChild(2).tag());

        assertFails("module M\nwhile\n    x\n", "expected expression as while condition");
        assertFails("module M\nfor x xs\n    x\n", "missing in keyword of for loop");
        assertFails("module M\nfor x in\n    x\n", "for must iterate over an expression");
        assertFails("module M\nfor\n    x\n", "expected pattern as first part of for header");
    }

    @Test
    public void tuples() {
        assertEquals(TUPLE_LIT, first("t = ()").getChild(2).getChild(0).getChild(0).tag());
        Node paren = first("t = (a)").getChild(2).getChild(0).getChild(0);
        assertEquals(PARENED, paren.tag());
        Node pair = first("t = (a, b)").getChild(2).getChild(0).getChild(0);
        assertEquals(TUPLE_LIT, pair.tag());
        assertEquals(Arrays.asList("(", "a", ",", "b", ")"), pair.terminals());
        assertFails("module M\nt = (a,)\n", "expected 0 or at least 2 elements in tuple");
        assertFails("module M\nt = (a b\n", "expected closing paren");
    }

    @Test
    public void bracketsSpanLines() {
        Node pair = first("t = (a,", "     b)", "u").getChild(2).getChild(0)
                        .getChild(0);
        assertEquals(TUPLE_LIT, pair.tag());
        assertEquals(2, prog("t = [1,", "  2]", "u").count(LINE));
    }

    @Test
    public void assignmentAndVar() {
        Node a = first("x : Int = 5");
        assertEquals(ASSIGN, a.tag());
        assertEquals(Arrays.asList("x", ":", "Int", "=", "5"), a.terminals());

        Node v = first("var (a, b) = pair");
        assertEquals(VAR, v.tag());
        assertEquals(PATTERN, v.getChild(1).tag());

        // comparison is an operator, not an assignment
        Node cmp = first("x == 5");
        assertEquals(QUAL_IDENT, cmp.tag());
        assertEquals(Arrays.asList("x", "==", "5"), prog("x == 5").find(LINE).terminals());

        assertFails("module M\nvar x\n", "var assignment must use =");
        assertFails("module M\nx =\n", "right-hand side of assignment");
    }

    @Test
    public void listComprehension() {
        Node comp = first("ys = [x | x <- xs, x > 0]").getChild(2).getChild(0)
                        .getChild(0);
        assertEquals(LIST_COMP, comp.tag());
        assertEquals(GENERATOR, comp.getChild(3).tag());
        assertEquals(Arrays.asList("x", "<-", "xs"), comp.getChild(3).terminals());
        assertEquals(EXPR, comp.getChild(5).tag());
        assertEquals(Arrays.asList("x", ">", "0"), comp.getChild(5).terminals());
        assertEquals(7, comp.childCount());
        assertFails("module M\n[x | ]\n", "expected generator or condition after |");
    }

    @Test
    public void listLiterals() {
        Node list = first("[]");
        assertEquals(LIST_LIT, list.tag());
        assertEquals(2, list.childCount());
        list = first("[1, 2, 3]");
        assertEquals(3, list.count(EXPR));
        assertFails("module M\n[1, 2\n", "requires ]");
    }

    @Test
    public void dictsAndSets() {
        Node d = first("d = {a = 1, b = 2}").getChild(2).getChild(0).getChild(0);
        assertEquals(DICT_LIT, d.tag());
        assertEquals(2, d.count(DICT_ENTRY));

        Node s = first("s = {1, 2}").getChild(2).getChild(0).getChild(0);
        assertEquals(SET_LIT, s.tag());
        assertEquals(2, s.count(EXPR));

        Node empty = first("{}");
        assertEquals(DICT_LIT, empty.tag());

        Node dc = first("{k = v | k <- ks}");
        assertEquals(DICT_COMP, dc.tag());
        assertEquals(1, dc.count(GENERATOR));

        Node sc = first("{x | x <- xs}");
        assertEquals(SET_COMP, sc.tag());

        Node nested = first("d = {a = {b = {c = 1}}}").getChild(2).getChild(0)
                          .getChild(0);
        assertEquals(DICT_LIT, nested.tag());
        Node inner = nested.getChild(1).getChild(2).getChild(0).getChild(0);
        assertEquals(DICT_LIT, inner.tag());

        assertFails("module M\n{a = 1, b}\n", "expected = after dict key");
        assertFails("module M\n{a = 1, }\n", "expected dict entry after ,");
        assertFails("module M\n{a = }\n",
                    "expected expression to be assigned to dict key");
    }

    @Test(timeout = 5000)
    public void deeplyNestedBraces() {
        StringBuffer src = new StringBuffer("x = ");
        for (int i = 0; i < 30; ++i)
            src.append('{');
        src.append('1');
        for (int i = 0; i < 30; ++i)
            src.append('}');
        Node assign = first(src.toString());
        assertEquals(ASSIGN, assign.tag());
        Node set = assign.getChild(2).getChild(0).getChild(0);
        assertEquals(SET_LIT, set.tag());
        assertEquals(63, assign.terminals().size());
    }

    @Test
    public void lambda() {
        Node l = first("f = \\x, y -> x").getChild(2).getChild(0).getChild(0);
        assertEquals(LAMBDA, l.tag());
        assertEquals(2, l.count(PARAM));
        assertEquals(Arrays.asList("\\", "x", ",", "y", "->", "x"), l.terminals());
        assertFails("module M\n\\ -> x\n", "lambda expression requires 1+ args");
        assertFails("module M\n\\x x\n", "lambda expression requires ->");
        assertFails("module M\n\\x ->\n", "lambda body must be expression");
    }

    @Test
    public void returnStatement() {
        Node fn = first("fn f", "    return 1");
        Node ret = fn.find(LINE).getChild(0).getChild(0).getChild(0);
        assertEquals(RETURN, ret.tag());
        assertFails("module M\nreturn\n", "expected expression to return");
    }

    @Test
    public void qualifiedIdentifiers() {
        assertEquals(MEMBER_IDENT, first("a.b.c").getChild(0).tag());
        assertEquals(Arrays.asList("a", ".", "b", ".", "c"), first("a.b.c").terminals());
        assertEquals(SCOPED_IDENT, first("List::map f").getChild(0).tag());
        assertEquals(IDENT, first("plain").getChild(0).tag());
        assertFails("module M\na.\n", "expected identifier after .");
        assertFails("module M\nA::\n", "expected identifier after ::");
    }

    @Test
    public void infixedIdentifier() {
        Node line = prog("a `div` b").find(LINE);
        Node inf = line.getChild(0).getChild(1).getChild(0);
        assertEquals(INFIXED, inf.tag());
        assertEquals(Arrays.asList("`", "div", "`"), inf.terminals());
    }

    @Test
    public void numbers() {
        Node n = first("42");
        assertEquals(INT_LIT, n.getChild(0).tag());
        n = first("-3.25");
        assertEquals(REAL_LIT, n.getChild(0).tag());
        assertEquals(Arrays.asList("-", "3.25"), n.terminals());
        n = first("-Infinity");
        assertEquals(REAL_LIT, n.getChild(0).tag());
        assertEquals(INFINITY_KEYWORD, n.getChild(0).getChild(1).tag());
        assertEquals(REAL_LIT, first("NaN").getChild(0).tag());
        assertFails("module M\nx = 1.\n", "expected at least one digit after decimal point");
    }

    @Test
    public void minusOperatorNeedsBlank() {
        Node expr = prog("a - 1").find(LINE).getChild(0);
        assertEquals(3, expr.childCount());
        assertEquals(OP, expr.getChild(1).getChild(0).tag());
        expr = prog("a -1").find(LINE).getChild(0);
        assertEquals(2, expr.childCount());
        assertEquals(NUM_LIT, expr.getChild(1).getChild(0).tag());
    }

    @Test
    public void characterAndStringLiterals() {
        Node c = first("'\\n'");
        assertEquals(CHR_LIT, c.tag());
        assertEquals("\\n", c.getChild(1).text());
        Node s = first("\"a\\\"b\"");
        assertEquals(STR_LIT, s.tag());
        assertEquals(Arrays.asList("\"", "a", "\\\"", "b", "\""), s.terminals());
        assertEquals(2, first("\"\"").childCount());
        assertFails("module M\ns = \"a\\qb\"\n", "invalid escape sequence");
        assertFails("module M\nc = 'ab'\n", "expected '");
        assertFails("module M\ns = \"abc\n", "unterminated string literal");
    }

    @Test
    public void reservedOperators() {
        assertFails("module M\na -> b\n", "the operator -> is reserved");
        assertFails("module M\na <- b\n", "the operator <- is reserved");
        assertFails("module M\na | b\n", "the operator | is reserved");
        assertFails("module M\na => b\n", "the operator => is reserved");
        assertFails("module M\na :: b\n", "the operator :: is reserved");
        assertFails("module M\na : b\n", "the operator : is reserved");
        assertFails("module M\na . b\n", "the operator . is reserved");
        assertFails("module M\na = = b\n", "the operator = is reserved");
        assertFails("module M\na \\ b\n", "lambda expression requires ->");
        assertEquals(ASSIGN, first("x : Int = 1").tag());
        assertEquals(MEMBER_IDENT, first("a.b").getChild(0).tag());
        Node expr = prog("a <> b").find(LINE).getChild(0);
        assertEquals("<>", expr.getChild(1).getChild(0).text());
    }

    @Test
    public void reservedOperatorErrorPosition() {
        try {
            parse("module M\nfoo -> bar\n");
            fail();
        } catch (ParseException ex) {
            assertEquals(2, ex.getLine());
            assertEquals(5, ex.getColumn());
        }
    }

    @Test
    public void commentsEndExpressions() {
        Node line = prog("f x -- call f").find(LINE);
        assertEquals(Arrays.asList("f", "x"), line.terminals());
        line = prog("xs = [1, -- first", "      2]").find(LINE);
        assertEquals(Arrays.asList("xs", "=", "[", "1", ",", "2", "]"),
                     line.terminals());
    }

    @Test
    public void terminalsReproduceTokens() {
        Node root = parse("module Shapes exposing (area)\n"
                        + "import Math as M\n"
                        + "fn area (s : Shape) -> Float\n"
                        + "    case s\n"
                        + "        (w, h) => w * h\n"
                        + "        r => M::pi * r ** 2\n");
        assertEquals(Arrays.asList(
            "module", "Shapes", "exposing", "(", "area", ")",
            "import", "Math", "as", "M",
            "fn", "area", "(", "s", ":", "Shape", ")", "->", "Float",
            "case", "s",
            "(", "w", ",", "h", ")", "=>", "w", "*", "h",
            "r", "=>", "M", "::", "pi", "*", "r", "**", "2"),
            root.terminals());
    }

    @Test
    public void nodePositions() {
        Node prog = prog("x = 1", "fn g y", "    y");
        Node fn = prog.getChild(2).getChild(0).getChild(0).getChild(0);
        assertEquals(FN_DECL, fn.tag());
        assertEquals(3, fn.line());
        assertEquals(1, fn.column());
        Node body = fn.find(LINE);
        assertEquals(4, body.line());
        assertEquals(5, body.column());
    }

    @Test
    public void summaryIsLoggedOnlyAtFine() {
        final List<String> messages = new ArrayList<String>();
        Handler handler = new Handler() {
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            public void flush() {
            }

            public void close() {
            }
        };
        Logger log = Logger.getLogger(Parser.class.getName());
        Level level = log.getLevel();
        log.addHandler(handler);
        try {
            log.setLevel(Level.INFO);
            parse("module Quiet\nx\n");
            assertEquals(0, messages.size());

            log.setLevel(Level.FINE);
            parse("module Loud\nimport A\nx\ny\n");
            assertEquals(Arrays.asList(
                "test.brw: module Loud, 1 imports, 2 top-level lines"),
                messages);
        } finally {
            log.removeHandler(handler);
            log.setLevel(level);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void parseOnlyOnce() {
        Parser p = new Parser("once", "module M\n");
        p.parse();
        p.parse();
    }
}
