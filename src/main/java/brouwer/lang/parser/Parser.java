// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser.
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
import java.util.logging.Level;
import java.util.logging.Logger;

import static brouwer.lang.parser.TokenType.*;

/*
   Syntax (informal).

prog:      modDecl import* line*
modDecl:   module Name [exposing|hiding a, b...]
import:    import Name [as Alias | [hiding] (a, b...)]
line:      subexpr+ [-- comment]
subexpr:   var | assign | fn | (...) | return | case | if | try | while
           | for | lambda | [...] | {...} | a.b | A::b | `f` | 1.5
           | 'c' | "str" | op
*/

/**
 * Brouwer language parser.
 *
 * Parses straight from characters, without a token stream. Every
 * production returns null when its opening shape is absent (and
 * leaves the input untouched), or throws {@link ParseException} when
 * it already committed and the rest is malformed.
 *
 * <pre>
 * Node root = new Parser("hello.brw").parse();
 * System.out.print(root.dump());
 * </pre>
 */
public final class Parser extends CharParser {
    private final static Logger LOG = Logger.getLogger(Parser.class.getName());
    private static final String[] NO_STOPS = {};
    private static final String[] BAR_STOP = { "|" };
    private static final String[] KEY_STOPS = { "=", "|" };

    // reserved operators that end the expression being parsed
    private String[] stops = NO_STOPS;
    private boolean parsed;

    /**
     * Opens the named file, using UTF-8.
     *
     * @throws IOException if the file cannot be read
     */
    public Parser(String filename) throws IOException {
        this(filename, new SourceReader());
    }

    public Parser(String filename, SourceReader reader) throws IOException {
        this(filename, reader.getSource(filename));
    }

    public Parser(String sourceName, char[] src) {
        super(sourceName, src);
    }

    public Parser(String sourceName, String src) {
        this(sourceName, src.toCharArray());
    }

    /**
     * Parses the whole source.
     *
     * @return the ROOT node
     * @throws ParseException on malformed input
     * @throws ParserDefectException on internal errors
     */
    public Node parse() {
        if (parsed)
            throw new IllegalStateException("parse() already called");
        parsed = true;
        return new Node(ROOT).add(parseProg());
    }

    private Node parseProg() {
        readIndent();
        if (indent.length() != 0)
            throw error("source must not start with leading whitespace");
        Node prog = new Node(PROG);
        Node mod = parseModDecl();
        if (mod == null)
            throw error("expected module declaration, not " + found());
        prog.add(mod);
        int imports = 0, lines = 0;
        for (Node imp; !cur.atEnd() && indent.length() == 0
                       && (imp = parseImport()) != null; ++imports)
            prog.add(imp);
        while (!cur.atEnd()) {
            if (indent.length() != 0)
                throw error("unexpected indentation");
            Node line = parseLine();
            if (line == null)
                throw error("unexpected input " + found());
            prog.add(line);
            ++lines;
            if (!expectNewline())
                throw error("unexpected input " + found());
        }
        if (LOG.isLoggable(Level.FINE))
            LOG.fine(sourceName + ": module " + mod.getChild(1).text() + ", "
                     + imports + " imports, " + lines + " top-level lines");
        return prog;
    }

    private Node parseModDecl() {
        Mark m = mark();
        Node kw = keyword(MODULE_KEYWORD);
        if (kw == null)
            return fail(m);
        Node mod = new Node(MOD_DECL).add(kw);
        Node name = parseIdent();
        if (name == null)
            throw error("expected name of module to be plain identifier");
        mod.add(name);
        Node list = keyword(EXPOSING_KEYWORD);
        if (list == null)
            list = keyword(HIDING_KEYWORD);
        if (list != null) {
            mod.add(list);
            identList(mod, punct(L_PAREN),
                "expected at least one item in module export/hide list");
        }
        if (!expectNewline())
            throw error("expected newline after module declaration, not "
                        + found());
        return mod;
    }

    private Node parseImport() {
        Mark m = mark();
        Node kw = keyword(IMPORT_KEYWORD);
        if (kw == null)
            return fail(m);
        Node imp = new Node(IMPORT).add(kw);
        Node name = parseIdent();
        if (name == null)
            throw error("expected module name after import keyword");
        imp.add(name);
        Node as = keyword(AS_KEYWORD);
        if (as != null) {
            Node alias = parseIdent();
            if (alias == null)
                throw error("expected namespace alias after as keyword");
            imp.add(as).add(alias);
        } else {
            Node hiding = keyword(HIDING_KEYWORD);
            if (hiding != null)
                imp.add(hiding);
            Node lp = punct(L_PAREN);
            if (lp != null)
                identList(imp, lp,
                    "expected at least one import item in import list");
            else if (hiding != null)
                throw error("expected left paren to start import list");
        }
        if (!expectNewline())
            throw error("expected newline after import statement, not "
                        + found());
        return imp;
    }

    // a, b, c or (a, b, c) when lParen is given
    private void identList(Node to, Node lParen, String what) {
        if (lParen != null) {
            to.add(lParen);
            ++nesting;
        }
        try {
            Node id = parseIdent();
            if (id == null)
                throw error(what);
            to.add(id);
            for (Node comma; (comma = punct(COMMA)) != null;) {
                if ((id = parseIdent()) == null)
                    throw error("expected identifier after ,");
                to.add(comma).add(id);
            }
            if (lParen != null) {
                Node rp = punct(R_PAREN);
                if (rp == null)
                    throw error("expected right paren to terminate list, not "
                                + found());
                to.add(rp);
            }
        } finally {
            if (lParen != null)
                --nesting;
        }
    }

    private Node parseLine() {
        Node expr = parseExpr();
        return expr == null ? null : new Node(LINE).add(expr);
    }

    private Node parseExpr() {
        Node sub = parseSubexpr();
        if (sub == null)
            return null;
        Node expr = new Node(EXPR).add(sub);
        // a nested block leaves the cursor on a fresh line
        while (!atLineStart() && (sub = parseSubexpr()) != null)
            expr.add(sub);
        return expr;
    }

    private Node parseExprUntil(String[] terminators) {
        String[] outer = stops;
        stops = terminators;
        try {
            return parseExpr();
        } finally {
            stops = outer;
        }
    }

    private boolean stopsAt(String op) {
        for (int i = 0; i < stops.length; ++i)
            if (stops[i].equals(op))
                return true;
        return false;
    }

    // bracket contents: newlines allowed, no terminators inherited
    private String[] open() {
        String[] outer = stops;
        stops = NO_STOPS;
        ++nesting;
        return outer;
    }

    private void close(String[] outer) {
        stops = outer;
        --nesting;
    }

    private Node parseSubexpr() {
        Mark m = mark();
        skipBlanks();
        Node n;
        if ((n = parseVar()) == null &&
            (n = stopsAt("=") ? null : parseAssign()) == null &&
            (n = headed(FN_DECL)) == null &&
            (n = parseParen()) == null &&
            (n = parseReturn()) == null &&
            (n = headed(CASE)) == null &&
            (n = headed(IF_ELSE)) == null &&
            (n = headed(TRY)) == null &&
            (n = headed(WHILE)) == null &&
            (n = headed(FOR)) == null &&
            (n = parseLambda()) == null &&
            (n = parseList()) == null &&
            (n = parseCurly()) == null &&
            (n = parseQualIdent()) == null &&
            (n = parseInfixed()) == null &&
            (n = parseNumLit()) == null &&
            (n = parseChrLit()) == null &&
            (n = parseStrLit()) == null &&
            (n = parseOp()) == null)
            return fail(m);
        return new Node(SUBEXPR).add(n);
    }

    /*
     * Constructs with an indented body. The header ends at the
     * newline even inside brackets.
     */
    private Node headed(TokenType kind) {
        int outerNesting = nesting;
        String[] outerStops = stops;
        nesting = 0;
        stops = NO_STOPS;
        try {
            switch (kind) {
            case FN_DECL:
                return parseFnDecl();
            case CASE:
                return parseCase();
            case IF_ELSE:
                return parseIfElse();
            case TRY:
                return parseTry();
            case WHILE:
                return parseWhile();
            case FOR:
                return parseFor();
            default:
                throw new ParserDefectException(kind + " has no block");
            }
        } finally {
            nesting = outerNesting;
            stops = outerStops;
        }
    }

    private Node parseVar() {
        Mark m = mark();
        Node kw = keyword(VAR_KEYWORD);
        if (kw == null)
            return fail(m);
        Node var = new Node(VAR).add(kw);
        Node pattern = parsePattern();
        if (pattern == null)
            throw error("left-hand side of var assignment must be a pattern");
        var.add(pattern);
        Node colon = operator(COLON);
        if (colon != null) {
            Node type = parseTypeIdent();
            if (type == null)
                throw error("type of var binding must be a valid type identifier");
            var.add(colon).add(type);
        }
        Node eq = operator(EQUALS);
        if (eq == null)
            throw error("var assignment must use =, not " + found());
        Node expr = parseExpr();
        if (expr == null)
            throw error("right-hand side of var assignment must be a valid expression");
        return var.add(eq).add(expr);
    }

    /*
     * pattern [: type] = expr. Without the = everything is rolled back,
     * so the same text can be read as an ordinary expression.
     */
    private Node parseAssign() {
        Mark m = mark();
        Node pattern, type = null;
        try {
            pattern = parsePattern();
        } catch (ParseException ex) {
            return fail(m);
        }
        if (pattern == null)
            return fail(m);
        Node colon = operator(COLON);
        if (colon != null) {
            try {
                type = parseTypeIdent();
            } catch (ParseException ex) {
                return fail(m);
            }
            if (type == null)
                return fail(m);
        }
        Node eq = operator(EQUALS);
        if (eq == null)
            return fail(m);
        Node assign = new Node(ASSIGN).add(pattern);
        if (colon != null)
            assign.add(colon).add(type);
        Node expr = parseExpr();
        if (expr == null)
            throw error("right-hand side of assignment must be a valid expression");
        return assign.add(eq).add(expr);
    }

    private Node parseFnDecl() {
        Mark m = mark();
        Node kw = keyword(FN_KEYWORD);
        if (kw == null)
            return fail(m);
        Node name = parseIdent();
        if (name == null)
            throw error("expected function name, not " + found());
        Node fn = new Node(FN_DECL).add(kw).add(name);
        for (Node param; (param = parseParam()) != null;)
            fn.add(param);
        Node arrow = operator(R_ARROW);
        if (arrow != null) {
            Node type = parseTypeIdent();
            if (type == null)
                throw error("expected return type after ->");
            fn.add(arrow).add(type);
        }
        parseBlock(fn, LINE);
        return fn;
    }

    /*
     * () is the empty tuple, (a) is parenthesized, (a, b...) is a tuple
     * and (a,) is an error.
     */
    private Node parseParen() {
        Mark m = mark();
        Node lp = punct(L_PAREN);
        if (lp == null)
            return fail(m);
        String[] outer = open();
        try {
            Node rp = punct(R_PAREN);
            if (rp != null)
                return new Node(TUPLE_LIT).add(lp).add(rp);
            Node first = parseExpr();
            if (first == null)
                throw error("expected expression within parens, not "
                            + found());
            if ((rp = punct(R_PAREN)) != null)
                return new Node(PARENED).add(lp).add(first).add(rp);
            Node comma = punct(COMMA);
            if (comma == null)
                throw error("expected closing paren, not " + found());
            Node tuple = new Node(TUPLE_LIT).add(lp).add(first).add(comma);
            Node expr = parseExpr();
            if (expr == null)
                throw error("expected 0 or at least 2 elements in tuple");
            tuple.add(expr);
            while ((comma = punct(COMMA)) != null) {
                if ((expr = parseExpr()) == null)
                    throw error("expected tuple element after ,");
                tuple.add(comma).add(expr);
            }
            if ((rp = punct(R_PAREN)) == null)
                throw error("expected right paren to terminate tuple, not "
                            + found());
            return tuple.add(rp);
        } finally {
            close(outer);
        }
    }

    private Node parseReturn() {
        Mark m = mark();
        Node kw = keyword(RETURN_KEYWORD);
        if (kw == null)
            return fail(m);
        Node expr = parseExpr();
        if (expr == null)
            throw error("expected expression to return");
        return new Node(RETURN).add(kw).add(expr);
    }

    private Node parseCase() {
        Mark m = mark();
        Node kw = keyword(CASE_KEYWORD);
        if (kw == null)
            return fail(m);
        Node subject = parseExpr();
        if (subject == null)
            throw error("expected subject expression for case");
        Node node = new Node(CASE).add(kw).add(subject);
        parseBlock(node, CASE_BRANCH);
        return node;
    }

    private Node parseCaseBranch() {
        Mark m = mark();
        Node pattern = parsePattern();
        if (pattern == null)
            return fail(m);
        Node arrow = operator(FAT_R_ARROW);
        if (arrow == null)
            throw error("expected => while parsing case branch, not "
                        + found());
        Node line = parseLine();
        if (line == null)
            throw error("expected expression(s) after =>");
        return new Node(CASE_BRANCH).add(pattern).add(arrow).add(line);
    }

    private Node parseIfElse() {
        Mark m = mark();
        Node kw = keyword(IF_KEYWORD);
        if (kw == null)
            return fail(m);
        Node cond = parseExpr();
        if (cond == null)
            throw error("expected expression as if condition");
        Node node = new Node(IF_ELSE).add(kw).add(cond);
        String start = parseBlock(node, LINE);
        if (cur.atEnd() || !indent.equals(start))
            return node;
        Node els = keyword(ELSE_KEYWORD);
        if (els == null)
            return node;
        node.add(els);
        Node elseIf = parseIfElse();
        if (elseIf != null)
            return node.add(elseIf);
        parseBlock(node, LINE);
        return node;
    }

    private Node parseTry() {
        Mark m = mark();
        Node kw = keyword(TRY_KEYWORD);
        if (kw == null)
            return fail(m);
        Node node = new Node(TRY).add(kw);
        String start = parseBlock(node, LINE);
        if (cur.atEnd() || !indent.equals(start))
            throw error("try must have corresponding catch on same indent level");
        Node katch = keyword(CATCH_KEYWORD);
        if (katch == null)
            throw error("try must have corresponding catch, not " + found());
        Node name = parseIdent();
        if (name == null)
            throw error("catch must name the caught exception");
        node.add(katch).add(name);
        parseBlock(node, LINE);
        return node;
    }

    private Node parseWhile() {
        Mark m = mark();
        Node kw = keyword(WHILE_KEYWORD);
        if (kw == null)
            return fail(m);
        Node cond = parseExpr();
        if (cond == null)
            throw error("expected expression as while condition");
        Node node = new Node(WHILE).add(kw).add(cond);
        parseBlock(node, LINE);
        return node;
    }

    private Node parseFor() {
        Mark m = mark();
        Node kw = keyword(FOR_KEYWORD);
        if (kw == null)
            return fail(m);
        Node pattern = parsePattern();
        if (pattern == null)
            throw error("expected pattern as first part of for header");
        Node in = keyword(IN_KEYWORD);
        if (in == null)
            throw error("missing in keyword of for loop, found " + found());
        Node iterated = parseExpr();
        if (iterated == null)
            throw error("for must iterate over an expression");
        Node node = new Node(FOR).add(kw).add(pattern).add(in).add(iterated);
        parseBlock(node, LINE);
        return node;
    }

    private Node parseLambda() {
        Mark m = mark();
        Node bs = operator(BACKSLASH);
        if (bs == null)
            return fail(m);
        Node param = parseParam();
        if (param == null)
            throw error("lambda expression requires 1+ args");
        Node lambda = new Node(LAMBDA).add(bs).add(param);
        for (Node comma; (comma = punct(COMMA)) != null;) {
            if ((param = parseParam()) == null)
                throw error("expected lambda parameter after ,");
            lambda.add(comma).add(param);
        }
        Node arrow = operator(R_ARROW);
        if (arrow == null)
            throw error("lambda expression requires ->, not " + found());
        Node body = parseExpr();
        if (body == null)
            throw error("lambda body must be expression");
        return lambda.add(arrow).add(body);
    }

    private Node parseList() {
        Mark m = mark();
        Node lb = punct(L_SQ_BRACKET);
        if (lb == null)
            return fail(m);
        String[] outer = open();
        try {
            Node rb = punct(R_SQ_BRACKET);
            if (rb != null)
                return new Node(LIST_LIT).add(lb).add(rb);
            Node first = parseExprUntil(BAR_STOP);
            if (first == null)
                throw error("expected expression or ] after [, not "
                            + found());
            Node bar = operator(BAR);
            if (bar != null) {
                Node comp = new Node(LIST_COMP).add(lb).add(first).add(bar);
                clauses(comp);
                if ((rb = punct(R_SQ_BRACKET)) == null)
                    throw error("expected ] to terminate list comprehension, not "
                                + found());
                return comp.add(rb);
            }
            Node list = new Node(LIST_LIT).add(lb).add(first);
            elements(list, "expected list element after ,");
            if ((rb = punct(R_SQ_BRACKET)) == null)
                throw error("left square bracket in list literal requires ], not "
                            + found());
            return list.add(rb);
        } finally {
            close(outer);
        }
    }

    /*
     * {} and {k = v...} are dicts, {a, b...} sets; either can be
     * a comprehension after |.
     */
    private Node parseCurly() {
        Mark m = mark();
        Node lc = punct(L_CURLY_BRACKET);
        if (lc == null)
            return fail(m);
        String[] outer = open();
        try {
            Node rc = punct(R_CURLY_BRACKET);
            if (rc != null)
                return new Node(DICT_LIT).add(lc).add(rc);
            // a dict key and a set element differ only in ending at =
            Node first = parseExprUntil(KEY_STOPS);
            if (first == null)
                throw error("expected dict entry or set element after {, not "
                            + found());
            Node eq = operator(EQUALS);
            if (eq != null) {
                Node entry = dictEntry(first, eq);
                Node bar = operator(BAR);
                if (bar != null) {
                    Node comp = new Node(DICT_COMP).add(lc).add(entry).add(bar);
                    clauses(comp);
                    if ((rc = punct(R_CURLY_BRACKET)) == null)
                        throw error("expected } to terminate dict comprehension, not "
                                    + found());
                    return comp.add(rc);
                }
                Node dict = new Node(DICT_LIT).add(lc).add(entry);
                for (Node comma; (comma = punct(COMMA)) != null;) {
                    Node key = parseExprUntil(KEY_STOPS);
                    if (key == null)
                        throw error("expected dict entry after ,");
                    if ((eq = operator(EQUALS)) == null)
                        throw error("expected = after dict key, not " + found());
                    dict.add(comma).add(dictEntry(key, eq));
                }
                if ((rc = punct(R_CURLY_BRACKET)) == null)
                    throw error("left curly bracket in dict literal requires }, not "
                                + found());
                return dict.add(rc);
            }
            Node bar = operator(BAR);
            if (bar != null) {
                Node comp = new Node(SET_COMP).add(lc).add(first).add(bar);
                clauses(comp);
                if ((rc = punct(R_CURLY_BRACKET)) == null)
                    throw error("expected } to terminate set comprehension, not "
                                + found());
                return comp.add(rc);
            }
            Node set = new Node(SET_LIT).add(lc).add(first);
            elements(set, "expected set element after ,");
            if ((rc = punct(R_CURLY_BRACKET)) == null)
                throw error("left curly bracket in set literal requires }, not "
                            + found());
            return set.add(rc);
        } finally {
            close(outer);
        }
    }

    private void elements(Node to, String what) {
        for (Node comma, expr; (comma = punct(COMMA)) != null;) {
            if ((expr = parseExprUntil(BAR_STOP)) == null)
                throw error(what);
            to.add(comma).add(expr);
        }
    }

    private Node dictEntry(Node key, Node eq) {
        Node value = parseExprUntil(BAR_STOP);
        if (value == null)
            throw error("expected expression to be assigned to dict key");
        return new Node(DICT_ENTRY).add(key).add(eq).add(value);
    }

    // generator or condition, separated by commas
    private void clauses(Node comp) {
        Node clause = parseClause();
        if (clause == null)
            throw error("expected generator or condition after |");
        comp.add(clause);
        for (Node comma; (comma = punct(COMMA)) != null;) {
            if ((clause = parseClause()) == null)
                throw error("expected generator or condition after ,");
            comp.add(comma).add(clause);
        }
    }

    private Node parseClause() {
        Node gen = parseGenerator();
        return gen != null ? gen : parseExpr();
    }

    private Node parseGenerator() {
        Mark m = mark();
        Node pattern;
        try {
            pattern = parsePattern();
        } catch (ParseException ex) {
            return fail(m);
        }
        if (pattern == null)
            return fail(m);
        Node arrow = operator(L_ARROW);
        if (arrow == null)
            return fail(m);
        Node expr = parseExpr();
        if (expr == null)
            throw error("expected expression after <-");
        return new Node(GENERATOR).add(pattern).add(arrow).add(expr);
    }

    Node parseQualIdent() {
        Mark m = mark();
        skipBlanks();
        Node id = parseMemberIdent();
        if (id == null && (id = parseScopedIdent()) == null
                       && (id = parseIdent()) == null)
            return fail(m);
        return new Node(QUAL_IDENT).add(id);
    }

    private Node parseNamespacedIdent() {
        Mark m = mark();
        skipBlanks();
        Node id = parseScopedIdent();
        if (id == null && (id = parseIdent()) == null)
            return fail(m);
        return new Node(NAMESPACED_IDENT).add(id);
    }

    private Node parseMemberIdent() {
        return chainedIdent(MEMBER_IDENT, DOT);
    }

    private Node parseScopedIdent() {
        return chainedIdent(SCOPED_IDENT, DOUBLE_COLON);
    }

    // a.b.c or A::B::c; a lone identifier is rolled back
    private Node chainedIdent(TokenType kind, TokenType separator) {
        Mark m = mark();
        Node first = parseIdent();
        if (first == null)
            return fail(m);
        Node sep = operatorHere(separator);
        if (sep == null)
            return fail(m);
        Node node = new Node(kind).add(first);
        do {
            Node id = ident();
            if (id == null)
                throw error("expected identifier after " + separator.lexeme()
                            + ", not " + found());
            node.add(sep).add(id);
        } while ((sep = operatorHere(separator)) != null);
        return node;
    }

    Node parseIdent() {
        skipBlanks();
        return ident();
    }

    Node parseTypeIdent() {
        Mark m = mark();
        Node id = parseNamespacedIdent();
        if (id != null)
            return new Node(TYPE_IDENT).add(id);
        Node open = punct(L_PAREN);
        if (open != null)
            return typeTuple(open);
        if ((open = punct(L_SQ_BRACKET)) != null)
            return typeList(open);
        if ((open = punct(L_CURLY_BRACKET)) != null)
            return typeDictOrSet(open);
        return fail(m);
    }

    private Node typeTuple(Node lp) {
        Node type = new Node(TYPE_IDENT).add(lp);
        String[] outer = open();
        try {
            Node first = parseTypeIdent();
            if (first != null) {
                Node comma = punct(COMMA);
                if (comma == null)
                    throw error("expected comma after first type tuple element");
                Node second = parseTypeIdent();
                if (second == null)
                    throw error("expected 0 or at least 2 elements in type tuple");
                type.add(first).add(comma).add(second);
                while ((comma = punct(COMMA)) != null) {
                    Node next = parseTypeIdent();
                    if (next == null)
                        throw error("expected type after ,");
                    type.add(comma).add(next);
                }
            }
            Node rp = punct(R_PAREN);
            if (rp == null)
                throw error("expected right paren to terminate type tuple");
            return type.add(rp);
        } finally {
            close(outer);
        }
    }

    private Node typeList(Node lb) {
        String[] outer = open();
        try {
            Node elem = parseTypeIdent();
            if (elem == null)
                throw error("expected type identifier after [");
            Node rb = punct(R_SQ_BRACKET);
            if (rb == null)
                throw error("expected closing ] of list type");
            return new Node(TYPE_IDENT).add(lb).add(elem).add(rb);
        } finally {
            close(outer);
        }
    }

    private Node typeDictOrSet(Node lc) {
        String[] outer = open();
        try {
            Node key = parseTypeIdent();
            if (key == null)
                throw error("expected type identifier after {");
            Node type = new Node(TYPE_IDENT).add(lc).add(key);
            Node comma = punct(COMMA);
            if (comma != null) {
                Node value = parseTypeIdent();
                if (value == null)
                    throw error("expected type identifier after ,");
                type.add(comma).add(value);
            }
            Node rc = punct(R_CURLY_BRACKET);
            if (rc == null)
                throw error("expected closing } of dict/set type");
            return type.add(rc);
        } finally {
            close(outer);
        }
    }

    private Node parseInfixed() {
        Mark m = mark();
        Node open = punct(BACKTICK);
        if (open == null)
            return fail(m);
        Node id = parseQualIdent();
        if (id == null)
            throw error("expected identifier after `");
        Node close = punctHere(BACKTICK);
        if (close == null)
            throw error("expected closing `, not " + found());
        return new Node(INFIXED).add(open).add(id).add(close);
    }

    /*
     * [-] (NaN | Infinity | digits [. digits]). Once the digits are
     * read a dot must be followed by more digits.
     */
    private Node parseNumLit() {
        Mark m = mark();
        // the sign must touch the number, "a - 1" is an operator
        Node minus = operator(MINUS);
        Node value = keywordHere(NAN_KEYWORD);
        if (value == null)
            value = keywordHere(INFINITY_KEYWORD);
        if (value != null)
            return numLit(REAL_LIT, minus, value);
        int from = cur.save();
        if (!isDigit(cur.peek()))
            return fail(m);
        while (isDigit(cur.peek()))
            cur.advance();
        if (cur.peek() != '.')
            return numLit(INT_LIT, minus, leaf(ABS_INT, cur.text(from), from));
        cur.advance();
        if (!isDigit(cur.peek()))
            throw error("expected at least one digit after decimal point");
        while (isDigit(cur.peek()))
            cur.advance();
        return numLit(REAL_LIT, minus, leaf(ABS_REAL, cur.text(from), from));
    }

    private static Node numLit(TokenType kind, Node minus, Node value) {
        Node lit = new Node(kind);
        if (minus != null)
            lit.add(minus);
        return new Node(NUM_LIT).add(lit.add(value));
    }

    private Node parseChrLit() {
        Mark m = mark();
        Node open = punct(SINGLE_QUOTE);
        if (open == null)
            return fail(m);
        Node chr = literalChar(CHR_CHR, "'\\");
        if (chr == null)
            throw error(cur.atEnd() ? "unterminated character literal"
                                    : "expected character between quotes");
        Node close = punctHere(SINGLE_QUOTE);
        if (close == null)
            throw error("expected ', got: " + found());
        return new Node(CHR_LIT).add(open).add(chr).add(close);
    }

    private Node parseStrLit() {
        Mark m = mark();
        Node open = punct(DOUBLE_QUOTE);
        if (open == null)
            return fail(m);
        Node str = new Node(STR_LIT).add(open);
        for (Node chr; (chr = literalChar(STR_CHR, "\"\\")) != null;)
            str.add(chr);
        Node close = punctHere(DOUBLE_QUOTE);
        if (close == null)
            throw error("unterminated string literal");
        return str.add(close);
    }

    /*
     * Any character outside the control set, or a backslash
     * followed by an escape character.
     */
    private Node literalChar(TokenType kind, String control) {
        int at = cur.save();
        int c = matchCharNotIn(control);
        if (c >= 0)
            return leaf(kind, String.valueOf((char) c), at);
        if (!matchChar('\\'))
            return null;
        if ((c = matchCharIn(ESC_CHARS)) < 0)
            throw error(at, "invalid escape sequence \\"
                + (cur.atEnd() ? "at end of input" : String.valueOf((char) cur.peek())));
        return leaf(kind, "\\" + (char) c, at);
    }

    private Node parseOp() {
        Mark m = mark();
        skipBlanks();
        int from = cur.save();
        while (matchCharIn(OP_CHARS) >= 0);
        if (cur.save() == from)
            return fail(m);
        String op = cur.text(from);
        if (isReservedOp(op)) {
            // -- starts a comment
            if (op.equals("--") || stopsAt(op))
                return fail(m);
            throw error(from, "the operator " + op + " is reserved");
        }
        return leaf(OP, op, from);
    }

    Node parsePattern() {
        Mark m = mark();
        skipBlanks();
        Node n;
        if ((n = parseIdent()) != null ||
            (n = parseChrLit()) != null ||
            (n = parseStrLit()) != null ||
            (n = parseNumLit()) != null ||
            (n = keyword(UNDERSCORE)) != null)
            return new Node(PATTERN).add(n);
        if ((n = punct(L_PAREN)) != null)
            return tuplePattern(n);
        if ((n = punct(L_SQ_BRACKET)) != null)
            return listPattern(n);
        if ((n = punct(L_CURLY_BRACKET)) != null)
            return curlyPattern(n);
        return fail(m);
    }

    private Node tuplePattern(Node lp) {
        Node pattern = new Node(PATTERN).add(lp);
        String[] outer = open();
        try {
            Node first = parsePattern();
            if (first != null) {
                Node comma = punct(COMMA);
                if (comma == null)
                    throw error("expected comma after first element of pattern tuple");
                Node second = parsePattern();
                if (second == null)
                    throw error("expected 0 or at least 2 elements in pattern tuple");
                pattern.add(first).add(comma).add(second);
                patternTail(pattern);
            }
            Node rp = punct(R_PAREN);
            if (rp == null)
                throw error("left paren in pattern requires ), not " + found());
            return pattern.add(rp);
        } finally {
            close(outer);
        }
    }

    private Node listPattern(Node lb) {
        Node pattern = new Node(PATTERN).add(lb);
        String[] outer = open();
        try {
            Node first = parsePattern();
            if (first != null) {
                pattern.add(first);
                patternTail(pattern);
            }
            Node rb = punct(R_SQ_BRACKET);
            if (rb == null)
                throw error("left square bracket in pattern requires ], not "
                            + found());
            return pattern.add(rb);
        } finally {
            close(outer);
        }
    }

    // {k = v, ...} or {a, b, ...}
    private Node curlyPattern(Node lc) {
        Node pattern = new Node(PATTERN).add(lc);
        String[] outer = open();
        try {
            Node first = parsePattern();
            if (first != null) {
                pattern.add(first);
                Node eq = operator(EQUALS);
                if (eq == null) {
                    patternTail(pattern);
                } else {
                    Node value = parsePattern();
                    if (value == null)
                        throw error("expected value pattern after first = of dict pattern");
                    pattern.add(eq).add(value);
                    for (Node comma; (comma = punct(COMMA)) != null;) {
                        Node key = parsePattern();
                        if (key == null)
                            throw error("expected key pattern after ,");
                        if ((eq = operator(EQUALS)) == null)
                            throw error("expected = after key of dict pattern");
                        if ((value = parsePattern()) == null)
                            throw error("expected value pattern after = of dict pattern");
                        pattern.add(comma).add(key).add(eq).add(value);
                    }
                }
            }
            Node rc = punct(R_CURLY_BRACKET);
            if (rc == null)
                throw error("left curly bracket in pattern requires }, not "
                            + found());
            return pattern.add(rc);
        } finally {
            close(outer);
        }
    }

    private void patternTail(Node pattern) {
        for (Node comma; (comma = punct(COMMA)) != null;) {
            Node next = parsePattern();
            if (next == null)
                throw error("expected pattern after ,");
            pattern.add(comma).add(next);
        }
    }

    /*
     * (pattern : type) or a bare pattern. A parenthesized pattern
     * without the colon is read again as a tuple pattern.
     */
    private Node parseParam() {
        Mark m = mark();
        Node lp = punct(L_PAREN);
        if (lp != null) {
            String[] outer = open();
            try {
                Node pattern = null, colon = null;
                try {
                    pattern = parsePattern();
                } catch (ParseException ex) {
                    pattern = null;
                }
                if (pattern != null && (colon = operator(COLON)) != null) {
                    Node type = parseTypeIdent();
                    if (type == null)
                        throw error("expected type after :");
                    Node rp = punct(R_PAREN);
                    if (rp == null)
                        throw error("expected ) after type, not " + found());
                    return new Node(PARAM).add(lp).add(pattern)
                                .add(colon).add(type).add(rp);
                }
            } finally {
                close(outer);
            }
            reset(m);
        }
        Node pattern = parsePattern();
        if (pattern == null)
            return fail(m);
        return new Node(PARAM).add(pattern);
    }

    /**
     * Parses the indented body of a header construct into the given
     * node.
     *
     * @param itemKind LINE or CASE_BRANCH
     * @return the indentation of the header line
     */
    String parseBlock(Node to, TokenType itemKind) {
        String start = indent;
        if (!expectNewline())
            throw error("expected newline after header, not " + found());
        String block = indent;
        if (cur.atEnd() || block.length() <= start.length()
                || !block.startsWith(start))
            throw error("improper indentation after header");
        Node item = blockItem(itemKind);
        if (item == null)
            throw error("expected at least one item in block, not "
                        + found());
        to.add(item);
        if (!expectNewline())
            throw error("expected newline after first item of block, not "
                        + found());
        while (!cur.atEnd() && indent.equals(block)) {
            if ((item = blockItem(itemKind)) == null)
                throw error("expected item in block, not " + found());
            to.add(item);
            if (!expectNewline())
                throw error("expected newline after block item, not "
                            + found());
        }
        return start;
    }

    private Node blockItem(TokenType itemKind) {
        switch (itemKind) {
        case LINE:
            return parseLine();
        case CASE_BRANCH:
            return parseCaseBranch();
        default:
            throw new ParserDefectException("unhandled block item type "
                                            + itemKind);
        }
    }
}
