// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, syntax tree node tags.
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
 * Tags of the syntax tree nodes.
 *
 * Structural tags have no source text, their meaning is given by
 * the child sequence. Terminal tags carry the matched lexeme, fixed
 * ones know it in advance.
 */
public enum TokenType {
    ROOT,
    PROG,
    MOD_DECL,
    IMPORT,
    LINE,
    EXPR,
    SUBEXPR,
    CHR_LIT,
    STR_LIT,
    FN_DECL,
    PARENED,
    RETURN,
    CASE,
    CASE_BRANCH,
    IF_ELSE,
    TRY,
    WHILE,
    FOR,
    LAMBDA,
    TUPLE_LIT,
    LIST_LIT,
    LIST_COMP,
    DICT_LIT,
    DICT_COMP,
    DICT_ENTRY,
    SET_LIT,
    SET_COMP,
    GENERATOR,
    QUAL_IDENT,
    NAMESPACED_IDENT,
    MEMBER_IDENT,
    SCOPED_IDENT,
    TYPE_IDENT,
    NUM_LIT,
    INT_LIT,
    REAL_LIT,
    INFIXED,
    VAR,
    ASSIGN,
    PATTERN,
    PARAM,

    IDENT(true),
    OP(true),
    ABS_INT(true),
    ABS_REAL(true),
    CHR_CHR(true),
    STR_CHR(true),

    MODULE_KEYWORD("module"),
    EXPOSING_KEYWORD("exposing"),
    HIDING_KEYWORD("hiding"),
    IMPORT_KEYWORD("import"),
    AS_KEYWORD("as"),
    FN_KEYWORD("fn"),
    CASE_KEYWORD("case"),
    IF_KEYWORD("if"),
    ELSE_KEYWORD("else"),
    TRY_KEYWORD("try"),
    CATCH_KEYWORD("catch"),
    WHILE_KEYWORD("while"),
    FOR_KEYWORD("for"),
    IN_KEYWORD("in"),
    VAR_KEYWORD("var"),
    RETURN_KEYWORD("return"),
    NAN_KEYWORD("NaN"),
    INFINITY_KEYWORD("Infinity"),

    EQUALS("="),
    SINGLE_QUOTE("'"),
    DOUBLE_QUOTE("\""),
    DOT("."),
    COMMA(","),
    COLON(":"),
    DOUBLE_COLON("::"),
    UNDERSCORE("_"),
    L_ARROW("<-"),
    R_ARROW("->"),
    FAT_R_ARROW("=>"),
    L_PAREN("("),
    R_PAREN(")"),
    L_SQ_BRACKET("["),
    R_SQ_BRACKET("]"),
    L_CURLY_BRACKET("{"),
    R_CURLY_BRACKET("}"),
    BACKSLASH("\\"),
    MINUS("-"),
    BAR("|"),
    BACKTICK("`");

    private final boolean terminal;
    private final String lexeme;

    TokenType() {
        this(false);
    }

    TokenType(boolean terminal) {
        this.terminal = terminal;
        this.lexeme = null;
    }

    TokenType(String lexeme) {
        this.terminal = true;
        this.lexeme = lexeme;
    }

    /** Whether nodes of this kind carry source text. */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * The fixed source text of a keyword or punctuation tag,
     * null for identifiers, literals and structural tags.
     */
    public String lexeme() {
        return lexeme;
    }
}
