// ex: se sts=4 sw=4 expandtab:

/*
 * Brouwer language parser, syntax tree.
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
import java.util.List;

/**
 * Syntax tree node.
 *
 * A node exclusively owns its children. Leaves carry the verbatim
 * lexeme, inner nodes only the tag and the child sequence.
 */
public final class Node {
    private static final Node[] NO_CHILDREN = {};

    private final TokenType tag;
    private final String text;
    private Node[] children = NO_CHILDREN;
    private int count;
    int line;
    int col;

    Node(TokenType tag) {
        this.tag = tag;
        this.text = "";
    }

    Node(TokenType tag, String text) {
        this.tag = tag;
        this.text = text;
    }

    Node pos(int line, int col) {
        this.line = line;
        this.col = col;
        return this;
    }

    Node add(Node child) {
        if (count == children.length) {
            Node[] tmp = new Node[count == 0 ? 4 : count << 1];
            System.arraycopy(children, 0, tmp, 0, count);
            children = tmp;
        }
        children[count++] = child;
        if (count == 1 && line == 0) {
            line = child.line;
            col = child.col;
        }
        return this;
    }

    public TokenType tag() {
        return tag;
    }

    /** Matched source text, empty for inner nodes. */
    public String text() {
        return text;
    }

    public int childCount() {
        return count;
    }

    public Node getChild(int i) {
        if (i < 0 || i >= count)
            throw new IndexOutOfBoundsException(
                "child " + i + " of " + count + " in " + tag);
        return children[i];
    }

    public boolean isLeaf() {
        return count == 0;
    }

    /** Source line of the first character, 1-based (0 when unknown). */
    public int line() {
        return line;
    }

    public int column() {
        return col;
    }

    /**
     * First child with the given tag, or null.
     */
    public Node find(TokenType tag) {
        for (int i = 0; i < count; ++i)
            if (children[i].tag == tag)
                return children[i];
        return null;
    }

    /** Number of direct children with the given tag. */
    public int count(TokenType tag) {
        int n = 0;
        for (int i = 0; i < count; ++i)
            if (children[i].tag == tag)
                ++n;
        return n;
    }

    /**
     * Lexemes of the leaves, left to right.
     */
    public List<String> terminals() {
        List<String> res = new ArrayList<String>();
        terminals(res);
        return res;
    }

    private void terminals(List<String> to) {
        if (isLeaf()) {
            if (tag.isTerminal())
                to.add(text);
            return;
        }
        for (int i = 0; i < count; ++i)
            children[i].terminals(to);
    }

    /**
     * Compact s-expression form, for example
     * <code>(EXPR (SUBEXPR (QUAL_IDENT x)))</code>.
     */
    public String str() {
        if (isLeaf())
            return tag.isTerminal() ? text : tag.name();
        StringBuffer buf = new StringBuffer("(");
        buf.append(tag.name());
        for (int i = 0; i < count; ++i) {
            buf.append(' ');
            buf.append(children[i].str());
        }
        return buf.append(')').toString();
    }

    /**
     * Indented listing, one node per line, children two spaces
     * deeper than their parent.
     */
    public String dump() {
        StringBuffer buf = new StringBuffer();
        dump(buf, 0);
        return buf.toString();
    }

    private void dump(StringBuffer buf, int depth) {
        for (int i = 0; i < depth; ++i)
            buf.append("  ");
        buf.append(tag.name());
        if (tag.isTerminal())
            buf.append(" \"").append(text).append('"');
        buf.append('\n');
        for (int i = 0; i < count; ++i)
            children[i].dump(buf, depth + 1);
    }

    public String toString() {
        return isLeaf() && tag.isTerminal()
            ? '`' + text + '\'' : tag.name();
    }
}
