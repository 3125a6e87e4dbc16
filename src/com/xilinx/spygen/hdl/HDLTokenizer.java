/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of SpyGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.xilinx.spygen.hdl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the text of a Verilog/SystemVerilog source file into {@link HDLToken}s.
 * Whitespace, comments, attribute instances and compiler directives are dropped,
 * but every token remembers whether something separated it from its predecessor
 * so that expression text can be rebuilt as written.
 */
public class HDLTokenizer {

    /** Compiler directives that consume the rest of their line */
    private static final Set<String> LINE_DIRECTIVES = new HashSet<>(Arrays.asList(
            "timescale", "include", "define", "undef", "undefineall", "ifdef", "ifndef",
            "elsif", "else", "endif", "resetall", "default_nettype", "celldefine",
            "endcelldefine", "line", "pragma", "begin_keywords", "end_keywords",
            "unconnected_drive", "nounconnected_drive", "protect", "endprotect"));

    private static final String[] OPERATORS;

    static {
        OPERATORS = new String[] {
            "<<<=", ">>>=", "===", "!==", "==?", "!=?", "<<=", ">>=", "<<<", ">>>", "<->",
            "|->", "|=>", "->>", "::", "==", "!=", "<=", ">=", "&&", "||", "**", "<<", ">>",
            "->", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "++", "--", "~&", "~|",
            "~^", "^~", "+:", "-:", "##", ".*", ":=", "=>", "*>", "@@"
        };
        Arrays.sort(OPERATORS, Comparator.comparingInt(String::length).reversed());
    }

    private final String fileName;

    private final String text;

    private int offset = 0;

    private int line = 1;

    private int column = 1;

    /** Module being tokenized, used as context in error messages */
    private String currentModule;

    private boolean expectModuleName;

    public HDLTokenizer(String fileName, String text) {
        this.fileName = fileName;
        this.text = text;
    }

    /**
     * Convenience method to tokenize a complete source text.
     * @param fileName Name of the file, used in error messages
     * @param text Source text
     * @return All tokens of the text in order.
     */
    public static List<HDLToken> tokenize(String fileName, String text) {
        HDLTokenizer tokenizer = new HDLTokenizer(fileName, text);
        List<HDLToken> tokens = new ArrayList<>();
        HDLToken t;
        while ((t = tokenizer.getOptionalNextToken()) != null) {
            tokens.add(t);
        }
        return tokens;
    }

    public String getFileName() {
        return fileName;
    }

    private char peek(int ahead) {
        int i = offset + ahead;
        return i < text.length() ? text.charAt(i) : 0;
    }

    private char advance() {
        char c = text.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private HDLParseException error(int errLine, int errColumn, String message) {
        return new HDLParseException(fileName, errLine, errColumn, currentModule, message);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isBaseChar(char c) {
        switch (c) {
            case 'b': case 'B': case 'o': case 'O': case 'd': case 'D': case 'h': case 'H':
                return true;
            default:
                return false;
        }
    }

    private static boolean isBasedDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F') || c == '_'
                || c == 'x' || c == 'X' || c == 'z' || c == 'Z' || c == '?';
    }

    /**
     * Skips whitespace, comments, attribute instances and line directives.
     * @return True if anything was skipped.
     */
    private boolean skipIgnored() {
        boolean skipped = false;
        while (offset < text.length()) {
            char c = peek(0);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                while (offset < text.length() && peek(0) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                skipUntil("*/", "Unterminated block comment");
            } else if (c == '(' && peek(1) == '*' && isAttributeStart()) {
                skipUntil("*)", "Unterminated attribute instance");
            } else if (c == '`' && LINE_DIRECTIVES.contains(readWordAt(offset + 1))) {
                skipDirective();
            } else {
                break;
            }
            skipped = true;
        }
        return skipped;
    }

    /**
     * Tells "(* attr *)" from the event control "@(*)" and "@( * )", looking at the
     * "(*" under the cursor.
     */
    private boolean isAttributeStart() {
        int next = offset + 2;
        while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
            next++;
        }
        if (next < text.length() && text.charAt(next) == ')') {
            return false;
        }
        int prev = offset - 1;
        while (prev >= 0 && Character.isWhitespace(text.charAt(prev))) {
            prev--;
        }
        return prev < 0 || text.charAt(prev) != '@';
    }

    private void skipUntil(String terminator, String message) {
        int startLine = line;
        int startColumn = column;
        int end = text.indexOf(terminator, offset + 2);
        if (end < 0) {
            throw error(startLine, startColumn, message);
        }
        while (offset < end + terminator.length()) {
            advance();
        }
    }

    private String readWordAt(int start) {
        int end = start;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        return text.substring(start, end);
    }

    private void skipDirective() {
        while (offset < text.length()) {
            char c = peek(0);
            if (c == '\\' && (peek(1) == '\n' || (peek(1) == '\r' && peek(2) == '\n'))) {
                advance();
                advance();
                continue;
            }
            if (c == '\n') {
                break;
            }
            if (c == '/' && peek(1) == '*') {
                skipUntil("*/", "Unterminated block comment");
                continue;
            }
            advance();
        }
    }

    /**
     * Reads the next token.
     * @return The token or null at the end of the text.
     */
    public HDLToken getOptionalNextToken() {
        boolean spaceBefore = skipIgnored();
        if (offset >= text.length()) {
            return null;
        }
        int startLine = line;
        int startColumn = column;
        int start = offset;
        char c = peek(0);
        HDLToken.Kind kind;
        if (isIdentifierStart(c)) {
            while (offset < text.length() && isIdentifierPart(peek(0))) {
                advance();
            }
            kind = HDLToken.Kind.IDENTIFIER;
        } else if (c == '\\') {
            while (offset < text.length() && !Character.isWhitespace(peek(0))) {
                advance();
            }
            kind = HDLToken.Kind.IDENTIFIER;
        } else if (c == '$' && isIdentifierPart(peek(1))) {
            advance();
            while (offset < text.length() && isIdentifierPart(peek(0))) {
                advance();
            }
            kind = HDLToken.Kind.SYSTEM_IDENTIFIER;
        } else if (c == '`' && isIdentifierStart(peek(1))) {
            advance();
            while (offset < text.length() && isIdentifierPart(peek(0))) {
                advance();
            }
            kind = HDLToken.Kind.MACRO;
        } else if (isDigit(c)) {
            readNumber();
            kind = HDLToken.Kind.NUMBER;
        } else if (c == '\'' && (isBaseChar(peek(1)) || ((peek(1) == 's' || peek(1) == 'S') && isBaseChar(peek(2))))) {
            readBasedValue();
            kind = HDLToken.Kind.NUMBER;
        } else if (c == '\'' && "01xXzZ".indexOf(peek(1)) >= 0 && !isIdentifierPart(peek(2))) {
            advance();
            advance();
            kind = HDLToken.Kind.NUMBER;
        } else if (c == '"') {
            readString(startLine, startColumn);
            kind = HDLToken.Kind.STRING;
        } else {
            String op = matchOperator();
            int length = op == null ? 1 : op.length();
            for (int i = 0; i < length; i++) {
                advance();
            }
            kind = HDLToken.Kind.SYMBOL;
        }
        HDLToken token = new HDLToken(kind, text.substring(start, offset), startLine, startColumn, spaceBefore);
        if (kind == HDLToken.Kind.IDENTIFIER) {
            trackModule(token.text);
        }
        return token;
    }

    private void trackModule(String identifier) {
        if (identifier.equals("module") || identifier.equals("macromodule")) {
            expectModuleName = true;
        } else if (identifier.equals("endmodule")) {
            currentModule = null;
        } else if (expectModuleName && !identifier.equals("static") && !identifier.equals("automatic")) {
            currentModule = identifier;
            expectModuleName = false;
        }
    }

    private void readNumber() {
        while (offset < text.length() && (isDigit(peek(0)) || peek(0) == '_')) {
            advance();
        }
        if (peek(0) == '.' && isDigit(peek(1))) {
            advance();
            while (offset < text.length() && (isDigit(peek(0)) || peek(0) == '_')) {
                advance();
            }
        }
        if ((peek(0) == 'e' || peek(0) == 'E')
                && (isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
            advance();
            advance();
            while (offset < text.length() && isDigit(peek(0))) {
                advance();
            }
        }
        if (peek(0) == '\'' && (isBaseChar(peek(1)) || ((peek(1) == 's' || peek(1) == 'S') && isBaseChar(peek(2))))) {
            readBasedValue();
        }
    }

    private void readBasedValue() {
        // '
        advance();
        if (peek(0) == 's' || peek(0) == 'S') {
            advance();
        }
        // base
        advance();
        while (offset < text.length() && isBasedDigit(peek(0))) {
            advance();
        }
    }

    private void readString(int startLine, int startColumn) {
        advance();
        while (true) {
            if (offset >= text.length() || peek(0) == '\n') {
                throw error(startLine, startColumn, "Unterminated string literal");
            }
            char c = advance();
            if (c == '\\' && offset < text.length()) {
                advance();
            } else if (c == '"') {
                return;
            }
        }
    }

    private String matchOperator() {
        for (String op : OPERATORS) {
            if (text.startsWith(op, offset)) {
                return op;
            }
        }
        return null;
    }
}
