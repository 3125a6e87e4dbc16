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

import java.util.Objects;

/**
 * A single lexical token of a Verilog/SystemVerilog source file.
 */
public class HDLToken {

    public enum Kind {
        /** Simple or escaped identifier, including keywords */
        IDENTIFIER,
        /** System task or function name such as $display */
        SYSTEM_IDENTIFIER,
        /** Macro usage such as `WIDTH */
        MACRO,
        NUMBER,
        STRING,
        /** Punctuation and operators, multi-character operators grouped */
        SYMBOL
    }

    public final Kind kind;
    public final String text;
    public final int line;
    public final int column;
    /** True if whitespace or a comment separated this token from the previous one */
    public final boolean spaceBefore;

    public HDLToken(Kind kind, String text, int line, int column, boolean spaceBefore) {
        this.kind = Objects.requireNonNull(kind);
        this.text = Objects.requireNonNull(text);
        this.line = line;
        this.column = column;
        this.spaceBefore = spaceBefore;
    }

    public boolean is(String s) {
        return text.equals(s);
    }

    public boolean isIdentifier() {
        return kind == Kind.IDENTIFIER;
    }

    public boolean isSymbol(String s) {
        return kind == Kind.SYMBOL && text.equals(s);
    }

    public boolean isOpenBracket() {
        return kind == Kind.SYMBOL && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isCloseBracket() {
        return kind == Kind.SYMBOL && (text.equals(")") || text.equals("]") || text.equals("}"));
    }

    /**
     * @return The closing bracket matching this opening bracket.
     */
    public String getClosingBracket() {
        switch (text) {
            case "(": return ")";
            case "[": return "]";
            case "{": return "}";
            default: throw new IllegalStateException(text + " is not an opening bracket");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HDLToken other = (HDLToken) o;
        return line == other.line && column == other.column && kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, line, column);
    }

    @Override
    public String toString() {
        String displayText = text;
        if (text.length()>120) {
            displayText = text.substring(0,100)+"[shortened, length is "+text.length()+"]";
        }
        return displayText + "@" + line + ":" + column;
    }
}
