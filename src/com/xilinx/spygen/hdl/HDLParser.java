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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.spygen.util.FileTools;
import com.xilinx.spygen.util.MessageGenerator;

/**
 * Structural parser for Verilog/SystemVerilog source files. It does not
 * elaborate anything: it extracts module headers, parameters, ports, internal
 * declarations and instantiations, and skips everything else. Shapes that are
 * recognized but malformed are reported as {@link HDLParseException}s.
 */
public class HDLParser {

    public static final String MODULE = "module";
    public static final String MACROMODULE = "macromodule";
    public static final String ENDMODULE = "endmodule";
    public static final String PARAMETER = "parameter";
    public static final String LOCALPARAM = "localparam";
    public static final String IMPORT = "import";
    public static final String EXTERN = "extern";
    public static final String BEGIN = "begin";
    public static final String END = "end";
    public static final String FORK = "fork";
    public static final String GENERATE = "generate";
    public static final String ENDGENERATE = "endgenerate";
    public static final String ENDCASE = "endcase";
    public static final String ELSE = "else";
    public static final String FOR = "for";

    /** Design units skipped wholesale outside of modules, with their closing keyword */
    private static final Map<String, String> SKIPPED_DESIGN_UNITS = new HashMap<>();

    /** Skipped design units that modules can instantiate */
    private static final Set<String> INSTANTIABLE_UNITS = new HashSet<>(Arrays.asList(
            "interface", "program", "checker", "primitive"));

    /** Constructs skipped wholesale inside a module body, with their closing keyword */
    private static final Map<String, String> SKIPPED_BODY_BLOCKS = new HashMap<>();

    static {
        SKIPPED_DESIGN_UNITS.put("package", "endpackage");
        SKIPPED_DESIGN_UNITS.put("interface", "endinterface");
        SKIPPED_DESIGN_UNITS.put("program", "endprogram");
        SKIPPED_DESIGN_UNITS.put("class", "endclass");
        SKIPPED_DESIGN_UNITS.put("checker", "endchecker");
        SKIPPED_DESIGN_UNITS.put("config", "endconfig");
        SKIPPED_DESIGN_UNITS.put("primitive", "endprimitive");

        SKIPPED_BODY_BLOCKS.put("function", "endfunction");
        SKIPPED_BODY_BLOCKS.put("task", "endtask");
        SKIPPED_BODY_BLOCKS.put("covergroup", "endgroup");
        SKIPPED_BODY_BLOCKS.put("property", "endproperty");
        SKIPPED_BODY_BLOCKS.put("sequence", "endsequence");
        SKIPPED_BODY_BLOCKS.put("clocking", "endclocking");
        SKIPPED_BODY_BLOCKS.put("class", "endclass");
        SKIPPED_BODY_BLOCKS.put("specify", "endspecify");
        SKIPPED_BODY_BLOCKS.put("checker", "endchecker");
    }

    /** Keywords that start a net or variable declaration */
    public static final Set<String> DATA_TYPE_KEYWORDS = new HashSet<>(Arrays.asList(
            "logic", "wire", "reg", "bit", "byte", "shortint", "int", "longint", "integer",
            "time", "real", "realtime", "shortreal", "string", "chandle", "event", "tri",
            "tri0", "tri1", "triand", "trior", "trireg", "wand", "wor", "uwire", "supply0",
            "supply1", "enum", "struct", "union", "interconnect"));

    /** Qualifiers that may precede the type of a declaration */
    public static final Set<String> DECLARATION_QUALIFIERS = new HashSet<>(Arrays.asList(
            "var", "const", "static", "automatic"));

    /** Qualifiers that may precede function and task declarations */
    private static final Set<String> SUBROUTINE_QUALIFIERS = new HashSet<>(Arrays.asList(
            "static", "automatic", "virtual", "protected", "local"));

    private static final Set<String> PROCEDURAL_KEYWORDS = new HashSet<>(Arrays.asList(
            "always", "always_ff", "always_comb", "always_latch", "initial", "final", "forever"));

    private static final Set<String> CONDITIONAL_KEYWORDS = new HashSet<>(Arrays.asList(
            "if", "for", "foreach", "while", "repeat"));

    private static final Set<String> CASE_QUALIFIERS = new HashSet<>(Arrays.asList(
            "unique", "unique0", "priority"));

    private static final Set<String> BLOCK_ENDS = new HashSet<>(Arrays.asList(
            END, "join", "join_any", "join_none"));

    /** Reserved words of IEEE 1800, never the name of a module or a signal */
    public static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "accept_on", "alias", "always", "always_comb", "always_ff", "always_latch", "and",
            "assert", "assign", "assume", "automatic", "before", "begin", "bind", "bins",
            "binsof", "bit", "break", "buf", "bufif0", "bufif1", "byte", "case", "casex",
            "casez", "cell", "chandle", "checker", "class", "clocking", "cmos", "config",
            "const", "constraint", "context", "continue", "cover", "covergroup", "coverpoint",
            "cross", "deassign", "default", "defparam", "design", "disable", "dist", "do",
            "edge", "else", "end", "endcase", "endchecker", "endclass", "endclocking",
            "endconfig", "endfunction", "endgenerate", "endgroup", "endinterface", "endmodule",
            "endpackage", "endprimitive", "endprogram", "endproperty", "endspecify",
            "endsequence", "endtable", "endtask", "enum", "event", "eventually", "expect",
            "export", "extends", "extern", "final", "first_match", "for", "force", "foreach",
            "forever", "fork", "forkjoin", "function", "generate", "genvar", "global",
            "highz0", "highz1", "if", "iff", "ifnone", "ignore_bins", "illegal_bins",
            "implements", "implies", "import", "incdir", "include", "initial", "inout",
            "input", "inside", "instance", "int", "integer", "interconnect", "interface",
            "intersect", "join", "join_any", "join_none", "large", "let", "liblist",
            "library", "local", "localparam", "logic", "longint", "macromodule", "matches",
            "medium", "modport", "module", "nand", "negedge", "nettype", "new", "nexttime",
            "nmos", "nor", "noshowcancelled", "not", "notif0", "notif1", "null", "or",
            "output", "package", "packed", "parameter", "pmos", "posedge", "primitive",
            "priority", "program", "property", "protected", "pull0", "pull1", "pulldown",
            "pullup", "pulsestyle_ondetect", "pulsestyle_onevent", "pure", "rand", "randc",
            "randcase", "randsequence", "rcmos", "real", "realtime", "ref", "reg",
            "reject_on", "release", "repeat", "restrict", "return", "rnmos", "rpmos",
            "rtran", "rtranif0", "rtranif1", "s_always", "s_eventually", "s_nexttime",
            "s_until", "s_until_with", "scalared", "sequence", "shortint", "shortreal",
            "showcancelled", "signed", "small", "soft", "solve", "specify", "specparam",
            "static", "string", "strong", "strong0", "strong1", "struct", "super", "supply0",
            "supply1", "sync_accept_on", "sync_reject_on", "table", "tagged", "task", "this",
            "throughout", "time", "timeprecision", "timeunit", "tran", "tranif0", "tranif1",
            "tri", "tri0", "tri1", "triand", "trior", "trireg", "type", "typedef", "union",
            "unique", "unique0", "unsigned", "until", "until_with", "untyped", "use",
            "uwire", "var", "vectored", "virtual", "void", "wait", "wait_order", "wand",
            "weak", "weak0", "weak1", "while", "wildcard", "wire", "with", "within", "wor",
            "xnor", "xor"));

    private final String fileName;

    private final List<HDLToken> tokens;

    /** For each opening bracket, the index of its closing bracket */
    private int[] matching;

    private int pos = 0;

    private ModuleBuilder current;

    /** Names of the skipped instantiable units to their keyword */
    private final Map<String, String> otherUnits = new LinkedHashMap<>();

    public HDLParser(String fileName, String text) {
        this.fileName = fileName;
        this.tokens = HDLTokenizer.tokenize(fileName, text);
    }

    public HDLParser(Path file) {
        this(HDLParseException.fileNameOf(file), FileTools.readTextFile(file));
    }

    /**
     * Convenience method to parse the modules of one source text.
     * @param fileName Name of the source, used in error messages and module locations
     * @param text Source text
     * @return The modules in the order they appear in the text.
     */
    public static List<HDLModule> parse(String fileName, String text) {
        return new HDLParser(fileName, text).parseModules();
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return The interfaces, programs, checkers and primitives found by
     * {@link #parseModules()}, name to keyword, in source order.
     */
    public Map<String, String> getOtherDesignUnits() {
        return otherUnits;
    }

    /**
     * Parses all modules of the source.
     * @return The modules in the order they appear in the source.
     * @throws HDLParseException on the first error found.
     */
    public List<HDLModule> parseModules() {
        matchBrackets();
        List<HDLModule> modules = new ArrayList<>();
        pos = 0;
        while (pos < tokens.size()) {
            HDLToken t = tokens.get(pos);
            if (!t.isIdentifier()) {
                pos++;
            } else if (t.is(MODULE) || t.is(MACROMODULE)) {
                modules.add(parseModule());
            } else if (t.is(ENDMODULE)) {
                throw error(t, "endmodule without a matching module");
            } else if (t.is(EXTERN) || t.is(IMPORT)) {
                skipPastSemicolon();
            } else if (SKIPPED_DESIGN_UNITS.containsKey(t.text)) {
                skipDesignUnit(t);
            } else {
                pos++;
            }
        }
        return modules;
    }

    private HDLParseException error(HDLToken t, String message) {
        return new HDLParseException(t, fileName, current == null ? null : current.name, message);
    }

    private HDLParseException errorAtEnd(String message) {
        if (tokens.isEmpty()) {
            return new HDLParseException(fileName, 0, 0, current == null ? null : current.name, message);
        }
        return error(tokens.get(tokens.size()-1), message);
    }

    private HDLToken next() {
        if (pos >= tokens.size()) {
            throw errorAtEnd("Unexpected end of file");
        }
        return tokens.get(pos++);
    }

    private boolean peekSymbol(String s) {
        return pos < tokens.size() && tokens.get(pos).isSymbol(s);
    }

    private boolean peekIdentifier(String s) {
        return pos < tokens.size() && tokens.get(pos).isIdentifier() && tokens.get(pos).is(s);
    }

    private void expectSymbol(String s, String message) {
        HDLToken t = next();
        if (!t.isSymbol(s)) {
            throw error(t, message + ", found '" + t.text + "'");
        }
    }

    /**
     * Checks that (), [] and {} are balanced in the whole file and records the
     * closing index of every opening bracket.
     */
    private void matchBrackets() {
        matching = new int[tokens.size()];
        Deque<Integer> open = new ArrayDeque<>();
        String module = null;
        for (int i = 0; i < tokens.size(); i++) {
            HDLToken t = tokens.get(i);
            if (t.isIdentifier() && (t.is(MODULE) || t.is(MACROMODULE)) && i+1 < tokens.size()) {
                module = tokens.get(i+1).text;
            } else if (t.isIdentifier() && t.is(ENDMODULE)) {
                module = null;
            } else if (t.isOpenBracket()) {
                open.push(i);
            } else if (t.isCloseBracket()) {
                if (open.isEmpty()) {
                    throw new HDLParseException(t, fileName, module, "Unmatched '" + t.text + "'");
                }
                HDLToken opener = tokens.get(open.peek());
                if (!opener.getClosingBracket().equals(t.text)) {
                    throw new HDLParseException(t, fileName, module, "Expected '" + opener.getClosingBracket()
                            + "' to close '" + opener.text + "' from line " + opener.line + ", found '" + t.text + "'");
                }
                matching[open.pop()] = i;
            }
        }
        if (!open.isEmpty()) {
            HDLToken opener = tokens.get(open.peek());
            throw new HDLParseException(opener, fileName, module, "Unbalanced '" + opener.text
                    + "', missing '" + opener.getClosingBracket() + "' before end of file");
        }
    }

    private void skipPastSemicolon() {
        while (pos < tokens.size()) {
            HDLToken t = tokens.get(pos);
            if (t.isOpenBracket()) {
                pos = matching[pos] + 1;
                continue;
            }
            pos++;
            if (t.isSymbol(";")) {
                return;
            }
        }
    }

    private void skipDesignUnit(HDLToken start) {
        String endKeyword = SKIPPED_DESIGN_UNITS.get(start.text);
        pos++;
        if (start.is("interface") && peekIdentifier("class")) {
            endKeyword = "endclass";
        } else if (INSTANTIABLE_UNITS.contains(start.text)) {
            if (peekIdentifier("automatic") || peekIdentifier("static")) {
                pos++;
            }
            if (pos < tokens.size() && isName(tokens.get(pos))) {
                otherUnits.putIfAbsent(tokens.get(pos).text, start.text);
            }
        }
        skipToKeyword(start, endKeyword);
    }

    private void skipToKeyword(HDLToken start, String endKeyword) {
        while (pos < tokens.size()) {
            HDLToken t = tokens.get(pos++);
            if (t.isIdentifier() && t.is(endKeyword)) {
                skipLabel();
                return;
            }
        }
        throw error(start, "Missing " + endKeyword + " for " + start.text);
    }

    /** Skips an optional ": label" after an end keyword */
    private String skipLabel() {
        if (pos+1 < tokens.size() && tokens.get(pos).isSymbol(":") && tokens.get(pos+1).isIdentifier()) {
            String label = tokens.get(pos+1).text;
            pos += 2;
            return label;
        }
        return null;
    }

    private static boolean isName(HDLToken t) {
        return t.isIdentifier() && !KEYWORDS.contains(t.text);
    }

    private HDLModule parseModule() {
        HDLToken moduleToken = next();
        if (peekIdentifier("static") || peekIdentifier("automatic")) {
            pos++;
        }
        HDLToken nameToken = next();
        if (!isName(nameToken)) {
            throw error(nameToken, "Expected a module name after '" + moduleToken.text + "'");
        }
        current = new ModuleBuilder(nameToken.text, moduleToken);
        while (peekIdentifier(IMPORT)) {
            skipPastSemicolon();
        }
        if (peekSymbol("#")) {
            pos++;
            if (!peekSymbol("(")) {
                throw error(next(), "Expected '(' after '#' in header of module " + current.name);
            }
            int close = matching[pos];
            parseParameterItems(tokens.subList(pos+1, close), tokens.get(pos), true);
            pos = close + 1;
        }
        if (peekSymbol("(")) {
            int close = matching[pos];
            parsePortList(tokens.subList(pos+1, close), tokens.get(pos));
            pos = close + 1;
        }
        expectSymbol(";", "Expected ';' after header of module " + current.name);
        HDLToken endToken = parseBody();
        HDLModule module = current.build(endToken);
        current = null;
        return module;
    }

    //------------------------------------------------------------------------------------------
    // Token list helpers. All lists handed to these are sublists with balanced brackets.
    //------------------------------------------------------------------------------------------

    /**
     * Rebuilds the source text of a token list, with a single space wherever the
     * source had whitespace or a comment.
     */
    public static String join(List<HDLToken> list) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (HDLToken t : list) {
            if (!first && t.spaceBefore) {
                sb.append(' ');
            }
            sb.append(t.text);
            first = false;
        }
        return sb.toString();
    }

    private static int closeIndex(List<HDLToken> list, int openIdx) {
        int depth = 0;
        for (int i = openIdx; i < list.size(); i++) {
            HDLToken t = list.get(i);
            if (t.isOpenBracket()) {
                depth++;
            } else if (t.isCloseBracket() && --depth == 0) {
                return i;
            }
        }
        throw new IllegalStateException("Unbalanced token list");
    }

    private static int openIndex(List<HDLToken> list, int closeIdx) {
        int depth = 0;
        for (int i = closeIdx; i >= 0; i--) {
            HDLToken t = list.get(i);
            if (t.isCloseBracket()) {
                depth++;
            } else if (t.isOpenBracket() && --depth == 0) {
                return i;
            }
        }
        throw new IllegalStateException("Unbalanced token list");
    }

    private static int indexOfTopLevel(List<HDLToken> list, String symbol) {
        int depth = 0;
        for (int i = 0; i < list.size(); i++) {
            HDLToken t = list.get(i);
            if (t.isOpenBracket()) {
                depth++;
            } else if (t.isCloseBracket()) {
                depth--;
            } else if (depth == 0 && t.isSymbol(symbol)) {
                return i;
            }
        }
        return -1;
    }

    private static int lastTopLevelName(List<HDLToken> list) {
        int depth = 0;
        int found = -1;
        for (int i = 0; i < list.size(); i++) {
            HDLToken t = list.get(i);
            if (t.isOpenBracket()) {
                depth++;
            } else if (t.isCloseBracket()) {
                depth--;
            } else if (depth == 0 && isName(t)) {
                found = i;
            }
        }
        return found;
    }

    /**
     * Splits a token list on commas at bracket depth 0.
     * @param anchor Token reported if the list contains an empty item
     * @return The items, or an empty list if list is empty.
     */
    private List<List<HDLToken>> split(List<HDLToken> list, HDLToken anchor) {
        List<List<HDLToken>> items = new ArrayList<>();
        if (list.isEmpty()) {
            return items;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= list.size(); i++) {
            HDLToken t = i < list.size() ? list.get(i) : null;
            if (t != null && t.isOpenBracket()) {
                depth++;
            } else if (t != null && t.isCloseBracket()) {
                depth--;
            } else if (t == null || (depth == 0 && t.isSymbol(","))) {
                if (i == start) {
                    throw error(t != null ? t : (i > 0 ? list.get(i-1) : anchor), "Empty item in list");
                }
                items.add(list.subList(start, i));
                start = i + 1;
            }
        }
        return items;
    }

    private static int skipBracketGroups(List<HDLToken> list, int i, String open) {
        while (i < list.size() && list.get(i).isSymbol(open)) {
            i = closeIndex(list, i) + 1;
        }
        return i;
    }

    /** Result of parsing "type [packed] name [unpacked] [= value]" */
    private static class Declarator {
        HDLToken nameToken;
        String type;
        String width;
        String arrayDims;
    }

    private Declarator parseDeclarator(List<HDLToken> item, HDLToken anchor) {
        int eq = indexOfTopLevel(item, "=");
        List<HDLToken> lhs = eq < 0 ? item : item.subList(0, eq);
        int nameIdx = lastTopLevelName(lhs);
        if (nameIdx < 0) {
            throw error(item.isEmpty() ? anchor : item.get(0), "Declaration without a name");
        }
        if (eq >= 0 && eq == item.size()-1) {
            throw error(item.get(eq), "Missing value after '=' in declaration of " + lhs.get(nameIdx).text);
        }
        int end = skipBracketGroups(lhs, nameIdx+1, "[");
        if (end != lhs.size()) {
            throw error(lhs.get(end), "Unexpected '" + lhs.get(end).text + "' after name "
                    + lhs.get(nameIdx).text);
        }
        int widthStart = nameIdx;
        while (widthStart > 0 && lhs.get(widthStart-1).isSymbol("]")) {
            widthStart = openIndex(lhs, widthStart-1);
        }
        Declarator d = new Declarator();
        d.nameToken = lhs.get(nameIdx);
        d.type = join(lhs.subList(0, widthStart));
        d.width = join(lhs.subList(widthStart, nameIdx));
        d.arrayDims = join(lhs.subList(nameIdx+1, lhs.size()));
        return d;
    }

    //------------------------------------------------------------------------------------------
    // Module header
    //------------------------------------------------------------------------------------------

    private void parseParameterItems(List<HDLToken> list, HDLToken anchor, boolean header) {
        String type = "";
        boolean local = false;
        for (List<HDLToken> item : split(list, anchor)) {
            HDLToken first = item.get(0);
            int i = 0;
            if (first.isIdentifier() && (first.is(PARAMETER) || first.is(LOCALPARAM))) {
                local = first.is(LOCALPARAM);
                type = "";
                i = 1;
            }
            List<HDLToken> decl = item.subList(i, item.size());
            int eq = indexOfTopLevel(decl, "=");
            List<HDLToken> lhs = eq < 0 ? decl : decl.subList(0, eq);
            int nameIdx = lastTopLevelName(lhs);
            if (nameIdx < 0) {
                throw error(first, "Malformed parameter declaration");
            }
            if (nameIdx > 0) {
                type = join(lhs.subList(0, nameIdx));
            }
            String value = eq < 0 ? "" : join(decl.subList(eq+1, decl.size()));
            if (!local) {
                current.addParameter(new HDLParameter(lhs.get(nameIdx).text, type, value, header));
            }
        }
    }

    private void parsePortList(List<HDLToken> list, HDLToken anchor) {
        HDLDirection direction = null;
        String type = "";
        String width = "";
        for (List<HDLToken> item : split(list, anchor)) {
            HDLToken first = item.get(0);
            if (first.isSymbol(".")) {
                MessageGenerator.warning("Skipping explicit port expression at " + fileName + ":"
                        + first.line + " in module " + current.name);
                continue;
            }
            if (first.isIdentifier() && first.is("ref")) {
                MessageGenerator.warning("Skipping ref port at " + fileName + ":" + first.line
                        + " in module " + current.name);
                direction = null;
                continue;
            }
            if (isInterfacePort(item, direction)) {
                MessageGenerator.warning("Skipping interface port " + item.get(item.size()-1).text
                        + " of module " + current.name);
                continue;
            }
            HDLDirection d = first.isIdentifier() ? HDLDirection.getEnum(first.text) : null;
            List<HDLToken> rest = d == null ? item : item.subList(1, item.size());
            Declarator decl = parseDeclarator(rest, first);
            if (d == null && direction == null) {
                if (decl.type.isEmpty() && decl.width.isEmpty()) {
                    current.addHeaderPortName(decl.nameToken);
                    continue;
                }
                // first port without direction but with a type defaults to inout
                d = HDLDirection.INOUT;
            }
            if (d != null) {
                direction = d;
                type = decl.type;
                width = decl.width;
            } else if (!decl.type.isEmpty() || !decl.width.isEmpty()) {
                type = decl.type;
                width = decl.width;
            }
            current.addAnsiPort(decl.nameToken, direction, type, width, decl.arrayDims);
        }
    }

    private static boolean isInterfacePort(List<HDLToken> item, HDLDirection previousDirection) {
        HDLToken first = item.get(0);
        if (first.isIdentifier() && first.is("interface")) {
            return true;
        }
        if (!isName(first) || item.size() < 2) {
            return false;
        }
        HDLToken second = item.get(1);
        if (second.isSymbol(".") && item.size() >= 3 && isName(item.get(2))) {
            // bus_if.mp bus
            return true;
        }
        // bus_if bus, only when no direction has been seen yet
        return previousDirection == null && isName(second);
    }

    //------------------------------------------------------------------------------------------
    // Module body
    //------------------------------------------------------------------------------------------

    /** A begin/end or fork/join block in a module body */
    private static class Block {
        final HDLToken start;
        final String label;
        final boolean procedural;
        final boolean loop;

        Block(HDLToken start, String label, boolean procedural, boolean loop) {
            this.start = start;
            this.label = label;
            this.procedural = procedural;
            this.loop = loop;
        }
    }

    /**
     * Groups the module body into statements and processes them.
     * @return The endmodule token.
     */
    private HDLToken parseBody() {
        List<HDLToken> stmt = new ArrayList<>();
        Deque<Block> blocks = new ArrayDeque<>();
        while (true) {
            if (pos >= tokens.size()) {
                throw error(current.moduleToken, "Module " + current.name + " has no matching endmodule");
            }
            HDLToken t = tokens.get(pos);
            if (t.isOpenBracket()) {
                int close = matching[pos];
                stmt.addAll(tokens.subList(pos, close+1));
                pos = close + 1;
                continue;
            }
            if (t.isSymbol(";")) {
                processStatement(stmt, blocks);
                stmt.clear();
                pos++;
                continue;
            }
            if (t.kind == HDLToken.Kind.MACRO && stmt.isEmpty()) {
                // macro used as a statement, possibly without a trailing ';'
                pos++;
                if (peekSymbol("(")) {
                    pos = matching[pos] + 1;
                }
                continue;
            }
            if (t.isIdentifier()) {
                if (t.is(ENDMODULE)) {
                    if (!stmt.isEmpty()) {
                        throw error(stmt.get(0), "Expected ';' before endmodule");
                    }
                    if (!blocks.isEmpty()) {
                        throw error(blocks.peek().start, "Missing 'end' for '" + blocks.peek().start.text + "'");
                    }
                    pos++;
                    String label = skipLabel();
                    if (label != null && !label.equals(current.name)) {
                        throw error(tokens.get(pos-1), "endmodule label " + label + " does not match module "
                                + current.name);
                    }
                    return t;
                }
                if (t.is(BEGIN) || t.is(FORK)) {
                    boolean procedural = t.is(FORK) || isInProcedural(blocks) || startsProcedure(stmt);
                    boolean loop = !procedural && containsIdentifier(stmt, FOR);
                    String label = stmt.size() >= 2 && isName(stmt.get(0)) && stmt.get(1).isSymbol(":")
                            ? stmt.get(0).text : null;
                    processStatement(stmt, blocks);
                    stmt.clear();
                    pos++;
                    String blockLabel = skipLabel();
                    blocks.push(new Block(t, blockLabel != null ? blockLabel : label, procedural, loop));
                    continue;
                }
                if (BLOCK_ENDS.contains(t.text)) {
                    processStatement(stmt, blocks);
                    stmt.clear();
                    if (blocks.isEmpty()) {
                        throw error(t, "'" + t.text + "' without a matching block start");
                    }
                    blocks.pop();
                    pos++;
                    skipLabel();
                    continue;
                }
                if (t.is(GENERATE) || t.is(ENDGENERATE) || t.is(ENDCASE)) {
                    processStatement(stmt, blocks);
                    stmt.clear();
                    pos++;
                    continue;
                }
                if (SKIPPED_BODY_BLOCKS.containsKey(t.text) && onlySubroutineQualifiers(stmt)) {
                    stmt.clear();
                    pos++;
                    skipToKeyword(t, SKIPPED_BODY_BLOCKS.get(t.text));
                    continue;
                }
                if (stmt.isEmpty() && SKIPPED_BODY_BLOCKS.containsValue(t.text)) {
                    // end of a construct that had no body, e.g. default clocking
                    pos++;
                    skipLabel();
                    continue;
                }
                if (t.is(MODULE) || t.is(MACROMODULE)) {
                    throw error(t, "Nested module declarations are not supported");
                }
            }
            stmt.add(t);
            pos++;
        }
    }

    private static boolean onlySubroutineQualifiers(List<HDLToken> stmt) {
        for (HDLToken t : stmt) {
            if (!t.isIdentifier() || !SUBROUTINE_QUALIFIERS.contains(t.text)) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsIdentifier(List<HDLToken> stmt, String s) {
        for (HDLToken t : stmt) {
            if (t.isIdentifier() && t.is(s)) return true;
        }
        return false;
    }

    private static boolean startsProcedure(List<HDLToken> stmt) {
        for (HDLToken t : stmt) {
            if (t.isIdentifier() && PROCEDURAL_KEYWORDS.contains(t.text)) return true;
        }
        return false;
    }

    private static boolean isInProcedural(Deque<Block> blocks) {
        return !blocks.isEmpty() && blocks.peek().procedural;
    }

    /**
     * Generate blocks that can only be named after elaboration: loop iterations and
     * blocks without a label.
     */
    private static boolean isInHiddenScope(Deque<Block> blocks) {
        for (Block b : blocks) {
            if (!b.procedural && (b.loop || b.label == null)) return true;
        }
        return false;
    }

    private static String getScope(Deque<Block> blocks) {
        StringBuilder sb = new StringBuilder();
        Iterator<Block> it = blocks.descendingIterator();
        while (it.hasNext()) {
            Block b = it.next();
            if (b.procedural || b.label == null) continue;
            if (sb.length() > 0) sb.append('.');
            sb.append(b.label);
        }
        return sb.toString();
    }

    private void processStatement(List<HDLToken> stmt, Deque<Block> blocks) {
        if (stmt.isEmpty()) {
            return;
        }
        boolean procedural = isInProcedural(blocks);
        boolean hidden = isInHiddenScope(blocks);
        int i = 0;
        while (i < stmt.size()) {
            HDLToken t = stmt.get(i);
            HDLToken n = i+1 < stmt.size() ? stmt.get(i+1) : null;
            if (isName(t) && n != null && n.isSymbol(":")) {
                // statement label
                i += 2;
            } else if (t.isIdentifier() && t.is(ELSE)) {
                hidden |= !procedural;
                i++;
            } else if (t.isIdentifier() && CASE_QUALIFIERS.contains(t.text)) {
                i++;
            } else if (t.isIdentifier() && CONDITIONAL_KEYWORDS.contains(t.text) && n != null && n.isSymbol("(")) {
                hidden |= !procedural;
                i = closeIndex(stmt, i+1) + 1;
            } else if (t.isIdentifier() && PROCEDURAL_KEYWORDS.contains(t.text)) {
                procedural = true;
                i++;
            } else if ((t.isSymbol("@") || t.isSymbol("#")) && n != null) {
                i = n.isOpenBracket() ? closeIndex(stmt, i+1) + 1 : i + 2;
            } else {
                break;
            }
        }
        if (procedural || i >= stmt.size()) {
            return;
        }
        List<HDLToken> rest = stmt.subList(i, stmt.size());
        HDLToken first = rest.get(0);
        if (!first.isIdentifier()) {
            return;
        }
        HDLDirection direction = HDLDirection.getEnum(first.text);
        if (direction != null) {
            parseDirectionDeclaration(rest, direction);
        } else if (first.is(PARAMETER)) {
            parseParameterItems(rest, first, false);
        } else if (DATA_TYPE_KEYWORDS.contains(first.text) || DECLARATION_QUALIFIERS.contains(first.text)) {
            parseSignalDeclaration(rest, getScope(blocks), !hidden);
        } else if (KEYWORDS.contains(first.text)) {
            return;
        } else if (isUserTypeDeclaration(rest)) {
            parseSignalDeclaration(rest, getScope(blocks), !hidden);
        } else if (isInstantiation(rest)) {
            parseInstances(rest, getScope(blocks), !hidden);
        }
    }

    /** my_t name..., my_t [3:0] name..., pkg::my_t name... */
    private static boolean isUserTypeDeclaration(List<HDLToken> rest) {
        int i = 1;
        if (rest.size() > 2 && rest.get(1).isSymbol("::") && isName(rest.get(2))) {
            i = 3;
        }
        int afterDims = skipBracketGroups(rest, i, "[");
        if (afterDims >= rest.size() || !isName(rest.get(afterDims))) {
            return false;
        }
        if (i == 1 && afterDims == 1) {
            // type name ( ... ) is an instantiation
            int afterName = skipBracketGroups(rest, 2, "[");
            return afterName >= rest.size() || !rest.get(afterName).isSymbol("(");
        }
        return true;
    }

    /** type [#(...)] name [dims] (...) */
    private static boolean isInstantiation(List<HDLToken> rest) {
        if (rest.size() < 2) {
            return false;
        }
        return rest.get(1).isSymbol("#") || isName(rest.get(1));
    }

    private void parseDirectionDeclaration(List<HDLToken> rest, HDLDirection direction) {
        HDLToken keyword = rest.get(0);
        List<HDLToken> decl = rest.subList(1, rest.size());
        if (decl.isEmpty()) {
            throw error(keyword, "'" + keyword.text + "' declaration without a port name");
        }
        String type = null;
        String width = null;
        for (List<HDLToken> item : split(decl, keyword)) {
            Declarator d = parseDeclarator(item, keyword);
            if (type == null || !d.type.isEmpty() || !d.width.isEmpty()) {
                type = d.type;
                width = d.width;
            }
            current.completePort(d.nameToken, direction, type, width, d.arrayDims);
        }
    }

    private void parseSignalDeclaration(List<HDLToken> rest, String scope, boolean observable) {
        HDLToken first = rest.get(0);
        String type = null;
        String width = null;
        for (List<HDLToken> item : split(rest, first)) {
            Declarator d = parseDeclarator(item, first);
            if (type == null || !d.type.isEmpty() || !d.width.isEmpty()) {
                type = d.type;
                width = d.width;
            }
            current.addSignal(d.nameToken, type, width, d.arrayDims, scope, observable);
        }
    }

    private void parseInstances(List<HDLToken> rest, String scope, boolean observable) {
        HDLToken typeToken = rest.get(0);
        Map<String, String> overrides = new LinkedHashMap<>();
        int i = 1;
        if (rest.get(i).isSymbol("#")) {
            i++;
            if (i >= rest.size()) {
                throw error(rest.get(i-1), "Missing parameter overrides for instance of " + typeToken.text);
            }
            HDLToken t = rest.get(i);
            if (t.isSymbol("(")) {
                int close = closeIndex(rest, i);
                parseOverrides(rest.subList(i+1, close), t, overrides);
                i = close + 1;
            } else if (t.kind == HDLToken.Kind.NUMBER || t.kind == HDLToken.Kind.MACRO || isName(t)) {
                overrides.put("0", t.text);
                i++;
            } else {
                throw error(t, "Malformed parameter override for instance of " + typeToken.text);
            }
        }
        List<List<HDLToken>> items = split(rest.subList(i, rest.size()), typeToken);
        if (items.isEmpty()) {
            throw error(typeToken, "Instance of " + typeToken.text + " without an instance name");
        }
        for (List<HDLToken> item : items) {
            HDLToken nameToken = item.get(0);
            if (!isName(nameToken)) {
                throw error(nameToken, "Expected an instance name for module " + typeToken.text
                        + ", found '" + nameToken.text + "'");
            }
            int j = skipBracketGroups(item, 1, "[");
            if (j >= item.size() || !item.get(j).isSymbol("(")) {
                throw error(j < item.size() ? item.get(j) : nameToken, "Expected port connections for instance "
                        + nameToken.text + " of module " + typeToken.text);
            }
            int close = closeIndex(item, j);
            if (close != item.size()-1) {
                throw error(item.get(close+1), "Unexpected '" + item.get(close+1).text
                        + "' after port connections of instance " + nameToken.text);
            }
            String dims = join(item.subList(1, j));
            current.addInstance(new HDLInstance(nameToken.text, typeToken.text, overrides, dims, scope,
                    observable, nameToken.line));
        }
    }

    private void parseOverrides(List<HDLToken> list, HDLToken anchor, Map<String, String> overrides) {
        int position = 0;
        for (List<HDLToken> item : split(list, anchor)) {
            HDLToken first = item.get(0);
            if (first.isSymbol(".")) {
                if (item.size() < 2 || !item.get(1).isIdentifier()) {
                    throw error(first, "Expected a parameter name after '.'");
                }
                String name = item.get(1).text;
                String value = "";
                if (item.size() > 2) {
                    if (!item.get(2).isSymbol("(") || closeIndex(item, 2) != item.size()-1) {
                        throw error(item.get(2), "Malformed override of parameter " + name);
                    }
                    value = join(item.subList(3, item.size()-1));
                }
                overrides.put(name, value);
            } else {
                overrides.put(String.valueOf(position), join(item));
            }
            position++;
        }
    }

    //------------------------------------------------------------------------------------------
    // Module under construction
    //------------------------------------------------------------------------------------------

    /** Port as collected from the header and the body */
    private static class PortDecl {
        final HDLToken nameToken;
        final boolean ansi;
        HDLDirection direction;
        String type = "";
        String width = "";
        String arrayDims = "";

        PortDecl(HDLToken nameToken, boolean ansi) {
            this.nameToken = nameToken;
            this.ansi = ansi;
        }

        void merge(String type, String width, String arrayDims) {
            if (!type.isEmpty()) this.type = type;
            if (!width.isEmpty()) this.width = width;
            if (!arrayDims.isEmpty()) this.arrayDims = arrayDims;
        }
    }

    private class ModuleBuilder {
        final String name;
        final HDLToken moduleToken;
        final List<HDLParameter> parameters = new ArrayList<>();
        final Map<String, PortDecl> ports = new LinkedHashMap<>();
        final Map<String, HDLSignal> signals = new LinkedHashMap<>();
        final Map<String, HDLInstance> instances = new LinkedHashMap<>();
        final Set<String> scopedInstanceNames = new HashSet<>();

        ModuleBuilder(String name, HDLToken moduleToken) {
            this.name = name;
            this.moduleToken = moduleToken;
        }

        void addParameter(HDLParameter p) {
            parameters.add(p);
        }

        private PortDecl newPort(HDLToken nameToken, boolean ansi) {
            if (ports.containsKey(nameToken.text)) {
                throw error(nameToken, "Duplicate port " + nameToken.text + " in header of module " + name);
            }
            PortDecl p = new PortDecl(nameToken, ansi);
            ports.put(nameToken.text, p);
            return p;
        }

        void addHeaderPortName(HDLToken nameToken) {
            newPort(nameToken, false);
        }

        void addAnsiPort(HDLToken nameToken, HDLDirection direction, String type, String width, String arrayDims) {
            PortDecl p = newPort(nameToken, true);
            p.direction = direction;
            p.merge(type, width, arrayDims);
        }

        void completePort(HDLToken nameToken, HDLDirection direction, String type, String width, String arrayDims) {
            PortDecl p = ports.get(nameToken.text);
            if (p == null) {
                throw error(nameToken, "'" + nameToken.text + "' is declared " + direction.getKeyword()
                        + " but is not in the port list of module " + name);
            }
            if (p.ansi) {
                throw error(nameToken, "Port " + nameToken.text + " is already declared in the header of module "
                        + name);
            }
            if (p.direction != null) {
                throw error(nameToken, "Port " + nameToken.text + " has more than one direction declaration");
            }
            p.direction = direction;
            p.merge(type, width, arrayDims);
        }

        void addSignal(HDLToken nameToken, String type, String width, String arrayDims, String scope,
                       boolean observable) {
            PortDecl p = scope.isEmpty() ? ports.get(nameToken.text) : null;
            if (p != null) {
                if (p.ansi) {
                    throw error(nameToken, "Declaration of " + nameToken.text + " redeclares a port of module "
                            + name);
                }
                // output q; reg q;
                p.merge(type, width, arrayDims);
                return;
            }
            String key = scope.isEmpty() ? nameToken.text : scope + "." + nameToken.text;
            // same name in both branches of a generate if/else, keep the first
            signals.putIfAbsent(key, new HDLSignal(nameToken.text, type, width, arrayDims, scope, observable,
                    nameToken.line));
        }

        void addInstance(HDLInstance inst) {
            String key = inst.getScopedName() + " " + inst.getModuleTypeName();
            if (instances.containsKey(key)) {
                return;
            }
            // generate if/else branches reusing an instance name for another module type:
            // the type still counts as instantiated but only the first is named by that path
            if (scopedInstanceNames.add(inst.getScopedName()) || !inst.isObservable()) {
                instances.put(key, inst);
            } else {
                instances.put(key, new HDLInstance(inst.getName(), inst.getModuleTypeName(),
                        inst.getParameterOverrides(), inst.getArrayDims(), inst.getScope(), false, inst.getLine()));
            }
        }

        HDLModule build(HDLToken endToken) {
            List<HDLPort> portList = new ArrayList<>(ports.size());
            for (PortDecl p : ports.values()) {
                if (p.direction == null) {
                    throw error(endToken, "Port " + p.nameToken.text + " of module " + name
                            + " (line " + p.nameToken.line + ") has no direction declaration");
                }
                portList.add(new HDLPort(p.nameToken.text, p.direction, p.type, p.width, p.arrayDims));
            }
            return new HDLModule(name, fileName, moduleToken.line, parameters, portList,
                    new ArrayList<>(signals.values()), new ArrayList<>(instances.values()));
        }
    }
}
