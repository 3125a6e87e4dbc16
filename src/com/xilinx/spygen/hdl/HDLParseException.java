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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a source file cannot be turned into modules: unbalanced brackets,
 * a module without endmodule, or a declaration that has the shape of a
 * port/signal/instance but is malformed.
 */
public class HDLParseException extends HDLDesignException {

    private final String fileName;

    private final int line;

    private final int column;

    private final String moduleName;

    public HDLParseException(String fileName, int line, int column, String moduleName, String message) {
        super(format(fileName, line, column, moduleName, message));
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.moduleName = moduleName;
    }

    public HDLParseException(HDLToken token, String fileName, String moduleName, String message) {
        this(fileName, token.line, token.column, moduleName, message);
    }

    private static String format(String fileName, int line, int column, String moduleName, String message) {
        StringBuilder sb = new StringBuilder("ERROR: ");
        sb.append(fileName == null ? "<unknown>" : fileName);
        if (line > 0) {
            sb.append(':').append(line).append(':').append(column);
        }
        if (moduleName != null) {
            sb.append(" (in module ").append(moduleName).append(')');
        }
        sb.append(": ").append(message);
        return sb.toString();
    }

    static String fileNameOf(Path p) {
        return p == null ? null : p.toString();
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return Name of the module being parsed when the error was found, or null if
     * the error happened outside of any module.
     */
    public String getModuleName() {
        return moduleName;
    }

    @Override
    public List<String> getOffendingNames() {
        List<String> names = new ArrayList<>(2);
        if (fileName != null) names.add(fileName);
        if (moduleName != null) names.add(moduleName);
        return Collections.unmodifiableList(names);
    }
}
