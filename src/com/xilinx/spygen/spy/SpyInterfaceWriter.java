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
package com.xilinx.spygen.spy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.xilinx.spygen.hdl.HDLDeclaration;
import com.xilinx.spygen.hdl.HDLParameter;
import com.xilinx.spygen.hdl.HDLPort;
import com.xilinx.spygen.util.FileTools;

/**
 * Writes an {@link InterfaceModel} as SystemVerilog: the spy interface itself
 * and the bind statement attaching it to the top module. Declarations and
 * assignments are aligned in columns.
 */
public class SpyInterfaceWriter {

    public static final String DEFAULT_INTERFACE_SUFFIX = "_spy_if";

    public static final String DEFAULT_BIND_INSTANCE_NAME = "i_spy";

    private static final String INDENT = "    ";

    /** Qualifiers of the design that must not be copied to the interface declarations */
    private static final Set<String> DROPPED_QUALIFIERS = new HashSet<>(Arrays.asList(
            "const", "static", "automatic"));

    private final String interfaceName;

    private final String bindInstanceName;

    public SpyInterfaceWriter() {
        this(null, DEFAULT_BIND_INSTANCE_NAME);
    }

    /**
     * @param interfaceName Name of the interface, null for "&lt;top&gt;_spy_if"
     * @param bindInstanceName Instance name used in the bind statement, null for "i_spy"
     */
    public SpyInterfaceWriter(String interfaceName, String bindInstanceName) {
        this.interfaceName = interfaceName;
        this.bindInstanceName = bindInstanceName == null ? DEFAULT_BIND_INSTANCE_NAME : bindInstanceName;
    }

    public String getInterfaceName(InterfaceModel model) {
        return interfaceName != null ? interfaceName : model.getTopModuleName() + DEFAULT_INTERFACE_SUFFIX;
    }

    public String getBindInstanceName() {
        return bindInstanceName;
    }

    /**
     * Writes the interface.
     * @param model The interface model
     * @return The SystemVerilog text of the interface.
     */
    public String writeInterface(InterfaceModel model) {
        String name = getInterfaceName(model);
        StringBuilder sb = new StringBuilder();
        sb.append("// Spy interface of module ").append(model.getTopModuleName())
          .append(", generated by SpyGen. Do not edit.\n");
        sb.append("// Mode: ").append(model.getMode()).append(", ")
          .append(model.getEntries().size()).append(" spied signals\n\n");

        sb.append("interface ").append(name);
        writeParameters(sb, model.getTopParameters());
        writePorts(sb, model.getTopPorts());

        for (ModuleSection section : model.getSections()) {
            List<SpyEntry> declared = section.getDeclaredEntries();
            if (declared.isEmpty()) continue;
            Set<String> paths = new LinkedHashSet<>();
            for (SpyEntry e : declared) {
                paths.add(e.getPath().toString());
            }
            sb.append('\n').append(INDENT).append("// ").append(section.getModuleName())
              .append(": ").append(String.join(", ", paths)).append('\n');

            List<String[]> declarations = new ArrayList<>();
            for (SpyEntry e : declared) {
                HDLDeclaration d = e.getSource();
                declarations.add(new String[]{declarationType(d.getType()), d.getWidth(),
                        e.getOutputName() + d.getArrayDims() + ";"});
            }
            for (String line : alignColumns(declarations)) {
                sb.append(INDENT).append(line).append('\n');
            }
            sb.append('\n');
            List<String[]> assigns = new ArrayList<>();
            for (SpyAssignment a : section.getAssignments()) {
                assigns.add(new String[]{"assign", a.getTarget(), "= " + a.getSource() + ";"});
            }
            for (String line : alignColumns(assigns)) {
                sb.append(INDENT).append(line).append('\n');
            }
        }
        sb.append("\nendinterface : ").append(name).append('\n');
        return sb.toString();
    }

    private static void writeParameters(StringBuilder sb, List<HDLParameter> parameters) {
        if (parameters.isEmpty()) return;
        sb.append(" #(\n");
        for (int i = 0; i < parameters.size(); i++) {
            HDLParameter p = parameters.get(i);
            sb.append(INDENT).append("parameter ");
            if (!p.getType().isEmpty()) {
                sb.append(p.getType()).append(' ');
            }
            sb.append(p.getName());
            if (!p.getDefaultValue().isEmpty()) {
                sb.append(" = ").append(p.getDefaultValue());
            }
            sb.append(i < parameters.size()-1 ? ",\n" : "\n");
        }
        sb.append(")");
    }

    private static void writePorts(StringBuilder sb, List<HDLPort> ports) {
        if (ports.isEmpty()) {
            sb.append(" ();\n");
            return;
        }
        sb.append(" (\n");
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < ports.size(); i++) {
            HDLPort p = ports.get(i);
            // the interface only observes, every port is an input
            rows.add(new String[]{"input", p.getType(), p.getWidth(),
                    p.getName() + p.getArrayDims() + (i < ports.size()-1 ? "," : "")});
        }
        for (String line : alignColumns(rows)) {
            sb.append(INDENT).append(line).append('\n');
        }
        sb.append(");\n");
    }

    /**
     * Writes the bind statement attaching the interface to every instance of the
     * top module, passing its parameters through.
     * @param model The interface model
     * @return e.g. "bind top top_spy_if #(.WIDTH(WIDTH)) i_spy (.*);"
     */
    public String writeBindStatement(InterfaceModel model) {
        StringBuilder sb = new StringBuilder("bind ");
        sb.append(model.getTopModuleName()).append(' ').append(getInterfaceName(model));
        List<HDLParameter> parameters = model.getTopParameters();
        if (!parameters.isEmpty()) {
            sb.append(" #(");
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) sb.append(", ");
                String n = parameters.get(i).getName();
                sb.append('.').append(n).append('(').append(n).append(')');
            }
            sb.append(')');
        }
        sb.append(' ').append(bindInstanceName).append(" (.*);");
        return sb.toString();
    }

    /**
     * Writes the interface into a file.
     * @param model The interface model
     * @param fileName Name of the file to write
     */
    public void writeInterfaceFile(InterfaceModel model, String fileName) {
        FileTools.writeStringToTextFile(writeInterface(model), fileName);
    }

    static String declarationType(String type) {
        StringBuilder sb = new StringBuilder();
        for (String word : type.split(" ")) {
            if (word.isEmpty() || DROPPED_QUALIFIERS.contains(word)) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word);
        }
        return sb.length() == 0 ? "logic" : sb.toString();
    }

    /**
     * Pads every column but the last to the widest cell of that column. Columns that
     * are empty in every row are left out.
     * @param rows Rows of cells, all of the same length
     * @return One line per row, without trailing whitespace.
     */
    static List<String> alignColumns(List<String[]> rows) {
        List<String> lines = new ArrayList<>(rows.size());
        if (rows.isEmpty()) return lines;
        int columns = rows.get(0).length;
        int[] max = new int[columns];
        for (String[] row : rows) {
            for (int c = 0; c < columns; c++) {
                max[c] = Math.max(max[c], row[c].length());
            }
        }
        for (String[] row : rows) {
            StringBuilder sb = new StringBuilder();
            for (int c = 0; c < columns; c++) {
                if (max[c] == 0) continue;
                if (sb.length() > 0) sb.append(' ');
                sb.append(row[c]);
                if (c < columns-1) {
                    for (int i = row[c].length(); i < max[c]; i++) {
                        sb.append(' ');
                    }
                }
            }
            int end = sb.length();
            while (end > 0 && sb.charAt(end-1) == ' ') end--;
            sb.setLength(end);
            lines.add(sb.toString());
        }
        return lines;
    }
}
