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
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestHDLParser {

    private static HDLModule parseOne(String source) {
        List<HDLModule> modules = HDLParser.parse("test.sv", source);
        Assertions.assertEquals(1, modules.size());
        return modules.get(0);
    }

    private static HDLSignal findSignal(HDLModule m, String scopedName) {
        for (HDLSignal s : m.getSignals()) {
            if (s.getScopedName().equals(scopedName)) return s;
        }
        Assertions.fail("No signal " + scopedName + " in module " + m.getName());
        return null;
    }

    @Test
    public void testAnsiHeader() {
        HDLModule m = parseOne(
                "module fifo #(parameter int WIDTH = 8, DEPTH = 4) (\n"
              + "    input  logic             clk,\n"
              + "    input  logic [WIDTH-1:0] din,\n"
              + "    output logic [WIDTH-1:0] dout,\n"
              + "    output logic             full, empty\n"
              + ");\n"
              + "endmodule : fifo\n");
        Assertions.assertEquals("fifo", m.getName());
        Assertions.assertEquals("test.sv:1", m.getLocation());

        Assertions.assertEquals(2, m.getParameters().size());
        HDLParameter depth = m.getParameters().get(1);
        Assertions.assertEquals("DEPTH", depth.getName());
        Assertions.assertEquals("int", depth.getType());
        Assertions.assertEquals("4", depth.getDefaultValue());
        Assertions.assertTrue(depth.isHeaderParameter());

        Assertions.assertEquals(5, m.getPorts().size());
        HDLPort din = m.getPort("din");
        Assertions.assertEquals(HDLDirection.INPUT, din.getDirection());
        Assertions.assertEquals("logic", din.getType());
        Assertions.assertEquals("[WIDTH-1:0]", din.getWidth());
        HDLPort empty = m.getPort("empty");
        Assertions.assertTrue(empty.isOutput());
        Assertions.assertEquals("logic", empty.getType());
        Assertions.assertEquals("", empty.getWidth());
        Assertions.assertTrue(m.isLeaf());
    }

    @Test
    public void testNonAnsiPorts() {
        HDLModule m = parseOne(
                "module old (clk, d, q);\n"
              + "    input clk;\n"
              + "    input [7:0] d;\n"
              + "    output [7:0] q;\n"
              + "    reg [7:0] q;\n"
              + "    reg [7:0] shadow_s;\n"
              + "    always @(posedge clk) q <= d;\n"
              + "endmodule\n");
        Assertions.assertEquals(Arrays.asList("clk", "d", "q"),
                Arrays.asList(m.getPorts().get(0).getName(), m.getPorts().get(1).getName(),
                        m.getPorts().get(2).getName()));
        HDLPort q = m.getPort("q");
        Assertions.assertEquals(HDLDirection.OUTPUT, q.getDirection());
        Assertions.assertEquals("reg", q.getType());
        Assertions.assertEquals("[7:0]", q.getWidth());
        Assertions.assertEquals(1, m.getSignals().size());
        Assertions.assertEquals("[7:0]", m.getSignal("shadow_s").getWidth());
    }

    @Test
    public void testGenerateScopes() {
        HDLModule m = parseOne(
                "module gen #(parameter N = 2) (input logic clk);\n"
              + "    generate\n"
              + "        if (N > 1) begin : g_multi\n"
              + "            logic [N-1:0] acc_s;\n"
              + "            leaf i_leaf (.clk(clk));\n"
              + "        end else begin\n"
              + "            logic other_s;\n"
              + "        end\n"
              + "        for (genvar i = 0; i < N; i++) begin : g_loop\n"
              + "            logic loop_s;\n"
              + "        end\n"
              + "    endgenerate\n"
              + "    always_ff @(posedge clk) begin\n"
              + "        logic tmp_s;\n"
              + "    end\n"
              + "endmodule\n");
        Assertions.assertEquals(3, m.getSignals().size());

        HDLSignal acc = findSignal(m, "g_multi.acc_s");
        Assertions.assertTrue(acc.isObservable());
        Assertions.assertEquals("[N-1:0]", acc.getWidth());
        Assertions.assertEquals(4, acc.getLine());
        Assertions.assertFalse(findSignal(m, "other_s").isObservable());
        Assertions.assertFalse(findSignal(m, "g_loop.loop_s").isObservable());

        HDLInstance leaf = m.getInstance("i_leaf");
        Assertions.assertEquals("g_multi", leaf.getScope());
        Assertions.assertEquals("g_multi.i_leaf", leaf.getScopedName());
        Assertions.assertTrue(leaf.isObservable());
    }

    @Test
    public void testInstantiations() {
        HDLModule m = parseOne(
                "module top;\n"
              + "    fifo #(.WIDTH(16), .DEPTH()) i_fifo (.*);\n"
              + "    fifo #(32, 8) i_fifo2 (.clk(clk));\n"
              + "    leaf #8 i_leaf ();\n"
              + "    leaf i_arr [3:0] (.clk(clk));\n"
              + "    leaf i_a (), i_b ();\n"
              + "endmodule\n");
        Assertions.assertEquals(6, m.getInstances().size());

        Map<String, String> named = m.getInstance("i_fifo").getParameterOverrides();
        Assertions.assertEquals(Arrays.asList("WIDTH", "DEPTH"), Arrays.asList(named.keySet().toArray()));
        Assertions.assertEquals("16", named.get("WIDTH"));
        Assertions.assertEquals("", named.get("DEPTH"));

        Map<String, String> positional = m.getInstance("i_fifo2").getParameterOverrides();
        Assertions.assertEquals("32", positional.get("0"));
        Assertions.assertEquals("8", positional.get("1"));
        Assertions.assertEquals("8", m.getInstance("i_leaf").getParameterOverrides().get("0"));

        HDLInstance arr = m.getInstance("i_arr");
        Assertions.assertEquals("[3:0]", arr.getArrayDims());
        Assertions.assertFalse(arr.isObservable());
        Assertions.assertEquals("leaf", m.getInstance("i_b").getModuleTypeName());
    }

    @Test
    public void testBodyContentsThatAreNotSignals() {
        HDLModule m = parseOne(
                "module body;\n"
              + "    typedef enum logic [1:0] {IDLE, RUN} state_t;\n"
              + "    localparam int HIDDEN = 3;\n"
              + "    parameter DEPTH = 4;\n"
              + "    state_t state_s, next_s;\n"
              + "    pkg::cfg_t cfg_s;\n"
              + "    wire a = 1'b0, b;\n"
              + "    assign b = a;\n"
              + "    function automatic int twice(input int x);\n"
              + "        logic fn_s;\n"
              + "        return 2 * x;\n"
              + "    endfunction\n"
              + "    `ASSERT_KNOWN(a)\n"
              + "endmodule\n");
        Assertions.assertEquals(1, m.getParameters().size());
        Assertions.assertFalse(m.getParameters().get(0).isHeaderParameter());
        Assertions.assertEquals("state_t", m.getSignal("next_s").getType());
        Assertions.assertEquals("pkg::cfg_t", m.getSignal("cfg_s").getType());
        Assertions.assertEquals("wire", m.getSignal("b").getType());
        Assertions.assertNull(m.getSignal("fn_s"));
        Assertions.assertEquals(5, m.getSignals().size());
    }

    @Test
    public void testSkipsOtherDesignUnits() {
        List<HDLModule> modules = HDLParser.parse("test.sv",
                "`timescale 1ns/1ps\n"
              + "package p; typedef logic [3:0] nib_t; endpackage : p\n"
              + "interface bus_if; logic v; endinterface\n"
              + "import p::*;\n"
              + "module m (input logic a); endmodule\n"
              + "module n; m i_m (.a(1'b0)); endmodule\n");
        Assertions.assertEquals(2, modules.size());
        Assertions.assertEquals("n", modules.get(1).getName());
        Assertions.assertEquals(5, modules.get(0).getLine());
    }

    @Test
    public void testRecordsInstantiableDesignUnits() {
        HDLParser parser = new HDLParser("units.sv",
                "package p; endpackage\n"
              + "interface automatic bus_if; endinterface\n"
              + "interface class visitor; endclass\n"
              + "program tb; endprogram\n"
              + "primitive mux_udp (o, a, b); output o; input a, b; table 0 0 : 0; endtable endprimitive\n"
              + "module m; endmodule\n");
        Assertions.assertEquals(1, parser.parseModules().size());
        Map<String, String> units = parser.getOtherDesignUnits();
        Assertions.assertEquals(Arrays.asList("bus_if", "tb", "mux_udp"), new ArrayList<>(units.keySet()));
        Assertions.assertEquals("interface", units.get("bus_if"));
        Assertions.assertEquals("primitive", units.get("mux_udp"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "module m (input a);\\nlogic x_s;|1|has no matching endmodule",
        "module m (input a;\\nendmodule|1|Unbalanced '('",
        "module m;\\nlogic x_s\\nendmodule|2|Expected ';' before endmodule",
        "module m;\\nmodule n; endmodule\\nendmodule|2|Nested module declarations",
        "module m (a, b);\\ninput a;\\nendmodule|3|Port b of module m (line 1) has no direction declaration",
        "module m (a);\\ninput a;\\noutput z;\\nendmodule|3|is not in the port list of module m",
        "module m (input a, output a);\\nendmodule|1|Duplicate port a",
        "module m;\\nendmodule : n|2|does not match module m",
        "endmodule|1|endmodule without a matching module",
        "module m;\\nend\\nendmodule|2|'end' without a matching block start",
        "module m;\\nif (1) begin : g\\nendmodule|2|Missing 'end'",
        "module m;\\nassign x = {a, b);\\nendmodule|2|Expected '}' to close '{'",
    })
    public void testParseErrors(String source, int line, String message) {
        HDLParseException e = Assertions.assertThrows(HDLParseException.class,
                () -> HDLParser.parse("bad.sv", source.replace("\\n", "\n")));
        Assertions.assertEquals("bad.sv", e.getFileName());
        Assertions.assertEquals(line, e.getLine());
        Assertions.assertTrue(e.getMessage().contains(message), e.getMessage());
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: bad.sv:" + line + ":"), e.getMessage());
    }

    @Test
    public void testErrorNamesModule() {
        HDLParseException e = Assertions.assertThrows(HDLParseException.class,
                () -> HDLParser.parse("bad.sv", "module good; endmodule\nmodule broken;\nlogic x_s\nendmodule\n"));
        Assertions.assertEquals("broken", e.getModuleName());
        Assertions.assertTrue(e.getOffendingNames().contains("broken"));
    }
}
