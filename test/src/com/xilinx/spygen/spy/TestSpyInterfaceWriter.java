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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLModuleRegistry;
import com.xilinx.spygen.hdl.HDLParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestSpyInterfaceWriter {

    private static final String EXPECTED_RX_TX =
            "// Spy interface of module top, generated by SpyGen. Do not edit.\n"
          + "// Mode: registers, 4 spied signals\n"
          + "\n"
          + "interface top_spy_if #(\n"
          + "    parameter WIDTH = 8\n"
          + ") (\n"
          + "    input logic             clk,\n"
          + "    input logic [WIDTH-1:0] din,\n"
          + "    input logic [WIDTH-1:0] dout\n"
          + ");\n"
          + "\n"
          + "    // top: top\n"
          + "    logic [WIDTH-1:0] pipe_s;\n"
          + "\n"
          + "    assign pipe_s = top.pipe_s;\n"
          + "\n"
          + "    // rx: top.i_rx\n"
          + "    logic [WIDTH-1:0] i_rx_data_s;\n"
          + "\n"
          + "    assign i_rx_data_s = top.i_rx.data_s;\n"
          + "\n"
          + "    // fifo: top.i_rx.i_fifo\n"
          + "    logic [3:0] level_s;\n"
          + "\n"
          + "    assign level_s = top.i_rx.i_fifo.level_s;\n"
          + "\n"
          + "    // tx: top.i_tx\n"
          + "    logic [WIDTH-1:0] i_tx_data_s;\n"
          + "\n"
          + "    assign i_tx_data_s = top.i_tx.data_s;\n"
          + "\n"
          + "endinterface : top_spy_if\n";

    private static InterfaceModel analyze(HDLModuleRegistry registry, SpyMode mode) {
        SpyGenConfig config = new SpyGenConfig();
        config.setMode(mode);
        return new SpyGen(config).analyze(registry);
    }

    @Test
    public void testRxTxInterface() {
        InterfaceModel model = analyze(SpyTestDesigns.rxTxRegistry(), SpyMode.REGISTERS);
        Assertions.assertEquals(EXPECTED_RX_TX, new SpyInterfaceWriter().writeInterface(model));
    }

    @Test
    public void testBindStatement() {
        InterfaceModel model = analyze(SpyTestDesigns.rxTxRegistry(), SpyMode.REGISTERS);
        Assertions.assertEquals("bind top top_spy_if #(.WIDTH(WIDTH)) i_spy (.*);",
                new SpyInterfaceWriter().writeBindStatement(model));
        SpyInterfaceWriter named = new SpyInterfaceWriter("watch_if", "u_watch");
        Assertions.assertEquals("bind top watch_if #(.WIDTH(WIDTH)) u_watch (.*);", named.writeBindStatement(model));
        Assertions.assertTrue(named.writeInterface(model).endsWith("endinterface : watch_if\n"));
    }

    @Test
    public void testNoPortsNoParameters() {
        HDLModuleRegistry registry = SpyTestDesigns.registry("module bare; logic a_s, b_s; endmodule\n");
        InterfaceModel model = analyze(registry, SpyMode.BOTH);
        String text = new SpyInterfaceWriter().writeInterface(model);
        Assertions.assertTrue(text.contains("interface bare_spy_if ();\n"));
        Assertions.assertTrue(text.contains("    logic a_s;\n    logic b_s;\n"));
        Assertions.assertTrue(text.contains("    assign a_s = bare.a_s;\n    assign b_s = bare.b_s;\n"));
        Assertions.assertEquals("bind bare bare_spy_if i_spy (.*);", new SpyInterfaceWriter().writeBindStatement(model));
    }

    @Test
    public void testBothModeSubmodulePorts() {
        InterfaceModel model = analyze(SpyTestDesigns.rxTxRegistry(), SpyMode.BOTH);
        String text = new SpyInterfaceWriter().writeInterface(model);
        Assertions.assertTrue(text.startsWith("// Spy interface of module top, generated by SpyGen. Do not edit.\n"
                + "// Mode: both, 12 spied signals\n"));
        Assertions.assertTrue(text.contains("    // rx: top.i_rx\n"
                + "    logic             i_rx_clk;\n"
                + "    logic [WIDTH-1:0] i_rx_din;\n"
                + "    logic [WIDTH-1:0] i_rx_data_s;\n"
                + "\n"
                + "    assign i_rx_clk    = top.i_rx.clk;\n"
                + "    assign i_rx_din    = top.i_rx.din;\n"
                + "    assign i_rx_data_s = top.i_rx.data_s;\n"));
        // top ports are interface ports, never redeclared or assigned
        Assertions.assertFalse(text.contains("assign clk"));
        Assertions.assertFalse(text.contains("logic             clk;"));
    }

    @Test
    public void testSharedModuleSection() {
        HDLModuleRegistry registry = SpyTestDesigns.registry(
                "module top; leaf i_a (); leaf i_b (); endmodule\n",
                "module leaf; logic [1:0] x_s [4]; endmodule\n");
        String text = new SpyInterfaceWriter().writeInterface(analyze(registry, SpyMode.REGISTERS));
        Assertions.assertTrue(text.contains("    // leaf: top.i_a, top.i_b\n"
                + "    logic [1:0] i_a_x_s[4];\n"
                + "    logic [1:0] i_b_x_s[4];\n"));
    }

    @Test
    public void testWriteFileIsIdempotent(@TempDir Path dir) throws IOException {
        SpyInterfaceWriter writer = new SpyInterfaceWriter();
        String file = dir.resolve("top_spy_if.sv").toString();
        writer.writeInterfaceFile(analyze(SpyTestDesigns.rxTxRegistry(), SpyMode.REGISTERS), file);
        byte[] first = Files.readAllBytes(Paths.get(file));
        writer.writeInterfaceFile(analyze(SpyTestDesigns.rxTxRegistry(), SpyMode.REGISTERS), file);
        Assertions.assertArrayEquals(first, Files.readAllBytes(Paths.get(file)));
        Assertions.assertTrue(new String(first, StandardCharsets.UTF_8).startsWith(EXPECTED_RX_TX));
    }

    @Test
    public void testAlignColumns() {
        List<String> lines = SpyInterfaceWriter.alignColumns(Arrays.asList(
                new String[]{"logic", "", "a;"},
                new String[]{"int unsigned", "", "long_name;"},
                new String[]{"logic", "[7:0]", "b;"}));
        Assertions.assertEquals(Arrays.asList(
                "logic              a;",
                "int unsigned       long_name;",
                "logic        [7:0] b;"), lines);
        Assertions.assertEquals(Collections.singletonList("x y"),
                SpyInterfaceWriter.alignColumns(Collections.singletonList(new String[]{"x", "", "y"})));
        Assertions.assertTrue(SpyInterfaceWriter.alignColumns(Collections.emptyList()).isEmpty());
    }

    @ParameterizedTest
    @CsvSource(value = {
        "logic, logic",
        "'', logic",
        "const logic, logic",
        "static int unsigned, int unsigned",
        "var logic signed, var logic signed",
    })
    public void testDeclarationType(String type, String expected) {
        Assertions.assertEquals(expected, SpyInterfaceWriter.declarationType(type));
    }

    @Test
    public void testPortTypesCopied() {
        HDLModule top = HDLParser.parse("t.sv", "module top (input wire [3:0] a, output reg b); endmodule").get(0);
        InterfaceModel model = InterfaceModelBuilder.build(top, Collections.emptyList(), SpyMode.PORTS);
        String text = new SpyInterfaceWriter().writeInterface(model);
        Assertions.assertTrue(text.contains("    input wire [3:0] a,\n    input reg        b\n);\n"));
    }
}
