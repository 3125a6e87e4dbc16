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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.spygen.hdl.AmbiguousTopModuleException;
import com.xilinx.spygen.hdl.HDLDesignException;
import com.xilinx.spygen.hdl.HDLParseErrorsException;
import com.xilinx.spygen.hdl.UnresolvedInstanceException;
import com.xilinx.spygen.util.CodePerfTracker;
import com.xilinx.spygen.util.FileTools;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestSpyGen {

    private static List<String> outputNames(InterfaceModel model) {
        List<String> names = new ArrayList<>();
        for (SpyEntry e : model.getEntries()) {
            names.add(e.getOutputName());
        }
        return names;
    }

    @Test
    public void testAnalyzeSources() {
        InterfaceModel model = new SpyGen().analyzeSources(SpyTestDesigns.rxTxSources());
        Assertions.assertEquals("top", model.getTopModuleName());
        Assertions.assertEquals(Arrays.asList("pipe_s", "i_rx_data_s", "level_s", "i_tx_data_s"), outputNames(model));
        Assertions.assertEquals("WIDTH", model.getTopParameters().get(0).getName());
    }

    @Test
    public void testAnalyzeFiles(@TempDir Path dir) throws IOException {
        Path rtl = Files.createDirectories(dir.resolve("rtl"));
        Path sub = Files.createDirectories(rtl.resolve("sub"));
        for (Map.Entry<String, String> e : SpyTestDesigns.rxTxSources().entrySet()) {
            Path target = e.getKey().equals("fifo.sv") ? sub.resolve("fifo.v") : rtl.resolve(e.getKey());
            Files.write(target, e.getValue().getBytes(StandardCharsets.UTF_8));
        }
        Files.write(rtl.resolve("notes.txt"), "module ignored; endmodule".getBytes(StandardCharsets.UTF_8));

        SpyGenConfig config = new SpyGenConfig();
        List<Path> files = FileTools.findFiles(Collections.singletonList(rtl), config.getExtensions());
        Assertions.assertEquals(4, files.size());

        CodePerfTracker t = new CodePerfTracker("test", false);
        InterfaceModel model = new SpyGen(config, t).analyze(files);
        Assertions.assertEquals("top", model.getTopModuleName());
        Assertions.assertEquals(4, model.getEntries().size());
        Assertions.assertNotNull(t.getRuntime("Parse Files"));
        Assertions.assertNotNull(t.getRuntime("Resolve Name Conflicts"));
    }

    @Test
    public void testRepeatedRunsAreIdentical() {
        SpyGenConfig config = new SpyGenConfig();
        config.setMode(SpyMode.BOTH);
        SpyInterfaceWriter writer = config.getWriter();
        String first = writer.writeInterface(new SpyGen(config).analyzeSources(SpyTestDesigns.rxTxSources()));
        String second = writer.writeInterface(new SpyGen(config).analyzeSources(SpyTestDesigns.rxTxSources()));
        Assertions.assertEquals(first, second);
    }

    @Test
    public void testExplicitTopAndNaming() {
        SpyGenConfig config = new SpyGenConfig();
        config.setTopModuleName("rx");
        config.setMode(SpyMode.PORTS);
        config.setPrefix("spy_");
        InterfaceModel model = new SpyGen(config).analyzeSources(SpyTestDesigns.rxTxSources());
        Assertions.assertEquals("rx", model.getTopModuleName());
        // rx ports are the interface ports, the fifo port only gets the prefix
        Assertions.assertEquals(Arrays.asList("clk", "din", "spy_clk"), outputNames(model));
        Assertions.assertEquals("bind rx rx_spy_if #(.WIDTH(WIDTH)) i_spy (.*);",
                config.getWriter().writeBindStatement(model));
    }

    private static Map<String, String> unobservableDesign() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("leaf.sv", "module leaf; logic x_s; endmodule\n");
        sources.put("top.sv", "module top;\n"
                + "    for (genvar i = 0; i < 2; i++) begin : g_loop\n"
                + "        logic cnt_s;\n"
                + "    end\n"
                + "    leaf i_arr [1:0] ();\n"
                + "    logic kept_s;\n"
                + "endmodule\n");
        return sources;
    }

    @Test
    public void testUnobservableObjectsStopTheRun() {
        UnobservableObjectException e = Assertions.assertThrows(UnobservableObjectException.class,
                () -> new SpyGen().analyzeSources(unobservableDesign()));
        Assertions.assertEquals("g_loop.cnt_s", e.getObjectName());
        Assertions.assertEquals("top.sv:3", e.getLocation());

        SpyGenConfig config = new SpyGenConfig();
        config.setSkipUnobservable(true);
        InterfaceModel model = new SpyGen(config).analyzeSources(unobservableDesign());
        Assertions.assertEquals(Arrays.asList("kept_s"), outputNames(model));
    }

    @Test
    public void testMissingModule() {
        Map<String, String> sources = SpyTestDesigns.rxTxSources();
        sources.remove("tx.sv");
        UnresolvedInstanceException e = Assertions.assertThrows(UnresolvedInstanceException.class,
                () -> new SpyGen().analyzeSources(sources));
        Assertions.assertEquals("tx", e.getMissingModuleName());
        Assertions.assertEquals("top.i_tx", e.getQualifiedInstanceName());
    }

    @Test
    public void testDesignErrorsShareOneType() {
        Map<String, String> sources = SpyTestDesigns.rxTxSources();
        sources.put("spare.sv", "module spare; endmodule\n");
        HDLDesignException e = Assertions.assertThrows(AmbiguousTopModuleException.class,
                () -> new SpyGen().analyzeSources(sources));
        Assertions.assertEquals(Arrays.asList("spare", "top"), e.getOffendingNames());

        sources.put("broken.sv", "module broken;\n");
        Assertions.assertThrows(HDLParseErrorsException.class, () -> new SpyGen().analyzeSources(sources));
    }
}
