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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestHDLHierarchyResolver {

    private static final String TOP = "module top (input logic clk);\n"
            + "    rx i_rx (.clk(clk));\n"
            + "    tx i_tx (.clk(clk));\n"
            + "endmodule\n";

    private static final String RX = "module rx (input logic clk);\n"
            + "    fifo i_fifo (.clk(clk));\n"
            + "endmodule\n";

    private static final String TX = "module tx (input logic clk);\n"
            + "endmodule\n";

    private static final String FIFO = "module fifo (input logic clk);\n"
            + "endmodule\n";

    private static HDLModuleRegistry registry(String... sources) {
        HDLModuleRegistry registry = new HDLModuleRegistry();
        for (int i = 0; i < sources.length; i++) {
            HDLParser parser = new HDLParser("file" + i + ".sv", sources[i]);
            registry.addModules(parser.parseModules());
            registry.addOtherDesignUnits(parser.getOtherDesignUnits());
        }
        return registry;
    }

    @Test
    public void testTopIndependentOfOrder() {
        List<List<String>> orders = Arrays.asList(
                Arrays.asList(TOP, RX, TX, FIFO),
                Arrays.asList(FIFO, TX, RX, TOP),
                Arrays.asList(RX, TOP, FIFO, TX));
        for (List<String> order : orders) {
            HDLModule top = HDLHierarchyResolver.resolveTop(registry(order.toArray(new String[0])));
            Assertions.assertEquals("top", top.getName());
        }
    }

    @Test
    public void testAllInOneFile() {
        HDLModule top = HDLHierarchyResolver.resolveTop(registry(FIFO + RX + TOP + TX));
        Assertions.assertEquals("top", top.getName());
    }

    @Test
    public void testUnresolvedInstance() {
        // tx is missing
        UnresolvedInstanceException e = Assertions.assertThrows(UnresolvedInstanceException.class,
                () -> HDLHierarchyResolver.resolveTop(registry(TOP, RX, FIFO)));
        Assertions.assertEquals("tx", e.getMissingModuleName());
        Assertions.assertEquals("top", e.getParentModuleName());
        Assertions.assertEquals("i_tx", e.getInstanceName());
        Assertions.assertEquals("top.i_tx", e.getQualifiedInstanceName());
        Assertions.assertEquals("file0.sv:3", e.getLocation());
        Assertions.assertTrue(e.getMessage().contains("tx"));
    }

    @Test
    public void testNoModules() {
        NoTopModuleException e = Assertions.assertThrows(NoTopModuleException.class,
                () -> HDLHierarchyResolver.resolveTop(new HDLModuleRegistry()));
        Assertions.assertNull(e.getRequestedTop());
    }

    @Test
    public void testEverythingInstantiated() {
        String a = "module a; b i_b (); endmodule\n";
        String b = "module b; a i_a (); endmodule\n";
        Assertions.assertThrows(NoTopModuleException.class, () -> HDLHierarchyResolver.resolveTop(registry(a, b)));
    }

    @Test
    public void testAmbiguousTop() {
        String zeta = "module zeta; endmodule\n";
        AmbiguousTopModuleException e = Assertions.assertThrows(AmbiguousTopModuleException.class,
                () -> HDLHierarchyResolver.resolveTop(registry(zeta, TOP, RX, TX, FIFO)));
        Assertions.assertEquals(Arrays.asList("top", "zeta"), e.getCandidates());
        Assertions.assertTrue(e.getMessage().contains("top, zeta"));
    }

    @Test
    public void testExplicitTop() {
        String zeta = "module zeta; endmodule\n";
        HDLModule top = HDLHierarchyResolver.resolveTop(registry(zeta, TOP, RX, TX, FIFO), "rx");
        Assertions.assertEquals("rx", top.getName());

        NoTopModuleException e = Assertions.assertThrows(NoTopModuleException.class,
                () -> HDLHierarchyResolver.resolveTop(registry(TOP, RX, TX, FIFO), "nope"));
        Assertions.assertEquals("nope", e.getRequestedTop());
    }

    @Test
    public void testInstanceGraph() {
        HDLInstanceGraph graph = new HDLInstanceGraph(registry(TOP, RX, TX, FIFO,
                "module dual; fifo i_a (); fifo i_b (); endmodule\n"));
        Assertions.assertEquals(Arrays.asList("top", "dual"), graph.getTopCandidates());
        Assertions.assertEquals(Collections.emptySet(), graph.getModulesOnCycles());
    }

    @Test
    public void testCycleDetection() {
        HDLInstanceGraph graph = new HDLInstanceGraph(registry(
                "module top; a i_a (); endmodule\n",
                "module b; a i_a (); endmodule\n",
                "module a; b i_b (); endmodule\n"));
        Assertions.assertEquals(new LinkedHashSet<>(Arrays.asList("b", "a")), graph.getModulesOnCycles());
        Assertions.assertEquals(Collections.singletonList("top"), graph.getTopCandidates());
    }

    @Test
    public void testNoTopReportsCycle() {
        String a = "module a; b i_b (); endmodule\n";
        String b = "module b; a i_a (); endmodule\n";
        String c = "module c; c i_c (); endmodule\n";
        NoTopModuleException e = Assertions.assertThrows(NoTopModuleException.class,
                () -> HDLHierarchyResolver.resolveTop(registry(a, b, c)));
        Assertions.assertEquals(Arrays.asList("a", "b", "c"), e.getModulesOnCycles());
        Assertions.assertEquals(Arrays.asList("a", "b", "c"), e.getOffendingNames());
        Assertions.assertTrue(e.getMessage().contains("instantiation cycle through a, b, c"));
    }

    @Test
    public void testGenerateBranchesInstantiateDifferentTypes() {
        String top = "module top #(parameter P = 1) (input logic clk);\n"
                + "    if (P) begin\n"
                + "        fast u_core (.clk(clk));\n"
                + "    end else begin\n"
                + "        slow u_core (.clk(clk));\n"
                + "    end\n"
                + "endmodule\n";
        String fast = "module fast (input logic clk); endmodule\n";
        String slow = "module slow (input logic clk); endmodule\n";
        HDLModuleRegistry registry = registry(top, fast, slow);
        Assertions.assertEquals(Arrays.asList("fast", "slow"), typesOf(registry.getModule("top")));
        Assertions.assertEquals("top", HDLHierarchyResolver.resolveTop(registry).getName());
    }

    @Test
    public void testNamedBranchesHideLaterTypes() {
        String top = "module top #(parameter P = 1);\n"
                + "    if (P) begin : g_core\n"
                + "        fast u_core ();\n"
                + "    end else begin : g_core\n"
                + "        slow u_core ();\n"
                + "        slow u_core ();\n"
                + "    end\n"
                + "endmodule\n";
        HDLModule m = registry(top).getModule("top");
        Assertions.assertEquals(Arrays.asList("fast", "slow"), typesOf(m));
        Assertions.assertTrue(m.getInstances().get(0).isObservable());
        Assertions.assertFalse(m.getInstances().get(1).isObservable());
        Assertions.assertEquals("g_core.u_core", m.getInstances().get(1).getScopedName());
    }

    private static List<String> typesOf(HDLModule m) {
        List<String> types = new ArrayList<>();
        for (HDLInstance inst : m.getInstances()) {
            types.add(inst.getModuleTypeName());
        }
        return types;
    }

    @Test
    public void testInterfaceInstancesAreNotModuleInstances() {
        String busIf = "interface bus_if (input logic clk);\n"
                + "    logic valid;\n"
                + "endinterface\n";
        String top = "module top (input logic clk);\n"
                + "    bus_if u_bus (.clk(clk));\n"
                + "    rx i_rx (.clk(clk));\n"
                + "endmodule\n";
        HDLModuleRegistry registry = registry(busIf, top, RX, FIFO);
        Assertions.assertTrue(registry.isOtherDesignUnit("bus_if"));
        Assertions.assertEquals("interface", registry.getOtherDesignUnits().get("bus_if"));
        List<HDLInstance> insts = registry.getModuleInstances(registry.getModule("top"));
        Assertions.assertEquals(1, insts.size());
        Assertions.assertEquals("i_rx", insts.get(0).getName());
        Assertions.assertEquals("top", HDLHierarchyResolver.resolveTop(registry).getName());
    }

    @Test
    public void testUndefinedInterfaceIsUnresolved() {
        String top = "module top (input logic clk);\n"
                + "    bus_if u_bus (.clk(clk));\n"
                + "endmodule\n";
        UnresolvedInstanceException e = Assertions.assertThrows(UnresolvedInstanceException.class,
                () -> HDLHierarchyResolver.resolveTop(registry(top)));
        Assertions.assertEquals("bus_if", e.getMissingModuleName());
    }

    @Test
    public void testHierInstNames() {
        HDLModuleRegistry registry = registry(
                "module top; if (1) begin : g_on core i_core (); end endmodule\n",
                "module core; alu i_alu (); endmodule\n",
                "module alu; endmodule\n");
        HDLModule top = HDLHierarchyResolver.resolveTop(registry);
        HDLModule core = registry.getModule("core");
        HDLModule alu = registry.getModule("alu");
        HDLHierInst path = HDLHierInst.createTop(top)
                .getChild(top.getInstance("i_core"), core)
                .getChild(core.getInstance("i_alu"), alu);
        Assertions.assertEquals(2, path.getDepth());
        Assertions.assertEquals(Arrays.asList("g_on", "i_core", "i_alu"), path.getPathSegments());
        Assertions.assertEquals("g_on.i_core.i_alu", path.getFullHierarchicalInstName());
        Assertions.assertEquals("top.g_on.i_core.i_alu.x_s", path.getHierarchicalReference("x_s"));
        Assertions.assertEquals("top/g_on.i_core(core)/i_alu(alu)", path.getModuleTypePath());
        Assertions.assertTrue(path.containsModuleType("core"));
        Assertions.assertFalse(path.containsModuleType("other"));
        Assertions.assertSame(alu, path.getModule());
        Assertions.assertSame(top, path.getTopModule());
        Assertions.assertTrue(path.getParent().getParent().isTop());
        Assertions.assertEquals("top", HDLHierInst.createTop(top).toString());
    }
}
