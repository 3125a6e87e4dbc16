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

import java.nio.file.Paths;
import java.util.Arrays;

import com.xilinx.spygen.util.Params;
import joptsimple.OptionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestSpyGenConfig {

    @Test
    public void testDefaults() {
        SpyGenConfig config = new SpyGenConfig(new String[0]);
        Assertions.assertEquals(Arrays.asList(Paths.get("./rtl")), config.getInputs());
        Assertions.assertEquals(Arrays.asList(".sv", ".v"), config.getExtensions());
        Assertions.assertEquals(SpyMode.REGISTERS, config.getMode());
        Assertions.assertEquals(Params.SPYGEN_REGISTER_SUFFIX, config.getRegisterSuffix());
        Assertions.assertFalse(config.isIgnoreCase());
        Assertions.assertNull(config.getTopModuleName());
        Assertions.assertNull(config.getInterfaceName());
        Assertions.assertEquals(SpyInterfaceWriter.DEFAULT_BIND_INSTANCE_NAME, config.getBindInstanceName());
        Assertions.assertEquals("top_spy_if.sv", config.getOutputFileName("top_spy_if"));
        Assertions.assertFalse(config.isHelp());
        Assertions.assertFalse(config.isSkipUnobservable());
        SpyNaming naming = config.getNaming();
        Assertions.assertEquals("", naming.getPrefix());
        Assertions.assertEquals(SpyNaming.DEFAULT_SEPARATOR, naming.getSeparator());
    }

    @Test
    public void testAllOptions() {
        SpyGenConfig config = new SpyGenConfig(new String[]{
            "-i", "rtl/core", "--input", "rtl/io", "extra.sv",
            "-x", "sv,vh",
            "-m", "Both",
            "-s", "_q", "--ignore-case",
            "-t", "chip",
            "-o", "out/spy.sv",
            "-n", "chip_watch_if",
            "-b", "u_watch",
            "--prefix", "spy_",
            "--separator", "__",
            "--skip-unobservable",
            "-q"});
        Assertions.assertEquals(Arrays.asList(Paths.get("rtl/core"), Paths.get("rtl/io"), Paths.get("extra.sv")),
                config.getInputs());
        Assertions.assertEquals(Arrays.asList(".sv", ".vh"), config.getExtensions());
        Assertions.assertEquals(SpyMode.BOTH, config.getMode());
        Assertions.assertEquals("chip", config.getTopModuleName());
        Assertions.assertEquals("out/spy.sv", config.getOutputFileName("ignored"));
        Assertions.assertEquals("chip_watch_if", config.getInterfaceName());
        Assertions.assertEquals("u_watch", config.getWriter().getBindInstanceName());
        Assertions.assertTrue(config.isQuiet());
        Assertions.assertTrue(config.isSkipUnobservable());

        SpyNaming naming = config.getNaming();
        Assertions.assertEquals("_q", naming.getRegisterSuffix());
        Assertions.assertTrue(naming.isIgnoreCase());
        Assertions.assertTrue(naming.isRegisterName("CNT_Q"));
        Assertions.assertEquals("spy_", naming.getPrefix());
        Assertions.assertEquals("__", naming.getSeparator());
    }

    @Test
    public void testHelp() {
        Assertions.assertTrue(new SpyGenConfig(new String[]{"-h"}).isHelp());
        Assertions.assertTrue(new SpyGenConfig(new String[]{"--help"}).isHelp());
    }

    @ParameterizedTest
    @ValueSource(strings = {"--nope", "-t"})
    public void testBadOptions(String arg) {
        Assertions.assertThrows(OptionException.class, () -> new SpyGenConfig(new String[]{arg}));
    }

    @Test
    public void testBadMode() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SpyGenConfig(new String[]{"-m", "wires"}));
        Assertions.assertTrue(e.getMessage().contains("wires"));
    }

    @Test
    public void testEmptyNamingOptions() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SpyGenConfig(new String[]{"-s", ""}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SpyGenConfig(new String[]{"--separator", ""}));
    }

    @Test
    public void testModeParsing() {
        Assertions.assertEquals(SpyMode.PORTS, SpyMode.parse(" PORTS "));
        Assertions.assertEquals("registers", SpyMode.REGISTERS.toString());
        Assertions.assertThrows(IllegalArgumentException.class, () -> SpyMode.parse(null));
    }
}
