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
package com.xilinx.spygen.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestParams {

    @AfterEach
    public void cleanup() {
        System.clearProperty("SPYGEN_TEST_PARAM");
    }

    @ParameterizedTest
    @CsvSource(value = {
        "1, true",
        "true, true",
        "yes, true",
        "0, false",
        "false, false",
        "FALSE, false",
        "'', false",
    })
    public void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    public void testSystemProperty() {
        Assertions.assertFalse(Params.isParamSet("SPYGEN_TEST_PARAM"));
        Assertions.assertEquals("_s", Params.getParamOrDefault("SPYGEN_TEST_PARAM", "_s"));
        System.setProperty("SPYGEN_TEST_PARAM", "_reg");
        Assertions.assertTrue(Params.isParamSet("SPYGEN_TEST_PARAM"));
        Assertions.assertEquals("_reg", Params.getParamValue("SPYGEN_TEST_PARAM"));
        Assertions.assertEquals("_reg", Params.getParamOrDefault("SPYGEN_TEST_PARAM", "_s"));
    }
}
