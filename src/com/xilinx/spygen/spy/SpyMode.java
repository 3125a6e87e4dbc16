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

import java.util.Locale;

/**
 * Selects which objects of the design hierarchy are spied on.
 */
public enum SpyMode {
    /** Ports of every module in the hierarchy */
    PORTS,
    /** Internal signals whose name carries the register suffix */
    REGISTERS,
    /** Both ports and registers */
    BOTH;

    public boolean includesPorts() {
        return this != REGISTERS;
    }

    public boolean includesRegisters() {
        return this != PORTS;
    }

    /**
     * Parses a mode name, ignoring case.
     * @param s "ports", "registers" or "both"
     * @return The mode.
     * @throws IllegalArgumentException for any other text
     */
    public static SpyMode parse(String s) {
        if (s != null) {
            for (SpyMode m : values()) {
                if (m.name().equalsIgnoreCase(s.trim())) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("ERROR: Unknown spy mode '" + s + "', expected one of ports, "
                + "registers, both");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
