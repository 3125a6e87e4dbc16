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

import java.util.Locale;

/**
 * Provides basic directional options for ports.
 */
public enum HDLDirection {
    INPUT,
    OUTPUT,
    INOUT;

    private final String keyword;

    HDLDirection() {
        keyword = name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a direction by its HDL keyword ("input", "output", "inout").
     * @param s The keyword
     * @return The direction, or null if s is not a direction keyword.
     */
    public static HDLDirection getEnum(String s) {
        switch (s) {
            case "input": return INPUT;
            case "output": return OUTPUT;
            case "inout": return INOUT;
            default: return null;
        }
    }

    public static boolean isDirectionKeyword(String s) {
        return getEnum(s) != null;
    }

    /**
     * @return The keyword used in source, e.g. "input".
     */
    public String getKeyword() {
        return keyword;
    }
}
