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

import com.xilinx.spygen.util.Params;

/**
 * Naming rules of a spy run: which internal signals count as registers and how
 * the names of the interface signals are formed.
 */
public class SpyNaming {

    public static final String DEFAULT_SEPARATOR = "_";

    private final String registerSuffix;

    private final boolean ignoreCase;

    private final String prefix;

    private final String separator;

    /**
     * Naming with the register suffix of {@link Params#SPYGEN_REGISTER_SUFFIX}, case
     * sensitive matching, no prefix and "_" as separator.
     */
    public SpyNaming() {
        this(Params.SPYGEN_REGISTER_SUFFIX, false, "", DEFAULT_SEPARATOR);
    }

    public SpyNaming(String registerSuffix, boolean ignoreCase, String prefix, String separator) {
        if (registerSuffix == null || registerSuffix.isEmpty()) {
            throw new IllegalArgumentException("ERROR: The register suffix must not be empty");
        }
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("ERROR: The name separator must not be empty");
        }
        this.registerSuffix = registerSuffix;
        this.ignoreCase = ignoreCase;
        this.prefix = prefix == null ? "" : prefix;
        this.separator = separator;
    }

    public String getRegisterSuffix() {
        return registerSuffix;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    /**
     * @return Text put in front of every generated spy signal name.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * @return Text joining instance names and the signal name of a disambiguated name.
     */
    public String getSeparator() {
        return separator;
    }

    /**
     * Checks if a signal name marks a register, i.e. it ends with the register suffix
     * and has at least one character in front of it.
     * @param name Signal name
     * @return True if the signal is a register to spy on.
     */
    public boolean isRegisterName(String name) {
        if (name.length() <= registerSuffix.length()) {
            return false;
        }
        if (ignoreCase) {
            return name.toLowerCase(Locale.ROOT).endsWith(registerSuffix.toLowerCase(Locale.ROOT));
        }
        return name.endsWith(registerSuffix);
    }
}
