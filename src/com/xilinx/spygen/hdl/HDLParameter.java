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

/**
 * A module parameter. Neither the type nor the default value are evaluated, both
 * are kept as the text found in source.
 */
public class HDLParameter extends HDLName {

    private final String type;

    private final String defaultValue;

    private final boolean isHeaderParameter;

    public HDLParameter(String name, String type, String defaultValue, boolean isHeaderParameter) {
        super(name);
        this.type = type == null ? "" : type;
        this.defaultValue = defaultValue == null ? "" : defaultValue;
        this.isHeaderParameter = isHeaderParameter;
    }

    /**
     * @return The declared type text, for example "int" or "logic [3:0]", or an
     * empty string if no type was given.
     */
    public String getType() {
        return type;
    }

    /**
     * @return The default value text, or an empty string if there is none.
     */
    public String getDefaultValue() {
        return defaultValue;
    }

    /**
     * @return True if declared in the #( ... ) parameter port list of the module
     * header, false if declared in the module body.
     */
    public boolean isHeaderParameter() {
        return isHeaderParameter;
    }
}
