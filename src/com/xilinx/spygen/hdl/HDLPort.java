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
 * Represents a port on an {@link HDLModule}.
 */
public class HDLPort extends HDLDeclaration {

    private final HDLDirection direction;

    public HDLPort(String name, HDLDirection direction, String type, String width, String arrayDims) {
        super(name, type, width, arrayDims);
        if (direction == null) {
            throw new IllegalArgumentException("Port " + name + " needs a direction");
        }
        this.direction = direction;
    }

    public HDLDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction == HDLDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == HDLDirection.OUTPUT;
    }

    @Override
    public boolean isPort() {
        return true;
    }
}
