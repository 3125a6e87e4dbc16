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

import java.util.Objects;

/**
 * Continuous assignment of a spied object to its interface signal:
 * {@code assign target = source;}
 */
public class SpyAssignment {

    private final String target;

    private final String source;

    public SpyAssignment(String target, String source) {
        this.target = Objects.requireNonNull(target);
        this.source = Objects.requireNonNull(source);
    }

    /**
     * @return The interface signal name.
     */
    public String getTarget() {
        return target;
    }

    /**
     * @return The upward hierarchical reference, e.g. "top.i_rx.data_s".
     */
    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpyAssignment that = (SpyAssignment) o;
        return target.equals(that.target) && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, source);
    }

    @Override
    public String toString() {
        return "assign " + target + " = " + source + ";";
    }
}
