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

import java.util.List;

/**
 * Common ancestor of all errors detected while analyzing a design. Each subclass
 * carries the identifiers (module, instance, file names...) that caused it so that
 * callers can report them without parsing the message.
 */
public abstract class HDLDesignException extends RuntimeException {

    protected HDLDesignException(String message) {
        super(message);
    }

    protected HDLDesignException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return The names of the design objects this error is about, in a stable order.
     */
    public abstract List<String> getOffendingNames();
}
