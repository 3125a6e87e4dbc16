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
import java.util.Collections;
import java.util.List;

/**
 * Bundles the parse errors of several source files so that all of them can be
 * reported together. The order of {@link #getErrors()} follows the order in which
 * the files were given.
 */
public class HDLParseErrorsException extends HDLDesignException {

    private final List<HDLParseException> errors;

    public HDLParseErrorsException(List<HDLParseException> errors) {
        super(buildMessage(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("Need at least one parse error");
        }
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        for (HDLParseException e : errors) {
            addSuppressed(e);
        }
    }

    private static String buildMessage(List<HDLParseException> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(errors.size() == 1 ? " file" : " files").append(" failed to parse:");
        for (HDLParseException e : errors) {
            sb.append("\n\t").append(e.getMessage());
        }
        return sb.toString();
    }

    public List<HDLParseException> getErrors() {
        return errors;
    }

    @Override
    public List<String> getOffendingNames() {
        List<String> names = new ArrayList<>();
        for (HDLParseException e : errors) {
            names.add(e.getFileName());
        }
        return Collections.unmodifiableList(names);
    }
}
