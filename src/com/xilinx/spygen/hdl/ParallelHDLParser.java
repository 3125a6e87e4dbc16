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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

import com.xilinx.spygen.util.CodePerfTracker;
import com.xilinx.spygen.util.FileTools;
import com.xilinx.spygen.util.ParallelismTools;

/**
 * Parses many source files at once, one {@link ParallelismTools} task per file.
 * The tasks share no state; their results are merged into a
 * {@link HDLModuleRegistry} in the order the files were given, so duplicate
 * detection and error reporting do not depend on thread scheduling.
 */
public class ParallelHDLParser {

    /** Outcome of parsing one file: its modules and other units, or its error */
    private static class ParseResult {
        final List<HDLModule> modules;
        final Map<String, String> otherUnits;
        final HDLParseException error;

        ParseResult(List<HDLModule> modules, Map<String, String> otherUnits, HDLParseException error) {
            this.modules = modules;
            this.otherUnits = otherUnits;
            this.error = error;
        }
    }

    private final Map<String, String> sources;

    private final Map<String, Path> paths;

    /**
     * @param files Source files, read when {@link #parse()} is called
     */
    public ParallelHDLParser(List<Path> files) {
        this.sources = null;
        this.paths = new LinkedHashMap<>();
        for (Path p : files) {
            paths.put(p.toString(), p);
        }
    }

    /**
     * @param sources File identifier to source text, in the order to merge
     */
    public ParallelHDLParser(Map<String, String> sources) {
        this.sources = new LinkedHashMap<>(sources);
        this.paths = null;
    }

    private List<String> getFileNames() {
        return new ArrayList<>(sources != null ? sources.keySet() : paths.keySet());
    }

    private ParseResult parseFile(String fileName) {
        try {
            HDLParser parser = sources != null
                    ? new HDLParser(fileName, sources.get(fileName))
                    : new HDLParser(fileName, FileTools.readTextFile(paths.get(fileName)));
            List<HDLModule> modules = parser.parseModules();
            return new ParseResult(modules, parser.getOtherDesignUnits(), null);
        } catch (HDLParseException e) {
            return new ParseResult(Collections.emptyList(), Collections.emptyMap(), e);
        }
    }

    public HDLModuleRegistry parse() {
        return parse(CodePerfTracker.SILENT);
    }

    /**
     * Parses all files and collects their modules.
     * @param t Tracker receiving the runtime of the parse and merge steps
     * @return A registry with the modules of all files, in file order.
     * @throws HDLParseErrorsException if any file failed to parse, listing the
     * error of every failing file
     * @throws DuplicateModuleException if two modules share a name
     */
    public HDLModuleRegistry parse(CodePerfTracker t) {
        List<String> fileNames = getFileNames();
        t.start("Parse Files");
        List<Future<ParseResult>> futures = ParallelismTools.invokeAll(fileNames, this::parseFile);
        t.stop().start("Merge Modules");
        List<HDLParseException> errors = new ArrayList<>();
        List<ParseResult> results = new ArrayList<>();
        for (Future<ParseResult> f : futures) {
            ParseResult result = ParallelismTools.get(f);
            if (result.error != null) {
                errors.add(result.error);
            } else {
                results.add(result);
            }
        }
        if (!errors.isEmpty()) {
            t.stop();
            throw new HDLParseErrorsException(errors);
        }
        HDLModuleRegistry registry = new HDLModuleRegistry();
        for (ParseResult result : results) {
            registry.addModules(result.modules);
            registry.addOtherDesignUnits(result.otherUnits);
        }
        t.stop();
        return registry;
    }
}
