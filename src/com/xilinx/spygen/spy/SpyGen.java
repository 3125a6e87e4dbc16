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

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.xilinx.spygen.hdl.HDLDesignException;
import com.xilinx.spygen.hdl.HDLHierarchyResolver;
import com.xilinx.spygen.hdl.HDLModule;
import com.xilinx.spygen.hdl.HDLModuleRegistry;
import com.xilinx.spygen.hdl.HDLPort;
import com.xilinx.spygen.hdl.ParallelHDLParser;
import com.xilinx.spygen.util.CodePerfTracker;
import com.xilinx.spygen.util.FileTools;
import com.xilinx.spygen.util.MessageGenerator;
import com.xilinx.spygen.util.Params;
import joptsimple.OptionException;

/**
 * Runs the complete analysis: parse the sources, find the top module, collect the
 * spied ports and registers, give them unique names and build the
 * {@link InterfaceModel}. Any design error aborts the run with an
 * {@link HDLDesignException}; there is no partial result.
 */
public class SpyGen {

    private final SpyGenConfig config;

    private final CodePerfTracker t;

    public SpyGen() {
        this(new SpyGenConfig());
    }

    public SpyGen(SpyGenConfig config) {
        this(config, CodePerfTracker.SILENT);
    }

    public SpyGen(SpyGenConfig config, CodePerfTracker t) {
        this.config = config;
        this.t = t;
    }

    public SpyGenConfig getConfig() {
        return config;
    }

    /**
     * Analyzes a set of source files.
     * @param files The source files, in the order their modules are registered
     * @return The interface model.
     */
    public InterfaceModel analyze(List<Path> files) {
        return analyze(new ParallelHDLParser(files).parse(t));
    }

    /**
     * Analyzes in-memory sources.
     * @param sources File identifier to source text, in the order their modules are registered
     * @return The interface model.
     */
    public InterfaceModel analyzeSources(Map<String, String> sources) {
        return analyze(new ParallelHDLParser(sources).parse(t));
    }

    /**
     * Analyzes the modules of a registry. The registry is locked afterwards.
     * @param registry All modules of the design
     * @return The interface model.
     */
    public InterfaceModel analyze(HDLModuleRegistry registry) {
        t.start("Resolve Hierarchy");
        HDLModule top = HDLHierarchyResolver.resolveTop(registry, config.getTopModuleName());
        t.stop().start("Flatten Signals");
        SpyNaming naming = config.getNaming();
        List<SpyEntry> entries = SignalFlattener.flatten(top, registry, config.getMode(), naming,
                config.isSkipUnobservable());
        t.stop().start("Resolve Name Conflicts");
        List<String> reserved = new ArrayList<>();
        for (HDLPort p : top.getPorts()) {
            reserved.add(p.getName());
        }
        List<SpyEntry> resolved = ConflictResolver.resolve(entries, reserved, naming);
        t.stop().start("Build Interface Model");
        InterfaceModel model = InterfaceModelBuilder.build(top, resolved, config.getMode());
        t.stop();
        return model;
    }

    public static void main(String[] args) {
        SpyGenConfig config;
        try {
            config = new SpyGenConfig(args);
        } catch (OptionException | IllegalArgumentException e) {
            MessageGenerator.briefError(e.getMessage().startsWith("ERROR:") ? e.getMessage()
                    : "ERROR: " + e.getMessage());
            SpyGenConfig.printHelp();
            System.exit(1);
            return;
        }
        if (config.isHelp()) {
            SpyGenConfig.printHelp();
            return;
        }
        if (config.isQuiet()) {
            Params.SPYGEN_QUIET = true;
        }

        CodePerfTracker t = new CodePerfTracker("SpyGen");
        try {
            t.start("Find Source Files");
            List<Path> files = FileTools.findFiles(config.getInputs(), config.getExtensions());
            t.stop();
            if (files.isEmpty()) {
                MessageGenerator.briefErrorAndExit("ERROR: No source files with extension "
                        + String.join(", ", config.getExtensions()) + " found in " + config.getInputs());
            }
            MessageGenerator.briefMessage("[INFO] Parsing " + files.size() + " source files");

            InterfaceModel model = new SpyGen(config, t).analyze(files);

            t.start("Write Interface");
            SpyInterfaceWriter writer = config.getWriter();
            String outputFileName = config.getOutputFileName(writer.getInterfaceName(model));
            writer.writeInterfaceFile(model, outputFileName);
            t.stop();

            MessageGenerator.briefMessage("[INFO] Top module: " + model.getTopModuleName());
            MessageGenerator.briefMessage("[INFO] Wrote " + model.getEntries().size() + " spied signals to "
                    + outputFileName);
            t.printSummary();
            System.out.println(writer.writeBindStatement(model));
        } catch (HDLDesignException | UncheckedIOException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
        }
    }
}
