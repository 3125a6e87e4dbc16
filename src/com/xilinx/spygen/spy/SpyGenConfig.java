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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.xilinx.spygen.util.FileTools;
import com.xilinx.spygen.util.MessageGenerator;
import com.xilinx.spygen.util.Params;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * A collection of customizable parameters for a {@link SpyGen} run.
 * Modifications of default parameter values can be done by adding corresponding
 * options with values to the arguments or by calling the applicable setter method.
 */
public class SpyGenConfig {

    public static final String DEFAULT_INPUT = "./rtl";

    public static final List<String> DEFAULT_EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            FileTools.SYSTEM_VERILOG_EXTENSION, FileTools.VERILOG_EXTENSION));

    public static final SpyMode DEFAULT_MODE = SpyMode.REGISTERS;

    private List<Path> inputs;

    private List<String> extensions;

    private SpyMode mode;

    private String registerSuffix;

    private boolean ignoreCase;

    private String topModuleName;

    private String outputFileName;

    private String interfaceName;

    private String bindInstanceName;

    private String prefix;

    private String separator;

    private boolean skipUnobservable;

    private boolean quiet;

    private boolean help;

    private static final List<String> INPUT_OPTS = Arrays.asList("i", "input");
    private static final List<String> EXTENSIONS_OPTS = Arrays.asList("x", "extensions");
    private static final List<String> MODE_OPTS = Arrays.asList("m", "mode");
    private static final List<String> SUFFIX_OPTS = Arrays.asList("s", "suffix");
    private static final List<String> IGNORE_CASE_OPTS = Collections.singletonList("ignore-case");
    private static final List<String> TOP_OPTS = Arrays.asList("t", "top");
    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> INTERFACE_NAME_OPTS = Arrays.asList("n", "interface-name");
    private static final List<String> BIND_INSTANCE_OPTS = Arrays.asList("b", "bind-instance");
    private static final List<String> PREFIX_OPTS = Collections.singletonList("prefix");
    private static final List<String> SEPARATOR_OPTS = Collections.singletonList("separator");
    private static final List<String> SKIP_UNOBSERVABLE_OPTS = Collections.singletonList("skip-unobservable");
    private static final List<String> QUIET_OPTS = Arrays.asList("q", "quiet");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public SpyGenConfig() {
        inputs = new ArrayList<>(Collections.singletonList(Paths.get(DEFAULT_INPUT)));
        extensions = new ArrayList<>(DEFAULT_EXTENSIONS);
        mode = DEFAULT_MODE;
        registerSuffix = Params.SPYGEN_REGISTER_SUFFIX;
        ignoreCase = false;
        topModuleName = null;
        outputFileName = null;
        interfaceName = null;
        bindInstanceName = SpyInterfaceWriter.DEFAULT_BIND_INSTANCE_NAME;
        prefix = "";
        separator = SpyNaming.DEFAULT_SEPARATOR;
        skipUnobservable = false;
        quiet = Params.SPYGEN_QUIET;
    }

    public SpyGenConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(INPUT_OPTS, "Source file or directory, may be repeated (default is '"
                        + DEFAULT_INPUT + "')").withRequiredArg();
                acceptsAll(EXTENSIONS_OPTS, "Comma separated source file extensions searched in "
                        + "directories (default is '.sv,.v')").withRequiredArg().withValuesSeparatedBy(',');
                acceptsAll(MODE_OPTS, "What to spy on: ports, registers or both (default is registers)")
                        .withRequiredArg();
                acceptsAll(SUFFIX_OPTS, "Name suffix marking registers (default is '"
                        + Params.DEFAULT_REGISTER_SUFFIX + "')").withRequiredArg();
                acceptsAll(IGNORE_CASE_OPTS, "Match the register suffix ignoring case");
                acceptsAll(TOP_OPTS, "Name of the top module, detected if not given").withRequiredArg();
                acceptsAll(OUTPUT_OPTS, "Output file (default is '<interface name>.sv')").withRequiredArg();
                acceptsAll(INTERFACE_NAME_OPTS, "Name of the generated interface (default is '<top>"
                        + SpyInterfaceWriter.DEFAULT_INTERFACE_SUFFIX + "')").withRequiredArg();
                acceptsAll(BIND_INSTANCE_OPTS, "Instance name of the interface in the bind statement "
                        + "(default is '" + SpyInterfaceWriter.DEFAULT_BIND_INSTANCE_NAME + "')").withRequiredArg();
                acceptsAll(PREFIX_OPTS, "Prefix of every generated spy signal name").withRequiredArg();
                acceptsAll(SEPARATOR_OPTS, "Separator between instance and signal names (default is '"
                        + SpyNaming.DEFAULT_SEPARATOR + "')").withRequiredArg();
                acceptsAll(SKIP_UNOBSERVABLE_OPTS, "Leave out registers and instances in loop or unnamed "
                        + "generate blocks and instance arrays with a warning instead of failing");
                acceptsAll(QUIET_OPTS, "Only print errors, warnings and the bind statement");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("SpyGen");
        System.out.println("Generates a SystemVerilog spy interface exposing the ports and registers of a design,");
        System.out.println("and the bind statement that attaches it to the top module.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        setHelp(options.has(HELP_OPTS.get(0)));
        setIgnoreCase(options.has(IGNORE_CASE_OPTS.get(0)));
        setSkipUnobservable(options.has(SKIP_UNOBSERVABLE_OPTS.get(0)));
        if (options.has(QUIET_OPTS.get(0))) {
            setQuiet(true);
        }

        List<Path> inputList = new ArrayList<>();
        for (Object o : options.valuesOf(INPUT_OPTS.get(0))) {
            inputList.add(Paths.get((String) o));
        }
        for (Object o : options.nonOptionArguments()) {
            inputList.add(Paths.get((String) o));
        }
        if (!inputList.isEmpty()) {
            setInputs(inputList);
        }

        if (options.has(EXTENSIONS_OPTS.get(0))) {
            List<String> list = new ArrayList<>();
            for (Object o : options.valuesOf(EXTENSIONS_OPTS.get(0))) {
                String ext = ((String) o).trim();
                if (!ext.isEmpty()) {
                    list.add(ext.startsWith(".") ? ext : "." + ext);
                }
            }
            setExtensions(list);
        }

        if (options.has(MODE_OPTS.get(0))) {
            setMode(SpyMode.parse((String) options.valueOf(MODE_OPTS.get(0))));
        } else {
            MessageGenerator.briefMessage("[INFO] No spy mode set, defaulting to: " + getMode());
        }

        if (options.has(SUFFIX_OPTS.get(0))) {
            setRegisterSuffix((String) options.valueOf(SUFFIX_OPTS.get(0)));
        }

        if (options.has(TOP_OPTS.get(0))) {
            setTopModuleName((String) options.valueOf(TOP_OPTS.get(0)));
        }

        if (options.has(OUTPUT_OPTS.get(0))) {
            setOutputFileName((String) options.valueOf(OUTPUT_OPTS.get(0)));
        }

        if (options.has(INTERFACE_NAME_OPTS.get(0))) {
            setInterfaceName((String) options.valueOf(INTERFACE_NAME_OPTS.get(0)));
        }

        if (options.has(BIND_INSTANCE_OPTS.get(0))) {
            setBindInstanceName((String) options.valueOf(BIND_INSTANCE_OPTS.get(0)));
        }

        if (options.has(PREFIX_OPTS.get(0))) {
            setPrefix((String) options.valueOf(PREFIX_OPTS.get(0)));
        }

        if (options.has(SEPARATOR_OPTS.get(0))) {
            setSeparator((String) options.valueOf(SEPARATOR_OPTS.get(0)));
        }

        // fail early on bad naming options
        getNaming();
    }

    /**
     * @return The naming rules configured by suffix, case, prefix and separator.
     */
    public SpyNaming getNaming() {
        return new SpyNaming(registerSuffix, ignoreCase, prefix, separator);
    }

    /**
     * @return A writer using the configured interface and bind instance names.
     */
    public SpyInterfaceWriter getWriter() {
        return new SpyInterfaceWriter(interfaceName, bindInstanceName);
    }

    /**
     * Gets the file the interface is written to.
     * @param resolvedInterfaceName Name of the interface, used if no output file is set
     * @return The configured output file or "&lt;interface name&gt;.sv".
     */
    public String getOutputFileName(String resolvedInterfaceName) {
        return outputFileName != null ? outputFileName : resolvedInterfaceName + FileTools.SYSTEM_VERILOG_EXTENSION;
    }

    public List<Path> getInputs() {
        return inputs;
    }

    public void setInputs(List<Path> inputs) {
        this.inputs = new ArrayList<>(inputs);
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = new ArrayList<>(extensions);
    }

    public SpyMode getMode() {
        return mode;
    }

    public void setMode(SpyMode mode) {
        this.mode = mode;
    }

    public String getRegisterSuffix() {
        return registerSuffix;
    }

    public void setRegisterSuffix(String registerSuffix) {
        this.registerSuffix = registerSuffix;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    /**
     * @return The explicitly requested top module, or null to detect it.
     */
    public String getTopModuleName() {
        return topModuleName;
    }

    public void setTopModuleName(String topModuleName) {
        this.topModuleName = topModuleName;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    public void setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
    }

    public String getInterfaceName() {
        return interfaceName;
    }

    public void setInterfaceName(String interfaceName) {
        this.interfaceName = interfaceName;
    }

    public String getBindInstanceName() {
        return bindInstanceName;
    }

    public void setBindInstanceName(String bindInstanceName) {
        this.bindInstanceName = bindInstanceName;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    public boolean isSkipUnobservable() {
        return skipUnobservable;
    }

    public void setSkipUnobservable(boolean skipUnobservable) {
        this.skipUnobservable = skipUnobservable;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public boolean isHelp() {
        return help;
    }

    public void setHelp(boolean help) {
        this.help = help;
    }
}
