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

package com.xilinx.spygen.util;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A set of utility methods for reading, writing and finding RTL source files.
 */
public class FileTools {

    public static final String SYSTEM_VERILOG_EXTENSION = ".sv";

    public static final String VERILOG_EXTENSION = ".v";

    /**
     * Reads the complete contents of a text file as UTF-8.
     * @param fileName Path of the text file to load.
     * @return The file contents.
     */
    public static String readTextFile(Path fileName) {
        try {
            return new String(Files.readAllBytes(fileName), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
    }

    /**
     * This is a simple method that writes a String to a file and adds a new line.
     * @param text the String to write to the file
     * @param fileName Name of the text file to write
     */
    public static void writeStringToTextFile(String text, String fileName) {
        String nl = System.lineSeparator();
        try (FileWriter fw = new FileWriter(fileName, StandardCharsets.UTF_8);
            BufferedWriter bw = new BufferedWriter(fw)) {
            bw.write(text + nl);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write file: " +
                fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets the extension of a file name including the leading dot.
     * @param fileName Name of the file.
     * @return The extension (for example ".sv"), or an empty string if there is none.
     */
    public static String getFileExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int sep = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf(File.separatorChar));
        if (dot <= sep + 1) {
            return "";
        }
        return fileName.substring(dot);
    }

    /**
     * Expands a list of files and directories into the list of source files they
     * contain. Files given explicitly are always kept. Directories are searched
     * recursively for files whose extension (case-insensitive) is one of extensions.
     * The result is sorted within each directory so that repeated runs see the files
     * in the same order.
     * @param inputs Files and/or directories.
     * @param extensions Extensions including the leading dot, e.g. ".sv".
     * @return The ordered list of matching files.
     */
    public static List<Path> findFiles(Collection<Path> inputs, Collection<String> extensions) {
        List<String> lowerExtensions = extensions.stream()
                .map(e -> e.startsWith(".") ? e : "." + e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    walk.filter(Files::isRegularFile)
                        .filter(p -> lowerExtensions.contains(
                                getFileExtension(p.getFileName().toString()).toLowerCase(Locale.ROOT)))
                        .sorted()
                        .forEach(files::add);
                } catch (IOException e) {
                    throw new UncheckedIOException("ERROR: Could not list directory: " + input, e);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new UncheckedIOException(new NoSuchFileException(input.toString(), null,
                        "ERROR: Input is neither a file nor a directory"));
            }
        }
        return files;
    }
}
