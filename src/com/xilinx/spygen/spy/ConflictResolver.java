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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives every spy entry a unique interface name. Entries whose names collide are
 * prefixed with their enclosing instance names, nearest first, one level at a
 * time, until no collision is left.
 */
public class ConflictResolver {

    public static List<SpyEntry> resolve(List<SpyEntry> entries, Collection<String> reservedNames) {
        return resolve(entries, reservedNames, new SpyNaming());
    }

    /**
     * Resolves the output names of a list of entries.
     * @param entries Entries with their bare names, in traversal order
     * @param reservedNames Names taken by the ports of the interface itself. Only top
     * level port entries may use them.
     * @param naming Prefix and separator of generated names
     * @return Renamed copies of entries, in the same order.
     * @throws UnresolvableConflictException if colliding entries run out of instance
     * names to tell them apart
     */
    public static List<SpyEntry> resolve(List<SpyEntry> entries, Collection<String> reservedNames,
                                         SpyNaming naming) {
        int n = entries.size();
        Set<String> reserved = new HashSet<>(reservedNames);
        List<List<String>> qualifiers = new ArrayList<>(n);
        int[] depth = new int[n];
        String[] names = new String[n];
        for (int i = 0; i < n; i++) {
            qualifiers.add(entries.get(i).getQualifiers());
            names[i] = makeName(entries.get(i), qualifiers.get(i), 0, naming);
        }

        while (true) {
            Map<String, List<Integer>> byName = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                byName.computeIfAbsent(names[i], k -> new ArrayList<>()).add(i);
            }
            Set<Integer> conflicted = new HashSet<>();
            for (List<Integer> group : byName.values()) {
                if (group.size() > 1) {
                    conflicted.addAll(group);
                }
            }
            for (int i = 0; i < n; i++) {
                if (!entries.get(i).isTopLevelPort() && reserved.contains(names[i])) {
                    conflicted.add(i);
                }
            }
            if (conflicted.isEmpty()) {
                break;
            }

            boolean progress = false;
            for (int i : conflicted) {
                if (depth[i] < qualifiers.get(i).size()) {
                    depth[i]++;
                    names[i] = makeName(entries.get(i), qualifiers.get(i), depth[i], naming);
                    progress = true;
                }
            }
            if (!progress) {
                throw unresolvable(entries, names, conflicted);
            }
        }

        List<SpyEntry> resolved = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            resolved.add(entries.get(i).withOutputName(names[i]));
        }
        return resolved;
    }

    /**
     * Builds the name of an entry using the given number of its innermost qualifiers.
     */
    static String makeName(SpyEntry entry, List<String> qualifiers, int depth, SpyNaming naming) {
        if (entry.isTopLevelPort()) {
            return entry.getBareName();
        }
        StringBuilder sb = new StringBuilder(naming.getPrefix());
        for (String q : qualifiers.subList(qualifiers.size() - depth, qualifiers.size())) {
            sb.append(q).append(naming.getSeparator());
        }
        sb.append(entry.getBareName());
        return sb.toString();
    }

    private static UnresolvableConflictException unresolvable(List<SpyEntry> entries, String[] names,
                                                              Set<Integer> conflicted) {
        // report the first stuck name in traversal order together with everything sharing it
        int first = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (conflicted.contains(i)) {
                first = i;
                break;
            }
        }
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (names[i].equals(names[first])) {
                paths.add(entries.get(i).getHierarchicalReference());
            }
        }
        return new UnresolvableConflictException(names[first], paths);
    }
}
