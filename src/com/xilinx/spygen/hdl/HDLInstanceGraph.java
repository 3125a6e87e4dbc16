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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Directed graph of module names with an edge from a module to every module type
 * it instantiates. Several instances of the same type share one edge.
 */
public class HDLInstanceGraph {

    private final Graph<String, DefaultEdge> graph;

    /**
     * Builds the graph of all modules of a registry. Instances of module types
     * missing from the registry are ignored.
     * @param registry The modules of the design
     */
    public HDLInstanceGraph(HDLModuleRegistry registry) {
        graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (HDLModule m : registry.getModules()) {
            graph.addVertex(m.getName());
        }
        for (HDLModule m : registry.getModules()) {
            for (HDLInstance inst : registry.getModuleInstances(m)) {
                String child = inst.getModuleTypeName();
                if (graph.containsVertex(child) && !graph.containsEdge(m.getName(), child)) {
                    graph.addEdge(m.getName(), child);
                }
            }
        }
    }

    /**
     * @return Names of the modules no other module instantiates, in the order the
     * modules were added.
     */
    public List<String> getTopCandidates() {
        List<String> result = new ArrayList<>();
        for (String v : graph.vertexSet()) {
            if (graph.inDegreeOf(v) == 0) {
                result.add(v);
            }
        }
        return result;
    }

    /**
     * @return Names of all modules that are part of an instantiation cycle, in the
     * order the modules were added.
     */
    public Set<String> getModulesOnCycles() {
        Set<String> onCycles = new CycleDetector<>(graph).findCycles();
        Set<String> result = new LinkedHashSet<>();
        for (String v : graph.vertexSet()) {
            if (onCycles.contains(v)) {
                result.add(v);
            }
        }
        return result;
    }
}
