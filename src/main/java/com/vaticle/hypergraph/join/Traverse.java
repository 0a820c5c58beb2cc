/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.graph.Atom;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The state of a single join execution.
 *
 * The replacement map pairs each grounded atom with what it will be rewritten to, initially the
 * variable it grounds. The join map holds, per declared variable, every atom grounded to it.
 */
class Traverse {

    private final Map<Atom, Atom> replaceMap;
    private final Set<Atom> overridden;
    private final List<Set<Atom>> joinMap;

    Traverse(int variableCount) {
        this.replaceMap = new LinkedHashMap<>();
        this.overridden = new HashSet<>();
        this.joinMap = new ArrayList<>(variableCount);
        for (int i = 0; i < variableCount; i++) joinMap.add(new LinkedHashSet<>());
    }

    void ground(int variableIndex, Atom value, Atom variable) {
        replaceMap.putIfAbsent(value, variable);
        joinMap.get(variableIndex).add(value);
    }

    void override(Atom grounded, Atom target) {
        assert replaceMap.containsKey(grounded);
        replaceMap.put(grounded, target);
        overridden.add(grounded);
    }

    Map<Atom, Atom> replaceMap() {
        return replaceMap;
    }

    /**
     * @return the entries of the replacement map that a replacement directive has retargeted
     */
    Map<Atom, Atom> replacements() {
        Map<Atom, Atom> replacements = new LinkedHashMap<>();
        for (Atom grounded : overridden) replacements.put(grounded, replaceMap.get(grounded));
        return replacements;
    }

    Set<Atom> joinMap(int variableIndex) {
        return joinMap.get(variableIndex);
    }

    int variableCount() {
        return joinMap.size();
    }
}
