/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.collection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class Collections {

    @SafeVarargs
    public static <T> Set<T> set(T... elements) {
        return set(Arrays.asList(elements));
    }

    public static <T> Set<T> set(Collection<T> elements) {
        Set<T> set = new HashSet<>(elements);
        return java.util.Collections.unmodifiableSet(set);
    }

    @SafeVarargs
    public static <T> List<T> list(T... elements) {
        return list(Arrays.asList(elements));
    }

    public static <T> List<T> list(Collection<T> elements) {
        List<T> list = new ArrayList<>(elements);
        return java.util.Collections.unmodifiableList(list);
    }
}
