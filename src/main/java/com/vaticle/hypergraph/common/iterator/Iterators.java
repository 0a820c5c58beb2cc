/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.iterator;

import java.util.Collection;

import static com.vaticle.hypergraph.common.collection.Collections.list;

public class Iterators {

    private Iterators() {}

    public static <T> FunctionalIterator<T> empty() {
        return iterate(list());
    }

    public static <T> FunctionalIterator<T> iterate(Collection<T> collection) {
        return new BaseIterator<>(collection.iterator());
    }
}
