/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.iterator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.hypergraph.common.collection.Collections.list;

public abstract class AbstractFunctionalIterator<T> implements FunctionalIterator<T> {

    @Override
    public FunctionalIterator<T> link(FunctionalIterator<T> iterator) {
        return new LinkedIterators<>(list(this, iterator));
    }

    @Override
    public List<T> toList() {
        List<T> list = new ArrayList<>();
        while (hasNext()) list.add(next());
        recycle();
        return list;
    }

    @Override
    public Set<T> toSet() {
        Set<T> set = new LinkedHashSet<>();
        while (hasNext()) set.add(next());
        recycle();
        return set;
    }
}
