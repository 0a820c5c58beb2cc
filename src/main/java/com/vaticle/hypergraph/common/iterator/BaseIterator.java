/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.iterator;

import java.util.Iterator;

class BaseIterator<T> extends AbstractFunctionalIterator<T> {

    private final Iterator<T> iterator;

    BaseIterator(Iterator<T> iterator) {
        this.iterator = iterator;
    }

    @Override
    public boolean hasNext() {
        return iterator.hasNext();
    }

    @Override
    public T next() {
        return iterator.next();
    }

    @Override
    public void recycle() {
        if (iterator instanceof FunctionalIterator<?>) ((FunctionalIterator<?>) iterator).recycle();
    }
}
