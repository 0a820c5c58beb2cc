/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * A single-pass iterator over store scans and join results. Draining it releases whatever it holds.
 */
public interface FunctionalIterator<T> extends Iterator<T> {

    FunctionalIterator<T> link(FunctionalIterator<T> iterator);

    List<T> toList();

    Set<T> toSet();

    void recycle();
}
