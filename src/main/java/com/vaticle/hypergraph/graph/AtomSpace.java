/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.graph;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.common.iterator.FunctionalIterator;
import com.vaticle.hypergraph.common.parameters.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.SPACE_CLOSED;
import static com.vaticle.hypergraph.common.iterator.Iterators.empty;
import static com.vaticle.hypergraph.common.iterator.Iterators.iterate;
import static java.util.Collections.unmodifiableSet;

/**
 * A shared, mutable store of interned atoms with an incoming-set index.
 *
 * An atom space may be layered over a parent space as an overlay. Atoms added to an overlay, and
 * the incoming-set entries they create, are only visible through the overlay; lookups fall through
 * to the parent. Closing a transient overlay discards everything it holds.
 */
@ThreadSafe
public class AtomSpace implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AtomSpace.class);

    @Nullable
    private final AtomSpace parent;
    private final boolean isTransient;
    private final Options.Space options;
    private final ConcurrentMap<Atom, Atom> atoms;
    private final ConcurrentMap<Atom, Set<Link>> incoming;
    private final ConcurrentMap<AtomType, Set<Atom>> typeIndex;
    private final ReadWriteLock lock;
    private volatile boolean isOpen;

    public AtomSpace() {
        this(new Options.Space());
    }

    public AtomSpace(Options.Space options) {
        this(null, false, options);
    }

    private AtomSpace(@Nullable AtomSpace parent, boolean isTransient, Options.Space options) {
        this.parent = parent;
        this.isTransient = isTransient;
        this.options = options;
        this.atoms = new ConcurrentHashMap<>();
        this.incoming = new ConcurrentHashMap<>();
        this.typeIndex = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.isOpen = true;
    }

    public AtomSpace overlay(boolean isTransient) {
        validateIsOpen();
        LOG.trace("Opening {} overlay over atom space of size {}", isTransient ? "transient" : "persistent", size());
        return new AtomSpace(this, isTransient, options);
    }

    public Optional<AtomSpace> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isOverlay() {
        return parent != null;
    }

    public boolean isTransient() {
        return isTransient;
    }

    public Options.Space options() {
        return options;
    }

    public Atom add(Atom atom) {
        validateIsOpen();
        Optional<Atom> existing = get(atom);
        if (existing.isPresent()) return existing.get();

        lock.writeLock().lock();
        try {
            return addLocal(atom);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Atom addLocal(Atom atom) {
        Optional<Atom> existing = get(atom);
        if (existing.isPresent()) return existing.get();

        if (atom.isLink()) {
            for (Atom child : atom.asLink().outgoing()) {
                Atom interned = addLocal(child);
                incoming.computeIfAbsent(interned, c -> ConcurrentHashMap.newKeySet()).add(atom.asLink());
            }
        }
        atoms.put(atom, atom);
        typeIndex.computeIfAbsent(atom.type(), t -> ConcurrentHashMap.newKeySet()).add(atom);
        return atom;
    }

    public Optional<Atom> get(Atom atom) {
        validateIsOpen();
        lock.readLock().lock();
        try {
            Atom local = atoms.get(atom);
            if (local != null) return Optional.of(local);
        } finally {
            lock.readLock().unlock();
        }
        return parent != null ? parent.get(atom) : Optional.empty();
    }

    public boolean contains(Atom atom) {
        return get(atom).isPresent();
    }

    /**
     * @return true if the atom is held by this space itself, rather than inherited from a parent
     */
    public boolean containsLocally(Atom atom) {
        validateIsOpen();
        return atoms.containsKey(atom);
    }

    public Set<Link> incoming(Atom atom) {
        validateIsOpen();
        Set<Link> links = new HashSet<>();
        lock.readLock().lock();
        try {
            Set<Link> local = incoming.get(atom);
            if (local != null) links.addAll(local);
        } finally {
            lock.readLock().unlock();
        }
        if (parent != null) links.addAll(parent.incoming(atom));
        return unmodifiableSet(links);
    }

    public FunctionalIterator<Atom> atoms(AtomType type, boolean includeSubtypes) {
        validateIsOpen();
        List<Atom> matches = new ArrayList<>();
        lock.readLock().lock();
        try {
            typeIndex.forEach((t, index) -> {
                if (t == type || (includeSubtypes && t.isA(type))) matches.addAll(index);
            });
        } finally {
            lock.readLock().unlock();
        }
        FunctionalIterator<Atom> local = matches.isEmpty() ? empty() : iterate(matches);
        return parent != null ? local.link(parent.atoms(type, includeSubtypes)) : local;
    }

    public FunctionalIterator<Atom> atoms() {
        return atoms(AtomType.ATOM, true);
    }

    public boolean isA(AtomType type, AtomType parentType) {
        return type.isA(parentType);
    }

    public int size() {
        validateIsOpen();
        return atoms.size() + (parent != null ? parent.size() : 0);
    }

    public boolean isOpen() {
        return isOpen;
    }

    private void validateIsOpen() {
        if (!isOpen) throw HypergraphException.of(SPACE_CLOSED);
    }

    @Override
    public void close() {
        if (!isOpen) return;
        lock.writeLock().lock();
        try {
            isOpen = false;
            if (isTransient) {
                LOG.trace("Discarding {} atoms held by transient overlay", atoms.size());
                atoms.clear();
                incoming.clear();
                typeIndex.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
