/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.producer;

import com.vaticle.hypergraph.common.collection.Either;
import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.common.iterator.AbstractFunctionalIterator;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.UNEXPECTED_INTERRUPTION;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.RESULT_CHANNEL_CLOSED;

/**
 * A closeable, single-producer single-consumer result channel.
 *
 * The producer {@link #put(Object)}s items and then signals completion with {@link #done()} or
 * {@link #done(Throwable)}. The consumer iterates, blocking until an item or the completion signal
 * arrives. Iteration is single-pass: once completion has been observed the channel cannot be restarted.
 */
@ThreadSafe
public class ResultQueue<T> extends AbstractFunctionalIterator<T> {

    private final LinkedBlockingQueue<Either<Result<T>, Done>> blockingQueue;
    private volatile boolean closed;
    private T next;
    private State state;

    public ResultQueue() {
        this.blockingQueue = new LinkedBlockingQueue<>();
        this.closed = false;
        this.state = State.EMPTY;
    }

    private enum State {EMPTY, FETCHED, COMPLETED}

    public synchronized void put(T item) {
        if (closed) throw HypergraphException.of(RESULT_CHANNEL_CLOSED);
        try {
            blockingQueue.put(Either.first(new Result<>(item)));
        } catch (InterruptedException e) {
            throw HypergraphException.of(UNEXPECTED_INTERRUPTION);
        }
    }

    public synchronized void done() {
        done(null);
    }

    public synchronized void done(@Nullable Throwable error) {
        if (closed) return;
        closed = true;
        try {
            if (error != null) blockingQueue.put(Either.second(Done.error(error)));
            else blockingQueue.put(Either.second(Done.success()));
        } catch (InterruptedException e) {
            throw HypergraphException.of(UNEXPECTED_INTERRUPTION);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean hasNext() {
        if (state == State.COMPLETED) return false;
        else if (state == State.FETCHED) return true;

        Either<Result<T>, Done> result = take();
        if (result.isFirst()) {
            next = result.first().value();
            state = State.FETCHED;
        } else {
            state = State.COMPLETED;
            Optional<Throwable> error = result.second().error();
            if (error.isPresent()) {
                if (error.get() instanceof HypergraphException) throw (HypergraphException) error.get();
                else throw new RuntimeException(error.get());
            }
        }
        return state == State.FETCHED;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        state = State.EMPTY;
        return next;
    }

    @Override
    public void recycle() {
    }

    private Either<Result<T>, Done> take() {
        try {
            return blockingQueue.take();
        } catch (InterruptedException e) {
            throw HypergraphException.of(UNEXPECTED_INTERRUPTION);
        }
    }

    private static class Result<T> {

        private final T value;

        private Result(T value) {
            this.value = value;
        }

        private T value() {
            return value;
        }
    }

    private static class Done {

        @Nullable
        private final Throwable error;

        private Done(@Nullable Throwable error) {
            this.error = error;
        }

        private static Done success() {
            return new Done(null);
        }

        private static Done error(Throwable e) {
            return new Done(e);
        }

        private Optional<Throwable> error() {
            return Optional.ofNullable(error);
        }
    }
}
