/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.moderation.store;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nonnull;

import org.apache.jackrabbit.moderation.api.ModerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds the current {@link StoreSnapshot} and applies units of work to it
 * one at a time. A unit of work either becomes visible as a whole, after
 * passing the commit hook, or not at all. Readers always see a complete
 * snapshot.
 */
public class ModerationStore {

    private static final Logger log = LoggerFactory.getLogger(ModerationStore.class);

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    private final CommitHook hook;

    private StoreSnapshot head;

    public ModerationStore() {
        this(StoreSnapshot.EMPTY);
    }

    public ModerationStore(@Nonnull StoreSnapshot initial) {
        this(initial, createDefaultHook());
    }

    public ModerationStore(@Nonnull StoreSnapshot initial, @Nonnull CommitHook hook) {
        this.head = checkNotNull(initial);
        this.hook = checkNotNull(hook);
    }

    /**
     * @return the hook aligning the public tree and validating the
     *         publication invariant and the grant references
     */
    @Nonnull
    public static CommitHook createDefaultHook() {
        return new CompositeHook(
                new PublicTreeAlignmentHook(),
                new PublicationInvariantHook(),
                new GrantReferenceHook());
    }

    /**
     * @return the latest committed snapshot
     */
    @Nonnull
    public StoreSnapshot getHead() {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            return head;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code work} on a builder of the latest snapshot and commits the
     * result. Units of work are serialized.
     *
     * @return the result of {@code work}
     * @throws ModerationException if {@code work} or the commit hook fails,
     *         in which case nothing is committed
     */
    public <T> T execute(@Nonnull UnitOfWork<T> work) throws ModerationException {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            StoreSnapshot before = head;
            StoreBuilder builder = before.builder();
            T result = work.run(builder);
            head = hook.processCommit(before, builder.getSnapshot());
            log.debug("Committed revision {}", head.getRevision());
            return result;
        } catch (ModerationException e) {
            log.debug("Unit of work rejected: {}", e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }
}
