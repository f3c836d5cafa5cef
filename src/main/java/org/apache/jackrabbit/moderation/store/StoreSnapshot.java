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

import javax.annotation.Nonnull;

import org.apache.jackrabbit.moderation.security.GrantSnapshot;
import org.apache.jackrabbit.moderation.tree.ContentTree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable state of a {@link ModerationStore} at one revision: the content
 * tree together with the grants that apply to it.
 */
public final class StoreSnapshot {

    public static final StoreSnapshot EMPTY = new StoreSnapshot(ContentTree.EMPTY, GrantSnapshot.EMPTY, 0);

    private final ContentTree tree;
    private final GrantSnapshot grants;
    private final long revision;

    public StoreSnapshot(@Nonnull ContentTree tree, @Nonnull GrantSnapshot grants, long revision) {
        this.tree = checkNotNull(tree);
        this.grants = checkNotNull(grants);
        this.revision = revision;
    }

    @Nonnull
    public ContentTree getTree() {
        return tree;
    }

    @Nonnull
    public GrantSnapshot getGrants() {
        return grants;
    }

    public long getRevision() {
        return revision;
    }

    @Nonnull
    public StoreBuilder builder() {
        return new StoreBuilder(this);
    }

    @Override
    public String toString() {
        return "StoreSnapshot r" + revision + ' ' + tree;
    }
}
