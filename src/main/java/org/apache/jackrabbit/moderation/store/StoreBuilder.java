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

import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.apache.jackrabbit.moderation.security.GrantSnapshot;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Working copy of a {@link StoreSnapshot} used by one unit of work.
 */
public final class StoreBuilder {

    private final StoreSnapshot base;
    private final ContentTreeBuilder tree;
    private GrantSnapshot grants;

    StoreBuilder(@Nonnull StoreSnapshot base) {
        this.base = checkNotNull(base);
        this.tree = base.getTree().builder();
        this.grants = base.getGrants();
    }

    @Nonnull
    public StoreSnapshot getBase() {
        return base;
    }

    @Nonnull
    public ContentTreeBuilder getTree() {
        return tree;
    }

    @Nonnull
    public GrantSnapshot getGrants() {
        return grants;
    }

    public void setGrants(@Nonnull GrantSnapshot grants) {
        this.grants = checkNotNull(grants);
    }

    public void addGrants(PermissionGrant... grants) {
        this.grants = this.grants.with(grants);
    }

    /**
     * @return the state of this builder as the revision following its base
     */
    @Nonnull
    public StoreSnapshot getSnapshot() {
        return new StoreSnapshot(tree.getContentTree(), grants, base.getRevision() + 1);
    }
}
