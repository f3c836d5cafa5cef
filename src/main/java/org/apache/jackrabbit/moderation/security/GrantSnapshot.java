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
package org.apache.jackrabbit.moderation.security;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import org.apache.jackrabbit.moderation.api.PermissionGrant;

/**
 * Immutable set of all active {@link PermissionGrant}s, indexed by the node
 * they are attached to. Global grants are kept apart.
 */
public final class GrantSnapshot {

    public static final GrantSnapshot EMPTY = new GrantSnapshot(ImmutableList.<PermissionGrant>of());

    private final ImmutableListMultimap<String, PermissionGrant> byNode;
    private final ImmutableListMultimap<String, PermissionGrant> global;

    private GrantSnapshot(Iterable<PermissionGrant> grants) {
        ImmutableListMultimap.Builder<String, PermissionGrant> nodeGrants = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<String, PermissionGrant> globalGrants = ImmutableListMultimap.builder();
        for (PermissionGrant grant : grants) {
            if (grant.isGlobal()) {
                globalGrants.put(grant.getUserId(), grant);
            } else {
                nodeGrants.put(grant.getNodeId(), grant);
            }
        }
        this.byNode = nodeGrants.build();
        this.global = globalGrants.build();
    }

    @Nonnull
    public static GrantSnapshot of(@Nonnull Iterable<PermissionGrant> grants) {
        return new GrantSnapshot(grants);
    }

    @Nonnull
    public static GrantSnapshot of(PermissionGrant... grants) {
        return new GrantSnapshot(ImmutableList.copyOf(grants));
    }

    /**
     * @return the grants attached to {@code nodeId}, for all users
     */
    @Nonnull
    public List<PermissionGrant> getGrants(@Nonnull String nodeId) {
        return byNode.get(nodeId);
    }

    @Nonnull
    public List<PermissionGrant> getGlobalGrants(@Nonnull String userId) {
        return global.get(userId);
    }

    @Nonnull
    public List<PermissionGrant> getGlobalGrants() {
        return ImmutableList.copyOf(global.values());
    }

    @Nonnull
    public List<PermissionGrant> getAll() {
        return ImmutableList.copyOf(Iterables.concat(global.values(), byNode.values()));
    }

    public boolean isEmpty() {
        return byNode.isEmpty() && global.isEmpty();
    }

    //------------------------------------------------------------< copies >---

    @Nonnull
    public GrantSnapshot with(@Nonnull Collection<PermissionGrant> grants) {
        if (grants.isEmpty()) {
            return this;
        }
        List<PermissionGrant> all = Lists.newArrayList(getAll());
        all.addAll(grants);
        return new GrantSnapshot(all);
    }

    @Nonnull
    public GrantSnapshot with(PermissionGrant... grants) {
        return with(ImmutableList.copyOf(grants));
    }

    /**
     * @return a snapshot without the grants attached to any of the given nodes
     */
    @Nonnull
    public GrantSnapshot withoutNodes(@Nonnull Set<String> nodeIds) {
        List<PermissionGrant> remaining = Lists.newArrayList();
        for (PermissionGrant grant : getAll()) {
            if (grant.isGlobal() || !nodeIds.contains(grant.getNodeId())) {
                remaining.add(grant);
            }
        }
        return new GrantSnapshot(remaining);
    }

    @Override
    public String toString() {
        return "GrantSnapshot" + getAll();
    }
}
