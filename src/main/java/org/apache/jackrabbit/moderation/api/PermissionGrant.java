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
package org.apache.jackrabbit.moderation.api;

import java.util.Arrays;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Capabilities granted to a user on a node and, depending on the
 * {@link GrantScope}, on its children or descendants. A grant may also
 * register the user as moderator of the nodes it covers. A grant without a
 * node is global.
 */
public final class PermissionGrant {

    private final String userId;
    private final String nodeId;
    private final ImmutableSet<Capability> capabilities;
    private final boolean moderate;
    private final GrantScope scope;

    public PermissionGrant(@Nonnull String userId, @Nullable String nodeId,
                           @Nonnull Set<Capability> capabilities, boolean moderate,
                           @Nonnull GrantScope scope) {
        this.userId = checkNotNull(userId);
        this.nodeId = nodeId;
        this.capabilities = Sets.immutableEnumSet(capabilities);
        this.moderate = moderate;
        this.scope = checkNotNull(scope);
    }

    /**
     * Grants capabilities on {@code nodeId} and all its descendants.
     */
    public static PermissionGrant grant(@Nonnull String userId, @Nonnull String nodeId,
                                        Capability... capabilities) {
        return grant(userId, nodeId, GrantScope.PAGE_AND_DESCENDANTS, capabilities);
    }

    public static PermissionGrant grant(@Nonnull String userId, @Nonnull String nodeId,
                                        @Nonnull GrantScope scope, Capability... capabilities) {
        return new PermissionGrant(userId, checkNotNull(nodeId), ImmutableSet.copyOf(Arrays.asList(capabilities)), false, scope);
    }

    /**
     * Registers {@code userId} as moderator of {@code nodeId} and all its
     * descendants, without granting any capability.
     */
    public static PermissionGrant moderator(@Nonnull String userId, @Nonnull String nodeId) {
        return moderator(userId, nodeId, GrantScope.PAGE_AND_DESCENDANTS);
    }

    public static PermissionGrant moderator(@Nonnull String userId, @Nonnull String nodeId,
                                            @Nonnull GrantScope scope) {
        return new PermissionGrant(userId, checkNotNull(nodeId), ImmutableSet.<Capability>of(), true, scope);
    }

    /**
     * Grants capabilities everywhere, including the creation of top level nodes.
     */
    public static PermissionGrant global(@Nonnull String userId, Capability... capabilities) {
        return new PermissionGrant(userId, null, ImmutableSet.copyOf(Arrays.asList(capabilities)), false,
                GrantScope.PAGE_AND_DESCENDANTS);
    }

    @Nonnull
    public String getUserId() {
        return userId;
    }

    /**
     * @return the node this grant is attached to or {@code null} for a global grant
     */
    @CheckForNull
    public String getNodeId() {
        return nodeId;
    }

    public boolean isGlobal() {
        return nodeId == null;
    }

    @Nonnull
    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean isModerate() {
        return moderate;
    }

    @Nonnull
    public GrantScope getScope() {
        return scope;
    }

    /**
     * A grant that only registers a moderator takes no part in the
     * capability lookup.
     */
    public boolean isModeratorOnly() {
        return moderate && capabilities.isEmpty();
    }

    public boolean isEmpty() {
        return !moderate && capabilities.isEmpty();
    }

    public boolean covers(int distance) {
        return scope.covers(distance);
    }

    //------------------------------------------------------------< copies >---

    @Nonnull
    public PermissionGrant attachTo(@Nonnull String nodeId) {
        return new PermissionGrant(userId, checkNotNull(nodeId), capabilities, moderate, scope);
    }

    @Nonnull
    public PermissionGrant withoutCapabilities() {
        return new PermissionGrant(userId, nodeId, ImmutableSet.<Capability>of(), moderate, scope);
    }

    @Nonnull
    public PermissionGrant withoutModeration() {
        return new PermissionGrant(userId, nodeId, capabilities, false, scope);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PermissionGrant)) {
            return false;
        }
        PermissionGrant that = (PermissionGrant) other;
        return moderate == that.moderate && userId.equals(that.userId)
                && Objects.equal(nodeId, that.nodeId)
                && capabilities.equals(that.capabilities) && scope == that.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(userId, nodeId, capabilities, moderate, scope);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("user", userId)
                .add("node", nodeId)
                .add("capabilities", capabilities)
                .add("moderate", moderate)
                .add("scope", scope)
                .toString();
    }
}
