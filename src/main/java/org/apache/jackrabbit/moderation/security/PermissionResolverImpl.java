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

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.Sets;
import org.apache.jackrabbit.moderation.api.Capability;
import org.apache.jackrabbit.moderation.api.ModeratorAssignment;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.apache.jackrabbit.moderation.api.User;
import org.apache.jackrabbit.moderation.tree.TreeNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Default {@link PermissionResolver} working on an explicit tree and grant
 * snapshot. Superusers are granted everything.
 */
public class PermissionResolverImpl implements PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolverImpl.class);

    private final TreeNavigator tree;
    private final GrantSnapshot grants;

    public PermissionResolverImpl(@Nonnull TreeNavigator tree, @Nonnull GrantSnapshot grants) {
        this.tree = checkNotNull(tree);
        this.grants = checkNotNull(grants);
    }

    @Override
    public boolean canPerform(@Nonnull User user, @Nonnull Node node, @Nonnull Capability capability) {
        if (user.isSuperuser()) {
            return true;
        }
        boolean granted = findCapabilities(user, node, 0).contains(capability);
        log.debug("{} {} on {}: {}", user.getId(), capability, node.getId(), granted ? "granted" : "denied");
        return granted;
    }

    @Override
    public boolean canAddChild(@Nonnull User user, @Nullable Node parent) {
        if (user.isSuperuser()) {
            return true;
        }
        Set<Capability> capabilities = (parent == null)
                ? getGlobalCapabilities(user)
                : findCapabilities(user, parent, 1);
        boolean granted = capabilities.contains(Capability.ADD);
        log.debug("{} ADD below {}: {}", user.getId(), parent == null ? "top level" : parent.getId(),
                granted ? "granted" : "denied");
        return granted;
    }

    @Nonnull
    @Override
    public Set<Capability> getCapabilities(@Nonnull User user, @Nonnull Node node) {
        if (user.isSuperuser()) {
            return Collections.unmodifiableSet(EnumSet.allOf(Capability.class));
        }
        return Collections.unmodifiableSet(findCapabilities(user, node, 0));
    }

    @Nonnull
    @Override
    public Set<ModeratorAssignment> getModerators(@Nonnull Node node) {
        Set<ModeratorAssignment> moderators = Sets.newLinkedHashSet();
        Node current = node;
        int distance = 0;
        while (current != null) {
            for (PermissionGrant grant : grants.getGrants(current.getId())) {
                if (grant.isModerate() && grant.covers(distance)) {
                    moderators.add(ModeratorAssignment.of(grant));
                }
            }
            current = tree.getParent(current);
            distance++;
        }
        for (PermissionGrant grant : grants.getGlobalGrants()) {
            if (grant.isModerate()) {
                moderators.add(ModeratorAssignment.of(grant));
            }
        }
        return moderators;
    }

    @Override
    public int getModeratorCount(@Nonnull Node node) {
        return getModerators(node).size();
    }

    @Override
    public boolean isModerator(@Nonnull User user, @Nonnull Node node) {
        for (ModeratorAssignment moderator : getModerators(node)) {
            if (moderator.getUserId().equals(user.getId())) {
                return true;
            }
        }
        return false;
    }

    //------------------------------------------------------------< private >---

    /**
     * Walks up from {@code node} to the first node carrying a grant for
     * {@code user} that covers the checked position, falling back to the
     * user's global grants.
     *
     * @param offset distance of the checked position below {@code node}
     */
    @Nonnull
    private Set<Capability> findCapabilities(User user, Node node, int offset) {
        Node current = node;
        int distance = offset;
        while (current != null) {
            Set<Capability> capabilities = collect(grants.getGrants(current.getId()), user, distance);
            if (capabilities != null) {
                return capabilities;
            }
            current = tree.getParent(current);
            distance++;
        }
        return getGlobalCapabilities(user);
    }

    @Nonnull
    private Set<Capability> getGlobalCapabilities(User user) {
        Set<Capability> capabilities = collect(grants.getGlobalGrants(user.getId()), user, 0);
        return capabilities == null ? EnumSet.noneOf(Capability.class) : capabilities;
    }

    /**
     * @return the union of the matching grants or {@code null} if none matches
     */
    @CheckForNull
    private static Set<Capability> collect(List<PermissionGrant> candidates, User user, int distance) {
        Set<Capability> capabilities = null;
        for (PermissionGrant grant : candidates) {
            if (!grant.getUserId().equals(user.getId()) || grant.isModeratorOnly()) {
                continue;
            }
            if (!grant.isGlobal() && !grant.covers(distance)) {
                continue;
            }
            if (capabilities == null) {
                capabilities = EnumSet.noneOf(Capability.class);
            }
            capabilities.addAll(grant.getCapabilities());
        }
        return capabilities;
    }
}
