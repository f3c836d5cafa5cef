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

import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.apache.jackrabbit.moderation.api.Capability;
import org.apache.jackrabbit.moderation.api.ModeratorAssignment;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.User;

/**
 * Evaluates permissions and moderator assignments against one consistent
 * snapshot of the tree and the grants. Implementations have no side effects.
 * <p>
 * Capabilities follow the nearest grant: the grant closest to the node wins
 * and grants on different levels are never merged. Moderators on the other
 * hand accumulate over all levels above a node.
 */
public interface PermissionResolver {

    /**
     * @param user       the acting user
     * @param node       the target node
     * @param capability the requested capability
     * @return {@code true} if {@code user} may perform {@code capability} on {@code node}
     */
    boolean canPerform(@Nonnull User user, @Nonnull Node node, @Nonnull Capability capability);

    /**
     * Checks whether {@code user} may add a child to {@code parent}. The
     * scope of each grant is evaluated for the position of the new child,
     * so a grant covering only the descendants of a node allows adding
     * children to it.
     *
     * @param parent the future parent or {@code null} for a top level node,
     *               which only global grants allow
     */
    boolean canAddChild(@Nonnull User user, @Nullable Node parent);

    /**
     * @return the capabilities of the grant that decides for {@code user} on {@code node}
     */
    @Nonnull
    Set<Capability> getCapabilities(@Nonnull User user, @Nonnull Node node);

    /**
     * @return all moderators whose approval is required for {@code node}
     */
    @Nonnull
    Set<ModeratorAssignment> getModerators(@Nonnull Node node);

    int getModeratorCount(@Nonnull Node node);

    /**
     * @return {@code true} if {@code user} is one of the moderators of {@code node}
     */
    boolean isModerator(@Nonnull User user, @Nonnull Node node);
}
