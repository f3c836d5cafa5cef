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
package org.apache.jackrabbit.moderation.workflow;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.apache.jackrabbit.moderation.api.Capability;
import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.User;

/**
 * Operations offered to the application managing the content tree. Every
 * mutating operation checks the permissions of the acting user first and
 * is applied atomically: when it fails, nothing has changed.
 */
public interface ModerationWorkflow {

    /**
     * Creates a node as first child of {@code parentId}, or as top level
     * node if {@code parentId} is {@code null}. Requires
     * {@link Capability#ADD} below the parent.
     *
     * @return the identifier of the new node
     */
    @Nonnull
    String create(@Nonnull User actor, @Nullable String parentId, @Nonnull String name)
            throws ModerationException;

    /**
     * Records an edit of a node, which returns it to
     * {@link ModerationState#CHANGED}. Requires {@link Capability#CHANGE}.
     */
    @Nonnull
    ModerationState edit(@Nonnull User actor, @Nonnull String nodeId) throws ModerationException;

    /**
     * Requests the publication of a node. Requires {@link Capability#CHANGE},
     * plus {@link Capability#PUBLISH} when nobody moderates the node.
     */
    @Nonnull
    ModerationState requestPublish(@Nonnull User actor, @Nonnull String nodeId) throws ModerationException;

    /**
     * Approves a node waiting for approval. The actor must moderate the node
     * or be a superuser, whatever the state of the node.
     */
    @Nonnull
    ModerationState approve(@Nonnull User actor, @Nonnull String nodeId) throws ModerationException;

    /**
     * Approves a node only if it did not change since the caller read it at
     * {@code expectedRevision}.
     *
     * @throws ModerationException of type {@link ModerationException#STATE}
     *         if the node changed in between
     */
    @Nonnull
    ModerationState approve(@Nonnull User actor, @Nonnull String nodeId, long expectedRevision)
            throws ModerationException;

    /**
     * Copies a subtree as first child of {@code targetParentId} using the
     * configured default {@link CopyOptions}.
     *
     * @return the identifier of the copy of {@code sourceId}
     */
    @Nonnull
    String copy(@Nonnull User actor, @Nonnull String sourceId, @Nonnull String targetParentId)
            throws ModerationException;

    /**
     * Copies a subtree as first child of {@code targetParentId}. Copies start
     * in {@link ModerationState#CHANGED} without public counterpart.
     * Requires {@link Capability#ADD} below the target.
     */
    @Nonnull
    String copy(@Nonnull User actor, @Nonnull String sourceId, @Nonnull String targetParentId,
                @Nonnull CopyOptions options) throws ModerationException;

    /**
     * Removes a node with its subtree, their counterparts and the grants
     * attached to them. Requires {@link Capability#DELETE}.
     */
    void delete(@Nonnull User actor, @Nonnull String nodeId) throws ModerationException;

    /**
     * @return the current state of a node
     */
    @Nonnull
    Node getNode(@Nonnull String nodeId) throws ModerationException;

    /**
     * @return number of moderators whose approval {@code nodeId} requires
     */
    int getModeratorCount(@Nonnull String nodeId) throws ModerationException;

    /**
     * @return {@code true} if {@code user} may perform {@code capability} on {@code nodeId}
     */
    boolean canPerform(@Nonnull User user, @Nonnull String nodeId, @Nonnull Capability capability)
            throws ModerationException;
}
