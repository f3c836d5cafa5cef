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

import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable snapshot of a content node. A node owns the identifiers of its
 * children, never the child nodes themselves. Changes produce new instances
 * with an incremented revision.
 */
public final class Node {

    private final String id;
    private final String name;
    private final String parentId;
    private final ImmutableList<String> childIds;
    private final ModerationState state;
    private final PublicCounterpart publicCounterpart;
    private final long revision;

    public Node(@Nonnull String id, @Nonnull String name, @Nullable String parentId,
                @Nonnull List<String> childIds, @Nonnull ModerationState state,
                @Nullable PublicCounterpart publicCounterpart, long revision) {
        this.id = checkNotNull(id);
        this.name = checkNotNull(name);
        this.parentId = parentId;
        this.childIds = ImmutableList.copyOf(childIds);
        this.state = checkNotNull(state);
        this.publicCounterpart = publicCounterpart;
        this.revision = revision;
    }

    /**
     * Creates a new node without children in state {@link ModerationState#CHANGED}.
     */
    public static Node create(@Nonnull String id, @Nonnull String name, @Nullable String parentId) {
        return new Node(id, name, parentId, ImmutableList.<String>of(), ModerationState.CHANGED, null, 0);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * @return the parent identifier or {@code null} for a top level node
     */
    @CheckForNull
    public String getParentId() {
        return parentId;
    }

    public boolean isTopLevel() {
        return parentId == null;
    }

    @Nonnull
    public List<String> getChildIds() {
        return childIds;
    }

    @Nonnull
    public ModerationState getState() {
        return state;
    }

    @CheckForNull
    public PublicCounterpart getPublicCounterpart() {
        return publicCounterpart;
    }

    public boolean hasPublicCounterpart() {
        return publicCounterpart != null;
    }

    public long getRevision() {
        return revision;
    }

    //------------------------------------------------------------< copies >---

    @Nonnull
    public Node withState(@Nonnull ModerationState state) {
        return new Node(id, name, parentId, childIds, state, publicCounterpart, revision + 1);
    }

    /**
     * Same node with a new counterpart. The revision is kept.
     */
    @Nonnull
    public Node withPublicCounterpart(@Nullable PublicCounterpart counterpart) {
        return new Node(id, name, parentId, childIds, state, counterpart, revision);
    }

    @Nonnull
    public Node withChildIds(@Nonnull List<String> childIds) {
        return new Node(id, name, parentId, childIds, state, publicCounterpart, revision);
    }

    /**
     * Marks the node as edited.
     */
    @Nonnull
    public Node touch() {
        return new Node(id, name, parentId, childIds, state, publicCounterpart, revision + 1);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("parent", parentId)
                .add("state", state)
                .add("public", publicCounterpart != null)
                .add("revision", revision)
                .toString();
    }
}
