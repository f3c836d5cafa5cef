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
package org.apache.jackrabbit.moderation.tree;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PublicCounterpart;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Mutable working copy of a {@link ContentTree}. Navigation always reflects
 * the changes made so far. Not thread-safe.
 */
public final class ContentTreeBuilder extends AbstractTreeNavigator {

    private final Map<String, Node> nodes;
    private final List<String> topLevelIds;

    public ContentTreeBuilder() {
        this(ImmutableMap.<String, Node>of(), ImmutableList.<String>of());
    }

    ContentTreeBuilder(@Nonnull Map<String, Node> nodes, @Nonnull List<String> topLevelIds) {
        this.nodes = Maps.newLinkedHashMap(nodes);
        this.topLevelIds = Lists.newArrayList(topLevelIds);
    }

    /**
     * Adds a new node as first child of {@code parentId}, or as last top
     * level node if {@code parentId} is {@code null}.
     *
     * @return the new node, in state {@link ModerationState#CHANGED}
     */
    @Nonnull
    public Node addNode(@Nullable String parentId, @Nonnull String name) {
        return addNode(UUID.randomUUID().toString(), parentId, name, 0);
    }

    /**
     * Adds a new node at {@code index} among the children of {@code parentId}.
     * The index is ignored for top level nodes, which are appended.
     */
    @Nonnull
    public Node addNode(@Nonnull String id, @Nullable String parentId, @Nonnull String name, int index) {
        checkArgument(!nodes.containsKey(id), "Node %s already exists", id);
        Node node = Node.create(id, name, parentId);
        if (parentId == null) {
            topLevelIds.add(id);
        } else {
            Node parent = getNode(parentId);
            List<String> childIds = Lists.newArrayList(parent.getChildIds());
            childIds.add(Math.min(Math.max(index, 0), childIds.size()), id);
            nodes.put(parentId, parent.withChildIds(childIds));
        }
        nodes.put(id, node);
        return node;
    }

    @Nonnull
    public Node setState(@Nonnull String id, @Nonnull ModerationState state) {
        return put(getNode(id).withState(state));
    }

    @Nonnull
    public Node setPublicCounterpart(@Nonnull String id, @Nullable PublicCounterpart counterpart) {
        checkArgument(counterpart == null || id.equals(counterpart.getSourceId()),
                "Counterpart %s does not belong to %s", counterpart, id);
        return put(getNode(id).withPublicCounterpart(counterpart));
    }

    /**
     * Marks a node as edited without changing its position.
     */
    @Nonnull
    public Node touch(@Nonnull String id) {
        return put(getNode(id).touch());
    }

    /**
     * Removes a node together with all its descendants.
     *
     * @return the removed nodes, the node itself first
     */
    @Nonnull
    public List<Node> removeSubtree(@Nonnull String id) {
        Node node = getNode(id);
        List<Node> removed = Lists.newArrayList(node);
        removed.addAll(getDescendants(node));

        Node parent = getParent(node);
        if (parent == null) {
            topLevelIds.remove(id);
        } else {
            List<String> childIds = Lists.newArrayList(parent.getChildIds());
            childIds.remove(id);
            nodes.put(parent.getId(), parent.withChildIds(childIds));
        }
        for (Node r : removed) {
            nodes.remove(r.getId());
        }
        return removed;
    }

    /**
     * @return an immutable snapshot of the current state of this builder
     */
    @Nonnull
    public ContentTree getContentTree() {
        return new ContentTree(nodes, topLevelIds);
    }

    //------------------------------------------------------------< internal >---

    private Node put(Node node) {
        nodes.put(node.getId(), node);
        return node;
    }

    @CheckForNull
    @Override
    protected Node lookup(@Nonnull String id) {
        return nodes.get(id);
    }

    @Nonnull
    @Override
    protected List<String> getTopLevelIds() {
        return topLevelIds;
    }

    @Override
    protected int size() {
        return nodes.size();
    }
}
