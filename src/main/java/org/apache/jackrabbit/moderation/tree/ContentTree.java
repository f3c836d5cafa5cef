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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.TreePosition;

/**
 * Immutable snapshot of the content hierarchy. Instances are safe to share
 * between threads; changes are made on a {@link ContentTreeBuilder} which
 * produces a new snapshot.
 */
public final class ContentTree extends AbstractTreeNavigator {

    public static final ContentTree EMPTY =
            new ContentTree(ImmutableMap.<String, Node>of(), ImmutableList.<String>of());

    private final ImmutableMap<String, Node> nodes;
    private final ImmutableList<String> topLevelIds;

    private final Supplier<Map<String, TreePosition>> positions =
            Suppliers.memoize(new Supplier<Map<String, TreePosition>>() {
                @Override
                public Map<String, TreePosition> get() {
                    return ImmutableMap.copyOf(ContentTree.super.getPositions());
                }
            });

    ContentTree(@Nonnull Map<String, Node> nodes, @Nonnull List<String> topLevelIds) {
        this.nodes = ImmutableMap.copyOf(nodes);
        this.topLevelIds = ImmutableList.copyOf(topLevelIds);
    }

    @Nonnull
    public ContentTreeBuilder builder() {
        return new ContentTreeBuilder(nodes, topLevelIds);
    }

    @Nonnull
    @Override
    public TreePosition getPosition(@Nonnull Node node) {
        TreePosition position = positions.get().get(node.getId());
        if (position == null) {
            return super.getPosition(node);
        }
        return position;
    }

    @Nonnull
    @Override
    public Map<String, TreePosition> getPositions() {
        return positions.get();
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

    @Override
    public String toString() {
        return "ContentTree" + topLevelIds + " (" + nodes.size() + " nodes)";
    }
}
