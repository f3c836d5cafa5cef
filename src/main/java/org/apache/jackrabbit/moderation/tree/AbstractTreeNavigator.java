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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.TreePosition;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Navigation shared by the immutable {@link ContentTree} and the mutable
 * {@link ContentTreeBuilder}. Subclasses only provide lookup by identifier
 * and the list of top level nodes.
 */
abstract class AbstractTreeNavigator implements TreeNavigator {

    @CheckForNull
    protected abstract Node lookup(@Nonnull String id);

    @Nonnull
    protected abstract List<String> getTopLevelIds();

    /**
     * @return number of nodes, bounds the length of any ancestor chain
     */
    protected abstract int size();

    @Nonnull
    @Override
    public Node getNode(@Nonnull String id) {
        Node node = lookup(id);
        checkArgument(node != null, "No such node: %s", id);
        return node;
    }

    @Override
    public boolean exists(@Nonnull String id) {
        return lookup(id) != null;
    }

    @CheckForNull
    @Override
    public Node getParent(@Nonnull Node node) {
        String parentId = node.getParentId();
        return parentId == null ? null : getNode(parentId);
    }

    @Nonnull
    @Override
    public List<Node> getAncestors(@Nonnull Node node) {
        List<Node> ancestors = Lists.newArrayList();
        Node parent = getParent(node);
        while (parent != null) {
            checkState(ancestors.size() < size(), "Cyclic ancestor chain at %s", node.getId());
            ancestors.add(parent);
            parent = getParent(parent);
        }
        return Lists.reverse(ancestors);
    }

    @Nonnull
    @Override
    public List<Node> getChildren(@Nonnull Node node) {
        List<Node> children = Lists.newArrayListWithCapacity(node.getChildIds().size());
        for (String childId : node.getChildIds()) {
            children.add(getNode(childId));
        }
        return children;
    }

    @Nonnull
    @Override
    public List<Node> getDescendants(@Nonnull Node node) {
        List<Node> descendants = Lists.newArrayList();
        collectDescendants(node, descendants);
        return descendants;
    }

    @Override
    public boolean isDescendantOf(@Nonnull Node node, @Nonnull Node ancestor) {
        for (Node candidate : getAncestors(node)) {
            if (candidate.getId().equals(ancestor.getId())) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    @Override
    public List<Node> getTopLevelNodes() {
        List<Node> nodes = Lists.newArrayList();
        for (String id : getTopLevelIds()) {
            nodes.add(getNode(id));
        }
        return nodes;
    }

    @Nonnull
    @Override
    public List<Node> getNodes() {
        List<Node> nodes = Lists.newArrayListWithCapacity(size());
        for (Node top : getTopLevelNodes()) {
            nodes.add(top);
            collectDescendants(top, nodes);
        }
        return nodes;
    }

    @Nonnull
    @Override
    public TreePosition getPosition(@Nonnull Node node) {
        List<Node> ancestors = getAncestors(node);
        Node top = ancestors.isEmpty() ? node : ancestors.get(0);
        Map<String, TreePosition> positions = Maps.newHashMap();
        number(this, top, top.getId(), 1, 0, positions);
        return positions.get(node.getId());
    }

    @Nonnull
    @Override
    public Map<String, TreePosition> getPositions() {
        Map<String, TreePosition> positions = Maps.newHashMapWithExpectedSize(size());
        for (Node top : getTopLevelNodes()) {
            number(this, top, top.getId(), 1, 0, positions);
        }
        return positions;
    }

    //------------------------------------------------------------< internal >---

    /**
     * Assigns nested set bounds to the subtree rooted at {@code node}.
     *
     * @return the next free ordering key
     */
    private static int number(TreeNavigator tree, Node node, String treeId, int left, int level,
                              Map<String, TreePosition> positions) {
        int next = left + 1;
        for (Node child : tree.getChildren(node)) {
            next = number(tree, child, treeId, next, level + 1, positions);
        }
        positions.put(node.getId(), new TreePosition(node.getId(), treeId, left, next, node.getParentId(), level));
        return next + 1;
    }

    private void collectDescendants(Node node, List<Node> result) {
        for (Node child : getChildren(node)) {
            result.add(child);
            collectDescendants(child, result);
        }
    }
}
