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

import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.TreePosition;

/**
 * Read-only navigation over the content hierarchy. Passing the identifier of
 * a node the tree does not contain is a programming error and results in an
 * {@code IllegalArgumentException}.
 */
public interface TreeNavigator {

    /**
     * @param id node identifier
     * @return the node with the given identifier
     * @throws IllegalArgumentException if there is no such node
     */
    @Nonnull
    Node getNode(@Nonnull String id);

    boolean exists(@Nonnull String id);

    /**
     * @return the parent of {@code node} or {@code null} for a top level node
     */
    @CheckForNull
    Node getParent(@Nonnull Node node);

    /**
     * Returns the ancestors of a node ordered from the top level node down to
     * the node's parent. Empty for a top level node.
     */
    @Nonnull
    List<Node> getAncestors(@Nonnull Node node);

    /**
     * @return the children of {@code node} in their order
     */
    @Nonnull
    List<Node> getChildren(@Nonnull Node node);

    /**
     * Returns all descendants of a node in pre-order: every node comes
     * before its own descendants.
     */
    @Nonnull
    List<Node> getDescendants(@Nonnull Node node);

    /**
     * @return {@code true} if {@code node} lies strictly below {@code ancestor}
     */
    boolean isDescendantOf(@Nonnull Node node, @Nonnull Node ancestor);

    /**
     * @return the nodes without parent, in their order
     */
    @Nonnull
    List<Node> getTopLevelNodes();

    /**
     * @return all nodes of the tree in pre-order
     */
    @Nonnull
    List<Node> getNodes();

    /**
     * @return the structural position of {@code node}
     */
    @Nonnull
    TreePosition getPosition(@Nonnull Node node);

    /**
     * Numbers every top level tree once.
     *
     * @return the positions of all nodes keyed by node identifier
     */
    @Nonnull
    Map<String, TreePosition> getPositions();
}
