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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Structural identity of a node inside its tree: the nested set bounds of
 * a pre-order numbering, the parent and the depth. A node and its
 * {@link PublicCounterpart} share the same position.
 */
public final class TreePosition {

    private final String id;
    private final String treeId;
    private final int left;
    private final int right;
    private final String parentId;
    private final int level;

    public TreePosition(@Nonnull String id, @Nonnull String treeId, int left, int right,
                        @CheckForNull String parentId, int level) {
        this.id = checkNotNull(id);
        this.treeId = checkNotNull(treeId);
        this.left = left;
        this.right = right;
        this.parentId = parentId;
        this.level = level;
    }

    @Nonnull
    public String getId() {
        return id;
    }

    /**
     * @return identifier of the top level node of the tree this position belongs to
     */
    @Nonnull
    public String getTreeId() {
        return treeId;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    @CheckForNull
    public String getParentId() {
        return parentId;
    }

    /**
     * @return the depth, {@code 0} for top level nodes
     */
    public int getLevel() {
        return level;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TreePosition)) {
            return false;
        }
        TreePosition that = (TreePosition) other;
        return left == that.left && right == that.right && level == that.level
                && id.equals(that.id) && treeId.equals(that.treeId)
                && Objects.equal(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, treeId, left, right, parentId, level);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("tree", treeId)
                .add("lft", left)
                .add("rght", right)
                .add("parent", parentId)
                .add("level", level)
                .toString();
    }
}
