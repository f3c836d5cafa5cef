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
package org.apache.jackrabbit.moderation.state;

import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.Lists;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PublicCounterpart;
import org.apache.jackrabbit.moderation.api.TreePosition;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates, moves and removes the {@link PublicCounterpart}s of the nodes in a
 * tree, keeping the public tree a mirror of the draft tree. A node never has
 * a counterpart while one of its ancestors lacks one.
 */
public class PublicationPropagator {

    private static final Logger log = LoggerFactory.getLogger(PublicationPropagator.class);

    private final ContentTreeBuilder tree;

    public PublicationPropagator(@Nonnull ContentTreeBuilder tree) {
        this.tree = checkNotNull(tree);
    }

    /**
     * @return {@code true} if every ancestor of {@code node} has a public counterpart
     */
    public boolean isAncestorChainPublic(@Nonnull Node node) {
        for (Node ancestor : tree.getAncestors(node)) {
            if (!ancestor.hasPublicCounterpart()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Makes {@code node} publicly visible. Materializing a node whose
     * counterpart already mirrors its position returns that counterpart;
     * an outdated counterpart is replaced.
     *
     * @return the counterpart or {@code null} if an ancestor is not public yet
     */
    @CheckForNull
    public PublicCounterpart materialize(@Nonnull Node node) {
        Node current = tree.getNode(node.getId());
        if (!isAncestorChainPublic(current)) {
            log.debug("Ancestor of {} is not public, not materializing", current.getId());
            return null;
        }
        TreePosition position = tree.getPosition(current);
        PublicCounterpart existing = current.getPublicCounterpart();
        if (existing != null && existing.getPosition().equals(position)) {
            return existing;
        }
        PublicCounterpart counterpart = new PublicCounterpart(current.getId(), position, true);
        tree.setPublicCounterpart(current.getId(), counterpart);
        log.info("Published {} ({}) at {}", current.getName(), current.getId(), position);
        return counterpart;
    }

    /**
     * Moves every counterpart to the current position of its source node.
     *
     * @return number of counterparts that moved
     */
    public int realign() {
        int moved = 0;
        Map<String, TreePosition> positions = tree.getPositions();
        for (Node node : tree.getNodes()) {
            PublicCounterpart counterpart = node.getPublicCounterpart();
            if (counterpart != null) {
                PublicCounterpart aligned = counterpart.moveTo(positions.get(node.getId()));
                if (aligned != counterpart) {
                    tree.setPublicCounterpart(node.getId(), aligned);
                    moved++;
                }
            }
        }
        if (moved > 0) {
            log.debug("Realigned {} public counterparts", moved);
        }
        return moved;
    }

    /**
     * Removes the counterparts of {@code node} and of all its descendants.
     * Approved descendants wait for {@code node} to be published again.
     *
     * @return the nodes that lost their counterpart
     */
    @Nonnull
    public List<Node> retract(@Nonnull Node node) {
        List<Node> retracted = Lists.newArrayList();
        Node current = tree.getNode(node.getId());
        if (current.hasPublicCounterpart()) {
            retracted.add(tree.setPublicCounterpart(current.getId(), null));
        }
        for (Node descendant : tree.getDescendants(current)) {
            if (descendant.hasPublicCounterpart()) {
                Node updated = tree.setPublicCounterpart(descendant.getId(), null);
                if (updated.getState() == ModerationState.APPROVED) {
                    updated = tree.setState(updated.getId(), ModerationState.APPROVED_WAITING_FOR_PARENTS);
                }
                retracted.add(updated);
            }
        }
        if (!retracted.isEmpty()) {
            log.info("Retracted {} public counterparts below {}", retracted.size(), current.getId());
        }
        return retracted;
    }
}
