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

import javax.annotation.Nonnull;

import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.User;
import org.apache.jackrabbit.moderation.security.PermissionResolver;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.jackrabbit.moderation.api.ModerationState.APPROVED;
import static org.apache.jackrabbit.moderation.api.ModerationState.APPROVED_WAITING_FOR_PARENTS;
import static org.apache.jackrabbit.moderation.api.ModerationState.CHANGED;
import static org.apache.jackrabbit.moderation.api.ModerationState.NEED_APPROVEMENT;

/**
 * Drives the {@link ModerationState} of the nodes in a tree. All transitions
 * are applied to the given builder; committing them is up to the caller.
 * <p>
 * A node that reaches {@code APPROVED} gets its public counterpart and
 * promotes the descendants that were only waiting for it, top-down.
 */
public class ModerationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ModerationStateMachine.class);

    private final ContentTreeBuilder tree;
    private final PermissionResolver resolver;
    private final PublicationPropagator propagator;

    public ModerationStateMachine(@Nonnull ContentTreeBuilder tree, @Nonnull PermissionResolver resolver,
                                  @Nonnull PublicationPropagator propagator) {
        this.tree = checkNotNull(tree);
        this.resolver = checkNotNull(resolver);
        this.propagator = checkNotNull(propagator);
    }

    /**
     * Records an edit. An existing public counterpart is left untouched.
     */
    @Nonnull
    public ModerationState edit(@Nonnull Node node) {
        Node current = tree.touch(node.getId());
        if (current.getState() != CHANGED) {
            transition(current, CHANGED);
        }
        return CHANGED;
    }

    /**
     * Submits a node for publication. Without moderators in scope the node
     * is approved right away, otherwise it waits for their approval.
     */
    @Nonnull
    public ModerationState requestPublish(@Nonnull Node node) {
        Node current = tree.getNode(node.getId());
        if (current.getState().isApproved()) {
            return current.getState();
        }
        if (resolver.getModeratorCount(current) == 0) {
            return publish(current);
        }
        if (current.getState() != NEED_APPROVEMENT) {
            transition(current, NEED_APPROVEMENT);
        }
        return NEED_APPROVEMENT;
    }

    /**
     * Approves a node on behalf of {@code user}, who must moderate the node
     * or be a superuser. Approving an approved node changes nothing.
     *
     * @throws ModerationException if {@code user} does not moderate the node
     *         or the node is not waiting for approval
     */
    @Nonnull
    public ModerationState approve(@Nonnull User user, @Nonnull Node node) throws ModerationException {
        Node current = tree.getNode(node.getId());
        if (!user.isSuperuser() && !resolver.isModerator(user, current)) {
            throw ModerationException.permissionDenied(
                    user.getId() + " does not moderate " + current.getId());
        }
        ModerationState state = current.getState();
        if (state.isApproved()) {
            log.debug("{} is already {}", current.getId(), state);
            return state;
        }
        if (state != NEED_APPROVEMENT) {
            throw ModerationException.invalidStateTransition(
                    "Cannot approve " + current.getId() + " in state " + state);
        }
        return publish(current);
    }

    /**
     * Promotes the waiting descendants of {@code node} whose ancestors are
     * all public by now, parents before their children.
     *
     * @return number of promoted nodes
     */
    public int promoteWaitingDescendants(@Nonnull Node node) {
        int promoted = 0;
        for (Node child : tree.getChildren(tree.getNode(node.getId()))) {
            if (child.getState() == APPROVED_WAITING_FOR_PARENTS && propagator.materialize(child) != null) {
                transition(tree.getNode(child.getId()), APPROVED);
                promoted++;
            }
            Node current = tree.getNode(child.getId());
            if (current.hasPublicCounterpart()) {
                promoted += promoteWaitingDescendants(current);
            }
        }
        return promoted;
    }

    //------------------------------------------------------------< private >---

    private ModerationState publish(Node node) {
        if (propagator.materialize(node) == null) {
            transition(node, APPROVED_WAITING_FOR_PARENTS);
            return APPROVED_WAITING_FOR_PARENTS;
        }
        Node approved = transition(tree.getNode(node.getId()), APPROVED);
        int promoted = promoteWaitingDescendants(approved);
        if (promoted > 0) {
            log.info("Publishing {} promoted {} waiting descendants", approved.getId(), promoted);
        }
        return APPROVED;
    }

    private Node transition(Node node, ModerationState target) {
        log.debug("{}: {} -> {}", node.getId(), node.getState(), target);
        return tree.setState(node.getId(), target);
    }
}
