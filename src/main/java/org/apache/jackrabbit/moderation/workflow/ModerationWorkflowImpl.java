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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.jackrabbit.moderation.api.Capability;
import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.apache.jackrabbit.moderation.api.User;
import org.apache.jackrabbit.moderation.security.PermissionResolver;
import org.apache.jackrabbit.moderation.security.PermissionResolverImpl;
import org.apache.jackrabbit.moderation.spi.ConfigurationParameters;
import org.apache.jackrabbit.moderation.state.ModerationStateMachine;
import org.apache.jackrabbit.moderation.state.PublicationPropagator;
import org.apache.jackrabbit.moderation.store.ModerationStore;
import org.apache.jackrabbit.moderation.store.StoreBuilder;
import org.apache.jackrabbit.moderation.store.StoreSnapshot;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;
import org.apache.jackrabbit.moderation.tree.TreeNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link ModerationWorkflow} running every operation as one unit of work
 * of a {@link ModerationStore}.
 */
public class ModerationWorkflowImpl implements ModerationWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ModerationWorkflowImpl.class);

    private final ModerationStore store;
    private final WorkflowConfiguration config;

    public ModerationWorkflowImpl(@Nonnull ModerationStore store) {
        this(store, ConfigurationParameters.EMPTY);
    }

    public ModerationWorkflowImpl(@Nonnull ModerationStore store, @Nonnull ConfigurationParameters parameters) {
        this.store = checkNotNull(store);
        this.config = new WorkflowConfiguration(parameters);
    }

    @Nonnull
    @Override
    public String create(@Nonnull final User actor, @Nullable final String parentId, @Nonnull final String name)
            throws ModerationException {
        return store.execute(builder -> {
            ContentTreeBuilder tree = builder.getTree();
            Node parent = (parentId == null) ? null : requireNode(tree, parentId);
            if (!resolver(builder).canAddChild(actor, parent)) {
                throw ModerationException.permissionDenied(actor.getId() + " may not add nodes "
                        + (parent == null ? "at top level" : "below " + parentId));
            }
            Node node = tree.addNode(parentId, name);
            log.info("{} created {} ({})", actor.getId(), name, node.getId());
            return node.getId();
        });
    }

    @Nonnull
    @Override
    public ModerationState edit(@Nonnull final User actor, @Nonnull final String nodeId) throws ModerationException {
        return store.execute(builder -> {
            Node node = requireNode(builder.getTree(), nodeId);
            PermissionResolver resolver = resolver(builder);
            checkCapability(resolver, actor, node, Capability.CHANGE);
            if (config.getRetractionPolicy() == RetractionPolicy.RETRACT_ON_EDIT) {
                new PublicationPropagator(builder.getTree()).retract(node);
            }
            return stateMachine(builder, resolver).edit(node);
        });
    }

    @Nonnull
    @Override
    public ModerationState requestPublish(@Nonnull final User actor, @Nonnull final String nodeId)
            throws ModerationException {
        return store.execute(builder -> {
            Node node = requireNode(builder.getTree(), nodeId);
            PermissionResolver resolver = resolver(builder);
            checkCapability(resolver, actor, node, Capability.CHANGE);
            if (!node.getState().isApproved() && resolver.getModeratorCount(node) == 0) {
                checkCapability(resolver, actor, node, Capability.PUBLISH);
            }
            ModerationState state = stateMachine(builder, resolver).requestPublish(node);
            log.info("{} requested publication of {}: {}", actor.getId(), nodeId, state);
            return state;
        });
    }

    @Nonnull
    @Override
    public ModerationState approve(@Nonnull User actor, @Nonnull String nodeId) throws ModerationException {
        return doApprove(actor, nodeId, null);
    }

    @Nonnull
    @Override
    public ModerationState approve(@Nonnull User actor, @Nonnull String nodeId, long expectedRevision)
            throws ModerationException {
        return doApprove(actor, nodeId, expectedRevision);
    }

    @Nonnull
    @Override
    public String copy(@Nonnull User actor, @Nonnull String sourceId, @Nonnull String targetParentId)
            throws ModerationException {
        return copy(actor, sourceId, targetParentId, config.getDefaultCopyOptions());
    }

    @Nonnull
    @Override
    public String copy(@Nonnull final User actor, @Nonnull final String sourceId,
                       @Nonnull final String targetParentId, @Nonnull final CopyOptions options)
            throws ModerationException {
        return store.execute(builder -> {
            ContentTreeBuilder tree = builder.getTree();
            Node source = requireNode(tree, sourceId);
            Node target = requireNode(tree, targetParentId);
            if (source.getId().equals(target.getId()) || tree.isDescendantOf(target, source)) {
                throw ModerationException.invalidStateTransition(
                        "Cannot copy " + sourceId + " into its own subtree");
            }
            if (!resolver(builder).canAddChild(actor, target)) {
                throw ModerationException.permissionDenied(actor.getId() + " may not add nodes below " + targetParentId);
            }

            Map<String, String> copies = Maps.newLinkedHashMap();
            Node copy = copySubtree(tree, source, targetParentId, 0, copies);

            List<PermissionGrant> copiedGrants = Lists.newArrayList();
            for (Map.Entry<String, String> entry : copies.entrySet()) {
                for (PermissionGrant grant : builder.getGrants().getGrants(entry.getKey())) {
                    PermissionGrant copied = copyGrant(grant, entry.getValue(), options);
                    if (copied != null) {
                        copiedGrants.add(copied);
                    }
                }
            }
            builder.setGrants(builder.getGrants().with(copiedGrants));
            log.info("{} copied {} nodes from {} below {} as {} ({})", actor.getId(), copies.size(), sourceId,
                    targetParentId, copy.getId(), options);
            return copy.getId();
        });
    }

    @Override
    public void delete(@Nonnull final User actor, @Nonnull final String nodeId) throws ModerationException {
        store.execute(builder -> {
            Node node = requireNode(builder.getTree(), nodeId);
            checkCapability(resolver(builder), actor, node, Capability.DELETE);
            Set<String> removed = Sets.newHashSet();
            for (Node r : builder.getTree().removeSubtree(nodeId)) {
                removed.add(r.getId());
            }
            builder.setGrants(builder.getGrants().withoutNodes(removed));
            log.info("{} deleted {} nodes below and including {}", actor.getId(), removed.size(), nodeId);
            return null;
        });
    }

    @Nonnull
    @Override
    public Node getNode(@Nonnull String nodeId) throws ModerationException {
        return requireNode(store.getHead().getTree(), nodeId);
    }

    @Override
    public int getModeratorCount(@Nonnull String nodeId) throws ModerationException {
        StoreSnapshot head = store.getHead();
        Node node = requireNode(head.getTree(), nodeId);
        return new PermissionResolverImpl(head.getTree(), head.getGrants()).getModeratorCount(node);
    }

    @Override
    public boolean canPerform(@Nonnull User user, @Nonnull String nodeId, @Nonnull Capability capability)
            throws ModerationException {
        StoreSnapshot head = store.getHead();
        Node node = requireNode(head.getTree(), nodeId);
        return new PermissionResolverImpl(head.getTree(), head.getGrants()).canPerform(user, node, capability);
    }

    //------------------------------------------------------------< private >---

    private ModerationState doApprove(final User actor, final String nodeId, @Nullable final Long expectedRevision)
            throws ModerationException {
        return store.execute(builder -> {
            Node node = requireNode(builder.getTree(), nodeId);
            if (expectedRevision != null && node.getRevision() != expectedRevision) {
                throw ModerationException.invalidStateTransition("Node " + nodeId + " changed since revision "
                        + expectedRevision + " (now " + node.getRevision() + ')');
            }
            PermissionResolver resolver = resolver(builder);
            ModerationState state = stateMachine(builder, resolver).approve(actor, node);
            log.info("{} approved {}: {}", actor.getId(), nodeId, state);
            return state;
        });
    }

    private static PermissionResolver resolver(StoreBuilder builder) {
        return new PermissionResolverImpl(builder.getTree(), builder.getGrants());
    }

    private static ModerationStateMachine stateMachine(StoreBuilder builder, PermissionResolver resolver) {
        return new ModerationStateMachine(builder.getTree(), resolver,
                new PublicationPropagator(builder.getTree()));
    }

    @Nonnull
    private static Node requireNode(TreeNavigator tree, String nodeId) throws ModerationException {
        if (!tree.exists(nodeId)) {
            throw ModerationException.notFound(nodeId);
        }
        return tree.getNode(nodeId);
    }

    private static void checkCapability(PermissionResolver resolver, User actor, Node node, Capability capability)
            throws ModerationException {
        if (!resolver.canPerform(actor, node, capability)) {
            throw ModerationException.permissionDenied(actor.getId() + " lacks " + capability + " on " + node.getId());
        }
    }

    /**
     * Copies {@code source} and its descendants below {@code parentId},
     * keeping the order of the children.
     *
     * @param copies receives the identifier of each copy keyed by its source
     */
    private static Node copySubtree(ContentTreeBuilder tree, Node source, String parentId, int index,
                                    Map<String, String> copies) {
        Node copy = tree.addNode(UUID.randomUUID().toString(), parentId, source.getName(), index);
        copies.put(source.getId(), copy.getId());
        List<Node> children = tree.getChildren(source);
        for (int i = 0; i < children.size(); i++) {
            copySubtree(tree, children.get(i), copy.getId(), i, copies);
        }
        return copy;
    }

    @CheckForNull
    private static PermissionGrant copyGrant(PermissionGrant grant, String copyId, CopyOptions options) {
        PermissionGrant copied = grant.attachTo(copyId);
        if (!options.isCopyPermissions()) {
            copied = copied.withoutCapabilities();
        }
        if (!options.isCopyModeration()) {
            copied = copied.withoutModeration();
        }
        return copied.isEmpty() ? null : copied;
    }
}
