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
package org.apache.jackrabbit.moderation;

import java.util.concurrent.atomic.AtomicInteger;

import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.apache.jackrabbit.moderation.api.PublicCounterpart;
import org.apache.jackrabbit.moderation.api.TreePosition;
import org.apache.jackrabbit.moderation.api.User;
import org.apache.jackrabbit.moderation.security.PermissionResolverImpl;
import org.apache.jackrabbit.moderation.spi.ConfigurationParameters;
import org.apache.jackrabbit.moderation.state.ModerationStateMachine;
import org.apache.jackrabbit.moderation.state.PublicationPropagator;
import org.apache.jackrabbit.moderation.store.ModerationStore;
import org.apache.jackrabbit.moderation.tree.ContentTree;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;
import org.apache.jackrabbit.moderation.workflow.ModerationWorkflow;
import org.apache.jackrabbit.moderation.workflow.ModerationWorkflowImpl;
import org.junit.Before;

import static org.apache.jackrabbit.moderation.api.Capability.ADD;
import static org.apache.jackrabbit.moderation.api.Capability.CHANGE;
import static org.apache.jackrabbit.moderation.api.Capability.DELETE;
import static org.apache.jackrabbit.moderation.api.Capability.PUBLISH;
import static org.apache.jackrabbit.moderation.api.GrantScope.DESCENDANTS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

/**
 * Base class for workflow tests. Sets up three users and four pages:
 * <ul>
 *     <li>{@code super}: superuser</li>
 *     <li>{@code master}: may do anything below {@code home} but not on
 *     {@code home} itself, anything on {@code master} and {@code pageA} and
 *     their descendants, and moderates {@code slave-home} and its
 *     descendants</li>
 *     <li>{@code slave}: may add, change and delete {@code slave-home} and
 *     its descendants</li>
 * </ul>
 * {@code home} is published. {@code slave-home} is approved but waits for
 * its parent {@code master}, which is not published.
 */
public abstract class AbstractModerationTest {

    private final AtomicInteger pageCounter = new AtomicInteger();

    protected final User userSuper = User.superuser("super");
    protected final User userMaster = User.staff("master");
    protected final User userSlave = User.staff("slave");

    protected ModerationStore store;
    protected ModerationWorkflow workflow;

    protected String homePage;
    protected String masterPage;
    protected String slavePage;
    protected String pageA;

    @Before
    public void before() throws Exception {
        store = new ModerationStore();
        store.execute(builder -> {
            ContentTreeBuilder tree = builder.getTree();
            homePage = tree.addNode(null, "home").getId();
            masterPage = tree.addNode(null, "master").getId();
            slavePage = tree.addNode(masterPage, "slave-home").getId();
            pageA = tree.addNode(null, "pageA").getId();

            builder.addGrants(
                    PermissionGrant.grant("master", homePage, DESCENDANTS, ADD, CHANGE, DELETE, PUBLISH),
                    PermissionGrant.grant("master", masterPage, ADD, CHANGE, DELETE, PUBLISH),
                    PermissionGrant.grant("master", pageA, ADD, CHANGE, DELETE, PUBLISH),
                    PermissionGrant.grant("slave", slavePage, ADD, CHANGE, DELETE),
                    PermissionGrant.moderator("master", slavePage));

            ModerationStateMachine stateMachine = new ModerationStateMachine(tree,
                    new PermissionResolverImpl(tree, builder.getGrants()), new PublicationPropagator(tree));
            stateMachine.requestPublish(tree.getNode(homePage));
            stateMachine.requestPublish(tree.getNode(slavePage));
            stateMachine.approve(userSuper, tree.getNode(slavePage));
            return null;
        });
        workflow = new ModerationWorkflowImpl(store, getConfigurationParameters());
    }

    protected ConfigurationParameters getConfigurationParameters() {
        return ConfigurationParameters.EMPTY;
    }

    //------------------------------------------------------------< helpers >---

    protected Node getNode(String id) throws ModerationException {
        return workflow.getNode(id);
    }

    /**
     * Creates a page and checks it is not public yet.
     */
    protected Node createPage(User user, String parentId) throws ModerationException {
        String id = workflow.create(user, parentId, "page-" + pageCounter.incrementAndGet());
        Node page = getNode(id);
        assertEquals(ModerationState.CHANGED, page.getState());
        assertFalse(page.hasPublicCounterpart());
        return page;
    }

    /**
     * Requests publication of a page and optionally approves it with the
     * same user, if it still waits for approval.
     */
    protected Node publishPage(User user, String id, boolean approve) throws ModerationException {
        ModerationState state = workflow.requestPublish(user, id);
        if (approve && state == ModerationState.NEED_APPROVEMENT) {
            workflow.approve(user, id);
        }
        return getNode(id);
    }

    protected Node publishAndApprove(User user, String id) throws ModerationException {
        Node page = publishPage(user, id, true);
        assertNotNull(page.getPublicCounterpart());
        assertTrue(page.getPublicCounterpart().isPublished());
        return page;
    }

    /**
     * Compares identifier and tree attributes of a page and its public
     * counterpart.
     */
    protected void assertPublishedAttributes(String id) throws ModerationException {
        ContentTree tree = store.getHead().getTree();
        Node page = tree.getNode(id);
        PublicCounterpart counterpart = page.getPublicCounterpart();
        assertNotNull("no public counterpart for " + page, counterpart);
        TreePosition expected = tree.getPosition(page);
        TreePosition actual = counterpart.getPosition();
        assertEquals(page.getId(), counterpart.getSourceId());
        assertEquals(expected.getId(), actual.getId());
        assertEquals(expected.getTreeId(), actual.getTreeId());
        assertEquals(expected.getLeft(), actual.getLeft());
        assertEquals(expected.getRight(), actual.getRight());
        assertEquals(expected.getParentId(), actual.getParentId());
        assertEquals(expected.getLevel(), actual.getLevel());
    }

    /**
     * Checks that no node is public below a node that is not.
     */
    protected void assertPublicationInvariant() {
        ContentTree tree = store.getHead().getTree();
        for (Node node : tree.getNodes()) {
            if (node.hasPublicCounterpart()) {
                for (Node ancestor : tree.getAncestors(node)) {
                    assertTrue(ancestor + " is not public above " + node, ancestor.hasPublicCounterpart());
                }
            }
        }
    }
}
