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
package org.apache.jackrabbit.moderation.store;

import org.apache.jackrabbit.moderation.api.Capability;
import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.apache.jackrabbit.moderation.api.PublicCounterpart;
import org.apache.jackrabbit.moderation.api.TreePosition;
import org.apache.jackrabbit.moderation.state.PublicationPropagator;
import org.apache.jackrabbit.moderation.tree.ContentTreeBuilder;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ModerationStoreTest {

    private ModerationStore store;

    @Before
    public void setUp() throws Exception {
        store = new ModerationStore();
        store.execute(builder -> {
            ContentTreeBuilder tree = builder.getTree();
            tree.addNode("root", null, "root", 0);
            tree.addNode("child", "root", "child", 0);
            return null;
        });
    }

    @Test
    public void testExecute() throws Exception {
        StoreSnapshot before = store.getHead();
        String id = store.execute(builder -> builder.getTree().addNode("root", "new").getId());

        StoreSnapshot after = store.getHead();
        assertEquals(before.getRevision() + 1, after.getRevision());
        assertTrue(after.getTree().exists(id));
        assertFalse(before.getTree().exists(id));
    }

    @Test
    public void testFailedWorkIsDiscarded() throws Exception {
        StoreSnapshot before = store.getHead();
        try {
            store.execute(builder -> {
                builder.getTree().addNode("root", "lost");
                throw ModerationException.permissionDenied("denied");
            });
            fail();
        } catch (ModerationException e) {
            assertTrue(e.isAccessViolation());
        }
        assertSame(before, store.getHead());
    }

    @Test
    public void testHookIsCalled() throws Exception {
        CommitHook hook = mock(CommitHook.class);
        when(hook.processCommit(any(StoreSnapshot.class), any(StoreSnapshot.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));
        ModerationStore hooked = new ModerationStore(store.getHead(), hook);

        hooked.execute(builder -> builder.getTree().addNode("root", "new"));
        hooked.execute(builder -> builder.getTree().addNode("root", "other"));

        verify(hook, times(2)).processCommit(any(StoreSnapshot.class), any(StoreSnapshot.class));
        assertEquals(4, hooked.getHead().getTree().getNodes().size());
    }

    @Test
    public void testHookRejects() throws Exception {
        CommitHook hook = mock(CommitHook.class);
        when(hook.processCommit(any(StoreSnapshot.class), any(StoreSnapshot.class)))
                .thenThrow(new ModerationException(ModerationException.CONSTRAINT, 42, "rejected"));
        StoreSnapshot initial = store.getHead();
        ModerationStore hooked = new ModerationStore(initial, hook);
        try {
            hooked.execute(builder -> builder.getTree().addNode("root", "new"));
            fail();
        } catch (ModerationException e) {
            assertTrue(e.isConstraintViolation());
            assertEquals(42, e.getCode());
            assertEquals("ModerationConstraint0042: rejected", e.getMessage());
        }
        assertSame(initial, hooked.getHead());
    }

    @Test
    public void testPublicNodeBelowPrivateParent() throws Exception {
        try {
            store.execute(builder -> {
                ContentTreeBuilder tree = builder.getTree();
                Node child = tree.getNode("child");
                tree.setPublicCounterpart("child",
                        new PublicCounterpart("child", tree.getPosition(child), true));
                return null;
            });
            fail();
        } catch (ModerationException e) {
            assertTrue(e.isConstraintViolation());
            assertEquals(1, e.getCode());
        }
        assertFalse(store.getHead().getTree().getNode("child").hasPublicCounterpart());
    }

    @Test
    public void testMisplacedCounterpart() throws Exception {
        StoreSnapshot before = store.getHead();
        StoreBuilder builder = before.builder();
        builder.getTree().setPublicCounterpart("root", new PublicCounterpart("root",
                new TreePosition("root", "root", 7, 8, null, 0), true));
        try {
            new PublicationInvariantHook().processCommit(before, builder.getSnapshot());
            fail();
        } catch (ModerationException e) {
            assertTrue(e.isConstraintViolation());
            assertEquals(2, e.getCode());
        }

        // the alignment hook moves it back in place
        StoreSnapshot aligned = new PublicTreeAlignmentHook().processCommit(before, builder.getSnapshot());
        assertSame(aligned, new PublicationInvariantHook().processCommit(before, aligned));
    }

    @Test
    public void testCounterpartsAreRealigned() throws Exception {
        store.execute(builder -> {
            PublicationPropagator propagator = new PublicationPropagator(builder.getTree());
            propagator.materialize(builder.getTree().getNode("root"));
            propagator.materialize(builder.getTree().getNode("child"));
            return null;
        });
        store.execute(builder -> builder.getTree().addNode("root", "first"));

        StoreSnapshot head = store.getHead();
        for (Node node : head.getTree().getNodes()) {
            if (node.hasPublicCounterpart()) {
                assertEquals(head.getTree().getPosition(node), node.getPublicCounterpart().getPosition());
            }
        }
        assertEquals(4, head.getTree().getNode("child").getPublicCounterpart().getPosition().getLeft());
    }

    @Test
    public void testDanglingGrant() throws Exception {
        try {
            store.execute(builder -> {
                builder.addGrants(PermissionGrant.grant("alice", "missing", Capability.CHANGE));
                return null;
            });
            fail();
        } catch (ModerationException e) {
            assertTrue(e.isConstraintViolation());
            assertEquals(3, e.getCode());
        }
        assertTrue(store.getHead().getGrants().isEmpty());
    }
}
