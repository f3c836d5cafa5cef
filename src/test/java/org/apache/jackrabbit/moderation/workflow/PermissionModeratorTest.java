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

import com.google.common.collect.Lists;
import org.apache.jackrabbit.moderation.AbstractModerationTest;
import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.ModerationState;
import org.apache.jackrabbit.moderation.api.Node;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Permissions and moderation together, exercised through the workflow with
 * the users and pages of {@link AbstractModerationTest}.
 */
public class PermissionModeratorTest extends AbstractModerationTest {

    @Test
    public void testSuperCanAddPageToRoot() throws Exception {
        String id = workflow.create(userSuper, null, "top");
        assertTrue(getNode(id).isTopLevel());
    }

    @Test
    public void testMasterCannotAddPageToRoot() throws Exception {
        try {
            workflow.create(userMaster, null, "top");
            fail("master must not add top level pages");
        } catch (ModerationException e) {
            assertTrue(e.isAccessViolation());
        }
    }

    @Test
    public void testSlaveCannotAddPageToRoot() throws Exception {
        try {
            workflow.create(userSlave, null, "top");
            fail("slave must not add top level pages");
        } catch (ModerationException e) {
            assertTrue(e.isAccessViolation());
        }
    }

    @Test
    public void testModerationOnSlaveHome() throws Exception {
        assertEquals(1, workflow.getModeratorCount(slavePage));
    }

    @Test
    public void testSlaveCanAddPageUnderSlaveHome() throws Exception {
        Node page = createPage(userSlave, slavePage);
        assertEquals(1, workflow.getModeratorCount(page.getId()));

        // request publication and approve as master
        assertEquals(ModerationState.NEED_APPROVEMENT, workflow.requestPublish(userMaster, page.getId()));
        assertEquals(ModerationState.APPROVED_WAITING_FOR_PARENTS, workflow.approve(userMaster, page.getId()));

        // slave-home is not public yet
        assertFalse(getNode(page.getId()).hasPublicCounterpart());
    }

    @Test
    public void testPublicCounterpartAttributes() throws Exception {
        List<String> ids = Lists.newArrayList();
        for (int i = 0; i < 10; i++) {
            ids.add(createPage(userMaster, homePage).getId());
        }

        // approve the last 5 pages in reverse order
        for (String id : Lists.reverse(ids.subList(5, 10))) {
            publishAndApprove(userMaster, id);
            assertPublishedAttributes(id);
        }
        for (String id : ids.subList(5, 10)) {
            assertPublishedAttributes(id);
        }
        for (String id : ids.subList(0, 5)) {
            assertFalse(getNode(id).hasPublicCounterpart());
        }
        assertPublicationInvariant();
    }

    @Test
    public void testCreateCopyPublish() throws Exception {
        Node page = createPage(userMaster, slavePage);

        String copy = workflow.copy(userMaster, page.getId(), homePage);
        assertEquals(homePage, getNode(copy).getParentId());

        publishAndApprove(userMaster, copy);
        assertPublishedAttributes(copy);
    }

    @Test
    public void testCreatePublishCopy() throws Exception {
        Node page = createPage(userMaster, homePage);
        publishAndApprove(userMaster, page.getId());

        String copy = workflow.copy(userMaster, page.getId(), masterPage);

        assertPublishedAttributes(page.getId());
        Node copied = getNode(copy);
        assertEquals(ModerationState.CHANGED, copied.getState());
        assertFalse(copied.hasPublicCounterpart());
        assertEquals(ModerationState.APPROVED, getNode(page.getId()).getState());
    }

    @Test
    public void testSubtreeNeedsApprovement() throws Exception {
        Node page = createPage(userMaster, homePage);
        Node subpage = createPage(userMaster, page.getId());

        // publish both of them in reverse order
        subpage = publishPage(userMaster, subpage.getId(), true);

        // parent is not published yet
        assertFalse(subpage.hasPublicCounterpart());
        assertEquals(ModerationState.APPROVED_WAITING_FOR_PARENTS, subpage.getState());

        page = publishAndApprove(userMaster, page.getId());
        assertTrue(page.hasPublicCounterpart());

        // parent was published, so subpage is published as well
        subpage = getNode(subpage.getId());
        assertTrue(subpage.hasPublicCounterpart());
        assertEquals(ModerationState.APPROVED, subpage.getState());

        assertPublishedAttributes(page.getId());
        assertPublishedAttributes(subpage.getId());
    }

    @Test
    public void testSubtreeWithSuper() throws Exception {
        String page = workflow.create(userSuper, null, "super-page");
        Node subpage = createPage(userSuper, page);

        publishAndApprove(userSuper, page);
        publishAndApprove(userSuper, subpage.getId());

        assertPublishedAttributes(page);
        assertPublishedAttributes(subpage.getId());
    }

    @Test
    public void testSuperAddPageToRoot() throws Exception {
        Node page = getNode(workflow.create(userSuper, null, "unmoderated"));

        assertFalse(page.hasPublicCounterpart());
        assertEquals(ModerationState.CHANGED, page.getState());
    }

    @Test
    public void testModeratorFlags() throws Exception {
        Node page = createPage(userSlave, slavePage);

        page = publishPage(userSlave, page.getId(), false);
        assertEquals(ModerationState.NEED_APPROVEMENT, page.getState());

        // approved by master, but slave-home is not public
        assertEquals(ModerationState.APPROVED_WAITING_FOR_PARENTS, workflow.approve(userMaster, page.getId()));
        assertFalse(getNode(page.getId()).hasPublicCounterpart());

        Node master = publishPage(userMaster, masterPage, false);
        assertEquals(ModerationState.APPROVED, master.getState());

        // slave-home and the page follow their parent
        assertEquals(ModerationState.APPROVED, getNode(slavePage).getState());
        page = getNode(page.getId());
        assertEquals(ModerationState.APPROVED, page.getState());
        assertNotNull(page.getPublicCounterpart());
        assertPublishedAttributes(slavePage);
        assertPublishedAttributes(page.getId());
    }
}
