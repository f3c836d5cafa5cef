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

import javax.annotation.Nonnull;

import org.apache.jackrabbit.moderation.api.ModerationException;
import org.apache.jackrabbit.moderation.api.Node;
import org.apache.jackrabbit.moderation.api.PublicCounterpart;
import org.apache.jackrabbit.moderation.tree.ContentTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects any commit leaving a public counterpart below a node that has
 * none, or a counterpart that does not mirror its source node.
 */
public class PublicationInvariantHook implements CommitHook {

    private static final Logger log = LoggerFactory.getLogger(PublicationInvariantHook.class);

    @Nonnull
    @Override
    public StoreSnapshot processCommit(@Nonnull StoreSnapshot before, @Nonnull StoreSnapshot after)
            throws ModerationException {
        ContentTree tree = after.getTree();
        for (Node node : tree.getNodes()) {
            PublicCounterpart counterpart = node.getPublicCounterpart();
            if (counterpart == null) {
                continue;
            }
            Node parent = tree.getParent(node);
            if (parent != null && !parent.hasPublicCounterpart()) {
                log.warn("Rejecting commit: {} is public below non public {}", node.getId(), parent.getId());
                throw new ModerationException(ModerationException.CONSTRAINT, 1,
                        "Node " + node.getId() + " is public while its parent " + parent.getId() + " is not");
            }
            if (!counterpart.getPosition().equals(tree.getPosition(node))) {
                log.warn("Rejecting commit: counterpart of {} is out of place", node.getId());
                throw new ModerationException(ModerationException.CONSTRAINT, 2,
                        "Public counterpart of " + node.getId() + " does not mirror its position");
            }
        }
        return after;
    }
}
