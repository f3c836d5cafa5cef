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
import org.apache.jackrabbit.moderation.api.PermissionGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects commits leaving grants attached to nodes that do not exist.
 */
public class GrantReferenceHook implements CommitHook {

    private static final Logger log = LoggerFactory.getLogger(GrantReferenceHook.class);

    @Nonnull
    @Override
    public StoreSnapshot processCommit(@Nonnull StoreSnapshot before, @Nonnull StoreSnapshot after)
            throws ModerationException {
        for (PermissionGrant grant : after.getGrants().getAll()) {
            if (!grant.isGlobal() && !after.getTree().exists(grant.getNodeId())) {
                log.warn("Rejecting commit: grant {} refers to missing node", grant);
                throw new ModerationException(ModerationException.CONSTRAINT, 3,
                        "Grant " + grant + " refers to a missing node");
            }
        }
        return after;
    }
}
