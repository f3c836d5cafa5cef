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
 * A user whose approval is required for a node, together with the node the
 * moderating grant is attached to ({@code null} for a global grant).
 */
public final class ModeratorAssignment {

    private final String userId;
    private final String grantNodeId;

    public ModeratorAssignment(@Nonnull String userId, @CheckForNull String grantNodeId) {
        this.userId = checkNotNull(userId);
        this.grantNodeId = grantNodeId;
    }

    public static ModeratorAssignment of(@Nonnull PermissionGrant grant) {
        return new ModeratorAssignment(grant.getUserId(), grant.getNodeId());
    }

    @Nonnull
    public String getUserId() {
        return userId;
    }

    @CheckForNull
    public String getGrantNodeId() {
        return grantNodeId;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ModeratorAssignment)) {
            return false;
        }
        ModeratorAssignment that = (ModeratorAssignment) other;
        return userId.equals(that.userId) && Objects.equal(grantNodeId, that.grantNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(userId, grantNodeId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("user", userId).add("node", grantNodeId).toString();
    }
}
