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

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The acting user of a workflow operation. Users are identified by their id;
 * everything they may do is defined by {@link PermissionGrant}s, unless they
 * are a superuser.
 */
public final class User {

    public enum Tier {
        /**
         * Bypasses all permission checks.
         */
        SUPERUSER,
        /**
         * Limited to what explicit grants allow.
         */
        STAFF
    }

    private final String id;
    private final Tier tier;

    private User(@Nonnull String id, @Nonnull Tier tier) {
        this.id = checkNotNull(id);
        this.tier = checkNotNull(tier);
    }

    public static User superuser(@Nonnull String id) {
        return new User(id, Tier.SUPERUSER);
    }

    public static User staff(@Nonnull String id) {
        return new User(id, Tier.STAFF);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public Tier getTier() {
        return tier;
    }

    public boolean isSuperuser() {
        return tier == Tier.SUPERUSER;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof User)) {
            return false;
        }
        User that = (User) other;
        return id.equals(that.id) && tier == that.tier;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", id).add("tier", tier).toString();
    }
}
