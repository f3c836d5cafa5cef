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

import com.google.common.base.MoreObjects;

/**
 * Selects which grants attached inside a copied subtree are duplicated onto
 * the copies.
 */
public final class CopyOptions {

    public static final CopyOptions ALL = new CopyOptions(true, true);

    public static final CopyOptions STRUCTURE_ONLY = new CopyOptions(false, false);

    private final boolean copyPermissions;
    private final boolean copyModeration;

    public CopyOptions(boolean copyPermissions, boolean copyModeration) {
        this.copyPermissions = copyPermissions;
        this.copyModeration = copyModeration;
    }

    /**
     * @return {@code true} if capabilities are copied
     */
    public boolean isCopyPermissions() {
        return copyPermissions;
    }

    /**
     * @return {@code true} if moderator registrations are copied
     */
    public boolean isCopyModeration() {
        return copyModeration;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("permissions", copyPermissions)
                .add("moderation", copyModeration)
                .toString();
    }
}
