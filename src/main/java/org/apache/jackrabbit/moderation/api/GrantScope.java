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

/**
 * Defines which nodes a {@link PermissionGrant} covers relative to the node
 * it is attached to.
 */
public enum GrantScope {

    PAGE(true, false, false),

    CHILDREN(false, true, false),

    DESCENDANTS(false, true, true),

    PAGE_AND_CHILDREN(true, true, false),

    PAGE_AND_DESCENDANTS(true, true, true);

    private final boolean page;
    private final boolean children;
    private final boolean descendants;

    GrantScope(boolean page, boolean children, boolean descendants) {
        this.page = page;
        this.children = children;
        this.descendants = descendants;
    }

    /**
     * Returns {@code true} if a grant with this scope covers a node located
     * {@code distance} levels below the node carrying the grant.
     *
     * @param distance number of levels between the grant node and the
     *                 checked node, {@code 0} for the grant node itself
     * @return {@code true} iff the node at that distance is covered
     */
    public boolean covers(int distance) {
        if (distance < 0) {
            return false;
        } else if (distance == 0) {
            return page;
        } else if (distance == 1) {
            return children;
        } else {
            return descendants;
        }
    }
}
