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
 * Moderation status of a content node.
 * <pre>
 * CHANGED → NEED_APPROVEMENT → APPROVED
 *                            ↘ APPROVED_WAITING_FOR_PARENTS → APPROVED
 * </pre>
 * Without moderators in scope a publication request skips
 * {@code NEED_APPROVEMENT}. Every edit goes back to {@code CHANGED}.
 */
public enum ModerationState {

    /**
     * Edited and not reviewed yet. Initial state of every node.
     */
    CHANGED,

    /**
     * Submitted for review by the moderators in scope.
     */
    NEED_APPROVEMENT,

    /**
     * Approved and publicly visible.
     */
    APPROVED,

    /**
     * Approved, but an ancestor is not public yet. Promoted to
     * {@code APPROVED} as soon as the whole ancestor chain is public.
     */
    APPROVED_WAITING_FOR_PARENTS;

    public boolean isApproved() {
        return this == APPROVED || this == APPROVED_WAITING_FOR_PARENTS;
    }
}
