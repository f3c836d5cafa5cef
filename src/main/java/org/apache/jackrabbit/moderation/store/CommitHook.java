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

/**
 * Extension point for validating and modifying the state of a unit of work
 * before it becomes visible. A hook may reject the whole unit by throwing.
 */
public interface CommitHook {

    /**
     * Processes a commit.
     *
     * @param before state before the unit of work
     * @param after  state after the unit of work
     * @return the state to commit, possibly modified
     * @throws ModerationException if the commit is rejected
     */
    @Nonnull
    StoreSnapshot processCommit(@Nonnull StoreSnapshot before, @Nonnull StoreSnapshot after)
            throws ModerationException;
}
