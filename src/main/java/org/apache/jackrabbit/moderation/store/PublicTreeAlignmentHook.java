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

import org.apache.jackrabbit.moderation.state.PublicationPropagator;

/**
 * Moves the public counterparts along with structural changes of the
 * content tree, so the public tree keeps mirroring it.
 */
public class PublicTreeAlignmentHook implements CommitHook {

    @Nonnull
    @Override
    public StoreSnapshot processCommit(@Nonnull StoreSnapshot before, @Nonnull StoreSnapshot after) {
        StoreBuilder builder = after.builder();
        if (new PublicationPropagator(builder.getTree()).realign() == 0) {
            return after;
        }
        return new StoreSnapshot(builder.getTree().getContentTree(), after.getGrants(), after.getRevision());
    }
}
