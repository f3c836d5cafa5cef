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
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Publicly visible projection of an approved {@link Node}. Refers back to its
 * source node by identifier only.
 */
public final class PublicCounterpart {

    private final String sourceId;
    private final TreePosition position;
    private final boolean published;

    public PublicCounterpart(@Nonnull String sourceId, @Nonnull TreePosition position, boolean published) {
        checkArgument(sourceId.equals(position.getId()),
                "Position %s does not belong to %s", position, sourceId);
        this.sourceId = sourceId;
        this.position = checkNotNull(position);
        this.published = published;
    }

    @Nonnull
    public String getSourceId() {
        return sourceId;
    }

    @Nonnull
    public TreePosition getPosition() {
        return position;
    }

    public boolean isPublished() {
        return published;
    }

    /**
     * Returns a counterpart of the same source mirroring the given position.
     */
    @Nonnull
    public PublicCounterpart moveTo(@Nonnull TreePosition position) {
        if (this.position.equals(position)) {
            return this;
        }
        return new PublicCounterpart(sourceId, position, published);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PublicCounterpart)) {
            return false;
        }
        PublicCounterpart that = (PublicCounterpart) other;
        return published == that.published && sourceId.equals(that.sourceId)
                && position.equals(that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(sourceId, position, published);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("source", sourceId)
                .add("position", position)
                .add("published", published)
                .toString();
    }
}
