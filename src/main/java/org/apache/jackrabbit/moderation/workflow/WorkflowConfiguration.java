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

import javax.annotation.Nonnull;

import org.apache.jackrabbit.moderation.spi.ConfigurationParameters;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Typed view of the options of a {@link ModerationWorkflow}.
 */
public final class WorkflowConfiguration {

    /**
     * Name of the option holding the {@link RetractionPolicy}.
     */
    public static final String PARAM_RETRACTION_POLICY = "retractionPolicy";

    /**
     * Name of the option defining whether copies get the capability grants
     * of their source.
     */
    public static final String PARAM_COPY_PERMISSIONS = "copyPermissions";

    /**
     * Name of the option defining whether copies get the moderators of
     * their source.
     */
    public static final String PARAM_COPY_MODERATION = "copyModeration";

    public static final RetractionPolicy DEFAULT_RETRACTION_POLICY = RetractionPolicy.KEEP_UNTIL_REPLACED;

    private final ConfigurationParameters parameters;

    public WorkflowConfiguration(@Nonnull ConfigurationParameters parameters) {
        this.parameters = checkNotNull(parameters);
    }

    @Nonnull
    public RetractionPolicy getRetractionPolicy() {
        return parameters.getConfigValue(PARAM_RETRACTION_POLICY, DEFAULT_RETRACTION_POLICY);
    }

    @Nonnull
    public CopyOptions getDefaultCopyOptions() {
        return new CopyOptions(
                parameters.getConfigValue(PARAM_COPY_PERMISSIONS, true),
                parameters.getConfigValue(PARAM_COPY_MODERATION, true));
    }

    @Nonnull
    public ConfigurationParameters getParameters() {
        return parameters;
    }
}
