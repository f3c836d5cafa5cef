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

/**
 * What happens to the public counterpart of a node when the node is edited.
 */
public enum RetractionPolicy {

    /**
     * The counterpart stays public until the next successful publication
     * replaces it.
     */
    KEEP_UNTIL_REPLACED,

    /**
     * The counterparts of the node and of its whole subtree are removed.
     * Approved descendants wait until the node is published again.
     */
    RETRACT_ON_EDIT
}
