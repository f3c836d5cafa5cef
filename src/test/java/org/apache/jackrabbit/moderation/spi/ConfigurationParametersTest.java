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
package org.apache.jackrabbit.moderation.spi;

import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.apache.jackrabbit.moderation.workflow.RetractionPolicy;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ConfigurationParametersTest {

    @Test
    public void testContains() {
        ConfigurationParameters params = ConfigurationParameters.EMPTY;
        assertFalse(params.contains("some"));
        assertFalse(params.contains(""));
        assertTrue(params.isEmpty());

        params = ConfigurationParameters.of(ImmutableMap.of("key1", "v", "key2", "v"));
        assertTrue(params.contains("key1"));
        assertTrue(params.contains("key2"));
        assertFalse(params.contains("another"));
        assertFalse(params.contains(""));
        assertEquals(2, params.keySet().size());
    }

    @Test
    public void testNullValuesAreIgnored() {
        Map<String, Object> map = new HashMap<String, Object>();
        map.put("key", null);
        map.put("other", "v");
        ConfigurationParameters params = ConfigurationParameters.of(map);
        assertFalse(params.contains("key"));
        assertTrue(params.contains("other"));
    }

    @Test
    public void testEmptyMap() {
        assertSame(ConfigurationParameters.EMPTY, ConfigurationParameters.of(new HashMap<String, Object>()));
    }

    @Test
    public void testGetConfigValue() {
        ConfigurationParameters options = ConfigurationParameters.of("o1", "v");
        assertEquals("v", options.getConfigValue("o1", "v2"));
        assertEquals("v2", options.getConfigValue("missing", "v2"));
    }

    @Test
    public void testGetNullableConfigValue() {
        ConfigurationParameters options = ConfigurationParameters.of("o1", "v");
        assertEquals("v", options.getConfigValue("o1", null, null));
        assertEquals("v", options.getConfigValue("o1", null, String.class));
        assertEquals("v", options.getConfigValue("o1", "v2", null));
        assertEquals("v2", options.getConfigValue("missing", "v2", String.class));
        assertNull(options.getConfigValue("missing", null, null));
        assertNull(options.getConfigValue("missing", null, Integer.class));
    }

    @Test
    public void testConversion() {
        ConfigurationParameters options = ConfigurationParameters.of(ImmutableMap.<String, Object>of(
                "String", "1000",
                "Int", 1000,
                "Bool", "true",
                "Policy", "retract_on_edit"));

        assertTrue(1000 == options.getConfigValue("String", 10, int.class));
        assertEquals(Integer.valueOf(1000), options.getConfigValue("String", 10));
        assertEquals(Long.valueOf(1000), options.getConfigValue("String", 10L));
        assertEquals("1000", options.getConfigValue("Int", "10"));
        assertEquals(Double.valueOf(1000), options.getConfigValue("Int", 1.0d));
        assertTrue(options.getConfigValue("Bool", false));
        assertEquals(RetractionPolicy.RETRACT_ON_EDIT,
                options.getConfigValue("Policy", RetractionPolicy.KEEP_UNTIL_REPLACED));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConversion() {
        ConfigurationParameters.of("Policy", "never").getConfigValue("Policy", RetractionPolicy.KEEP_UNTIL_REPLACED);
    }
}
