/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.mothertree.spi.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mothertree.spi.config.MotherTreeConfiguration.PARAM_CONTAINER_ENFORCED;
import static org.mothertree.spi.config.MotherTreeConfiguration.PARAM_MAX_DEPTH;
import static org.mothertree.spi.config.MotherTreeConfiguration.PARAM_ROOTIFY_ALLOWED;

import com.google.common.collect.ImmutableList;

import ch.qos.logback.classic.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mothertree.junit.LogCustomizer;

public class MotherTreeConfigurationTest {

    private final LogCustomizer logs = LogCustomizer.forLogger(MotherTreeConfiguration.class)
            .enable(Level.TRACE).create();

    @Before
    public void before() {
        clearProperties();
        logs.starting();
    }

    @After
    public void after() {
        logs.finished();
        clearProperties();
    }

    @Test
    public void defaults() {
        MotherTreeConfiguration config = MotherTreeConfiguration.DEFAULT;
        assertFalse(config.isContainerEnforced());
        assertTrue(config.isRootifyAllowed());
        assertNull(config.getMaxDepth());
        assertEquals(config, MotherTreeConfiguration.fromSystemProperties());
    }

    @Test
    public void unsetPropertiesAreTraced() {
        MotherTreeConfiguration.fromSystemProperties();
        assertEquals(ImmutableList.of(
                "System property mothertree.containerEnforced not set",
                "System property mothertree.rootifyAllowed not set",
                "System property mothertree.maxDepth not set"), logs.getLogs());
    }

    @Test
    public void systemProperties() {
        System.setProperty(PARAM_CONTAINER_ENFORCED, "TRUE");
        System.setProperty(PARAM_ROOTIFY_ALLOWED, "false");
        System.setProperty(PARAM_MAX_DEPTH, "8");
        MotherTreeConfiguration config = MotherTreeConfiguration.fromSystemProperties();
        assertEquals(MotherTreeConfiguration.builder()
                .containerEnforced(true).rootifyAllowed(false).maxDepth(8).build(), config);
        assertTrue(logs.getLogs().contains("System property mothertree.maxDepth found to be '8'"));
    }

    @Test
    public void booleansOtherThanTrueReadAsFalse() {
        System.setProperty(PARAM_CONTAINER_ENFORCED, "nonsense");
        System.setProperty(PARAM_ROOTIFY_ALLOWED, "yes");
        MotherTreeConfiguration config = MotherTreeConfiguration.fromSystemProperties();
        assertFalse(config.isContainerEnforced());
        assertFalse(config.isRootifyAllowed());
    }

    @Test
    public void zeroDepthIsUnbounded() {
        System.setProperty(PARAM_MAX_DEPTH, "0");
        assertNull(MotherTreeConfiguration.fromSystemProperties().getMaxDepth());
    }

    @Test
    public void negativeDepthIsIgnored() {
        System.setProperty(PARAM_MAX_DEPTH, "-3");
        assertNull(MotherTreeConfiguration.fromSystemProperties().getMaxDepth());
        assertTrue(logs.getLogs().contains(
                "Ignoring invalid value '-3' for system property mothertree.maxDepth"));
    }

    @Test
    public void malformedDepth() {
        System.setProperty(PARAM_MAX_DEPTH, "deep");
        assertEquals(MotherTreeConfiguration.DEFAULT, MotherTreeConfiguration.fromSystemProperties());
        assertTrue(logs.getLogs().contains(
                "Ignoring malformed value 'deep' for system property mothertree.maxDepth"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroDepthInBuilder() {
        MotherTreeConfiguration.builder().maxDepth(0);
    }

    private static void clearProperties() {
        System.clearProperty(PARAM_CONTAINER_ENFORCED);
        System.clearProperty(PARAM_ROOTIFY_ALLOWED);
        System.clearProperty(PARAM_MAX_DEPTH);
    }
}
