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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

import org.apache.jackrabbit.oak.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edit policy of a mother editor.
 * <ul>
 * <li>{@code containerEnforced}: a clause may only be attached to a mother
 * in the same container (default {@code false})</li>
 * <li>{@code rootifyAllowed}: clauses may be detached to become roots
 * (default {@code true})</li>
 * <li>{@code maxDepth}: maximum number of clauses on a path from a root,
 * both ends included (default unbounded)</li>
 * </ul>
 */
public final class MotherTreeConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(MotherTreeConfiguration.class);

    public static final String PARAM_CONTAINER_ENFORCED = "mothertree.containerEnforced";

    public static final String PARAM_ROOTIFY_ALLOWED = "mothertree.rootifyAllowed";

    /**
     * Zero means unbounded. Negative values are ignored.
     */
    public static final String PARAM_MAX_DEPTH = "mothertree.maxDepth";

    public static final MotherTreeConfiguration DEFAULT = builder().build();

    private final boolean containerEnforced;

    private final boolean rootifyAllowed;

    private final Integer maxDepth;

    private MotherTreeConfiguration(boolean containerEnforced, boolean rootifyAllowed,
                                    @Nullable Integer maxDepth) {
        this.containerEnforced = containerEnforced;
        this.rootifyAllowed = rootifyAllowed;
        this.maxDepth = maxDepth;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from system properties. Missing or malformed
     * values fall back to the defaults.
     */
    @NotNull
    public static MotherTreeConfiguration fromSystemProperties() {
        boolean containerEnforced = SystemPropertySupplier.create(PARAM_CONTAINER_ENFORCED, false)
                .loggingTo(LOG).get();
        boolean rootifyAllowed = SystemPropertySupplier.create(PARAM_ROOTIFY_ALLOWED, true)
                .loggingTo(LOG).get();
        int depth = SystemPropertySupplier.create(PARAM_MAX_DEPTH, 0)
                .loggingTo(LOG).validateWith(value -> value >= 0).get();
        return new MotherTreeConfiguration(containerEnforced, rootifyAllowed,
                depth > 0 ? Integer.valueOf(depth) : null);
    }

    public boolean isContainerEnforced() {
        return containerEnforced;
    }

    public boolean isRootifyAllowed() {
        return rootifyAllowed;
    }

    /**
     * @return the maximum depth, or {@code null} if depth is unbounded
     */
    @Nullable
    public Integer getMaxDepth() {
        return maxDepth;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MotherTreeConfiguration)) {
            return false;
        }
        MotherTreeConfiguration that = (MotherTreeConfiguration) other;
        return containerEnforced == that.containerEnforced
                && rootifyAllowed == that.rootifyAllowed
                && Objects.equals(maxDepth, that.maxDepth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerEnforced, rootifyAllowed, maxDepth);
    }

    @Override
    public String toString() {
        return "MotherTreeConfiguration{containerEnforced=" + containerEnforced
                + ", rootifyAllowed=" + rootifyAllowed + ", maxDepth=" + maxDepth + "}";
    }

    //-----------------------------------------------------------< Builder >--

    public static final class Builder {

        private boolean containerEnforced = false;

        private boolean rootifyAllowed = true;

        private Integer maxDepth;

        private Builder() {
        }

        public Builder containerEnforced(boolean enforced) {
            this.containerEnforced = enforced;
            return this;
        }

        public Builder rootifyAllowed(boolean allowed) {
            this.rootifyAllowed = allowed;
            return this;
        }

        /**
         * @param maxDepth maximum depth of at least 1, or {@code null} for
         *                 unbounded trees
         */
        public Builder maxDepth(@Nullable Integer maxDepth) {
            checkArgument(maxDepth == null || maxDepth >= 1,
                    "Maximum depth must be at least 1: %s", maxDepth);
            this.maxDepth = maxDepth;
            return this;
        }

        @NotNull
        public MotherTreeConfiguration build() {
            return new MotherTreeConfiguration(containerEnforced, rootifyAllowed, maxDepth);
        }
    }
}
