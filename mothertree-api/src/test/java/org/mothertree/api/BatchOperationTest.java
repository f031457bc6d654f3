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
package org.mothertree.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class BatchOperationTest {

    @Test
    public void reparentAndRootify() {
        BatchOperation reparent = BatchOperation.reparent(5, 3);
        assertEquals(5, reparent.getChild());
        assertEquals(Integer.valueOf(3), reparent.getNewMother());
        assertFalse(reparent.isRootify());

        BatchOperation rootify = BatchOperation.rootify(5);
        assertNull(rootify.getNewMother());
        assertTrue(rootify.isRootify());

        assertEquals(rootify, BatchOperation.of(5, null));
        assertEquals(reparent, BatchOperation.of(5, 3));
    }

    @Test
    public void edge() {
        Edge root = new Edge(5, null, EdgeSource.USER);
        assertTrue(root.isRoot());
        assertEquals("user", root.getSource().toString());
        assertEquals(new Edge(5, 3, EdgeSource.ORIGINAL), new Edge(5, 3, EdgeSource.ORIGINAL));
        assertFalse(new Edge(5, 3, EdgeSource.ORIGINAL).equals(new Edge(5, 3, EdgeSource.USER)));
        assertEquals(EdgeSource.USER, EdgeSource.of(true));
        assertEquals(EdgeSource.ORIGINAL, EdgeSource.of(false));
    }
}
