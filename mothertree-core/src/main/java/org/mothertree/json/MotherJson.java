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
package org.mothertree.json;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.Lists;

import org.apache.jackrabbit.oak.commons.json.JsopBuilder;
import org.apache.jackrabbit.oak.commons.json.JsopReader;
import org.apache.jackrabbit.oak.commons.json.JsopTokenizer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.BatchOperation;
import org.mothertree.api.ClauseNode;
import org.mothertree.api.Edge;
import org.mothertree.api.EdgeUpdate;
import org.mothertree.api.EditResult;
import org.mothertree.api.Reason;
import org.mothertree.api.TreeView;

/**
 * Renders editor results as JSON for transport layers and reads batch
 * requests of the form
 * {@code {"ops":[{"child":427568,"newMother":427567},{"child":427570,"newMother":null}]}}.
 * <ul>
 * <li>tree: {@code {"nodes":[...],"edges":[...],"scope":...,"version":...}}</li>
 * <li>edge update: {@code {"ok":true,"edge":{"from":...,"to":...,"source":...},"version":...}}</li>
 * <li>failure: {@code {"ok":false,"reason":"CYCLE"}}</li>
 * </ul>
 */
public final class MotherJson {

    public static final int SC_OK = 200;
    public static final int SC_NOT_FOUND = 404;
    public static final int SC_METHOD_NOT_ALLOWED = 405;
    public static final int SC_CONFLICT = 409;

    private MotherJson() {
    }

    /**
     * HTTP status a failure with the given reason is reported with.
     */
    public static int getStatusCode(@NotNull Reason reason) {
        switch (checkNotNull(reason)) {
            case NODE_NOT_FOUND:
                return SC_NOT_FOUND;
            case ROOTIFY_DISABLED:
                return SC_METHOD_NOT_ALLOWED;
            default:
                return SC_CONFLICT;
        }
    }

    public static int getStatusCode(@NotNull EditResult<?> result) {
        return result.isSuccess() ? SC_OK : getStatusCode(result.getReason());
    }

    @NotNull
    public static String toJson(@NotNull TreeView tree) {
        JsopBuilder json = new JsopBuilder();
        writeTree(json, tree);
        return json.toString();
    }

    /**
     * Renders the result of a reparent, rootify, undo or redo.
     */
    @NotNull
    public static String toJson(@NotNull EditResult<EdgeUpdate> result) {
        JsopBuilder json = new JsopBuilder();
        if (!result.isSuccess()) {
            writeFailure(json, result.getReason());
        } else {
            EdgeUpdate update = result.get();
            json.object();
            json.key("ok").value(true);
            json.key("edge");
            writeEdge(json, update.getEdge());
            json.key("version").value(update.getVersion());
            json.endObject();
        }
        return json.toString();
    }

    /**
     * Renders the result of a batch: the whole tree on success, the failure
     * otherwise.
     */
    @NotNull
    public static String batchToJson(@NotNull EditResult<TreeView> result) {
        JsopBuilder json = new JsopBuilder();
        if (result.isSuccess()) {
            writeTree(json, result.get());
        } else {
            writeFailure(json, result.getReason());
        }
        return json.toString();
    }

    @NotNull
    public static String toJson(@NotNull Reason reason) {
        JsopBuilder json = new JsopBuilder();
        writeFailure(json, reason);
        return json.toString();
    }

    /**
     * Parses a batch request. A missing or {@code null} new mother detaches
     * the child.
     *
     * @throws IllegalArgumentException if the request is malformed
     */
    @NotNull
    public static List<BatchOperation> readBatch(@NotNull String json) {
        JsopReader reader = new JsopTokenizer(checkNotNull(json));
        List<BatchOperation> ops = null;
        reader.read('{');
        if (!reader.matches('}')) {
            do {
                String name = reader.readString();
                reader.read(':');
                checkArgument("ops".equals(name), "Unexpected property %s", name);
                ops = readOperations(reader);
            } while (reader.matches(','));
            reader.read('}');
        }
        reader.read(JsopReader.END);
        checkArgument(ops != null, "Missing property ops");
        return ops;
    }

    //------------------------------------------------------------< private >--

    private static List<BatchOperation> readOperations(JsopReader reader) {
        List<BatchOperation> ops = Lists.newArrayList();
        reader.read('[');
        for (boolean first = true; !reader.matches(']'); first = false) {
            if (!first) {
                reader.read(',');
            }
            ops.add(readOperation(reader));
        }
        return ops;
    }

    private static BatchOperation readOperation(JsopReader reader) {
        Integer child = null;
        Integer newMother = null;
        reader.read('{');
        if (!reader.matches('}')) {
            do {
                String name = reader.readString();
                reader.read(':');
                if ("child".equals(name)) {
                    child = Integer.parseInt(reader.read(JsopReader.NUMBER));
                } else if ("newMother".equals(name)) {
                    if (!reader.matches(JsopReader.NULL)) {
                        newMother = Integer.parseInt(reader.read(JsopReader.NUMBER));
                    }
                } else {
                    throw new IllegalArgumentException("Unexpected property " + name);
                }
            } while (reader.matches(','));
            reader.read('}');
        }
        checkArgument(child != null, "Missing property child");
        return BatchOperation.of(child, newMother);
    }

    private static void writeFailure(JsopBuilder json, Reason reason) {
        json.object();
        json.key("ok").value(false);
        json.key("reason").value(reason.name());
        json.endObject();
    }

    private static void writeTree(JsopBuilder json, TreeView tree) {
        json.object();
        json.key("nodes").array();
        for (TreeView.Node node : tree.getNodes()) {
            writeNode(json, node);
        }
        json.endArray();
        json.key("edges").array();
        for (Edge edge : tree.getEdges()) {
            writeEdge(json, edge);
        }
        json.endArray();
        json.key("scope");
        writeString(json, tree.getScope());
        json.key("version").value(tree.getVersion());
        json.endObject();
    }

    private static void writeNode(JsopBuilder json, TreeView.Node node) {
        ClauseNode clause = node.getClause();
        json.object();
        json.key("id").value(clause.getId());
        json.key("slotsStart").value(clause.getSlotsStart());
        json.key("slotsEnd").value(clause.getSlotsEnd());
        json.key("slotCount").value(clause.getSlotCount());
        json.key("label").value(clause.getLabel());
        json.key("containerId").value(clause.getContainerId());
        json.key("inScope").value(node.isInScope());
        json.key("kind").value(clause.getKind());
        json.key("draggable").value(node.isDraggable());
        for (String tag : new String[] {ClauseNode.TYP, ClauseNode.RELA, ClauseNode.CODE,
                ClauseNode.TXT, ClauseNode.DOMAIN, ClauseNode.INSTRUCTION}) {
            json.key(tag);
            writeString(json, clause.getTag(tag));
        }
        json.key("originalMother");
        writeNumber(json, clause.getOriginalMother());
        json.key("coreFunctions").array();
        for (String function : clause.getCoreFunctions()) {
            json.value(function);
        }
        json.endArray();
        json.key("children").array();
        for (ClauseNode child : node.getChildren()) {
            json.object();
            json.key("id").value(child.getId());
            json.key("typ");
            writeString(json, child.getTyp());
            json.key("rela");
            writeString(json, child.getRela());
            json.key("code");
            writeString(json, child.getCode());
            json.endObject();
        }
        json.endArray();
        json.key("reference").value(clause.getReference());
        json.endObject();
    }

    private static void writeEdge(JsopBuilder json, Edge edge) {
        json.object();
        json.key("from").value(edge.getFrom());
        json.key("to");
        writeNumber(json, edge.getTo());
        json.key("source").value(edge.getSource().toString());
        json.endObject();
    }

    private static void writeString(JsopBuilder json, @Nullable String value) {
        if (value == null) {
            json.encodedValue("null");
        } else {
            json.value(value);
        }
    }

    private static void writeNumber(JsopBuilder json, @Nullable Integer value) {
        if (value == null) {
            json.encodedValue("null");
        } else {
            json.value(value.longValue());
        }
    }
}
