package io.surfworks.loopweaver.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes graphs and node lists as JSON for inspection.
 *
 * <p>Nested graphs are written inline under the attribute that owns them:
 * <pre>{@code
 * {
 *   "op": "Loop", "name": "loop__7", "inputs": [...], "outputs": [...],
 *   "attributes": { "body": { "graph": { "name": "loop-body-graph", "nodes": [...] } } }
 * }
 * }</pre>
 *
 * <p>This is a debugging format, not a model file format.
 */
public final class GraphJsonWriter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private GraphJsonWriter() {
    }

    public static String toJson(Graph graph) {
        return GSON.toJson(graphTree(graph));
    }

    public static String toJson(List<Node> nodes) {
        return GSON.toJson(nodesTree(nodes));
    }

    /**
     * Writes a graph to a file, creating parent directories.
     *
     * @throws IOException if writing fails
     */
    public static void write(Graph graph, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, toJson(graph), StandardCharsets.UTF_8);
    }

    /**
     * Returns the JSON tree of a graph.
     */
    public static JsonObject graphTree(Graph graph) {
        JsonObject json = new JsonObject();
        json.addProperty("name", graph.name());
        json.add("inputs", valueInfos(graph.inputs()));
        json.add("outputs", valueInfos(graph.outputs()));
        json.add("nodes", nodesTree(graph.nodes()));
        return json;
    }

    private static JsonArray nodesTree(List<Node> nodes) {
        JsonArray array = new JsonArray();
        for (Node node : nodes) {
            array.add(nodeTree(node));
        }
        return array;
    }

    private static JsonObject nodeTree(Node node) {
        JsonObject json = new JsonObject();
        json.addProperty("op", node.opType());
        json.addProperty("name", node.name());
        json.add("inputs", GSON.toJsonTree(node.inputs()));
        json.add("outputs", GSON.toJsonTree(node.outputs()));
        if (!node.attributes().isEmpty()) {
            JsonObject attrs = new JsonObject();
            for (Map.Entry<String, AttributeValue> entry : node.attributes().entrySet()) {
                attrs.add(entry.getKey(), attributeTree(entry.getValue()));
            }
            json.add("attributes", attrs);
        }
        return json;
    }

    private static JsonElement attributeTree(AttributeValue value) {
        JsonObject json = new JsonObject();
        if (value instanceof AttributeValue.IntsAttr ints) {
            json.add("ints", GSON.toJsonTree(ints.values()));
        } else if (value instanceof AttributeValue.TensorAttr tensorAttr) {
            json.add("tensor", tensorTree(tensorAttr.value()));
        } else if (value instanceof AttributeValue.GraphAttr graphAttr) {
            json.add("graph", graphTree(graphAttr.graph()));
        }
        return json;
    }

    private static JsonObject tensorTree(TensorValue tensor) {
        JsonObject json = new JsonObject();
        json.addProperty("dtype", tensor.elementType().irName());
        json.add("shape", GSON.toJsonTree(tensor.shape()));
        JsonArray data = new JsonArray();
        for (int i = 0; i < tensor.elementCount(); i++) {
            Object element = tensor.get(i);
            if (element instanceof Boolean b) {
                data.add(b);
            } else {
                data.add((Number) element);
            }
        }
        json.add("data", data);
        return json;
    }

    private static JsonArray valueInfos(List<ValueInfo> infos) {
        JsonArray array = new JsonArray();
        for (ValueInfo info : infos) {
            JsonObject json = new JsonObject();
            json.addProperty("name", info.name());
            json.addProperty("dtype", info.elementType().irName());
            json.add("shape", GSON.toJsonTree(info.shape().dims()));
            array.add(json);
        }
        return array;
    }
}
