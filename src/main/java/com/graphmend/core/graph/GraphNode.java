package com.graphmend.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a decision graph.
 *
 * id and kind are fixed at construction. category is only accepted for
 * FACTOR nodes. data is the open extraction-metadata map (value, value_std,
 * factor_type, uncertainty_drivers, is_status_quo, interventions, ...);
 * null means "absent", which is different from an empty map on the wire.
 */
public class GraphNode {

    public static final String DATA_VALUE               = "value";
    public static final String DATA_VALUE_STD           = "value_std";
    public static final String DATA_FACTOR_TYPE         = "factor_type";
    public static final String DATA_UNCERTAINTY_DRIVERS = "uncertainty_drivers";
    public static final String DATA_IS_STATUS_QUO       = "is_status_quo";
    public static final String DATA_INTERVENTIONS       = "interventions";
    public static final String DATA_OPERATOR            = "operator";

    private final String   id;
    private final NodeKind kind;

    private String              label;
    private FactorCategory      category;
    private Map<String, Object> data;
    private String              body;
    private UniformPrior        prior;

    public GraphNode(String id, NodeKind kind) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null (id=" + id + ")");
        }
        this.id   = id;
        this.kind = kind;
    }

    public GraphNode(String id, NodeKind kind, String label) {
        this(id, kind);
        this.label = label;
    }

    public static GraphNode factor(String id, String label, FactorCategory category) {
        GraphNode node = new GraphNode(id, NodeKind.FACTOR, label);
        node.setCategory(category);
        return node;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String   getId()    { return id; }
    public NodeKind getKind()  { return kind; }
    public String   getLabel() { return label; }
    public String   getBody()  { return body; }

    public void setLabel(String label) {
        this.label = label;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public UniformPrior getPrior() {
        return prior;
    }

    public void setPrior(UniformPrior prior) {
        if (prior != null && kind != NodeKind.FACTOR) {
            throw new IllegalStateException("Prior only applies to factor nodes (id=" + id + ")");
        }
        this.prior = prior;
    }

    public FactorCategory getCategory() {
        return category;
    }

    public void setCategory(FactorCategory category) {
        if (category != null && kind != NodeKind.FACTOR) {
            throw new IllegalStateException(
                    "Category only applies to factor nodes (id=" + id + ", kind=" + kind.wireName() + ")");
        }
        this.category = category;
    }

    /** Live data map, or null when the node carries no data. */
    public Map<String, Object> getData() {
        return data;
    }

    public boolean hasData() {
        return data != null;
    }

    public boolean hasDataField(String key) {
        return data != null && data.containsKey(key) && data.get(key) != null;
    }

    public Object getDataField(String key) {
        return data != null ? data.get(key) : null;
    }

    public void setData(Map<String, Object> data) {
        this.data = data != null ? new LinkedHashMap<>(data) : null;
    }

    public void putDataField(String key, Object value) {
        if (data == null) {
            data = new LinkedHashMap<>();
        }
        data.put(key, value);
    }

    /** @return true if the field was present (non-null) before removal. */
    public boolean removeDataField(String key) {
        if (data == null) {
            return false;
        }
        return data.remove(key) != null;
    }

    public void clearData() {
        this.data = null;
    }

    // =========================================================================
    // Copy
    // =========================================================================

    public GraphNode copy() {
        GraphNode copy = new GraphNode(id, kind, label);
        copy.category = category;
        copy.body     = body;
        copy.prior    = prior;
        copy.data     = data != null ? deepCopyMap(data) : null;
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopyMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> deepCopyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "GraphNode{id='" + id + "', kind=" + kind.wireName() + "}";
    }
}
