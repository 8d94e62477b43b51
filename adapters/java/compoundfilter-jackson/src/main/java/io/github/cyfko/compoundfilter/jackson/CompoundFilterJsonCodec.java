package io.github.cyfko.compoundfilter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.FilterValue;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes client filter trees in the editor's JSON format.
 *
 * <pre>{@code
 * {
 *   "type": "group", "operator": "and", "not": false,
 *   "nodes": [
 *     {"type": "property", "property": "Price", "propertyType": "number", "operator": "less_than", "value": 10},
 *     {"type": "property", "property": "", "propertyType": "", "operator": "equals", "value": null}
 *   ]
 * }
 * }</pre>
 * <p>
 * An empty {@code property} or {@code propertyType} denotes an incomplete rule. JSON
 * {@code null} is the empty filter. Values map to {@link FilterValue} by JSON type: boolean,
 * string, number, {@code null}, or a {@code {"start", "end"}} object for date ranges.
 * </p>
 *
 * @since 1.0.0
 */
public class CompoundFilterJsonCodec {

    private static final String TYPE = "type";
    private static final String TYPE_PROPERTY = "property";
    private static final String TYPE_GROUP = "group";

    private final ObjectMapper mapper;

    public CompoundFilterJsonCodec() {
        this(new ObjectMapper());
    }

    public CompoundFilterJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    /**
     * @return the tree as JSON, {@link NullNode} for the empty filter
     */
    public JsonNode toJson(CompoundFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        return filter.root().<JsonNode>map(this::nodeToJson).orElse(NullNode.getInstance());
    }

    public String write(CompoundFilter filter) {
        try {
            return mapper.writeValueAsString(toJson(filter));
        } catch (JsonProcessingException e) {
            throw new FilterJsonException("Failed to write filter as JSON", e);
        }
    }

    /**
     * @throws FilterJsonException if the text is not JSON or not a filter tree
     */
    public CompoundFilter read(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FilterJsonException("Malformed filter JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(node);
    }

    /**
     * @throws FilterJsonException if the node is not a filter tree
     */
    public CompoundFilter fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return CompoundFilter.empty();
        }
        return CompoundFilter.of(readNode(json, ""));
    }

    private ObjectNode nodeToJson(FilterNode node) {
        ObjectNode json = mapper.createObjectNode();
        if (node instanceof FilterRule rule) {
            json.put(TYPE, TYPE_PROPERTY);
            json.put("property", rule.selectedProperty().orElse(""));
            json.put("propertyType", rule.selectedCategory().map(PropertyCategory::wireKey).orElse(""));
            json.put("operator", rule.operator().wireKey());
            Object raw = rule.value().raw();
            json.set("value", raw == null ? NullNode.getInstance() : mapper.valueToTree(raw));
            return json;
        }

        FilterGroup group = (FilterGroup) node;
        json.put(TYPE, TYPE_GROUP);
        json.put("operator", group.operator().wireKey());
        json.put("not", group.negated());
        ArrayNode nodes = json.putArray("nodes");
        for (FilterNode child : group.children()) {
            nodes.add(nodeToJson(child));
        }
        return json;
    }

    private FilterNode readNode(JsonNode json, String pointer) {
        if (!json.isObject()) {
            throw new FilterJsonException("Expected a filter object at " + location(pointer));
        }
        String type = json.path(TYPE).asText("");
        return switch (type) {
            case TYPE_PROPERTY -> readRule(json, pointer);
            case TYPE_GROUP -> readGroup(json, pointer);
            default -> throw new FilterJsonException("Unknown node type '" + type + "' at " + location(pointer));
        };
    }

    private FilterRule readRule(JsonNode json, String pointer) {
        String property = json.path("property").asText("");

        String categoryKey = json.path("propertyType").asText("");
        PropertyCategory category = null;
        if (!categoryKey.isEmpty()) {
            category = PropertyCategory.fromWireKey(categoryKey).orElseThrow(() -> new FilterJsonException(
                    "Unknown property type '" + categoryKey + "' at " + location(pointer)));
        }

        String operatorKey = json.path("operator").asText("");
        FilterOperator operator = FilterOperator.fromWireKey(operatorKey).orElseThrow(() -> new FilterJsonException(
                "Unknown operator '" + operatorKey + "' at " + location(pointer)));

        FilterValue value = readValue(json.path("value"), pointer + "/value");
        return new FilterRule(property, category, operator, value);
    }

    private FilterGroup readGroup(JsonNode json, String pointer) {
        String operatorKey = json.path("operator").asText("");
        GroupOperator operator = GroupOperator.fromWireKey(operatorKey).orElseThrow(() -> new FilterJsonException(
                "Unknown group operator '" + operatorKey + "' at " + location(pointer)));

        JsonNode nodes = json.path("nodes");
        if (!nodes.isArray() || nodes.isEmpty()) {
            throw new FilterJsonException("Group must have at least one node at " + location(pointer));
        }

        List<FilterNode> children = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            children.add(readNode(nodes.get(i), pointer + "/nodes/" + i));
        }
        return new FilterGroup(operator, json.path("not").asBoolean(false), children);
    }

    private static FilterValue readValue(JsonNode json, String pointer) {
        if (json.isMissingNode() || json.isNull()) {
            return FilterValue.none();
        }
        if (json.isBoolean()) {
            return FilterValue.of(json.booleanValue());
        }
        if (json.isNumber()) {
            return FilterValue.of(json.decimalValue());
        }
        if (json.isTextual()) {
            return FilterValue.of(json.textValue());
        }
        if (json.isObject() && json.path("start").isTextual()) {
            JsonNode end = json.path("end");
            return FilterValue.dateRange(json.get("start").textValue(), end.isTextual() ? end.textValue() : null);
        }
        throw new FilterJsonException("Unsupported filter value at " + location(pointer));
    }

    private static String location(String pointer) {
        return pointer.isEmpty() ? "/" : pointer;
    }
}
