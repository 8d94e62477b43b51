package io.github.cyfko.compoundfilter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.compoundfilter.core.wire.WireCompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;
import io.github.cyfko.compoundfilter.core.wire.WirePropertyFilter;

import java.util.Objects;
import java.util.Optional;

/**
 * Writes {@link WireFilter}s as the JSON filter object of a remote query request.
 *
 * <pre>{@code
 * {"property": "Price", "number": {"less_than": 10}}
 * {"timestamp": "created_time", "created_time": {"past_week": {}}}
 * {"or": [{"and": [...]}, {"property": ...}]}
 * }</pre>
 *
 * @since 1.0.0
 */
public class WireFilterJsonWriter {

    private final ObjectMapper mapper;

    public WireFilterJsonWriter() {
        this(new ObjectMapper());
    }

    public WireFilterJsonWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    public ObjectNode toJson(WireFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        if (filter instanceof WirePropertyFilter leaf) {
            return leafToJson(leaf);
        }

        WireCompoundFilter compound = (WireCompoundFilter) filter;
        ObjectNode node = mapper.createObjectNode();
        ArrayNode members = node.putArray(compound.operator().wireKey());
        for (WireFilter member : compound.members()) {
            members.add(toJson(member));
        }
        return node;
    }

    /**
     * Builds a query request body: {@code {"filter": ...}} when a filter is present, {@code {}}
     * otherwise.
     */
    public ObjectNode toQueryBody(Optional<WireFilter> filter) {
        ObjectNode body = mapper.createObjectNode();
        filter.ifPresent(f -> body.set("filter", toJson(f)));
        return body;
    }

    /**
     * @throws FilterJsonException if serialization fails
     */
    public String writeValueAsString(WireFilter filter) {
        try {
            return mapper.writeValueAsString(toJson(filter));
        } catch (JsonProcessingException e) {
            throw new FilterJsonException("Failed to write filter as JSON", e);
        }
    }

    private ObjectNode leafToJson(WirePropertyFilter leaf) {
        ObjectNode node = mapper.createObjectNode();
        String categoryKey = leaf.category().wireKey();
        if (leaf.isTimestamp()) {
            node.put("timestamp", categoryKey);
        } else {
            node.put("property", leaf.property());
        }

        Object raw = leaf.payload();
        JsonNode payload = raw == null ? NullNode.getInstance() : mapper.valueToTree(raw);
        node.putObject(categoryKey).set(leaf.operator().wireKey(), payload);
        return node;
    }
}
