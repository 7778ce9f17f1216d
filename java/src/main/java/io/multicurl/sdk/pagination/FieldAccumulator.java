package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.multicurl.sdk.internal.Json;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts a single attribute from every record: the result maps each record id to {@code {field: value}}.
 *
 * <p>
 * Records lacking an id or the field are skipped. Merges are keyed by id, so duplicate ids resolve last-write-wins
 * and the outcome does not depend on the order pages arrive in.
 * </p>
 */
public final class FieldAccumulator implements PageAccumulator<Map<String, ObjectNode>> {

    private final String field;
    private final Map<String, ObjectNode> byId = new LinkedHashMap<>();

    public FieldAccumulator(String field) {
        this.field = Objects.requireNonNull(field, "field");
    }

    @Override
    public void accept(int page, JsonNode data) {
        for (JsonNode item : PageAccumulator.items(data)) {
            JsonNode id = item.get("id");
            JsonNode value = item.get(field);
            if (id == null || id.isNull() || value == null || value.isNull()) {
                continue;
            }
            byId.computeIfAbsent(id.asText(), ignored -> Json.mapper().createObjectNode()).set(field, value);
        }
    }

    @Override
    public Map<String, ObjectNode> result() {
        return byId;
    }
}
