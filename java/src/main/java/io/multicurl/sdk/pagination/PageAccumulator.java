package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the pages of one resource into a result.
 *
 * @param <R> result type handed back to the caller.
 */
public interface PageAccumulator<R> {

    /**
     * Merges the body of page {@code page}.
     */
    void accept(int page, JsonNode data);

    R result();

    /**
     * Items carried by a page body: the elements of an array, the body itself for a single object, nothing for an
     * empty body.
     */
    static List<JsonNode> items(JsonNode data) {
        List<JsonNode> items = new ArrayList<>();
        if (data == null || data.isNull() || data.isMissingNode()) {
            return items;
        }
        if (data.isArray()) {
            data.forEach(items::add);
        } else {
            items.add(data);
        }
        return items;
    }

    static int itemCount(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return 0;
        }
        return data.isArray() ? data.size() : 1;
    }
}
