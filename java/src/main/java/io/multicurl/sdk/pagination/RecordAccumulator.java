package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps full records, concatenated in page order regardless of the order pages arrived in.
 */
public final class RecordAccumulator implements PageAccumulator<List<JsonNode>> {

    private final Map<Integer, List<JsonNode>> pages = new TreeMap<>();

    @Override
    public void accept(int page, JsonNode data) {
        pages.put(page, PageAccumulator.items(data));
    }

    @Override
    public List<JsonNode> result() {
        List<JsonNode> all = new ArrayList<>();
        pages.values().forEach(all::addAll);
        return all;
    }
}
