package com.newsverdict.sources.structured;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsverdict.sources.config.ApiSourceConfig;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

public class NewsDataSource extends StructuredApiSource {
    public NewsDataSource(ApiSourceConfig config, String apiKey) {
        super(config, apiKey);
    }

    @Override
    protected HttpRequest.Builder buildRequest(String upstreamQuery, int limit, String apiKey) {
        StringBuilder query = new StringBuilder("/api/1/news?apikey=").append(encode(apiKey))
                .append("&q=").append(encode(upstreamQuery))
                .append("&language=").append(encode(config.language()))
                .append("&size=").append(Math.max(1, Math.min(limit, 50)));
        if (config.country() != null && !config.country().isBlank()) {
            query.append("&country=").append(encode(config.country()));
        }
        return HttpRequest.newBuilder(endpoint(query.toString()));
    }

    @Override
    protected String successStatus() {
        return "success";
    }

    @Override
    protected List<ApiEntry> entries(JsonNode root) {
        List<ApiEntry> entries = new ArrayList<>();
        for (JsonNode result : root.path("results")) {
            entries.add(new ApiEntry(
                    text(result, "source_id"),
                    text(result, "title"),
                    text(result, "description"),
                    text(result, "content")
            ));
        }
        return entries;
    }

    @Override
    protected String errorCode(JsonNode root) {
        JsonNode results = root.path("results");
        return results.isObject() ? text(results, "code") : text(root, "code");
    }

    @Override
    protected String errorMessage(JsonNode root) {
        JsonNode results = root.path("results");
        return results.isObject() ? text(results, "message") : text(root, "message");
    }
}
