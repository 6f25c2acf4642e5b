package com.newsverdict.sources.structured;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsverdict.sources.config.ApiSourceConfig;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

public class NewsApiSource extends StructuredApiSource {
    public NewsApiSource(ApiSourceConfig config, String apiKey) {
        super(config, apiKey);
    }

    @Override
    protected HttpRequest.Builder buildRequest(String upstreamQuery, int limit, String apiKey) {
        String query = "/v2/everything?q=" + encode(upstreamQuery)
                + "&pageSize=" + Math.max(1, Math.min(limit, 100))
                + "&language=" + encode(config.language())
                + "&sortBy=publishedAt";
        return HttpRequest.newBuilder(endpoint(query)).header("X-Api-Key", apiKey);
    }

    @Override
    protected String successStatus() {
        return "ok";
    }

    @Override
    protected List<ApiEntry> entries(JsonNode root) {
        List<ApiEntry> entries = new ArrayList<>();
        for (JsonNode article : root.path("articles")) {
            entries.add(new ApiEntry(
                    text(article.path("source"), "name"),
                    text(article, "title"),
                    text(article, "description"),
                    text(article, "content")
            ));
        }
        return entries;
    }

    @Override
    protected String errorCode(JsonNode root) {
        return text(root, "code");
    }

    @Override
    protected String errorMessage(JsonNode root) {
        return text(root, "message");
    }
}
