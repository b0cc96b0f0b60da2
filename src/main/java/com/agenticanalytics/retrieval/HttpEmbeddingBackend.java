package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpEmbeddingBackend implements EmbeddingBackend {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;

    public HttpEmbeddingBackend(OkHttpClient httpClient, String endpoint, String apiKey, String model) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public List<float[]> encode(List<String> texts) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            body.put("model", model);
        }
        body.put("input", texts);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("Embedding endpoint " + endpoint + " returned HTTP " + response.code());
            }
            List<float[]> vectors = parse(mapper.readTree(responseBody.string()));
            if (vectors.size() != texts.size()) {
                throw new IOException("Embedding endpoint returned " + vectors.size() + " vectors for "
                        + texts.size() + " inputs");
            }
            return vectors;
        }
    }

    @Override
    public String modelName() {
        return model == null || model.isBlank() ? endpoint : model;
    }

    private List<float[]> parse(JsonNode root) throws IOException {
        List<float[]> out = new ArrayList<>();
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            for (JsonNode node : embeddings) {
                out.add(toVector(node));
            }
            return out;
        }
        JsonNode data = root.path("data");
        if (data.isArray()) {
            List<JsonNode> items = new ArrayList<>();
            data.forEach(items::add);
            items.sort(Comparator.comparingInt(item -> item.path("index").asInt(0)));
            for (JsonNode item : items) {
                out.add(toVector(item.path("embedding")));
            }
            return out;
        }
        JsonNode single = root.path("embedding");
        if (single.isArray()) {
            out.add(toVector(single));
            return out;
        }
        throw new IOException("Embedding response has no embeddings array");
    }

    private static float[] toVector(JsonNode node) throws IOException {
        if (!node.isArray() || node.isEmpty()) {
            throw new IOException("Embedding vector missing or empty");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            vector[i] = (float) node.get(i).asDouble();
        }
        return vector;
    }
}
