package com.pitwall.client;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.QueryMap;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Retrofit-based implementation of UpstreamClient.
 */
@Slf4j
public class OpenF1Client implements UpstreamClient {

    private final OpenF1Api api;
    private final ObjectMapper objectMapper;

    public OpenF1Client(String baseUrl, ObjectMapper objectMapper, Timeouts timeouts) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(timeouts.connect())
                .readTimeout(timeouts.read())
                .callTimeout(timeouts.call())
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(objectMapper))
                .client(client)
                .build();

        this.api = retrofit.create(OpenF1Api.class);

        log.info("Upstream client initialized: baseUrl={}, timeouts={}", normalizedUrl, timeouts);
    }

    @Override
    public <T> List<T> call(DataCategory category, FetchParams params, Class<T> recordType) {
        Map<String, String> query = params.toQueryMap();
        String description = "GET /" + category.getPath();

        Response<JsonNode> response;
        try {
            response = api.fetch(category.getPath(), query).execute();
        } catch (IOException e) {
            // timeout 포함 네트워크 계층 오류
            throw new UpstreamException(category, description + " failed: " + e.getMessage(), e);
        }

        if (!response.isSuccessful()) {
            throw new UpstreamException(
                    category,
                    response.code(),
                    description + " failed: " + response.code() + " " + response.message()
            );
        }

        JsonNode body = response.body();
        if (body == null || !body.isArray()) {
            throw new UpstreamException(
                    category,
                    response.code(),
                    description + " returned a non-array body"
            );
        }

        JavaType listType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, recordType);

        List<T> records;
        try {
            records = objectMapper.convertValue(body, listType);
        } catch (IllegalArgumentException e) {
            throw new UpstreamException(category, description + " returned malformed records", e);
        }

        log.debug("{} {} -> {} records", description, query, records.size());
        return records;
    }

    /**
     * OkHttp timeout settings
     */
    public record Timeouts(Duration connect, Duration read, Duration call) {

        public static Timeouts defaults() {
            return new Timeouts(Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(30));
        }
    }

    /**
     * Retrofit service interface: every category is a plain GET on its path.
     */
    interface OpenF1Api {
        @GET("{category}")
        Call<JsonNode> fetch(@Path(value = "category", encoded = true) String category,
                             @QueryMap Map<String, String> query);
    }
}
