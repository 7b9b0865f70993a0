package com.eventpod.crawler.infra.http;

import com.eventpod.crawler.infra.retry.RetryExecutor;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonHttpClient {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T get(String url, Map<String, String> headers, Class<T> type, RetryPolicy policy) {
        return RetryExecutor.execute(policy, () -> fetchOnce(url, headers, type));
    }

    private <T> T fetchOnce(String url, Map<String, String> headers, Class<T> type) throws IOException {
        Request.Builder builder = new Request.Builder().url(url).get().header("Accept", "application/json");
        headers.forEach(builder::header);

        try (Response response = okHttpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();

            if (!response.isSuccessful()) {
                HttpStatusException error = new HttpStatusException(response.code(), url, text);
                if (error.isServerError()) {
                    log.warn("[HTTP] 서버 오류, 재시도 예정: status={}, url={}", response.code(), url);
                }
                throw error;
            }
            return objectMapper.readValue(text, type);
        }
    }
}
