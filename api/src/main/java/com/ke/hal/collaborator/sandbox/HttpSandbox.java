package com.ke.hal.collaborator.sandbox;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.exception.PersistenceException;
import com.ke.hal.exception.SandboxException;
import com.ke.hal.util.JacksonUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * 通过 HTTP 调用隔离的代码执行服务
 */
@Slf4j
public class HttpSandbox implements Sandbox {

    private static final Duration TRANSPORT_GRACE = Duration.ofSeconds(5);

    private final OkHttpClient okHttpClient;
    private final String url;

    public HttpSandbox(OkHttpClient okHttpClient, String url) {
        this.okHttpClient = okHttpClient;
        this.url = url;
    }

    @Override
    public SandboxResult run(String code, Duration timeout) {
        ExecuteRequest executeRequest = new ExecuteRequest();
        executeRequest.setCode(code);
        executeRequest.setTimeoutSeconds(timeout.getSeconds());

        OkHttpClient client = okHttpClient.newBuilder()
                .callTimeout(timeout.plus(TRANSPORT_GRACE))
                .readTimeout(timeout.plus(TRANSPORT_GRACE))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(JacksonUtils.serialize(executeRequest), MediaType.parse("application/json")))
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body == null ? "" : body.string();
            if(!response.isSuccessful()) {
                throw new SandboxException("sandbox returned " + response.code());
            }
            SandboxResult result = JacksonUtils.deserialize(content, SandboxResult.class);
            if(result == null) {
                throw new SandboxException("sandbox returned an empty result");
            }
            return result;
        } catch (InterruptedIOException e) {
            log.warn("Sandbox call timed out after {}", timeout);
            return SandboxResult.timeout("execution timed out after " + timeout.getSeconds() + "s");
        } catch (IOException e) {
            throw new SandboxException("sandbox unreachable: " + e.getMessage(), e);
        } catch (PersistenceException e) {
            throw new SandboxException("malformed sandbox response", e);
        }
    }

    @Data
    public static class ExecuteRequest {
        private String code;
        @JsonProperty("timeout_seconds")
        private long timeoutSeconds;
    }
}
