package com.ke.hal.collaborator.action;

import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

@Slf4j
public class HttpActionCaller implements ActionCaller {

    private final OkHttpClient okHttpClient;

    public HttpActionCaller(OkHttpClient okHttpClient) {
        this.okHttpClient = okHttpClient;
    }

    @Override
    public ActionResponse invoke(ActionRequest request, Duration timeout) {
        HttpUrl base = HttpUrl.parse(request.getUrl());
        if(base == null) {
            throw new IllegalArgumentException("invalid action url: " + request.getUrl());
        }
        HttpUrl.Builder urlBuilder = base.newBuilder();
        request.getQuery().forEach(urlBuilder::addQueryParameter);

        String method = request.getMethod().toUpperCase(Locale.ROOT);
        RequestBody body = null;
        if(!"GET".equals(method) && !"HEAD".equals(method)) {
            String contentType = StringUtils.defaultIfBlank(request.getContentType(), "application/json");
            body = RequestBody.create(StringUtils.defaultString(request.getBody()), MediaType.parse(contentType));
        }

        Request.Builder builder = new Request.Builder()
                .url(urlBuilder.build())
                .method(method, body);
        request.getHeaders().forEach(builder::header);

        OkHttpClient client = okHttpClient.newBuilder().callTimeout(timeout).build();
        log.info("Invoking action {} {}", method, base);
        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            return new ActionResponse(response.code(), responseBody == null ? "" : responseBody.string());
        } catch (IOException e) {
            throw new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "action call failed: " + e.getMessage(), e);
        }
    }
}
