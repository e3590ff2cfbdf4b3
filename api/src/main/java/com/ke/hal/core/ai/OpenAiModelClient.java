package com.ke.hal.core.ai;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.configuration.ModelProperties;
import com.ke.hal.exception.ContextLengthExceededException;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.ModelClientException;
import com.ke.hal.exception.PersistenceException;
import com.ke.hal.exception.TransientCollaboratorException;
import com.ke.hal.util.JacksonUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * OpenAI 兼容的 /chat/completions 适配器
 */
@Slf4j
public class OpenAiModelClient implements ModelClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final ModelProperties modelProperties;

    public OpenAiModelClient(OkHttpClient okHttpClient, ModelProperties modelProperties) {
        this.modelProperties = modelProperties;
        this.client = okHttpClient.newBuilder()
                .connectTimeout(modelProperties.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(modelProperties.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        String body = JacksonUtils.serialize(buildCompletionRequest(request));
        Request.Builder builder = new Request.Builder()
                .url(StringUtils.removeEnd(modelProperties.getUrl(), "/") + "/chat/completions")
                .post(RequestBody.create(body, JSON));
        if(StringUtils.isNotBlank(modelProperties.getApiKey())) {
            builder.header("Authorization", "Bearer " + modelProperties.getApiKey());
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String content = responseBody == null ? "" : responseBody.string();
            if(!response.isSuccessful()) {
                throw mapError(response.code(), content);
            }
            CompletionResponse completion = JacksonUtils.deserialize(content, CompletionResponse.class);
            return toModelResponse(completion);
        } catch (IOException e) {
            throw new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "model endpoint unreachable: " + e.getMessage(), e);
        } catch (PersistenceException e) {
            throw new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "malformed model response", e);
        }
    }

    private RuntimeException mapError(int code, String body) {
        log.warn("Model endpoint returned {}: {}", code, StringUtils.abbreviate(body, 500));
        if(code == 429) {
            return new TransientCollaboratorException(ErrorCode.RATE_LIMIT, "model rate limit exceeded");
        }
        if(code >= 500 || code == 499 || code == 408) {
            return new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "model endpoint error " + code);
        }
        if(code == 400 && isContextLengthError(body)) {
            return new ContextLengthExceededException("model context length exceeded");
        }
        return new ModelClientException(code, "model request rejected with " + code + ": " + StringUtils.abbreviate(body, 200));
    }

    private boolean isContextLengthError(String body) {
        return StringUtils.containsIgnoreCase(body, "context_length_exceeded")
                || StringUtils.containsIgnoreCase(body, "maximum context length");
    }

    private CompletionRequest buildCompletionRequest(ModelRequest request) {
        CompletionRequest completion = new CompletionRequest();
        completion.setModel(request.getModel());
        List<Message> messages = new ArrayList<>();
        if(StringUtils.isNotBlank(request.getInstructions())) {
            Message system = new Message();
            system.setRole("system");
            system.setContent(request.getInstructions());
            messages.add(system);
        }
        for (ChatEntry entry : request.getHistory()) {
            Message message = new Message();
            message.setRole(entry.getRole());
            message.setContent(entry.getContent());
            message.setToolCallId(entry.getToolCallId());
            if(entry.hasToolCalls()) {
                message.setToolCalls(entry.getToolCalls().stream().map(this::toToolCall).collect(Collectors.toList()));
            }
            messages.add(message);
        }
        completion.setMessages(messages);
        if(CollectionUtils.isNotEmpty(request.getTools())) {
            completion.setTools(request.getTools().stream().map(spec -> {
                Tool tool = new Tool();
                Function function = new Function();
                function.setName(spec.getName());
                function.setDescription(spec.getDescription());
                function.setParameters(spec.getParameters());
                tool.setFunction(function);
                return tool;
            }).collect(Collectors.toList()));
        }
        return completion;
    }

    private ToolCall toToolCall(ToolInvocation invocation) {
        ToolCall toolCall = new ToolCall();
        toolCall.setId(invocation.getId());
        Function function = new Function();
        function.setName(invocation.getName());
        function.setArguments(invocation.getArguments());
        toolCall.setFunction(function);
        return toolCall;
    }

    private ModelResponse toModelResponse(CompletionResponse completion) {
        if(completion == null || CollectionUtils.isEmpty(completion.getChoices()) || completion.getChoices().get(0).getMessage() == null) {
            throw new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "model response has no choices");
        }
        Message message = completion.getChoices().get(0).getMessage();
        if(CollectionUtils.isNotEmpty(message.getToolCalls())) {
            return ModelResponse.toolCalls(message.getToolCalls().stream()
                    .map(call -> new ToolInvocation(call.getId(), call.getFunction().getName(), call.getFunction().getArguments()))
                    .collect(Collectors.toList()));
        }
        return ModelResponse.text(StringUtils.defaultString(message.getContent()));
    }

    @Data
    public static class CompletionRequest {
        private String model;
        private List<Message> messages;
        private List<Tool> tools;
    }

    @Data
    public static class CompletionResponse {
        private String id;
        private List<Choice> choices;
    }

    @Data
    public static class Choice {
        private Integer index;
        private Message message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class Message {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class Tool {
        private String type = "function";
        private Function function;
    }

    @Data
    public static class ToolCall {
        private String id;
        private String type = "function";
        private Function function;
    }

    @Data
    public static class Function {
        private String name;
        private String description;
        private Map<String, Object> parameters;
        private String arguments;
    }
}
