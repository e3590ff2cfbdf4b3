package com.ke.hal.collaborator.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.configuration.ToolProperties;
import com.ke.hal.exception.AssistantException;
import com.ke.hal.exception.ErrorCode;
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

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 通过 HTTP 调用外部检索服务
 */
@Slf4j
public class HttpRetriever implements Retriever {

    private final OkHttpClient client;
    private final ToolProperties.RetrievalToolProperties retrievalProperties;

    public HttpRetriever(OkHttpClient okHttpClient, ToolProperties.RetrievalToolProperties retrievalProperties) {
        this.retrievalProperties = retrievalProperties;
        this.client = okHttpClient.newBuilder()
                .callTimeout(retrievalProperties.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public List<RetrievedChunk> search(String query, List<String> fileIds, int topK) {
        RetrievalRequest requestBody = new RetrievalRequest();
        requestBody.setQuery(query);
        requestBody.setFileIds(fileIds);
        requestBody.setTopK(topK);

        Request request = new Request.Builder()
                .url(retrievalProperties.getUrl())
                .post(RequestBody.create(JacksonUtils.serialize(requestBody), MediaType.parse("application/json")))
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body == null ? "" : body.string();
            if(response.code() == 429 || response.code() >= 500) {
                throw new TransientCollaboratorException(ErrorCode.RETRIEVAL_ERROR, "retrieval service returned " + response.code());
            }
            if(!response.isSuccessful()) {
                throw new AssistantException(ErrorCode.RETRIEVAL_ERROR, "retrieval request rejected with " + response.code());
            }
            RetrievalResponse retrievalResponse = JacksonUtils.deserialize(content, RetrievalResponse.class);
            if(retrievalResponse == null || retrievalResponse.getList() == null) {
                return Collections.emptyList();
            }
            return retrievalResponse.getList().stream()
                    .map(chunk -> new RetrievedChunk(chunk.getFileId(), chunk.getChunkId(), chunk.getContent(), chunk.getScore()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientCollaboratorException(ErrorCode.RETRIEVAL_ERROR, "retrieval service unreachable: " + e.getMessage(), e);
        } catch (PersistenceException e) {
            throw new TransientCollaboratorException(ErrorCode.RETRIEVAL_ERROR, "malformed retrieval response", e);
        }
    }

    @Data
    public static class RetrievalRequest {
        private String query;
        @JsonProperty("file_ids")
        private List<String> fileIds;
        @JsonProperty("top_k")
        private Integer topK;
    }

    @Data
    public static class RetrievalResponse {
        private List<Chunk> list;
    }

    @Data
    public static class Chunk {
        @JsonProperty("file_id")
        private String fileId;
        @JsonProperty("chunk_id")
        private String chunkId;
        private String content;
        private Double score;
    }
}
