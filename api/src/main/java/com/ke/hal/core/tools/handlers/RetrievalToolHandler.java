package com.ke.hal.core.tools.handlers;

import com.ke.hal.collaborator.retrieval.RetrievedChunk;
import com.ke.hal.collaborator.retrieval.Retriever;
import com.ke.hal.common.Tool;
import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.configuration.ToolProperties;
import com.ke.hal.core.ai.ToolSpec;
import com.ke.hal.core.run.ExecutionContext;
import com.ke.hal.core.run.RetryPolicy;
import com.ke.hal.core.tools.RetrievalOutput;
import com.ke.hal.core.tools.ToolContext;
import com.ke.hal.core.tools.ToolHandler;
import com.ke.hal.core.tools.ToolResult;
import com.ke.hal.exception.AssistantException;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.RunFailedException;
import com.ke.hal.exception.TransientCollaboratorException;
import com.ke.hal.util.JacksonUtils;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 检索工具处理器
 * 在工具、run 与线程关联的文件中检索，结果按 run 内连续编号供模型引用
 */
@Component
public class RetrievalToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalToolHandler.class);

    public static final String NAME = "retrieval";

    @Autowired
    private Retriever retriever;

    @Autowired
    private AssistantProperties assistantProperties;

    @Override
    public ToolResult execute(ToolContext context, Map<String, Object> arguments) {
        ExecutionContext execution = context.getExecution();
        ToolProperties.RetrievalToolProperties properties = assistantProperties.getTools().getRetrieval();

        Object queryArg = arguments.get("query");
        String query = queryArg instanceof String && StringUtils.isNotBlank((String) queryArg)
                ? (String) queryArg : execution.latestUserMessageText();
        if(StringUtils.isBlank(query)) {
            return ToolResult.error("no query to search for");
        }

        Tool.ToolRetrieval tool = (Tool.ToolRetrieval) context.getTool();
        Set<String> fileIds = new LinkedHashSet<>();
        if(tool.getFileIds() != null) {
            fileIds.addAll(tool.getFileIds());
        }
        fileIds.addAll(execution.getSnapshot().getFileIds());
        fileIds.addAll(execution.threadFileIds());
        if(fileIds.isEmpty()) {
            return ToolResult.success(JacksonUtils.serialize(new RetrievalOutput(query, new ArrayList<>())));
        }

        int topK = tool.getTopK() != null && tool.getTopK() > 0 ? tool.getTopK() : properties.getTopK();
        List<String> searchFiles = new ArrayList<>(fileIds);
        RetryPolicy retryPolicy = RetryPolicy.of(properties.getMaxAttempts(), assistantProperties.getEngine().getModelRetry());

        List<RetrievedChunk> chunks;
        try {
            chunks = retryPolicy.execute("retrieval of run " + execution.getRunId(),
                    () -> retriever.search(query, searchFiles, topK),
                    e -> e instanceof TransientCollaboratorException,
                    execution::ensureActive);
        } catch (TransientCollaboratorException e) {
            throw new RunFailedException(ErrorCode.RETRIEVAL_ERROR,
                    "retrieval failed after " + properties.getMaxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (AssistantException e) {
            if(e.getCode() != ErrorCode.RETRIEVAL_ERROR) {
                throw e;
            }
            throw new RunFailedException(ErrorCode.RETRIEVAL_ERROR, "retrieval failed: " + e.getMessage(), e);
        }

        RetrievalOutput output = new RetrievalOutput(query, budget(chunks, properties.getMaxChars(),
                RetrievalOutput.collect(execution.getToolCalls()).size() + 1));
        logger.info("Run {} retrieval returned {} snippets from {} files", execution.getRunId(),
                output.getResults().size(), searchFiles.size());
        return ToolResult.success(JacksonUtils.serialize(output));
    }

    /**
     * 按相关度顺序截取，总字符数不超过 maxChars
     */
    private List<RetrievalOutput.Result> budget(List<RetrievedChunk> chunks, int maxChars, int firstIndex) {
        List<RetrievalOutput.Result> results = new ArrayList<>();
        if(CollectionUtils.isEmpty(chunks)) {
            return results;
        }
        int remaining = maxChars;
        int index = firstIndex;
        for (RetrievedChunk chunk : chunks) {
            if(remaining <= 0) {
                break;
            }
            String text = StringUtils.defaultString(chunk.getText());
            if(text.length() > remaining) {
                text = text.substring(0, remaining);
            }
            remaining -= text.length();
            results.add(new RetrievalOutput.Result(index++, chunk.getFileId(), text));
        }
        return results;
    }

    @Override
    public String getToolType() {
        return Tool.RETRIEVAL;
    }

    @Override
    public List<ToolSpec> getToolSpecs(Tool tool) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("type", "string");
        query.put("description", "搜索内容，缺省时使用用户最新的消息");

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("query", query);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);
        return Collections.singletonList(new ToolSpec(NAME,
                "Search the files attached to this conversation. Each result has an index; cite it as [index] in the answer.",
                parameters));
    }
}
