package com.ke.hal.core.tools;

import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ToolInvocation;
import com.ke.hal.core.ai.ToolSpec;
import com.ke.hal.core.run.ExecutionContext;
import com.ke.hal.db.entity.FunctionDb;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.db.repo.FunctionRepo;
import com.ke.hal.db.repo.ToolCallRepo;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.RunFailedException;
import com.ke.hal.util.DateTimeUtils;
import com.ke.hal.util.JacksonUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具分发器
 * 将模型请求的函数名解析到 run 快照中的工具，执行服务端工具并记录输出
 */
@Component
@RequiredArgsConstructor
public class ToolDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

    static final String INTERRUPTED_OUTPUT = "The previous attempt of this call was interrupted and its outcome is unknown. "
            + "It was not retried because it may have side effects.";

    private final ToolFetcher toolFetcher;
    private final FunctionRepo functionRepo;
    private final ToolCallRepo toolCallRepo;

    /**
     * 构建函数名到工具的绑定，按工具配置顺序，重名时先出现的生效
     */
    public Map<String, ToolBinding> bind(ExecutionContext context) {
        Map<String, ToolBinding> bindings = new LinkedHashMap<>();
        for (Tool tool : context.getSnapshot().getTools()) {
            if(tool instanceof Tool.ToolFunction) {
                ToolSpec spec = functionSpec(context.getUserId(), ((Tool.ToolFunction) tool).getFunction());
                register(bindings, new ToolBinding(spec, tool, null, null));
                continue;
            }
            ToolHandler handler = toolFetcher.getToolHandler(tool.getType());
            if(handler == null) {
                throw new RunFailedException(ErrorCode.INVALID_TOOL, "no handler for tool type " + tool.getType());
            }
            for (ToolSpec spec : handler.getToolSpecs(tool)) {
                register(bindings, new ToolBinding(spec, tool, handler, findOperation(tool, spec.getName())));
            }
        }
        return bindings;
    }

    public List<ToolSpec> toolSpecs(Map<String, ToolBinding> bindings) {
        List<ToolSpec> specs = new ArrayList<>();
        bindings.values().forEach(binding -> specs.add(binding.getSpec()));
        return specs;
    }

    public ToolBinding resolve(Map<String, ToolBinding> bindings, String name) {
        ToolBinding binding = bindings.get(name);
        if(binding == null) {
            throw new RunFailedException(ErrorCode.INVALID_TOOL, "model requested unknown tool: " + name);
        }
        return binding;
    }

    /**
     * 先落库 pending 调用再执行，中断后由 resume 继续
     */
    public ToolCallDb start(ExecutionContext context, ToolBinding binding, ToolInvocation invocation, int round, int seq) {
        ToolCallDb call = new ToolCallDb();
        call.setRunId(context.getRunId());
        call.setType(binding.getType());
        call.setName(invocation.getName());
        call.setArguments(StringUtils.defaultIfBlank(invocation.getArguments(), "{}"));
        call.setRound(round);
        call.setSeq(seq);
        toolCallRepo.insert(call);
        context.getToolCalls().add(call);
        return call;
    }

    public void execute(ExecutionContext context, Map<String, ToolBinding> bindings, ToolCallDb call) {
        ToolBinding binding = resolve(bindings, call.getName());
        Map<String, Object> arguments = JacksonUtils.toMapOrNull(call.getArguments());
        ToolResult result;
        if(arguments == null) {
            result = ToolResult.error("arguments are not valid JSON: " + call.getArguments());
        } else {
            ToolContext toolContext = new ToolContext(context, call, binding.getTool(), binding.getOperation());
            long start = DateTimeUtils.getCurrentMillis();
            result = binding.getHandler().execute(toolContext, arguments);
            logger.info("Run {} tool call {} ({}) finished in {} ms, error: {}", context.getRunId(), call.getId(),
                    call.getName(), DateTimeUtils.getCurrentMillis() - start, result.isError());
        }
        record(call, result);
    }

    /**
     * 处理上一次中断时未完成的调用，可重放的重新执行，否则记录中断结果
     */
    public void resume(ExecutionContext context, Map<String, ToolBinding> bindings, ToolCallDb call) {
        ToolBinding binding = resolve(bindings, call.getName());
        ToolContext toolContext = new ToolContext(context, call, binding.getTool(), binding.getOperation());
        if(binding.getHandler().isReplayable(toolContext)) {
            logger.info("Run {} replaying interrupted tool call {} ({})", context.getRunId(), call.getId(), call.getName());
            execute(context, bindings, call);
            return;
        }
        logger.warn("Run {} tool call {} ({}) was interrupted and is not replayable", context.getRunId(), call.getId(), call.getName());
        record(call, ToolResult.error(INTERRUPTED_OUTPUT));
    }

    private void record(ToolCallDb call, ToolResult result) {
        if(toolCallRepo.complete(call.getId(), result.getOutput(), result.isError())) {
            call.setOutput(result.getOutput());
            call.setIsError(result.isError());
            call.setStatus(ToolCallDb.COMPLETED);
            call.setCompletedAt(DateTimeUtils.getCurrentSeconds());
            return;
        }
        // 输出只写一次，以已落库的为准
        ToolCallDb stored = toolCallRepo.findById(call.getId());
        logger.warn("Tool call {} already has an output, keeping the stored one", call.getId());
        call.setOutput(stored.getOutput());
        call.setIsError(stored.getIsError());
        call.setStatus(stored.getStatus());
        call.setCompletedAt(stored.getCompletedAt());
    }

    /**
     * 只给出名字的 function 从注册表补全描述与参数
     */
    private ToolSpec functionSpec(String userId, Tool.FunctionDefinition definition) {
        String description = definition.getDescription();
        Map<String, Object> parameters = definition.getParameters();
        if(parameters == null) {
            FunctionDb registered = functionRepo.findByName(userId, definition.getName());
            if(registered != null) {
                description = StringUtils.defaultIfBlank(description, registered.getDescription());
                parameters = JacksonUtils.toMapOrNull(registered.getParameters());
            }
        }
        if(parameters == null || parameters.isEmpty()) {
            parameters = new LinkedHashMap<>();
            parameters.put("type", "object");
            parameters.put("properties", new LinkedHashMap<>());
        }
        return new ToolSpec(definition.getName(), description, parameters);
    }

    private void register(Map<String, ToolBinding> bindings, ToolBinding binding) {
        String name = binding.getSpec().getName();
        if(bindings.containsKey(name)) {
            logger.warn("Duplicate tool name {} from {} ignored", name, binding.getType());
            return;
        }
        bindings.put(name, binding);
    }

    private Tool.ActionOperation findOperation(Tool tool, String name) {
        if(!(tool instanceof Tool.ToolAction)) {
            return null;
        }
        return ((Tool.ToolAction) tool).getAction().getOperations().stream()
                .filter(operation -> name.equals(operation.getOperationId()))
                .findFirst()
                .orElse(null);
    }
}
