package com.ke.hal.core.run;

import com.ke.hal.common.Tool;
import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.configuration.EngineProperties;
import com.ke.hal.core.ai.ModelClient;
import com.ke.hal.core.ai.ModelRequest;
import com.ke.hal.core.ai.ModelResponse;
import com.ke.hal.core.ai.ToolInvocation;
import com.ke.hal.core.memory.ContextTruncator;
import com.ke.hal.core.tools.ToolBinding;
import com.ke.hal.core.tools.ToolDispatcher;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.db.repo.MessageRepo;
import com.ke.hal.db.repo.RunRepo;
import com.ke.hal.db.repo.ThreadRepo;
import com.ke.hal.db.repo.ToolCallRepo;
import com.ke.hal.exception.AbortedException;
import com.ke.hal.exception.ConflictException;
import com.ke.hal.exception.ContextLengthExceededException;
import com.ke.hal.exception.DeadlineExceededException;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.LeaseLostException;
import com.ke.hal.exception.ModelClientException;
import com.ke.hal.exception.PersistenceException;
import com.ke.hal.exception.RunFailedException;
import com.ke.hal.exception.TransientCollaboratorException;
import com.ke.hal.util.DateTimeUtils;
import com.ke.hal.util.JacksonUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Run 执行器
 * 每次处理都从持久化状态重建上下文，循环调用模型并分发工具，直到 run 完成、等待提交或终止
 */
@Component
public class RunProcessor {

    private static final Logger logger = LoggerFactory.getLogger(RunProcessor.class);

    @Autowired
    private RunRepo runRepo;

    @Autowired
    private ThreadRepo threadRepo;

    @Autowired
    private MessageRepo messageRepo;

    @Autowired
    private ToolCallRepo toolCallRepo;

    @Autowired
    private RunStateManager stateManager;

    @Autowired
    private ToolDispatcher toolDispatcher;

    @Autowired
    private ModelClient modelClient;

    @Autowired
    private ContextTruncator contextTruncator;

    @Autowired
    private AssistantProperties assistantProperties;

    /**
     * 处理一次投递
     *
     * @throws PersistenceException 存储不可用，调用方不应释放 lease，run 会在 lease 过期后重新投递
     */
    public void process(String runId, LeaseGuard lease) {
        RunDb run = runRepo.findById(runId);
        if(run == null) {
            logger.warn("Run {} not found, dropping delivery", runId);
            return;
        }
        RunStatus status = RunStatus.fromValue(run.getStatus());
        if(status.isTerminal() || status == RunStatus.REQUIRES_ACTION) {
            logger.info("Run {} is {}, nothing to process", runId, status.getValue());
            return;
        }

        try {
            if(status == RunStatus.CANCELLING) {
                stateManager.toCancelled(runId);
                return;
            }
            if(isExpired(run)) {
                stateManager.toExpired(runId);
                return;
            }
            run = status == RunStatus.QUEUED ? stateManager.toInProgress(run) : stateManager.recordRedelivery(run);
            execute(loadContext(run, lease));
        } catch (RunFailedException e) {
            logger.error("Run {} failed: {}", runId, e.getMessage(), e);
            stateManager.toFailed(runId, e.getCode(), e.getMessage());
        } catch (DeadlineExceededException e) {
            logger.warn("Run {} expired during processing", runId);
            stateManager.toExpired(runId);
        } catch (LeaseLostException | AbortedException e) {
            logger.warn("Run {} processing abandoned: {}", runId, e.getMessage());
        } catch (ConflictException e) {
            logger.warn("Run {} changed concurrently: {}", runId, e.getMessage());
            settle(runId);
        } catch (PersistenceException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new PersistenceException("storage error while processing run " + runId, e);
        } catch (RuntimeException e) {
            logger.error("Run {} failed with unexpected error", runId, e);
            stateManager.toFailed(runId, ErrorCode.SERVER_ERROR, StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName()));
        }
    }

    private void execute(ExecutionContext context) {
        EngineProperties engine = assistantProperties.getEngine();
        Map<String, ToolBinding> bindings = toolDispatcher.bind(context);

        while (true) {
            if(!checkpoint(context)) {
                return;
            }

            // 上一次处理中断时留下的服务端工具调用
            List<ToolCallDb> interrupted = context.pendingAutoCalls();
            if(!interrupted.isEmpty()) {
                for (ToolCallDb call : interrupted) {
                    if(!checkpoint(context)) {
                        return;
                    }
                    toolDispatcher.resume(context, bindings, call);
                    checkSandboxBudget(context, call);
                }
                continue;
            }
            List<ToolCallDb> waiting = context.pendingFunctionCalls();
            if(!waiting.isEmpty()) {
                stateManager.toRequiresAction(context, waiting);
                return;
            }

            if(context.currentRound() >= engine.getMaxSteps()) {
                throw new RunFailedException(ErrorCode.MAX_STEPS_EXCEEDED,
                        "run exceeded " + engine.getMaxSteps() + " model steps");
            }

            stateManager.completeToolSteps(context);
            ModelResponse response = callModel(context, bindings);
            if(!checkpoint(context)) {
                return;
            }
            if(!response.hasToolInvocations()) {
                stateManager.toCompleted(context, response.getText());
                return;
            }

            int round = context.currentRound() + 1;
            List<ToolCallDb> autoCalls = new ArrayList<>();
            List<ToolCallDb> functionCalls = new ArrayList<>();
            List<ToolBinding> resolved = new ArrayList<>();
            for (ToolInvocation invocation : response.getToolInvocations()) {
                resolved.add(toolDispatcher.resolve(bindings, invocation.getName()));
            }
            stateManager.startToolStep(context, round);
            for (int i = 0; i < resolved.size(); i++) {
                ToolBinding binding = resolved.get(i);
                ToolInvocation invocation = response.getToolInvocations().get(i);
                if(binding.isFunction()) {
                    functionCalls.add(newFunctionCall(context, invocation, round, i));
                } else {
                    autoCalls.add(toolDispatcher.start(context, binding, invocation, round, i));
                }
            }
            logger.info("Run {} round {}: {} server tool calls, {} function calls", context.getRunId(), round,
                    autoCalls.size(), functionCalls.size());

            for (ToolCallDb call : autoCalls) {
                if(!checkpoint(context)) {
                    return;
                }
                toolDispatcher.execute(context, bindings, call);
                checkSandboxBudget(context, call);
            }
            if(!functionCalls.isEmpty()) {
                if(!checkpoint(context)) {
                    return;
                }
                stateManager.toRequiresAction(context, functionCalls);
                return;
            }
        }
    }

    /**
     * 调用模型，上下文超长时截断后重试一次
     */
    private ModelResponse callModel(ExecutionContext context, Map<String, ToolBinding> bindings) {
        RunSnapshot snapshot = context.getSnapshot();
        ModelRequest request = ModelRequest.builder()
                .model(snapshot.getModel())
                .instructions(snapshot.getInstructions())
                .history(context.buildHistory())
                .tools(toolDispatcher.toolSpecs(bindings))
                .build();
        try {
            return callWithRetry(context, request);
        } catch (ContextLengthExceededException e) {
            ModelRequest truncated = contextTruncator.truncate(request, assistantProperties.getModel().getMaxInputTokens());
            logger.warn("Run {} exceeded the model context, retrying with {} of {} history entries", context.getRunId(),
                    truncated.getHistory().size(), request.getHistory().size());
            try {
                return callWithRetry(context, truncated);
            } catch (ContextLengthExceededException again) {
                throw new RunFailedException(ErrorCode.CONTEXT_EXCEEDED, again.getMessage(), again);
            }
        }
    }

    private ModelResponse callWithRetry(ExecutionContext context, ModelRequest request) {
        RetryPolicy retryPolicy = RetryPolicy.of(assistantProperties.getEngine().getModelRetry());
        try {
            return retryPolicy.execute("model call of run " + context.getRunId(),
                    () -> modelClient.complete(request),
                    e -> e instanceof TransientCollaboratorException,
                    context::ensureActive);
        } catch (TransientCollaboratorException e) {
            throw new RunFailedException(e.getCode(),
                    "model call failed after " + retryPolicy.getMaxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (ModelClientException e) {
            throw new RunFailedException(ErrorCode.SERVER_ERROR, "model rejected the request: " + e.getMessage(), e);
        }
    }

    /**
     * 检查点：lease 与截止时间有效，并观察外部写入的 cancelling
     *
     * @return false 表示本次处理应结束
     */
    private boolean checkpoint(ExecutionContext context) {
        context.ensureActive();
        RunDb current = runRepo.findById(context.getRunId());
        RunStatus status = RunStatus.fromValue(current.getStatus());
        if(status == RunStatus.CANCELLING) {
            logger.info("Run {} cancellation observed at checkpoint", context.getRunId());
            stateManager.toCancelled(context.getRunId());
            return false;
        }
        if(status != RunStatus.IN_PROGRESS) {
            logger.warn("Run {} moved to {} by another writer, stop processing", context.getRunId(), status.getValue());
            return false;
        }
        if(!current.getVersion().equals(context.getRun().getVersion())) {
            // 另一次投递已接管
            throw new LeaseLostException(context.getRunId());
        }
        return true;
    }

    private void checkSandboxBudget(ExecutionContext context, ToolCallDb call) {
        if(!Tool.CODE_INTERPRETER.equals(call.getType())) {
            return;
        }
        int maxCorrections = assistantProperties.getTools().getCodeInterpreter().getMaxCorrections();
        int failures = context.consecutiveSandboxFailures();
        if(failures >= maxCorrections) {
            throw new RunFailedException(ErrorCode.SANDBOX_EXHAUSTED,
                    "code execution failed " + failures + " consecutive times");
        }
    }

    private ToolCallDb newFunctionCall(ExecutionContext context, ToolInvocation invocation, int round, int seq) {
        ToolCallDb call = new ToolCallDb();
        call.setRunId(context.getRunId());
        call.setType(Tool.FUNCTION);
        call.setName(invocation.getName());
        call.setArguments(StringUtils.defaultIfBlank(invocation.getArguments(), "{}"));
        call.setRound(round);
        call.setSeq(seq);
        return call;
    }

    private ExecutionContext loadContext(RunDb run, LeaseGuard lease) {
        RunSnapshot snapshot = JacksonUtils.deserialize(run.getSnapshot(), RunSnapshot.class);
        if(snapshot == null) {
            throw new RunFailedException(ErrorCode.SERVER_ERROR, "run " + run.getId() + " has no snapshot");
        }
        ExecutionContext context = new ExecutionContext();
        context.setRun(run);
        context.setSnapshot(snapshot);
        context.setThread(threadRepo.findById(run.getThreadId()));
        context.setMessages(messageRepo.findByThreadId(run.getThreadId()));
        context.setToolCalls(new ArrayList<>(toolCallRepo.findByRunId(run.getId())));
        context.setLease(lease);
        return context;
    }

    /**
     * 版本冲突后以库中状态为准，只处理需要引擎收尾的 cancelling
     */
    private void settle(String runId) {
        RunDb current = runRepo.findById(runId);
        if(current != null && RunStatus.CANCELLING.getValue().equals(current.getStatus())) {
            stateManager.toCancelled(runId);
        }
    }

    private boolean isExpired(RunDb run) {
        return run.getExpiresAt() != null && DateTimeUtils.getCurrentSeconds() >= run.getExpiresAt();
    }
}
