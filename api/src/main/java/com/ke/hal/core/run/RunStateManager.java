package com.ke.hal.core.run;

import com.google.common.collect.Sets;
import com.ke.hal.common.LastError;
import com.ke.hal.core.ai.ChatEntry;
import com.ke.hal.core.tools.CitationAnnotator;
import com.ke.hal.db.entity.MessageDb;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.db.entity.RunStepDb;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.db.repo.MessageRepo;
import com.ke.hal.db.repo.RunRepo;
import com.ke.hal.db.repo.RunStepRepo;
import com.ke.hal.db.repo.ToolCallRepo;
import com.ke.hal.exception.AssistantException;
import com.ke.hal.exception.BadRequestException;
import com.ke.hal.exception.ConflictException;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.ResourceNotFoundException;
import com.ke.hal.message.MessageContent;
import com.ke.hal.run.RunInfo;
import com.ke.hal.run.RunOps;
import com.ke.hal.util.DateTimeUtils;
import com.ke.hal.util.JacksonUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Run状态管理器
 * 所有状态写入都经过带版本校验的 updateRun，状态与其关联行在同一事务中提交
 */
@Component
public class RunStateManager {

    private static final Logger logger = LoggerFactory.getLogger(RunStateManager.class);

    @Autowired
    private RunRepo runRepo;

    @Autowired
    private ToolCallRepo toolCallRepo;

    @Autowired
    private MessageRepo messageRepo;

    @Autowired
    private RunStepRepo runStepRepo;

    /**
     * 更新Run状态
     *
     * @param run 当前持有的 run，version 需与库中一致
     * @param newStatus 新状态
     * @param mutator 状态之外的字段修改（可选）
     * @throws ConflictException 状态转换不合法或 run 已被并发修改
     */
    @Transactional
    public RunDb updateRun(RunDb run, RunStatus newStatus, Consumer<RunDb> mutator) {
        RunStatus currentStatus = RunStatus.fromValue(run.getStatus());
        if(!currentStatus.canTransitionTo(newStatus)) {
            throw new ConflictException("invalid status transition for run " + run.getId() + ": "
                    + currentStatus.getValue() + " -> " + newStatus.getValue());
        }

        long now = DateTimeUtils.getCurrentSeconds();
        run.setStatus(newStatus.getValue());
        if(newStatus == RunStatus.CANCELLED) {
            run.setCancelledAt(now);
        } else if(newStatus == RunStatus.FAILED) {
            run.setFailedAt(now);
        } else if(newStatus == RunStatus.COMPLETED) {
            run.setCompletedAt(now);
        }
        if(mutator != null) {
            mutator.accept(run);
        }

        if(!runRepo.update(run)) {
            throw new ConflictException("run " + run.getId() + " was modified concurrently");
        }
        if(newStatus.isTerminal()) {
            runStepRepo.finishInProgress(run.getId(), newStatus.getValue());
        }
        logger.info("Run {} status updated: {} -> {}", run.getId(), currentStatus.getValue(), newStatus.getValue());
        return run;
    }

    /**
     * 首次领取，started_at 只在第一次设置
     */
    @Transactional
    public RunDb toInProgress(RunDb run) {
        return updateRun(run, RunStatus.IN_PROGRESS, db -> {
            db.setAttempts(db.getAttempts() + 1);
            if(db.getStartedAt() == null) {
                db.setStartedAt(DateTimeUtils.getCurrentSeconds());
            }
        });
    }

    /**
     * in_progress 状态被重新投递，记录领取次数
     */
    @Transactional
    public RunDb recordRedelivery(RunDb run) {
        return updateRun(run, RunStatus.IN_PROGRESS, db -> db.setAttempts(db.getAttempts() + 1));
    }

    /**
     * 写入最终 assistant 消息并完成 run，版本校验失败时消息随事务回滚
     */
    @Transactional
    public RunDb toCompleted(ExecutionContext context, String text) {
        RunDb run = context.getRun();
        List<MessageContent.Annotation> annotations = CitationAnnotator.annotate(text, context.getToolCalls());

        MessageDb message = new MessageDb();
        message.setThreadId(run.getThreadId());
        message.setUserId(run.getUserId());
        message.setRole(ChatEntry.ASSISTANT);
        message.setContent(JacksonUtils.serialize(Collections.singletonList(
                MessageContent.text(StringUtils.defaultString(text), annotations))));
        message.setFileIds(JacksonUtils.serialize(new ArrayList<>()));
        message.setAssistantId(run.getAssistantId());
        message.setRunId(run.getId());
        messageRepo.insert(message);

        RunStepDb step = newStep(run, RunStepDb.MESSAGE_CREATION, context.currentRound() + 1);
        step.setStatus(RunStatus.COMPLETED.getValue());
        step.setMessageId(message.getId());
        step.setCompletedAt(DateTimeUtils.getCurrentSeconds());
        runStepRepo.insert(step);

        return updateRun(run, RunStatus.COMPLETED, null);
    }

    /**
     * 模型发起一轮工具调用，记录 tool_calls 步骤，重新投递时已存在则跳过
     */
    @Transactional
    public void startToolStep(ExecutionContext context, int round) {
        RunDb run = context.getRun();
        if(runStepRepo.findByStepNumber(run.getId(), round) != null) {
            return;
        }
        RunStepDb step = newStep(run, RunStepDb.TOOL_CALLS, round);
        step.setStatus(RunStepRepo.IN_PROGRESS);
        runStepRepo.insert(step);
    }

    /**
     * 再次调用模型前，之前各轮的工具调用均已有结果
     */
    @Transactional
    public void completeToolSteps(ExecutionContext context) {
        runStepRepo.finishInProgress(context.getRunId(), RunStatus.COMPLETED.getValue());
    }

    /**
     * 落库 function 调用与 required_action，run 进入等待提交状态
     */
    @Transactional
    public RunDb toRequiresAction(ExecutionContext context, List<ToolCallDb> functionCalls) {
        if(functionCalls.isEmpty()) {
            throw new IllegalArgumentException("requires_action needs at least one pending tool call");
        }
        for (ToolCallDb call : functionCalls) {
            if(call.getId() == null) {
                toolCallRepo.insert(call);
                context.getToolCalls().add(call);
            }
        }

        RunInfo.RequiredAction requiredAction = new RunInfo.RequiredAction();
        RunInfo.RequiredAction.SubmitToolOutputs submitToolOutputs = new RunInfo.RequiredAction.SubmitToolOutputs();
        submitToolOutputs.setToolCalls(functionCalls.stream().map(call -> {
            RunInfo.RequiredAction.ToolCall toolCall = new RunInfo.RequiredAction.ToolCall();
            toolCall.setId(call.getId());
            RunInfo.RequiredAction.ToolCall.Function function = new RunInfo.RequiredAction.ToolCall.Function();
            function.setName(call.getName());
            function.setArguments(call.getArguments());
            toolCall.setFunction(function);
            return toolCall;
        }).collect(Collectors.toList()));
        requiredAction.setSubmitToolOutputs(submitToolOutputs);

        return updateRun(context.getRun(), RunStatus.REQUIRES_ACTION,
                db -> db.setRequiredAction(JacksonUtils.serialize(requiredAction)));
    }

    /**
     * 以 failed 结束 run，run 已处于终止状态时不做修改
     *
     * @return 是否写入
     */
    @Transactional
    public boolean toFailed(String runId, ErrorCode code, String message) {
        RunDb run = runRepo.findByIdForUpdate(runId);
        if(run == null || !RunStatus.fromValue(run.getStatus()).canTransitionTo(RunStatus.FAILED)) {
            logger.warn("Run {} can not be failed with {}, current status: {}", runId, code.getCode(),
                    run == null ? null : run.getStatus());
            return false;
        }
        updateRun(run, RunStatus.FAILED, db -> {
            db.setRequiredAction(null);
            db.setLastError(JacksonUtils.serialize(new LastError(code.getCode(), message)));
        });
        return true;
    }

    /**
     * 过期，取消中的 run 直接进入 cancelled
     */
    @Transactional
    public boolean toExpired(String runId) {
        RunDb run = runRepo.findByIdForUpdate(runId);
        if(run == null) {
            return false;
        }
        RunStatus status = RunStatus.fromValue(run.getStatus());
        if(status == RunStatus.CANCELLING) {
            updateRun(run, RunStatus.CANCELLED, null);
            return true;
        }
        if(!status.canTransitionTo(RunStatus.EXPIRED)) {
            logger.info("Run {} is {}, skip expiring", runId, status.getValue());
            return false;
        }
        updateRun(run, RunStatus.EXPIRED, db -> db.setRequiredAction(null));
        return true;
    }

    /**
     * 引擎在检查点观察到 cancelling 后结束 run
     */
    @Transactional
    public boolean toCancelled(String runId) {
        RunDb run = runRepo.findByIdForUpdate(runId);
        if(run == null || !RunStatus.fromValue(run.getStatus()).canTransitionTo(RunStatus.CANCELLED)) {
            return false;
        }
        updateRun(run, RunStatus.CANCELLED, db -> db.setRequiredAction(null));
        return true;
    }

    /**
     * 提交 function 调用结果，提交的 id 集合必须与 pending 调用完全一致，否则不做任何修改
     */
    @Transactional
    public RunDb submitToolOutputs(String threadId, String runId, List<RunOps.ToolOutput> outputs) {
        RunDb run = lockRun(threadId, runId);
        if(!RunStatus.REQUIRES_ACTION.getValue().equals(run.getStatus())) {
            throw new BadRequestException("run " + runId + " is not waiting for tool outputs, status: " + run.getStatus());
        }

        Map<String, String> submitted = new LinkedHashMap<>();
        for (RunOps.ToolOutput output : outputs) {
            if(output.getOutput() == null) {
                throw new AssistantException(ErrorCode.INVALID_TOOL_OUTPUT, "output of tool call " + output.getToolCallId() + " is null");
            }
            if(submitted.put(output.getToolCallId(), output.getOutput()) != null) {
                throw new BadRequestException("duplicate output for tool call " + output.getToolCallId());
            }
        }
        Set<String> pending = toolCallRepo.findPendingByRunId(runId).stream()
                .map(ToolCallDb::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if(!pending.equals(submitted.keySet())) {
            throw new BadRequestException("tool outputs must match the pending tool calls exactly, missing: "
                    + Sets.difference(pending, submitted.keySet()) + ", unexpected: " + Sets.difference(submitted.keySet(), pending));
        }

        for (Map.Entry<String, String> entry : submitted.entrySet()) {
            if(!toolCallRepo.complete(entry.getKey(), entry.getValue(), false)) {
                throw new ConflictException("tool call " + entry.getKey() + " already has an output");
            }
        }
        return updateRun(run, RunStatus.QUEUED, db -> db.setRequiredAction(null));
    }

    /**
     * 取消 run：排队中与等待提交的 run 没有执行中的引擎，直接经 cancelling 进入 cancelled
     */
    @Transactional
    public RunDb cancel(String threadId, String runId) {
        RunDb run = lockRun(threadId, runId);
        RunStatus status = RunStatus.fromValue(run.getStatus());
        if(status == RunStatus.CANCELLING) {
            return run;
        }
        if(status.isTerminal()) {
            throw new BadRequestException("cannot cancel run " + runId + " with status " + status.getValue());
        }
        updateRun(run, RunStatus.CANCELLING, null);
        if(status == RunStatus.QUEUED || status == RunStatus.REQUIRES_ACTION) {
            updateRun(run, RunStatus.CANCELLED, db -> db.setRequiredAction(null));
        }
        return run;
    }

    private RunDb lockRun(String threadId, String runId) {
        RunDb run = runRepo.findByIdForUpdate(runId);
        if(run == null || !run.getThreadId().equals(threadId)) {
            throw new ResourceNotFoundException("run not found: " + runId);
        }
        return run;
    }

    private static RunStepDb newStep(RunDb run, String type, long stepNumber) {
        RunStepDb step = new RunStepDb();
        step.setRunId(run.getId());
        step.setThreadId(run.getThreadId());
        step.setAssistantId(run.getAssistantId());
        step.setUserId(run.getUserId());
        step.setType(type);
        step.setStepNumber(stepNumber);
        return step;
    }
}
