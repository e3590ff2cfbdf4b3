package com.ke.hal.service;

import com.ke.hal.common.LastError;
import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.core.run.RunSnapshot;
import com.ke.hal.core.run.RunStateManager;
import com.ke.hal.core.run.RunStatus;
import com.ke.hal.db.entity.AssistantDb;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.db.entity.RunStepDb;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.db.repo.RunRepo;
import com.ke.hal.db.repo.RunStepRepo;
import com.ke.hal.db.repo.ToolCallRepo;
import com.ke.hal.exception.BadRequestException;
import com.ke.hal.exception.ResourceNotFoundException;
import com.ke.hal.queue.RunQueue;
import com.ke.hal.run.RunInfo;
import com.ke.hal.run.RunOps;
import com.ke.hal.run.RunStepInfo;
import com.ke.hal.run.ToolCallInfo;
import com.ke.hal.util.DateTimeUtils;
import com.ke.hal.util.JacksonUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Run Service
 * 入队发生在 run 状态提交之后，保证 worker 取出时一定能读到 queued 状态
 */
@Service
@Slf4j
public class RunService {

    private static final List<String> ACTIVE_STATUSES = Arrays.asList(RunStatus.QUEUED.getValue(),
            RunStatus.IN_PROGRESS.getValue(), RunStatus.REQUIRES_ACTION.getValue(), RunStatus.CANCELLING.getValue());

    @Autowired
    private RunRepo runRepo;

    @Autowired
    private ToolCallRepo toolCallRepo;

    @Autowired
    private RunStepRepo runStepRepo;

    @Autowired
    private AssistantService assistantService;

    @Autowired
    private RunStateManager runStateManager;

    @Autowired
    private RunQueue runQueue;

    @Autowired
    private AssistantProperties assistantProperties;

    /**
     * 创建 Run：快照 assistant 配置并入队
     */
    public RunInfo createRun(String userId, String threadId, RunOps.CreateRunOp op) {
        AssistantDb assistant = assistantService.getOwnedAssistant(userId, op.getAssistantId());

        RunSnapshot snapshot = new RunSnapshot();
        snapshot.setModel(assistant.getModel());
        snapshot.setInstructions(StringUtils.isNotBlank(op.getInstructions()) ? op.getInstructions() : assistant.getInstructions());
        snapshot.setTools(assistantService.parseTools(assistant));
        List<String> fileIds = JacksonUtils.deserialize(assistant.getFileIds(), AssistantService.IDS_TYPE);
        snapshot.setFileIds(fileIds == null ? new ArrayList<>() : fileIds);

        long now = DateTimeUtils.getCurrentSeconds();
        RunDb run = new RunDb();
        run.setThreadId(threadId);
        run.setAssistantId(assistant.getId());
        run.setUserId(userId);
        run.setStatus(RunStatus.QUEUED.getValue());
        run.setSnapshot(JacksonUtils.serialize(snapshot));
        run.setMetadata(JacksonUtils.serialize(op.getMetadata() == null ? new HashMap<>() : op.getMetadata()));
        run.setExpiresAt(now + assistantProperties.getRunTtlMinutes() * 60L);
        runRepo.insert(run);

        enqueue(run.getId());
        log.info("Run {} created on thread {} with assistant {}", run.getId(), threadId, assistant.getId());
        return convertToInfo(run);
    }

    public RunDb getRunDb(String threadId, String runId) {
        RunDb run = runRepo.findById(threadId, runId);
        if(run == null) {
            throw new ResourceNotFoundException("run not found: " + runId);
        }
        return run;
    }

    public RunInfo getRun(String threadId, String runId) {
        return convertToInfo(getRunDb(threadId, runId));
    }

    /**
     * 基于游标的分页查询Run
     */
    public List<RunInfo> getRunsByCursor(String threadId, String after, String before, int limit, String order) {
        return runRepo.findByThreadIdWithCursor(threadId, after, before, limit, order).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    public List<ToolCallInfo> getToolCalls(String threadId, String runId) {
        getRunDb(threadId, runId);
        return toolCallRepo.findByRunId(runId).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    /**
     * 基于游标的分页查询 Run Step，tool_calls 步骤附带该轮的工具调用
     */
    public List<RunStepInfo> getStepsByCursor(String threadId, String runId, String after, String before, int limit, String order) {
        RunDb run = getRunDb(threadId, runId);
        Map<Integer, List<ToolCallInfo>> callsByRound = toolCallRepo.findByRunId(runId).stream()
                .map(this::convertToInfo)
                .collect(Collectors.groupingBy(ToolCallInfo::getRound));
        return runStepRepo.findByRunIdWithCursor(runId, after, before, limit, order).stream()
                .map(step -> convertToInfo(run, step, callsByRound))
                .collect(Collectors.toList());
    }

    public RunStepInfo getStep(String threadId, String runId, String stepId) {
        RunDb run = getRunDb(threadId, runId);
        RunStepDb step = runStepRepo.findById(runId, stepId);
        if(step == null) {
            throw new ResourceNotFoundException("run step not found: " + stepId);
        }
        Map<Integer, List<ToolCallInfo>> callsByRound = toolCallRepo.findByRunId(runId).stream()
                .map(this::convertToInfo)
                .collect(Collectors.groupingBy(ToolCallInfo::getRound));
        return convertToInfo(run, step, callsByRound);
    }

    /**
     * 提交 function 调用结果，提交成功后重新入队
     */
    public RunInfo submitToolOutputs(String threadId, String runId, RunOps.SubmitToolOutputsOp op) {
        RunDb run = runStateManager.submitToolOutputs(threadId, runId, op.getToolOutputs());
        enqueue(run.getId());
        return convertToInfo(run);
    }

    /**
     * 只更新 metadata，不经过状态机
     */
    public RunInfo updateRun(String threadId, String runId, RunOps.UpdateRunOp op) {
        RunDb run = getRunDb(threadId, runId);
        if(op.getMetadata() != null) {
            run.setMetadata(JacksonUtils.serialize(op.getMetadata()));
            runRepo.updateMetadata(runId, run.getMetadata());
        }
        return convertToInfo(run);
    }

    /**
     * 删除已结束的 run 及其工具调用与步骤，run 产生的消息保留在线程中
     */
    @Transactional
    public boolean deleteRun(String threadId, String runId) {
        RunDb run = getRunDb(threadId, runId);
        if(!RunStatus.fromValue(run.getStatus()).isTerminal()) {
            throw new BadRequestException("cannot delete run " + runId + " with status " + run.getStatus());
        }
        return deleteRunRows(runId);
    }

    /**
     * 删除线程下全部 run，存在未结束的 run 时拒绝
     */
    @Transactional
    public void deleteRunsOfThread(String threadId) {
        if(runRepo.existsByThreadIdAndStatus(threadId, ACTIVE_STATUSES)) {
            throw new BadRequestException("thread " + threadId + " has an active run");
        }
        runRepo.findIdsByThreadId(threadId).forEach(this::deleteRunRows);
    }

    private boolean deleteRunRows(String runId) {
        toolCallRepo.deleteByRunId(runId);
        runStepRepo.deleteByRunId(runId);
        return runRepo.deleteById(runId);
    }

    public RunInfo cancelRun(String threadId, String runId) {
        return convertToInfo(runStateManager.cancel(threadId, runId));
    }

    /**
     * run 已落库，入队失败时由过期扫描重新投递
     */
    private void enqueue(String runId) {
        try {
            runQueue.push(runId);
        } catch (RuntimeException e) {
            log.error("Failed to push run {}, it will be redelivered by the stale run sweep", runId, e);
        }
    }

    public RunInfo convertToInfo(RunDb db) {
        RunInfo info = new RunInfo();
        info.setId(db.getId());
        info.setCreatedAt(db.getCreatedAt());
        info.setThreadId(db.getThreadId());
        info.setAssistantId(db.getAssistantId());
        info.setStatus(db.getStatus());
        info.setRequiredAction(JacksonUtils.deserialize(db.getRequiredAction(), RunInfo.RequiredAction.class));
        info.setLastError(JacksonUtils.deserialize(db.getLastError(), LastError.class));
        info.setExpiresAt(db.getExpiresAt());
        info.setStartedAt(db.getStartedAt());
        info.setCancelledAt(db.getCancelledAt());
        info.setFailedAt(db.getFailedAt());
        info.setCompletedAt(db.getCompletedAt());
        RunSnapshot snapshot = JacksonUtils.deserialize(db.getSnapshot(), RunSnapshot.class);
        if(snapshot != null) {
            info.setModel(snapshot.getModel());
            info.setInstructions(snapshot.getInstructions());
            info.setTools(snapshot.getTools());
            info.setFileIds(snapshot.getFileIds());
        }
        info.setMetadata(JacksonUtils.deserialize(db.getMetadata(), AssistantService.METADATA_TYPE));
        return info;
    }

    public ToolCallInfo convertToInfo(ToolCallDb db) {
        ToolCallInfo info = new ToolCallInfo();
        info.setId(db.getId());
        info.setRunId(db.getRunId());
        info.setType(db.getType());
        info.setName(db.getName());
        info.setArguments(db.getArguments());
        info.setOutput(db.getOutput());
        info.setIsError(db.getIsError());
        info.setStatus(db.getStatus());
        info.setRound(db.getRound());
        info.setCreatedAt(db.getCreatedAt());
        info.setCompletedAt(db.getCompletedAt());
        return info;
    }

    private RunStepInfo convertToInfo(RunDb run, RunStepDb db, Map<Integer, List<ToolCallInfo>> callsByRound) {
        RunStepInfo info = new RunStepInfo();
        info.setId(db.getId());
        info.setCreatedAt(db.getCreatedAt());
        info.setAssistantId(db.getAssistantId());
        info.setThreadId(db.getThreadId());
        info.setRunId(db.getRunId());
        info.setType(db.getType());
        info.setStatus(db.getStatus());
        info.setExpiredAt(db.getExpiredAt());
        info.setCancelledAt(db.getCancelledAt());
        info.setFailedAt(db.getFailedAt());
        info.setCompletedAt(db.getCompletedAt());
        if(RunStatus.FAILED.getValue().equals(db.getStatus())) {
            info.setLastError(JacksonUtils.deserialize(run.getLastError(), LastError.class));
        }

        RunStepInfo.StepDetails details = new RunStepInfo.StepDetails();
        details.setType(db.getType());
        if(RunStepDb.MESSAGE_CREATION.equals(db.getType())) {
            RunStepInfo.MessageCreation messageCreation = new RunStepInfo.MessageCreation();
            messageCreation.setMessageId(db.getMessageId());
            details.setMessageCreation(messageCreation);
        } else {
            details.setToolCalls(callsByRound.getOrDefault(db.getStepNumber().intValue(), new ArrayList<>()));
        }
        info.setStepDetails(details);
        return info;
    }
}
