package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.common.DeleteResponse;
import com.ke.hal.context.UserContext;
import com.ke.hal.run.RunInfo;
import com.ke.hal.run.RunOps;
import com.ke.hal.run.RunStepInfo;
import com.ke.hal.run.ToolCallInfo;
import com.ke.hal.service.RunService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * Run Controller
 */
@RestController
@RequestMapping("/v1/threads/{thread_id}/runs")
public class RunController {

    @Autowired
    private RunService runService;

    /**
     * 创建 Run，立即返回 queued 状态，由引擎异步执行
     */
    @PostMapping
    public RunInfo createRun(
            @PathVariable("thread_id") String threadId,
            @Valid @RequestBody RunOps.CreateRunOp request) {
        return runService.createRun(UserContext.getUserId(), threadId, request);
    }

    @GetMapping("/{run_id}")
    public RunInfo getRun(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId) {
        return runService.getRun(threadId, runId);
    }

    /**
     * 只允许修改 metadata
     */
    @PostMapping("/{run_id}")
    public RunInfo updateRun(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId,
            @Valid @RequestBody RunOps.UpdateRunOp request) {
        return runService.updateRun(threadId, runId, request);
    }

    /**
     * 只能删除已结束的 run
     */
    @DeleteMapping("/{run_id}")
    public DeleteResponse deleteRun(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId) {
        boolean deleted = runService.deleteRun(threadId, runId);
        return new DeleteResponse(runId, "thread.run.deleted", deleted);
    }

    @GetMapping
    public CommonPage<RunInfo> listRuns(
            @PathVariable("thread_id") String threadId,
            @RequestParam(value = "after", required = false) String after,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        limit = PageUtils.checkLimit(limit);
        List<RunInfo> infoList = runService.getRunsByCursor(threadId, after, before, limit + 1, PageUtils.checkOrder(order));
        return PageUtils.toPage(infoList, limit, RunInfo::getId);
    }

    /**
     * run 内全部工具调用，按轮次排序
     */
    @GetMapping("/{run_id}/tool_calls")
    public CommonPage<ToolCallInfo> listToolCalls(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId) {
        List<ToolCallInfo> toolCalls = runService.getToolCalls(threadId, runId);
        return PageUtils.toPage(toolCalls, Integer.MAX_VALUE, ToolCallInfo::getId);
    }

    @GetMapping("/{run_id}/steps")
    public CommonPage<RunStepInfo> listRunSteps(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId,
            @RequestParam(value = "after", required = false) String after,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        limit = PageUtils.checkLimit(limit);
        List<RunStepInfo> infoList = runService.getStepsByCursor(threadId, runId, after, before, limit + 1, PageUtils.checkOrder(order));
        return PageUtils.toPage(infoList, limit, RunStepInfo::getId);
    }

    @GetMapping("/{run_id}/steps/{step_id}")
    public RunStepInfo getRunStep(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId,
            @PathVariable("step_id") String stepId) {
        return runService.getStep(threadId, runId, stepId);
    }

    @PostMapping("/{run_id}/submit_tool_outputs")
    public RunInfo submitToolOutputs(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId,
            @Valid @RequestBody RunOps.SubmitToolOutputsOp request) {
        return runService.submitToolOutputs(threadId, runId, request);
    }

    @PostMapping("/{run_id}/cancel")
    public RunInfo cancelRun(
            @PathVariable("thread_id") String threadId,
            @PathVariable("run_id") String runId) {
        return runService.cancelRun(threadId, runId);
    }
}
