package com.ke.hal.core.run;

import com.ke.hal.BaseSpringTest;
import com.ke.hal.ToolFixtures;
import com.ke.hal.collaborator.action.ActionRequest;
import com.ke.hal.collaborator.action.ActionResponse;
import com.ke.hal.collaborator.sandbox.SandboxResult;
import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ChatEntry;
import com.ke.hal.core.ai.ModelRequest;
import com.ke.hal.core.ai.ModelResponse;
import com.ke.hal.core.ai.ToolInvocation;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.db.repo.RunRepo;
import com.ke.hal.db.repo.ToolCallRepo;
import com.ke.hal.exception.AssistantException;
import com.ke.hal.exception.BadRequestException;
import com.ke.hal.exception.ContextLengthExceededException;
import com.ke.hal.exception.ErrorCode;
import com.ke.hal.exception.TransientCollaboratorException;
import com.ke.hal.message.MessageContent;
import com.ke.hal.message.MessageInfo;
import com.ke.hal.message.MessageOps;
import com.ke.hal.run.RunInfo;
import com.ke.hal.run.RunOps;
import com.ke.hal.run.RunStepInfo;
import com.ke.hal.run.ToolCallInfo;
import com.ke.hal.service.ChunkService;
import com.ke.hal.service.MessageService;
import com.ke.hal.thread.ThreadOps;
import com.ke.hal.util.DateTimeUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RunProcessor 端到端测试，直接驱动一次投递的处理
 */
class RunProcessorTest extends BaseSpringTest {

    @Autowired
    private RunProcessor runProcessor;

    @Autowired
    private RunStateManager runStateManager;

    @Autowired
    private RunExpirationScheduler runExpirationScheduler;

    @Autowired
    private MessageService messageService;

    @Autowired
    private ChunkService chunkService;

    @Autowired
    private RunRepo runRepo;

    @Autowired
    private ToolCallRepo toolCallRepo;

    @Test
    @DisplayName("function 调用：requires_action → 提交结果 → completed")
    void functionCallRoundTrip() {
        String assistantId = createAssistant(ToolFixtures.function("get_weather"));
        String threadId = createThread("What's the weather in Paris?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("call_model_1", "get_weather", "{\"city\":\"Paris\"}")))
                .thenReturn(ModelResponse.text("It is sunny in Paris."));

        RunInfo run = process(threadId, runId);

        assertEquals("requires_action", run.getStatus());
        List<RunInfo.RequiredAction.ToolCall> required = run.getRequiredAction().getSubmitToolOutputs().getToolCalls();
        assertEquals(1, required.size());
        assertEquals("get_weather", required.get(0).getFunction().getName());
        assertEquals("{\"city\":\"Paris\"}", required.get(0).getFunction().getArguments());

        RunInfo queued = runService.submitToolOutputs(threadId, runId, outputs(output(required.get(0).getId(), "{\"temp\":20}")));
        assertEquals("queued", queued.getStatus());
        assertNull(queued.getRequiredAction());

        run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        assertTrue(run.getCompletedAt() != null);
        List<MessageInfo> messages = messageService.getRunMessages(threadId, runId);
        assertEquals(1, messages.size());
        assertEquals("assistant", messages.get(0).getRole());
        assertEquals("It is sunny in Paris.", messages.get(0).getContent().get(0).getText().getValue());

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelClient, times(2)).complete(captor.capture());
        ModelRequest first = captor.getAllValues().get(0);
        assertEquals("gpt-4o", first.getModel());
        assertEquals("get_weather", first.getTools().get(0).getName());
        List<ChatEntry> history = captor.getAllValues().get(1).getHistory();
        assertEquals(3, history.size());
        assertEquals(required.get(0).getId(), history.get(1).getToolCalls().get(0).getId());
        assertEquals(ChatEntry.TOOL, history.get(2).getRole());
        assertEquals("{\"temp\":20}", history.get(2).getContent());
    }

    @Test
    @DisplayName("run step：工具轮次在提交前为 in_progress，完成后追加 message_creation")
    void stepsFollowRunLifecycle() {
        String assistantId = createAssistant(ToolFixtures.function("get_weather"));
        String threadId = createThread("What's the weather in Paris?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("call_model_1", "get_weather", "{\"city\":\"Paris\"}")))
                .thenReturn(ModelResponse.text("It is sunny in Paris."));

        RunInfo run = process(threadId, runId);
        List<RunStepInfo> steps = steps(threadId, runId);
        assertEquals(1, steps.size());
        assertEquals("tool_calls", steps.get(0).getType());
        assertEquals("in_progress", steps.get(0).getStatus());
        assertEquals(1, steps.get(0).getStepDetails().getToolCalls().size());
        assertEquals("get_weather", steps.get(0).getStepDetails().getToolCalls().get(0).getName());

        String callId = run.getRequiredAction().getSubmitToolOutputs().getToolCalls().get(0).getId();
        runService.submitToolOutputs(threadId, runId, outputs(output(callId, "{\"temp\":20}")));
        assertEquals("completed", process(threadId, runId).getStatus());

        steps = steps(threadId, runId);
        assertEquals(2, steps.size());
        assertEquals("completed", steps.get(0).getStatus());
        assertTrue(steps.get(0).getCompletedAt() != null);
        assertEquals("message_creation", steps.get(1).getType());
        assertEquals("completed", steps.get(1).getStatus());
        String messageId = messageService.getRunMessages(threadId, runId).get(0).getId();
        assertEquals(messageId, steps.get(1).getStepDetails().getMessageCreation().getMessageId());
        assertEquals(steps.get(1).getId(), runService.getStep(threadId, runId, steps.get(1).getId()).getId());
    }

    @Test
    @DisplayName("提交的结果必须与 pending 调用完全一致")
    void rejectsPartialOrExtraneousOutputs() {
        String assistantId = createAssistant(ToolFixtures.function("get_weather"), ToolFixtures.function("get_time"));
        String threadId = createThread("Weather and time in Paris?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenReturn(toolCalls(
                new ToolInvocation("a", "get_weather", "{\"city\":\"Paris\"}"),
                new ToolInvocation("b", "get_time", "{\"city\":\"Paris\"}")));

        RunInfo run = process(threadId, runId);
        List<RunInfo.RequiredAction.ToolCall> required = run.getRequiredAction().getSubmitToolOutputs().getToolCalls();
        assertEquals(2, required.size());
        String weatherId = required.get(0).getId();
        String timeId = required.get(1).getId();

        assertThrows(BadRequestException.class,
                () -> runService.submitToolOutputs(threadId, runId, outputs(output(weatherId, "sunny"))));
        assertThrows(BadRequestException.class, () -> runService.submitToolOutputs(threadId, runId,
                outputs(output(weatherId, "sunny"), output(timeId, "noon"), output("call_unknown", "?"))));
        assertThrows(BadRequestException.class, () -> runService.submitToolOutputs(threadId, runId,
                outputs(output(weatherId, "sunny"), output(weatherId, "rainy"))));
        AssistantException nullOutput = assertThrows(AssistantException.class, () -> runService.submitToolOutputs(threadId, runId,
                outputs(output(weatherId, "sunny"), output(timeId, null))));
        assertEquals(ErrorCode.INVALID_TOOL_OUTPUT, nullOutput.getCode());

        assertEquals("requires_action", runService.getRun(threadId, runId).getStatus());
        assertTrue(toolCallRepo.findByRunId(runId).stream().allMatch(ToolCallDb::isPending));

        RunInfo queued = runService.submitToolOutputs(threadId, runId, outputs(output(timeId, "noon"), output(weatherId, "sunny")));
        assertEquals("queued", queued.getStatus());
        assertThrows(BadRequestException.class, () -> runService.submitToolOutputs(threadId, runId,
                outputs(output(timeId, "noon"), output(weatherId, "sunny"))));
    }

    @Test
    @DisplayName("代码执行结果反馈给模型后完成")
    void codeInterpreterAnswer() {
        String assistantId = createAssistant(ToolFixtures.codeInterpreter());
        String threadId = createThread("What is 3*7+2?");
        String runId = createRun(threadId, assistantId);
        when(sandbox.run(anyString(), any(Duration.class))).thenReturn(new SandboxResult(0, "23\n", "", false, new ArrayList<>()));
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "code_interpreter", "{\"code\":\"print(3*7+2)\"}")))
                .thenReturn(ModelResponse.text("3*7+2 = 23"));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        verify(sandbox).run(eq("print(3*7+2)"), any(Duration.class));
        List<ToolCallInfo> calls = runService.getToolCalls(threadId, runId);
        assertEquals(1, calls.size());
        assertEquals(Tool.CODE_INTERPRETER, calls.get(0).getType());
        assertEquals("completed", calls.get(0).getStatus());
        assertFalse(calls.get(0).getIsError());
        assertTrue(calls.get(0).getOutput().contains("23"));
        assertEquals("3*7+2 = 23", messageService.getRunMessages(threadId, runId).get(0).getContent().get(0).getText().getValue());
    }

    @Test
    @DisplayName("连续执行失败达到上限后 sandbox_exhausted")
    void sandboxExhausted() {
        String assistantId = createAssistant(ToolFixtures.codeInterpreter());
        String threadId = createThread("Divide by zero please");
        String runId = createRun(threadId, assistantId);
        when(sandbox.run(anyString(), any(Duration.class)))
                .thenReturn(new SandboxResult(1, "", "ZeroDivisionError", false, new ArrayList<>()));
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "code_interpreter", "{\"code\":\"1/0\"}")));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("sandbox_exhausted", run.getLastError().getCode());
        List<RunStepInfo> steps = steps(threadId, runId);
        RunStepInfo failedStep = steps.get(steps.size() - 1);
        assertEquals("failed", failedStep.getStatus());
        assertEquals("sandbox_exhausted", failedStep.getLastError().getCode());
        verify(sandbox, times(2)).run(anyString(), any(Duration.class));
        assertTrue(runService.getToolCalls(threadId, runId).stream().allMatch(ToolCallInfo::getIsError));
    }

    @Test
    @DisplayName("模型持续返回可重试错误，重试耗尽后失败")
    void transientModelErrorsExhausted() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenThrow(new TransientCollaboratorException(ErrorCode.SERVER_ERROR, "model endpoint error 503"));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("server_error", run.getLastError().getCode());
        assertTrue(run.getFailedAt() != null);
        verify(modelClient, times(3)).complete(any());
        assertTrue(messageService.getRunMessages(threadId, runId).isEmpty());
    }

    @Test
    void transientModelErrorRecovers() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenThrow(new TransientCollaboratorException(ErrorCode.RATE_LIMIT, "slow down"))
                .thenReturn(ModelResponse.text("Hi there"));

        assertEquals("completed", process(threadId, runId).getStatus());
        verify(modelClient, times(2)).complete(any());
    }

    @Test
    @DisplayName("持续限流，重试耗尽后以 rate_limit 失败")
    void rateLimitExhausted() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenThrow(new TransientCollaboratorException(ErrorCode.RATE_LIMIT, "slow down"));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("rate_limit", run.getLastError().getCode());
        verify(modelClient, times(3)).complete(any());
    }

    @Test
    @DisplayName("重新投递时已完成的工具调用不再执行")
    void redeliveryDoesNotRepeatCompletedTools() {
        String assistantId = createAssistant(ToolFixtures.codeInterpreter());
        String threadId = createThread("What is 3*7+2?");
        String runId = createRun(threadId, assistantId);
        AtomicBoolean held = new AtomicBoolean(true);
        when(sandbox.run(anyString(), any(Duration.class))).thenAnswer(invocation -> {
            // 执行完成后 lease 丢失，模拟 worker 在落库结果后崩溃
            held.set(false);
            return new SandboxResult(0, "23\n", "", false, new ArrayList<>());
        });
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("c1", "code_interpreter", "{\"code\":\"print(3*7+2)\"}")))
                .thenReturn(ModelResponse.text("23"));

        runProcessor.process(runId, held::get);
        assertEquals("in_progress", runService.getRun(threadId, runId).getStatus());

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        verify(sandbox, times(1)).run(anyString(), any(Duration.class));
        verify(modelClient, times(2)).complete(any());
        assertEquals(2, runRepo.findById(runId).getAttempts());
        assertEquals(1, messageService.getRunMessages(threadId, runId).size());
    }

    @Test
    @DisplayName("中断的可重放调用在重新投递时执行")
    void replaysInterruptedReplayableCall() {
        String assistantId = createAssistant(ToolFixtures.codeInterpreter());
        String threadId = createThread("Print one");
        String runId = createRun(threadId, assistantId);
        runStateManager.toInProgress(runRepo.findById(runId));
        insertPendingCall(runId, Tool.CODE_INTERPRETER, "code_interpreter", "{\"code\":\"print(1)\"}");
        when(sandbox.run(anyString(), any(Duration.class))).thenReturn(new SandboxResult(0, "1\n", "", false, new ArrayList<>()));
        when(modelClient.complete(any())).thenReturn(ModelResponse.text("1"));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        verify(sandbox).run(eq("print(1)"), any(Duration.class));
        ToolCallInfo call = runService.getToolCalls(threadId, runId).get(0);
        assertEquals("completed", call.getStatus());
        assertFalse(call.getIsError());
    }

    @Test
    @DisplayName("中断的有副作用 action 不重放")
    void doesNotReplayConsequentialAction() {
        String assistantId = createAssistant(ToolFixtures.forecastAction("http://weather.local", true));
        String threadId = createThread("Book the forecast");
        String runId = createRun(threadId, assistantId);
        runStateManager.toInProgress(runRepo.findById(runId));
        insertPendingCall(runId, Tool.ACTION, "get_forecast", "{\"city\":\"Paris\"}");
        when(modelClient.complete(any())).thenReturn(ModelResponse.text("Not sure it went through."));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        verifyNoInteractions(actionCaller);
        ToolCallInfo call = runService.getToolCalls(threadId, runId).get(0);
        assertTrue(call.getIsError());
        assertTrue(call.getOutput().contains("interrupted"));
    }

    @Test
    @DisplayName("只用检索的 run 不进入 requires_action，回答带引用")
    void retrievalWithCitations() {
        String fileId = "file_" + userId;
        chunkService.ingest(fileId, "Paris is the capital of France. It sits on the Seine.", null);
        String assistantId = createAssistant(ToolFixtures.retrieval(fileId));
        String threadId = createThread("What is the capital of France?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("r1", "retrieval", "{\"query\":\"capital of France\"}")))
                .thenReturn(ModelResponse.text("The capital is Paris [1]."));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        assertNull(run.getRequiredAction());
        ToolCallInfo call = runService.getToolCalls(threadId, runId).get(0);
        assertEquals(Tool.RETRIEVAL, call.getType());
        assertTrue(call.getOutput().contains("\"index\":1"));
        assertTrue(call.getOutput().contains(fileId));

        MessageContent.Text text = messageService.getRunMessages(threadId, runId).get(0).getContent().get(0).getText();
        assertEquals(1, text.getAnnotations().size());
        MessageContent.Annotation annotation = text.getAnnotations().get(0);
        assertEquals("[1]", annotation.getText());
        assertEquals(fileId, annotation.getFileCitation().getFileId());
        assertTrue(annotation.getFileCitation().getQuote().contains("Paris"));
    }

    @Test
    @DisplayName("排队中的 run 取消后不再执行")
    void cancelQueuedRun() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);

        RunInfo cancelled = runService.cancelRun(threadId, runId);
        assertEquals("cancelled", cancelled.getStatus());

        RunInfo run = process(threadId, runId);

        assertEquals("cancelled", run.getStatus());
        assertTrue(run.getCancelledAt() != null);
        verifyNoInteractions(modelClient);
        assertThrows(BadRequestException.class, () -> runService.cancelRun(threadId, runId));
    }

    @Test
    @DisplayName("执行中取消，在下一个检查点结束")
    void cancelObservedAtCheckpoint() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenAnswer(invocation -> {
            assertEquals("cancelling", runService.cancelRun(threadId, runId).getStatus());
            return ModelResponse.text("too late");
        });

        RunInfo run = process(threadId, runId);

        assertEquals("cancelled", run.getStatus());
        assertTrue(messageService.getRunMessages(threadId, runId).isEmpty());
    }

    @Test
    void unknownToolFailsRun() {
        String assistantId = createAssistant(ToolFixtures.function("get_weather"));
        String threadId = createThread("Launch");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenReturn(toolCalls(new ToolInvocation("x", "launch_rockets", "{}")));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("invalid_tool", run.getLastError().getCode());
        assertTrue(toolCallRepo.findByRunId(runId).isEmpty());
    }

    @Test
    @DisplayName("模型轮次超过上限后失败")
    void maxStepsExceeded() {
        String assistantId = createAssistant(ToolFixtures.codeInterpreter());
        String threadId = createThread("Loop forever");
        String runId = createRun(threadId, assistantId);
        when(sandbox.run(anyString(), any(Duration.class))).thenReturn(new SandboxResult(0, "ok", "", false, new ArrayList<>()));
        when(modelClient.complete(any())).thenReturn(toolCalls(new ToolInvocation("c", "code_interpreter", "{\"code\":\"print('ok')\"}")));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("max_steps_exceeded", run.getLastError().getCode());
        verify(modelClient, times(5)).complete(any());
        verify(sandbox, times(5)).run(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("上下文超长时截断历史重试一次")
    void truncatesContextOnce() {
        String assistantId = createAssistant();
        String threadId = threadService.createThread(userId, threadOp(
                message("user", StringUtils.repeat("Tell me about the old days. ", 200)),
                message("assistant", StringUtils.repeat("Long ago there was a kingdom. ", 200)),
                message("user", "And now?"))).getId();
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenThrow(new ContextLengthExceededException("context_length_exceeded"))
                .thenReturn(ModelResponse.text("Now is different."));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelClient, times(2)).complete(captor.capture());
        List<ChatEntry> original = captor.getAllValues().get(0).getHistory();
        List<ChatEntry> truncated = captor.getAllValues().get(1).getHistory();
        assertEquals(3, original.size());
        assertTrue(truncated.size() < original.size());
        assertEquals("And now?", truncated.get(truncated.size() - 1).getContent());
    }

    @Test
    void contextStillTooLongFails() {
        String assistantId = createAssistant();
        String threadId = createThread("Old message", "New message");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenThrow(new ContextLengthExceededException("context_length_exceeded"));

        RunInfo run = process(threadId, runId);

        assertEquals("failed", run.getStatus());
        assertEquals("context_exceeded", run.getLastError().getCode());
        verify(modelClient, times(2)).complete(any());
    }

    @Test
    @DisplayName("排队期间过期的 run 不再执行")
    void expiresWhileQueued() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        DateTimeUtils.setClock(Clock.offset(Clock.systemUTC(), Duration.ofMinutes(11)));

        RunInfo run = process(threadId, runId);

        assertEquals("expired", run.getStatus());
        verifyNoInteractions(modelClient);
    }

    @Test
    @DisplayName("等待提交的 run 过期后被清理")
    void sweepExpiresRequiresAction() {
        String assistantId = createAssistant(ToolFixtures.function("get_weather"));
        String threadId = createThread("Weather?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenReturn(toolCalls(new ToolInvocation("a", "get_weather", "{}")));
        RunInfo run = process(threadId, runId);
        assertEquals("requires_action", run.getStatus());
        String callId = run.getRequiredAction().getSubmitToolOutputs().getToolCalls().get(0).getId();

        DateTimeUtils.setClock(Clock.offset(Clock.systemUTC(), Duration.ofMinutes(11)));
        assertTrue(runExpirationScheduler.sweep() >= 1);

        run = runService.getRun(threadId, runId);
        assertEquals("expired", run.getStatus());
        assertNull(run.getRequiredAction());
        assertEquals("expired", steps(threadId, runId).get(0).getStatus());
        assertThrows(BadRequestException.class,
                () -> runService.submitToolOutputs(threadId, runId, outputs(output(callId, "sunny"))));
    }

    @Test
    @DisplayName("action 缺少必填参数时错误反馈给模型")
    void actionMissingParameters() {
        String assistantId = createAssistant(ToolFixtures.forecastAction("http://weather.local", false));
        String threadId = createThread("Forecast?");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("f", "get_forecast", "{}")))
                .thenReturn(ModelResponse.text("Which city?"));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        verifyNoInteractions(actionCaller);
        ToolCallInfo call = runService.getToolCalls(threadId, runId).get(0);
        assertTrue(call.getIsError());
        assertEquals("missing required parameters: city", call.getOutput());
    }

    @Test
    @DisplayName("action 非 2xx 响应作为错误结果返回")
    void actionErrorStatus() {
        String assistantId = createAssistant(ToolFixtures.forecastAction("http://weather.local/", false));
        String threadId = createThread("Forecast for New York?");
        String runId = createRun(threadId, assistantId);
        when(actionCaller.invoke(any(), any())).thenReturn(new ActionResponse(500, "boom"));
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("f", "get_forecast", "{\"city\":\"New York\"}")))
                .thenReturn(ModelResponse.text("The weather service is down."));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        ArgumentCaptor<ActionRequest> captor = ArgumentCaptor.forClass(ActionRequest.class);
        verify(actionCaller).invoke(captor.capture(), any());
        assertEquals("GET", captor.getValue().getMethod());
        assertEquals("http://weather.local/forecast/New%20York", captor.getValue().getUrl());
        ToolCallInfo call = runService.getToolCalls(threadId, runId).get(0);
        assertTrue(call.getIsError());
        assertTrue(call.getOutput().contains("\"status\":500"));
    }

    @Test
    @DisplayName("operation 未声明参数时正常调用")
    void actionWithoutParameters() {
        Tool.ToolAction tool = ToolFixtures.forecastAction("http://status.local", false);
        Tool.ActionOperation operation = tool.getAction().getOperations().get(0);
        operation.setOperationId("get_status");
        operation.setPath("/status");
        operation.setParameters(null);
        String assistantId = createAssistant(tool);
        String threadId = createThread("Is the service up?");
        String runId = createRun(threadId, assistantId);
        when(actionCaller.invoke(any(), any())).thenReturn(new ActionResponse(200, "{\"up\":true}"));
        when(modelClient.complete(any()))
                .thenReturn(toolCalls(new ToolInvocation("s", "get_status", "{}")))
                .thenReturn(ModelResponse.text("The service is up."));

        RunInfo run = process(threadId, runId);

        assertEquals("completed", run.getStatus());
        ArgumentCaptor<ActionRequest> captor = ArgumentCaptor.forClass(ActionRequest.class);
        verify(actionCaller).invoke(captor.capture(), any());
        assertEquals("http://status.local/status", captor.getValue().getUrl());
        assertFalse(runService.getToolCalls(threadId, runId).get(0).getIsError());
    }

    @Test
    void terminalRunIsIgnored() {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);
        when(modelClient.complete(any())).thenReturn(ModelResponse.text("Hi"));
        assertEquals("completed", process(threadId, runId).getStatus());

        assertEquals("completed", process(threadId, runId).getStatus());
        verify(modelClient, times(1)).complete(any());
    }

    private RunInfo process(String threadId, String runId) {
        runProcessor.process(runId, LeaseGuard.ALWAYS);
        return runService.getRun(threadId, runId);
    }

    private List<RunStepInfo> steps(String threadId, String runId) {
        return runService.getStepsByCursor(threadId, runId, null, null, 20, "asc");
    }

    private void insertPendingCall(String runId, String type, String name, String arguments) {
        ToolCallDb call = new ToolCallDb();
        call.setRunId(runId);
        call.setType(type);
        call.setName(name);
        call.setArguments(arguments);
        call.setRound(1);
        call.setSeq(0);
        toolCallRepo.insert(call);
    }

    private static ModelResponse toolCalls(ToolInvocation... invocations) {
        return ModelResponse.toolCalls(new ArrayList<>(List.of(invocations)));
    }

    private static RunOps.ToolOutput output(String toolCallId, String output) {
        RunOps.ToolOutput toolOutput = new RunOps.ToolOutput();
        toolOutput.setToolCallId(toolCallId);
        toolOutput.setOutput(output);
        return toolOutput;
    }

    private static RunOps.SubmitToolOutputsOp outputs(RunOps.ToolOutput... outputs) {
        RunOps.SubmitToolOutputsOp op = new RunOps.SubmitToolOutputsOp();
        op.setToolOutputs(new ArrayList<>(List.of(outputs)));
        return op;
    }

    private static ThreadOps.CreateThreadOp threadOp(MessageOps.CreateMessageOp... messages) {
        ThreadOps.CreateThreadOp op = new ThreadOps.CreateThreadOp();
        op.setMessages(new ArrayList<>(List.of(messages)));
        return op;
    }
}
