package com.ke.hal;

import com.ke.hal.assistant.AssistantInfo;
import com.ke.hal.assistant.AssistantOps;
import com.ke.hal.collaborator.action.ActionCaller;
import com.ke.hal.collaborator.sandbox.Sandbox;
import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ModelClient;
import com.ke.hal.message.MessageOps;
import com.ke.hal.run.RunOps;
import com.ke.hal.service.AssistantService;
import com.ke.hal.service.RunService;
import com.ke.hal.service.ThreadService;
import com.ke.hal.thread.ThreadOps;
import com.ke.hal.util.DateTimeUtils;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 集成测试基类：H2 + 内存队列，模型、沙箱与 action 调用使用 mock，检索使用本地 chunks 表
 * 引擎 worker 不启动，测试直接驱动 RunProcessor
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("ut")
public abstract class BaseSpringTest {

    @MockBean
    protected ModelClient modelClient;

    @MockBean
    protected Sandbox sandbox;

    @MockBean
    protected ActionCaller actionCaller;

    @Autowired
    protected AssistantService assistantService;

    @Autowired
    protected ThreadService threadService;

    @Autowired
    protected RunService runService;

    /**
     * 每个测试使用独立的 owner，数据互不可见
     */
    protected final String userId = "user_" + UUID.randomUUID().toString().substring(0, 8);

    @AfterEach
    void resetClock() {
        DateTimeUtils.setClock(null);
    }

    protected String createAssistant(Tool... tools) {
        AssistantOps.CreateAssistantOp op = new AssistantOps.CreateAssistantOp();
        op.setModel("gpt-4o");
        op.setName("test assistant");
        op.setInstructions("You are a helpful assistant.");
        op.setTools(new ArrayList<>(List.of(tools)));
        AssistantInfo assistant = assistantService.createAssistant(userId, op);
        return assistant.getId();
    }

    protected String createThread(String... userMessages) {
        ThreadOps.CreateThreadOp op = new ThreadOps.CreateThreadOp();
        List<MessageOps.CreateMessageOp> messages = new ArrayList<>();
        for (String text : userMessages) {
            messages.add(message("user", text));
        }
        op.setMessages(messages);
        return threadService.createThread(userId, op).getId();
    }

    protected MessageOps.CreateMessageOp message(String role, String text) {
        MessageOps.CreateMessageOp message = new MessageOps.CreateMessageOp();
        message.setRole(role);
        message.setContent(text);
        return message;
    }

    protected String createRun(String threadId, String assistantId) {
        RunOps.CreateRunOp op = new RunOps.CreateRunOp();
        op.setAssistantId(assistantId);
        return runService.createRun(userId, threadId, op).getId();
    }
}
