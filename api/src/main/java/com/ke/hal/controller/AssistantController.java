package com.ke.hal.controller;

import com.ke.hal.assistant.AssistantInfo;
import com.ke.hal.assistant.AssistantOps;
import com.ke.hal.common.CommonPage;
import com.ke.hal.common.DeleteResponse;
import com.ke.hal.context.UserContext;
import com.ke.hal.service.AssistantService;
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
 * Assistant Controller
 */
@RestController
@RequestMapping("/v1/assistants")
public class AssistantController {

    @Autowired
    private AssistantService assistantService;

    /**
     * 创建 Assistant
     */
    @PostMapping
    public AssistantInfo createAssistant(@Valid @RequestBody AssistantOps.CreateAssistantOp request) {
        return assistantService.createAssistant(UserContext.getUserId(), request);
    }

    /**
     * 获取 Assistant 详情
     */
    @GetMapping("/{assistant_id}")
    public AssistantInfo getAssistant(@PathVariable("assistant_id") String assistantId) {
        return assistantService.getAssistant(UserContext.getUserId(), assistantId);
    }

    /**
     * 获取 Assistant 列表
     */
    @GetMapping
    public CommonPage<AssistantInfo> listAssistants(
            @RequestParam(value = "after", required = false) String after,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        limit = PageUtils.checkLimit(limit);
        List<AssistantInfo> infoList = assistantService.getAssistantsByCursor(UserContext.getUserId(), after, before,
                limit + 1, PageUtils.checkOrder(order));
        return PageUtils.toPage(infoList, limit, AssistantInfo::getId);
    }

    /**
     * 更新 Assistant
     */
    @PostMapping("/{assistant_id}")
    public AssistantInfo updateAssistant(
            @PathVariable("assistant_id") String assistantId,
            @Valid @RequestBody AssistantOps.UpdateAssistantOp request) {
        return assistantService.updateAssistant(UserContext.getUserId(), assistantId, request);
    }

    /**
     * 删除 Assistant
     */
    @DeleteMapping("/{assistant_id}")
    public DeleteResponse deleteAssistant(@PathVariable("assistant_id") String assistantId) {
        boolean deleted = assistantService.deleteAssistant(UserContext.getUserId(), assistantId);
        return new DeleteResponse(assistantId, "assistant.deleted", deleted);
    }
}
