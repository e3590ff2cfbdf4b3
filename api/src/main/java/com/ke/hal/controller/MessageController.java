package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.common.DeleteResponse;
import com.ke.hal.context.UserContext;
import com.ke.hal.message.MessageInfo;
import com.ke.hal.message.MessageOps;
import com.ke.hal.service.MessageService;
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
 * Message Controller，线程归属由 ThreadOwnershipInterceptor 校验
 */
@RestController
@RequestMapping("/v1/threads/{thread_id}/messages")
public class MessageController {

    @Autowired
    private MessageService messageService;

    @PostMapping
    public MessageInfo createMessage(
            @PathVariable("thread_id") String threadId,
            @Valid @RequestBody MessageOps.CreateMessageOp request) {
        return messageService.createMessage(UserContext.getUserId(), threadId, request);
    }

    @GetMapping
    public CommonPage<MessageInfo> listMessages(
            @PathVariable("thread_id") String threadId,
            @RequestParam(value = "after", required = false) String after,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        limit = PageUtils.checkLimit(limit);
        List<MessageInfo> infoList = messageService.getMessagesByCursor(threadId, after, before, limit + 1,
                PageUtils.checkOrder(order));
        return PageUtils.toPage(infoList, limit, MessageInfo::getId);
    }

    @GetMapping("/{message_id}")
    public MessageInfo getMessage(
            @PathVariable("thread_id") String threadId,
            @PathVariable("message_id") String messageId) {
        return messageService.getMessage(threadId, messageId);
    }

    @PostMapping("/{message_id}")
    public MessageInfo updateMessage(
            @PathVariable("thread_id") String threadId,
            @PathVariable("message_id") String messageId,
            @Valid @RequestBody MessageOps.UpdateMessageOp request) {
        return messageService.updateMessage(threadId, messageId, request);
    }

    @DeleteMapping("/{message_id}")
    public DeleteResponse deleteMessage(
            @PathVariable("thread_id") String threadId,
            @PathVariable("message_id") String messageId) {
        boolean deleted = messageService.deleteMessage(threadId, messageId);
        return new DeleteResponse(messageId, "thread.message.deleted", deleted);
    }
}
