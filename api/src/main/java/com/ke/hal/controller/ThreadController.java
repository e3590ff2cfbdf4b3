package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.common.DeleteResponse;
import com.ke.hal.context.UserContext;
import com.ke.hal.service.ThreadService;
import com.ke.hal.thread.ThreadInfo;
import com.ke.hal.thread.ThreadOps;
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
 * Thread Controller
 */
@RestController
@RequestMapping("/v1/threads")
public class ThreadController {

    @Autowired
    private ThreadService threadService;

    @PostMapping
    public ThreadInfo createThread(@Valid @RequestBody(required = false) ThreadOps.CreateThreadOp request) {
        return threadService.createThread(UserContext.getUserId(), request == null ? new ThreadOps.CreateThreadOp() : request);
    }

    @GetMapping
    public CommonPage<ThreadInfo> listThreads(
            @RequestParam(value = "after", required = false) String after,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        limit = PageUtils.checkLimit(limit);
        List<ThreadInfo> infoList = threadService.getThreadsByCursor(UserContext.getUserId(), after, before,
                limit + 1, PageUtils.checkOrder(order));
        return PageUtils.toPage(infoList, limit, ThreadInfo::getId);
    }

    @GetMapping("/{thread_id}")
    public ThreadInfo getThread(@PathVariable("thread_id") String threadId) {
        return threadService.getThread(UserContext.getUserId(), threadId);
    }

    @PostMapping("/{thread_id}")
    public ThreadInfo updateThread(
            @PathVariable("thread_id") String threadId,
            @Valid @RequestBody ThreadOps.UpdateThreadOp request) {
        return threadService.updateThread(UserContext.getUserId(), threadId, request);
    }

    /**
     * 删除 Thread，线程上有未结束的 run 时返回 400
     */
    @DeleteMapping("/{thread_id}")
    public DeleteResponse deleteThread(@PathVariable("thread_id") String threadId) {
        boolean deleted = threadService.deleteThread(UserContext.getUserId(), threadId);
        return new DeleteResponse(threadId, "thread.deleted", deleted);
    }
}
