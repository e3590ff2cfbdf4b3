package com.ke.hal.configuration;

import com.ke.hal.context.UserContext;
import com.ke.hal.service.ThreadService;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.util.Map;

/**
 * 路径中带 thread_id 的请求，校验线程存在且属于调用方，否则返回 404
 */
@Component
@RequiredArgsConstructor
public class ThreadOwnershipInterceptor implements HandlerInterceptor {

    private final ThreadService threadService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if(!(handler instanceof HandlerMethod)) {
            return true;
        }

        @SuppressWarnings("unchecked")
        Map<String, String> uriVariables = (Map<String, String>) request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if(uriVariables == null) {
            return true;
        }
        String threadId = uriVariables.get("thread_id");
        if(StringUtils.isNotBlank(threadId)) {
            threadService.getOwnedThread(UserContext.getUserId(), threadId);
        }
        return true;
    }
}
