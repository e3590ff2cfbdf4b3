package com.ke.hal.collaborator.action;

import java.time.Duration;

/**
 * 执行 action 工具的 HTTP 请求，任何状态码都作为结果返回，网络错误抛出 TransientCollaboratorException
 */
public interface ActionCaller {

    ActionResponse invoke(ActionRequest request, Duration timeout);
}
