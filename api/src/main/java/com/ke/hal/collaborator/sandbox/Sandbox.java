package com.ke.hal.collaborator.sandbox;

import java.time.Duration;

/**
 * 代码执行沙箱
 * 非零退出码与超时通过 SandboxResult 返回，沙箱服务本身不可用时抛出 SandboxException
 */
public interface Sandbox {

    SandboxResult run(String code, Duration timeout);
}
