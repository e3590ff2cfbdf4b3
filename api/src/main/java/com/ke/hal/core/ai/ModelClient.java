package com.ke.hal.core.ai;

/**
 * 模型调用适配器
 * 网络错误、5xx 与 429 抛出 TransientCollaboratorException，上下文超长抛出 ContextLengthExceededException，
 * 其余 4xx 抛出 ModelClientException
 */
public interface ModelClient {

    ModelResponse complete(ModelRequest request);
}
