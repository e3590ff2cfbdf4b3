package com.ke.hal.core.run;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Run执行状态枚举
 * 基于OpenAI Assistant API标准定义
 */
@Getter
@AllArgsConstructor
public enum RunStatus {

    /**
     * 排队中 - Run已创建或已提交工具结果，等待引擎取出
     */
    QUEUED("queued"),

    /**
     * 执行中 - 引擎持有 lease 并在执行
     */
    IN_PROGRESS("in_progress"),

    /**
     * 需要用户操作 - 等待调用方提交 function 调用结果
     */
    REQUIRES_ACTION("requires_action"),

    /**
     * 取消中 - 等待引擎在下一个检查点结束执行
     */
    CANCELLING("cancelling"),

    CANCELLED("cancelled"),

    FAILED("failed"),

    COMPLETED("completed"),

    EXPIRED("expired");

    private final String value;

    /**
     * 判断是否为终止状态
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == EXPIRED;
    }

    public static RunStatus fromValue(String value) {
        return Arrays.stream(RunStatus.values())
                .filter(runStatus -> runStatus.value.equals(value))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException("unknown run status: " + value));
    }

    public static Set<String> nonTerminalValues() {
        return EnumSet.complementOf(EnumSet.of(COMPLETED, FAILED, CANCELLED, EXPIRED)).stream()
                .map(RunStatus::getValue)
                .collect(Collectors.toSet());
    }

    /**
     * 判断是否可以执行状态转换，终止状态不可再转换
     */
    public boolean canTransitionTo(RunStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case QUEUED:
                return target == IN_PROGRESS || target == CANCELLING || target == CANCELLED || target == FAILED || target == EXPIRED;
            case IN_PROGRESS:
                return target == IN_PROGRESS || target == REQUIRES_ACTION || target == COMPLETED || target == FAILED
                        || target == CANCELLING || target == EXPIRED;
            case REQUIRES_ACTION:
                return target == QUEUED || target == CANCELLING || target == FAILED || target == EXPIRED;
            case CANCELLING:
                return target == CANCELLED || target == FAILED;
            default:
                return false;
        }
    }
}
