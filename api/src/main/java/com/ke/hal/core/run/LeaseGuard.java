package com.ke.hal.core.run;

/**
 * 当前处理是否仍持有 run 的 lease
 */
@FunctionalInterface
public interface LeaseGuard {

    LeaseGuard ALWAYS = () -> true;

    boolean isHeld();
}
