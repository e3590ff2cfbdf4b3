package com.ke.hal.context;

/**
 * 当前请求的调用方，由 UserInterceptor 从请求头写入
 */
public class UserContext {

    public static final String HEADER = "X-User-Id";
    public static final String ANONYMOUS = "anonymous";

    private static final ThreadLocal<String> USER_ID = new ThreadLocal<>();

    private UserContext() {
    }

    public static String getUserId() {
        String userId = USER_ID.get();
        return userId == null ? ANONYMOUS : userId;
    }

    public static void setUserId(String userId) {
        USER_ID.set(userId);
    }

    public static void clear() {
        USER_ID.remove();
    }
}
