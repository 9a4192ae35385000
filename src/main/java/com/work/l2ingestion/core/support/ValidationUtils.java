package com.work.l2ingestion.core.support;

import com.work.l2ingestion.core.exception.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * watcher 名会拼进 key，限制为可打印的 ASCII 子集，长度 1~64。
     */
    private static final Pattern WATCHER_PATTERN = Pattern.compile("^[a-zA-Z0-9:_.-]{1,64}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new InvalidArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new InvalidArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static String requireValidWatcherName(String watcherName) {
        requireNonEmpty(watcherName, "watcherName");
        if (!WATCHER_PATTERN.matcher(watcherName).matches()) {
            throw new InvalidArgumentException("watcherName 非法，只允许 1~64 位的字母、数字、':'、'_'、'.'、'-'");
        }
        return watcherName;
    }
}
