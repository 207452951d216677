package com.work.txpipeline.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * EVM 地址：0x + 40 位十六进制。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /**
     * wei 金额：十进制非负整数，不超过 uint256 的位数。
     */
    private static final Pattern WEI_PATTERN = Pattern.compile("^[0-9]{1,78}$");

    /**
     * calldata：0x + 偶数位十六进制。
     */
    private static final Pattern HEX_DATA_PATTERN = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    /**
     * intent_key 长度与列宽一致。
     */
    private static final int MAX_INTENT_KEY_LENGTH = 128;

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    public static int requirePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验并规范化 EVM 地址（统一转小写，账本与锁 key 都以小写形式出现）。
     */
    public static String requireAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        if (!ADDRESS_PATTERN.matcher(address).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法的地址: " + address);
        }
        return address.toLowerCase();
    }

    public static String requireIntentKey(String intentKey) {
        requireNonEmpty(intentKey, "intentKey");
        if (intentKey.length() > MAX_INTENT_KEY_LENGTH) {
            throw new IllegalArgumentException("intentKey 长度不能超过 " + MAX_INTENT_KEY_LENGTH);
        }
        return intentKey;
    }

    /**
     * 空值视为 0。
     */
    public static String requireWeiValue(String value, String paramName) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        if (!WEI_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法的十进制 wei 金额: " + value);
        }
        return value;
    }

    /**
     * 空值视为无 calldata。
     */
    public static String requireHexData(String data, String paramName) {
        if (data == null || data.isEmpty()) {
            return data;
        }
        if (!HEX_DATA_PATTERN.matcher(data).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法的十六进制数据");
        }
        return data;
    }
}
