package com.yanduoduo.auth.util;

import java.util.regex.Pattern;

public final class IdentifierValidator {

    /** 中国大陆 11 位手机号，以 1 开头。供 {@code @Pattern} 注解复用。 */
    public static final String PHONE_REGEX = "^1\\d{10}$";

    private static final Pattern PHONE_PATTERN = Pattern.compile(PHONE_REGEX);

    private IdentifierValidator() {
    }

    /**
     * 校验手机号格式。
     *
     * @param phone 手机号字符串。
     * @return 是否匹配手机号正则。
     */
    public static boolean isValidPhone(String phone) {
        return phone != null && PHONE_PATTERN.matcher(phone).matches();
    }
}
