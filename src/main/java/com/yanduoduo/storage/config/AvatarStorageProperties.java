package com.yanduoduo.storage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "avatar")
public class AvatarStorageProperties {
    /** 头像落盘目录。 */
    private String baseDir = "uploads/avatar";
    /** 对外访问前缀。 */
    private String urlPrefix = "/public/uploads/avatar";

    /** 去掉末尾斜杠的访问前缀。 */
    public String normalizedUrlPrefix() {
        return urlPrefix.replaceAll("/+$", "");
    }

    /** 头像静态资源的匹配模式，如 `/public/uploads/avatar/**`。 */
    public String resourcePattern() {
        return normalizedUrlPrefix() + "/**";
    }
}
