package com.yanduoduo.storage.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * 将头像目录映射为静态资源：`{urlPrefix}/**` -> `file:{baseDir}/`。
 */
@Configuration
@EnableConfigurationProperties(AvatarStorageProperties.class)
@RequiredArgsConstructor
public class AvatarResourceConfig implements WebMvcConfigurer {

    private final AvatarStorageProperties props;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(props.getBaseDir()).toAbsolutePath().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(props.resourcePattern()).addResourceLocations(location);
    }
}
