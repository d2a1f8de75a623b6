package com.yanduoduo.storage;

import com.yanduoduo.storage.config.AvatarStorageProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.UUID;

/**
 * 本地磁盘头像存储。文件名格式：`{userId}-{uuid}.{ext}`。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalAvatarStore implements AvatarStore {

    private static final int MAX_EXT_LENGTH = 10;

    private final AvatarStorageProperties props;

    @PostConstruct
    void init() throws IOException {
        Path dir = baseDir();
        Files.createDirectories(dir);
        if (!Files.isWritable(dir)) {
            log.warn("Avatar dir not writable: {}", dir);
        } else {
            log.info("Avatar dir ready: {}", dir);
        }
    }

    @Override
    public String save(byte[] content, long userId, String originalName) throws IOException {
        if (content == null || content.length == 0) {
            throw new IOException("Empty avatar content");
        }
        String ext = safeExt(originalName);
        String fileName = userId + "-" + UUID.randomUUID().toString().replace("-", "")
                + (ext.isEmpty() ? "" : "." + ext);
        Path dir = baseDir();
        Files.createDirectories(dir);
        // CREATE_NEW 防止覆盖
        Files.write(dir.resolve(fileName), content, StandardOpenOption.CREATE_NEW);
        return fileName;
    }

    @Override
    public String urlFor(String fileName) {
        return props.normalizedUrlPrefix() + "/" + fileName;
    }

    @Override
    public Optional<String> fileNameOf(String url) {
        String prefix = props.normalizedUrlPrefix() + "/";
        if (!StringUtils.hasText(url) || !url.startsWith(prefix)) {
            return Optional.empty();
        }
        String fileName = url.substring(prefix.length());
        if (fileName.isEmpty() || fileName.contains("/") || fileName.contains("\\") || fileName.startsWith(".")) {
            return Optional.empty();
        }
        return Optional.of(fileName);
    }

    @Override
    public void delete(String fileName) {
        Path dir = baseDir().normalize();
        Path target = dir.resolve(fileName).normalize();
        if (!target.getParent().equals(dir)) {
            log.warn("Refuse to delete avatar outside dir: {}", fileName);
            return;
        }
        try {
            if (Files.deleteIfExists(target)) {
                log.info("Deleted avatar file {}", fileName);
            }
        } catch (IOException ex) {
            log.warn("Failed to delete avatar file {}", fileName, ex);
        }
    }

    private Path baseDir() {
        return Path.of(props.getBaseDir()).toAbsolutePath();
    }

    /** 只保留小写字母数字扩展名。 */
    private static String safeExt(String originalName) {
        if (!StringUtils.hasText(originalName)) {
            return "";
        }
        String ext;
        try {
            ext = FilenameUtils.getExtension(originalName.trim());
        } catch (IllegalArgumentException ex) {
            // 含 ':' 等非法字符的文件名
            return "";
        }
        ext = ext == null ? "" : ext.toLowerCase().replaceAll("[^a-z0-9]+", "");
        return ext.length() > MAX_EXT_LENGTH ? "" : ext;
    }
}
