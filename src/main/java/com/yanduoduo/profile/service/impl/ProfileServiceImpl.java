package com.yanduoduo.profile.service.impl;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.profile.api.dto.AvatarUploadResponse;
import com.yanduoduo.profile.api.dto.ProfileResponse;
import com.yanduoduo.profile.service.ProfileService;
import com.yanduoduo.storage.AvatarStore;
import com.yanduoduo.user.domain.User;
import com.yanduoduo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileServiceImpl implements ProfileService {

    private final UserService userService;
    private final AvatarStore avatarStore;

    @Override
    public ProfileResponse getProfile(long userId) {
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNREGISTERED, "用户不存在"));
        return new ProfileResponse(user.getId(), user.getPhone(), user.getNickname(), user.getAvatar());
    }

    /**
     * 保存新头像后更新用户记录并删除被替换的旧文件。
     * 保存之后的任一步失败都会删除刚写入的文件，用户记录保持原值。
     */
    @Override
    public AvatarUploadResponse uploadAvatar(long userId, MultipartFile file) {
        log.info("用户 {} 上传头像", userId);
        if (file == null || file.isEmpty()) {
            throw new BusinessException(ErrorCode.UPLOAD_ERROR, "未收到头像文件");
        }
        String previousAvatar = userService.findById(userId)
                .map(User::getAvatar)
                .orElse(null);

        String fileName = null;
        try (InputStream in = file.getInputStream()) {
            fileName = storeAvatar(in, userId, file.getOriginalFilename());
        } catch (IOException ex) {
            // 打开或关闭上传流失败
            if (fileName != null) {
                avatarStore.delete(fileName);
            }
            throw new BusinessException(ErrorCode.UPLOAD_ERROR, ex.getMessage(), ex);
        }
        log.info("成功保存图片，图片名称为：{}", fileName);

        String avatarUrl = avatarStore.urlFor(fileName);
        try {
            userService.updateAvatar(userId, avatarUrl);
        } catch (RuntimeException ex) {
            avatarStore.delete(fileName);
            throw ex;
        }
        log.info("用户 {} 修改头像成功", userId);
        if (previousAvatar != null && !previousAvatar.equals(avatarUrl)) {
            avatarStore.fileNameOf(previousAvatar).ifPresent(avatarStore::delete);
        }
        return new AvatarUploadResponse(avatarUrl);
    }

    /**
     * 读取全部内容并交给存储；失败时排空剩余数据后抛出 UPLOAD_ERROR，调用方不得继续更新用户记录。
     */
    private String storeAvatar(InputStream in, long userId, String originalName) {
        try {
            byte[] content = IOUtils.toByteArray(in);
            return avatarStore.save(content, userId, originalName);
        } catch (IOException | RuntimeException ex) {
            drainQuietly(in);
            log.error("用户 {} 头像保存失败", userId, ex);
            throw new BusinessException(ErrorCode.UPLOAD_ERROR, ErrorCode.UPLOAD_ERROR.getDefaultMessage(), ex);
        }
    }

    private static void drainQuietly(InputStream in) {
        try {
            IOUtils.consume(in);
        } catch (IOException ex) {
            log.debug("Failed to drain avatar stream", ex);
        }
    }
}
