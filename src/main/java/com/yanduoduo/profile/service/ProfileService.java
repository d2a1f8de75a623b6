package com.yanduoduo.profile.service;

import com.yanduoduo.profile.api.dto.AvatarUploadResponse;
import com.yanduoduo.profile.api.dto.ProfileResponse;
import org.springframework.web.multipart.MultipartFile;

/**
 * 个人资料业务接口。
 */
public interface ProfileService {

    ProfileResponse getProfile(long userId);

    /**
     * 上传并替换头像。存储失败时不修改用户记录。
     *
     * @param userId 当前用户 ID。
     * @param file   上传的图片。
     * @return 新头像的访问地址。
     */
    AvatarUploadResponse uploadAvatar(long userId, MultipartFile file);
}
