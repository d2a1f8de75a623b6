package com.yanduoduo.profile.api;

import com.yanduoduo.auth.token.JwtService;
import com.yanduoduo.profile.api.dto.AvatarUploadResponse;
import com.yanduoduo.profile.api.dto.ProfileResponse;
import com.yanduoduo.profile.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;
    private final JwtService jwtService;

    @GetMapping
    public ProfileResponse get(@AuthenticationPrincipal Jwt jwt) {
        return profileService.getProfile(jwtService.extractUserId(jwt));
    }

    @PostMapping("/avatar")
    public AvatarUploadResponse uploadAvatar(@AuthenticationPrincipal Jwt jwt,
                                             @RequestPart("file") MultipartFile file) {
        long userId = jwtService.extractUserId(jwt);
        return profileService.uploadAvatar(userId, file);
    }
}
