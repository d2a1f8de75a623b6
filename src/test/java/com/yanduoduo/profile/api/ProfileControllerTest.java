package com.yanduoduo.profile.api;

import com.yanduoduo.auth.config.SecurityConfig;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.auth.token.JwtService;
import com.yanduoduo.profile.api.dto.AvatarUploadResponse;
import com.yanduoduo.profile.api.dto.ProfileResponse;
import com.yanduoduo.profile.service.ProfileService;
import com.yanduoduo.storage.config.AvatarResourceConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProfileController.class)
@Import({SecurityConfig.class, AvatarResourceConfig.class})
class ProfileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProfileService profileService;
    @MockBean
    private JwtService jwtService;
    @MockBean
    private JwtDecoder jwtDecoder;

    @Test
    void profileRequiresAccessToken() throws Exception {
        mockMvc.perform(get("/api/v1/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(ErrorCode.TOKEN_INVALID.getCode()));

        verify(profileService, never()).getProfile(anyLong());
    }

    @Test
    void profileOfTokenOwner() throws Exception {
        when(jwtService.extractUserId(any(Jwt.class))).thenReturn(7L);
        when(profileService.getProfile(7L))
                .thenReturn(new ProfileResponse(7L, "13800000000", "tester", null));

        mockMvc.perform(get("/api/v1/profile").with(jwt().jwt(token -> token.claim("uid", 7L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.phone").value("13800000000"));
    }

    @Test
    void uploadWithoutFilePartIsUploadError() throws Exception {
        mockMvc.perform(multipart("/api/v1/profile/avatar")
                        .file(new MockMultipartFile("image", "a.png", "image/png", new byte[]{1}))
                        .with(jwt()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.UPLOAD_ERROR.getCode()));

        verify(profileService, never()).uploadAvatar(anyLong(), any());
    }

    @Test
    void uploadReturnsPublicUrl() throws Exception {
        when(jwtService.extractUserId(any(Jwt.class))).thenReturn(7L);
        when(profileService.uploadAvatar(eq(7L), any()))
                .thenReturn(new AvatarUploadResponse("/public/uploads/avatar/7-abc.png"));

        mockMvc.perform(multipart("/api/v1/profile/avatar")
                        .file(new MockMultipartFile("file", "a.png", "image/png", new byte[]{1}))
                        .with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("/public/uploads/avatar/7-abc.png"));
    }

    @Test
    void avatarFilesArePublic() throws Exception {
        mockMvc.perform(get("/public/uploads/avatar/7-missing.png"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_PARAM.getCode()));
    }
}
