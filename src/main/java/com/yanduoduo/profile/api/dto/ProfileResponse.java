package com.yanduoduo.profile.api.dto;

public record ProfileResponse(
        Long id,
        String phone,
        String nickname,
        String avatar
) {}
