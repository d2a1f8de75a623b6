package com.yanduoduo.profile.api.dto;

public record AvatarUploadResponse(String url) {}
