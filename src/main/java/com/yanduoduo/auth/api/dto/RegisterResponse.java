package com.yanduoduo.auth.api.dto;

public record RegisterResponse(Long id, String nickname) {
}
