package com.yanduoduo.auth.model;

/**
 * 发起请求的客户端，写入登录日志。
 *
 * @param ip        优先取 `X-Forwarded-For` 的第一段。
 * @param userAgent 原样保存，可能为空。
 */
public record ClientInfo(String ip, String userAgent) {
}
