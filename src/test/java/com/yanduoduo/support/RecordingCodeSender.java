package com.yanduoduo.support;

import com.yanduoduo.auth.verification.CodeSender;

import java.util.HashMap;
import java.util.Map;

public class RecordingCodeSender implements CodeSender {

    private final Map<String, String> lastCodes = new HashMap<>();

    @Override
    public void sendCode(String phone, String code, int expireMinutes) {
        lastCodes.put(phone, code);
    }

    public String lastCode(String phone) {
        return lastCodes.get(phone);
    }
}
