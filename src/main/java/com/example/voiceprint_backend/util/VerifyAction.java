package com.example.voiceprint_backend.util;

public enum VerifyAction {
    ACCEPT,
    REJECT,
    CREATE_PROFILE
}
