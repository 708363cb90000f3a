package com.couplesync.backend.message.entity;

public enum MessageType {
    USER_MESSAGE,
    SYSTEM,
    ASSISTANT_RESPONSE
}
