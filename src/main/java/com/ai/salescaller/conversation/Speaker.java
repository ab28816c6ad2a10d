package com.ai.salescaller.conversation;

public enum Speaker {
    SYSTEM,
    CUSTOMER
}
