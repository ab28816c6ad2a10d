package com.ai.salescaller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OutboundCallResponse {

    private final String callSid;
    private final String phoneNumber;
    private final String status;
}
