package com.ai.salescaller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EndCallResponse {

    private final String callSid;
    /** False when the telephony provider could not be reached; the session is ended either way. */
    private final boolean providerHangup;
    private final String outcome;
}
