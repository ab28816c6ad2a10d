package com.ai.salescaller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@AllArgsConstructor
public class ActiveCallsResponse {

    private final int activeCount;
    private final double averageTurns;
    private final Map<String, Long> byStep;
    private final List<CallSummary> calls;
}
