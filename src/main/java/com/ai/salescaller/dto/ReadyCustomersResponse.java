package com.ai.salescaller.dto;

import com.ai.salescaller.service.record.CustomerRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ReadyCustomersResponse {

    private final List<CustomerRecord> customers;
    private final int count;
}
