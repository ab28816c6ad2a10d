package com.ai.salescaller.service.record;

import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Record store over a Google Sheets "Customers" tab, via the Sheets v4 REST API.
 *
 * <p>Columns: A id, B name, C phone, D email, E car model, F status, G last call date,
 * H call result, I appointment, J notes. Updates overwrite fixed cells of the customer's row,
 * so repeating an update is harmless.
 */
@Service
@ConditionalOnProperty(prefix = "record-store", name = "type", havingValue = "sheets")
public class GoogleSheetsRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(GoogleSheetsRecordStore.class);

    static final String PROVIDER = "google-sheets";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String spreadsheetId;
    private final String accessToken;
    private final String tab;
    private final String baseUrl;

    public GoogleSheetsRecordStore(RestTemplateBuilder builder,
                                   ObjectMapper mapper,
                                   @Value("${sheets.spreadsheet-id:}") String spreadsheetId,
                                   @Value("${sheets.access-token:}") String accessToken,
                                   @Value("${sheets.tab:Customers}") String tab,
                                   @Value("${sheets.base-url:https://sheets.googleapis.com}") String baseUrl,
                                   @Value("${sheets.timeout:10s}") Duration timeout) {
        this.restTemplate = builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
        this.mapper = mapper;
        this.spreadsheetId = spreadsheetId;
        this.accessToken = accessToken;
        this.tab = tab;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        if (StringUtils.isAnyBlank(spreadsheetId, accessToken)) {
            log.warn("sheets.spreadsheet-id or sheets.access-token is not set; record store calls will fail");
        }
    }

    private static final class Row {
        final int index;
        final CustomerRecord record;

        Row(int index, CustomerRecord record) {
            this.index = index;
            this.record = record;
        }
    }

    @Override
    public Optional<CustomerRecord> findByPhone(String phone) {
        String normalized = PhoneNumbers.normalize(phone);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return readRows().stream()
                .filter(r -> normalized.equals(PhoneNumbers.normalize(r.record.getPhone())))
                .map(r -> r.record)
                .findFirst();
    }

    @Override
    public Optional<CustomerRecord> getCustomer(CustomerRef ref) {
        return findRow(ref.getRecordKey()).map(r -> r.record);
    }

    @Override
    public List<CustomerRecord> findReadyToCall(LocalDate today) {
        List<Row> rows = readRows();
        List<CustomerRecord> ready = rows.stream()
                .map(r -> r.record)
                .filter(c -> c.isReadyToCall(today))
                .collect(Collectors.toList());
        log.info("Customers filtered for calling: {} of {}", ready.size(), rows.size());
        return ready;
    }

    @Override
    public void updateOutcome(CustomerRef ref, String callId, OutcomeUpdate update) {
        Optional<Row> row = findRow(ref.getRecordKey());
        if (row.isEmpty()) {
            log.warn("[{}] Customer {} not found in sheet; outcome not written", callId, ref.getRecordKey());
            return;
        }
        int r = row.get().index;

        List<Map<String, Object>> data = new ArrayList<>();
        data.add(cell("F", r, update.customerStatus()));
        data.add(cell("G", r, update.getCalledAt().atOffset(ZoneOffset.UTC).toLocalDate().toString()));
        data.add(cell("H", r, update.getOutcome()));
        if (StringUtils.isNotBlank(update.getAppointmentTime())) {
            data.add(cell("I", r, update.getAppointmentTime()));
        }
        if (StringUtils.isNotBlank(update.getEmail())) {
            data.add(cell("D", r, update.getEmail()));
        }
        data.add(cell("J", r, "[" + callId + "] " + StringUtils.defaultString(update.getNotes())));

        Map<String, Object> body = new HashMap<>();
        body.put("valueInputOption", "RAW");
        body.put("data", data);

        String url = baseUrl + "/v4/spreadsheets/" + spreadsheetId + "/values:batchUpdate";
        try {
            restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers()), String.class);
            log.info("[{}] Sheet row {} updated for {}: {}", callId, r, ref.getRecordKey(), update.getOutcome());
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    private Optional<Row> findRow(String recordKey) {
        return readRows().stream()
                .filter(r -> recordKey.equals(r.record.getRecordKey()))
                .findFirst();
    }

    private List<Row> readRows() {
        String url = baseUrl + "/v4/spreadsheets/" + spreadsheetId + "/values/" + tab + "!A:J";
        JsonNode values;
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            values = mapper.readTree(response.getBody()).path("values");
        } catch (IOException e) {
            throw new PermanentProviderException(PROVIDER, "Unparseable sheet response: " + e.getMessage(), 0, e);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
        List<Row> rows = new ArrayList<>();
        // row 1 is the header
        for (int i = 1; i < values.size(); i++) {
            JsonNode row = values.get(i);
            String id = row.path(0).asText("");
            if (id.isEmpty()) {
                continue;
            }
            rows.add(new Row(i + 1, CustomerRecord.builder()
                    .recordKey(id)
                    .name(row.path(1).asText(""))
                    .phone(row.path(2).asText(""))
                    .email(row.path(3).asText(""))
                    .carModel(row.path(4).asText(""))
                    .status(row.path(5).asText(""))
                    .lastCallDate(parseDate(row.path(6).asText("")))
                    .build()));
        }
        return rows;
    }

    private static LocalDate parseDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable last call date '{}'", value);
            return null;
        }
    }

    private Map<String, Object> cell(String column, int row, String value) {
        Map<String, Object> range = new HashMap<>();
        range.put("range", tab + "!" + column + row);
        range.put("values", List.of(List.of(value)));
        return range;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(StringUtils.trimToEmpty(accessToken));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
