package com.ai.salescaller.service.record;

import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.exception.PermanentProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleSheetsRecordStoreTest {

    private static final String READ_URL = "https://sheets.test/v4/spreadsheets/sheet-1/values/Customers!A:J";
    private static final String WRITE_URL = "https://sheets.test/v4/spreadsheets/sheet-1/values:batchUpdate";
    private static final String SHEET = "{\"values\":["
            + "[\"id\",\"name\",\"phone\",\"email\",\"car_model\",\"status\"],"
            + "[\"CUST001\",\"Alex Morgan\",\"(555) 123-0001\",\"\",\"2023 Honda Accord\",\"new\"],"
            + "[\"CUST002\",\"Sam Lee\",\"+15551230002\",\"sam@example.com\",\"2022 Toyota Camry\",\"new\"]]}";

    private MockRestServiceServer server;
    private GoogleSheetsRecordStore store;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        store = new GoogleSheetsRecordStore(new RestTemplateBuilder(customizer), new ObjectMapper(),
                "sheet-1", "token-1", "Customers", "https://sheets.test/", Duration.ofSeconds(5));
        server = customizer.getServer();
    }

    @Test
    void shouldFindCustomerByPhoneInAnyFormat() {
        server.expect(requestTo(READ_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer token-1"))
                .andRespond(withSuccess(SHEET, MediaType.APPLICATION_JSON));

        assertThat(store.findByPhone("+1 555 123 0001"))
                .hasValueSatisfying(c -> {
                    assertThat(c.getRecordKey()).isEqualTo("CUST001");
                    assertThat(c.getName()).isEqualTo("Alex Morgan");
                });
    }

    @Test
    void shouldListOnlyCustomersDueACallToday() {
        String sheet = "{\"values\":["
                + "[\"id\",\"name\",\"phone\",\"email\",\"car_model\",\"status\",\"last_call_date\"],"
                + "[\"CUST001\",\"Alex Morgan\",\"(555) 123-0001\",\"\",\"2023 Honda Accord\",\"new\",\"\"],"
                + "[\"CUST002\",\"Sam Lee\",\"+15551230002\",\"\",\"2022 Toyota Camry\",\"retry\",\"2024-03-13\"],"
                + "[\"CUST003\",\"Kim Park\",\"+15551230003\",\"\",\"2021 Mazda 3\",\"Not_Interested\",\"2024-03-01\"],"
                + "[\"CUST004\",\"Lee Chan\",\"\",\"\",\"2020 Kia Rio\",\"new\"],"
                + "[\"CUST005\",\"Ana Ruiz\",\"+15551230005\",\"\",\"2024 Ford Focus\",\"callback\",\"last week\"]]}";
        server.expect(requestTo(READ_URL)).andRespond(withSuccess(sheet, MediaType.APPLICATION_JSON));

        assertThat(store.findReadyToCall(LocalDate.parse("2024-03-13")))
                .extracting(CustomerRecord::getRecordKey)
                .containsExactly("CUST001", "CUST005");
    }

    @Test
    void shouldOverwriteFixedCellsOfCustomerRow() {
        server.expect(requestTo(READ_URL)).andRespond(withSuccess(SHEET, MediaType.APPLICATION_JSON));
        server.expect(requestTo(WRITE_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.valueInputOption").value("RAW"))
                .andExpect(jsonPath("$.data[0].range").value("Customers!F3"))
                .andExpect(jsonPath("$.data[0].values[0][0]").value("interested_similar"))
                .andExpect(jsonPath("$.data[1].values[0][0]").value("2024-03-13"))
                .andExpect(jsonPath("$.data[2].values[0][0]").value("interested_similar"))
                .andExpect(jsonPath("$.data[3].range").value("Customers!D3"))
                .andExpect(jsonPath("$.data[4].values[0][0]").value("[CA7] Outcome: interested_similar"))
                .andRespond(withSuccess());

        store.updateOutcome(new CustomerRef("+15551230002", "CUST002"), "CA7", OutcomeUpdate.builder()
                .outcome("interested_similar")
                .nextAction("send_similar_cars_email")
                .extractedData(Map.of("email", "sam.lee@example.com"))
                .email("sam.lee@example.com")
                .notes("Outcome: interested_similar")
                .calledAt(Instant.parse("2024-03-13T09:05:00Z"))
                .build());

        server.verify();
    }

    @Test
    void shouldSkipWriteForCustomerMissingFromSheet() {
        server.expect(requestTo(READ_URL)).andRespond(withSuccess(SHEET, MediaType.APPLICATION_JSON));

        store.updateOutcome(new CustomerRef("+15550000000", "phone:+15550000000"), "CA8", OutcomeUpdate.builder()
                .outcome("no_response")
                .calledAt(Instant.parse("2024-03-13T09:05:00Z"))
                .build());

        server.verify();
    }

    @Test
    void shouldTreatRejectedTokenAsPermanent() {
        server.expect(requestTo(READ_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> store.getCustomer(new CustomerRef("+15551230001", "CUST001")))
                .isInstanceOf(PermanentProviderException.class);
    }
}
