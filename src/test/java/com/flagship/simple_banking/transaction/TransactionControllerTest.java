package com.flagship.simple_banking.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Transaction API tests: sign normalization, validation, listing and
 * idempotent creation.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long accountId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() throws Exception {
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM accounts");

        String document = String.valueOf(ThreadLocalRandom.current().nextLong(10_000_000_000L, 99_999_999_999L));
        MvcResult created = mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"document_number\":\"" + document + "\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        accountId = objectMapper.readTree(created.getResponse().getContentAsString()).get("account_id").asLong();
    }

    @Test
    @DisplayName("Purchase of 50.0 is stored as -50.0")
    void purchaseIsNegative() throws Exception {
        printTestHeader("Purchase normalization");
        String payload = transactionJson(accountId, 1, "50.0");
        printInput("Request", payload);

        MvcResult result = mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(header().string("X-Idempotency-Status", "new"))
            .andExpect(jsonPath("$.account_id").value(accountId))
            .andExpect(jsonPath("$.operation_type_id").value(1))
            .andExpect(jsonPath("$.amount").value(-50.0))
            .andExpect(jsonPath("$.event_date").exists())
            .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
        assertTrue(objectMapper.readTree(result.getResponse().getContentAsString())
            .get("transaction_id").asLong() > 0);
    }

    @Test
    @DisplayName("Credit voucher of -100.0 is stored as 100.0")
    void creditVoucherIsPositive() throws Exception {
        long transactionId = createTransaction(UUID.randomUUID().toString(), transactionJson(accountId, 4, "-100.0"));

        mockMvc.perform(get("/transactions/{id}", transactionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount").value(100.0))
            .andExpect(jsonPath("$.operation_type_id").value(4));

        Double stored = jdbcTemplate.queryForObject(
            "SELECT amount FROM transactions WHERE id = ?", Double.class, transactionId);
        assertEquals(100.0, stored);
    }

    @Test
    @DisplayName("Unknown account returns 404")
    void unknownAccount() throws Exception {
        mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionJson(9999, 1, "50.0")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"))
            .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    @DisplayName("Validation errors map to 400 with their codes")
    void validationErrors() throws Exception {
        expectBadRequest(transactionJson(0, 1, "10"), "INVALID_ACCOUNT_ID");
        expectBadRequest(transactionJson(accountId, 7, "10"), "INVALID_OPERATION_TYPE");
        expectBadRequest(transactionJson(accountId, 1, "0"), "ZERO_AMOUNT");
        expectBadRequest("{\"account_id\":" + accountId + ",\"operation_type_id\":1}", "ZERO_AMOUNT");
        expectBadRequest("{\"account_id\": ", "INVALID_REQUEST_BODY");

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }

    @Test
    @DisplayName("Amounts beyond four decimals or fifteen integer digits return 400, nothing is stored")
    void unstorableAmounts() throws Exception {
        expectBadRequest(transactionJson(accountId, 1, "0.00001"), "INVALID_AMOUNT");
        expectBadRequest(transactionJson(accountId, 1, "12.34567"), "INVALID_AMOUNT");
        expectBadRequest(transactionJson(accountId, 4, "1e20"), "INVALID_AMOUNT");

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }

    @Test
    @DisplayName("Created response matches the stored record")
    void createdResponseMatchesStoredRecord() throws Exception {
        String key = UUID.randomUUID().toString();
        String payload = transactionJson(accountId, 1, "12.3456");

        MvcResult created = mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode posted = objectMapper.readTree(created.getResponse().getContentAsString());
        long transactionId = posted.get("transaction_id").asLong();

        MvcResult fetched = mockMvc.perform(get("/transactions/{id}", transactionId))
            .andExpect(status().isOk())
            .andReturn();
        JsonNode stored = objectMapper.readTree(fetched.getResponse().getContentAsString());

        MvcResult listed = mockMvc.perform(get("/accounts/{id}/transactions", accountId))
            .andExpect(status().isOk())
            .andReturn();
        JsonNode listedFirst = objectMapper.readTree(listed.getResponse().getContentAsString())
            .get("transactions").get(0);

        printOutput("POST", posted);
        printOutput("GET", stored);
        assertEquals(posted.get("event_date").asText(), stored.get("event_date").asText());
        assertEquals(posted.get("event_date").asText(), listedFirst.get("event_date").asText());
        assertEquals(0, posted.get("amount").decimalValue().compareTo(stored.get("amount").decimalValue()));
        assertEquals(0, new BigDecimal("-12.3456").compareTo(stored.get("amount").decimalValue()));
    }

    @Test
    @DisplayName("Missing idempotency key returns 400")
    void missingIdempotencyKey() throws Exception {
        mockMvc.perform(post("/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionJson(accountId, 1, "50.0")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("MISSING_HEADER"));

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }

    @Test
    @DisplayName("Retry with the same key replays the first response and writes one row")
    void retryIsReplayed() throws Exception {
        String key = UUID.randomUUID().toString();
        String payload = transactionJson(accountId, 2, "75.25");

        MvcResult first = mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andReturn();

        MvcResult second = mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(header().string("X-Idempotency-Status", "replayed"))
            .andReturn();

        assertEquals(first.getResponse().getContentAsString(), second.getResponse().getContentAsString());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }

    @Test
    @DisplayName("Failed request is not cached: the same key can succeed later")
    void failureIsRetryable() throws Exception {
        String key = UUID.randomUUID().toString();

        mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionJson(accountId, 1, "0")))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionJson(accountId, 1, "20")))
            .andExpect(status().isCreated())
            .andExpect(header().string("X-Idempotency-Status", "new"))
            .andExpect(jsonPath("$.amount").value(-20));
    }

    @Test
    @DisplayName("Concurrent requests with the same key create exactly one transaction")
    void concurrentSameKey() throws Exception {
        printTestHeader("Concurrent idempotent creation");
        String key = UUID.randomUUID().toString();
        String payload = transactionJson(accountId, 3, "30.0");
        int threads = 5;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            Callable<MvcResult> call = () -> {
                start.await();
                return mockMvc.perform(post("/transactions")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                    .andReturn();
            };
            Future<?>[] futures = new Future<?>[threads];
            for (int i = 0; i < threads; i++) {
                futures[i] = executor.submit(call);
            }
            start.countDown();

            String expectedBody = null;
            for (Future<?> future : futures) {
                MvcResult result = (MvcResult) future.get(10, TimeUnit.SECONDS);
                assertEquals(201, result.getResponse().getStatus());
                String body = result.getResponse().getContentAsString();
                if (expectedBody == null) {
                    expectedBody = body;
                }
                assertEquals(expectedBody, body);
            }
            printOutput("Body", expectedBody);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }

    @Test
    @DisplayName("Listing two transactions with limit 10 returns one page, newest first")
    void listTransactions() throws Exception {
        long first = createTransaction(UUID.randomUUID().toString(), transactionJson(accountId, 1, "10"));
        long second = createTransaction(UUID.randomUUID().toString(), transactionJson(accountId, 4, "5"));

        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.transactions.length()").value(2))
            .andExpect(jsonPath("$.transactions[0].transaction_id").value(second))
            .andExpect(jsonPath("$.transactions[1].transaction_id").value(first))
            .andExpect(jsonPath("$.pagination.total").value(2))
            .andExpect(jsonPath("$.pagination.limit").value(10))
            .andExpect(jsonPath("$.pagination.offset").value(0))
            .andExpect(jsonPath("$.pagination.pages").value(1));

        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("limit", "1").param("offset", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.transactions.length()").value(1))
            .andExpect(jsonPath("$.transactions[0].transaction_id").value(first))
            .andExpect(jsonPath("$.pagination.pages").value(2));
    }

    @Test
    @DisplayName("Listing rejects bad pagination and unknown accounts")
    void listErrors() throws Exception {
        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_PAGINATION"));

        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("limit", "101"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_PAGINATION"));

        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("offset", "-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_PAGINATION"));

        mockMvc.perform(get("/accounts/{id}/transactions", accountId).param("limit", "ten"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_PAGINATION"));

        mockMvc.perform(get("/accounts/{id}/transactions", 9999))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    @DisplayName("Unknown transaction id returns 404")
    void unknownTransaction() throws Exception {
        mockMvc.perform(get("/transactions/{id}", 123456))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("TRANSACTION_NOT_FOUND"));
    }

    private long createTransaction(String key, String payload) throws Exception {
        MvcResult result = mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("transaction_id").asLong();
    }

    private void expectBadRequest(String payload, String code) throws Exception {
        mockMvc.perform(post("/transactions")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.code").value(code));
    }

    private static String transactionJson(long accountId, int operationTypeId, String amount) {
        return "{\"account_id\":" + accountId
            + ",\"operation_type_id\":" + operationTypeId
            + ",\"amount\":" + amount + "}";
    }
}
