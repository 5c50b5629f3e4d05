package com.gymadmin.backend.modules.staff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.gymadmin.backend.modules.staff.application.PinHasher;
import com.gymadmin.backend.support.AbstractPostgresIntegrationTest;
import com.gymadmin.backend.support.web.MemberFixtureController;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import javax.crypto.spec.SecretKeySpec;

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
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class StaffAccessIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final UUID BRANCH_ONE = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID BRANCH_TWO = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID ASSOCIATE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID MANAGER_ID = UUID.fromString("00000000-0000-0000-0000-00000000a002");
    private static final UUID UNMIGRATED_ID = UUID.fromString("00000000-0000-0000-0000-00000000a003");
    private static final UUID PLATFORM_USER_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");
    private static final String SESSION_HEADER = "X-Session-Token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PinHasher pinHasher;

    @BeforeEach
    void seed() {
        jdbcTemplate.update("INSERT INTO branch (id, name) VALUES (?, 'Downtown'), (?, 'Harbour')",
                BRANCH_ONE, BRANCH_TWO);
        insertStaff(ASSOCIATE_ID, BRANCH_ONE, "Sam", "associate", pinHasher.hash("4821"));
        insertStaff(MANAGER_ID, BRANCH_ONE, "Maria", "manager", pinHasher.hash("7395"));
        insertStaff(UNMIGRATED_ID, BRANCH_ONE, "Olly", "associate", null);
        jdbcTemplate.update("INSERT INTO gym_user (id, auth_user_id, email, role) VALUES (?, ?, ?, 'manager')",
                UUID.randomUUID(), PLATFORM_USER_ID, "owner@gym.test");
    }

    @Test
    void branchSessionCarriesItsBranchIntoPermissions() throws Exception {
        String token = login(ASSOCIATE_ID, "4821");

        mockMvc.perform(get("/auth/permissions").header(SESSION_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("associate"))
                .andExpect(jsonPath("$.sessionKind").value("branch_session"))
                .andExpect(jsonPath("$.branchId").value(BRANCH_ONE.toString()))
                .andExpect(jsonPath("$.synthetic").value(false));

        assertThat(jdbcTemplate.queryForObject(
                "SELECT token_hash FROM staff_session WHERE staff_id = ?", String.class, ASSOCIATE_ID))
                .isNotEqualTo(token)
                .hasSize(64);
    }

    @Test
    @DisplayName("associate of branch one is refused on branch two before any PIN is checked")
    void crossBranchRequestIsRefused() throws Exception {
        String token = login(ASSOCIATE_ID, "4821");
        long attemptsBefore = countEvents(ASSOCIATE_ID, "PIN_ATTEMPT");
        Map<String, Object> body = Map.of("firstName", "Lee", "lastName", "Park", "amountPaid", 50,
                "staffId", ASSOCIATE_ID, "staffPin", "4821");

        mockMvc.perform(post("/fixtures/branches/{branchId}/members", BRANCH_TWO)
                        .header(SESSION_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("BRANCH_ACCESS_DENIED"))
                .andExpect(jsonPath("$.details.assignedBranch").value(BRANCH_ONE.toString()))
                .andExpect(jsonPath("$.details.requestedBranch").value(BRANCH_TWO.toString()));

        assertThat(countEvents(ASSOCIATE_ID, "PIN_ATTEMPT")).isEqualTo(attemptsBefore);
    }

    @Test
    void managerWriteWithPinIsAuditedWithoutCredentials() throws Exception {
        String token = login(MANAGER_ID, "7395");
        Map<String, Object> body = Map.of("firstName", "Lee", "lastName", "Park", "amountPaid", 120,
                "paymentMethod", "card", "staffId", MANAGER_ID, "staffPin", "7395");

        mockMvc.perform(post("/fixtures/branches/{branchId}/members", BRANCH_ONE)
                        .header(SESSION_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated());

        Map<String, Object> row = awaitAuditRow("CREATE_MEMBER");
        assertThat(row.get("user_id")).isEqualTo(MANAGER_ID.toString());
        assertThat(row.get("branch_id")).isEqualTo(BRANCH_ONE.toString());
        assertThat(row.get("resource_id")).isEqualTo(MemberFixtureController.CREATED_MEMBER_ID);
        assertThat(String.valueOf(row.get("request_data")))
                .contains("\"staff_pin_provided\": \"YES\"")
                .doesNotContain("7395");
    }

    @Test
    void managerResetsPinAndOldPinStopsWorking() throws Exception {
        String token = login(MANAGER_ID, "7395");

        mockMvc.perform(put("/branches/{branchId}/staff/{staffId}/pin", BRANCH_ONE, ASSOCIATE_ID)
                        .header(SESSION_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pin\":\"2580\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pinConfigured").value(true));

        verifyPin(ASSOCIATE_ID, "4821")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isValid").value(false));
        verifyPin(ASSOCIATE_ID, "2580")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isValid").value(true));

        Map<String, Object> row = awaitAuditRow("UPDATE_STAFF_PIN");
        assertThat(row.get("resource_id")).isEqualTo(ASSOCIATE_ID.toString());
        assertThat(String.valueOf(row.get("request_data"))).doesNotContain("2580");
    }

    @Test
    void associateCannotResetPins() throws Exception {
        String token = login(ASSOCIATE_ID, "4821");

        mockMvc.perform(put("/branches/{branchId}/staff/{staffId}/pin", BRANCH_ONE, UNMIGRATED_ID)
                        .header(SESSION_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pin\":\"2580\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"))
                .andExpect(jsonPath("$.details.required").value("staff:manage_pins"));
    }

    @Test
    void sixthAttemptWithinWindowIsLockedOut() throws Exception {
        for (int remaining = 4; remaining >= 0; remaining--) {
            verifyPin(ASSOCIATE_ID, "9999")
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.attemptsRemaining").value(remaining));
        }

        verifyPin(ASSOCIATE_ID, "4821")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value("TOO_MANY_ATTEMPTS"))
                .andExpect(jsonPath("$.details.lockoutUntil").exists());

        assertThat(countEvents(ASSOCIATE_ID, "PIN_ATTEMPT")).isEqualTo(6);
        assertThat(countEvents(ASSOCIATE_ID, "PIN_LOCKOUT")).isEqualTo(1);
    }

    @Test
    void unmigratedStaffMustResetPin() throws Exception {
        mockMvc.perform(post("/staff/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(UNMIGRATED_ID, "4821")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MIGRATION_REQUIRED"));
    }

    @Test
    void malformedPinIsRejectedWithoutRecordingAttempt() throws Exception {
        verifyPin(ASSOCIATE_ID, "12a4")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PIN_FORMAT"));

        assertThat(countEvents(ASSOCIATE_ID, "PIN_ATTEMPT")).isZero();
    }

    @Test
    void blankPinOnLoginIsAFormatError() throws Exception {
        mockMvc.perform(post("/staff/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(ASSOCIATE_ID, "  ")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PIN_FORMAT"));

        assertThat(countEvents(ASSOCIATE_ID, "PIN_ATTEMPT")).isZero();
    }

    @Test
    void logoutEndsSession() throws Exception {
        String token = login(ASSOCIATE_ID, "4821");

        mockMvc.perform(post("/staff/logout").header(SESSION_HEADER, token))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/auth/permissions").header(SESSION_HEADER, token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void platformTokenResolvesProfileRole() throws Exception {
        mockMvc.perform(get("/auth/permissions").header("Authorization", "Bearer " + platformToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("manager"))
                .andExpect(jsonPath("$.sessionKind").value("platform_token"))
                .andExpect(jsonPath("$.permissions").isArray());
    }

    @Test
    void requestWithoutCredentialsIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/auth/permissions"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void branchDirectoryIsPublicAndHidesHashes() throws Exception {
        mockMvc.perform(get("/staff/branch/{branchId}", BRANCH_ONE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].pinHash").doesNotExist());
    }

    private String login(UUID staffId, String pin) throws Exception {
        MvcResult result = mockMvc.perform(post("/staff/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(pinBody(staffId, pin)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("sessionToken").asText();
    }

    private ResultActions verifyPin(UUID staffId, String pin) throws Exception {
        return mockMvc.perform(post("/staff/verify-pin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(pinBody(staffId, pin)));
    }

    private String pinBody(UUID staffId, String pin) throws Exception {
        return objectMapper.writeValueAsString(Map.of("staffId", staffId, "pin", pin));
    }

    private void insertStaff(UUID id, UUID branchId, String firstName, String role, String pinHash) {
        jdbcTemplate.update("""
                        INSERT INTO branch_staff (id, branch_id, first_name, last_name, email, role, pin_hash)
                        VALUES (?, ?, ?, 'Tester', ?, ?, ?)
                        """,
                id, branchId, firstName, firstName.toLowerCase() + "@gym.test", role, pinHash);
    }

    private long countEvents(UUID staffId, String type) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM staff_security_event WHERE staff_id = ? AND event_type = ?",
                Long.class, staffId, type);
        return count == null ? 0 : count;
    }

    private Map<String, Object> awaitAuditRow(String action) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                    "SELECT user_id, branch_id, resource_id, request_data::text AS request_data "
                            + "FROM audit_log WHERE action = ?", action);
            if (!rows.isEmpty()) {
                return rows.get(0);
            }
            Thread.sleep(50);
        }
        throw new AssertionError("No audit row for " + action);
    }

    private static String platformToken() {
        return Jwts.builder()
                .subject(PLATFORM_USER_ID.toString())
                .audience().add("authenticated").and()
                .claim("email", "owner@gym.test")
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(new SecretKeySpec(TEST_JWT_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"), Jwts.SIG.HS256)
                .compact();
    }
}
