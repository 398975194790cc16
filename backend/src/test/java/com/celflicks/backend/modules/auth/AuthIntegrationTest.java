package com.celflicks.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.celflicks.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.celflicks.backend.modules.profile.infrastructure.persistence.ProfileRepository;
import com.celflicks.backend.modules.wallet.infrastructure.persistence.UserBalanceRepository;
import com.celflicks.backend.support.AbstractPostgresIntegrationTest;
import com.celflicks.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private UserBalanceRepository userBalanceRepository;

    @Test
    void signupCreatesAccountProfileAndToken() throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("alice@example.com", "alice_01", null)))
                .andExpect(status().isCreated())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.profile.username").value("alice_01"))
                .andExpect(jsonPath("$.profile.avatarUrl").value("https://ui-avatars.com/api/?name=alice_01&background=random"))
                .andExpect(jsonPath("$.token.tokenType").value("Bearer"))
                .andReturn();

        JsonNode response = objectMapper.readTree(result.getResponse().getContentAsString());
        UUID userId = UUID.fromString(response.path("profile").path("userId").asText());
        assertThat(appUserRepository.findById(userId)).isPresent();
        assertThat(userBalanceRepository.findById(userId)).isPresent();

        mockMvc.perform(get("/profiles/me")
                        .header("Authorization", "Bearer " + response.path("token").path("accessToken").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(userId.toString()));
    }

    @Test
    void signupWithTakenUsernameLeavesNoAccount() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("first@example.com", "alice_01", null)))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("second@example.com", "Alice_01", null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USERNAME_ALREADY_EXISTS"))
                .andExpect(jsonPath("$.detail").value("username already exists"));

        assertThat(appUserRepository.findByEmailIgnoreCase("second@example.com")).isEmpty();
        assertThat(profileRepository.count()).isEqualTo(1);
    }

    @Test
    void signupRejectsMalformedUsername() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("bad@example.com", "a b", null)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_USERNAME_FORMAT"))
                .andExpect(jsonPath("$.detail").value("invalid username format"));

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("blank@example.com", "   ", null)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("USERNAME_REQUIRED"));

        assertThat(appUserRepository.count()).isZero();
    }

    @Test
    void duplicateEmailIsRejected() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("dup@example.com", "dup_one", null)))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("DUP@example.com", "dup_two", null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));
    }

    @Test
    void loginIssuesTokenForValidCredentials() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("login@example.com", "login_user", "https://cdn.example.com/a.png")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.profile.avatarUrl").value("https://cdn.example.com/a.png"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"Login@Example.com\",\"password\":\"" + TestUserFactory.DEFAULT_PASSWORD + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token.accessToken").isNotEmpty());

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"login@example.com\",\"password\":\"wrong-password\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void protectedEndpointRequiresToken() throws Exception {
        mockMvc.perform(get("/wallet/me"))
                .andExpect(status().isUnauthorized());
    }

    private String signupBody(String email, String username, String avatarUrl) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("password", TestUserFactory.DEFAULT_PASSWORD);
        body.put("username", username);
        body.put("avatarUrl", avatarUrl);
        return objectMapper.writeValueAsString(body);
    }
}
