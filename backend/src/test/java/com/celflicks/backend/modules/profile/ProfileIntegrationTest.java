package com.celflicks.backend.modules.profile;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.celflicks.backend.modules.auth.presentation.dto.SignupResponse;
import com.celflicks.backend.support.AbstractPostgresIntegrationTest;
import com.celflicks.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ProfileIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    private SignupResponse alice;
    private SignupResponse bob;

    @BeforeEach
    void setUp() {
        alice = testUserFactory.signUp("alice_01");
        bob = testUserFactory.signUp("bob_02");
    }

    @Test
    void anyoneCanReadAProfile() throws Exception {
        mockMvc.perform(get("/profiles/{userId}", alice.profile().userId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice_01"));
    }

    @Test
    void unknownProfileIsNotFound() throws Exception {
        mockMvc.perform(get("/profiles/{userId}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROFILE_NOT_FOUND"));
    }

    @Test
    void ownProfileRequiresAuthentication() throws Exception {
        mockMvc.perform(get("/profiles/me"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void ownerCanRenameAndResetAvatar() throws Exception {
        mockMvc.perform(patch("/profiles/me")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"Alice_New\",\"avatarUrl\":\" \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("Alice_New"))
                .andExpect(jsonPath("$.avatarUrl").value("https://ui-avatars.com/api/?name=Alice_New&background=random"));

        mockMvc.perform(get("/profiles/{userId}", alice.profile().userId()))
                .andExpect(jsonPath("$.username").value("Alice_New"));
    }

    @Test
    void renameToAnotherUsersNameInDifferentCaseConflicts() throws Exception {
        mockMvc.perform(patch("/profiles/me")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"BOB_02\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USERNAME_ALREADY_EXISTS"));
    }

    @Test
    void renameValidatesFormat() throws Exception {
        mockMvc.perform(patch("/profiles/me")
                        .header("Authorization", bearer(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"x\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_USERNAME_FORMAT"));
    }

    private static String bearer(SignupResponse account) {
        return "Bearer " + account.token().accessToken();
    }
}
