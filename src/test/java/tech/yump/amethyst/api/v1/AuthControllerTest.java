package tech.yump.amethyst.api.v1;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.amethyst.auth.AuthException;
import tech.yump.amethyst.auth.BucketPrincipal;
import tech.yump.amethyst.auth.BucketTokenService;
import tech.yump.amethyst.auth.IssuedToken;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static tech.yump.amethyst.support.ControllerTestSupport.OPEN_BUCKET;
import static tech.yump.amethyst.support.ControllerTestSupport.mockMvc;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    private static final UUID CLIENT_ID = UUID.fromString("0b7e4a52-2f0e-4f0a-9a51-8f7d3c2e1a10");

    @Mock
    private BucketTokenService bucketTokenService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = mockMvc(new AuthController(bucketTokenService));
    }

    @Test
    @DisplayName("A matching client id is exchanged for a bearer token")
    void issueToken() throws Exception {
        Instant expiresAt = Instant.parse("2026-10-20T10:00:00Z");
        when(bucketTokenService.issue(OPEN_BUCKET, CLIENT_ID)).thenReturn(new IssuedToken("signed.token.value", expiresAt));

        mockMvc.perform(post("/v1/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"prod\",\"clientId\":\"" + CLIENT_ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("signed.token.value"))
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.expiresAt").value("2026-10-20T10:00:00Z"));
    }

    @Test
    @DisplayName("A wrong client id answers 401 with a bearer challenge")
    void issueToken_Mismatch() throws Exception {
        when(bucketTokenService.issue(OPEN_BUCKET, CLIENT_ID)).thenThrow(AuthException.clientMismatch());

        mockMvc.perform(post("/v1/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"prod\",\"clientId\":\"" + CLIENT_ID + "\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));
    }

    @Test
    @DisplayName("A missing client id answers 400")
    void issueToken_MissingClientId() throws Exception {
        mockMvc.perform(post("/v1/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"prod\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(bucketTokenService);
    }

    @Test
    @DisplayName("Verify reports the scope of a valid token and rejects an expired one")
    void verifyToken() throws Exception {
        Instant expiresAt = Instant.parse("2026-10-20T10:00:00Z");
        when(bucketTokenService.verify("good")).thenReturn(new BucketPrincipal(OPEN_BUCKET, CLIENT_ID, expiresAt));
        when(bucketTokenService.verify("old")).thenThrow(AuthException.expiredToken(null));

        mockMvc.perform(post("/v1/auth/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"good\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.bucketName").value("prod"));

        mockMvc.perform(post("/v1/auth/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"old\"}"))
                .andExpect(status().isUnauthorized());
    }
}
