package tech.yump.amethyst.api.v1;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.amethyst.auth.ClientAddresses;
import tech.yump.amethyst.bucket.BucketCreation;
import tech.yump.amethyst.bucket.BucketDetails;
import tech.yump.amethyst.bucket.BucketException;
import tech.yump.amethyst.bucket.BucketManager;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static tech.yump.amethyst.support.ControllerTestSupport.OPEN_BUCKET;
import static tech.yump.amethyst.support.ControllerTestSupport.RESTRICTED_BUCKET;
import static tech.yump.amethyst.support.ControllerTestSupport.accessGuard;
import static tech.yump.amethyst.support.ControllerTestSupport.mockMvc;

@ExtendWith(MockitoExtension.class)
class BucketControllerTest {

    @Mock
    private BucketManager bucketManager;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = mockMvc(new BucketController(bucketManager, accessGuard()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("POST creates a bucket and returns its client id")
    void createBucket() throws Exception {
        UUID clientId = UUID.randomUUID();
        when(bucketManager.createBucket(OPEN_BUCKET)).thenReturn(new BucketCreation(OPEN_BUCKET, clientId, true));

        mockMvc.perform(post("/v1/buckets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"prod\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.clientId").value(clientId.toString()))
                .andExpect(jsonPath("$.mirrored").value(true));
    }

    @Test
    @DisplayName("Creating an existing bucket answers 409")
    void createBucket_Conflict() throws Exception {
        when(bucketManager.createBucket(OPEN_BUCKET)).thenThrow(BucketException.alreadyExists(OPEN_BUCKET));

        mockMvc.perform(post("/v1/buckets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"prod\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Creation from a disallowed address answers 403 without touching the store")
    void createBucket_AddressNotAllowed() throws Exception {
        mockMvc.perform(post("/v1/buckets")
                        .header(ClientAddresses.REAL_IP_HEADER, "192.168.1.5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"billing\",\"bucketName\":\"restricted\"}"))
                .andExpect(status().isForbidden());
        verifyNoInteractions(bucketManager);
    }

    @Test
    @DisplayName("Names that could escape the mirror directory answer 400")
    void createBucket_InvalidName() throws Exception {
        mockMvc.perform(post("/v1/buckets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appName\":\"..\",\"bucketName\":\"prod\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(bucketManager);
    }

    @Test
    @DisplayName("Details of an allowed bucket include client id and owner e-mail")
    void bucketDetails() throws Exception {
        UUID clientId = UUID.randomUUID();
        when(bucketManager.bucketDetails(RESTRICTED_BUCKET))
                .thenReturn(new BucketDetails(RESTRICTED_BUCKET, clientId, "billing-owner@example.com"));

        mockMvc.perform(post("/v1/buckets/billing/restricted/details")
                        .header(ClientAddresses.REAL_IP_HEADER, "10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clientId").value(clientId.toString()))
                .andExpect(jsonPath("$.ownerEmail").value("billing-owner@example.com"));
    }

    @Test
    @DisplayName("Details of an unknown bucket answer 404")
    void bucketDetails_NotFound() throws Exception {
        when(bucketManager.bucketDetails(any())).thenThrow(BucketException.notFound(OPEN_BUCKET));

        mockMvc.perform(post("/v1/buckets/billing/prod/details"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET lists the buckets of the local mirror")
    void listBuckets() throws Exception {
        when(bucketManager.listBuckets()).thenReturn(List.of(OPEN_BUCKET, RESTRICTED_BUCKET));

        mockMvc.perform(get("/v1/buckets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].bucketName").value("prod"))
                .andExpect(jsonPath("$[1].bucketName").value("restricted"));
    }
}
