package net.recipecatalog.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.recipecatalog.application.catalog.ItemError;
import net.recipecatalog.application.upload.UploadState;
import net.recipecatalog.application.upload.UploadStatus;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import net.recipecatalog.support.s3.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class UploadStatusRepositoryTest {

    @Mock
    private S3ObjectStorageGateway gateway;

    private ObjectMapper objectMapper;
    private UploadStatusRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        repository = new UploadStatusRepository(gateway, objectMapper, "upload-status/");
    }

    @Test
    void should_WriteLowercaseStatusUnderJobKey_When_Saving() {
        UploadStatus status = new UploadStatus("job-1", UploadState.COMPLETED, 2, 1, List.of("7"),
            List.of(new ItemError(1, "Soup", "Recipe title already exists")), null,
            Instant.parse("2024-05-01T12:00:00Z"));

        repository.save(status);

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(gateway).putObject(eq("upload-status/job-1.json"), body.capture(), eq("application/json"));
        JsonNode json = objectMapper.readTree(new String(body.getValue(), StandardCharsets.UTF_8));
        assertThat(json.get("status").asString()).isEqualTo("completed");
        assertThat(json.get("committedKeys").get(0).asString()).isEqualTo("7");
        assertThat(json.get("errors").get(0).get("reason").asString()).isEqualTo("Recipe title already exists");
    }

    @Test
    void should_ReadBackStatus_When_JobExists() {
        String json = """
            {"jobId":"job-2","status":"processing","total":3,"completed":0,"committedKeys":[],
             "errors":[],"message":null,"updatedAt":"2024-05-01T12:00:00Z"}
            """;
        when(gateway.fetchUtf8Object("upload-status/job-2.json")).thenReturn(Optional.of(new StoredObject(json, "\"e\"")));

        Optional<UploadStatus> status = repository.find("job-2");

        assertThat(status).hasValueSatisfying(found -> {
            assertThat(found.status()).isEqualTo(UploadState.PROCESSING);
            assertThat(found.total()).isEqualTo(3);
            assertThat(found.updatedAt()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        });
    }

    @Test
    void should_ReturnEmpty_When_JobUnknown() {
        when(gateway.fetchUtf8Object(any())).thenReturn(Optional.empty());

        assertThat(repository.find("nope")).isEmpty();
    }

    @Test
    void should_RejectJobId_When_ItCouldEscapeThePrefix() {
        assertThatThrownBy(() -> repository.find("../jsondata/combined_data"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(UploadStatusRepository.isValidJobId("a1_B-2")).isTrue();
    }
}
