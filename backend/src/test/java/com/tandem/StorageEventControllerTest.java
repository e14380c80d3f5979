package com.tandem;

import com.tandem.dto.ContentUpdatedRequest;
import com.tandem.protocol.Domain;
import com.tandem.service.ChangeFeedService;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@MicronautTest
class StorageEventControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    ChangeFeedService changeFeedService;

    @MockBean(ChangeFeedService.class)
    ChangeFeedService mockChangeFeed() {
        return mock(ChangeFeedService.class);
    }

    @Test
    void treeChanged_returns202AndBroadcasts() {
        HttpResponse<?> resp = client.toBlocking().exchange(
            HttpRequest.POST("/api/v1/vault/events/tree-changed", Map.of()));

        assertThat((Object) resp.getStatus()).isEqualTo(HttpStatus.ACCEPTED);
        verify(changeFeedService).treeChanged(Domain.VAULT);
    }

    @Test
    void contentUpdated_returns202AndBroadcasts() {
        HttpResponse<?> resp = client.toBlocking().exchange(
            HttpRequest.POST("/api/v1/document/events/content-updated",
                new ContentUpdatedRequest("doc-1", "r7", "Notes.md", "alice")));

        assertThat((Object) resp.getStatus()).isEqualTo(HttpStatus.ACCEPTED);
        verify(changeFeedService).contentUpdated(Domain.DOCUMENT, "doc-1", "r7", "Notes.md", "alice");
    }

    @Test
    void contentUpdated_blankResourceId_returns400() {
        assertThatThrownBy(() -> client.toBlocking().exchange(
                HttpRequest.POST("/api/v1/document/events/content-updated",
                    new ContentUpdatedRequest("", null, null, null))))
            .isInstanceOf(HttpClientResponseException.class)
            .satisfies(e -> assertThat((Object) ((HttpClientResponseException) e).getStatus())
                .isEqualTo(HttpStatus.BAD_REQUEST));
    }
}
