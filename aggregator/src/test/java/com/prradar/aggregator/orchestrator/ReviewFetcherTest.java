package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.model.Review;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewFetcherTest {

    private static final String PR_URL = "https://ghe/api/v3/repos/acme/billing/pulls/42";

    @Mock
    private GitHubApiClient client;

    private static Review review(String state, String login) {
        return new Review(state, login != null ? new Review.User(login) : null);
    }

    @Test
    @DisplayName("Keeps only approving reviewers, counting a repeated approval once")
    void fetchApprovers_filtersAndCollapses() throws Exception {
        when(client.getReviews(PR_URL)).thenReturn(List.of(
                review("APPROVED", "bob"),
                review("CHANGES_REQUESTED", "carol"),
                review("COMMENTED", "dan"),
                review("APPROVED", "bob"),
                review("APPROVED", "erin")));

        Set<String> approvers = new ReviewFetcher(client).fetchApprovers(PR_URL);

        assertEquals(Set.of("bob", "erin"), approvers);
    }

    @Test
    @DisplayName("No reviews yields no approvers")
    void fetchApprovers_noReviews() throws Exception {
        when(client.getReviews(PR_URL)).thenReturn(List.of());

        assertTrue(new ReviewFetcher(client).fetchApprovers(PR_URL).isEmpty());
    }

    @Test
    @DisplayName("Approving review without a user is a malformed payload")
    void fetchApprovers_approvalWithoutUser_throws() throws Exception {
        when(client.getReviews(PR_URL)).thenReturn(List.of(review("APPROVED", null)));

        assertThrows(MalformedPayloadException.class, () -> new ReviewFetcher(client).fetchApprovers(PR_URL));
    }

    @Test
    @DisplayName("Transport failure propagates")
    void fetchApprovers_transportFailure_propagates() throws Exception {
        when(client.getReviews(PR_URL)).thenThrow(new IOException("connection reset"));

        assertThrows(IOException.class, () -> new ReviewFetcher(client).fetchApprovers(PR_URL));
    }
}
