package org.javai.retryify.examples;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.retryify.MemberSelectors;
import org.javai.retryify.Retryify;
import org.javai.retryify.ops.log4j.Log4jRetryReporter;
import org.javai.retryify.retry.RetryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Demonstrates a client that transparently refreshes its access token when the API
 * answers 401 Unauthorized.
 */
public class CredentialRefreshTest {

	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		objectMapper = new ObjectMapper();
	}

	static class ApiException extends Exception {
		private final int status;

		ApiException(int status, String message) {
			super(message);
			this.status = status;
		}

		int status() {
			return status;
		}
	}

	interface TrackApi {
		CompletableFuture<JsonNode> getTrack(String id);

		CompletionStage<String> _refreshAccessToken();
	}

	/**
	 * Simulated remote API: rejects calls until the access token has been refreshed
	 * {@code refreshesNeeded} times.
	 */
	class SimulatedTrackApi implements TrackApi {
		final AtomicInteger requests = new AtomicInteger();
		final AtomicInteger refreshes = new AtomicInteger();
		private final int refreshesNeeded;

		SimulatedTrackApi(int refreshesNeeded) {
			this.refreshesNeeded = refreshesNeeded;
		}

		@Override
		public CompletableFuture<JsonNode> getTrack(String id) {
			requests.incrementAndGet();
			if (refreshes.get() < refreshesNeeded) {
				return CompletableFuture.failedFuture(new ApiException(401, "The access token expired"));
			}
			String body = """
					{"id": "%s", "name": "Teardrop", "durationMs": 330773}""".formatted(id);
			try {
				return CompletableFuture.completedFuture(objectMapper.readTree(body));
			} catch (IOException e) {
				return CompletableFuture.failedFuture(e);
			}
		}

		@Override
		public CompletionStage<String> _refreshAccessToken() {
			return CompletableFuture.completedFuture("token-" + refreshes.incrementAndGet());
		}
	}

	private static RetryOptions.Builder refreshingOptions(TrackApi client) {
		return RetryOptions.builder()
				.retryDelay(Duration.ofMillis(10))
				.shouldRetry(err -> err instanceof ApiException api && api.status() == 401)
				.beforeRetry((attempt, args) -> client._refreshAccessToken())
				.memberSelector(MemberSelectors.publicNames())
				.reporter(new Log4jRetryReporter());
	}

	@Test
	void unauthorizedTwice_refreshesTwiceAndReturnsThirdResponse() {
		SimulatedTrackApi client = new SimulatedTrackApi(2);

		TrackApi retrying = Retryify.decorate(TrackApi.class, client, refreshingOptions(client)
				.maxRetries(2)
				.build());

		JsonNode track = retrying.getTrack("0bYg9bo50gSsH3LtXe2SQn").join();

		assertThat(track.get("name").asText()).isEqualTo("Teardrop");
		assertThat(track.get("id").asText()).isEqualTo("0bYg9bo50gSsH3LtXe2SQn");
		assertThat(client.refreshes.get()).isEqualTo(2);
		assertThat(client.requests.get()).isEqualTo(3);
	}

	@Test
	void unauthorizedBeyondBudget_surfacesOriginalApiFailure() {
		SimulatedTrackApi client = new SimulatedTrackApi(5);

		TrackApi retrying = Retryify.decorate(TrackApi.class, client, refreshingOptions(client)
				.maxRetries(1)
				.build());

		assertThatThrownBy(() -> retrying.getTrack("abc").join())
				.hasCauseInstanceOf(ApiException.class)
				.hasMessageContaining("access token expired");
		assertThat(client.requests.get()).isEqualTo(2);
		assertThat(client.refreshes.get()).isEqualTo(1);
	}

	@Test
	void otherFailures_areNotRetried() {
		AtomicInteger requests = new AtomicInteger();
		TrackApi failing = new TrackApi() {
			@Override
			public CompletableFuture<JsonNode> getTrack(String id) {
				requests.incrementAndGet();
				return CompletableFuture.failedFuture(new ApiException(404, "Track not found"));
			}

			@Override
			public CompletionStage<String> _refreshAccessToken() {
				throw new AssertionError("refresh must not be attempted");
			}
		};

		TrackApi retrying = Retryify.decorate(TrackApi.class, failing, refreshingOptions(failing).build());

		assertThatThrownBy(() -> retrying.getTrack("missing").join())
				.hasCauseInstanceOf(ApiException.class);
		assertThat(requests.get()).isEqualTo(1);
	}
}
