package org.springaicommunity.github.reporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for configuration and wiring support classes. Plain JUnit, no network.
 */
@DisplayName("ConfigurationSupport Tests")
class ConfigurationSupportTest {

	@Nested
	@DisplayName("ReporterProperties Tests")
	class ReporterPropertiesTest {

		private ReporterProperties properties;

		@BeforeEach
		void setUp() {
			properties = new ReporterProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaultProperties() {
			assertThat(properties.getApiBaseUrl()).isEqualTo("https://api.github.com");
			assertThat(properties.getDangerId()).isEqualTo("danger");
			assertThat(properties.getStatusContext()).isEqualTo("danger/danger");
			assertThat(properties.getCommentsPerPage()).isEqualTo(100);
			assertThat(properties.isApplyIgnoreDirectives()).isTrue();
			assertThat(properties.getConnectTimeoutSeconds()).isEqualTo(30);
		}

		@Test
		@DisplayName("Should have working getters and setters")
		void shouldHaveWorkingGettersAndSetters() {
			properties.setApiBaseUrl("https://github.example.com/api/v3");
			properties.setDangerId("lint");
			properties.setStatusContext("ci/lint");
			properties.setCommentsPerPage(30);
			properties.setApplyIgnoreDirectives(false);
			properties.setConnectTimeoutSeconds(5);

			assertThat(properties.getApiBaseUrl()).isEqualTo("https://github.example.com/api/v3");
			assertThat(properties.getDangerId()).isEqualTo("lint");
			assertThat(properties.getStatusContext()).isEqualTo("ci/lint");
			assertThat(properties.getCommentsPerPage()).isEqualTo(30);
			assertThat(properties.isApplyIgnoreDirectives()).isFalse();
			assertThat(properties.getConnectTimeoutSeconds()).isEqualTo(5);
		}

	}

	@Nested
	@DisplayName("ObjectMapperFactory Tests")
	class ObjectMapperFactoryTest {

		record Sample(String htmlUrl, LocalDate createdAt) {
		}

		@Test
		@DisplayName("Should map snake_case keys and ignore unknown ones")
		void shouldMapSnakeCase() throws Exception {
			ObjectMapper mapper = ObjectMapperFactory.create();

			Sample sample = mapper.readValue(
					"{\"html_url\": \"https://x\", \"created_at\": \"2024-01-15\", \"extra\": 1}", Sample.class);

			assertThat(sample.htmlUrl()).isEqualTo("https://x");
			assertThat(sample.createdAt()).isEqualTo(LocalDate.of(2024, 1, 15));
			assertThat(mapper.writeValueAsString(sample)).contains("\"created_at\":\"2024-01-15\"");
		}

	}

	@Nested
	@DisplayName("GitHubReporterBuilder Tests")
	class GitHubReporterBuilderTest {

		@Test
		@DisplayName("Should require a token without a custom client")
		void shouldRequireToken() {
			assertThatThrownBy(() -> GitHubReporterBuilder.create().buildPublisher("owner/repo", 1))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("token");
		}

		@Test
		@DisplayName("Should build a service over the default HTTP client with a token")
		void shouldBuildWithToken() {
			ReviewService service = GitHubReporterBuilder.create().token("test-token").buildReviewService();

			assertThat(service).isInstanceOf(GitHubReviewService.class);
		}

		@Test
		@DisplayName("Should keep defaults when null properties are passed")
		void shouldKeepDefaultsForNullProperties() {
			GitHubReporterBuilder builder = GitHubReporterBuilder.create().properties(null);

			assertThat(builder.getProperties().getDangerId()).isEqualTo("danger");
		}

		@Test
		@DisplayName("Should wire a working publisher around a custom client")
		void shouldWirePublisherWithCustomClient() {
			GitHubClient client = mock(GitHubClient.class);
			when(client.get("/repos/owner/repo/pulls/3")).thenReturn("""
					{"number": 3, "html_url": "https://github.com/owner/repo/pull/3", "body": null,
					 "head": {"sha": "abc"}, "base": {"sha": "def", "repo": {"private": false}}}
					""");
			when(client.get("/repos/owner/repo/issues/3/comments?per_page=100&page=1")).thenReturn("[]");
			when(client.post(eq("/repos/owner/repo/issues/3/comments"), anyString()))
				.thenReturn("{\"id\": 9, \"html_url\": \"https://github.com/owner/repo/pull/3#issuecomment-9\"}");
			when(client.post(eq("/repos/owner/repo/statuses/abc"), anyString())).thenReturn("{}");

			ReporterProperties properties = new ReporterProperties();
			properties.setStatusContext("ci/report");
			ByteArrayOutputStream console = new ByteArrayOutputStream();
			ReportPublisher publisher = GitHubReporterBuilder.create()
				.httpClient(client)
				.properties(properties)
				.console(new PrintStream(console, true, StandardCharsets.UTF_8))
				.buildPublisher("owner/repo", 3);

			PublishResult result = publisher.publish(FindingSet.of(Finding.error("boom")));

			assertThat(result).isInstanceOfSatisfying(PublishResult.Completed.class, completed -> {
				assertThat(completed.reconcile().action()).isEqualTo(ReconcileAction.CREATED);
				assertThat(completed.status().description()).isEqualTo("1 error");
			});
			verify(client).post(eq("/repos/owner/repo/statuses/abc"), contains("\"context\":\"ci/report\""));
		}

		@Test
		@DisplayName("Should use a custom renderer")
		void shouldUseCustomRenderer() {
			GitHubClient client = mock(GitHubClient.class);
			when(client.get(startsWith("/repos/owner/repo/pulls/"))).thenReturn(
					"{\"number\": 3, \"head\": {\"sha\": \"abc\"}, \"base\": {\"repo\": {\"private\": false}}}");
			when(client.get(contains("/comments"))).thenReturn("[]");
			when(client.post(anyString(), anyString())).thenReturn("{\"id\": 1}");

			GitHubReporterBuilder.create()
				.httpClient(client)
				.renderer((findings, ledger, dangerId) -> "custom " + ReportSignature.marker(dangerId))
				.buildPublisher("owner/repo", 3)
				.publish(FindingSet.of(Finding.warning("w")));

			verify(client).post(eq("/repos/owner/repo/issues/3/comments"), contains("custom"));
		}

	}

}
