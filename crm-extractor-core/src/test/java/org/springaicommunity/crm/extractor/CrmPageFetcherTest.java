package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CrmPageFetcher}.
 *
 * Tests query parameter construction and decoding of list responses.
 */
@DisplayName("CrmPageFetcher Tests")
@ExtendWith(MockitoExtension.class)
class CrmPageFetcherTest {

	private static final String PAGE = """
			{
			  "results": [
			    {
			      "id": "101",
			      "properties": {"dealname": "Big deal", "amount": "1500.50", "hs_deal_stage_probability": 0.4},
			      "associations": {"contacts": {"results": [{"id": "7", "type": "deal_to_contact"}]}},
			      "createdAt": "2024-01-01T00:00:00Z",
			      "updatedAt": "2024-02-01T00:00:00Z",
			      "archived": false
			    },
			    {
			      "id": "102",
			      "properties": {"dealname": null, "amount": 20},
			      "archived": true
			    }
			  ],
			  "paging": {"next": {"after": "cursor-2", "link": "https://api.example.com/next"}},
			  "total": 57
			}
			""";

	@Mock
	private RequestExecutor executor;

	private CrmPageFetcher fetcher;

	@BeforeEach
	void setUp() {
		fetcher = new CrmPageFetcher(executor, new ObjectMapper(), "https://api.example.com/", "deals");
	}

	private ApiRequest captureRequest() {
		ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
		verify(executor).execute(captor.capture());
		return captor.getValue();
	}

	@Nested
	@DisplayName("Request Parameter Tests")
	class RequestParameterTest {

		@BeforeEach
		void stubEmptyPage() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(200, "{\"results\": []}"));
		}

		@Test
		@DisplayName("Should call the objects list endpoint with default properties")
		void shouldUseDefaults() {
			fetcher.fetch(PageRequest.first(50));

			ApiRequest request = captureRequest();
			assertThat(request.method()).isEqualTo("GET");
			assertThat(request.url()).isEqualTo("https://api.example.com/crm/v3/objects/deals");
			assertThat(request.params()).containsEntry("limit", "50")
				.containsEntry("archived", "false")
				.containsEntry("properties", String.join(",", CrmPageFetcher.DEFAULT_PROPERTIES))
				.doesNotContainKeys("after", "associations");
		}

		@Test
		@DisplayName("Should never request more than 100 records per page")
		void shouldClampBatchSize() {
			fetcher.fetch(PageRequest.first(250));

			assertThat(captureRequest().params()).containsEntry("limit", "100");
		}

		@Test
		@DisplayName("Should send cursor, properties, associations and archived flag")
		void shouldSendFilters() {
			PageRequest request = new PageRequest("abc", 25, List.of("dealname", "amount"),
					List.of("contacts", "companies"), true, Map.of());

			fetcher.fetch(request);

			assertThat(captureRequest().params()).containsExactly(entry("limit", "25"), entry("archived", "true"),
					entry("after", "abc"), entry("properties", "dealname,amount"),
					entry("associations", "contacts,companies"));
		}

		@Test
		@DisplayName("Should forward extra params except test-only keys and scan id")
		void shouldFilterExtraParams() {
			Map<String, String> extra = new LinkedHashMap<>();
			extra.put("_test_failure", "true");
			extra.put("scan_id", "scan-1");
			extra.put("sort", "createdate");

			fetcher.fetch(new PageRequest(null, 10, List.of(), List.of(), false, extra));

			assertThat(captureRequest().params()).containsEntry("sort", "createdate")
				.doesNotContainKeys("_test_failure", "scan_id");
		}

		@Test
		@DisplayName("Should URL-encode parameters in the request URI")
		void shouldEncodeUri() {
			fetcher.fetch(new PageRequest("a b/c", 10, List.of("dealname"), List.of(), false, Map.of()));

			assertThat(captureRequest().uri().toString()).contains("after=a+b%2Fc")
				.startsWith("https://api.example.com/crm/v3/objects/deals?limit=10");
		}

	}

	@Nested
	@DisplayName("Response Decoding Tests")
	class ResponseDecodingTest {

		@Test
		@DisplayName("Should decode records, next cursor and total")
		void shouldDecodePage() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(200, PAGE));

			PageResult page = fetcher.fetch(PageRequest.first(2));

			assertThat(page.records()).hasSize(2);
			assertThat(page.nextCursor()).isEqualTo("cursor-2");
			assertThat(page.hasNext()).isTrue();
			assertThat(page.rawTotal()).isEqualTo(57);

			RawRecord first = page.records().get(0);
			assertThat(first.id()).isEqualTo("101");
			assertThat(first.stringProperty("dealname")).isEqualTo("Big deal");
			assertThat(first.property("amount")).isEqualTo("1500.50");
			assertThat(first.property("hs_deal_stage_probability")).isEqualTo(new BigDecimal("0.4"));
			assertThat(first.associations()).containsKey("contacts");
			assertThat(first.createdAt()).isEqualTo("2024-01-01T00:00:00Z");
			assertThat(first.archived()).isFalse();

			RawRecord second = page.records().get(1);
			assertThat(second.properties()).containsEntry("dealname", null);
			assertThat(second.property("amount")).isEqualTo(20L);
			assertThat(second.associations()).isEmpty();
			assertThat(second.createdAt()).isNull();
			assertThat(second.archived()).isTrue();
		}

		@Test
		@DisplayName("Should report the last page when paging is absent or the cursor is empty")
		void shouldDetectLastPage() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(200, "{\"results\": [{\"id\": \"1\"}]}"))
				.thenReturn(ApiResponse.of(200, "{\"results\": [], \"paging\": {\"next\": {\"after\": \"\"}}}"));

			PageResult noPaging = fetcher.fetch(PageRequest.first(10));
			PageResult emptyCursor = fetcher.fetch(PageRequest.first(10));

			assertThat(noPaging.hasNext()).isFalse();
			assertThat(noPaging.rawTotal()).isNull();
			assertThat(emptyCursor.nextCursor()).isNull();
			assertThat(emptyCursor.isEmpty()).isTrue();
		}

		@Test
		@DisplayName("Should keep totals beyond the int range")
		void shouldKeepLargeTotal() {
			when(executor.execute(any(ApiRequest.class)))
				.thenReturn(ApiResponse.of(200, "{\"results\": [], \"total\": 3000000000}"));

			PageResult page = fetcher.fetch(PageRequest.first(10));

			assertThat(page.rawTotal()).isEqualTo(3_000_000_000L);
		}

	}

	@Nested
	@DisplayName("Error Handling Tests")
	class ErrorHandlingTest {

		@Test
		@DisplayName("Should throw with status and body on a non-2xx response")
		void shouldThrowOnErrorStatus() {
			when(executor.execute(any(ApiRequest.class)))
				.thenReturn(ApiResponse.of(401, "{\"message\": \"Authentication credentials not found\"}"));

			assertThatThrownBy(() -> fetcher.fetch(PageRequest.first(10))).isInstanceOf(CrmApiException.class)
				.hasMessageContaining("HTTP 401")
				.satisfies(e -> {
					CrmApiException apiException = (CrmApiException) e;
					assertThat(apiException.getStatusCode()).isEqualTo(401);
					assertThat(apiException.getResponseBody()).contains("Authentication credentials");
				});
		}

		@Test
		@DisplayName("Should surface an exhausted rate limit as a rate-limited error")
		void shouldThrowOnExhausted429() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(429, ""));

			assertThatThrownBy(() -> fetcher.fetch(PageRequest.first(10))).isInstanceOf(CrmApiException.class)
				.satisfies(e -> assertThat(((CrmApiException) e).isRateLimited()).isTrue());
		}

		@Test
		@DisplayName("Should throw on malformed JSON")
		void shouldThrowOnMalformedJson() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(200, "{not json"));

			assertThatThrownBy(() -> fetcher.fetch(PageRequest.first(10))).isInstanceOf(CrmApiException.class)
				.hasMessageContaining("Could not decode deals page");
		}

		@Test
		@DisplayName("Should throw when the payload is not an object")
		void shouldThrowOnNonObjectPayload() {
			when(executor.execute(any(ApiRequest.class))).thenReturn(ApiResponse.of(200, "[1, 2]"));

			assertThatThrownBy(() -> fetcher.fetch(PageRequest.first(10))).isInstanceOf(CrmApiException.class)
				.hasMessageContaining("Unexpected deals page payload");
		}

	}

}
