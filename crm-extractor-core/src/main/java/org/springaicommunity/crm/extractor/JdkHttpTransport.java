package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Sends the bearer token and JSON content headers on every request. Daily quota headers
 * are captured from all responses and made available via {@link #getLastRateLimitInfo()}.
 */
public class JdkHttpTransport implements HttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	static final String USER_AGENT = "crm-extractor/1.0";

	private final HttpClient httpClient;

	private final String accessToken;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public JdkHttpTransport(String accessToken) {
		this(accessToken, Duration.ofSeconds(30));
	}

	public JdkHttpTransport(String accessToken, Duration connectTimeout) {
		this.accessToken = accessToken;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public ApiResponse send(ApiRequest request, Duration timeout) throws IOException {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(request.uri())
			.timeout(timeout)
			.header("Authorization", "Bearer " + accessToken)
			.header("Accept", "application/json")
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT);
		request.headers().forEach(builder::setHeader);

		HttpRequest.BodyPublisher body = request.body() != null ? HttpRequest.BodyPublishers.ofString(request.body())
				: HttpRequest.BodyPublishers.noBody();
		builder.method(request.method(), body);

		logger.debug("{} {}", request.method(), request.url());
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
			logger.debug("{} {} -> {} in {}ms", request.method(), request.url(), response.statusCode(),
					System.currentTimeMillis() - start);

			ApiResponse apiResponse = new ApiResponse(response.statusCode(), response.headers().map(),
					response.body() != null ? response.body() : "");
			captureRateLimit(apiResponse);
			return apiResponse;
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), request.url(),
					System.currentTimeMillis() - start, e.toString());
			throw e;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CrmApiException("HTTP request interrupted", e);
		}
	}

	private void captureRateLimit(ApiResponse response) {
		RateLimitInfo.from(response).ifPresent(info -> {
			this.lastRateLimitInfo = info;
			if (info.dailyRemaining() < info.dailyLimit() / 10) {
				logger.info("Daily rate limit low: {}/{} remaining", info.dailyRemaining(), info.dailyLimit());
			}
			else {
				logger.debug("Daily rate limit: {}/{} remaining", info.dailyRemaining(), info.dailyLimit());
			}
		});
	}

}
