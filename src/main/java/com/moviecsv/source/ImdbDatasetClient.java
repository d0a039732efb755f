package com.moviecsv.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.moviecsv.exception.TransportException;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Kapselt die HTTP-Downloads der IMDb-Archive inklusive Retry-Handling für transiente Fehler.
 */
@ApplicationScoped
public class ImdbDatasetClient {

	private static final Logger LOG = Logger.getLogger(ImdbDatasetClient.class);

	@ConfigProperty(name = "moviecsv.source.base-url", defaultValue = "https://datasets.imdbws.com/")
	String baseUrl;

	@ConfigProperty(name = "moviecsv.source.connect-timeout", defaultValue = "PT30S")
	Duration connectTimeout;

	@ConfigProperty(name = "moviecsv.source.read-timeout", defaultValue = "PT60S")
	Duration readTimeout;

	/** Obergrenze für einen kompletten Download inklusive Body. */
	@ConfigProperty(name = "moviecsv.source.call-timeout", defaultValue = "PT30M")
	Duration callTimeout;

	@ConfigProperty(name = "moviecsv.source.max-retry-wait", defaultValue = "PT30S")
	Duration maxRetryWait;

	OkHttpClient http;

	public ImdbDatasetClient() {
	}

	ImdbDatasetClient(OkHttpClient http, String baseUrl, Duration maxRetryWait) {
		this.http = http;
		this.baseUrl = baseUrl;
		this.maxRetryWait = maxRetryWait;
	}

	@PostConstruct
	void initHttpClient() {
		if (http != null)
			return;
		http = new OkHttpClient.Builder()
				.connectTimeout(connectTimeout)
				.readTimeout(readTimeout)
				.callTimeout(callTimeout)
				.build();
	}

	/**
	 * Baut die Download-URL eines Archivs, z.B. {@code https://datasets.imdbws.com/title.basics.tsv.gz}.
	 */
	public HttpUrl archiveUrl(String archiveName) {
		String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
		return Objects.requireNonNull(HttpUrl.parse(base + archiveName + ".tsv.gz"),
				() -> "Invalid dataset base URL: " + baseUrl);
	}

	/**
	 * Lädt ein Archiv vollständig in eine temporäre Datei. Der Aufrufer ist für das Löschen zuständig.
	 * Transiente Status-Codes und I/O-Fehler werden bis zur Retry-Deadline wiederholt.
	 */
	public Path download(String archiveName) {
		HttpUrl url = archiveUrl(archiveName);
		Request req = new Request.Builder()
				.url(url)
				.get()
				.addHeader("accept", "application/gzip")
				.build();

		long deadline = System.nanoTime() + maxRetryWait.toNanos();
		int attempt = 0;

		while (true) {
			try (Response resp = http.newCall(req).execute()) {
				if (isTransientStatus(resp.code()) && System.nanoTime() < deadline) {
					LOG.debugf("HTTP %d for %s, retrying", resp.code(), url);
					sleepForRetry(attempt++, deadline);
					continue;
				}

				if (!resp.isSuccessful())
					throw new TransportException("HTTP " + resp.code() + " for URL " + url);

				ResponseBody body = resp.body();
				if (body == null)
					throw new TransportException("Empty response body for URL " + url);

				return writeToTempFile(archiveName, body);
			} catch (IOException e) {
				if (System.nanoTime() >= deadline) {
					throw new TransportException("Download of " + url + " failed after retrying", e);
				}
				LOG.debugf("I/O failure for %s (%s), retrying", url, e.getMessage());
				sleepForRetry(attempt++, deadline);
			}
		}
	}

	private Path writeToTempFile(String archiveName, ResponseBody body) throws IOException {
		Path target = Files.createTempFile(archiveName + "-", ".tsv.gz");
		try (InputStream in = body.byteStream()) {
			Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
			return target;
		} catch (IOException e) {
			Files.deleteIfExists(target);
			throw e;
		}
	}

	private boolean isTransientStatus(int statusCode) {
		return statusCode == 429 || statusCode == 500 || statusCode == 502 || statusCode == 503 || statusCode == 504;
	}

	private void sleepForRetry(int attempt, long deadlineNanos) {
		long remainingMillis = Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
		if (remainingMillis == 0)
			return;

		long delayMillis = Math.min(remainingMillis, 500L + Math.min(attempt, 5) * 200L);
		try {
			Thread.sleep(delayMillis);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("Interrupted while waiting to retry download", e);
		}
	}
}
