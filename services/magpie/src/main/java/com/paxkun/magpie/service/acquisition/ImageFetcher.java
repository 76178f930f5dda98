package com.paxkun.magpie.service.acquisition;

import com.paxkun.magpie.config.HttpSettings;
import com.paxkun.magpie.exception.FetchException;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;

/**
 * Pooled HTTP client for page images. Transient statuses (429, 500, 502, 503, 504)
 * are retried here with exponential backoff, below and independent of the per-URL
 * retry loop of {@link AcquisitionWorkerPool}.
 * <p>
 * Author: Pax
 */
@Slf4j
@Component
public class ImageFetcher implements DisposableBean {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    private static final String ACCEPT = "image/webp,image/apng,image/*,*/*;q=0.8";

    private final HttpSettings settings;
    private final ConnectionProvider connectionProvider;
    private final WebClient webClient;

    public ImageFetcher(HttpSettings settings) {
        this.settings = settings;
        this.connectionProvider = ConnectionProvider.builder("magpie-images")
                .maxConnections(settings.maxConnections())
                .pendingAcquireTimeout(Duration.ofSeconds(60))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.responseTimeout().toMillis())
                .responseTimeout(settings.responseTimeout())
                .followRedirect(true)
                .compress(true);

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(settings.maxImageBytes()))
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, ACCEPT)
                .build();
    }

    /**
     * Downloads one image.
     *
     * @param url     absolute image URL, possibly carrying unencoded characters
     * @param referer page the image belongs to, sent as Referer; may be null
     * @return the response body
     * @throws FetchException on any transport or HTTP failure left after transport retries
     */
    public byte[] fetch(String url, String referer) {
        URI uri = toUri(url);
        try {
            byte[] body = webClient.get()
                    .uri(uri)
                    .headers(headers -> {
                        if (referer != null && !referer.isBlank()) {
                            headers.set(HttpHeaders.REFERER, referer);
                        }
                    })
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .retryWhen(Retry.backoff(settings.transportRetries(), settings.transportBackoff())
                            .filter(ImageFetcher::isRetryableStatus)
                            .doBeforeRetry(signal -> log.debug("Transport retry {} for {}: {}",
                                    signal.totalRetries() + 1, url, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();

            if (body == null || body.length == 0) {
                throw new FetchException("Empty response body from " + url);
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new FetchException("HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (WebClientRequestException e) {
            throw new FetchException("Request to " + url + " failed: " + e.getMessage(), e);
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FetchException("Fetching " + url + " failed: " + e.getMessage(), e);
        }
    }

    static boolean isRetryableStatus(Throwable failure) {
        return failure instanceof WebClientResponseException response
                && HttpSettings.RETRYABLE_STATUSES.contains(response.getStatusCode().value());
    }

    private URI toUri(String url) {
        try {
            return UriComponentsBuilder.fromHttpUrl(url).build().encode().toUri();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Malformed image URL: " + url, e);
        }
    }

    @Override
    public void destroy() {
        connectionProvider.dispose();
    }
}
