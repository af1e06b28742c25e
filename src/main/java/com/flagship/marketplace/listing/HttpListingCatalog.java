package com.flagship.marketplace.listing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Listing service client over HTTP ({@code GET {base-url}/api/listings/{itemId}}).
 *
 * 404 means the item does not exist. Transport failures, timeouts and
 * error statuses are reported as UNAVAILABLE so the caller can retry. A
 * listing that is incomplete or uses an unknown currency or delivery method
 * cannot be traded and is reported as INVALID_STATE.
 */
@Component
@Slf4j
public class HttpListingCatalog implements ListingCatalog {

    private final RestClient restClient;

    public HttpListingCatalog(
            @Value("${marketplace.listings.base-url}") String baseUrl,
            @Value("${marketplace.listings.connect-timeout-ms:1000}")
            int connectTimeoutMs,
            @Value("${marketplace.listings.read-timeout-ms:2000}")
            int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Optional<Listing> get(UUID itemId) {
        try {
            ListingPayload payload = restClient.get()
                    .uri("/api/listings/{itemId}", itemId)
                    .header(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId())
                    .retrieve()
                    .body(ListingPayload.class);

            if (payload == null) {
                throw MarketplaceException.unavailable("Listing service returned an empty body for item " + itemId, null);
            }
            return Optional.of(payload.toListing(itemId));

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                log.debug("Listing {} not found", itemId);
                return Optional.empty();
            }
            log.error("Listing lookup for item {} rejected with status {}", itemId, e.getStatusCode());
            throw MarketplaceException.unavailable("Listing service rejected lookup for item " + itemId, e);
        } catch (RestClientException e) {
            log.error("Listing lookup for item {} failed: {}", itemId, e.getMessage());
            throw MarketplaceException.unavailable("Listing service unavailable", e);
        }
    }

    /**
     * Wire format of the listing service.
     */
    record ListingPayload(
            @JsonProperty("seller_id") UUID sellerId,
            @JsonProperty("price") BigDecimal price,
            @JsonProperty("currency") String currency,
            @JsonProperty("delivery_method") String deliveryMethod,
            @JsonProperty("status") String status) {

        Listing toListing(UUID itemId) {
            if (sellerId == null || price == null || currency == null || deliveryMethod == null) {
                throw MarketplaceException.invalidState("Listing service returned an incomplete listing for item " + itemId);
            }
            return Listing.builder()
                    .itemId(itemId)
                    .sellerId(sellerId)
                    .price(price)
                    .currency(parse(CurrencyCode.class, currency, "currency", itemId))
                    .deliveryMethod(parse(DeliveryMethod.class, deliveryMethod, "delivery method", itemId))
                    .available(status == null || "active".equalsIgnoreCase(status))
                    .build();
        }

        private static <E extends Enum<E>> E parse(Class<E> type, String raw, String field, UUID itemId) {
            try {
                return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw MarketplaceException.invalidState(
                        String.format("Listing %s has unsupported %s '%s'", itemId, field, raw));
            }
        }
    }
}
