package com.flagship.settlement_engine.payout.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Transfer API client over HTTP.
 *
 * Every submission carries the withdrawal id as Idempotency-Key. Calls go
 * through the transfer circuit breaker; declines are ignored by the breaker.
 */
@Component
@Slf4j
public class HttpTransferClient implements TransferClient {

    static final String TRANSFERS_PATH = "/v1/transfers";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String apiKey;

    public HttpTransferClient(RestTemplate transferRestTemplate,
                              CircuitBreaker transferCircuitBreaker,
                              @Value("${settlement.transfer.api-key:}") String apiKey) {
        this.restTemplate = transferRestTemplate;
        this.circuitBreaker = transferCircuitBreaker;
        this.apiKey = apiKey;
    }

    @Override
    public TransferReceipt submit(TransferRequest request) {
        return guarded(() -> doSubmit(request));
    }

    @Override
    public Optional<TransferReceipt> lookup(UUID withdrawalId) {
        return guarded(() -> doLookup(withdrawalId));
    }

    private TransferReceipt doSubmit(TransferRequest request) {
        HttpHeaders headers = baseHeaders();
        headers.set(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", request.getAmount().movePointRight(2).longValueExact());
        body.put("currency", request.getCurrency().toLowerCase());
        body.put("destination", request.getBeneficiaryId().toString());
        body.put("metadata", Map.of("withdrawal_id", request.getWithdrawalId().toString()));

        try {
            ResponseEntity<TransferApiResponse> response = restTemplate.exchange(
                TRANSFERS_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), TransferApiResponse.class);
            return toReceipt(response.getBody(), request.getWithdrawalId());
        } catch (HttpClientErrorException e) {
            if (isAmbiguous(e.getStatusCode().value())) {
                throw new TransferOutcomeUnknownException(
                    "Transfer API answered " + e.getStatusCode().value() + " for withdrawal " + request.getWithdrawalId(), e);
            }
            log.warn("Transfer declined: withdrawalId={}, status={}, body={}",
                    request.getWithdrawalId(), e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new TransferDeclinedException(
                "Transfer declined for withdrawal " + request.getWithdrawalId() + ": " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            // 5xx, I/O, unreadable 2xx body: the request may have been acted on
            throw new TransferOutcomeUnknownException(
                "Transfer outcome unknown for withdrawal " + request.getWithdrawalId() + ": " + e.getMessage(), e);
        }
    }

    private Optional<TransferReceipt> doLookup(UUID withdrawalId) {
        try {
            ResponseEntity<TransferApiResponse> response = restTemplate.exchange(
                TRANSFERS_PATH + "?idempotency_key={key}", HttpMethod.GET, new HttpEntity<>(baseHeaders()),
                TransferApiResponse.class, withdrawalId.toString());
            return Optional.of(toReceipt(response.getBody(), withdrawalId));
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                return Optional.empty();
            }
            throw new TransferOutcomeUnknownException(
                "Transfer lookup failed for withdrawal " + withdrawalId + ": " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new TransferOutcomeUnknownException(
                "Transfer lookup failed for withdrawal " + withdrawalId + ": " + e.getMessage(), e);
        }
    }

    private <T> T guarded(Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new TransferUnavailableException("Transfer API circuit breaker is open", e);
        }
    }

    private HttpHeaders baseHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        return headers;
    }

    private static TransferReceipt toReceipt(TransferApiResponse payload, UUID withdrawalId) {
        if (payload == null || payload.getId() == null) {
            throw new TransferOutcomeUnknownException("Empty transfer response for withdrawal " + withdrawalId);
        }
        // An unrecognised status is treated as still in flight
        TransferStatus status = TransferStatus.fromWireName(payload.getStatus()).orElse(TransferStatus.PENDING);
        return new TransferReceipt(payload.getId(), status);
    }

    // Timeout, conflict on the idempotency key, rate limit: the transfer may exist
    private static boolean isAmbiguous(int status) {
        return status == 408 || status == 409 || status == 429;
    }

    @lombok.Value
    static class TransferApiResponse {
        @JsonProperty("id")
        String id;
        @JsonProperty("status")
        String status;
    }
}
