package com.flagship.settlement_engine.intake;

import com.flagship.settlement_engine.intake.dto.WebhookAckResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Webhook endpoint for the payment processor.
 *
 * The body is read as raw bytes so the signature is checked over exactly
 * what was sent. A bad signature is rejected with 400 before anything is
 * recorded; every verified event is acknowledged with 200, whatever its
 * outcome, unless the failure could not be recorded (500, redelivered).
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    public static final String SIGNATURE_HEADER = "Processor-Signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final EventIntakeService intakeService;

    @PostMapping("/processor")
    public ResponseEntity<WebhookAckResponse> receive(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody byte[] body) {
        signatureVerifier.verify(body, signature);
        IntakeOutcome outcome = intakeService.receive(new String(body, StandardCharsets.UTF_8));
        return ResponseEntity.ok(WebhookAckResponse.of(outcome));
    }
}
