package com.flagship.settlement_engine.payout;

import com.flagship.settlement_engine.payout.dto.WithdrawalRequest;
import com.flagship.settlement_engine.payout.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Withdrawal endpoint. 200 when paid out, 202 when the transfer outcome is
 * still open, 422 when rejected.
 */
@RestController
@RequestMapping("/api/withdrawals")
@RequiredArgsConstructor
public class WithdrawalController {

    private final PayoutProcessor payoutProcessor;

    @PostMapping
    public ResponseEntity<WithdrawalResponse> withdraw(@Valid @RequestBody WithdrawalRequest request) {
        PayoutResult result = payoutProcessor.withdraw(request.getBeneficiaryId(), request.getAmount());
        HttpStatus status = switch (result.getStatus()) {
            case PAID_OUT -> HttpStatus.OK;
            case PENDING -> HttpStatus.ACCEPTED;
            case REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return ResponseEntity.status(status).body(WithdrawalResponse.from(result));
    }
}
