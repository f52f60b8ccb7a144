package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.ledger.dto.BalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/balances")
@RequiredArgsConstructor
public class BalanceController {

    private final LedgerService ledgerService;

    @GetMapping("/{beneficiaryId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("beneficiaryId") UUID beneficiaryId) {
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.getBalance(beneficiaryId)));
    }
}
