package com.flagship.finance_tracker.payoff;

import com.flagship.finance_tracker.ledger.LedgerService;
import com.flagship.finance_tracker.payoff.dto.DebtPayoffResponse;
import com.flagship.finance_tracker.payoff.dto.DebtPayoffSettingsRequest;
import com.flagship.finance_tracker.payoff.dto.DebtPayoffSettingsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the debt payoff planner. Projections are read-only.
 */
@RestController
@RequestMapping("/api/profiles/{profileId}/debt-payoff")
@RequiredArgsConstructor
@Slf4j
public class DebtPayoffController {

    private final LedgerService ledgerService;

    @GetMapping
    public ResponseEntity<DebtPayoffResponse> getProjection(@PathVariable("profileId") String profileId) {
        DebtPayoffResponse response = ledgerService.withProfile(profileId, () -> {
            DebtPayoffResult result = ledgerService.projectDebtPayoff();
            log.debug("Projected debt payoff: mode={}, debts={}, months={}, insufficient={}",
                    result.getMode().getCode(), result.getDebts().size(), result.getSchedule().size(),
                    result.isInsufficientAllocation());
            return DebtPayoffResponse.from(result, ledgerService.debtPayoffSettings());
        });

        return ResponseEntity.ok(response);
    }

    @PutMapping("/settings")
    public ResponseEntity<DebtPayoffSettingsResponse> updateSettings(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody DebtPayoffSettingsRequest request) {

        log.info("Updating debt payoff settings: mode={}, monthlyAllocation={}",
                request.getMode().getCode(), request.getMonthlyAllocation());

        DebtPayoffSettings updated = ledgerService.withProfile(profileId,
                () -> ledgerService.updateDebtPayoffSettings(request.toSettings()));
        return ResponseEntity.ok(DebtPayoffSettingsResponse.from(updated));
    }
}
