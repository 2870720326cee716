package com.flagship.finance_tracker.ledger;

import com.flagship.finance_tracker.ledger.dto.AccountResponse;
import com.flagship.finance_tracker.ledger.dto.BillRequest;
import com.flagship.finance_tracker.ledger.dto.BillResponse;
import com.flagship.finance_tracker.ledger.dto.CreateAccountRequest;
import com.flagship.finance_tracker.ledger.dto.CreateTransactionRequest;
import com.flagship.finance_tracker.ledger.dto.LedgerResponse;
import com.flagship.finance_tracker.ledger.dto.MutationResponse;
import com.flagship.finance_tracker.ledger.dto.NetWorthResponse;
import com.flagship.finance_tracker.ledger.dto.PreferencesRequest;
import com.flagship.finance_tracker.ledger.dto.ResetRequest;
import com.flagship.finance_tracker.ledger.dto.TransactionResponse;
import com.flagship.finance_tracker.ledger.dto.TransferRequest;
import com.flagship.finance_tracker.ledger.dto.UpdateAccountRequest;
import com.flagship.finance_tracker.ledger.dto.UpdateTransactionRequest;
import com.flagship.finance_tracker.payoff.dto.DebtPayoffSettingsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * REST controller for a profile's ledger.
 *
 * Every request runs against the profile in the path, activated atomically
 * with the work through {@link LedgerService#withProfile}. Mutations return a
 * {@link MutationResponse}:
 * - applied: 200, or 201 when something was created
 * - pending confirmation: 202, nothing changed; repeat with {@code ?confirm=true}
 * - rejected: 400, nothing changed
 */
@RestController
@RequestMapping("/api/profiles/{profileId}")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String CONFIRM_PARAM = "confirm";

    private final LedgerService ledgerService;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<LedgerResponse> getLedger(@PathVariable("profileId") String profileId) {
        LedgerResponse response = ledgerService.withProfile(profileId, () -> {
            LedgerSnapshot snapshot = ledgerService.snapshot();
            boolean hideMoney = ledgerService.isHideMoney();
            LocalDate today = LocalDate.now(clock);

            return LedgerResponse.builder()
                .profileId(profileId)
                .accounts(snapshot.getAccounts().stream().map(a -> AccountResponse.from(a, hideMoney)).toList())
                .deletedAccounts(snapshot.getDeletedAccounts().stream()
                    .map(a -> AccountResponse.from(a, hideMoney)).toList())
                .selectedAccountId(ledgerService.selectedAccount().map(Account::getId).orElse(null))
                .transactions(TransactionResponse.fromAll(snapshot.getTransactions()))
                .bills(snapshot.getBills().stream().map(bill -> BillResponse.from(bill, today)).toList())
                .netWorth(netWorthResponse())
                .hideMoney(hideMoney)
                .debtPayoffSettings(DebtPayoffSettingsResponse.from(ledgerService.debtPayoffSettings()))
                .build();
        });

        return ResponseEntity.ok(response);
    }

    @GetMapping("/net-worth")
    public ResponseEntity<NetWorthResponse> getNetWorth(@PathVariable("profileId") String profileId) {
        return ResponseEntity.ok(ledgerService.withProfile(profileId, this::netWorthResponse));
    }

    // ==================== Accounts ====================

    @PostMapping("/accounts")
    public ResponseEntity<MutationResponse<AccountResponse>> createAccount(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody CreateAccountRequest request) {

        log.info("Received account creation request: name={}, category={}", request.getName(), request.getCategory());

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.addAccount(request.toDraft()), this::toAccountResponse, HttpStatus.CREATED));
    }

    @PatchMapping("/accounts/{accountId}")
    public ResponseEntity<MutationResponse<AccountResponse>> updateAccount(
            @PathVariable("profileId") String profileId,
            @PathVariable("accountId") String accountId,
            @Valid @RequestBody UpdateAccountRequest request,
            @RequestParam(name = CONFIRM_PARAM, defaultValue = "false") boolean confirm) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.editAccount(accountId, request.toChanges(), confirm),
                        this::toAccountResponse, HttpStatus.OK));
    }

    @DeleteMapping("/accounts/{accountId}")
    public ResponseEntity<MutationResponse<AccountResponse>> deleteAccount(
            @PathVariable("profileId") String profileId,
            @PathVariable("accountId") String accountId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.deleteAccount(accountId), this::toAccountResponse, HttpStatus.OK));
    }

    @PostMapping("/accounts/{accountId}/restore")
    public ResponseEntity<MutationResponse<AccountResponse>> restoreAccount(
            @PathVariable("profileId") String profileId,
            @PathVariable("accountId") String accountId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.restoreAccount(accountId), this::toAccountResponse, HttpStatus.OK));
    }

    @PostMapping("/accounts/{accountId}/select")
    public ResponseEntity<MutationResponse<AccountResponse>> selectAccount(
            @PathVariable("profileId") String profileId,
            @PathVariable("accountId") String accountId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.selectAccount(accountId), this::toAccountResponse, HttpStatus.OK));
    }

    @GetMapping("/accounts/{accountId}/transactions")
    public ResponseEntity<List<TransactionResponse>> getAccountTransactions(
            @PathVariable("profileId") String profileId,
            @PathVariable("accountId") String accountId) {

        return ResponseEntity.ok(ledgerService.withProfile(profileId, () ->
                TransactionResponse.fromAll(ledgerService.transactionsFor(accountId))));
    }

    // ==================== Transactions ====================

    @PostMapping("/transactions")
    public ResponseEntity<MutationResponse<TransactionResponse>> createTransaction(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody CreateTransactionRequest request,
            @RequestParam(name = CONFIRM_PARAM, defaultValue = "false") boolean confirm) {

        log.info("Received transaction request: accountId={}, amount={}, confirm={}",
                request.getAccountId(), request.getAmount(), confirm);

        return ledgerService.withProfile(profileId, () -> respond(
                ledgerService.addTransaction(request.getAccountId(), request.getAmount(), request.getDate(),
                        request.getDescription(), confirm),
                TransactionResponse::from, HttpStatus.CREATED));
    }

    @PatchMapping("/transactions/{transactionId}")
    public ResponseEntity<MutationResponse<TransactionResponse>> updateTransaction(
            @PathVariable("profileId") String profileId,
            @PathVariable("transactionId") String transactionId,
            @Valid @RequestBody UpdateTransactionRequest request,
            @RequestParam(name = CONFIRM_PARAM, defaultValue = "false") boolean confirm) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.updateTransaction(transactionId, request.toChanges(), confirm),
                        TransactionResponse::from, HttpStatus.OK));
    }

    @DeleteMapping("/transactions/{transactionId}")
    public ResponseEntity<MutationResponse<List<TransactionResponse>>> deleteTransaction(
            @PathVariable("profileId") String profileId,
            @PathVariable("transactionId") String transactionId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.deleteTransaction(transactionId), TransactionResponse::fromAll, HttpStatus.OK));
    }

    @PostMapping("/transfers")
    public ResponseEntity<MutationResponse<List<TransactionResponse>>> createTransfer(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody TransferRequest request,
            @RequestParam(name = CONFIRM_PARAM, defaultValue = "false") boolean confirm) {

        log.info("Received transfer request: from={}, to={}, amount={}, confirm={}",
                request.getFromAccountId(), request.getToAccountId(), request.getAmount(), confirm);

        return ledgerService.withProfile(profileId, () -> respond(
                ledgerService.transfer(request.getFromAccountId(), request.getToAccountId(), request.getAmount(),
                        request.getDate(), request.getNote(), confirm),
                TransactionResponse::fromAll, HttpStatus.CREATED));
    }

    // ==================== Bills ====================

    @GetMapping("/bills/unpaid")
    public ResponseEntity<List<BillResponse>> getUnpaidBills(@PathVariable("profileId") String profileId) {
        return ResponseEntity.ok(ledgerService.withProfile(profileId, () ->
                ledgerService.unpaidBills().stream().map(this::toBillResponse).toList()));
    }

    @PostMapping("/bills")
    public ResponseEntity<MutationResponse<BillResponse>> createBill(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody BillRequest request) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.addBill(request.toBill()), this::toBillResponse, HttpStatus.CREATED));
    }

    @PutMapping("/bills/{billId}")
    public ResponseEntity<MutationResponse<BillResponse>> updateBill(
            @PathVariable("profileId") String profileId,
            @PathVariable("billId") String billId,
            @Valid @RequestBody BillRequest request) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.updateBill(billId, request.toBill()), this::toBillResponse, HttpStatus.OK));
    }

    @DeleteMapping("/bills/{billId}")
    public ResponseEntity<MutationResponse<BillResponse>> deleteBill(
            @PathVariable("profileId") String profileId,
            @PathVariable("billId") String billId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.deleteBill(billId), this::toBillResponse, HttpStatus.OK));
    }

    @PostMapping("/bills/{billId}/pay")
    public ResponseEntity<MutationResponse<TransactionResponse>> payBill(
            @PathVariable("profileId") String profileId,
            @PathVariable("billId") String billId) {

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.markBillPaid(billId), TransactionResponse::from, HttpStatus.CREATED));
    }

    // ==================== Reset & preferences ====================

    @PostMapping("/reset")
    public ResponseEntity<MutationResponse<Integer>> reset(
            @PathVariable("profileId") String profileId,
            @Valid @RequestBody ResetRequest request) {

        ResetScope scope = ResetScope.fromCode(request.getScope());
        log.info("Received reset request: scope={}", scope.getCode());

        return ledgerService.withProfile(profileId, () ->
                respond(ledgerService.reset(scope), Function.identity(), HttpStatus.OK));
    }

    @PutMapping("/preferences")
    public ResponseEntity<NetWorthResponse> updatePreferences(
            @PathVariable("profileId") String profileId,
            @RequestBody PreferencesRequest request) {

        NetWorthViewMode viewMode = request.getNetWorthViewMode() != null
            ? NetWorthViewMode.fromCode(request.getNetWorthViewMode())
            : null;
        if (request.getNetWorthViewMode() != null && viewMode == null) {
            throw new IllegalArgumentException("Unknown net worth view mode: " + request.getNetWorthViewMode());
        }

        return ResponseEntity.ok(ledgerService.withProfile(profileId, () -> {
            ledgerService.updatePreferences(viewMode, request.getHideMoney());
            return netWorthResponse();
        }));
    }

    // ==================== Helpers ====================

    private NetWorthResponse netWorthResponse() {
        return NetWorthResponse.from(
                ledgerService.netWorth(),
                ledgerService.netWorthHistory(),
                ledgerService.netWorthViewMode(),
                ledgerService.isHideMoney());
    }

    private AccountResponse toAccountResponse(Account account) {
        return AccountResponse.from(account, ledgerService.isHideMoney());
    }

    private BillResponse toBillResponse(Bill bill) {
        return BillResponse.from(bill, LocalDate.now(clock));
    }

    private static <S, T> ResponseEntity<MutationResponse<T>> respond(MutationResult<S> result,
                                                                       Function<S, T> mapper,
                                                                       HttpStatus appliedStatus) {
        HttpStatus status = switch (result.getOutcome()) {
            case APPLIED -> appliedStatus;
            case PENDING_CONFIRMATION -> HttpStatus.ACCEPTED;
            case REJECTED -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(MutationResponse.from(result, mapper));
    }
}
