package com.flagship.account_pro.api;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountNotFoundException;
import com.flagship.account_pro.account.AccountService;
import com.flagship.account_pro.account.dto.AccountResponse;
import com.flagship.account_pro.stats.AccountStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only JSON API over the account store.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AccountApiController {

    private final AccountService accountService;
    private final AccountStatsService statsService;

    @GetMapping("/accounts")
    public ResponseEntity<ApiResponses.AccountList> listAccounts() {
        List<AccountResponse> accounts = accountService.listAccounts().stream()
            .map(AccountResponse::from)
            .toList();
        return ResponseEntity.ok(new ApiResponses.AccountList(true, accounts.size(), accounts));
    }

    /**
     * @return the account, or 404 with {@code {success:false, message}}
     */
    @GetMapping("/account/{id}")
    public ResponseEntity<ApiResponses.SingleAccount> getAccount(@PathVariable("id") long id) {
        Account account = accountService.getAccount(id);
        return ResponseEntity.ok(new ApiResponses.SingleAccount(true, AccountResponse.from(account)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponses.Stats> stats() {
        return ResponseEntity.ok(new ApiResponses.Stats(true, statsService.computeStats()));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiResponses.Failure> handleNotFound(AccountNotFoundException e) {
        log.info("API lookup for unknown account: id={}", e.getAccountId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ApiResponses.Failure(false, "Account not found"));
    }
}
