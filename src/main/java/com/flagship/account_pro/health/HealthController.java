package com.flagship.account_pro.health;

import com.flagship.account_pro.account.AccountService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness probes.
 * The in-memory store cannot fail, so this always answers 200.
 */
@RestController
public class HealthController {

    private final AccountService accountService;
    private final Clock clock;

    public HealthController(AccountService accountService, Clock clock) {
        this.accountService = accountService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("timestamp", LocalDateTime.now(clock).toString());
        response.put("accounts_count", accountService.countAccounts());
        return ResponseEntity.ok(response);
    }
}
