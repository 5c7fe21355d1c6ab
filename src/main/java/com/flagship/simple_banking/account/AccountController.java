package com.flagship.simple_banking.account;

import com.flagship.simple_banking.account.dto.AccountResponse;
import com.flagship.simple_banking.account.dto.CreateAccountRequest;
import com.flagship.simple_banking.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for account operations.
 */
@RestController
@RequestMapping("/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    /**
     * Creates a new account.
     *
     * @param request document number, already format-checked by bean validation
     * @return 201 with the created account, 409 if the document is taken
     */
    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request");

        Account account = accountService.createAccount(request.getDocumentNumber());
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, account.getId().toString());

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("accountId") long accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(accountId)));
    }
}
