package com.flagship.simple_banking.account;

import com.flagship.simple_banking.exception.ConflictException;
import com.flagship.simple_banking.exception.NotFoundException;
import com.flagship.simple_banking.exception.PersistenceFailureException;
import com.flagship.simple_banking.exception.ValidationException;
import com.flagship.simple_banking.observability.BankingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates and looks up accounts.
 *
 * Document number format is checked at the API boundary; this service owns
 * uniqueness. The lookup-then-insert check covers the common case and the
 * database unique constraint covers two concurrent creates of the same
 * document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final BankingMetrics metrics;

    @Transactional
    public Account createAccount(String documentNumber) {
        try {
            if (accountRepository.findByDocumentNumber(documentNumber).isPresent()) {
                metrics.recordAccountCreated("duplicate");
                throw ConflictException.duplicateDocumentNumber();
            }

            AccountEntity saved = accountRepository.save(AccountEntity.fromDomain(Account.create(documentNumber)));
            log.info("Account created: accountId={}", saved.getId());
            metrics.recordAccountCreated("success");
            return saved.toDomain();

        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent account creation lost the unique constraint race");
            metrics.recordAccountCreated("duplicate");
            throw ConflictException.duplicateDocumentNumber();
        } catch (DataAccessException e) {
            metrics.recordAccountCreated("error");
            throw new PersistenceFailureException("Failed to create account", e);
        }
    }

    /**
     * @throws ValidationException if the id is not positive
     * @throws NotFoundException if no account has the id
     */
    @Transactional(readOnly = true)
    public Account getAccount(long accountId) {
        if (accountId <= 0) {
            throw ValidationException.invalidAccountId();
        }
        try {
            return accountRepository.findById(accountId)
                .map(AccountEntity::toDomain)
                .orElseThrow(() -> NotFoundException.account(accountId));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load account " + accountId, e);
        }
    }
}
