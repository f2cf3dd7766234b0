package com.example.ledger.service;

import com.example.ledger.domain.*;
import com.example.ledger.exception.*;
import com.example.ledger.repository.JournalEntryRepository;
import com.example.ledger.repository.TransactionMatchRepository;
import com.example.ledger.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service responsible for writing transactions and their journal entries.
 * Ensures the double-entry rules hold for every stored transaction:
 * - At least two entries
 * - Amounts have at most four decimal places
 * - Entries sum to exactly zero, with no tolerance
 * - Entries are only ever replaced or deleted as a whole set
 *
 * Shape and balance are checked before any account is resolved, so a rejected
 * request never creates accounts.
 */
@Service
@Transactional
public class PostingService {

    private static final Logger log = LoggerFactory.getLogger(PostingService.class);

    static final int AMOUNT_SCALE = 4;

    private final TransactionRepository transactionRepository;
    private final JournalEntryRepository journalEntryRepository;
    private final TransactionMatchRepository matchRepository;
    private final AccountService accountService;
    private final AuditService auditService;

    public PostingService(TransactionRepository transactionRepository,
                          JournalEntryRepository journalEntryRepository,
                          TransactionMatchRepository matchRepository,
                          AccountService accountService,
                          AuditService auditService) {
        this.transactionRepository = transactionRepository;
        this.journalEntryRepository = journalEntryRepository;
        this.matchRepository = matchRepository;
        this.accountService = accountService;
        this.auditService = auditService;
    }

    /**
     * Posts a transaction with all its entries as one unit of work.
     *
     * @param request header, provenance and entries
     * @param actor the user posting, may be null for imports
     * @return the saved transaction
     * @throws EmptyTransactionException if fewer than two entries are given
     * @throws InvalidAmountException if an amount is missing or too precise
     * @throws UnbalancedTransactionException if the amounts do not sum to zero
     * @throws AccountNotFoundException if an account is missing and auto-creation is off
     */
    public Transaction post(PostingRequest request, User actor) {
        validateHeader(request.getDescription(), request.getTransactionDate());
        validateEntries(request.getEntries());

        Transaction transaction = new Transaction(request.getDescription(), request.getTransactionDate());
        transaction.setReference(request.getReference());
        transaction.setCreatedBy(actor);
        transaction.setImportSource(request.getImportSource());
        transaction.setImportBatchId(request.getImportBatchId());
        transaction.setExternalReference(request.getExternalReference());

        for (JournalEntry entry : buildEntries(request.getEntries(), request.isAutoCreateAccounts(), actor)) {
            transaction.addEntry(entry);
        }
        transaction = transactionRepository.save(transaction);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entries", transaction.getEntries().size());
        details.put("amount", transaction.magnitude().toPlainString());
        if (transaction.getImportSource() != null) {
            details.put("importSource", transaction.getImportSource());
        }
        auditService.logEvent(
            actor,
            "TRANSACTION_POSTED",
            "Transaction",
            transaction.getId(),
            "Posted transaction: " + transaction.getDescription(),
            details
        );
        log.info("Posted transaction {} '{}' on {} with {} entries",
            transaction.getId(), transaction.getDescription(),
            transaction.getTransactionDate(), transaction.getEntries().size());

        return transaction;
    }

    /**
     * Posts a two-entry transfer. Accounts must exist.
     */
    public Transaction transfer(String description, LocalDate date, String fromPath, String toPath,
                                BigDecimal amount, User actor) {
        return post(PostingRequest.transfer(description, date, fromPath, toPath, amount), actor);
    }

    public Transaction income(String description, LocalDate date, String incomePath, String assetPath,
                              BigDecimal amount, User actor) {
        return post(PostingRequest.income(description, date, incomePath, assetPath, amount), actor);
    }

    public Transaction expense(String description, LocalDate date, String expensePath, String paymentPath,
                               BigDecimal amount, User actor) {
        return post(PostingRequest.expense(description, date, expensePath, paymentPath, amount), actor);
    }

    /**
     * Replaces the whole entry set of a stored transaction. The new set is checked exactly like a
     * new posting; readers never see a mix of old and new entries.
     */
    public Transaction replaceEntries(Long transactionId, List<EntryRequest> entries, User actor) {
        validateEntries(entries);
        Transaction transaction = transactionRepository.findByIdForUpdate(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));

        transaction.replaceEntries(buildEntries(entries, false, actor));
        transaction = transactionRepository.save(transaction);

        auditService.logEvent(
            actor,
            "TRANSACTION_ENTRIES_REPLACED",
            "Transaction",
            transaction.getId(),
            "Replaced entries of transaction: " + transaction.getDescription()
        );
        log.info("Replaced entries of transaction {} ({} entries)", transactionId, entries.size());
        return transaction;
    }

    /**
     * Deletes a transaction, its entries and every match row involving it. Refused while other
     * transactions are merged into it.
     */
    public void deleteTransaction(Long transactionId, User actor) {
        Transaction transaction = transactionRepository.findByIdForUpdate(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));

        long merged = transactionRepository.countByMergedInto(transaction);
        if (merged > 0) {
            throw new MergedDuplicatesExistException(transactionId, merged);
        }

        List<TransactionMatch> matches = matchRepository.findInvolving(transaction);
        matchRepository.deleteAll(matches);
        String description = transaction.getDescription();
        transactionRepository.delete(transaction);

        auditService.logEvent(
            actor,
            "TRANSACTION_DELETED",
            "Transaction",
            transactionId,
            "Deleted transaction: " + description
        );
        log.info("Deleted transaction {} and {} match row(s)", transactionId, matches.size());
    }

    @Transactional(readOnly = true)
    public Transaction findTransaction(Long transactionId) {
        return transactionRepository.findWithEntries(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /** Transactions in a date range, hidden duplicates excluded. */
    @Transactional(readOnly = true)
    public List<Transaction> findVisibleTransactions(LocalDate from, LocalDate to) {
        return transactionRepository.findVisibleBetween(from, to);
    }

    @Transactional(readOnly = true)
    public List<Transaction> findByImportBatch(UUID importBatchId) {
        return transactionRepository.findByImportBatchIdOrderByTransactionDate(importBatchId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findVisibleEntriesForAccount(Account account, LocalDate from, LocalDate to) {
        return journalEntryRepository.findVisibleByAccountAndDateRange(account, from, to);
    }

    @Transactional(readOnly = true)
    public List<Transaction> findRecent(int limit) {
        return transactionRepository.findRecent(PageRequest.of(0, limit));
    }

    /**
     * Re-checks a stored transaction.
     *
     * @throws LedgerIntegrityException if its entries do not sum to zero
     */
    @Transactional(readOnly = true)
    public void verifyBalanced(Transaction transaction) {
        if (!transaction.isBalanced()) {
            throw new LedgerIntegrityException("Stored transaction " + transaction.getId()
                + " does not balance: entries sum to " + transaction.entrySum().toPlainString());
        }
    }

    /**
     * Sweeps the whole store for unbalanced transactions.
     *
     * @throws LedgerIntegrityException naming the offending transactions
     */
    @Transactional(readOnly = true)
    public void verifyLedger() {
        List<Long> unbalanced = journalEntryRepository.findUnbalancedTransactionIds();
        if (!unbalanced.isEmpty()) {
            log.error("Found {} unbalanced transaction(s): {}", unbalanced.size(), unbalanced);
            throw new LedgerIntegrityException("Unbalanced transactions in store: " + unbalanced);
        }
    }

    /**
     * Validates entry count, amount precision and balance, in that order.
     */
    public void validateEntries(List<EntryRequest> entries) {
        int count = entries == null ? 0 : entries.size();
        if (count < 2) {
            throw new EmptyTransactionException(count);
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < entries.size(); i++) {
            BigDecimal amount = entries.get(i).amount();
            if (amount == null) {
                throw new InvalidAmountException("Entry " + (i + 1) + " has no amount");
            }
            if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
                throw new InvalidAmountException("Entry " + (i + 1) + " amount " + amount.toPlainString()
                    + " has more than " + AMOUNT_SCALE + " decimal places");
            }
            sum = sum.add(amount);
        }

        // Exact comparison: 0.001 is not zero
        if (sum.signum() != 0) {
            log.warn("Rejected unbalanced transaction, entries sum to {}", sum.toPlainString());
            throw new UnbalancedTransactionException(sum);
        }
    }

    private void validateHeader(String description, LocalDate date) {
        if (description == null || description.isBlank()) {
            throw new LedgerValidationException("Transaction description is required");
        }
        if (date == null) {
            throw new LedgerValidationException("Transaction date is required");
        }
    }

    private List<JournalEntry> buildEntries(List<EntryRequest> requests, boolean autoCreate, User actor) {
        List<JournalEntry> entries = new ArrayList<>();
        for (EntryRequest request : requests) {
            Account account = resolveAccount(request, autoCreate, actor);
            if (!account.isActive()) {
                throw new InvalidAccountException(List.of("account " + account.getFullPath() + " is inactive"));
            }
            entries.add(new JournalEntry(account, request.amount(), request.memo()));
        }
        return entries;
    }

    private Account resolveAccount(EntryRequest request, boolean autoCreate, User actor) {
        if (request.accountId() != null) {
            return accountService.findById(request.accountId())
                .orElseThrow(() -> new AccountNotFoundException(request.accountReference()));
        }
        if (request.accountPath() == null) {
            throw new LedgerValidationException("Entry names no account");
        }
        if (autoCreate) {
            return accountService.resolveOrCreate(
                request.accountPath(), null, Account.AccountSubtype.CATEGORY, actor);
        }
        return accountService.findByPath(request.accountPath())
            .orElseThrow(() -> new AccountNotFoundException(request.accountPath()));
    }
}
