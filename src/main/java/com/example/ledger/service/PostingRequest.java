package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.example.ledger.exception.InvalidAmountException;

/**
 * A transaction to be posted: header fields, import provenance and the requested entries.
 *
 * <p>The {@link #transfer}, {@link #income} and {@link #expense} factories build the common
 * two-entry cases. Their amount is always positive and flows from the first account to the
 * second.
 */
public class PostingRequest {

    private final String description;
    private final LocalDate transactionDate;
    private final List<EntryRequest> entries = new ArrayList<>();
    private String reference;
    private boolean autoCreateAccounts;

    // Import provenance
    private String importSource;
    private UUID importBatchId;
    private String externalReference;

    public PostingRequest(String description, LocalDate transactionDate) {
        this.description = description;
        this.transactionDate = transactionDate;
    }

    /** Money leaves {@code fromPath} (credit) and arrives in {@code toPath} (debit). */
    public static PostingRequest transfer(String description, LocalDate date,
                                          String fromPath, String toPath, BigDecimal amount) {
        requirePositive(amount);
        return new PostingRequest(description, date)
            .entry(EntryRequest.byPath(toPath, amount))
            .entry(EntryRequest.byPath(fromPath, amount.negate()));
    }

    /** Income account is credited, asset account debited. */
    public static PostingRequest income(String description, LocalDate date,
                                        String incomePath, String assetPath, BigDecimal amount) {
        return transfer(description, date, incomePath, assetPath, amount);
    }

    /** Paying account (asset or liability) is credited, expense account debited. */
    public static PostingRequest expense(String description, LocalDate date,
                                         String expensePath, String paymentPath, BigDecimal amount) {
        return transfer(description, date, paymentPath, expensePath, amount);
    }

    public PostingRequest entry(EntryRequest entry) {
        entries.add(entry);
        return this;
    }

    public PostingRequest entries(List<EntryRequest> newEntries) {
        entries.addAll(newEntries);
        return this;
    }

    public PostingRequest reference(String reference) {
        this.reference = reference;
        return this;
    }

    /** Missing accounts named by path are created instead of failing the posting. */
    public PostingRequest autoCreateAccounts(boolean autoCreateAccounts) {
        this.autoCreateAccounts = autoCreateAccounts;
        return this;
    }

    public PostingRequest importedFrom(String importSource, UUID importBatchId, String externalReference) {
        this.importSource = importSource;
        this.importBatchId = importBatchId;
        this.externalReference = externalReference;
        return this;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Amount must be positive, got " + amount);
        }
    }

    public String getDescription() {
        return description;
    }

    public LocalDate getTransactionDate() {
        return transactionDate;
    }

    public List<EntryRequest> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public String getReference() {
        return reference;
    }

    public boolean isAutoCreateAccounts() {
        return autoCreateAccounts;
    }

    public String getImportSource() {
        return importSource;
    }

    public UUID getImportBatchId() {
        return importBatchId;
    }

    public String getExternalReference() {
        return externalReference;
    }
}
