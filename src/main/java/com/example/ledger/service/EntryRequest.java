package com.example.ledger.service;

import java.math.BigDecimal;

/**
 * One requested posting. The account is named either by id or by colon-delimited path; when both
 * are given the id wins.
 */
public record EntryRequest(Long accountId, String accountPath, BigDecimal amount, String memo) {

    public static EntryRequest byId(Long accountId, BigDecimal amount) {
        return new EntryRequest(accountId, null, amount, null);
    }

    public static EntryRequest byId(Long accountId, BigDecimal amount, String memo) {
        return new EntryRequest(accountId, null, amount, memo);
    }

    public static EntryRequest byPath(String accountPath, BigDecimal amount) {
        return new EntryRequest(null, accountPath, amount, null);
    }

    public static EntryRequest byPath(String accountPath, BigDecimal amount, String memo) {
        return new EntryRequest(null, accountPath, amount, memo);
    }

    /** Human readable account reference for error messages. */
    public String accountReference() {
        return accountId != null ? "#" + accountId : accountPath;
    }
}
