package com.example.ledger.service;

import java.math.BigDecimal;

import com.example.ledger.domain.MatchCriteria;
import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch.MatchTier;

/** A transaction proposed as a duplicate of a reference transaction, with its score. */
public record DuplicateCandidate(
    Transaction candidate, BigDecimal confidence, MatchTier tier, MatchCriteria criteria) {}
