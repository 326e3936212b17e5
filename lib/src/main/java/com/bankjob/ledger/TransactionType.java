package com.bankjob.ledger;

/** OFX {@code TRNTYPE} values. */
public enum TransactionType {
    /** Generic credit. */
    CREDIT,
    /** Generic debit. */
    DEBIT,
    /** Interest earned or paid, depending on the sign of the amount. */
    INT,
    /** Dividend. */
    DIV,
    /** Financial institution fee. */
    FEE,
    /** Service charge. */
    SRVCHG,
    /** Deposit. */
    DEP,
    /** ATM debit or credit, depending on the sign of the amount. */
    ATM,
    /** Point of sale debit or credit, depending on the sign of the amount. */
    POS,
    /** Transfer. */
    XFER,
    /** Check (cheque). */
    CHECK,
    /** Electronic payment. */
    PAYMENT,
    /** Cash withdrawal. */
    CASH,
    /** Direct deposit. */
    DIRECTDEP,
    /** Merchant initiated debit. */
    DIRECTDEBIT,
    /** Repeating payment or standing order. */
    REPEATPMT,
    /** Anything else; rules usually narrow this down. */
    OTHER
}
