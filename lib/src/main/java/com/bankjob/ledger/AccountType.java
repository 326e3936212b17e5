package com.bankjob.ledger;

/** OFX {@code ACCTTYPE} values for bank accounts. */
public enum AccountType {
    CHECKING,
    SAVINGS,
    MONEYMRKT,
    CREDITLINE
}
