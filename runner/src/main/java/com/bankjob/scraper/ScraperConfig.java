package com.bankjob.scraper;

import com.bankjob.ledger.AccountType;
import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import com.bankjob.support.AmountParser;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Per-bank settings applied to every statement and transaction a scraper creates. Instances are
 * immutable and validated when built.
 */
public final class ScraperConfig {

    public static final String CURRENCY_PROPERTY = "bankjob.currency";
    public static final String DECIMAL_PROPERTY = "bankjob.decimal";
    public static final String ACCOUNT_NUMBER_PROPERTY = "bankjob.accountNumber";
    public static final String ACCOUNT_TYPE_PROPERTY = "bankjob.accountType";
    public static final String BANK_ID_PROPERTY = "bankjob.bankId";

    private static final Pattern CURRENCY_PATTERN = Pattern.compile("[A-Z]{3}");

    private final String currency;
    private final char decimalSeparator;
    private final String accountNumber;
    private final AccountType accountType;
    private final String bankId;

    private ScraperConfig(Builder builder) {
        this.currency = builder.currency;
        this.decimalSeparator = builder.decimalSeparator;
        this.accountNumber = builder.accountNumber;
        this.accountType = builder.accountType;
        this.bankId = builder.bankId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code bankjob.*} keys; absent keys keep the builder defaults.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    public static ScraperConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String currency = properties.getProperty(CURRENCY_PROPERTY);
        if (currency != null) {
            builder.currency(currency.trim());
        }
        String decimal = properties.getProperty(DECIMAL_PROPERTY);
        if (decimal != null) {
            String trimmed = decimal.trim();
            if (trimmed.length() != 1) {
                throw new IllegalArgumentException(
                        DECIMAL_PROPERTY + " must be a single character but was \"" + decimal + "\"");
            }
            builder.decimalSeparator(trimmed.charAt(0));
        }
        String accountNumber = properties.getProperty(ACCOUNT_NUMBER_PROPERTY);
        if (accountNumber != null) {
            builder.accountNumber(accountNumber.trim());
        }
        String accountType = properties.getProperty(ACCOUNT_TYPE_PROPERTY);
        if (accountType != null) {
            builder.accountType(AccountType.valueOf(accountType.trim().toUpperCase(Locale.ROOT)));
        }
        String bankId = properties.getProperty(BANK_ID_PROPERTY);
        if (bankId != null) {
            builder.bankId(bankId.trim());
        }
        return builder.build();
    }

    /** An empty statement carrying the account details. */
    public Statement createStatement() {
        Statement statement = new Statement(accountNumber, currency);
        statement.setAccountType(accountType);
        statement.setBankId(bankId);
        return statement;
    }

    /** An empty transaction using the configured decimal separator. */
    public Transaction createTransaction() {
        return new Transaction(decimalSeparator);
    }

    public String getCurrency() {
        return currency;
    }

    public char getDecimalSeparator() {
        return decimalSeparator;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public AccountType getAccountType() {
        return accountType;
    }

    public String getBankId() {
        return bankId;
    }

    @Override
    public String toString() {
        return "ScraperConfig{currency="
                + currency
                + ", decimal="
                + decimalSeparator
                + ", account="
                + accountNumber
                + ", type="
                + accountType
                + ", bankId="
                + bankId
                + "}";
    }

    public static final class Builder {
        private String currency = Statement.DEFAULT_CURRENCY;
        private char decimalSeparator = AmountParser.PERIOD;
        private String accountNumber;
        private AccountType accountType = AccountType.CHECKING;
        private String bankId;

        private Builder() {}

        public Builder currency(String currency) {
            this.currency = Objects.requireNonNull(currency, "currency");
            return this;
        }

        public Builder decimalSeparator(char decimalSeparator) {
            this.decimalSeparator = decimalSeparator;
            return this;
        }

        public Builder accountNumber(String accountNumber) {
            this.accountNumber = accountNumber;
            return this;
        }

        public Builder accountType(AccountType accountType) {
            this.accountType = Objects.requireNonNull(accountType, "accountType");
            return this;
        }

        public Builder bankId(String bankId) {
            this.bankId = bankId;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the currency is not a three-letter code, the separator
         *     is not {@code '.'} or {@code ','}, or the account number or bank id is too long
         */
        public ScraperConfig build() {
            if (!CURRENCY_PATTERN.matcher(currency).matches()) {
                throw new IllegalArgumentException("Currency must be a three-letter code: " + currency);
            }
            AmountParser.checkSeparator(decimalSeparator);
            if (accountNumber != null && accountNumber.length() > 22) {
                throw new IllegalArgumentException("Account number longer than 22 characters: " + accountNumber);
            }
            if (bankId != null && bankId.length() > 9) {
                throw new IllegalArgumentException("Bank id longer than 9 characters: " + bankId);
            }
            return new ScraperConfig(this);
        }
    }
}
