package com.bankjob.rules;

import com.bankjob.ledger.TransactionType;
import com.bankjob.support.Words;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Rules most bank scrapers register. */
public final class StandardRules {

    private StandardRules() {}

    /**
     * Types transactions still marked {@code OTHER} as {@code CREDIT} or {@code DEBIT} by the sign
     * of their amount. A zero amount stays {@code OTHER}. Register at {@link RuleEngine#LAST}.
     */
    public static TransactionRule debitOrCreditBySign() {
        return transaction -> {
            if (transaction.getType() != TransactionType.OTHER) {
                return;
            }
            BigDecimal amount = transaction.getRealAmount();
            if (amount == null) {
                return;
            }
            if (amount.signum() > 0) {
                transaction.setType(TransactionType.CREDIT);
            } else if (amount.signum() < 0) {
                transaction.setType(TransactionType.DEBIT);
            }
        };
    }

    /**
     * Title-cases descriptions no other rule has set, so all-uppercase bank text reads better.
     * Register at {@link RuleEngine#LAST}.
     */
    public static TransactionRule capitalizeUncustomized() {
        return transaction -> {
            if (!transaction.isDescriptionCustomized() && transaction.getRawDescription() != null) {
                transaction.setDescription(Words.capitalizeWords(transaction.getRawDescription()));
            }
        };
    }

    /**
     * Marks transactions whose raw description matches {@code pattern} as checks. Group 1 of the
     * pattern is the check number. The description becomes {@code descriptionFormat} formatted with
     * the check number ({@code %1$s}) and the text after the match ({@code %2$s}).
     */
    public static TransactionRule checkNumber(Pattern pattern, String descriptionFormat) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(descriptionFormat, "descriptionFormat");
        return transaction -> {
            String raw = transaction.getRawDescription();
            if (raw == null) {
                return;
            }
            Matcher matcher = pattern.matcher(raw);
            if (!matcher.find()) {
                return;
            }
            String number = matcher.group(1);
            String rest = raw.substring(matcher.end()).trim();
            transaction.setDescription(
                    String.format(Locale.ROOT, descriptionFormat, number, rest).trim());
            transaction.setType(TransactionType.CHECK);
            transaction.setCheckNumber(number);
        };
    }

    /**
     * Marks withdrawals whose raw description matches {@code pattern} as ATM transactions described
     * as {@code prefix} followed by the text after the match.
     */
    public static TransactionRule atmWithdrawal(Pattern pattern, String prefix) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(prefix, "prefix");
        return transaction -> {
            BigDecimal amount = transaction.getRealAmount();
            String raw = transaction.getRawDescription();
            if (amount == null || amount.signum() >= 0 || raw == null) {
                return;
            }
            Matcher matcher = pattern.matcher(raw);
            if (matcher.find()) {
                transaction.setDescription(prefix + raw.substring(matcher.end()));
                transaction.setType(TransactionType.ATM);
            }
        };
    }
}
