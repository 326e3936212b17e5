package com.bankjob.ledger;

import com.bankjob.support.DateTimes;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The transactions of one bank account over one period, plus the account details and closing
 * balances that go into an OFX statement response.
 *
 * <p>Transactions must be kept in one chronological order, consistently across every statement
 * that will be merged together. The defaults assume the order banks usually list them in, most
 * recent first: unless set explicitly, the closing balances are the new balance of the first
 * transaction, {@link #getToDate()} is the date of the first transaction and
 * {@link #getFromDate()} the date of the last one. Unset values are derived on every read, so
 * they follow the transaction list until {@link #finish()} pins them.</p>
 *
 * <p>{@link #merge(Statement)} and {@link #mergeInPlace(Statement)} combine two scrapes of
 * overlapping periods into one list without duplicates, refusing combinations that would leave a
 * gap or an interleave in the ledger.</p>
 */
public final class Statement {

    public static final String DEFAULT_CURRENCY = "EUR";

    private static final Logger LOGGER = Logger.getLogger(Statement.class.getName());

    private final List<Transaction> transactions = new ArrayList<>();
    private String accountNumber;
    private AccountType accountType = AccountType.CHECKING;
    private String bankId;
    private String currency;
    private String closingBalance;
    private String closingAvailable;
    private LocalDateTime fromDate;
    private LocalDateTime toDate;

    public Statement() {
        this(null);
    }

    public Statement(String accountNumber) {
        this(accountNumber, DEFAULT_CURRENCY);
    }

    public Statement(String accountNumber, String currency) {
        this.accountNumber = accountNumber;
        this.currency = currency == null ? DEFAULT_CURRENCY : currency;
    }

    /** Deep copy: the transactions are copied too. */
    public Statement copy() {
        Statement copy = copyAttributes();
        for (Transaction transaction : snapshot()) {
            copy.transactions.add(transaction.copy());
        }
        return copy;
    }

    public synchronized void addTransaction(Transaction transaction) {
        transactions.add(Objects.requireNonNull(transaction, "transaction"));
    }

    public synchronized void setTransactions(List<Transaction> replacement) {
        List<Transaction> copy = List.copyOf(replacement);
        transactions.clear();
        transactions.addAll(copy);
    }

    /** Read-only view, in statement order. The transactions themselves remain mutable. */
    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Returns a new statement holding the transactions of this statement followed by those of
     * {@code other} that this one does not already contain. Neither input is modified; the result
     * shares transaction instances with them. Its closing balances and date range are unset so
     * they derive from the merged list.
     *
     * <p>Both statements must use the same chronological order and {@code other} must continue
     * this one: its transactions that are already here have to be the tail of this statement and
     * the head of {@code other}. A statement whose transactions are all present already merges as
     * a no-op, which makes re-merging the same scrape safe.</p>
     *
     * <p>A statement may list the same transaction twice (two identical entries on one day). Both
     * are kept, but such a statement only merges with one that adds nothing new to it.</p>
     *
     * @throws MergeConflictException if {@code other} does not extend this statement contiguously
     */
    public Statement merge(Statement other) throws MergeConflictException {
        Objects.requireNonNull(other, "other");
        List<Transaction> union = mergeTransactions(snapshot(), other.snapshot(), other);
        Statement merged = copyAttributes();
        merged.closingBalance = null;
        merged.closingAvailable = null;
        merged.fromDate = null;
        merged.toDate = null;
        merged.transactions.addAll(union);
        return merged;
    }

    /**
     * Same as {@link #merge(Statement)} but replaces this statement's transactions. On failure
     * this statement is left untouched.
     *
     * @throws MergeConflictException if {@code other} does not extend this statement contiguously
     */
    public void mergeInPlace(Statement other) throws MergeConflictException {
        Objects.requireNonNull(other, "other");
        // other's lock is released before this one is taken
        List<Transaction> incoming = other.snapshot();
        synchronized (this) {
            List<Transaction> union =
                    mergeTransactions(new ArrayList<>(transactions), incoming, other);
            transactions.clear();
            transactions.addAll(union);
            closingBalance = null;
            closingAvailable = null;
            fromDate = null;
            toDate = null;
        }
    }

    /**
     * Whether every transaction of {@code other} is already listed here, so merging it in either
     * direction adds nothing.
     */
    public boolean containsAll(Statement other) {
        Objects.requireNonNull(other, "other");
        return new HashSet<>(snapshot()).containsAll(other.snapshot());
    }

    /** Pins the derived closing balances and date range to their current values. */
    public synchronized void finish() {
        closingBalance = getClosingBalance();
        closingAvailable = getClosingAvailable();
        fromDate = getFromDate();
        toDate = getToDate();
    }

    private synchronized List<Transaction> snapshot() {
        return new ArrayList<>(transactions);
    }

    private List<Transaction> mergeTransactions(
            List<Transaction> existing, List<Transaction> incoming, Statement other)
            throws MergeConflictException {
        Set<Transaction> known = new HashSet<>(existing);
        List<Transaction> union = new ArrayList<>(existing);
        int added = 0;
        for (Transaction transaction : incoming) {
            if (known.add(transaction)) {
                union.add(transaction);
                added++;
            }
        }

        if (added > 0) {
            int start = union.indexOf(incoming.get(0));
            for (int i = 0; i < incoming.size(); i++) {
                int position = start + i;
                if (position >= union.size() || !union.get(position).equals(incoming.get(i))) {
                    throw conflict(
                            other,
                            incoming.get(i),
                            "incoming transactions do not continue the existing ones contiguously");
                }
            }
        }

        LOGGER.log(
                Level.FINE,
                "Merged {0} new transaction(s) into statement {1}",
                new Object[] {added, getDateRange()});
        return union;
    }

    private MergeConflictException conflict(Statement other, Transaction offending, String reason) {
        return new MergeConflictException(getDateRange(), other.getDateRange(), offending, reason);
    }

    private Statement copyAttributes() {
        Statement copy = new Statement(accountNumber, currency);
        copy.accountType = accountType;
        copy.bankId = bankId;
        copy.closingBalance = closingBalance;
        copy.closingAvailable = closingAvailable;
        copy.fromDate = fromDate;
        copy.toDate = toDate;
        return copy;
    }

    /** CSV rows for every transaction, in statement order. */
    public List<List<String>> toRecordRows() {
        List<Transaction> current = snapshot();
        List<List<String>> rows = new ArrayList<>(current.size());
        for (Transaction transaction : current) {
            rows.add(transaction.toRecordRow());
        }
        return rows;
    }

    /** {@code STMTTRNRS} aggregate wrapping the statement response. */
    public OfxElement toOfxElement() {
        String asOf = DateTimes.toInterchange(getToDate());
        OfxElement.Builder transactionList =
                OfxElement.aggregate("BANKTRANLIST")
                        .leaf("DTSTART", DateTimes.toInterchange(getFromDate()))
                        .leaf("DTEND", asOf);
        for (Transaction transaction : snapshot()) {
            transactionList.child(transaction.toOfxElement());
        }
        OfxElement statementResponse =
                OfxElement.aggregate("STMTRS")
                        .leaf("CURDEF", currency)
                        .child(
                                OfxElement.aggregate("BANKACCTFROM")
                                        .leaf("BANKID", bankId)
                                        .leaf("ACCTID", accountNumber)
                                        .leaf("ACCTTYPE", accountType.name())
                                        .build())
                        .child(transactionList.build())
                        .child(
                                OfxElement.aggregate("LEDGERBAL")
                                        .leaf("BALAMT", getClosingBalance())
                                        .leaf("DTASOF", asOf)
                                        .build())
                        .child(
                                OfxElement.aggregate("AVAILBAL")
                                        .leaf("BALAMT", getClosingAvailable())
                                        .leaf("DTASOF", asOf)
                                        .build())
                        .build();
        return OfxElement.aggregate("STMTTRNRS").child(statementResponse).build();
    }

    /** {@code yyyyMMdd-yyyyMMdd} from the date range, as used in output file names. */
    public String getDateRangeLabel() {
        return day(getFromDate()) + "-" + day(getToDate());
    }

    /** Human-readable date range used in diagnostics. */
    public String getDateRange() {
        if (transactions.isEmpty() && fromDate == null && toDate == null) {
            return "[empty]";
        }
        return "[" + DateTimes.toRecord(getFromDate()) + " .. " + DateTimes.toRecord(getToDate()) + "]";
    }

    private static String day(LocalDateTime dateTime) {
        String encoded = DateTimes.toInterchange(dateTime);
        return encoded.length() >= 8 ? encoded.substring(0, 8) : encoded;
    }

    public LocalDateTime getFromDate() {
        if (fromDate != null) {
            return fromDate;
        }
        return transactions.isEmpty() ? null : transactions.get(transactions.size() - 1).getDate();
    }

    public void setFromDate(LocalDateTime fromDate) {
        this.fromDate = fromDate;
    }

    public LocalDateTime getToDate() {
        if (toDate != null) {
            return toDate;
        }
        return transactions.isEmpty() ? null : transactions.get(0).getDate();
    }

    public void setToDate(LocalDateTime toDate) {
        this.toDate = toDate;
    }

    public String getClosingBalance() {
        if (closingBalance != null) {
            return closingBalance;
        }
        return transactions.isEmpty() ? null : transactions.get(0).getNewBalance();
    }

    public void setClosingBalance(String closingBalance) {
        this.closingBalance = closingBalance;
    }

    public String getClosingAvailable() {
        if (closingAvailable != null) {
            return closingAvailable;
        }
        return transactions.isEmpty() ? null : transactions.get(0).getNewBalance();
    }

    public void setClosingAvailable(String closingAvailable) {
        this.closingAvailable = closingAvailable;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public void setAccountNumber(String accountNumber) {
        this.accountNumber = accountNumber;
    }

    public AccountType getAccountType() {
        return accountType;
    }

    public void setAccountType(AccountType accountType) {
        this.accountType = Objects.requireNonNull(accountType, "accountType");
    }

    public String getBankId() {
        return bankId;
    }

    public void setBankId(String bankId) {
        this.bankId = bankId;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Statement)) {
            return false;
        }
        Statement that = (Statement) other;
        return Objects.equals(getFromDate(), that.getFromDate())
                && Objects.equals(getToDate(), that.getToDate())
                && Objects.equals(getClosingBalance(), that.getClosingBalance())
                && Objects.equals(getClosingAvailable(), that.getClosingAvailable())
                && transactions.equals(that.transactions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                getFromDate(), getToDate(), getClosingBalance(), getClosingAvailable(), transactions);
    }

    @Override
    public String toString() {
        StringBuilder builder =
                new StringBuilder("Statement: close_bal = ")
                        .append(getClosingBalance())
                        .append(", avail = ")
                        .append(getClosingAvailable())
                        .append(", curr = ")
                        .append(currency)
                        .append(", transactions:");
        for (Transaction transaction : transactions) {
            builder.append(System.lineSeparator()).append("\t\t").append(transaction);
        }
        return builder.toString();
    }
}
