package com.bankjob.ledger;

import com.bankjob.support.AmountParser;
import com.bankjob.support.DateTimes;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a bank statement: a withdrawal, deposit, transfer and so on.
 *
 * <p>Extraction fills in the raw fields (date, value date, raw description, amount and new balance,
 * the money values kept as the exact text the bank showed). Transaction rules then refine the
 * description, type, check number and payee before the transaction is placed in a
 * {@link Statement}.</p>
 *
 * <p>Identity is the tuple {@code (date, rawDescription, amount, type, newBalance)} with the date
 * compared through its {@code yyyyMMddHHmmss} encoding. {@link #equals}, {@link #hashCode} and the
 * generated {@link #getId() id} all derive from it, so two scrapes of the same bank entry compare
 * equal however their date text was formatted. The value date is not part of the identity because
 * banks often fill it in later. Rules may still change the amount or type, but doing so after the
 * id has been read leaves the cached id stale.</p>
 */
public final class Transaction {

    private static final String ID_SEPARATOR = ":";

    public static final int RECORD_FIELD_COUNT = 9;

    public static final List<String> RECORD_HEADER =
            List.of(
                    "Date",
                    "Value-Date",
                    "Description",
                    "Amount",
                    "New-Balance",
                    "Raw-Amount",
                    "Raw-New-Balance",
                    "Raw-Description",
                    "OFX-ID");

    private LocalDateTime date;
    private LocalDateTime valueDate;
    private String rawDescription;
    private String description;
    private String amount = "0";
    private String newBalance = "0";
    private final char decimalSeparator;
    private TransactionType type = TransactionType.OTHER;
    private Payee payee;
    private String checkNumber;
    private String id;

    public Transaction() {
        this(AmountParser.PERIOD);
    }

    /**
     * @param decimalSeparator separator used in {@link #getAmount()} and {@link #getNewBalance()},
     *     {@code '.'} or {@code ','}
     */
    public Transaction(char decimalSeparator) {
        AmountParser.checkSeparator(decimalSeparator);
        this.decimalSeparator = decimalSeparator;
    }

    /**
     * Rebuilds a transaction from the nine CSV fields written by {@link #toRecordRow()}. The derived
     * numeric columns (3 and 4) are ignored and the stored id is kept as-is.
     *
     * @throws RecordFormatException if the row does not have exactly nine fields
     * @throws java.time.format.DateTimeParseException if a date field cannot be parsed
     */
    public static Transaction fromRecordRow(List<String> row, char decimalSeparator)
            throws RecordFormatException {
        Objects.requireNonNull(row, "row");
        if (row.size() != RECORD_FIELD_COUNT) {
            throw new RecordFormatException(
                    "Failed to create transaction from row "
                            + row
                            + ": 9 fields are required in the form: date, value_date, description,"
                            + " real_amount, real_new_balance, amount, new_balance,"
                            + " raw_description, id");
        }
        Transaction tx = new Transaction(decimalSeparator);
        tx.setDate(row.get(0));
        tx.setValueDate(row.get(1));
        tx.setDescription(row.get(2));
        tx.setAmount(row.get(5));
        tx.setNewBalance(row.get(6));
        tx.setRawDescription(row.get(7));
        tx.setId(row.get(8).isEmpty() ? null : row.get(8));
        return tx;
    }

    /** Duplicates every field, including a cached or assigned id. */
    public Transaction copy() {
        Transaction copy = new Transaction(decimalSeparator);
        copy.date = date;
        copy.valueDate = valueDate;
        copy.rawDescription = rawDescription;
        copy.description = description;
        copy.amount = amount;
        copy.newBalance = newBalance;
        copy.type = type;
        copy.payee = payee == null ? null : payee.copy();
        copy.checkNumber = checkNumber;
        copy.id = id;
        return copy;
    }

    /**
     * Stable identifier used as the OFX {@code FITID}: the MD5 digest of the identity fields. It is
     * computed on first use and then cached; an id set explicitly (for instance read back from a CSV
     * file) is never recomputed.
     */
    public String getId() {
        if (id == null) {
            id = digest(identityText());
        }
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    /** The description, falling back to the raw description when no rule customised it. */
    public String getDescription() {
        return description == null ? rawDescription : description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /** {@code "<payee name> - <description>"} when a named payee is present. */
    public String getEffectiveDescription() {
        if (payee != null && payee.hasName()) {
            return payee.getName() + " - " + getDescription();
        }
        return getDescription();
    }

    public BigDecimal getRealAmount() {
        return AmountParser.parse(amount, decimalSeparator);
    }

    public BigDecimal getRealNewBalance() {
        return AmountParser.parse(newBalance, decimalSeparator);
    }

    /** The nine CSV fields, in {@link #RECORD_HEADER} order. */
    public List<String> toRecordRow() {
        return List.of(
                DateTimes.toRecord(date),
                DateTimes.toRecord(valueDate),
                nullToEmpty(getEffectiveDescription()),
                plain(getRealAmount()),
                plain(getRealNewBalance()),
                nullToEmpty(amount),
                nullToEmpty(newBalance),
                nullToEmpty(rawDescription),
                getId());
    }

    /** {@code STMTTRN} aggregate. */
    public OfxElement toOfxElement() {
        return OfxElement.aggregate("STMTTRN")
                .leaf("TRNTYPE", type.name())
                .leaf("DTPOSTED", DateTimes.toInterchange(date))
                .leaf("TRNAMT", amount)
                .leaf("FITID", getId())
                .optionalLeaf("CHECKNUM", checkNumber)
                .child(payee == null ? null : payee.toOfxElement())
                .leaf("MEMO", getEffectiveDescription())
                .build();
    }

    public LocalDateTime getDate() {
        return date;
    }

    public void setDate(LocalDateTime date) {
        this.date = date;
    }

    /**
     * @throws java.time.format.DateTimeParseException if {@code rawDate} is not a recognised date
     */
    public void setDate(String rawDate) {
        this.date = DateTimes.parseFlexible(rawDate);
    }

    public LocalDateTime getValueDate() {
        return valueDate;
    }

    public void setValueDate(LocalDateTime valueDate) {
        this.valueDate = valueDate;
    }

    /**
     * @throws java.time.format.DateTimeParseException if {@code rawDate} is not a recognised date
     */
    public void setValueDate(String rawDate) {
        this.valueDate = DateTimes.parseFlexible(rawDate);
    }

    public String getRawDescription() {
        return rawDescription;
    }

    public void setRawDescription(String rawDescription) {
        this.rawDescription = rawDescription;
    }

    public boolean isDescriptionCustomized() {
        return description != null && !description.equals(rawDescription);
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    public String getNewBalance() {
        return newBalance;
    }

    public void setNewBalance(String newBalance) {
        this.newBalance = newBalance;
    }

    public char getDecimalSeparator() {
        return decimalSeparator;
    }

    public TransactionType getType() {
        return type;
    }

    public void setType(TransactionType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Payee getPayee() {
        return payee;
    }

    public void setPayee(Payee payee) {
        this.payee = payee;
    }

    public String getCheckNumber() {
        return checkNumber;
    }

    public void setCheckNumber(String checkNumber) {
        this.checkNumber = checkNumber;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Transaction)) {
            return false;
        }
        Transaction that = (Transaction) other;
        return DateTimes.toInterchange(date).equals(DateTimes.toInterchange(that.date))
                && nullToEmpty(rawDescription).equals(nullToEmpty(that.rawDescription))
                && Objects.equals(amount, that.amount)
                && type == that.type
                && Objects.equals(newBalance, that.newBalance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                DateTimes.toInterchange(date), nullToEmpty(rawDescription), amount, type, newBalance);
    }

    @Override
    public String toString() {
        return "Transaction - id: "
                + id
                + ", date: "
                + DateTimes.toInterchange(date)
                + ", raw description: "
                + rawDescription
                + ", type: "
                + type
                + ", amount: "
                + amount
                + ", new balance: "
                + newBalance;
    }

    private String identityText() {
        return String.join(
                ID_SEPARATOR,
                DateTimes.toInterchange(date),
                nullToEmpty(rawDescription),
                type.name(),
                nullToEmpty(amount),
                nullToEmpty(newBalance));
    }

    private static String digest(String text) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest unavailable", ex);
        }
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
