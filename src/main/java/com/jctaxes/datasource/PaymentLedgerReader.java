package com.jctaxes.datasource;

import com.csvreader.CsvReader;
import com.jctaxes.util.SkipCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the payment ledger: one CSV row per account and year with the amounts billed and paid. Amounts may carry
 * currency formatting ($1,234.56). Rows with unreadable numbers are skipped and counted.
 */
public abstract class PaymentLedgerReader {

    private static final Logger LOG = LoggerFactory.getLogger(PaymentLedgerReader.class);

    public static final String BAD_NUMBER = "unparseable year or amount";

    public static List<PaymentRecord> read (File file) {
        List<PaymentRecord> records = new ArrayList<>();
        SkipCounts skipCounts = new SkipCounts(LOG, "Reading payment ledger", 100_000);
        try (InputStream inputStream = new FileInputStream(file)) {
            CsvReader reader = new CsvReader(inputStream, ',', StandardCharsets.UTF_8);
            CsvColumns columns = new CsvColumns(reader, file);
            int blockCol = columns.required("Block");
            int lotCol = columns.required("Lot");
            int qualCol = columns.optional("Qualifier");
            int yearCol = columns.required("Year");
            int billedCol = columns.required("Billed");
            int paidCol = columns.required("Paid");
            while (reader.readRecord()) {
                skipCounts.seen();
                try {
                    records.add(new PaymentRecord(
                        columns.get(blockCol),
                        columns.get(lotCol),
                        columns.get(qualCol),
                        Integer.parseInt(columns.get(yearCol)),
                        parseAmount(columns.get(billedCol)),
                        parseAmount(columns.get(paidCol))
                    ));
                } catch (NumberFormatException e) {
                    LOG.debug("Skipping ledger record {}: {}", reader.getCurrentRecord(), e.getMessage());
                    skipCounts.skipped(BAD_NUMBER);
                }
            }
        } catch (IOException e) {
            throw new DataSourceException("Could not read payment ledger " + file, e);
        }
        skipCounts.logSummary();
        return records;
    }

    /** Parse a currency amount. A blank amount is zero. */
    static double parseAmount (String text) {
        if (text == null) {
            return 0;
        }
        String digits = text.replace("$", "").replace(",", "").trim();
        if (digits.isEmpty()) {
            return 0;
        }
        // Accounting notation for negative amounts.
        if (digits.startsWith("(") && digits.endsWith(")")) {
            return -Double.parseDouble(digits.substring(1, digits.length() - 1));
        }
        return Double.parseDouble(digits);
    }

}
