package com.jctaxes.lots;

import com.jctaxes.datasource.PaymentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Payments for a single tax year, summed per join key. Immutable: adjustments return a new index.
 */
public class PaymentIndex {

    private static final Logger LOG = LoggerFactory.getLogger(PaymentIndex.class);

    public final int year;

    public final JoinKeys joinKeys;

    /** True once omnibus payments have been redistributed. This may only happen once per index lineage. */
    public final boolean omnibusRedistributed;

    private final Map<String, Payment> paymentsByKey;

    private PaymentIndex (int year, JoinKeys joinKeys, Map<String, Payment> paymentsByKey, boolean omnibusRedistributed) {
        this.year = year;
        this.joinKeys = joinKeys;
        this.paymentsByKey = Collections.unmodifiableMap(paymentsByKey);
        this.omnibusRedistributed = omnibusRedistributed;
    }

    /**
     * Sum the ledger records for the given year by join key. At lot and block granularity this adds up the payments
     * of all units in a building.
     */
    public static PaymentIndex build (Collection<PaymentRecord> records, int year, JoinKeys joinKeys) {
        Map<String, Payment> sums = new LinkedHashMap<>();
        int nRecords = 0;
        int nUnkeyed = 0;
        for (PaymentRecord record : records) {
            if (record.year != year) continue;
            String key = joinKeys.of(record);
            if (key == null) {
                nUnkeyed += 1;
                continue;
            }
            sums.merge(key, new Payment(record.paid, record.billed), Payment::plus);
            nRecords += 1;
        }
        if (nUnkeyed > 0) {
            LOG.warn("{} payment records for {} lack the identifiers needed for {} keys.", nUnkeyed, year, joinKeys);
        }
        LOG.info("Indexed {} payment records for {} under {} {} keys.", nRecords, year, sums.size(), joinKeys);
        return new PaymentIndex(year, joinKeys, sums, false);
    }

    /**
     * Apply the omnibus override table. Only meaningful on a lot-keyed index: at unit granularity the source lot key
     * never matches, and at block granularity the split would just move money around inside one block.
     * @throws IllegalStateException if this index has already been redistributed or is not keyed on lots.
     */
    public PaymentIndex withOmnibusRedistribution (OmnibusTable omnibusTable) {
        if (omnibusRedistributed) {
            throw new IllegalStateException("Omnibus payments have already been redistributed in this index.");
        }
        if (joinKeys != JoinKeys.LOT) {
            throw new IllegalStateException("Omnibus redistribution applies only to lot-keyed payments, not " + joinKeys);
        }
        return new PaymentIndex(year, joinKeys, omnibusTable.redistribute(paymentsByKey), true);
    }

    /** A missing key is not an error: lots without any payment record simply paid nothing. */
    public Payment get (String key) {
        return paymentsByKey.getOrDefault(key, Payment.ZERO);
    }

    public boolean contains (String key) {
        return paymentsByKey.containsKey(key);
    }

    public Set<String> keys () {
        return paymentsByKey.keySet();
    }

    public int size () {
        return paymentsByKey.size();
    }

    public Payment total () {
        Payment total = Payment.ZERO;
        for (Payment payment : paymentsByKey.values()) {
            total = total.plus(payment);
        }
        return total;
    }

}
