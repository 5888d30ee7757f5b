package com.jctaxes.lots;

import com.jctaxes.datasource.ParcelFragment;
import com.jctaxes.datasource.PaymentRecord;

/**
 * The ways parcel geometry and payment records can be joined, from finest to coarsest. The same key function is
 * applied to both sides of the join, so a parcel fragment and a payment record meet when their keys are equal.
 */
public enum JoinKeys {

    /** block-lot-qualifier, one key per condominium unit. A missing qualifier yields a trailing dash. */
    UNIT {
        @Override
        public String key (String block, String lot, String qualifier) {
            if (block == null || lot == null) return null;
            return block + "-" + lot + "-" + (qualifier == null ? "" : qualifier);
        }
    },

    /** block-lot, all units of a lot share one key. */
    LOT {
        @Override
        public String key (String block, String lot, String qualifier) {
            if (block == null || lot == null) return null;
            return block + "-" + lot;
        }
    },

    /** City block number alone. */
    BLOCK {
        @Override
        public String key (String block, String lot, String qualifier) {
            return block;
        }
    };

    /** @return the join key, or null if the identifiers this granularity needs are missing. */
    public abstract String key (String block, String lot, String qualifier);

    public String of (ParcelFragment fragment) {
        return key(fragment.block, fragment.lot, fragment.qualifier);
    }

    public String of (PaymentRecord record) {
        return key(record.block, record.lot, record.qualifier);
    }

}
