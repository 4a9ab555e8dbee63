package com.fintech.marketdata.domain;

/**
 * Logical partitions of the time-series store, one per record kind.
 */
public enum Bucket {

    TRADES("trades", Trade.class),
    DEPTHS("depths", Depth.class),
    FEATURES("features", FeatureRecord.class),
    PRICES("prices", PriceRecord.class);

    private final String bucketName;
    private final Class<?> recordType;

    Bucket(String bucketName, Class<?> recordType) {
        this.bucketName = bucketName;
        this.recordType = recordType;
    }

    /** Returns the on-disk namespace name. */
    public String bucketName() {
        return bucketName;
    }

    /** Returns the record type stored in this bucket. */
    public Class<?> recordType() {
        return recordType;
    }

    /**
     * Resolves a bucket from its namespace name.
     *
     * @throws IllegalArgumentException if no bucket has that name
     */
    public static Bucket fromName(String name) {
        for (Bucket bucket : values()) {
            if (bucket.bucketName.equalsIgnoreCase(name)) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Unknown bucket: " + name);
    }
}
