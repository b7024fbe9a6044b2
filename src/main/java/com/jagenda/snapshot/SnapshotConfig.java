package com.jagenda.snapshot;

import com.jagenda.storage.MalformedLinePolicy;

/**
 * Configuration for snapshot files.
 */
public class SnapshotConfig {
    private final MalformedLinePolicy malformedLinePolicy;
    private final String listingTitle;

    private SnapshotConfig(Builder builder) {
        this.malformedLinePolicy = builder.malformedLinePolicy;
        this.listingTitle = builder.listingTitle;
    }

    public static SnapshotConfig defaults() {
        return new Builder().build();
    }

    public MalformedLinePolicy getMalformedLinePolicy() {
        return malformedLinePolicy;
    }

    public String getListingTitle() {
        return listingTitle;
    }

    public static class Builder {
        private MalformedLinePolicy malformedLinePolicy = MalformedLinePolicy.FAIL;
        private String listingTitle = "PHONE BOOK";

        public Builder setMalformedLinePolicy(MalformedLinePolicy malformedLinePolicy) {
            if (malformedLinePolicy == null) {
                throw new IllegalArgumentException("Malformed line policy must not be null");
            }
            this.malformedLinePolicy = malformedLinePolicy;
            return this;
        }

        public Builder setListingTitle(String listingTitle) {
            if (listingTitle == null || listingTitle.isBlank()) {
                throw new IllegalArgumentException("Listing title must not be blank");
            }
            this.listingTitle = listingTitle;
            return this;
        }

        public SnapshotConfig build() {
            return new SnapshotConfig(this);
        }
    }
}
