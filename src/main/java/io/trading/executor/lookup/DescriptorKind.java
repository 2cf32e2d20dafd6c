package io.trading.executor.lookup;

/**
 * Descriptor families and the directory each lives in under a search location.
 */
public enum DescriptorKind {
    TRADING_RULE("trading_rules", "trading rule"),
    COMMISSION_RATE("commission_rates", "commission rate");

    private final String directory;
    private final String displayName;

    DescriptorKind(String directory, String displayName) {
        this.directory = directory;
        this.displayName = displayName;
    }

    public String getDirectory() {
        return directory;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
