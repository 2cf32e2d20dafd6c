package io.trading.executor.error;

/**
 * No search location holds a descriptor for the venue and instrument.
 */
public class NotFoundException extends ExecutorException {

    private final String venue;
    private final String symbol;
    private final String resourceType;

    public NotFoundException(String venue, String symbol, String resourceType) {
        super(String.format("No %s found for %s/%s", resourceType, venue, symbol));
        this.venue = venue;
        this.symbol = symbol;
        this.resourceType = resourceType;
    }

    public String getVenue() {
        return venue;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getResourceType() {
        return resourceType;
    }
}
