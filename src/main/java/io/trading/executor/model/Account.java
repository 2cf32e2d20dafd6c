package io.trading.executor.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Account snapshot attached to a request.
 *
 * @param accountId     Account identifier, half of the serialization key
 * @param totalNetValue Total account equity
 * @param availableCash Cash or margin available for new orders
 * @param leverage      Current account leverage
 * @param positions     Open positions
 */
public record Account(
    String accountId,
    BigDecimal totalNetValue,
    BigDecimal availableCash,
    BigDecimal leverage,
    List<Position> positions
) {
    public Account {
        if (accountId == null || accountId.isEmpty()) {
            throw new IllegalArgumentException("accountId cannot be null or empty");
        }
        totalNetValue = totalNetValue == null ? BigDecimal.ZERO : totalNetValue;
        availableCash = availableCash == null ? BigDecimal.ZERO : availableCash;
        leverage = leverage == null ? BigDecimal.ONE : leverage;
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public Optional<Position> position(String symbol) {
        return positions.stream()
            .filter(p -> p.symbol().equals(symbol))
            .findFirst();
    }

    /**
     * Quantity held for a symbol, zero when flat.
     */
    public BigDecimal positionQuantity(String symbol) {
        return position(symbol).map(Position::quantity).orElse(BigDecimal.ZERO);
    }
}
