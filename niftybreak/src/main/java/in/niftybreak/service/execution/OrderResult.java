package in.niftybreak.service.execution;

import java.math.BigDecimal;

/**
 * Acknowledged order. averagePrice is the requested price when the
 * endpoint does not report a fill price.
 */
public record OrderResult(
    String orderId,
    BigDecimal averagePrice,
    int filledQty,
    String message
) {}
