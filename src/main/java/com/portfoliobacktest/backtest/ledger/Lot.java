package com.portfoliobacktest.backtest.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * An open quantity left over from a single fill, waiting for an opposing fill.
 * Entry commission not yet allocated to a closed trade travels with the lot.
 */
@Getter
@ToString
public class Lot {

    static final int COMMISSION_SCALE = 8;

    private final String instrumentId;
    private final Side side;
    private final BigDecimal entryPrice;
    private final LocalDateTime entryTime;
    private final String orderId;

    private long remainingQuantity;
    private BigDecimal remainingCommission;

    Lot(String instrumentId, Side side, long quantity, BigDecimal entryPrice,
        LocalDateTime entryTime, BigDecimal commission, String orderId) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Lot quantity must be positive: " + quantity);
        }
        this.instrumentId = instrumentId;
        this.side = side;
        this.remainingQuantity = quantity;
        this.entryPrice = entryPrice;
        this.entryTime = entryTime;
        this.remainingCommission = commission;
        this.orderId = orderId;
    }

    /**
     * Consume {@code quantity} from this lot and return the share of entry commission
     * that goes with it. The final consumption takes whatever commission is left so that
     * rounding never loses or invents money.
     */
    BigDecimal consume(long quantity) {
        if (quantity <= 0 || quantity > remainingQuantity) {
            throw new IllegalArgumentException("Cannot consume " + quantity + " from lot with "
                    + remainingQuantity + " remaining");
        }
        BigDecimal share;
        if (quantity == remainingQuantity) {
            share = remainingCommission;
        } else {
            share = remainingCommission
                    .multiply(BigDecimal.valueOf(quantity))
                    .divide(BigDecimal.valueOf(remainingQuantity), COMMISSION_SCALE, RoundingMode.HALF_UP);
        }
        remainingQuantity -= quantity;
        remainingCommission = remainingCommission.subtract(share);
        return share;
    }

    public boolean isClosed() {
        return remainingQuantity == 0;
    }
}
