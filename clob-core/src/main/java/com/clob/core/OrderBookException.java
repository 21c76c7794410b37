package com.clob.core;

/**
 * A recoverable rejection raised by the matching core.
 * <p>
 * Every rejection happens before Book, OrderTable and OwnerOrderRegistry are
 * mutated, so the caller may correct its input and resubmit. Internal
 * inconsistencies are not reported through this type; they surface as
 * {@link IllegalStateException}.
 * </p>
 */
public class OrderBookException extends RuntimeException {

    public enum Category {
        VALIDATION,
        NOT_FOUND,
        AUTHORIZATION,
        SETTLEMENT
    }

    public enum Reason {
        INVALID_PRICE(Category.VALIDATION),
        INVALID_QUANTITY(Category.VALIDATION),
        AMOUNT_OVERFLOW(Category.VALIDATION),
        ORDER_ID_ALREADY_EXISTS(Category.VALIDATION),
        QUEUE_ITEM_ALREADY_EXISTS(Category.VALIDATION),
        ORDER_ID_DOES_NOT_EXIST(Category.NOT_FOUND),
        PRICE_NOT_FOUND(Category.NOT_FOUND),
        QUEUE_EMPTY(Category.NOT_FOUND),
        QUEUE_ITEM_DOES_NOT_EXIST(Category.NOT_FOUND),
        NOT_ORDER_OWNER(Category.AUTHORIZATION),
        SETTLEMENT_FAILED(Category.SETTLEMENT);

        public final Category category;

        Reason(Category category) {
            this.category = category;
        }
    }

    private final Reason reason;

    public OrderBookException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public OrderBookException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public Category category() {
        return reason.category;
    }
}
