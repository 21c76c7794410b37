package com.clob.core;

import com.clob.api.Asset;
import com.clob.api.Ledger;
import com.clob.api.LedgerException;
import com.clob.api.OrderStatus;
import com.clob.api.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * <h1>The Matching Engine: One Instrument, Price-Time Priority</h1>
 *
 * <p>
 * Owns the two {@link Book}s, the {@link OrderTable} and the
 * {@link OwnerOrderRegistry} of a single trading pair and is the only entry
 * point that mutates them.
 * </p>
 *
 * <h2>Single Writer</h2>
 * <p>
 * This class is <b>NOT Thread-Safe</b>. Every {@code submit}/{@code cancel}
 * runs to completion on the caller's thread; concurrent callers must be
 * serialized outside (one sequencer per instrument).
 * </p>
 *
 * <h2>Submit: Plan, Settle, Apply</h2>
 * <ol>
 * <li><b>Plan:</b> walk the opposing book from its best price through each
 * level's FIFO and collect the fills, without touching anything.</li>
 * <li><b>Settle:</b> issue the {@link Ledger} transfers of every fill and the
 * lock of the resting remainder. On a ledger failure the completed transfers
 * are reversed and the call is rejected; the books were never touched.</li>
 * <li><b>Apply:</b> remove or shrink the consumed resting orders, rest the
 * remainder, then emit the domain events.</li>
 * </ol>
 */
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    /**
     * One planned fill against a resting order.
     */
    static final class Fill {
        final Order maker;
        final long quantity;
        final boolean full;
        final long quoteAmount;
        final long fee;
        final long released; // taken off the maker's lock
        final long refund; // truncation dust handed back to a fully filled maker

        Fill(Order maker, long quantity, boolean full, long quoteAmount, long fee, long released, long refund) {
            this.maker = maker;
            this.quantity = quantity;
            this.full = full;
            this.quoteAmount = quoteAmount;
            this.fee = fee;
            this.released = released;
            this.refund = refund;
        }
    }

    private final Book bids = new Book(Side.BUY);
    private final Book asks = new Book(Side.SELL);
    private final OrderTable orders = new OrderTable();
    private final OwnerOrderRegistry owners = new OwnerOrderRegistry();

    private final EngineConfig config;
    private final Ledger ledger;
    private final OrderEventListener listener;
    private final OrderIdGenerator idGenerator;

    private long lastTradePrice;

    public MatchingEngine(EngineConfig config, Ledger ledger, OrderEventListener listener) {
        this(config, ledger, listener, new HashingOrderIdGenerator());
    }

    public MatchingEngine(EngineConfig config, Ledger ledger, OrderEventListener listener,
            OrderIdGenerator idGenerator) {
        this.config = config.validate();
        this.ledger = ledger;
        this.listener = listener;
        this.idGenerator = idGenerator;
    }

    public long submit(long owner, byte side, long price, long quantity, long timestamp) {
        return submit(owner, side, price, quantity, timestamp, 0);
    }

    /**
     * Matches a new limit order against the opposite side and rests whatever
     * is left.
     *
     * @param owner     Account submitting the order (the taker of any fill)
     * @param side      {@link Side#BUY} or {@link Side#SELL}
     * @param price     Limit price, fixed point over {@link EngineConfig#precision}
     * @param quantity  Quantity of the base asset
     * @param timestamp Caller-supplied creation time, part of the id
     * @param expiresAt Stored on the order, not enforced; 0 = never
     * @return The new order id, also when the order was filled completely.
     */
    public long submit(long owner, byte side, long price, long quantity, long timestamp, long expiresAt) {
        if (!Side.isValid(side)) {
            throw new IllegalArgumentException("unknown side " + side);
        }
        if (price <= 0) {
            throw new OrderBookException(OrderBookException.Reason.INVALID_PRICE, "price " + price);
        }
        if (quantity <= 0) {
            throw new OrderBookException(OrderBookException.Reason.INVALID_QUANTITY, "quantity " + quantity);
        }

        long id = idGenerator.nextId(owner, side, price, timestamp);
        if (id == PriceLevelQueue.EMPTY || orders.exists(id)) {
            throw new OrderBookException(OrderBookException.Reason.ORDER_ID_ALREADY_EXISTS, "id " + id);
        }

        // 1. Plan
        Book opposite = bookOf(Side.opposite(side));
        List<Fill> fills = new ArrayList<>();
        long remaining = plan(id, side, price, quantity, opposite, fills);
        long lockAmount = 0;
        if (remaining > 0) {
            lockAmount = lockedAmount(side, price, remaining);
            bookOf(side).ensureCapacity(price, remaining);
        }

        // 2. Settle
        Settlement settlement = new Settlement(ledger, config.escrowAccount);
        try {
            for (Fill fill : fills) {
                settleFill(settlement, owner, side, fill);
            }
            settlement.transfer(Asset.lockedBy(side), owner, config.escrowAccount, lockAmount);
        } catch (LedgerException e) {
            settlement.rollback(e);
            throw new OrderBookException(OrderBookException.Reason.SETTLEMENT_FAILED,
                    "order " + id + " of owner " + owner, e);
        } catch (RuntimeException e) {
            settlement.rollback(e);
            throw e;
        }

        // 3. Apply
        for (Fill fill : fills) {
            applyFill(opposite, fill);
        }
        if (remaining > 0) {
            rest(id, owner, side, price, quantity, remaining, lockAmount, timestamp, expiresAt, !fills.isEmpty());
        }

        publish(id, owner, side, price, quantity, fills, remaining);

        log.debug("Accepted {} {} {} @ {} from owner {}: {} fills, {} resting",
                id, Side.name(side), quantity, price, owner, fills.size(), remaining);
        return id;
    }

    /**
     * Cancels a resting order and returns its locked funds to the owner.
     */
    public void cancel(long orderId, long caller) {
        Order order = orders.get(orderId);
        if (order.owner != caller) {
            throw new OrderBookException(OrderBookException.Reason.NOT_ORDER_OWNER,
                    "order " + orderId + " belongs to " + order.owner + ", not " + caller);
        }

        long refund = order.lockedAmount;
        Settlement settlement = new Settlement(ledger, config.escrowAccount);
        try {
            settlement.transfer(Asset.lockedBy(order.side), config.escrowAccount, order.owner, refund);
        } catch (LedgerException e) {
            settlement.rollback(e);
            throw new OrderBookException(OrderBookException.Reason.SETTLEMENT_FAILED, "cancel of " + orderId, e);
        } catch (RuntimeException e) {
            settlement.rollback(e);
            throw e;
        }

        bookOf(order.side).remove(order);
        orders.delete(orderId);
        owners.remove(order.owner, orderId);
        order.status = OrderStatus.CANCELED;

        listener.onOrderCanceled(orderId, order.owner, order.side, order.price, order.availableQuantity);
        log.debug("Canceled {} of owner {}, refunded {} {}", orderId, order.owner, refund, Asset.lockedBy(order.side));
    }

    // =========================================================================
    // MATCHING
    // =========================================================================

    /**
     * Collects the fills of an incoming order, oldest order first within a
     * price, best price first across prices, stopping after
     * {@link EngineConfig#maxOrdersPerMatch} resting orders.
     *
     * @return The quantity left unmatched.
     */
    private long plan(long id, byte side, long price, long quantity, Book opposite, List<Fill> fills) {
        long remaining = quantity;
        long bookPrice = opposite.bestPrice();
        long restingId = PriceLevelQueue.EMPTY;
        int processed = 0;

        while (remaining > 0
                && bookPrice != PriceIndex.EMPTY
                && crosses(side, price, bookPrice)
                && processed < config.maxOrdersPerMatch) {

            if (restingId == PriceLevelQueue.EMPTY) {
                restingId = opposite.nextOrderIdAtPrice(bookPrice);
            }
            Order resting = orders.get(restingId);

            if (remaining >= resting.availableQuantity) {
                // Full fill of the resting order
                fills.add(fill(side, resting, resting.availableQuantity, true));
                remaining -= resting.availableQuantity;

                restingId = opposite.orderIdAfter(bookPrice, restingId);
                if (restingId == PriceLevelQueue.EMPTY) {
                    bookPrice = opposite.nextPrice(bookPrice);
                }
            } else {
                // Partial fill: the incoming order is used up
                fills.add(fill(side, resting, remaining, false));
                remaining = 0;
            }
            processed++;
        }

        if (remaining > 0 && processed == config.maxOrdersPerMatch && crosses(side, price, bookPrice)) {
            log.warn("Order {} reached the limit of {} resting orders with the book still crossing; {} rests at {}",
                    id, processed, remaining, price);
        }
        return remaining;
    }

    /**
     * Prices one fill at the maker's price. The quote amount is truncated, so
     * a buying taker pays the lower figure and a selling taker receives it.
     */
    private Fill fill(byte takerSide, Order maker, long quantity, boolean full) {
        long quoteAmount = FixedPoint.quoteAmount(quantity, maker.price, config.precision);
        long fee = FixedPoint.fee(takerSide == Side.BUY ? quantity : quoteAmount, config.feeBps);

        long released = takerSide == Side.BUY ? quantity : quoteAmount;
        long refund = 0;
        if (full) {
            // Earlier truncated partial fills leave dust on a buy maker's lock
            refund = maker.lockedAmount - released;
            if (refund < 0) {
                throw new IllegalStateException("lock of " + maker + " short by " + -refund);
            }
            released = maker.lockedAmount;
        }
        return new Fill(maker, quantity, full, quoteAmount, fee, released, refund);
    }

    private static boolean crosses(byte side, long price, long bookPrice) {
        if (bookPrice == PriceIndex.EMPTY) {
            return false;
        }
        return side == Side.BUY ? price >= bookPrice : price <= bookPrice;
    }

    /**
     * The fee is skimmed from what the taker receives. Truncation favors a
     * buying taker; a selling taker gets the truncated quote less the fee.
     */
    private void settleFill(Settlement settlement, long taker, byte takerSide, Fill fill) throws LedgerException {
        long maker = fill.maker.owner;
        Asset makerLock = Asset.lockedBy(fill.maker.side);
        if (takerSide == Side.BUY) {
            settlement.transfer(Asset.QUOTE, taker, maker, fill.quoteAmount);
            settlement.transfer(Asset.BASE, config.escrowAccount, taker, fill.quantity - fill.fee);
            settlement.transferFee(Asset.BASE, config.feeRecipient, fill.fee);
        } else {
            settlement.transfer(Asset.BASE, taker, maker, fill.quantity);
            settlement.transfer(Asset.QUOTE, config.escrowAccount, taker, fill.quoteAmount - fill.fee);
            settlement.transferFee(Asset.QUOTE, config.feeRecipient, fill.fee);
        }
        settlement.transfer(makerLock, config.escrowAccount, maker, fill.refund);
    }

    private void applyFill(Book opposite, Fill fill) {
        Order resting = fill.maker;
        if (fill.full) {
            opposite.remove(resting);
            orders.delete(resting.id);
            owners.remove(resting.owner, resting.id);
            resting.availableQuantity = 0;
            resting.lockedAmount = 0;
            resting.status = OrderStatus.FILLED;
        } else {
            resting.availableQuantity -= fill.quantity;
            resting.lockedAmount -= fill.released;
            resting.status = OrderStatus.PARTIALLY_FILLED;
            opposite.update(resting.price, fill.quantity);
        }
        lastTradePrice = resting.price;
    }

    private void rest(long id, long owner, byte side, long price, long quantity, long remaining, long lockAmount,
            long timestamp, long expiresAt, boolean matched) {
        Order order = new Order();
        order.id = id;
        order.owner = owner;
        order.side = side;
        order.price = price;
        order.originalQuantity = quantity;
        order.availableQuantity = remaining;
        order.lockedAmount = lockAmount;
        order.timestamp = timestamp;
        order.expiresAt = expiresAt;
        order.status = matched ? OrderStatus.PARTIALLY_FILLED : OrderStatus.CREATED;

        orders.create(order);
        bookOf(side).insert(id, price, remaining);
        owners.add(owner, id);
    }

    private void publish(long id, long owner, byte side, long price, long quantity, List<Fill> fills,
            long remaining) {
        long takerLeft = quantity;
        for (Fill fill : fills) {
            Order maker = fill.maker;
            if (fill.full) {
                listener.onOrderFilled(maker.id, maker.owner, owner, maker.side, maker.price, fill.quantity);
            } else {
                listener.onOrderPartiallyFilled(maker.id, maker.owner, owner, maker.side, maker.price, fill.quantity);
            }

            takerLeft -= fill.quantity;
            if (takerLeft == 0) {
                listener.onOrderFilled(id, owner, maker.owner, side, maker.price, fill.quantity);
            } else {
                listener.onOrderPartiallyFilled(id, owner, maker.owner, side, maker.price, fill.quantity);
            }
        }
        if (remaining > 0) {
            listener.onOrderCreated(id, owner, side, price, remaining);
        }
    }

    /**
     * Funds a new resting order of {@code quantity} at {@code price} puts in
     * custody: quote for a buy, base for a sell.
     */
    private long lockedAmount(byte side, long price, long quantity) {
        return side == Side.BUY ? FixedPoint.quoteAmount(quantity, price, config.precision) : quantity;
    }

    private Book bookOf(byte side) {
        return side == Side.BUY ? bids : asks;
    }

    // =========================================================================
    // QUERIES
    // =========================================================================

    public long bestBidPrice() {
        return bids.bestPrice();
    }

    public long bestAskPrice() {
        return asks.bestPrice();
    }

    public long[] topPrices(byte side, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        return bookOf(side).topPrices(n);
    }

    public long[] top3Prices(byte side) {
        return bookOf(side).top3Prices();
    }

    public LevelStats[] depth(byte side, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        return bookOf(side).depth(n);
    }

    public long[] ordersOf(long owner) {
        return owners.ordersOf(owner);
    }

    /**
     * @return A copy of the resting order.
     */
    public Order orderDetail(long orderId) {
        return orders.get(orderId).copy();
    }

    public boolean orderExists(long orderId) {
        return orders.exists(orderId);
    }

    public LevelStats levelStats(long price, byte side) {
        return bookOf(side).levelStats(price);
    }

    /**
     * @return The price of the most recent fill, or 0 before the first one.
     */
    public long lastTradePrice() {
        return lastTradePrice;
    }

    public int restingOrderCount() {
        return orders.size();
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * @return The book of one side (for testing/inspection only)
     */
    public Book getBook(byte side) {
        return bookOf(side);
    }
}
