package com.clob.core;

import com.clob.api.Side;

import java.util.ArrayList;
import java.util.List;

class RecordingListener implements OrderEventListener {

    final List<String> events = new ArrayList<>();

    @Override
    public void onOrderCreated(long orderId, long owner, byte side, long price, long quantity) {
        events.add("CREATED " + orderId + " " + Side.name(side) + " " + quantity + "@" + price);
    }

    @Override
    public void onOrderFilled(long orderId, long owner, long counterparty, byte side, long price, long quantity) {
        events.add("FILLED " + orderId + " " + Side.name(side) + " " + quantity + "@" + price + " vs " + counterparty);
    }

    @Override
    public void onOrderPartiallyFilled(long orderId, long owner, long counterparty, byte side, long price,
            long quantity) {
        events.add("PARTIAL " + orderId + " " + Side.name(side) + " " + quantity + "@" + price + " vs " + counterparty);
    }

    @Override
    public void onOrderCanceled(long orderId, long owner, byte side, long price, long remainingQuantity) {
        events.add("CANCELED " + orderId + " " + Side.name(side) + " " + remainingQuantity + "@" + price);
    }
}
