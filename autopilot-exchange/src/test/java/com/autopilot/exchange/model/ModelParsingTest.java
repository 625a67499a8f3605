package com.autopilot.exchange.model;

import com.autopilot.core.model.OrderType;
import com.autopilot.core.model.SignalAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelParsingTest {

    @Test
    void klineIntervalAcceptsBothCases() {
        assertEquals(KlineInterval.M5, KlineInterval.parse("5m"));
        assertEquals(KlineInterval.H1, KlineInterval.parse("1H"));
        assertEquals(KlineInterval.D1, KlineInterval.parse("d1"));
        assertEquals("1H", KlineInterval.H1.code());
        assertThrows(IllegalArgumentException.class, () -> KlineInterval.parse("7m"));
    }

    @Test
    void orderStatusMapping() {
        assertEquals(OrderStatus.PENDING, OrderStatus.parse("NEW"));
        assertEquals(OrderStatus.PENDING, OrderStatus.parse("OPEN"));
        assertEquals(OrderStatus.CANCELED, OrderStatus.parse("cancelled"));
        assertEquals(OrderStatus.PARTIALLY_FILLED, OrderStatus.parse("PARTIALLY_FILLED"));
        assertTrue(OrderStatus.REJECTED.isTerminal());
        assertFalse(OrderStatus.PARTIALLY_FILLED.isTerminal());
    }

    @Test
    void orderSideFromAction() {
        assertEquals(OrderSide.BUY, OrderSide.fromAction(SignalAction.BUY));
        assertEquals(OrderSide.BUY, OrderSide.SELL.opposite());
        assertThrows(IllegalArgumentException.class, () -> OrderSide.fromAction(SignalAction.HOLD));
    }

    @Test
    void orderRequestValidation() {
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.builder()
                .symbol("BTC_USDT").side(OrderSide.BUY).type(OrderType.LIMIT).quantity(1).build());
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.builder()
                .symbol("BTC_USDT").side(OrderSide.SELL).type(OrderType.TRAILING_STOP_MARKET).quantity(1).build());
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.builder()
                .symbol("BTC_USDT").side(OrderSide.SELL).quantity(0).build());
    }
}
