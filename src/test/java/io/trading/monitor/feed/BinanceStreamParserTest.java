package io.trading.monitor.feed;

import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.Side;
import io.trading.monitor.model.TradeRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BinanceStreamParser.
 * Message samples follow the Binance combined-stream format.
 */
class BinanceStreamParserTest {

    private static final long RECEIPT = 1704067200500L;

    private final BinanceStreamParser parser = new BinanceStreamParser();

    @Test
    void testParseCombinedStreamTrade() {
        String message = """
            {
                "stream": "btcusdt@trade",
                "data": {
                    "e": "trade",
                    "E": 1704067200000,
                    "s": "BTCUSDT",
                    "t": 3456789012,
                    "p": "42150.25000000",
                    "q": "0.00150000",
                    "T": 1704067199998,
                    "m": true,
                    "M": true
                }
            }
            """;

        MarketRecord record = parser.decode(message, RECEIPT);

        TradeRecord trade = assertInstanceOf(TradeRecord.class, record);
        assertEquals("BTCUSDT", trade.symbol());
        assertEquals(3456789012L, trade.tradeId());
        assertEquals(0, new BigDecimal("42150.25").compareTo(trade.price()));
        assertEquals(0, new BigDecimal("0.0015").compareTo(trade.quantity()));
        assertEquals(Side.SELL, trade.side());
        assertEquals(1704067199998L, trade.timestamp());
        assertEquals(RECEIPT, trade.receiptTimestamp());
    }

    @Test
    void testBuyerTakerIsBuy() {
        String message = "{\"stream\":\"ethusdt@trade\",\"data\":{\"e\":\"trade\",\"E\":1,\"s\":\"ETHUSDT\","
            + "\"t\":7,\"p\":\"2250.10\",\"q\":\"1\",\"T\":2,\"m\":false}}";

        TradeRecord trade = (TradeRecord) parser.decode(message, RECEIPT);

        assertEquals(Side.BUY, trade.side());
    }

    @Test
    void testTradeTimeFallsBackToEventTime() {
        String message = "{\"e\":\"trade\",\"E\":1704067200000,\"s\":\"BTCUSDT\",\"t\":1,\"p\":\"1\",\"q\":\"1\",\"m\":false}";

        TradeRecord trade = (TradeRecord) parser.decode(message, RECEIPT);

        assertEquals(1704067200000L, trade.timestamp());
    }

    @Test
    void testParseAggTrade() {
        String message = "{\"e\":\"aggTrade\",\"E\":1,\"s\":\"bnbusdt\",\"a\":555,\"p\":\"310.5\",\"q\":\"2\","
            + "\"f\":100,\"l\":105,\"T\":2,\"m\":false}";

        TradeRecord trade = (TradeRecord) parser.decode(message, RECEIPT);

        assertEquals("BNBUSDT", trade.symbol());
        assertEquals(555, trade.tradeId());
    }

    @Test
    void testParsePartialDepth() {
        String message = """
            {
                "stream": "ethusdt@depth20@100ms",
                "data": {
                    "lastUpdateId": 160,
                    "bids": [["2250.10", "1.500"], ["2250.00", "3.000"]],
                    "asks": [["2250.20", "0.750"]]
                }
            }
            """;

        MarketRecord record = parser.decode(message, RECEIPT);

        OrderBookUpdate book = assertInstanceOf(OrderBookUpdate.class, record);
        assertEquals("ETHUSDT", book.symbol());
        assertEquals(160, book.sequence());
        assertEquals(2, book.bids().size());
        assertEquals(1, book.asks().size());
        assertEquals(0, new BigDecimal("2250.10").compareTo(book.bestBid().price()));
        assertEquals(0, new BigDecimal("1.5").compareTo(book.bestBid().quantity()));
        assertEquals(0, new BigDecimal("2250.20").compareTo(book.bestAsk().price()));
        assertEquals(RECEIPT, book.timestamp());
    }

    @Test
    void testEmptyBookSidesAccepted() {
        String message = "{\"stream\":\"btcusdt@depth5@100ms\",\"data\":{\"lastUpdateId\":1,\"bids\":[],\"asks\":[]}}";

        OrderBookUpdate book = (OrderBookUpdate) parser.decode(message, RECEIPT);

        assertTrue(book.bids().isEmpty());
        assertNull(book.bestAsk());
    }

    @Test
    void testSubscriptionAckIgnored() {
        assertNull(parser.decode("{\"result\":null,\"id\":1}", RECEIPT));
    }

    @Test
    void testUnsupportedEventIgnored() {
        String ticker = "{\"stream\":\"btcusdt@ticker\",\"data\":{\"e\":\"24hrTicker\",\"E\":1,\"s\":\"BTCUSDT\",\"c\":\"1\"}}";

        assertNull(parser.decode(ticker, RECEIPT));
    }

    @Test
    void testMalformedJsonRejected() {
        assertThrows(DecodeException.class, () -> parser.decode("{\"stream\":\"btcusdt@trade\",", RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode("not json", RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode("[1,2,3]", RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode("", RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode(null, RECEIPT));
    }

    @Test
    void testMissingFieldsRejected() {
        String noPrice = "{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"t\":1,\"q\":\"1\",\"m\":true}";
        String noSide = "{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"t\":1,\"p\":\"1\",\"q\":\"1\"}";
        String noSymbol = "{\"lastUpdateId\":1,\"bids\":[],\"asks\":[]}";
        String noAsks = "{\"stream\":\"btcusdt@depth5\",\"data\":{\"lastUpdateId\":1,\"bids\":[]}}";

        assertThrows(DecodeException.class, () -> parser.decode(noPrice, RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode(noSide, RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode(noSymbol, RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode(noAsks, RECEIPT));
    }

    @Test
    void testInvalidValuesRejected() {
        String badPrice = "{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"t\":1,\"p\":\"abc\",\"q\":\"1\",\"m\":true}";
        String shortLevel = "{\"stream\":\"btcusdt@depth5\",\"data\":{\"lastUpdateId\":1,\"bids\":[[\"1\"]],\"asks\":[]}}";

        assertThrows(DecodeException.class, () -> parser.decode(badPrice, RECEIPT));
        assertThrows(DecodeException.class, () -> parser.decode(shortLevel, RECEIPT));
    }

    @Test
    void testUnrecognizedMessageRejected() {
        assertThrows(DecodeException.class, () -> parser.decode("{\"foo\":\"bar\"}", RECEIPT));
    }

    @Test
    void testSymbolFromStream() {
        assertEquals("BTCUSDT", BinanceStreamParser.symbolFromStream("btcusdt@depth20@100ms"));
        assertEquals("ETHUSDT", BinanceStreamParser.symbolFromStream("ethusdt"));
        assertNull(BinanceStreamParser.symbolFromStream("@trade"));
        assertNull(BinanceStreamParser.symbolFromStream(null));
    }
}
