package io.trading.monitor.feed;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.Side;
import io.trading.monitor.model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for Binance WebSocket market data messages.
 *
 * Accepts combined-stream envelopes ({"stream":"btcusdt@trade","data":{...}}) as well
 * as raw payloads. Decodes trade / aggTrade events into {@link TradeRecord} and
 * partial book depth payloads (lastUpdateId, bids, asks) into {@link OrderBookUpdate}.
 * Uses Jackson's streaming parser, so no tree is built per message.
 */
public class BinanceStreamParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceStreamParser.class);

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private static final String EVENT_TRADE = "trade";
    private static final String EVENT_AGG_TRADE = "aggTrade";

    /**
     * Decodes a message.
     *
     * @param message     Raw text frame
     * @param receiptTime Local receive time in epoch milliseconds
     * @return the record, or null for control messages (subscription acks) and unsupported events
     * @throws DecodeException if the message is malformed or lacks required fields
     */
    public MarketRecord decode(String message, long receiptTime) {
        if (message == null || message.isBlank()) {
            throw new DecodeException("Empty message");
        }

        Fields fields = new Fields();
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new DecodeException("Expected a JSON object");
            }
            readObject(parser, fields, true);
        } catch (IOException e) {
            throw new DecodeException("Malformed JSON: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid field value: " + e.getMessage(), e);
        }

        try {
            return toRecord(fields, receiptTime);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid record: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the upper-case symbol from a stream name such as "btcusdt@depth20@100ms".
     */
    static String symbolFromStream(String stream) {
        if (stream == null || stream.isEmpty()) {
            return null;
        }
        int at = stream.indexOf('@');
        String symbol = at < 0 ? stream : stream.substring(0, at);
        return symbol.isEmpty() ? null : symbol.toUpperCase();
    }

    private void readObject(JsonParser parser, Fields fields, boolean topLevel) throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.getCurrentName();
            JsonToken value = parser.nextToken();

            if (topLevel && "data".equals(name) && value == JsonToken.START_OBJECT) {
                readObject(parser, fields, false);
                continue;
            }

            switch (name) {
                case "stream" -> fields.stream = parser.getValueAsString();
                case "e" -> fields.event = parser.getValueAsString();
                case "s" -> fields.symbol = parser.getValueAsString();
                case "E" -> fields.eventTime = parser.getValueAsLong();
                case "T" -> fields.tradeTime = parser.getValueAsLong();
                case "t" -> fields.tradeId = parser.getValueAsLong();
                case "p" -> fields.price = decimal(parser);
                case "q" -> fields.quantity = decimal(parser);
                case "m" -> fields.buyerMaker = value == JsonToken.VALUE_TRUE ? Boolean.TRUE
                    : value == JsonToken.VALUE_FALSE ? Boolean.FALSE : null;
                case "lastUpdateId" -> fields.lastUpdateId = parser.getValueAsLong();
                case "result", "id" -> {
                    fields.control = true;
                    parser.skipChildren();
                }
                case "a" -> {
                    // aggTrade id; diff depth streams use "a" for an ask array, which is not handled here
                    if (value == JsonToken.VALUE_NUMBER_INT) {
                        fields.aggTradeId = parser.getLongValue();
                    } else {
                        parser.skipChildren();
                    }
                }
                case "bids" -> fields.bids = readLevels(parser, value);
                case "asks" -> fields.asks = readLevels(parser, value);
                default -> parser.skipChildren();
            }
        }
    }

    private static BigDecimal decimal(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_FLOAT || token == JsonToken.VALUE_NUMBER_INT) {
            return parser.getDecimalValue();
        }
        String text = parser.getValueAsString();
        return text == null ? null : new BigDecimal(text);
    }

    /**
     * Reads [["price","qty"], ...]. Extra elements per level are ignored.
     */
    private static List<OrderBookLevel> readLevels(JsonParser parser, JsonToken start) throws IOException {
        if (start != JsonToken.START_ARRAY) {
            throw new DecodeException("Order book levels must be an array");
        }

        List<OrderBookLevel> levels = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) == JsonToken.START_ARRAY) {
            parser.nextToken();
            BigDecimal price = decimal(parser);
            parser.nextToken();
            BigDecimal quantity = decimal(parser);
            if (price == null || quantity == null) {
                throw new DecodeException("Order book level needs a price and a quantity");
            }
            levels.add(new OrderBookLevel(price, quantity));

            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new DecodeException("Unterminated order book level");
                }
                parser.skipChildren();
            }
        }
        if (token != JsonToken.END_ARRAY) {
            throw new DecodeException("Order book level must be an array");
        }
        return levels;
    }

    private MarketRecord toRecord(Fields f, long receiptTime) {
        if (f.event != null) {
            if (EVENT_TRADE.equals(f.event) || EVENT_AGG_TRADE.equals(f.event)) {
                return toTrade(f, receiptTime);
            }
            LOGGER.debug("Ignoring unsupported event type: {}", f.event);
            return null;
        }

        if (f.lastUpdateId != null) {
            return toBook(f, receiptTime);
        }

        if (f.control) {
            LOGGER.debug("Control message received");
            return null;
        }

        throw new DecodeException("Unrecognized message" + (f.stream != null ? " on stream " + f.stream : ""));
    }

    private TradeRecord toTrade(Fields f, long receiptTime) {
        String symbol = f.symbol != null ? f.symbol.toUpperCase() : symbolFromStream(f.stream);
        if (symbol == null) {
            throw new DecodeException("Trade without symbol");
        }
        if (f.price == null || f.quantity == null) {
            throw new DecodeException("Trade for " + symbol + " without price or quantity");
        }
        if (f.buyerMaker == null) {
            throw new DecodeException("Trade for " + symbol + " without side flag");
        }

        long tradeId = EVENT_AGG_TRADE.equals(f.event) ? f.aggTradeId : f.tradeId;
        long timestamp = f.tradeTime > 0 ? f.tradeTime : (f.eventTime > 0 ? f.eventTime : receiptTime);

        return new TradeRecord(
            symbol,
            tradeId,
            f.price,
            f.quantity,
            Side.fromBuyerMaker(f.buyerMaker),
            timestamp,
            receiptTime
        );
    }

    private OrderBookUpdate toBook(Fields f, long receiptTime) {
        String symbol = f.symbol != null ? f.symbol.toUpperCase() : symbolFromStream(f.stream);
        if (symbol == null) {
            throw new DecodeException("Order book without symbol");
        }
        if (f.bids == null || f.asks == null) {
            throw new DecodeException("Order book for " + symbol + " without bids or asks");
        }

        return new OrderBookUpdate(
            symbol,
            f.lastUpdateId,
            f.bids,
            f.asks,
            f.eventTime > 0 ? f.eventTime : receiptTime
        );
    }

    /**
     * Fields collected from the envelope and its payload.
     */
    private static final class Fields {
        String stream;
        String event;
        String symbol;
        long eventTime;
        long tradeTime;
        long tradeId;
        long aggTradeId;
        BigDecimal price;
        BigDecimal quantity;
        Boolean buyerMaker;
        Long lastUpdateId;
        List<OrderBookLevel> bids;
        List<OrderBookLevel> asks;
        boolean control;
    }
}
