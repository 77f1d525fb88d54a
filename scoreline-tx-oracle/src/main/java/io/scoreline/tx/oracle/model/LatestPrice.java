package io.scoreline.tx.oracle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Read model of the current price of one pair.
 */
public final class LatestPrice {

    private final String pair;
    private final String price;
    private final int decimals;
    private final Instant timestamp;

    @JsonCreator
    public LatestPrice(@JsonProperty("pair") String pair,
                       @JsonProperty("price") String price,
                       @JsonProperty("decimals") int decimals,
                       @JsonProperty("timestamp") Instant timestamp) {
        this.pair = pair;
        this.price = price;
        this.decimals = decimals;
        this.timestamp = timestamp;
    }

    public String getPair() { return pair; }
    public String getPrice() { return price; }
    public int getDecimals() { return decimals; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LatestPrice)) return false;
        LatestPrice that = (LatestPrice) o;
        return decimals == that.decimals && Objects.equals(pair, that.pair)
            && Objects.equals(price, that.price) && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, price, decimals, timestamp);
    }

    @Override
    public String toString() {
        return pair + "=" + price + " @ " + timestamp;
    }
}
