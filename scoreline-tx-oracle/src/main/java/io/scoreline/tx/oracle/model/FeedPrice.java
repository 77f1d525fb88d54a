package io.scoreline.tx.oracle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One signed price point. The price is a decimal string so no precision is
 * lost between the signer and storage; the property order is part of the
 * signed message.
 */
@JsonPropertyOrder({"pair", "price", "decimals"})
public final class FeedPrice {

    private final String pair;
    private final String price;
    private final int decimals;

    @JsonCreator
    public FeedPrice(@JsonProperty("pair") String pair,
                     @JsonProperty("price") String price,
                     @JsonProperty("decimals") int decimals) {
        this.pair = pair;
        this.price = price;
        this.decimals = decimals;
    }

    public String getPair() { return pair; }
    public String getPrice() { return price; }
    public int getDecimals() { return decimals; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeedPrice)) return false;
        FeedPrice that = (FeedPrice) o;
        return decimals == that.decimals && Objects.equals(pair, that.pair) && Objects.equals(price, that.price);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, price, decimals);
    }

    @Override
    public String toString() {
        return pair + "=" + price + " (decimals=" + decimals + ")";
    }
}
