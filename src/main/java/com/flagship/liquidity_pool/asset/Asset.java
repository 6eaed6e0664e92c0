package com.flagship.liquidity_pool.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Identifier of a fungible asset held in pools.
 *
 * The engine treats an asset as opaque: only identity and ordering matter.
 * Ordering is the lexicographic order of the id and decides which side of a
 * pair an asset occupies.
 */
@Value
public class Asset implements Comparable<Asset> {
    String id;

    private Asset(String id) {
        this.id = id;
    }

    @JsonCreator
    public static Asset of(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Asset id is required");
        }
        return new Asset(id.trim());
    }

    @Override
    public int compareTo(Asset other) {
        return this.id.compareTo(other.id);
    }

    @JsonValue
    @Override
    public String toString() {
        return id;
    }
}
