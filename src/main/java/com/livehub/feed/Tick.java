package com.livehub.feed;

public record Tick(String symbol, double price, double quantity, long eventTimeMs) {
}
