package com.graphmend.core.graph;

import java.util.Objects;

/**
 * Where an edge came from: a source tag and an optional supporting quote.
 */
public final class Provenance {

    public static final String SOURCE_SYNTHETIC = "synthetic";

    private final String source;
    private final String quote;

    public Provenance(String source, String quote) {
        this.source = source;
        this.quote  = quote;
    }

    public static Provenance synthetic(String quote) {
        return new Provenance(SOURCE_SYNTHETIC, quote);
    }

    public String getSource() { return source; }
    public String getQuote()  { return quote; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Provenance)) return false;
        Provenance that = (Provenance) o;
        return Objects.equals(source, that.source) && Objects.equals(quote, that.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, quote);
    }

    @Override
    public String toString() {
        return "Provenance{source='" + source + "'}";
    }
}
