package com.passage.proxy.core.http;

import java.util.Locale;
import java.util.Objects;

/**
 * A single header field as it appeared on the wire. Names keep their original
 * spelling; comparisons go through {@link #lowerName()}.
 */
public final class HttpHeader {
    private final String name;
    private final String value;

    public HttpHeader(String name, String value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value == null ? "" : value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String lowerName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean hasName(String other) {
        return name.equalsIgnoreCase(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HttpHeader that = (HttpHeader) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return name + ": " + value;
    }
}
