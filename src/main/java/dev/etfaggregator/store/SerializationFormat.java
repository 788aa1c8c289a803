package dev.etfaggregator.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * On-disk encoding of dataset segments. Manifests are always JSON regardless of this setting.
 */
public enum SerializationFormat {

    /** Compact UTF-8 JSON array. */
    JSON("json") {
        @Override
        public long arrayBytes(int count, long elementBytes) {
            // '[' + ']' plus one ',' between neighbours
            return 2 + elementBytes + Math.max(0, count - 1);
        }
    },

    /** MessagePack array. */
    MSGPACK("msgpack") {
        @Override
        public long arrayBytes(int count, long elementBytes) {
            long header;
            if (count < 16) {
                header = 1;
            } else if (count < 65536) {
                header = 3;
            } else {
                header = 5;
            }
            return header + elementBytes;
        }
    };

    private final String extension;

    SerializationFormat(String extension) {
        this.extension = extension;
    }

    @JsonValue
    public String extension() {
        return extension;
    }

    /**
     * Exact serialized size of an array holding {@code count} elements whose standalone
     * encodings add up to {@code elementBytes}.
     */
    public abstract long arrayBytes(int count, long elementBytes);

    @JsonCreator
    public static SerializationFormat fromExtension(String value) {
        if (value == null) {
            return JSON;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SerializationFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown serialization format: " + value);
    }
}
