package com.network.matching.graph;

import java.util.List;
import java.util.Objects;

/**
 * How a requester can reach a candidate through the connection graph.
 * Only direct connections and paths through a single mutual connection are classified.
 */
public record ConnectionPath(Type type, String via) {

    public enum Type {
        DIRECT,
        TWO_HOP,
        NONE
    }

    private static final ConnectionPath DIRECT = new ConnectionPath(Type.DIRECT, null);
    private static final ConnectionPath NONE = new ConnectionPath(Type.NONE, null);

    public ConnectionPath {
        Objects.requireNonNull(type, "type is required");
        if (type == Type.TWO_HOP && (via == null || via.isBlank())) {
            throw new IllegalArgumentException("a two-hop path needs the intermediate name");
        }
        if (type != Type.TWO_HOP && via != null) {
            throw new IllegalArgumentException("only two-hop paths have an intermediate");
        }
    }

    public static ConnectionPath direct() {
        return DIRECT;
    }

    public static ConnectionPath twoHop(String viaName) {
        return new ConnectionPath(Type.TWO_HOP, viaName);
    }

    public static ConnectionPath none() {
        return NONE;
    }

    /**
     * Returns the path as display labels: {@code ["direct"]}, {@code ["2-hop", name]}
     * or {@code ["no_direct_path"]}.
     */
    public List<String> labels() {
        return switch (type) {
            case DIRECT -> List.of("direct");
            case TWO_HOP -> List.of("2-hop", via);
            case NONE -> List.of("no_direct_path");
        };
    }
}
