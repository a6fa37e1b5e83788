package com.flowchart.fsmc.ir;

import java.util.List;
import java.util.Objects;

/**
 * An event of the machine's catalog.
 *
 * @param type    normalized event type ({@code SELECT_OPTION})
 * @param symbol  Java constant naming the event, unique within the machine
 * @param payload payload fields
 * @param doc     one-line description
 */
public record EventSpec(String type, String symbol, List<PayloadField> payload, String doc) {

    public EventSpec {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(symbol, "symbol");
        payload = List.copyOf(payload);
    }
}
