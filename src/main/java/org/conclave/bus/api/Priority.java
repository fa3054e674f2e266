package org.conclave.bus.api;

/**
 * Delivery priority of a {@link Message}. Declaration order is drain order: consumers always
 * inspect {@link #CRITICAL} before {@link #HIGH} before {@link #NORMAL} before {@link #LOW}.
 */
public enum Priority {
    CRITICAL(true),
    HIGH(true),
    NORMAL(false),
    LOW(false);

    private final boolean evictOnOverflow;

    Priority(boolean evictOnOverflow) {
        this.evictOnOverflow = evictOnOverflow;
    }

    /**
     * Whether a full lane of this priority makes room by discarding its oldest entry.
     * Lanes that return {@code false} reject the incoming message instead.
     *
     * @return {@code true} for urgent lanes that favour freshness.
     */
    public boolean evictsOnOverflow() {
        return evictOnOverflow;
    }
}
