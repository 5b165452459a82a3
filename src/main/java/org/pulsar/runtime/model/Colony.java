package org.pulsar.runtime.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A colony on a body, producing a fixed amount of goods per economic cycle.
 */
public class Colony {

    private final UUID id;
    private final String name;
    private final UUID bodyId;
    private final long productionPerCycle;
    private long stockpile;
    private long secondsIntoCycle;

    public Colony(UUID id, String name, UUID bodyId, long productionPerCycle, long stockpile) {
        if (productionPerCycle < 0) {
            throw new IllegalArgumentException("Production must be >= 0: " + productionPerCycle);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.bodyId = Objects.requireNonNull(bodyId, "bodyId");
        this.productionPerCycle = productionPerCycle;
        this.stockpile = stockpile;
    }

    public UUID getId() { return id; }

    public String getName() { return name; }

    public UUID getBodyId() { return bodyId; }

    public long getProductionPerCycle() { return productionPerCycle; }

    public long getStockpile() { return stockpile; }

    public void addToStockpile(long amount) { this.stockpile += amount; }

    /**
     * @return Seconds accumulated toward the next economic cycle.
     */
    public long getSecondsIntoCycle() { return secondsIntoCycle; }

    public void setSecondsIntoCycle(long secondsIntoCycle) { this.secondsIntoCycle = secondsIntoCycle; }

    @Override
    public String toString() {
        return "Colony{" + name + ", stockpile=" + stockpile + "}";
    }
}
