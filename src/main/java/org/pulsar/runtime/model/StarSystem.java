package org.pulsar.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An independently simulated star system: the unit of work handed to the processor pipeline.
 */
public class StarSystem {

    private final UUID id;
    private final String name;
    private final List<OrbitingBody> bodies = new ArrayList<>();
    private final List<Ship> ships = new ArrayList<>();
    private final List<Colony> colonies = new ArrayList<>();

    public StarSystem(UUID id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
    }

    public UUID getId() { return id; }

    public String getName() { return name; }

    public List<OrbitingBody> getBodies() { return bodies; }

    public List<Ship> getShips() { return ships; }

    public List<Colony> getColonies() { return colonies; }

    public StarSystem addBody(OrbitingBody body) {
        bodies.add(Objects.requireNonNull(body, "body"));
        return this;
    }

    public StarSystem addShip(Ship ship) {
        ships.add(Objects.requireNonNull(ship, "ship"));
        return this;
    }

    public StarSystem addColony(Colony colony) {
        colonies.add(Objects.requireNonNull(colony, "colony"));
        return this;
    }

    public Optional<OrbitingBody> findBody(UUID bodyId) {
        return bodies.stream().filter(b -> b.getId().equals(bodyId)).findFirst();
    }

    public Optional<OrbitingBody> findBodyByName(String bodyName) {
        return bodies.stream().filter(b -> b.getName().equals(bodyName)).findFirst();
    }

    @Override
    public String toString() {
        return "StarSystem{" + name + ", bodies=" + bodies.size() + ", ships=" + ships.size()
                + ", colonies=" + colonies.size() + "}";
    }
}
