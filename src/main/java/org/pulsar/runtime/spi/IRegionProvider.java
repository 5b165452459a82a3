package org.pulsar.runtime.spi;

import org.pulsar.runtime.model.StarSystem;

import java.util.List;

/**
 * Supplies the star systems the pipeline runs against. Queried once at the start of every
 * subpulse and never cached, so systems may be added or removed between subpulses.
 */
@FunctionalInterface
public interface IRegionProvider {

    /**
     * @return An immutable snapshot of the currently active systems.
     */
    List<StarSystem> getActiveSystems();
}
