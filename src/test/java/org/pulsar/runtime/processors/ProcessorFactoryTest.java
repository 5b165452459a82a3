package org.pulsar.runtime.processors;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.spi.ISubpulseProcessor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ProcessorFactoryTest {

    /**
     * Lacks the {@code (Config)} constructor the factory needs.
     */
    public static class NoConfigProcessor implements ISubpulseProcessor {
        @Override
        public void process(Simulation simulation, List<StarSystem> systems, long deltaSeconds, SubpulseContext context) {
        }
    }

    private static Config definition(String hocon) {
        return ConfigFactory.parseString(hocon);
    }

    @Test
    void create_passesOptionsToConfigConstructor() {
        ISubpulseProcessor processor = ProcessorFactory.create(definition(
                "className = \"org.pulsar.runtime.processors.EconomyProcessor\", options { cycleSeconds = 60 }"));

        assertThat(processor).isInstanceOfSatisfying(EconomyProcessor.class,
                p -> assertThat(p.getCycleSeconds()).isEqualTo(60));
        assertThat(processor.getName()).isEqualTo("EconomyProcessor");
    }

    @Test
    void createAll_preservesConfiguredOrder() {
        List<ISubpulseProcessor> processors = ProcessorFactory.createAll(List.of(
                definition("className = \"org.pulsar.runtime.processors.OrbitProcessor\""),
                definition("className = \"org.pulsar.runtime.processors.ShipMovementProcessor\""),
                definition("className = \"org.pulsar.runtime.processors.EconomyProcessor\"")));

        assertThat(processors).extracting(ISubpulseProcessor::getName)
                .containsExactly("OrbitProcessor", "ShipMovementProcessor", "EconomyProcessor");
    }

    @Test
    void create_rejectsUnknownClass() {
        assertThatThrownBy(() -> ProcessorFactory.create(definition("className = \"org.pulsar.Missing\"")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("org.pulsar.Missing")
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void create_rejectsClassThatIsNotAProcessor() {
        assertThatThrownBy(() -> ProcessorFactory.create(definition("className = \"java.lang.StringBuilder\"")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not implement ISubpulseProcessor");
    }

    @Test
    void create_rejectsProcessorWithoutConfigConstructor() {
        assertThatThrownBy(() -> ProcessorFactory.create(definition(
                "className = \"" + NoConfigProcessor.class.getName() + "\"")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(NoSuchMethodException.class);
    }
}
