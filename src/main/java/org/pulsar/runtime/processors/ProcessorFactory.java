package org.pulsar.runtime.processors;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pulsar.runtime.spi.ISubpulseProcessor;

import java.util.List;

/**
 * Instantiates processors from configuration entries of the form
 * <pre>
 * { className = "org.pulsar.runtime.processors.EconomyProcessor", options { cycleSeconds = 86400 } }
 * </pre>
 * Each class must implement {@link ISubpulseProcessor} and provide a
 * {@code (com.typesafe.config.Config options)} constructor.
 */
public final class ProcessorFactory {

    private ProcessorFactory() {}

    /**
     * Creates all processors, preserving their configured order.
     * @param definitions The processor definitions.
     * @return The processors in pipeline order.
     * @throws IllegalArgumentException if a definition cannot be instantiated.
     */
    public static List<ISubpulseProcessor> createAll(List<? extends Config> definitions) {
        return definitions.stream().map(ProcessorFactory::create).toList();
    }

    /**
     * Creates one processor.
     * @param definition A definition with {@code className} and optional {@code options}.
     * @return The processor.
     * @throws IllegalArgumentException if the class is missing, is not a processor, or cannot be
     *                                  constructed.
     */
    public static ISubpulseProcessor create(Config definition) {
        String className = definition.getString("className");
        Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> type = Class.forName(className);
            if (!ISubpulseProcessor.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Class " + className + " does not implement " + ISubpulseProcessor.class.getSimpleName());
            }
            return (ISubpulseProcessor) type.getConstructor(Config.class).newInstance(options);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate processor: " + className, e);
        }
    }
}
