package org.pulsar.runtime.pulse;

import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.spi.ISubpulseProcessor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The fixed, ordered set of processors run once per subpulse.
 * <p>
 * The order is part of the simulation's correctness: ship movement must see orbital
 * positions already updated for the subpulse. The pipeline is immutable once built and has
 * no recovery logic; a failing processor aborts the pass with a {@link ProcessorFaultException}.
 */
public final class ProcessorPipeline {

    private final List<ISubpulseProcessor> processors;

    public ProcessorPipeline(List<? extends ISubpulseProcessor> processors) {
        this.processors = List.copyOf(processors);
    }

    /**
     * Runs every processor, in order, once, for the given subpulse.
     *
     * @param simulation   The simulation instance.
     * @param systems      The systems to process.
     * @param deltaSeconds Length of the subpulse.
     * @param context      The subpulse context.
     * @throws ProcessorFaultException if any processor fails.
     */
    public void runAll(Simulation simulation, List<StarSystem> systems, long deltaSeconds, SubpulseContext context) {
        for (ISubpulseProcessor processor : processors) {
            try {
                processor.process(simulation, systems, deltaSeconds, context);
            } catch (RegionProcessingException e) {
                throw new ProcessorFaultException(processor.getName(), context.getSubpulseIndex(),
                        e.getRegionId(), e.getCause() != null ? e.getCause() : e);
            } catch (RuntimeException e) {
                throw new ProcessorFaultException(processor.getName(), context.getSubpulseIndex(), null, e);
            }
        }
    }

    public List<ISubpulseProcessor> getProcessors() {
        return processors;
    }

    public int size() {
        return processors.size();
    }

    @Override
    public String toString() {
        return processors.stream().map(ISubpulseProcessor::getName)
                .collect(Collectors.joining(" -> ", "ProcessorPipeline[", "]"));
    }
}
