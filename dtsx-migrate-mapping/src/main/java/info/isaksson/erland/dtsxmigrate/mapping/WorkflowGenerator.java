package info.isaksson.erland.dtsxmigrate.mapping;

/**
 * Consumes validated IR and produces a workflow-orchestration artifact.
 *
 * <p>Implementations must be deterministic: the same input yields an equal result. Rendering the
 * result to text is the caller's concern.</p>
 *
 * @param <T> the produced artifact
 */
public interface WorkflowGenerator<T> {

    T generate(WorkflowMappingInput input);
}
