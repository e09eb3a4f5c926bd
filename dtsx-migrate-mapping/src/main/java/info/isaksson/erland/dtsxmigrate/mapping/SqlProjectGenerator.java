package info.isaksson.erland.dtsxmigrate.mapping;

/**
 * Consumes the transform-eligible slice of the IR and produces a SQL-transformation project.
 *
 * @param <T> the produced artifact
 */
public interface SqlProjectGenerator<T> {

    T generate(SqlProjectMappingInput input);
}
