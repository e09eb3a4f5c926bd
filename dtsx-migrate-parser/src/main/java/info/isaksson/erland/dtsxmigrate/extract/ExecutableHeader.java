package info.isaksson.erland.dtsxmigrate.extract;

/** The attributes every executable variant shares, read once by {@link ControlFlowExtractor}. */
final class ExecutableHeader {
    final String id;
    final String name;
    final String typeTag;
    final String parentId;
    final String description;
    final boolean disabled;

    ExecutableHeader(String id, String name, String typeTag, String parentId, String description, boolean disabled) {
        this.id = id;
        this.name = name;
        this.typeTag = typeTag;
        this.parentId = parentId;
        this.description = description;
        this.disabled = disabled;
    }
}
