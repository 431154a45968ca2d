package work.infraplan.hcl.config;

/**
 * Block kinds the plan synthesizer distinguishes. Anything unknown is {@link #NESTED}.
 */
public enum BlockKind {
    RESOURCE("resource"),
    MODULE("module"),
    PROVIDER("provider"),
    DYNAMIC("dynamic"),
    DEPENDS_ON("depends_on"),
    NESTED(null);

    private final String keyword;

    BlockKind(String keyword) {
        this.keyword = keyword;
    }

    public static BlockKind of(String kind) {
        if (kind == null) {
            return NESTED;
        }
        for (BlockKind candidate : values()) {
            if (kind.equals(candidate.keyword)) {
                return candidate;
            }
        }
        return NESTED;
    }

    public boolean isMeta() {
        return this == DYNAMIC || this == DEPENDS_ON;
    }

    public boolean isCountable() {
        return this == RESOURCE || this == MODULE;
    }
}
