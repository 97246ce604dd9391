package com.eainde.ace.trust;

import java.util.List;

/**
 * Input to {@link TrustSourceTagger#tagContent(TagRequest)}. Only the type is required.
 * <pre>{@code
 * TagRequest.of(SourceType.WEB).origin("web:https://example.com").build();
 * }</pre>
 */
public final class TagRequest {

    private final SourceType type;
    private final TrustLevel level;
    private final String origin;
    private final List<String> chain;

    private TagRequest(Builder builder) {
        this.type = builder.type == null ? SourceType.UNKNOWN : builder.type;
        this.level = builder.level;
        this.origin = builder.origin;
        this.chain = builder.chain == null ? List.of() : List.copyOf(builder.chain);
    }

    public static Builder of(SourceType type) {
        return new Builder(type);
    }

    public SourceType getType() {
        return type;
    }

    /** Declared level, or {@code null} to use the type default. */
    public TrustLevel getLevel() {
        return level;
    }

    public String getOrigin() {
        return origin;
    }

    public List<String> getChain() {
        return chain;
    }

    public static final class Builder {
        private final SourceType type;
        private TrustLevel level;
        private String origin;
        private List<String> chain;

        private Builder(SourceType type) {
            this.type = type;
        }

        public Builder level(TrustLevel level) {
            this.level = level;
            return this;
        }

        public Builder origin(String origin) {
            this.origin = origin;
            return this;
        }

        public Builder chain(List<String> chain) {
            this.chain = chain;
            return this;
        }

        public TagRequest build() {
            return new TagRequest(this);
        }
    }
}
