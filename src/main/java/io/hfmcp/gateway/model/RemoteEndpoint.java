package io.hfmcp.gateway.model;

/**
 * A third-party compute endpoint (Gradio Space) whose tools can be proxied.
 *
 * <p>Resolved per request from settings and request parameters; never persisted.</p>
 */
public record RemoteEndpoint(
    String id,
    String name,
    String subdomain,
    String emoji,
    Visibility visibility
) {

    /**
     * Whether the endpoint requires the caller's token.
     */
    public enum Visibility {
        PUBLIC,
        PRIVATE
    }

    /**
     * Name shown in proxied tool titles and descriptions.
     */
    public String displayName() {
        return name == null || name.isBlank() ? "Unknown Space" : name;
    }

    public boolean hasAddress() {
        return subdomain != null && !subdomain.isBlank();
    }

    public RemoteEndpoint withVisibility(Visibility visibility) {
        return new RemoteEndpoint(id, name, subdomain, emoji, visibility);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String subdomain;
        private String emoji;
        private Visibility visibility = Visibility.PUBLIC;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder subdomain(String subdomain) {
            this.subdomain = subdomain;
            return this;
        }

        public Builder emoji(String emoji) {
            this.emoji = emoji;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public RemoteEndpoint build() {
            return new RemoteEndpoint(id, name, subdomain, emoji, visibility);
        }
    }
}
