package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Join handling: the ordered list of enabled {@link JoinMethod}s and one
 * settings block per method.
 *
 * <p>
 * An empty method list is valid. Clients are then disconnected without a
 * message while the server is not ready.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = JoinConfig.Builder.class)
public final class JoinConfig {

    public static final List<JoinMethod> DEFAULT_METHODS = List.of(JoinMethod.HOLD, JoinMethod.KICK);

    private final List<JoinMethod> methods;
    private final JoinKickConfig kick;
    private final JoinHoldConfig hold;
    private final JoinForwardConfig forward;
    private final JoinLobbyConfig lobby;

    private JoinConfig(Builder b) {
        this.methods = b.methods;
        this.kick = b.kick;
        this.hold = b.hold;
        this.forward = b.forward;
        this.lobby = b.lobby;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JoinConfig defaults() {
        return builder().build();
    }

    /**
     * @return enabled join methods in order of use; unmodifiable
     */
    public List<JoinMethod> getMethods() {
        return methods;
    }

    public JoinKickConfig getKick() {
        return kick;
    }

    public JoinHoldConfig getHold() {
        return hold;
    }

    public JoinForwardConfig getForward() {
        return forward;
    }

    public JoinLobbyConfig getLobby() {
        return lobby;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinConfig that))
            return false;
        return Objects.equals(methods, that.methods)
                && Objects.equals(kick, that.kick)
                && Objects.equals(hold, that.hold)
                && Objects.equals(forward, that.forward)
                && Objects.equals(lobby, that.lobby);
    }

    @Override
    public int hashCode() {
        return Objects.hash(methods, kick, hold, forward, lobby);
    }

    @Override
    public String toString() {
        return "JoinConfig{" +
                "methods=" + methods +
                ", kick=" + kick +
                ", hold=" + hold +
                ", forward=" + forward +
                ", lobby=" + lobby +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private List<JoinMethod> methods = DEFAULT_METHODS;
        private JoinKickConfig kick = JoinKickConfig.defaults();
        private JoinHoldConfig hold = JoinHoldConfig.defaults();
        private JoinForwardConfig forward = JoinForwardConfig.defaults();
        private JoinLobbyConfig lobby = JoinLobbyConfig.defaults();

        /**
         * @param v join methods in order; copied, must not contain {@code null}
         * @return this builder
         */
        @JsonProperty("methods")
        public Builder methods(List<JoinMethod> v) {
            this.methods = List.copyOf(Objects.requireNonNull(v, "methods"));
            return this;
        }

        @JsonProperty("kick")
        public Builder kick(JoinKickConfig v) {
            this.kick = Objects.requireNonNull(v, "kick");
            return this;
        }

        @JsonProperty("hold")
        public Builder hold(JoinHoldConfig v) {
            this.hold = Objects.requireNonNull(v, "hold");
            return this;
        }

        @JsonProperty("forward")
        public Builder forward(JoinForwardConfig v) {
            this.forward = Objects.requireNonNull(v, "forward");
            return this;
        }

        @JsonProperty("lobby")
        public Builder lobby(JoinLobbyConfig v) {
            this.lobby = Objects.requireNonNull(v, "lobby");
            return this;
        }

        public JoinConfig build() {
            return new JoinConfig(this);
        }
    }
}
