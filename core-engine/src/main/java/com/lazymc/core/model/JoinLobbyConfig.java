package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the experimental {@link JoinMethod#LOBBY} join method.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = JoinLobbyConfig.Builder.class)
public final class JoinLobbyConfig {

    public static final long DEFAULT_TIMEOUT = 10 * 60;
    public static final String DEFAULT_MESSAGE = "§2Server is starting\n§7⌛ Please wait...";
    public static final String DEFAULT_READY_SOUND = "block.note_block.chime";

    private final long timeout;
    private final String message;
    private final String readySound;

    private JoinLobbyConfig(Builder b) {
        this.timeout = b.timeout;
        this.message = b.message;
        this.readySound = b.readySound;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JoinLobbyConfig defaults() {
        return builder().build();
    }

    /**
     * @return maximum seconds a client waits in the lobby
     */
    public long getTimeout() {
        return timeout;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return sound played when the server is ready, or empty for none
     */
    public Optional<String> getReadySound() {
        return Optional.ofNullable(readySound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinLobbyConfig that))
            return false;
        return timeout == that.timeout
                && Objects.equals(message, that.message)
                && Objects.equals(readySound, that.readySound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeout, message, readySound);
    }

    @Override
    public String toString() {
        return "JoinLobbyConfig{" +
                "timeout=" + timeout +
                ", message='" + message + '\'' +
                ", readySound=" + readySound +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private long timeout = DEFAULT_TIMEOUT;
        private String message = DEFAULT_MESSAGE;
        private String readySound = DEFAULT_READY_SOUND;

        @JsonProperty("timeout")
        public Builder timeout(long v) {
            this.timeout = Unsigned.requireU32("join.lobby.timeout", v);
            return this;
        }

        @JsonProperty("message")
        public Builder message(String v) {
            this.message = Objects.requireNonNull(v, "message");
            return this;
        }

        /**
         * @param v sound identifier; {@code null} or empty disables the sound
         * @return this builder
         */
        @JsonProperty("ready_sound")
        public Builder readySound(String v) {
            this.readySound = (v == null || v.isEmpty()) ? null : v;
            return this;
        }

        public JoinLobbyConfig build() {
            return new JoinLobbyConfig(this);
        }
    }
}
