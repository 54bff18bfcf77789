package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * Idle timing, in seconds.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = TimeConfig.Builder.class)
public final class TimeConfig {

    public static final long DEFAULT_SLEEP_AFTER = 60;
    public static final long DEFAULT_MIN_ONLINE_TIME = 60;

    private final long sleepAfter;
    private final long minOnlineTime;

    private TimeConfig(Builder b) {
        this.sleepAfter = b.sleepAfter;
        this.minOnlineTime = b.minOnlineTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TimeConfig defaults() {
        return builder().build();
    }

    /**
     * @return seconds without players after which the server is put to sleep
     */
    public long getSleepAfter() {
        return sleepAfter;
    }

    /**
     * @return minimum seconds the server stays online once woken
     */
    public long getMinOnlineTime() {
        return minOnlineTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeConfig that))
            return false;
        return sleepAfter == that.sleepAfter && minOnlineTime == that.minOnlineTime;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sleepAfter, minOnlineTime);
    }

    @Override
    public String toString() {
        return "TimeConfig{sleepAfter=" + sleepAfter + ", minOnlineTime=" + minOnlineTime + '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private long sleepAfter = DEFAULT_SLEEP_AFTER;
        private long minOnlineTime = DEFAULT_MIN_ONLINE_TIME;

        @JsonProperty("sleep_after")
        public Builder sleepAfter(long v) {
            this.sleepAfter = Unsigned.requireU32("time.sleep_after", v);
            return this;
        }

        @JsonProperty("min_online_time")
        @JsonAlias("minimum_online_time")
        public Builder minOnlineTime(long v) {
            this.minOnlineTime = Unsigned.requireU32("time.min_online_time", v);
            return this;
        }

        public TimeConfig build() {
            return new TimeConfig(this);
        }
    }
}
