package com.lazymc.core.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dotted numeric version such as {@code 0.2.8}, compared part by part as
 * numbers rather than as text ({@code 0.2.11 > 0.2.8}).
 *
 * <p>
 * A leading {@code v} is accepted. An optional {@code -suffix} marks a
 * pre-release, which orders before the same version without a suffix.
 * Missing trailing parts count as zero, so {@code 1.2} equals {@code 1.2.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigVersion implements Comparable<ConfigVersion> {

    private static final Pattern VERSION_PATTERN =
            Pattern.compile("\\Av?(\\d+(?:\\.\\d+)*)(?:-([0-9A-Za-z][0-9A-Za-z.-]*))?\\z");

    private final List<Long> parts;
    private final String preRelease;
    private final String text;

    private ConfigVersion(List<Long> parts, String preRelease, String text) {
        this.parts = parts;
        this.preRelease = preRelease;
        this.text = text;
    }

    /**
     * Parse a version string.
     *
     * @param text version text; may be {@code null}
     * @return the parsed version, or empty if the text is not a version
     */
    public static Optional<ConfigVersion> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Matcher matcher = VERSION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        List<Long> parts = new ArrayList<>();
        for (String part : matcher.group(1).split("\\.")) {
            try {
                parts.add(Long.parseLong(part));
            } catch (NumberFormatException e) {
                // more digits than a long holds
                return Optional.empty();
            }
        }
        return Optional.of(new ConfigVersion(Collections.unmodifiableList(parts), matcher.group(2), trimmed));
    }

    /**
     * Parse a version string that is known to be valid, such as a constant.
     *
     * @param text version text
     * @return the parsed version
     * @throws IllegalArgumentException if {@code text} is not a version
     */
    public static ConfigVersion of(String text) {
        return parse(text).orElseThrow(
                () -> new IllegalArgumentException("Invalid version: '" + text + "'"));
    }

    /**
     * @param other version to compare with
     * @return {@code true} if this version is the same as or newer than
     *         {@code other}
     */
    public boolean isAtLeast(ConfigVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ConfigVersion other) {
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            long left = i < parts.size() ? parts.get(i) : 0L;
            long right = i < other.parts.size() ? other.parts.get(i) : 0L;
            if (left != right) {
                return Long.compare(left, right);
            }
        }
        if (preRelease == null) {
            return other.preRelease == null ? 0 : 1;
        }
        if (other.preRelease == null) {
            return -1;
        }
        return preRelease.compareTo(other.preRelease);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConfigVersion that))
            return false;
        return compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        int end = parts.size();
        while (end > 0 && parts.get(end - 1) == 0L) {
            end--;
        }
        return Objects.hash(parts.subList(0, end), preRelease);
    }

    @Override
    public String toString() {
        return text;
    }
}
