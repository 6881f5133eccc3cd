package com.platform.planner.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric version reported by the remote service, compared component-wise.
 * Suffixes such as {@code -SNAPSHOT} or build tags are ignored.
 */
public final class ProtocolVersion implements Comparable<ProtocolVersion> {
    
    private static final Pattern BASE_VERSION = Pattern.compile("^\\s*v?(\\d+(?:\\.\\d+)*)");
    
    private final List<Integer> parts;
    
    private ProtocolVersion(List<Integer> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }
    
    /**
     * Parses the base version out of a version string.
     *
     * @throws IllegalArgumentException if no numeric version is present
     */
    public static ProtocolVersion parse(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher matcher = BASE_VERSION.matcher(version);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Not a version: " + version);
        }
        List<Integer> parts = new ArrayList<>();
        for (String part : matcher.group(1).split("\\.")) {
            parts.add(Integer.parseInt(part));
        }
        return new ProtocolVersion(parts);
    }
    
    public static ProtocolVersion of(int... parts) {
        List<Integer> list = new ArrayList<>(parts.length);
        for (int part : parts) {
            list.add(part);
        }
        return new ProtocolVersion(list);
    }
    
    public boolean isAtLeast(ProtocolVersion other) {
        return compareTo(other) >= 0;
    }
    
    public boolean isBefore(ProtocolVersion other) {
        return compareTo(other) < 0;
    }
    
    @Override
    public int compareTo(ProtocolVersion other) {
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            int a = i < parts.size() ? parts.get(i) : 0;
            int b = i < other.parts.size() ? other.parts.get(i) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof ProtocolVersion other && compareTo(other) == 0;
    }
    
    @Override
    public int hashCode() {
        List<Integer> trimmed = new ArrayList<>(parts);
        while (trimmed.size() > 1 && trimmed.get(trimmed.size() - 1) == 0) {
            trimmed.remove(trimmed.size() - 1);
        }
        return trimmed.hashCode();
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
