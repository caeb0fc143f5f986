package com.yerin.pipeline.domain;

import java.util.Optional;

/**
 * Strict {@code major.minor.patch} version. Anything else (blank, "unknown", pre-release
 * suffixes) does not parse.
 */
public record PipelineVersion(int major, int minor, int patch) {

    public static Optional<PipelineVersion> parse(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("unknown")) return Optional.empty();

        String[] parts = v.split("\\.", -1);
        if (parts.length != 3) return Optional.empty();
        int[] nums = new int[3];
        for (int i = 0; i < 3; i++) {
            if (parts[i].isEmpty() || !parts[i].chars().allMatch(Character::isDigit)) return Optional.empty();
            try {
                nums[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new PipelineVersion(nums[0], nums[1], nums[2]));
    }

    /** Drift means major or minor differ; unparseable versions never drift. */
    public static boolean hasDrift(String old, String current) {
        Optional<PipelineVersion> o = parse(old);
        Optional<PipelineVersion> c = parse(current);
        if (o.isEmpty() || c.isEmpty()) return false;
        return o.get().major != c.get().major || o.get().minor != c.get().minor;
    }
}
