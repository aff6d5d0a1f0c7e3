package com.solparser.version;

/**
 * A concrete compiler version such as {@code 0.7.6} or {@code 0.8.0-nightly}.
 */
public record SemVerVersion(int major, int minor, int patch, String prerelease) {

    public SemVerVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version numbers must not be negative");
        }
        prerelease = prerelease == null ? "" : prerelease;
    }

    public static SemVerVersion parse(String text) {
        String core = text;
        String prerelease = "";
        int dash = text.indexOf('-');
        if (dash >= 0) {
            core = text.substring(0, dash);
            prerelease = text.substring(dash + 1);
        }
        int plus = core.indexOf('+');
        if (plus >= 0) {
            core = core.substring(0, plus);
        }
        String[] parts = core.split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid version string: " + text);
        }
        try {
            return new SemVerVersion(
                Integer.parseInt(parts[0]),
                Integer.parseInt(parts[1]),
                Integer.parseInt(parts[2]),
                prerelease);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version string: " + text, e);
        }
    }

    public int number(int level) {
        return switch (level) {
            case 0 -> major;
            case 1 -> minor;
            case 2 -> patch;
            default -> throw new IndexOutOfBoundsException(level);
        };
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    @Override
    public String toString() {
        String core = major + "." + minor + "." + patch;
        return prerelease.isEmpty() ? core : core + "-" + prerelease;
    }
}
