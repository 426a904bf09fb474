package com.portbuilder.orchestrator.pkg;

import com.portbuilder.orchestrator.model.InstallStatus;

/**
 * Compares package names of the form {@code name-version[_revision][,epoch]}.
 *
 * The epoch decides first, then the dotted version from left to right
 * (numerically where both parts are numbers), then the revision. A version
 * with more components is the newer one when all shared components match.
 */
public final class PackageVersions {

    private PackageVersions() {}

    /**
     * @param installed pkgname of the installed package
     * @param candidate pkgname the port would build
     * @return how the installed package relates to the candidate
     */
    public static InstallStatus compare(String installed, String candidate) {
        return InstallStatus.relative(compareVersions(version(installed), version(candidate)));
    }

    /** Compares bare versions ({@code 1.2.3_1,1}), returning the sign like {@code compareTo}. */
    public static int compareVersions(String left, String right) {
        if (left.equals(right)) {
            return 0;
        }

        Split epoch = split(left, right, ',');
        if (epoch.order != 0) {
            return epoch.order;
        }

        Split revision = split(epoch.left, epoch.right, '_');
        int order = compareDotted(revision.left, revision.right);
        return order != 0 ? order : revision.order;
    }

    /** The version part of a pkgname, i.e. everything after the last dash. */
    public static String version(String pkgname) {
        int dash = pkgname.lastIndexOf('-');
        return dash < 0 ? pkgname : pkgname.substring(dash + 1);
    }

    /** The name part of a pkgname, i.e. everything before the last dash. */
    public static String name(String pkgname) {
        int dash = pkgname.lastIndexOf('-');
        return dash < 0 ? pkgname : pkgname.substring(0, dash);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static int compareDotted(String left, String right) {
        String[] l = left.split("\\.");
        String[] r = right.split("\\.");
        for (int i = 0; i < Math.min(l.length, r.length); i++) {
            int order = comparePart(l[i], r[i]);
            if (order != 0) {
                return order;
            }
        }
        return Integer.signum(l.length - r.length);
    }

    private static int comparePart(String left, String right) {
        try {
            return Integer.signum(Long.compare(Long.parseLong(left), Long.parseLong(right)));
        } catch (NumberFormatException e) {
            return Integer.signum(left.compareTo(right));
        }
    }

    /** Splits a trailing {@code <sym>N} suffix off both sides and orders by it. */
    private static Split split(String left, String right, char sym) {
        int l = left.lastIndexOf(sym);
        int r = right.lastIndexOf(sym);
        String leftBase  = l < 0 ? left  : left.substring(0, l);
        String rightBase = r < 0 ? right : right.substring(0, r);
        int order;
        if (l >= 0 && r < 0) {
            order = 1;
        } else if (l < 0 && r >= 0) {
            order = -1;
        } else if (l < 0) {
            order = 0;
        } else {
            order = comparePart(left.substring(l + 1), right.substring(r + 1));
        }
        return new Split(leftBase, rightBase, order);
    }

    private record Split(String left, String right, int order) {}
}
