package org.counterseries.datapipeline.utils;

/**
 * Expands {@code ${VAR}} references and a leading {@code ~} in user-supplied paths.
 * <p>
 * Variables resolve against Java system properties first, then environment variables, so
 * {@code -Dname=value} overrides an environment variable of the same name.
 * <pre>
 * expandPath("${user.home}/data")    → "/home/user/data"
 * expandPath("~/snapshots")          → "/home/user/snapshots"
 * expandPath("${DATA_ROOT}/${RUN}")  → "/var/data/run-7"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path path possibly containing variables, may be {@code null}
     * @return the expanded path, or {@code null} for a {@code null} input
     * @throws IllegalArgumentException if a variable is undefined or a {@code ${} is never closed
     */
    public static String expandPath(String path) {
        if (path == null) {
            return null;
        }
        final String withHome = expandHome(path);
        if (!withHome.contains("${")) {
            return withHome;
        }

        final StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < withHome.length()) {
            final int startVar = withHome.indexOf("${", pos);
            if (startVar == -1) {
                result.append(withHome, pos, withHome.length());
                break;
            }
            result.append(withHome, pos, startVar);

            final int endVar = withHome.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }

            final String varName = withHome.substring(startVar + 2, endVar);
            final String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException(
                        "Undefined variable '${" + varName + "}' in path: " + path
                                + ". Check that the environment variable or system property exists.");
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    private static String resolveVariable(String varName) {
        final String value = System.getProperty(varName);
        return value != null ? value : System.getenv(varName);
    }
}
