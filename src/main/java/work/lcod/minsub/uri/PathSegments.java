package work.lcod.minsub.uri;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * POSIX-style path string helpers. Works on strings rather than {@link java.nio.file.Path}
 * so results do not depend on the host filesystem.
 */
final class PathSegments {
    private PathSegments() {}

    /**
     * Ensures directories end with exactly one '/'.
     */
    static String directoryFormat(String directory) {
        int end = directory.length();
        while (end > 0 && directory.charAt(end - 1) == '/') {
            end--;
        }
        return directory.substring(0, end) + "/";
    }

    /**
     * Splits at the last '/': the directory keeps its trailing slash, the basename may be empty.
     */
    static String[] split(String path) {
        int idx = path.lastIndexOf('/');
        return new String[] { path.substring(0, idx + 1), path.substring(idx + 1) };
    }

    /**
     * Collapses redundant separators and {@code .}/{@code ..} segments. Leading {@code ..}
     * segments survive on relative paths and are dropped on absolute ones.
     */
    static String normalize(String path) {
        if (path.isEmpty()) {
            return ".";
        }
        boolean absolute = path.startsWith("/");
        Deque<String> stack = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!stack.isEmpty() && !"..".equals(stack.peekLast())) {
                    stack.removeLast();
                } else if (!absolute) {
                    stack.addLast(segment);
                }
                continue;
            }
            stack.addLast(segment);
        }
        String joined = String.join("/", stack);
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    static String join(String parent, String child) {
        if (child.startsWith("/") || parent.isEmpty()) {
            return child;
        }
        return parent.endsWith("/") ? parent + child : parent + "/" + child;
    }

    static boolean hasSegment(String path, String segment) {
        for (String part : path.split("/")) {
            if (segment.equals(part)) {
                return true;
            }
        }
        return false;
    }
}
