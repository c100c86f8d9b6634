package work.lcod.minsub.actions;

import java.util.List;

/**
 * Bash snippets shared by the generated actions.
 */
public final class BashScript {
    static final String PREAMBLE = String.join(
        "\n",
        "set -o errexit",
        "set -o nounset",
        "set -o pipefail",
        ""
    );

    private BashScript() {}

    /**
     * Wraps {@code body} so it stops on the first failing command, unset variable or pipe segment.
     */
    public static String strict(String body) {
        return PREAMBLE + "\n" + body + "\n";
    }

    public static String strict(List<String> lines) {
        return strict(String.join("\n", lines));
    }

    /**
     * Double-quotes a value, escaping the characters bash still expands inside double quotes.
     */
    public static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\' || c == '$' || c == '`') {
                quoted.append('\\');
            }
            quoted.append(c);
        }
        return quoted.append('"').toString();
    }

    /**
     * {@code commands} for an action whose entrypoint is {@code /bin/bash}.
     */
    public static List<String> bashCommands(String script) {
        return List.of("-c", script);
    }
}
