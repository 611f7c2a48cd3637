package com.notibag.sender;

import lombok.Getter;

/**
 * Command-line flags of the sender. Accepts {@code -title value},
 * {@code --title value} and {@code title=value}.
 */
@Getter
final class SenderArguments {

    static final String USAGE = "Usage: send -title <title> -message <message> [-host <host>]";

    private final String title;
    private final String message;
    private final String host;

    private SenderArguments(String title, String message, String host) {
        this.title = title;
        this.message = message;
        this.host = host;
    }

    /**
     * @param defaultHost used when no host flag is given
     * @throws IllegalArgumentException on an unknown flag or a flag without a value
     */
    static SenderArguments parse(String[] args, String defaultHost) {
        String t = null, m = null, h = defaultHost;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String key;
            String value;

            int eq = arg.indexOf('=');
            if (eq > 0) {
                key = stripDashes(arg.substring(0, eq));
                value = arg.substring(eq + 1);
            } else if (arg.startsWith("-")) {
                key = stripDashes(arg);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Flag needs a value: " + arg);
                }
                value = args[++i];
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }

            switch (key) {
                case "title" -> t = value;
                case "message" -> m = value;
                case "host" -> h = value;
                default -> throw new IllegalArgumentException("Unknown flag: " + arg);
            }
        }

        return new SenderArguments(t, m, h);
    }

    boolean isComplete() {
        return title != null && !title.isEmpty() && message != null && !message.isEmpty();
    }

    private static String stripDashes(String flag) {
        int start = 0;
        while (start < flag.length() && flag.charAt(start) == '-') {
            start++;
        }
        return flag.substring(start);
    }
}
