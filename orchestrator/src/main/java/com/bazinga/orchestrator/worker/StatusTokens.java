package com.bazinga.orchestrator.worker;

import java.util.Arrays;
import java.util.Locale;

/**
 * Maps raw worker status tokens onto the closed enum for a stage.
 *
 * Accepts "changesRequested", "changes_requested" and "CHANGES-REQUESTED"
 * alike. Anything that does not name a constant is a protocol error.
 */
public final class StatusTokens {

    private StatusTokens() {}

    public static <E extends Enum<E>> E parse(Class<E> type, String token, String call) {
        if (token == null || token.isBlank()) {
            throw new WorkerProtocolException(call + ": missing status");
        }
        String name = token.strip()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new WorkerProtocolException(
                    call + ": status '" + token + "' is not one of " + Arrays.toString(type.getEnumConstants()));
        }
    }
}
