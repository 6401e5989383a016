package com.pushcast.dispatcher.registry;

import java.util.regex.Pattern;

/** Topic naming rules shared by the registry and payload validation. */
public final class Topics {

    private static final Pattern VALID_NAME = Pattern.compile("[a-zA-Z0-9\\-_.~%]{1,900}");

    private Topics() {}

    public static boolean isValidName(String topic) {
        return topic != null && VALID_NAME.matcher(topic).matches();
    }

    /** Topic that receives the reminders of one tournament. */
    public static String tournament(String tournamentId) {
        return "tournament_" + tournamentId;
    }
}
