package com.gt.wordreminder.bot.callback;

import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.preferences.PreferenceSetting;
import com.gt.wordreminder.scheduling.Quality;

import java.util.regex.Pattern;

public class CallbackData {

    static final String SETTINGS_PREFIX = "s:";
    static final String QUIZ_REVEAL_PREFIX = "q:";
    static final String REVIEW_ANSWER_PREFIX = "r:";

    // Telegram rejects callback data longer than 64 bytes
    static final int MAX_LENGTH = 64;

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,60}");
    private static final Pattern DELTA_PATTERN = Pattern.compile("[+-]\\d{1,2}");
    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d{1,18}");
    private static final Pattern QUALITY_PATTERN = Pattern.compile("\\d");

    public static String format(CallbackPayload payload) {
        if (payload instanceof CallbackPayload.SettingsAction settingsAction) {
            String sign = settingsAction.delta() >= 0 ? "+" : "";
            return SETTINGS_PREFIX + settingsAction.setting().getCode() + ":" + sign + settingsAction.delta();
        } else if (payload instanceof CallbackPayload.QuizReveal quizReveal) {
            return QUIZ_REVEAL_PREFIX + quizReveal.token();
        } else if (payload instanceof CallbackPayload.ReviewAnswer reviewAnswer) {
            return REVIEW_ANSWER_PREFIX + reviewAnswer.sessionVersion() + ":" + reviewAnswer.quality();
        }

        throw new IllegalArgumentException("Unsupported callback payload " + payload);
    }

    public static CallbackPayload parse(String data) {
        if (data == null || data.isEmpty() || data.length() > MAX_LENGTH) {
            throw new ValidationException("Invalid callback data");
        }

        if (data.startsWith(SETTINGS_PREFIX)) {
            return parseSettingsAction(data.substring(SETTINGS_PREFIX.length()), data);
        } else if (data.startsWith(QUIZ_REVEAL_PREFIX)) {
            String token = data.substring(QUIZ_REVEAL_PREFIX.length());
            if (!TOKEN_PATTERN.matcher(token).matches()) {
                throw new ValidationException("Invalid quiz token in callback data " + data);
            }
            return new CallbackPayload.QuizReveal(token);
        } else if (data.startsWith(REVIEW_ANSWER_PREFIX)) {
            return parseReviewAnswer(data.substring(REVIEW_ANSWER_PREFIX.length()), data);
        }

        throw new ValidationException("Unknown callback data " + data);
    }

    private static CallbackPayload.ReviewAnswer parseReviewAnswer(String body, String data) {
        String[] parts = body.split(":", -1);
        if (parts.length != 2 || !VERSION_PATTERN.matcher(parts[0]).matches() || !QUALITY_PATTERN.matcher(parts[1]).matches()
                || !Quality.isValid(Integer.parseInt(parts[1]))) {
            throw new ValidationException("Invalid review answer in callback data " + data);
        }

        return new CallbackPayload.ReviewAnswer(Long.parseLong(parts[0]), Integer.parseInt(parts[1]));
    }

    private static CallbackPayload.SettingsAction parseSettingsAction(String body, String data) {
        String[] parts = body.split(":", -1);
        if (parts.length != 2 || !DELTA_PATTERN.matcher(parts[1]).matches()) {
            throw new ValidationException("Invalid settings callback data " + data);
        }

        PreferenceSetting setting = PreferenceSetting.fromCode(parts[0]);
        if (setting == null) {
            throw new ValidationException("Unknown setting in callback data " + data);
        }

        return new CallbackPayload.SettingsAction(setting, Integer.parseInt(parts[1]));
    }
}
