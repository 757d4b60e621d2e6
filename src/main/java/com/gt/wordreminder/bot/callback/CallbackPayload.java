package com.gt.wordreminder.bot.callback;

import com.gt.wordreminder.preferences.PreferenceSetting;

/**
 * Parsed form of inline button data. Button data is only ever produced by {@link CallbackData#format}
 * and read back by {@link CallbackData#parse}.
 */
public sealed interface CallbackPayload
        permits CallbackPayload.SettingsAction, CallbackPayload.QuizReveal, CallbackPayload.ReviewAnswer {

    record SettingsAction(PreferenceSetting setting, int delta) implements CallbackPayload { }

    record QuizReveal(String token) implements CallbackPayload { }

    record ReviewAnswer(long sessionVersion, int quality) implements CallbackPayload { }
}
