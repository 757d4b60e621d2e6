package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackData;
import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.messaging.InlineButton;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.UserPreferences;
import com.gt.wordreminder.preferences.PreferenceSetting;
import com.gt.wordreminder.preferences.UserPreferencesService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SettingsCommandHandler {

    private static final List<List<InlineButton>> SETTINGS_KEYBOARD = List.of(
            List.of(settingsButton("- reminder", PreferenceSetting.RemindersPerDay, -1),
                    settingsButton("+ reminder", PreferenceSetting.RemindersPerDay, 1)),
            List.of(settingsButton("- card", PreferenceSetting.CardsPerSession, -1),
                    settingsButton("+ card", PreferenceSetting.CardsPerSession, 1)));

    private final UserPreferencesService userPreferencesService;
    private final MessagingGateway messagingGateway;

    @Autowired
    public SettingsCommandHandler(UserPreferencesService userPreferencesService, MessagingGateway messagingGateway) {
        this.userPreferencesService = userPreferencesService;
        this.messagingGateway = messagingGateway;
    }

    public void handleSettings(ChatContext context) {
        sendSettings(context.chatId(), userPreferencesService.getPreferences(context.owner()));
    }

    public void handleSettingsAction(ChatContext context, CallbackPayload.SettingsAction settingsAction) {
        UserPreferences updated;
        try {
            updated = userPreferencesService.adjustSetting(context.owner(), settingsAction.setting(), settingsAction.delta(), context.now());
        } catch (ValidationException ex) {
            PreferenceSetting setting = settingsAction.setting();
            messagingGateway.sendMessage(context.chatId(),
                    describe(setting) + " must stay between " + setting.getMinValue() + " and " + setting.getMaxValue() + ".");
            return;
        }

        sendSettings(context.chatId(), updated);
    }

    private void sendSettings(long chatId, UserPreferences userPreferences) {
        String text = "Your settings:\n" +
                describe(PreferenceSetting.RemindersPerDay) + ": " + userPreferences.remindersPerDay() + "\n" +
                describe(PreferenceSetting.CardsPerSession) + ": " + userPreferences.cardsPerSession();

        messagingGateway.sendMessage(chatId, text, SETTINGS_KEYBOARD);
    }

    private static String describe(PreferenceSetting setting) {
        return setting == PreferenceSetting.RemindersPerDay ? "Reminders per day" : "Cards per session";
    }

    private static InlineButton settingsButton(String text, PreferenceSetting setting, int delta) {
        return new InlineButton(text, CallbackData.format(new CallbackPayload.SettingsAction(setting, delta)));
    }
}
