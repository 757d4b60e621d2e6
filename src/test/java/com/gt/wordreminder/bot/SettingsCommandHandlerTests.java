package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.UserPreferences;
import com.gt.wordreminder.preferences.PreferenceSetting;
import com.gt.wordreminder.preferences.UserPreferencesService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class SettingsCommandHandlerTests {

    private static final long TEST_OWNER = 88L;
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final ChatContext CONTEXT = new ChatContext(TEST_OWNER, TEST_OWNER, "tester", NOW);

    @Mock private UserPreferencesService userPreferencesService;
    @Mock private MessagingGateway messagingGateway;

    private SettingsCommandHandler settingsCommandHandler;

    @BeforeEach
    public void setup() {
        settingsCommandHandler = new SettingsCommandHandler(userPreferencesService, messagingGateway);
    }

    @Test
    public void testHandleSettings() {
        when(userPreferencesService.getPreferences(TEST_OWNER)).thenReturn(new UserPreferences(TEST_OWNER, 3, 7, null, null));

        settingsCommandHandler.handleSettings(CONTEXT);

        verify(messagingGateway).sendMessage(eq(TEST_OWNER), eq("Your settings:\nReminders per day: 3\nCards per session: 7"), anyList());
    }

    @Test
    public void testHandleSettingsAction() {
        when(userPreferencesService.adjustSetting(TEST_OWNER, PreferenceSetting.CardsPerSession, 1, NOW))
                .thenReturn(new UserPreferences(TEST_OWNER, 1, 6, null, NOW.plusSeconds(86400)));

        settingsCommandHandler.handleSettingsAction(CONTEXT, new CallbackPayload.SettingsAction(PreferenceSetting.CardsPerSession, 1));

        verify(messagingGateway).sendMessage(eq(TEST_OWNER), contains("Cards per session: 6"), anyList());
    }

    @Test
    public void testHandleSettingsAction_OutOfRange() {
        when(userPreferencesService.adjustSetting(TEST_OWNER, PreferenceSetting.RemindersPerDay, -1, NOW))
                .thenThrow(new ValidationException("out of range"));

        settingsCommandHandler.handleSettingsAction(CONTEXT, new CallbackPayload.SettingsAction(PreferenceSetting.RemindersPerDay, -1));

        verify(messagingGateway).sendMessage(TEST_OWNER, "Reminders per day must stay between 1 and 24.");
    }
}
