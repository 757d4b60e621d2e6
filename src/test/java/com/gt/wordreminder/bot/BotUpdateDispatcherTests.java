package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.bot.model.TelegramUpdate;
import com.gt.wordreminder.exception.DeliveryException;
import com.gt.wordreminder.exception.NoCardsException;
import com.gt.wordreminder.exception.SessionConflictException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.preferences.UserPreferencesService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class BotUpdateDispatcherTests {

    private static final long TEST_OWNER = 9009L;
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private AccountCommandHandler accountCommandHandler;
    @Mock private ReviewCommandHandler reviewCommandHandler;
    @Mock private QuizCommandHandler quizCommandHandler;
    @Mock private VocabularyCommandHandler vocabularyCommandHandler;
    @Mock private SettingsCommandHandler settingsCommandHandler;
    @Mock private UserPreferencesService userPreferencesService;
    @Mock private MessagingGateway messagingGateway;

    private BotUpdateDispatcher botUpdateDispatcher;

    @BeforeEach
    public void setup() {
        botUpdateDispatcher = new BotUpdateDispatcher(accountCommandHandler, reviewCommandHandler, quizCommandHandler,
                vocabularyCommandHandler, settingsCommandHandler, userPreferencesService, messagingGateway, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testDispatch_Commands() {
        ChatContext context = new ChatContext(TEST_OWNER, TEST_OWNER, "tester", NOW);

        botUpdateDispatcher.dispatch(textUpdate("/start"));
        botUpdateDispatcher.dispatch(textUpdate("/review"));
        botUpdateDispatcher.dispatch(textUpdate("/cancel"));
        botUpdateDispatcher.dispatch(textUpdate("/game"));
        botUpdateDispatcher.dispatch(textUpdate("/getpair"));
        botUpdateDispatcher.dispatch(textUpdate("/export"));
        botUpdateDispatcher.dispatch(textUpdate("/clear"));
        botUpdateDispatcher.dispatch(textUpdate("/settings"));

        verify(accountCommandHandler).handleStart(context);
        verify(reviewCommandHandler).handleReview(context);
        verify(reviewCommandHandler).handleCancel(context);
        verify(quizCommandHandler).handleGame(context);
        verify(vocabularyCommandHandler).handleGetPair(context);
        verify(vocabularyCommandHandler).handleExport(context);
        verify(vocabularyCommandHandler).handleClear(context);
        verify(settingsCommandHandler).handleSettings(context);
        verifyNoInteractions(messagingGateway);
    }

    @Test
    public void testDispatch_FeedbackArgument() {
        botUpdateDispatcher.dispatch(textUpdate("/feedback  more languages please "));

        verify(accountCommandHandler).handleFeedback(any(ChatContext.class), eq("more languages please"));
    }

    @Test
    public void testDispatch_CommandsAreExactMatches() {
        botUpdateDispatcher.dispatch(textUpdate("/Review"));
        botUpdateDispatcher.dispatch(textUpdate("/review now"));
        botUpdateDispatcher.dispatch(textUpdate("hello"));

        verifyNoInteractions(reviewCommandHandler);
        verify(messagingGateway, times(3)).sendMessage(TEST_OWNER, BotReplies.UNKNOWN_COMMAND);
    }

    @Test
    public void testDispatch_Document() {
        TelegramUpdate.Document document = new TelegramUpdate.Document("file-1", "words.csv");
        TelegramUpdate.Message message = new TelegramUpdate.Message(1, user(), new TelegramUpdate.Chat(TEST_OWNER), null, document);

        botUpdateDispatcher.dispatch(new TelegramUpdate(1, message, null));

        verify(vocabularyCommandHandler).handleDocument(any(ChatContext.class), eq(document));
    }

    @Test
    public void testDispatch_Callbacks() {
        botUpdateDispatcher.dispatch(callbackUpdate("cb-1", "r:2:4"));
        botUpdateDispatcher.dispatch(callbackUpdate("cb-2", "q:abcDEF123_-"));
        botUpdateDispatcher.dispatch(callbackUpdate("cb-3", "s:cps:+1"));

        verify(reviewCommandHandler).handleAnswer(any(ChatContext.class), eq(new CallbackPayload.ReviewAnswer(2, 4)));
        verify(quizCommandHandler).handleReveal(any(ChatContext.class), eq(new CallbackPayload.QuizReveal("abcDEF123_-")));
        verify(settingsCommandHandler).handleSettingsAction(any(ChatContext.class), any(CallbackPayload.SettingsAction.class));
        verify(messagingGateway).answerCallbackQuery("cb-1", null);
        verify(messagingGateway).answerCallbackQuery("cb-2", null);
        verify(messagingGateway).answerCallbackQuery("cb-3", null);
    }

    @Test
    public void testDispatch_UnknownCallbackAcknowledgedOnly() {
        botUpdateDispatcher.dispatch(callbackUpdate("cb-1", "delete_everything"));

        verify(messagingGateway).answerCallbackQuery("cb-1", null);
        verifyNoInteractions(reviewCommandHandler, quizCommandHandler, settingsCommandHandler);
    }

    @Test
    public void testDispatch_ErrorsBecomeReplies() {
        doThrow(new NoCardsException("none")).when(reviewCommandHandler).handleReview(any());
        doThrow(new SessionConflictException("busy")).when(quizCommandHandler).handleGame(any());
        doThrow(new DataAccessResourceFailureException("db down")).when(vocabularyCommandHandler).handleGetPair(any());

        botUpdateDispatcher.dispatch(textUpdate("/review"));
        botUpdateDispatcher.dispatch(textUpdate("/game"));
        botUpdateDispatcher.dispatch(textUpdate("/getpair"));

        ArgumentCaptor<String> textCaptor = ArgumentCaptor.forClass(String.class);
        verify(messagingGateway, times(3)).sendMessage(eq(TEST_OWNER), textCaptor.capture());
        assertEquals(BotReplies.NO_CARDS, textCaptor.getAllValues().get(0));
        assertEquals(BotReplies.CONFLICT, textCaptor.getAllValues().get(1));
        assertEquals(BotReplies.TRY_AGAIN, textCaptor.getAllValues().get(2));
    }

    @Test
    public void testDispatch_RecordsActivity() {
        botUpdateDispatcher.dispatch(textUpdate("/settings"));
        botUpdateDispatcher.dispatch(callbackUpdate("cb-1", "s:rpd:+1"));

        verify(userPreferencesService, times(2)).recordActivity(TEST_OWNER, NOW);
    }

    @Test
    public void testDispatch_ActivityFailureDoesNotBlockCommand() {
        doThrow(new DataAccessResourceFailureException("db down")).when(userPreferencesService).recordActivity(anyLong(), any());

        botUpdateDispatcher.dispatch(textUpdate("/review"));

        verify(reviewCommandHandler).handleReview(any(ChatContext.class));
    }

    @Test
    public void testDispatch_DeliveryFailureDoesNotPropagate() {
        doThrow(new DeliveryException("blocked")).when(accountCommandHandler).handleStart(any());
        doThrow(new DeliveryException("blocked")).when(messagingGateway).answerCallbackQuery(anyString(), any());

        assertDoesNotThrow(() -> botUpdateDispatcher.dispatch(textUpdate("/start")));
        assertDoesNotThrow(() -> botUpdateDispatcher.dispatch(callbackUpdate("cb-1", "r:2:5")));
    }

    private static TelegramUpdate textUpdate(String text) {
        return new TelegramUpdate(1, new TelegramUpdate.Message(1, user(), new TelegramUpdate.Chat(TEST_OWNER), text, null), null);
    }

    private static TelegramUpdate callbackUpdate(String id, String data) {
        TelegramUpdate.Message message = new TelegramUpdate.Message(2, null, new TelegramUpdate.Chat(TEST_OWNER), "prompt", null);

        return new TelegramUpdate(2, null, new TelegramUpdate.CallbackQuery(id, user(), message, data));
    }

    private static TelegramUpdate.User user() {
        return new TelegramUpdate.User(TEST_OWNER, "tester");
    }
}
