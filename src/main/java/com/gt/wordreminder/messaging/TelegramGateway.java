package com.gt.wordreminder.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.gt.wordreminder.exception.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class TelegramGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramGateway.class);

    private final RestTemplate restTemplate;
    private final String methodUrlPrefix;
    private final String fileUrlPrefix;

    @Autowired
    public TelegramGateway(RestTemplate restTemplate,
                           @Value("${wordreminder.telegram.apiUrl:https://api.telegram.org}") String apiUrl,
                           @Value("${wordreminder.telegram.token}") String token) {
        this.restTemplate = restTemplate;

        this.methodUrlPrefix = apiUrl + "/bot" + token + "/";
        this.fileUrlPrefix = apiUrl + "/file/bot" + token + "/";
    }

    @Override
    public void sendMessage(long chatId, String text) {
        sendMessage(chatId, text, List.of());
    }

    @Override
    public void sendMessage(long chatId, String text, List<List<InlineButton>> keyboard) {
        Map<String, Object> request = new HashMap<>();
        request.put("chat_id", chatId);
        request.put("text", text);

        if (keyboard != null && !keyboard.isEmpty()) {
            List<List<Map<String, String>>> rows = new ArrayList<>();
            for (List<InlineButton> row : keyboard) {
                rows.add(row.stream()
                        .map(button -> Map.of("text", button.text(), "callback_data", button.callbackData()))
                        .toList());
            }
            request.put("reply_markup", Map.of("inline_keyboard", rows));
        }

        callMethod("sendMessage", request, chatId);
    }

    @Override
    public void answerCallbackQuery(String callbackQueryId, String text) {
        Map<String, Object> request = new HashMap<>();
        request.put("callback_query_id", callbackQueryId);
        if (text != null) {
            request.put("text", text);
        }

        try {
            restTemplate.postForObject(methodUrlPrefix + "answerCallbackQuery", request, JsonNode.class);
        } catch (RestClientException ex) {
            throw new DeliveryException("Failed to answer callback query " + callbackQueryId, ex);
        }
    }

    @Override
    public void sendDocument(long chatId, String fileName, byte[] content, String caption) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        if (caption != null) {
            body.add("caption", caption);
        }
        body.add("document", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return fileName;
            }
        });

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        callMethod("sendDocument", new HttpEntity<>(body, headers), chatId);
    }

    @Override
    public byte[] downloadFile(String fileId) {
        try {
            JsonNode response = restTemplate.postForObject(methodUrlPrefix + "getFile", Map.of("file_id", fileId), JsonNode.class);
            if (response == null || !response.path("ok").asBoolean(false) || response.path("result").path("file_path").isMissingNode()) {
                throw new DeliveryException("Telegram did not return a path for file " + fileId);
            }

            byte[] content = restTemplate.getForObject(fileUrlPrefix + response.path("result").path("file_path").asText(), byte[].class);
            return content == null ? new byte[0] : content;
        } catch (RestClientException ex) {
            throw new DeliveryException("Failed to download file " + fileId, ex);
        }
    }

    private void callMethod(String method, Object request, long chatId) {
        JsonNode response;
        try {
            response = restTemplate.postForObject(methodUrlPrefix + method, request, JsonNode.class);
        } catch (RestClientException ex) {
            throw new DeliveryException("Telegram " + method + " to chat " + chatId + " failed", ex);
        }

        if (response != null && !response.path("ok").asBoolean(true)) {
            log.warn("Telegram rejected {} to chat {}: {}", method, chatId, response.path("description").asText());
            throw new DeliveryException("Telegram rejected " + method + " to chat " + chatId + ": " + response.path("description").asText());
        }
    }
}
