package dev.univer.points.bot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends plain-text replies. Long reports (comparisons, orphan lists) are split on line breaks
 * to stay under Telegram's message size limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "bot", name = "enabled", havingValue = "true")
public class TelegramSender {
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final TelegramWrapper wrapper;

    public void send(Long chatId, String text) throws TelegramApiException {
        List<String> parts = split(text, MAX_MESSAGE_LENGTH);
        for (String part : parts) {
            wrapper.execute(SendMessage.builder()
                                       .chatId(chatId.toString())
                                       .text(part)
                                       .build());
        }
        if (parts.size() > 1) log.debug("Reply to {} sent in {} parts", chatId, parts.size());
    }

    static List<String> split(String text, int limit) {
        List<String> parts = new ArrayList<>();
        String rest = text == null || text.isEmpty() ? " " : text;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit);
            if (cut <= 0) cut = limit;
            parts.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) parts.add(rest);
        return parts;
    }
}
