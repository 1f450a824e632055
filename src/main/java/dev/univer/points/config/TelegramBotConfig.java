package dev.univer.points.config;

import dev.univer.points.bot.TelegramWrapper;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/**
 * Long-polling session for the ledger bot. Absent unless {@code bot.enabled=true}, so the ledger and
 * sync run headless otherwise.
 */
@Configuration
@ConditionalOnProperty(prefix = "bot", name = "enabled", havingValue = "true")
public class TelegramBotConfig {

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean
    public InitializingBean registerLedgerBot(TelegramBotsApi api, TelegramWrapper ledgerBot) {
        return () -> {
            try {
                api.registerBot(ledgerBot);
                ledgerBot.installCommands();
            } catch (TelegramApiException e) {
                throw new IllegalStateException("Failed to register Telegram bot " + ledgerBot.getBotUsername(), e);
            }
        };
    }
}
