package dev.univer.points.bot;

import dev.univer.points.config.TelegramProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/**
 * Long-polling receiver. Updates are republished as application events for {@link LedgerCommandBot}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "bot", name = "enabled", havingValue = "true")
public class TelegramWrapper extends TelegramLongPollingBot {

    private final TelegramProperties props;
    private final ApplicationEventPublisher publisher;

    public TelegramWrapper(TelegramProperties props, ApplicationEventPublisher publisher) {
        super(props.getToken());
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public String getBotUsername() {
        return props.getUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }

    public void installCommands() {
        List<BotCommand> commands = List.of(
                new BotCommand("/help", "Help"),
                new BotCommand("/balance", "My balance"),
                new BotCommand("/transfer", "Send points: /transfer <id> <amount>"),
                new BotCommand("/sync", "Reconcile now: /sync [group]"),
                new BotCommand("/syncstatus", "Background sync status"),
                new BotCommand("/syncon", "Enable background sync"),
                new BotCommand("/syncoff", "Disable background sync"),
                new BotCommand("/interval", "Sync interval in seconds"),
                new BotCommand("/compare", "Compare sheet and ledger: /compare [group]"),
                new BotCommand("/orphans", "Accounts of deleted groups")
        );
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(new BotCommandScopeDefault());
        try {
            execute(set);
            log.info("Bot commands installed: {}", commands.size());
        } catch (TelegramApiException e) {
            log.warn("Failed to set bot commands", e);
        }
    }
}
