package com.okazje.scanner.scan.notify;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.HttpFetchResult;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Posts the alert through the Telegram Bot API {@code sendMessage} method.
 */
@Component
@ConditionalOnProperty(prefix = "scanner.notify.telegram", name = "enabled", havingValue = "true")
public class TelegramScanNotifier implements ScanNotifier {
    private static final Logger log = LoggerFactory.getLogger(TelegramScanNotifier.class);
    private static final int MAX_MESSAGE_CHARS = 3800;

    private final PoliteHttpClient httpClient;
    private final ScannerProperties.Telegram telegram;

    public TelegramScanNotifier(PoliteHttpClient httpClient, ScannerProperties properties) {
        this.httpClient = httpClient;
        this.telegram = properties.getNotify().getTelegram();
    }

    @Override
    public void notifyNewListings(String destination, List<Listing> topListings, int acceptedCount) {
        if (telegram.getBotToken().isBlank()) {
            throw new NotificationException("Telegram bot token is not configured");
        }
        if (destination == null || destination.isBlank()) {
            throw new NotificationException("Telegram chat id is missing");
        }
        List<String> chunks = AlertFormatter.splitInChunks(
            AlertFormatter.format(topListings, acceptedCount), MAX_MESSAGE_CHARS);
        String endpoint = telegram.getApiBaseUrl() + "/bot" + telegram.getBotToken() + "/sendMessage";
        int sent = 0;
        for (String chunk : chunks) {
            String form = "chat_id=" + UrlUtils.encodeQuery(destination)
                + "&text=" + UrlUtils.encodeQuery(chunk)
                + "&parse_mode=Markdown"
                + "&disable_web_page_preview=true";
            HttpFetchResult result = httpClient.postForm(endpoint, form, PoliteHttpClient.ACCEPT_JSON);
            if (!result.isSuccessful()) {
                throw new NotificationException("Telegram sendMessage failed: " + result.describeFailure());
            }
            sent++;
        }
        log.info("Telegram alert sent to {}: {} listings, {} chunk(s)", destination, topListings.size(), sent);
    }
}
