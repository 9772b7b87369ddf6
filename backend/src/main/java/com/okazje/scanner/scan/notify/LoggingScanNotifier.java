package com.okazje.scanner.scan.notify;

import com.okazje.scanner.scan.model.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(prefix = "scanner.notify.telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingScanNotifier implements ScanNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingScanNotifier.class);

    @Override
    public void notifyNewListings(String destination, List<Listing> topListings, int acceptedCount) {
        log.info("Alert for {}:\n{}", destination, AlertFormatter.format(topListings, acceptedCount));
    }
}
